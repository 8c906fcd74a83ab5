package tech.andrefsramos.product_watcher.adapters.outbound.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class GenericProductAdapterTest {

    private static final String URL = "https://shop.com/p/1";

    private final GenericProductAdapter adapter = new GenericProductAdapter(new ObjectMapper());

    @Test
    void shouldReadProductFromJsonLdGraph() {
        // given
        var html = """
                <html><head>
                <script type="application/ld+json">
                {"@context":"https://schema.org","@graph":[
                  {"@type":"BreadcrumbList","name":"crumbs"},
                  {"@type":["Product","Thing"],"name":"Trail Runner","image":["https://cdn.shop.com/a.jpg"],
                   "offers":[{"@type":"Offer","price":"1299.99","priceCurrency":"eur",
                              "availability":"https://schema.org/InStock"}]}
                ]}
                </script></head>
                <body>
                  <select name="size"><option>Select size</option><option>M</option><option disabled>L</option><option>XL</option></select>
                </body></html>
                """;

        // when
        var snapshot = adapter.parse(html, URL);

        // then
        assertThat(snapshot.success()).isTrue();
        assertThat(snapshot.title()).isEqualTo("Trail Runner");
        assertThat(snapshot.price()).isEqualByComparingTo(new BigDecimal("1299.99"));
        assertThat(snapshot.currency()).isEqualTo("EUR");
        assertThat(snapshot.inStock()).isTrue();
        assertThat(snapshot.image()).isEqualTo("https://cdn.shop.com/a.jpg");
        assertThat(snapshot.sizes()).containsExactly("M", "XL");
    }

    @Test
    void shouldReadAggregateOfferLowPriceAndOutOfStock() {
        // given
        var html = """
                <script type="application/ld+json">
                {"@type":"Product","name":"Lamp","image":{"url":"https://cdn.shop.com/lamp.jpg"},
                 "offers":{"@type":"AggregateOffer","lowPrice":19.99,
                           "availability":"http://schema.org/OutOfStock"}}
                </script>
                """;

        // when
        var snapshot = adapter.parse(html, URL);

        // then
        assertThat(snapshot.price()).isEqualByComparingTo("19.99");
        assertThat(snapshot.currency()).isEqualTo("USD");
        assertThat(snapshot.inStock()).isFalse();
        assertThat(snapshot.image()).isEqualTo("https://cdn.shop.com/lamp.jpg");
    }

    @Test
    void shouldFallBackToSelectorsWhenJsonLdIsInvalid() {
        // given
        var html = """
                <html><head><title>Shop | Jacket</title>
                <script type="application/ld+json">{ not json </script></head>
                <body>
                  <h1 class="product-title">Winter Jacket</h1>
                  <span class="price">1.299,99 €</span>
                  <div class="sold-out">Sold out</div>
                  <div class="product-image"><img src="/img/jacket.jpg"></div>
                </body></html>
                """;

        // when
        var snapshot = adapter.parse(html, URL);

        // then
        assertThat(snapshot.success()).isTrue();
        assertThat(snapshot.title()).isEqualTo("Winter Jacket");
        assertThat(snapshot.price()).isEqualByComparingTo("1299.99");
        assertThat(snapshot.currency()).isEqualTo("EUR");
        assertThat(snapshot.inStock()).isFalse();
        assertThat(snapshot.image()).isEqualTo("/img/jacket.jpg");
    }

    @Test
    void shouldReadSalePriceWhenListPriceFollowsInSameElement() {
        // given
        var html = """
                <html><body>
                  <h1 class="product-title">Trail Socks</h1>
                  <span class="price"><ins>19.99</ins> <del>24.99</del></span>
                </body></html>
                """;

        // when
        var snapshot = adapter.parse(html, URL);

        // then
        assertThat(snapshot.success()).isTrue();
        assertThat(snapshot.price()).isEqualByComparingTo("19.99");
        assertThat(snapshot.currency()).isEqualTo("USD");
    }

    @Test
    void shouldUseMetaTagsAndLeaveStockUnknown() {
        // given
        var html = """
                <html><head>
                <meta property="og:title" content="Desk Chair">
                <meta property="product:price:amount" content="49.90">
                <meta property="product:price:currency" content="GBP">
                <meta property="og:image" content="https://cdn.shop.com/chair.jpg">
                </head><body><p>Great chair.</p></body></html>
                """;

        // when
        var snapshot = adapter.parse(html, URL);

        // then
        assertThat(snapshot.title()).isEqualTo("Desk Chair");
        assertThat(snapshot.price()).isEqualByComparingTo("49.90");
        assertThat(snapshot.currency()).isEqualTo("GBP");
        assertThat(snapshot.inStock()).isNull();
        assertThat(snapshot.image()).isEqualTo("https://cdn.shop.com/chair.jpg");
    }

    @Test
    void shouldReadAvailabilityText() {
        // given
        var html = """
                <h1>Kettle</h1><div id="availability">Currently unavailable.</div>
                """;

        // when
        var snapshot = adapter.parse(html, URL);

        // then
        assertThat(snapshot.inStock()).isFalse();
    }

    @Test
    void shouldFailWhenPageHasNoProductData() {
        // when
        var snapshot = adapter.parse("<html><body><p>hello</p></body></html>", URL);

        // then
        assertThat(snapshot.success()).isFalse();
        assertThat(snapshot.error()).isEqualTo("no product data found");
    }

    @Test
    void shouldFailOnEmptyContent() {
        // when
        var snapshot = adapter.parse("", URL);

        // then
        assertThat(snapshot.success()).isFalse();
        assertThat(snapshot.url()).isEqualTo(URL);
    }
}
