package tech.andrefsramos.product_watcher.adapters.outbound.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.product_watcher.core.domain.ProductSnapshot;
import tech.andrefsramos.product_watcher.core.ports.ProductAdapter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/*
 * Finalidade

 * Adapter de fallback para qualquer loja sem adapter específico.

 * Como funciona

 * - Primeiro tenta JSON-LD schema.org ({@link JsonLdProductReader}); se achar um Product, usa-o
 *   e completa tamanhos pelo HTML.
 * - Senão, sonda seletores comuns em ordem de preferência (título, preço, estoque, imagem) e
 *   cai para meta tags (og:title, product:price:amount, og:image).
 * - Estoque só é afirmado quando há indicador explícito; caso contrário fica desconhecido (null).
 * - Página sem título, preço e estoque é considerada falha de parse ("no product data found").
 * - Nunca lança exceção: erros viram snapshot com success=false.
 */
public class GenericProductAdapter implements ProductAdapter {

    private static final Logger log = LoggerFactory.getLogger(GenericProductAdapter.class);

    private static final int TITLE_MAX_LEN = 500;
    private static final int SIZE_MAX_LEN = 20;

    private static final List<String> TITLE_SELECTORS = List.of(
            "[data-testid=product-title]",
            "[data-product-title]",
            ".product-title",
            ".product-name",
            ".product__title",
            "h1.title",
            "h1[itemprop=name]",
            "#productTitle",
            "h1"
    );

    private static final List<String> PRICE_SELECTORS = List.of(
            "[data-testid=price]",
            "[data-price]",
            ".product-price",
            ".price-current",
            ".price",
            "[itemprop=price]",
            "#priceblock_ourprice",
            "#priceblock_dealprice",
            ".a-price-whole"
    );

    private static final List<String> OUT_OF_STOCK_SELECTORS = List.of(
            ".out-of-stock", ".sold-out", ".unavailable", "[data-out-of-stock]", "#outOfStock"
    );

    private static final List<String> IN_STOCK_SELECTORS = List.of(
            ".in-stock", ".available", "[data-in-stock]"
    );

    private static final List<String> IMAGE_SELECTORS = List.of(
            "[data-testid=product-image] img",
            ".product-image img",
            ".product__image img",
            "#landingImage",
            "[itemprop=image]"
    );

    private static final List<String> SIZE_SELECTORS = List.of(
            "[data-size]:not(.disabled):not([disabled])",
            "select[name*=size] option:not([disabled])",
            ".size-selector button:not([disabled])",
            ".sizes li:not(.unavailable)"
    );

    private final JsonLdProductReader jsonLd;

    public GenericProductAdapter(ObjectMapper objectMapper) {
        this.jsonLd = new JsonLdProductReader(objectMapper);
    }

    @Override
    public List<String> domains() {
        return List.of("*");
    }

    @Override
    public ProductSnapshot parse(String content, String url) {
        if (content == null || content.isBlank()) {
            return ProductSnapshot.failure(url, "empty content");
        }

        try {
            Document doc = Jsoup.parse(content, url == null ? "" : url);

            Optional<ProductSnapshot> structured = jsonLd.read(doc, url);
            if (structured.isPresent()) {
                ProductSnapshot s = structured.get();
                if (log.isDebugEnabled()) {
                    log.debug("[Generic] JSON-LD encontrado url={} title='{}' price={}", url, s.title(), s.price());
                }
                return new ProductSnapshot(s.url(), s.title(), s.price(), s.currency(), s.inStock(),
                        extractSizes(doc), s.image(), true, null);
            }

            String title = extractTitle(doc);
            BigDecimal price = null;
            String currency = null;
            PriceHit hit = extractPrice(doc);
            if (hit != null) {
                price = hit.amount();
                currency = hit.currency();
            }
            Boolean inStock = extractStock(doc);

            if (title == null && price == null && inStock == null) {
                log.debug("[Generic] nenhum dado de produto url={}", url);
                return ProductSnapshot.failure(url, "no product data found");
            }

            return new ProductSnapshot(url, title, price, currency, inStock, extractSizes(doc), extractImage(doc), true, null);

        } catch (Exception e) {
            log.warn("[Generic] falha de parse url={}: {}", url, e.toString());
            return ProductSnapshot.failure(url, "Parse failed: " + e.getClass().getSimpleName());
        }
    }

    private String extractTitle(Document doc) {
        for (String sel : TITLE_SELECTORS) {
            String t = text(doc, sel);
            if (t != null && t.length() < TITLE_MAX_LEN) return t;
        }
        String og = attr(doc, "meta[property=og:title]", "content");
        if (og != null) return og;
        String tw = attr(doc, "meta[name=twitter:title]", "content");
        if (tw != null) return tw;
        return blankToNull(doc.title());
    }

    private PriceHit extractPrice(Document doc) {
        for (String sel : PRICE_SELECTORS) {
            String t = text(doc, sel);
            if (t == null) continue;
            Optional<BigDecimal> amount = PriceTextParser.parseAmount(t);
            if (amount.isPresent()) {
                return new PriceHit(amount.get(), PriceTextParser.currencyOrDefault(t));
            }
        }

        String dataPrice = attr(doc, "[data-price]", "data-price");
        if (dataPrice != null) {
            Optional<BigDecimal> amount = PriceTextParser.parseAmount(dataPrice);
            if (amount.isPresent()) {
                return new PriceHit(amount.get(), PriceTextParser.DEFAULT_CURRENCY);
            }
        }

        String meta = attr(doc, "meta[property=product:price:amount]", "content");
        if (meta != null) {
            Optional<BigDecimal> amount = PriceTextParser.parseAmount(meta);
            if (amount.isPresent()) {
                String cur = PriceTextParser.normalizeCurrencyCode(
                        attr(doc, "meta[property=product:price:currency]", "content"));
                return new PriceHit(amount.get(), cur != null ? cur : PriceTextParser.DEFAULT_CURRENCY);
            }
        }
        return null;
    }

    private Boolean extractStock(Document doc) {
        for (String sel : OUT_OF_STOCK_SELECTORS) {
            if (!doc.select(sel).isEmpty()) return false;
        }
        for (String sel : IN_STOCK_SELECTORS) {
            if (!doc.select(sel).isEmpty()) return true;
        }

        String availability = text(doc, "#availability");
        if (availability != null) {
            String a = availability.toLowerCase(Locale.ROOT);
            // "out of stock"/"unavailable" contêm "available"/"in stock": negativo primeiro
            if (a.contains("out of stock") || a.contains("unavailable")) return false;
            if (a.contains("in stock") || a.contains("available")) return true;
        }

        String meta = attr(doc, "meta[property=product:availability]", "content");
        if (meta == null) meta = attr(doc, "link[itemprop=availability]", "href");
        return JsonLdProductReader.availability(meta);
    }

    private String extractImage(Document doc) {
        for (String sel : IMAGE_SELECTORS) {
            String src = attr(doc, sel, "src");
            if (src != null) return src;
        }
        return attr(doc, "meta[property=og:image]", "content");
    }

    private List<String> extractSizes(Document doc) {
        List<String> sizes = new ArrayList<>();
        for (String sel : SIZE_SELECTORS) {
            for (Element el : doc.select(sel)) {
                String v = blankToNull(el.hasAttr("data-size") ? el.attr("data-size") : el.text());
                if (v != null && v.length() <= SIZE_MAX_LEN && !v.toLowerCase(Locale.ROOT).startsWith("select")) {
                    sizes.add(v);
                }
            }
            if (!sizes.isEmpty()) break;
        }
        return sizes;
    }

    private static String text(Document doc, String selector) {
        Element el = doc.selectFirst(selector);
        return el == null ? null : blankToNull(el.text());
    }

    private static String attr(Document doc, String selector, String attr) {
        Element el = doc.selectFirst(selector);
        return el == null ? null : blankToNull(el.attr(attr));
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private record PriceHit(BigDecimal amount, String currency) {}
}
