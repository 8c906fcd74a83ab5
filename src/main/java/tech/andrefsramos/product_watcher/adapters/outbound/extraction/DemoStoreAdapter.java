package tech.andrefsramos.product_watcher.adapters.outbound.extraction;

import tech.andrefsramos.product_watcher.core.domain.ProductSnapshot;
import tech.andrefsramos.product_watcher.core.ports.ProductAdapter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
 * Finalidade

 * Loja de demonstração (example.com) para exercitar o pipeline de ponta a ponta sem depender
 * de HTML real. O conteúdo da página é ignorado: os dados são derivados de forma determinística
 * do id do produto na URL (".../product/{id}").

 * - Preço: preço base do produto com variação de -10% a +10%.
 * - Estoque: em estoque para 8 de cada 10 hashes.
 * - Tamanhos: subconjunto estável de XS..XXL.
 */
public class DemoStoreAdapter implements ProductAdapter {

    private static final Pattern PRODUCT_ID = Pattern.compile("product/([^/?#]+)");
    private static final List<String> ALL_SIZES = List.of("XS", "S", "M", "L", "XL", "XXL");

    private static final Map<String, DemoProduct> CATALOG = Map.of(
            "demo-sneakers", new DemoProduct("Demo Sneakers Pro Max", new BigDecimal("99.99")),
            "demo-jacket", new DemoProduct("Demo Winter Jacket", new BigDecimal("149.99")),
            "demo-watch", new DemoProduct("Demo Smart Watch", new BigDecimal("299.99"))
    );
    private static final BigDecimal DEFAULT_BASE_PRICE = new BigDecimal("79.99");

    @Override
    public List<String> domains() {
        return List.of("example.com", "*.example.com");
    }

    @Override
    public ProductSnapshot parse(String content, String url) {
        String productId = "unknown";
        if (url != null) {
            Matcher m = PRODUCT_ID.matcher(url);
            if (m.find()) productId = m.group(1);
        }

        long hash = Math.abs((long) productId.hashCode());
        DemoProduct product = CATALOG.getOrDefault(productId,
                new DemoProduct("Product " + productId, DEFAULT_BASE_PRICE));

        BigDecimal variation = BigDecimal.valueOf((hash % 21) - 10, 2);
        BigDecimal price = product.basePrice()
                .multiply(BigDecimal.ONE.add(variation))
                .setScale(2, RoundingMode.HALF_UP);

        boolean inStock = hash % 10 < 8;

        List<String> sizes = new ArrayList<>();
        for (int i = 0; i < ALL_SIZES.size(); i++) {
            if ((hash + i) % 3 != 0) sizes.add(ALL_SIZES.get(i));
        }

        return new ProductSnapshot(url, product.title(), price, "USD", inStock, sizes,
                "https://example.com/images/" + productId + ".jpg", true, null);
    }

    private record DemoProduct(String title, BigDecimal basePrice) {}
}
