package tech.andrefsramos.product_watcher.adapters.outbound.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.product_watcher.core.domain.ProductSnapshot;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/*
 * Finalidade

 * Lê dados estruturados schema.org (JSON-LD) de uma página e extrai o primeiro objeto
 * "Product": nome, imagem, e da oferta (offers) preço, moeda e disponibilidade.

 * - Aceita objeto único, lista na raiz ou lista em "@graph".
 * - "@type" pode ser string ou lista.
 * - offers pode ser objeto, lista (usa a primeira) ou AggregateOffer (usa price ou lowPrice).
 * - Disponibilidade: InStock/LimitedAvailability/OnlineOnly -> true; OutOfStock/SoldOut/
 *   Discontinued -> false; ausente ou outro valor -> desconhecido (null).
 * - Blocos JSON inválidos são ignorados e a busca segue para o próximo script.
 */
class JsonLdProductReader {

    private static final Logger log = LoggerFactory.getLogger(JsonLdProductReader.class);

    private final ObjectMapper objectMapper;

    JsonLdProductReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    Optional<ProductSnapshot> read(Document doc, String url) {
        for (Element script : doc.select("script[type=application/ld+json]")) {
            JsonNode root;
            try {
                root = objectMapper.readTree(script.data());
            } catch (JsonProcessingException e) {
                log.debug("[JsonLd] bloco JSON-LD inválido ignorado url={}: {}", url, e.getOriginalMessage());
                continue;
            }
            if (root == null) continue;

            for (JsonNode item : candidates(root)) {
                if (isProduct(item)) {
                    return Optional.of(toSnapshot(item, url));
                }
            }
        }
        return Optional.empty();
    }

    private List<JsonNode> candidates(JsonNode root) {
        List<JsonNode> out = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(n -> out.addAll(candidates(n)));
        } else if (root.isObject()) {
            JsonNode graph = root.get("@graph");
            if (graph != null && graph.isArray()) {
                graph.forEach(out::add);
            } else {
                out.add(root);
            }
        }
        return out;
    }

    private static boolean isProduct(JsonNode item) {
        JsonNode type = item.get("@type");
        if (type == null) return false;
        if (type.isArray()) {
            for (JsonNode t : type) {
                if ("Product".equals(t.asText())) return true;
            }
            return false;
        }
        return "Product".equals(type.asText());
    }

    private ProductSnapshot toSnapshot(JsonNode item, String url) {
        String title = text(item.get("name"));
        String image = image(item.get("image"));

        BigDecimal price = null;
        String currency = null;
        Boolean inStock = null;

        JsonNode offers = item.get("offers");
        if (offers != null && offers.isArray()) {
            offers = offers.size() > 0 ? offers.get(0) : null;
        }
        if (offers != null && offers.isObject()) {
            JsonNode priceNode = offers.hasNonNull("price") ? offers.get("price") : offers.get("lowPrice");
            price = amount(priceNode);
            currency = PriceTextParser.normalizeCurrencyCode(text(offers.get("priceCurrency")));
            inStock = availability(text(offers.get("availability")));
        }

        if (price != null && currency == null) {
            currency = PriceTextParser.DEFAULT_CURRENCY;
        }

        return new ProductSnapshot(url, title, price, currency, inStock, List.of(), image, true, null);
    }

    private static BigDecimal amount(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isNumber()) {
            BigDecimal v = node.decimalValue();
            return v.signum() >= 0 ? v : null;
        }
        String s = node.asText();
        try {
            BigDecimal v = new BigDecimal(s.trim());
            return v.signum() >= 0 ? v : null;
        } catch (NumberFormatException e) {
            return PriceTextParser.parseAmount(s).orElse(null);
        }
    }

    static Boolean availability(String value) {
        if (value == null || value.isBlank()) return null;
        String v = value.toLowerCase(Locale.ROOT);
        if (v.contains("instock") || v.contains("limitedavailability") || v.contains("onlineonly")) return true;
        if (v.contains("outofstock") || v.contains("soldout") || v.contains("discontinued")) return false;
        return null;
    }

    private static String image(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isTextual()) return node.asText();
        if (node.isArray()) return node.size() > 0 ? image(node.get(0)) : null;
        if (node.isObject()) return text(node.get("url"));
        return null;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull()) return null;
        String s = node.asText().trim();
        return s.isEmpty() ? null : s;
    }
}
