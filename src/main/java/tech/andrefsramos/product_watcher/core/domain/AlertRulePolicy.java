package tech.andrefsramos.product_watcher.core.domain;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/*
 * Finalidade

 * Avalia as regras de um watcher contra o snapshot atual e o anterior e devolve os alertas
 * que devem ser emitidos. Função pura: mesmas entradas, mesma saída, sem efeitos colaterais.

 * Regras
 *
 * - Preço BELOW/ABOVE: disparo por nível (dispara a cada verificação enquanto a condição valer).
 * - Preço CHANGE: exige preço anterior; com percentual, dispara quando |Δ%| >= percentual;
 *   sem percentual, qualquer variação numérica dispara.
 * - Estoque: apenas na borda false -> true. Sem snapshot anterior nunca dispara, e
 *   "desconhecido -> true" não conta como reposição.
 * - Tamanhos: cada tamanho observado presente agora e ausente antes. Sem snapshot anterior
 *   considera-se "nenhum tamanho conhecido", então a primeira verificação pode disparar.
 */
public final class AlertRulePolicy {

    private static final String UNKNOWN_PRODUCT = "Unknown Product";
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private AlertRulePolicy() {}

    public static List<AlertEvent> evaluate(String watcherId, RuleSet rules,
                                            ProductSnapshot current, ProductSnapshot previous) {
        List<AlertEvent> alerts = new ArrayList<>();
        if (rules == null || current == null || !current.success()) {
            return alerts;
        }

        ProductSnapshot prev = (previous != null && previous.success()) ? previous : null;
        String name = (current.title() == null || current.title().isBlank()) ? UNKNOWN_PRODUCT : current.title();

        if (rules.priceRule() != null && current.hasPrice()) {
            BigDecimal prevPrice = prev != null ? prev.price() : null;
            String message = checkPriceRule(rules.priceRule(), current.price(), prevPrice);
            if (message != null) {
                alerts.add(new AlertEvent(watcherId, AlertType.PRICE_CHANGE, new AlertPayload(
                        name, current.url(), plain(prevPrice), plain(current.price()), message)));
            }
        }

        if (rules.alertOnRestock()
                && prev != null
                && Boolean.FALSE.equals(prev.inStock())
                && Boolean.TRUE.equals(current.inStock())) {
            alerts.add(new AlertEvent(watcherId, AlertType.BACK_IN_STOCK, new AlertPayload(
                    name, current.url(), "false", "true", "Product is back in stock!")));
        }

        if (!rules.watchedSizes().isEmpty()) {
            List<String> previousSizes = prev != null ? prev.sizes() : List.of();
            for (String size : rules.watchedSizes()) {
                if (current.sizes().contains(size) && !previousSizes.contains(size)) {
                    alerts.add(new AlertEvent(watcherId, AlertType.SIZE_AVAILABLE, new AlertPayload(
                            name, current.url(), null, size, "Size " + size + " is now available!")));
                }
            }
        }

        return alerts;
    }

    static String checkPriceRule(PriceRule rule, BigDecimal currentPrice, BigDecimal previousPrice) {
        switch (rule.type()) {
            case BELOW:
                if (currentPrice.compareTo(rule.value()) < 0) {
                    return "Price dropped below " + plain(rule.value()) + "!";
                }
                return null;
            case ABOVE:
                if (currentPrice.compareTo(rule.value()) > 0) {
                    return "Price is now above " + plain(rule.value()) + "!";
                }
                return null;
            case CHANGE:
                if (previousPrice == null || currentPrice.compareTo(previousPrice) == 0) {
                    return null;
                }
                String direction = currentPrice.compareTo(previousPrice) < 0 ? "dropped" : "increased";
                if (rule.percentage() == null) {
                    return "Price " + direction + " from " + plain(previousPrice) + " to " + plain(currentPrice);
                }
                // a partir de zero qualquer variação é ilimitada em percentual
                if (previousPrice.signum() == 0) {
                    return "Price " + direction + " from " + plain(previousPrice) + " to " + plain(currentPrice);
                }
                BigDecimal changePct = currentPrice.subtract(previousPrice)
                        .multiply(HUNDRED)
                        .divide(previousPrice, MathContext.DECIMAL64)
                        .abs();
                if (changePct.compareTo(rule.percentage()) >= 0) {
                    return "Price " + direction + " by "
                            + changePct.setScale(1, RoundingMode.HALF_UP).toPlainString() + "%!";
                }
                return null;
            default:
                return null;
        }
    }

    private static String plain(BigDecimal v) {
        return v == null ? null : v.stripTrailingZeros().toPlainString();
    }
}
