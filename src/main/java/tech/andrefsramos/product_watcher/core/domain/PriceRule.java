package tech.andrefsramos.product_watcher.core.domain;

import java.math.BigDecimal;
import java.util.Objects;

/*
 * Regra de preço de um watcher.
 *
 * - BELOW/ABOVE usam {@code value} (obrigatório).
 * - CHANGE usa {@code percentage} (opcional); sem percentual, qualquer variação dispara.
 */
public record PriceRule(PriceRuleType type, BigDecimal value, BigDecimal percentage) {

    public PriceRule {
        Objects.requireNonNull(type, "type is required");
        if ((type == PriceRuleType.BELOW || type == PriceRuleType.ABOVE) && value == null) {
            throw new IllegalArgumentException("PriceRule " + type + " exige value");
        }
    }

    public static PriceRule below(BigDecimal value) {
        return new PriceRule(PriceRuleType.BELOW, value, null);
    }

    public static PriceRule above(BigDecimal value) {
        return new PriceRule(PriceRuleType.ABOVE, value, null);
    }

    public static PriceRule change(BigDecimal percentage) {
        return new PriceRule(PriceRuleType.CHANGE, null, percentage);
    }
}
