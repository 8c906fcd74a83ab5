package tech.andrefsramos.product_watcher.core.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record RuleSet(PriceRule priceRule, boolean alertOnRestock, Set<String> watchedSizes) {

    public RuleSet {
        watchedSizes = (watchedSizes == null)
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(watchedSizes));
    }

    public static RuleSet empty() {
        return new RuleSet(null, false, Set.of());
    }
}
