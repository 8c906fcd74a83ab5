package tech.andrefsramos.product_watcher.core.domain;

public enum PriceRuleType {
    BELOW,
    ABOVE,
    CHANGE
}
