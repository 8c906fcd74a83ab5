package tech.andrefsramos.product_watcher.core.domain;

public record AlertPayload(
        String productName,
        String productUrl,
        String previousValue,
        String currentValue,
        String message
) {}
