package tech.andrefsramos.product_watcher.core.domain;

import java.time.Instant;

public record Watcher(
        String id,
        String url,
        String domain,
        RuleSet rules,
        int intervalSeconds,
        WatcherStatus status,
        Instant lastCheckAt,
        Instant lastAlertAt,
        int errorCount,
        ProductSnapshot lastSnapshot
) {

    public boolean isActive() {
        return status == WatcherStatus.ACTIVE;
    }

    public RuleSet rulesOrEmpty() {
        return rules != null ? rules : RuleSet.empty();
    }
}
