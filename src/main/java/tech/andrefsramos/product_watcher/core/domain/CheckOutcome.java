package tech.andrefsramos.product_watcher.core.domain;

import java.util.List;

public record CheckOutcome(
        String watcherId,
        CheckStatus status,
        List<AlertEvent> alerts,
        ProductSnapshot snapshot,
        String error
) {

    public CheckOutcome {
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
    }

    public static CheckOutcome of(String watcherId, CheckStatus status, String error) {
        return new CheckOutcome(watcherId, status, List.of(), null, error);
    }

    public static CheckOutcome success(String watcherId, ProductSnapshot snapshot, List<AlertEvent> alerts) {
        return new CheckOutcome(watcherId, CheckStatus.SUCCESS, alerts, snapshot, null);
    }

    public static CheckOutcome unchanged(String watcherId) {
        return new CheckOutcome(watcherId, CheckStatus.UNCHANGED, List.of(), null, null);
    }
}
