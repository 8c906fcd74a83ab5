package tech.andrefsramos.product_watcher.core.domain;

import java.time.Instant;

/*
 * Delta pós-verificação aplicado atomicamente pelo repositório.

 * - success=true  -> errorCount volta a zero; snapshot (se presente) substitui o anterior.
 * - success=false -> errorCount += errorIncrement sobre a linha travada; se o novo valor atingir
 *   errorThreshold (> 0) um watcher ACTIVE passa para ERROR. A decisão usa a contagem persistida,
 *   não a lida no início da verificação.
 * - alerted=true  -> lastAlertAt = checkedAt.
 */
public record WatcherOutcome(
        boolean success,
        ProductSnapshot snapshot,
        int errorIncrement,
        int errorThreshold,
        Instant checkedAt,
        boolean alerted
) {

    public static WatcherOutcome success(ProductSnapshot snapshot, Instant checkedAt, boolean alerted) {
        return new WatcherOutcome(true, snapshot, 0, 0, checkedAt, alerted);
    }

    public static WatcherOutcome unchanged(Instant checkedAt) {
        return new WatcherOutcome(true, null, 0, 0, checkedAt, false);
    }

    public static WatcherOutcome failure(int errorThreshold, Instant checkedAt) {
        return new WatcherOutcome(false, null, 1, errorThreshold, checkedAt, false);
    }

    public boolean reachesThreshold(int newErrorCount) {
        return !success && errorThreshold > 0 && newErrorCount >= errorThreshold;
    }
}
