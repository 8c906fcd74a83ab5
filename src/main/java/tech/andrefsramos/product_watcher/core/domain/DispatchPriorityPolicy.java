package tech.andrefsramos.product_watcher.core.domain;

import java.time.Duration;
import java.time.Instant;

/*
 * Prioridade de despacho de um watcher (menor = mais cedo).

 * - base 10;
 * - intervalo <= 60s: -3; intervalo <= 300s: -1;
 * - +1 por erro consecutivo (watchers instáveis perdem a vez);
 * - nunca verificado: -5; sem verificação há mais de 2x o intervalo: -2;
 * - resultado limitado a [1, 20].
 */
public final class DispatchPriorityPolicy {

    public static final int BASE = 10;
    public static final int MIN = 1;
    public static final int MAX = 20;

    private DispatchPriorityPolicy() {}

    public static int compute(Watcher w, Instant now) {
        int priority = BASE;

        if (w.intervalSeconds() <= 60) priority -= 3;
        else if (w.intervalSeconds() <= 300) priority -= 1;

        priority += Math.max(0, w.errorCount());

        if (w.lastCheckAt() == null) {
            priority -= 5;
        } else {
            long sinceCheckMs = Duration.between(w.lastCheckAt(), now).toMillis();
            long intervalMs = w.intervalSeconds() * 1000L;
            if (sinceCheckMs > intervalMs * 2) priority -= 2;
        }

        return Math.max(MIN, Math.min(priority, MAX));
    }
}
