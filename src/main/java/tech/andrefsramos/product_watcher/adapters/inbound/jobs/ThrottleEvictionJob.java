package tech.andrefsramos.product_watcher.adapters.inbound.jobs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import tech.andrefsramos.product_watcher.core.application.ThrottleCoordinator;

/**
 * ThrottleEvictionJob

 * Remove periodicamente do {@link ThrottleCoordinator} os domínios sem requisições dentro do TTL,
 * mantendo o mapa limitado aos domínios em uso.
 */
@Component
public class ThrottleEvictionJob {

    private static final Logger log = LoggerFactory.getLogger(ThrottleEvictionJob.class);

    private final ThrottleCoordinator throttle;

    public ThrottleEvictionJob(ThrottleCoordinator throttle) {
        this.throttle = throttle;
    }

    @Scheduled(fixedDelayString = "${app.throttle.evictionFixedDelayMs:600000}",
               initialDelayString = "${app.throttle.evictionFixedDelayMs:600000}")
    public void evict() {
        long start = System.nanoTime();
        try {
            int removed = throttle.evictExpired();
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            if (removed > 0) {
                log.info("ThrottleEvictionJob: {} domínios expirados removidos (elapsedMs={} ms).", removed, elapsedMs);
            } else {
                log.debug("ThrottleEvictionJob: nenhum domínio expirado (elapsedMs={} ms).", elapsedMs);
            }
        } catch (Exception ex) {
            log.error("ThrottleEvictionJob: erro ao remover domínios expirados.", ex);
        }
    }
}
