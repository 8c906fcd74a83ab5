package tech.andrefsramos.product_watcher.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.product_watcher.core.application.ThrottleCoordinator;
import tech.andrefsramos.product_watcher.core.domain.DomainNames;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/*
 * Finalidade

 * Coordena o acesso "educado" aos domínios monitorados:
 *  1) Espaçamento mínimo por domínio (baseDelay) entre requisições.
 *  2) Backoff exponencial por erros consecutivos: baseDelay * multiplier^erros,
 *     limitado a [baseDelay, maxDelay]; a contagem de erros é limitada a errorCap.
 *  3) Limite global de fetches simultâneos (semáforo simples, não indexado por domínio).

 * Concorrência

 * - O mapa por domínio é o único estado mutável compartilhado entre os workers.
 * - Toda leitura-modificação-escrita passa por ConcurrentHashMap.compute: trava apenas a
 *   chave do domínio, domínios diferentes nunca se bloqueiam.
 * - reserveSlot() verifica e carimba o próximo horário permitido na mesma operação atômica;
 *   dois workers não conseguem ambos ver "pode prosseguir" a partir do mesmo estado.

 * Expiração

 * - Entradas sem atividade há mais de entryTtl são tratadas como inexistentes e removidas
 *   por evictExpired().
 */
public class DomainThrottleService implements ThrottleCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DomainThrottleService.class);

    private record ThrottleEntry(Instant lastRequest, int errorCount) {}

    private final ConcurrentMap<String, ThrottleEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long baseDelayMs;
    private final double multiplier;
    private final long maxDelayMs;
    private final int errorCap;
    private final Duration entryTtl;
    private final Semaphore fetchPermits;

    public DomainThrottleService(
            Clock clock,
            Duration baseDelay,
            double multiplier,
            Duration maxDelay,
            int errorCap,
            Duration entryTtl,
            int maxConcurrentFetches
    ) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.baseDelayMs = Math.max(0, baseDelay.toMillis());
        this.multiplier = Math.max(1.0, multiplier);
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelay.toMillis());
        this.errorCap = Math.max(0, errorCap);
        this.entryTtl = entryTtl;
        this.fetchPermits = new Semaphore(Math.max(1, maxConcurrentFetches), true);

        log.info("[Throttle] inicializado baseDelayMs={} multiplier={} maxDelayMs={} errorCap={} ttl={} maxConcurrentFetches={}",
                baseDelayMs, this.multiplier, this.maxDelayMs, this.errorCap, entryTtl, maxConcurrentFetches);
    }

    @Override
    public Duration canProceed(String domain) {
        String key = key(domain);
        Instant now = clock.instant();
        ThrottleEntry e = live(entries.get(key), now);
        if (e == null) {
            return Duration.ZERO;
        }
        return waitFor(e, now);
    }

    @Override
    public Duration reserveSlot(String domain) {
        String key = key(domain);
        AtomicReference<Duration> wait = new AtomicReference<>(Duration.ZERO);

        entries.compute(key, (k, current) -> {
            Instant now = clock.instant();
            ThrottleEntry e = live(current, now);
            if (e == null) {
                return new ThrottleEntry(now, 0);
            }
            Duration w = waitFor(e, now);
            wait.set(w);
            return new ThrottleEntry(now.plus(w), e.errorCount());
        });

        Duration w = wait.get();
        if (!w.isZero() && log.isDebugEnabled()) {
            log.debug("[Throttle] slot reservado domain={} waitMs={}", key, w.toMillis());
        }
        return w;
    }

    @Override
    public void recordSuccess(String domain) {
        String key = key(domain);
        entries.compute(key, (k, current) -> {
            Instant now = clock.instant();
            return new ThrottleEntry(latest(current, now), 0);
        });
        log.debug("[Throttle] sucesso registrado domain={}", key);
    }

    @Override
    public void recordFailure(String domain) {
        String key = key(domain);
        ThrottleEntry updated = entries.compute(key, (k, current) -> {
            Instant now = clock.instant();
            ThrottleEntry e = live(current, now);
            int errors = (e == null) ? 0 : e.errorCount();
            return new ThrottleEntry(latest(e, now), Math.min(errors + 1, errorCap));
        });
        log.info("[Throttle] falha registrada domain={} errorCount={} nextDelayMs={}",
                key, updated.errorCount(), requiredDelayMs(updated.errorCount()));
    }

    @Override
    public void recordAttempt(String domain) {
        String key = key(domain);
        entries.compute(key, (k, current) -> {
            Instant now = clock.instant();
            ThrottleEntry e = live(current, now);
            int errors = (e == null) ? 0 : e.errorCount();
            return new ThrottleEntry(latest(e, now), errors);
        });
    }

    @Override
    public Duration currentDelay(String domain) {
        ThrottleEntry e = live(entries.get(key(domain)), clock.instant());
        return Duration.ofMillis(requiredDelayMs(e == null ? 0 : e.errorCount()));
    }

    @Override
    public int errorCount(String domain) {
        ThrottleEntry e = live(entries.get(key(domain)), clock.instant());
        return e == null ? 0 : e.errorCount();
    }

    @Override
    public void reset(String domain) {
        String key = key(domain);
        entries.remove(key);
        log.info("[Throttle] entrada removida manualmente domain={}", key);
    }

    @Override
    public int evictExpired() {
        int removed = 0;
        for (String key : new ArrayList<>(entries.keySet())) {
            boolean[] evicted = {false};
            entries.computeIfPresent(key, (k, e) -> {
                if (live(e, clock.instant()) == null) {
                    evicted[0] = true;
                    return null;
                }
                return e;
            });
            if (evicted[0]) removed++;
        }
        if (removed > 0) {
            log.info("[Throttle] entradas expiradas removidas={} restantes={}", removed, entries.size());
        }
        return removed;
    }

    @Override
    public boolean acquireFetchPermit(Duration timeout) throws InterruptedException {
        boolean ok = fetchPermits.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!ok) {
            log.warn("[Throttle] nenhuma permissão global de fetch disponível em {} ms (disponíveis={})",
                    timeout.toMillis(), fetchPermits.availablePermits());
        }
        return ok;
    }

    @Override
    public void releaseFetchPermit() {
        fetchPermits.release();
    }

    long requiredDelayMs(int errorCount) {
        if (errorCount <= 0) {
            return baseDelayMs;
        }
        double delay = baseDelayMs * Math.pow(multiplier, Math.min(errorCount, errorCap));
        return (long) Math.max(baseDelayMs, Math.min(delay, maxDelayMs));
    }

    int trackedDomains() {
        return entries.size();
    }

    private Duration waitFor(ThrottleEntry e, Instant now) {
        Instant nextAllowed = e.lastRequest().plusMillis(requiredDelayMs(e.errorCount()));
        return nextAllowed.isAfter(now) ? Duration.between(now, nextAllowed) : Duration.ZERO;
    }

    private ThrottleEntry live(ThrottleEntry e, Instant now) {
        if (e == null) return null;
        if (entryTtl != null && e.lastRequest().plus(entryTtl).isBefore(now)) return null;
        return e;
    }

    private static Instant latest(ThrottleEntry e, Instant now) {
        if (e == null) return now;
        return e.lastRequest().isAfter(now) ? e.lastRequest() : now;
    }

    private static String key(String domain) {
        String key = DomainNames.normalize(domain);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("domain é obrigatório para throttling");
        }
        return key;
    }
}
