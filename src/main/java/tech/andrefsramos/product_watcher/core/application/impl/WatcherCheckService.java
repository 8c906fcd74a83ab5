package tech.andrefsramos.product_watcher.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.product_watcher.core.application.CheckWatcherUseCase;
import tech.andrefsramos.product_watcher.core.application.ThrottleCoordinator;
import tech.andrefsramos.product_watcher.core.domain.AlertEvent;
import tech.andrefsramos.product_watcher.core.domain.AlertRulePolicy;
import tech.andrefsramos.product_watcher.core.domain.CheckOutcome;
import tech.andrefsramos.product_watcher.core.domain.CheckStatus;
import tech.andrefsramos.product_watcher.core.domain.DomainNames;
import tech.andrefsramos.product_watcher.core.domain.FetchFailureKind;
import tech.andrefsramos.product_watcher.core.domain.FetchResult;
import tech.andrefsramos.product_watcher.core.domain.ProductSnapshot;
import tech.andrefsramos.product_watcher.core.domain.Watcher;
import tech.andrefsramos.product_watcher.core.domain.WatcherOutcome;
import tech.andrefsramos.product_watcher.core.ports.AlertSink;
import tech.andrefsramos.product_watcher.core.ports.PageFetcherPort;
import tech.andrefsramos.product_watcher.core.ports.ProductAdapter;
import tech.andrefsramos.product_watcher.core.ports.WatcherRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/*
 * Finalidade

 * Executa uma verificação completa de um único watcher:
 *  1) Carrega o watcher; se não estiver ACTIVE, rejeita sem tocar em rede ou throttle.
 *  2) Obtém uma permissão global de fetch.
 *  3) Com a permissão em mãos, reserva o slot do domínio no {@link ThrottleCoordinator},
 *     aguarda o tempo exigido e executa o GET condicional.
 *  4) UNCHANGED (304): sucesso sem avaliação de regras; snapshot anterior preservado.
 *  5) FETCHED: resolve o adapter do domínio, faz o parse e avalia as regras.
 *  6) Persiste o resultado e só então entrega os alertas ao {@link AlertSink}.

 * Erros

 * - Falha de fetch: backoff do domínio + erro do watcher.
 * - Falha de parse: apenas erro do watcher (o backoff do domínio não muda).
 * - A partir de errorThreshold falhas consecutivas o repositório move o watcher para ERROR.
 * - Nenhuma exceção escapa de check(): tudo vira um {@link CheckOutcome}.
 */
public class WatcherCheckService implements CheckWatcherUseCase {

    private static final Logger log = LoggerFactory.getLogger(WatcherCheckService.class);

    private final WatcherRepository watcherRepository;
    private final ThrottleCoordinator throttle;
    private final PageFetcherPort fetcher;
    private final ProductAdapterRegistry adapters;
    private final AlertSink alertSink;
    private final Clock clock;
    private final int errorThreshold;
    private final Duration permitTimeout;

    public WatcherCheckService(
            WatcherRepository watcherRepository,
            ThrottleCoordinator throttle,
            PageFetcherPort fetcher,
            ProductAdapterRegistry adapters,
            AlertSink alertSink,
            Clock clock,
            int errorThreshold,
            Duration permitTimeout
    ) {
        this.watcherRepository = watcherRepository;
        this.throttle = throttle;
        this.fetcher = fetcher;
        this.adapters = adapters;
        this.alertSink = alertSink;
        this.clock = clock;
        this.errorThreshold = Math.max(errorThreshold, 1);
        this.permitTimeout = permitTimeout;
    }

    @Override
    public CheckOutcome check(String watcherId) {
        final long t0 = System.nanoTime();

        final Optional<Watcher> found;
        try {
            found = watcherRepository.findById(watcherId);
        } catch (Exception e) {
            log.error("[Check] Falha ao carregar watcher id={}: {}", watcherId, e.getMessage(), e);
            return CheckOutcome.of(watcherId, CheckStatus.SKIPPED, "repository unavailable");
        }

        if (found.isEmpty()) {
            log.warn("[Check] Watcher não encontrado id={}", watcherId);
            return CheckOutcome.of(watcherId, CheckStatus.NOT_FOUND, "Watcher not found");
        }

        final Watcher w = found.get();
        if (!w.isActive()) {
            log.info("[Check] Watcher id={} não está ativo (status={}). Ignorando.", w.id(), w.status());
            return CheckOutcome.of(w.id(), CheckStatus.NOT_ACTIVE, "Watcher is not active");
        }

        final String domain = (w.domain() == null || w.domain().isBlank())
                ? DomainNames.fromUrl(w.url())
                : DomainNames.normalize(w.domain());
        if (domain.isEmpty()) {
            log.warn("[Check] URL inválida para watcher id={} url='{}'", w.id(), w.url());
            recordError(w, "invalid url");
            return CheckOutcome.of(w.id(), CheckStatus.FETCH_FAILED, "Invalid URL");
        }

        try {
            CheckOutcome outcome = run(w, domain);
            log.info("[Check] FIM id={} domain={} status={} alerts={} ({} ms)",
                    w.id(), domain, outcome.status(), outcome.alerts().size(), durMs(t0, System.nanoTime()));
            return outcome;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.info("[Check] Verificação interrompida id={} domain={}", w.id(), domain);
            return CheckOutcome.of(w.id(), CheckStatus.CANCELLED, "interrupted");
        } catch (Exception e) {
            log.error("[Check] Erro inesperado id={} domain={}: {}", w.id(), domain, e.getMessage(), e);
            recordError(w, e.getClass().getSimpleName());
            return CheckOutcome.of(w.id(), CheckStatus.ERROR, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private CheckOutcome run(Watcher w, String domain) throws InterruptedException {
        if (!throttle.acquireFetchPermit(permitTimeout)) {
            return CheckOutcome.of(w.id(), CheckStatus.SKIPPED, "no fetch permit available");
        }

        // o slot só é reservado com a permissão em mãos: o horário carimbado é o do envio real
        final long tFetch0;
        final FetchResult result;
        try {
            Duration wait = throttle.reserveSlot(domain);
            if (!wait.isZero()) {
                log.debug("[Check] Aguardando throttle id={} domain={} waitMs={}", w.id(), domain, wait.toMillis());
                TimeUnit.NANOSECONDS.sleep(wait.toNanos());
            }
            tFetch0 = System.nanoTime();
            result = fetcher.fetch(w.url());
        } finally {
            throttle.releaseFetchPermit();
        }
        if (log.isDebugEnabled()) {
            log.debug("[Check] Fetch id={} kind={} status={} ({} ms)",
                    w.id(), result.kind(), result.statusCode(), durMs(tFetch0, System.nanoTime()));
        }

        switch (result.kind()) {
            case FAILED:
                return onFetchFailure(w, domain, result);
            case UNCHANGED:
                throttle.recordSuccess(domain);
                watcherRepository.recordOutcome(w.id(), WatcherOutcome.unchanged(clock.instant()));
                return CheckOutcome.unchanged(w.id());
            case FETCHED:
            default:
                return onFetched(w, domain, result.body());
        }
    }

    private CheckOutcome onFetchFailure(Watcher w, String domain, FetchResult result) {
        if (result.failureKind() == FetchFailureKind.PERMANENT) {
            log.warn("[Check] Falha permanente id={} domain={} status={} reason={}",
                    w.id(), domain, result.statusCode(), result.reason());
        } else {
            log.info("[Check] Falha transitória id={} domain={} status={} reason={}",
                    w.id(), domain, result.statusCode(), result.reason());
        }
        throttle.recordFailure(domain);
        recordError(w, result.reason());
        return CheckOutcome.of(w.id(), CheckStatus.FETCH_FAILED, result.reason());
    }

    private CheckOutcome onFetched(Watcher w, String domain, String body) {
        ProductAdapter adapter = adapters.resolve(domain);
        ProductSnapshot snapshot = safeParse(adapter, body, w.url());

        if (!snapshot.success()) {
            log.warn("[Check] Parse sem sucesso id={} adapter={} erro={}",
                    w.id(), adapter.getClass().getSimpleName(), snapshot.error());
            throttle.recordAttempt(domain);
            recordError(w, snapshot.error());
            return new CheckOutcome(w.id(), CheckStatus.PARSE_FAILED, List.of(), snapshot, snapshot.error());
        }

        throttle.recordSuccess(domain);

        List<AlertEvent> alerts = AlertRulePolicy.evaluate(w.id(), w.rulesOrEmpty(), snapshot, w.lastSnapshot());

        watcherRepository.recordOutcome(w.id(), WatcherOutcome.success(snapshot, clock.instant(), !alerts.isEmpty()));

        for (AlertEvent alert : alerts) {
            safeEmit(alert);
        }
        return CheckOutcome.success(w.id(), snapshot, alerts);
    }

    private ProductSnapshot safeParse(ProductAdapter adapter, String body, String url) {
        try {
            ProductSnapshot s = adapter.parse(body, url);
            return s != null ? s : ProductSnapshot.failure(url, "adapter returned no result");
        } catch (Exception e) {
            log.error("[Check] Adapter {} lançou exceção url={}: {}",
                    adapter.getClass().getSimpleName(), url, e.getMessage(), e);
            return ProductSnapshot.failure(url, "Parse failed: " + e.getClass().getSimpleName());
        }
    }

    private void safeEmit(AlertEvent alert) {
        try {
            alertSink.emit(alert);
        } catch (Exception e) {
            log.error("[Check] Falha ao emitir alerta watcher={} type={}: {}",
                    alert.watcherId(), alert.type(), e.getMessage(), e);
        }
    }

    private void recordError(Watcher w, String reason) {
        try {
            watcherRepository.recordOutcome(w.id(), WatcherOutcome.failure(errorThreshold, clock.instant()));
            log.debug("[Check] Falha registrada id={} errorCountAnterior={} motivo={}", w.id(), w.errorCount(), reason);
        } catch (Exception e) {
            log.error("[Check] Falha ao registrar erro do watcher id={}: {}", w.id(), e.getMessage(), e);
        }
    }

    private static long durMs(long tStart, long tEnd) {
        return TimeUnit.NANOSECONDS.toMillis(Math.max(0, tEnd - tStart));
    }
}
