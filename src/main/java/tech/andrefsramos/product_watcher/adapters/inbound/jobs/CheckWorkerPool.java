package tech.andrefsramos.product_watcher.adapters.inbound.jobs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import tech.andrefsramos.product_watcher.core.application.CheckWatcherUseCase;
import tech.andrefsramos.product_watcher.core.domain.CheckJob;
import tech.andrefsramos.product_watcher.core.domain.CheckOutcome;
import tech.andrefsramos.product_watcher.core.ports.JobQueue;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * CheckWorkerPool

 * Descrição geral:
 * - Pool fixo de workers que consome a {@link JobQueue} e executa uma verificação por vez
 *   por worker, do início ao fim, antes de pegar o próximo job.

 * Fluxo de cada worker:
 * 1. Aguarda um job por até {@code POLL_TIMEOUT} (permite observar o pedido de parada).
 * 2. Executa {@link CheckWatcherUseCase#check(String)}.
 * 3. Sempre libera o watcherId na fila ({@code complete}), mesmo em caso de erro.

 * Ciclo de vida:
 * - Sobe junto com o contexto Spring (SmartLifecycle) e para antes do pool de conexões.
 * - No stop, jobs em andamento recebem interrupção após o tempo de espera; o estado
 *   persistido permite retomar no próximo ciclo do agendador.
 */
@Component
@ConditionalOnProperty(name = "app.worker.enabled", havingValue = "true", matchIfMissing = true)
public class CheckWorkerPool implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(CheckWorkerPool.class);
    private static final Duration POLL_TIMEOUT = Duration.ofSeconds(1);
    private static final long SHUTDOWN_GRACE_MS = 10_000;

    private final JobQueue jobQueue;
    private final CheckWatcherUseCase checkUseCase;
    private final int concurrency;

    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger processed = new AtomicInteger();

    private volatile boolean running;
    private ExecutorService executor;

    public CheckWorkerPool(
            JobQueue jobQueue,
            CheckWatcherUseCase checkUseCase,
            @Value("${app.worker.concurrency:5}") int concurrency
    ) {
        this.jobQueue = jobQueue;
        this.checkUseCase = checkUseCase;
        if (concurrency < 1) {
            log.warn("CheckWorkerPool: app.worker.concurrency={} inválido. Ajustando para 1.", concurrency);
            concurrency = 1;
        }
        this.concurrency = concurrency;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        running = true;
        executor = Executors.newFixedThreadPool(concurrency, new CustomizableThreadFactory("check-worker-"));
        for (int i = 0; i < concurrency; i++) {
            executor.submit(this::workerLoop);
        }
        log.info("CheckWorkerPool: iniciado com {} workers.", concurrency);
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE_MS, TimeUnit.MILLISECONDS)) {
                log.warn("CheckWorkerPool: workers não terminaram em {} ms; interrompendo (ativos={}).",
                        SHUTDOWN_GRACE_MS, active.get());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("CheckWorkerPool: parado (processados={}, fila={}).", processed.get(), jobQueue.size());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public int activeCount() {
        return active.get();
    }

    private void workerLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            Optional<CheckJob> next;
            try {
                next = jobQueue.take(POLL_TIMEOUT);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            next.ifPresent(this::process);
        }
    }

    private void process(CheckJob job) {
        long start = System.nanoTime();
        active.incrementAndGet();
        try {
            CheckOutcome outcome = checkUseCase.check(job.watcherId());
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.debug("CheckWorkerPool: job concluído watcherId={} priority={} status={} (elapsedMs={} ms)",
                    job.watcherId(), job.priority(), outcome.status(), elapsedMs);
        } catch (Exception ex) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.error("CheckWorkerPool: erro inesperado no job watcherId={} (elapsedMs={} ms)",
                    job.watcherId(), elapsedMs, ex);
        } finally {
            jobQueue.complete(job.watcherId());
            active.decrementAndGet();
            processed.incrementAndGet();
        }
    }
}
