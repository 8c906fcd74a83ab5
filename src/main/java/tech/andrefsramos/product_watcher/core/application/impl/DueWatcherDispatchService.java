package tech.andrefsramos.product_watcher.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.product_watcher.core.application.DispatchDueWatchersUseCase;
import tech.andrefsramos.product_watcher.core.domain.CheckJob;
import tech.andrefsramos.product_watcher.core.domain.DispatchPriorityPolicy;
import tech.andrefsramos.product_watcher.core.domain.DomainNames;
import tech.andrefsramos.product_watcher.core.domain.Watcher;
import tech.andrefsramos.product_watcher.core.ports.JobQueue;
import tech.andrefsramos.product_watcher.core.ports.WatcherRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/*
 * Finalidade

 * Uma passada do agendador:
 *  1) Consulta watchers ACTIVE nunca verificados ou verificados antes de (agora - recheckFloor).
 *  2) Ignora watchers que já têm job enfileirado ou em execução (dedup por id).
 *  3) Calcula a prioridade ({@link DispatchPriorityPolicy}) e enfileira o job.

 * O piso de re-verificação é granularidade do polling, não política de frescor.
 */
public class DueWatcherDispatchService implements DispatchDueWatchersUseCase {

    private static final Logger log = LoggerFactory.getLogger(DueWatcherDispatchService.class);

    private final WatcherRepository watcherRepository;
    private final JobQueue jobQueue;
    private final Clock clock;
    private final Duration recheckFloor;
    private final int batchLimit;

    public DueWatcherDispatchService(
            WatcherRepository watcherRepository,
            JobQueue jobQueue,
            Clock clock,
            Duration recheckFloor,
            int batchLimit
    ) {
        this.watcherRepository = watcherRepository;
        this.jobQueue = jobQueue;
        this.clock = clock;
        this.recheckFloor = recheckFloor;
        this.batchLimit = Math.max(batchLimit, 1);
    }

    @Override
    public int dispatchDue() {
        final long t0 = System.nanoTime();
        final Instant now = clock.instant();

        final List<Watcher> due;
        try {
            due = watcherRepository.findDue(now.minus(recheckFloor), batchLimit);
        } catch (Exception e) {
            log.error("[Dispatch] Falha ao consultar watchers pendentes: {}", e.getMessage(), e);
            return 0;
        }

        if (due.isEmpty()) {
            log.debug("[Dispatch] Nenhum watcher pendente.");
            return 0;
        }

        int queued = 0;
        int alreadyPending = 0;
        int failed = 0;

        for (Watcher w : due) {
            if (jobQueue.isPending(w.id())) {
                alreadyPending++;
                if (log.isDebugEnabled()) {
                    log.debug("[Dispatch] Job já na fila/em execução watcherId={}", w.id());
                }
                continue;
            }
            try {
                String domain = (w.domain() == null || w.domain().isBlank()) ? DomainNames.fromUrl(w.url()) : w.domain();
                CheckJob job = new CheckJob(w.id(), w.url(), domain, DispatchPriorityPolicy.compute(w, now));
                if (jobQueue.enqueueUnique(job)) {
                    queued++;
                    if (log.isDebugEnabled()) {
                        log.debug("[Dispatch] Enfileirado watcherId={} domain={} priority={}", w.id(), domain, job.priority());
                    }
                } else {
                    alreadyPending++;
                }
            } catch (Exception e) {
                failed++;
                log.error("[Dispatch] Falha ao enfileirar watcherId={}: {}", w.id(), e.getMessage(), e);
            }
        }

        log.info("[Dispatch] Concluído: encontrados={}, enfileirados={}, jaPendentes={}, falhas={}, fila={} ({} ms)",
                due.size(), queued, alreadyPending, failed, jobQueue.size(), durMs(t0, System.nanoTime()));
        return queued;
    }

    private static long durMs(long tStart, long tEnd) {
        return TimeUnit.NANOSECONDS.toMillis(Math.max(0, tEnd - tStart));
    }
}
