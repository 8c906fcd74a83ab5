package tech.andrefsramos.product_watcher.adapters.inbound.scheduler;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import tech.andrefsramos.product_watcher.core.application.DispatchDueWatchersUseCase;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DispatchScheduler

 * Descrição geral:
 * - Laço único do agendador: a cada {@code app.scheduler.pollIntervalMs} (padrão 30s) executa
 *   uma passada de {@link DispatchDueWatchersUseCase}, que enfileira os watchers devidos.

 * Agendamento:
 * - fixedDelay: a próxima passada só começa depois do término da anterior, então nunca há
 *   duas passadas simultâneas.
 * - {@link #stop()} interrompe o despacho de forma explícita (também chamado no shutdown).
 */
@Component
@ConditionalOnProperty(name = "app.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class DispatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(DispatchScheduler.class);

    private final DispatchDueWatchersUseCase dispatch;
    private final AtomicBoolean running = new AtomicBoolean(true);

    public DispatchScheduler(DispatchDueWatchersUseCase dispatch) {
        this.dispatch = dispatch;
    }

    @Scheduled(fixedDelayString = "${app.scheduler.pollIntervalMs:30000}",
               initialDelayString = "${app.scheduler.initialDelayMs:5000}")
    public void tick() {
        if (!running.get()) {
            log.debug("DispatchScheduler: parado; passada ignorada.");
            return;
        }
        long start = System.nanoTime();
        try {
            int queued = dispatch.dispatchDue();
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.debug("DispatchScheduler: passada concluída (enfileirados={}, elapsedMs={} ms).", queued, elapsedMs);
        } catch (Exception ex) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.error("DispatchScheduler: erro durante a passada (elapsedMs={} ms).", elapsedMs, ex);
        }
    }

    @PreDestroy
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("DispatchScheduler: despacho encerrado.");
        }
    }

    public void resume() {
        if (running.compareAndSet(false, true)) {
            log.info("DispatchScheduler: despacho retomado.");
        }
    }

    public boolean isRunning() {
        return running.get();
    }
}
