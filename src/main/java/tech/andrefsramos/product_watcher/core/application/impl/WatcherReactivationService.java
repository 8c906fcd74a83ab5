package tech.andrefsramos.product_watcher.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.product_watcher.core.application.ReactivateWatcherUseCase;
import tech.andrefsramos.product_watcher.core.ports.WatcherRepository;

/*
 * Finalidade

 * Reset manual de um watcher em ERROR (ou PAUSED/DISABLED): volta a ACTIVE e zera errorCount,
 * tornando-o elegível no próximo ciclo do agendador.
 */
public class WatcherReactivationService implements ReactivateWatcherUseCase {

    private static final Logger log = LoggerFactory.getLogger(WatcherReactivationService.class);

    private final WatcherRepository watcherRepository;

    public WatcherReactivationService(WatcherRepository watcherRepository) {
        this.watcherRepository = watcherRepository;
    }

    @Override
    public boolean reactivate(String watcherId) {
        if (watcherId == null || watcherId.isBlank()) {
            throw new IllegalArgumentException("watcherId é obrigatório");
        }
        boolean done = watcherRepository.reactivate(watcherId.trim());
        if (done) {
            log.info("[Reactivate] Watcher id={} reativado.", watcherId);
        } else {
            log.warn("[Reactivate] Watcher id={} não encontrado.", watcherId);
        }
        return done;
    }
}
