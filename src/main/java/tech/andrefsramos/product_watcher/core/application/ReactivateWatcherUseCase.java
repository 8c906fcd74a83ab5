package tech.andrefsramos.product_watcher.core.application;

public interface ReactivateWatcherUseCase {

    /** Volta um watcher para ACTIVE com errorCount zerado. Retorna false se o id não existe. */
    boolean reactivate(String watcherId);
}
