package tech.andrefsramos.product_watcher.core.application;

public interface DispatchDueWatchersUseCase {
    int dispatchDue();
}
