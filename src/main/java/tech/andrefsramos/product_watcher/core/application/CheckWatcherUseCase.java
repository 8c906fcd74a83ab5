package tech.andrefsramos.product_watcher.core.application;

import tech.andrefsramos.product_watcher.core.domain.CheckOutcome;

public interface CheckWatcherUseCase {
    CheckOutcome check(String watcherId);
}
