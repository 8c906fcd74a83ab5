package tech.andrefsramos.product_watcher.core.domain;

public enum WatcherStatus {
    ACTIVE,
    PAUSED,
    ERROR,
    DISABLED
}
