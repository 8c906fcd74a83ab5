package tech.andrefsramos.product_watcher.core.ports;

import tech.andrefsramos.product_watcher.core.domain.AlertEvent;

public interface AlertSink {
    void emit(AlertEvent event);
}
