package tech.andrefsramos.product_watcher.adapters.outbound.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import tech.andrefsramos.product_watcher.core.domain.AlertEvent;
import tech.andrefsramos.product_watcher.core.domain.AlertPayload;
import tech.andrefsramos.product_watcher.core.ports.AlertSink;

/** Escreve cada alerta no log da aplicação; útil em desenvolvimento e como trilha de auditoria. */
@Component
@ConditionalOnProperty(name = "app.alerts.log.enabled", havingValue = "true", matchIfMissing = true)
public class LogAlertSink implements AlertSink {

    private static final Logger log = LoggerFactory.getLogger(LogAlertSink.class);

    @Override
    public void emit(AlertEvent event) {
        AlertPayload p = event.payload();
        log.info("[Alert] watcherId={} type={} product='{}' previous={} current={} message='{}'",
                event.watcherId(),
                event.type().code(),
                p == null ? null : p.productName(),
                p == null ? null : p.previousValue(),
                p == null ? null : p.currentValue(),
                p == null ? null : p.message());
    }
}
