package tech.andrefsramos.product_watcher.adapters.outbound.persistence;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tech.andrefsramos.product_watcher.adapters.outbound.persistence.entity.AlertEntity;
import tech.andrefsramos.product_watcher.core.domain.AlertEvent;
import tech.andrefsramos.product_watcher.core.domain.AlertPayload;
import tech.andrefsramos.product_watcher.core.ports.AlertSink;

import java.time.Clock;

/*
 * Finalidade

 * Registra cada alerta na tabela `alerts`, de onde os serviços de entrega (e-mail, webhook)
 * fazem a leitura. Textos maiores que a coluna são truncados com aviso em log.
 */

@Repository
public class JpaAlertSink implements AlertSink {

    private static final Logger log = LoggerFactory.getLogger(JpaAlertSink.class);

    private static final int NAME_MAX = 500;
    private static final int URL_MAX = 2000;
    private static final int VALUE_MAX = 200;
    private static final int MESSAGE_MAX = 500;

    @PersistenceContext
    private EntityManager em;

    private final Clock clock;

    public JpaAlertSink(Clock clock) {
        this.clock = clock;
    }

    @Override
    @Transactional
    public void emit(AlertEvent event) {
        if (event == null || event.type() == null) {
            throw new IllegalArgumentException("AlertEvent e type são obrigatórios em emit()");
        }
        long t0 = System.nanoTime();
        AlertPayload p = event.payload();

        AlertEntity e = new AlertEntity();
        e.setWatcherId(event.watcherId());
        e.setType(event.type().code());
        e.setProductName(cut(p == null ? null : p.productName(), NAME_MAX, "productName", event));
        e.setProductUrl(cut(p == null ? null : p.productUrl(), URL_MAX, "productUrl", event));
        e.setPreviousValue(cut(p == null ? null : p.previousValue(), VALUE_MAX, "previousValue", event));
        e.setCurrentValue(cut(p == null ? null : p.currentValue(), VALUE_MAX, "currentValue", event));
        String message = (p == null || p.message() == null) ? event.type().code() : p.message();
        e.setMessage(cut(message, MESSAGE_MAX, "message", event));
        e.setCreatedAt(clock.instant());

        em.persist(e);

        long tookMs = (System.nanoTime() - t0) / 1_000_000;
        log.debug("[Alerts] persistido id={} watcherId={} type={} tookMs={}", e.getId(), event.watcherId(), e.getType(), tookMs);
    }

    private static String cut(String value, int max, String field, AlertEvent event) {
        if (value == null || value.length() <= max) return value;
        log.warn("[Alerts] campo {} truncado ({} > {}) watcherId={}", field, value.length(), max, event.watcherId());
        return value.substring(0, max);
    }
}
