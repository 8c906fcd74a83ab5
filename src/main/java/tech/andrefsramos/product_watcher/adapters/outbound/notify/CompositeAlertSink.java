package tech.andrefsramos.product_watcher.adapters.outbound.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.product_watcher.core.domain.AlertEvent;
import tech.andrefsramos.product_watcher.core.ports.AlertSink;

import java.util.List;

/*
 * CompositeAlertSink

 * Finalidade

 * Composite de {@link AlertSink}: repassa cada alerta a todos os destinos configurados
 * (tabela de alertas, log, ...). A falha de um destino é registrada e não impede os demais.

 * Se todos os destinos falharem, lança IllegalStateException para que o chamador registre
 * a perda do alerta.
 */

public class CompositeAlertSink implements AlertSink {

    private static final Logger log = LoggerFactory.getLogger(CompositeAlertSink.class);
    private final List<AlertSink> delegates;

    public CompositeAlertSink(List<AlertSink> delegates) {
        this.delegates = delegates != null ? List.copyOf(delegates) : List.of();
        log.info("CompositeAlertSink inicializado com {} destinos de alerta.", this.delegates.size());
    }

    @Override
    public void emit(AlertEvent event) {
        if (delegates.isEmpty()) {
            log.debug("emit: nenhum destino configurado; alerta descartado watcherId={} type={}",
                    event.watcherId(), event.type());
            return;
        }

        int failures = 0;
        for (AlertSink delegate : delegates) {
            String sinkName = delegate.getClass().getSimpleName();
            try {
                delegate.emit(event);
                log.debug("emit: alerta entregue sink={} watcherId={} type={}", sinkName, event.watcherId(), event.type());
            } catch (Exception ex) {
                failures++;
                log.warn("emit: falha no sink={} watcherId={} type={} erro={}",
                        sinkName, event.watcherId(), event.type(), ex.getMessage());
            }
        }

        if (failures == delegates.size()) {
            throw new IllegalStateException("Nenhum destino aceitou o alerta (" + failures + " falhas)");
        }
    }

    public int size() {
        return delegates.size();
    }
}
