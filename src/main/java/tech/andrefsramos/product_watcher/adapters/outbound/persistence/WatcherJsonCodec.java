package tech.andrefsramos.product_watcher.adapters.outbound.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tech.andrefsramos.product_watcher.core.domain.ProductSnapshot;
import tech.andrefsramos.product_watcher.core.domain.RuleSet;

/*
 * Finalidade

 * Serializa regras e último snapshot do watcher como JSON (colunas TEXT/CLOB).

 * - Escrita: falha de serialização é erro de programação e sobe como IllegalStateException.
 * - Leitura: JSON corrompido vira null com log de aviso; o watcher segue como
 *   "sem regras" ou "sem snapshot anterior" em vez de travar a verificação.
 */
@Component
public class WatcherJsonCodec {

    private static final Logger log = LoggerFactory.getLogger(WatcherJsonCodec.class);

    private final ObjectMapper objectMapper;

    public WatcherJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String writeRules(RuleSet rules) {
        return write(rules);
    }

    public RuleSet readRules(String json, String watcherId) {
        return read(json, RuleSet.class, watcherId);
    }

    public String writeSnapshot(ProductSnapshot snapshot) {
        return write(snapshot);
    }

    public ProductSnapshot readSnapshot(String json, String watcherId) {
        return read(json, ProductSnapshot.class, watcherId);
    }

    private String write(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Falha ao serializar " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type, String watcherId) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("[JPA] JSON inválido em {} watcherId={}: {}", type.getSimpleName(), watcherId, e.getOriginalMessage());
            return null;
        }
    }
}
