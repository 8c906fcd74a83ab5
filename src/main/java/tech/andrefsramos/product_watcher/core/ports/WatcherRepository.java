package tech.andrefsramos.product_watcher.core.ports;

import tech.andrefsramos.product_watcher.core.domain.Watcher;
import tech.andrefsramos.product_watcher.core.domain.WatcherOutcome;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface WatcherRepository {

    /**
     * Watchers ACTIVE nunca verificados ou com lastCheckAt anterior a {@code notCheckedSince},
     * nunca verificados primeiro e depois os mais antigos.
     */
    List<Watcher> findDue(Instant notCheckedSince, int limit);

    Optional<Watcher> findById(String id);

    /** Atualização atômica do delta pós-verificação. */
    void recordOutcome(String id, WatcherOutcome outcome);

    /** Reset manual: status ACTIVE e errorCount zero. Retorna false se o id não existe. */
    boolean reactivate(String id);
}
