package tech.andrefsramos.product_watcher.core.ports;

import tech.andrefsramos.product_watcher.core.domain.CheckJob;

import java.time.Duration;
import java.util.Optional;

public interface JobQueue {

    /** No-op (retorna false) se já existe job enfileirado ou ativo para o mesmo watcherId. */
    boolean enqueueUnique(CheckJob job);

    boolean isPending(String watcherId);

    /**
     * Marca o watcherId como em execução sem enfileirar job, para verificações fora da fila.
     * Retorna false se já há job pendente; quem obteve o claim libera com {@link #complete(String)}.
     */
    boolean claim(String watcherId);

    Optional<CheckJob> take(Duration timeout) throws InterruptedException;

    void complete(String watcherId);

    int size();
}
