package tech.andrefsramos.product_watcher.core.application;

import java.time.Duration;

public interface ThrottleCoordinator {

    /** Tempo de espera antes de poder requisitar o domínio; zero se pode prosseguir agora. */
    Duration canProceed(String domain);

    /**
     * Verifica e reserva o próximo slot do domínio numa única operação atômica.
     * O chamador deve aguardar a duração retornada antes de requisitar.
     */
    Duration reserveSlot(String domain);

    void recordSuccess(String domain);

    void recordFailure(String domain);

    /** Registra a requisição sem alterar a contagem de erros. */
    void recordAttempt(String domain);

    Duration currentDelay(String domain);

    int errorCount(String domain);

    void reset(String domain);

    int evictExpired();

    boolean acquireFetchPermit(Duration timeout) throws InterruptedException;

    void releaseFetchPermit();
}
