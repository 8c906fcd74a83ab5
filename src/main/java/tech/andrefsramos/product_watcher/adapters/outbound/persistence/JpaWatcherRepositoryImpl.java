package tech.andrefsramos.product_watcher.adapters.outbound.persistence;

import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tech.andrefsramos.product_watcher.adapters.outbound.persistence.entity.WatcherEntity;
import tech.andrefsramos.product_watcher.core.domain.Watcher;
import tech.andrefsramos.product_watcher.core.domain.WatcherOutcome;
import tech.andrefsramos.product_watcher.core.domain.WatcherStatus;
import tech.andrefsramos.product_watcher.core.ports.WatcherRepository;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/*
 * JpaWatcherRepositoryImpl

 * Finalidade

 * Implementação JPA do porto de watchers. O cadastro (CRUD) dos watchers é feito por outro
 * serviço; aqui só existem as leituras do agendador/processador e a escrita do delta pós-verificação.

 * Como funciona

 * - findDue: ACTIVE com lastCheckAt nulo ou anterior ao corte, nulos primeiro e depois os mais antigos.
 * - recordOutcome: carrega a linha com PESSIMISTIC_WRITE e aplica o delta na mesma transação
 *   (atomicidade por linha). Sucesso zera errorCount; falha incrementa e, se a nova contagem
 *   atingir o limite do outcome, move o watcher para ERROR.
 * - Todas as consultas levam hint de timeout (app.repository.queryTimeoutMs).
 */

@Repository
public class JpaWatcherRepositoryImpl implements WatcherRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaWatcherRepositoryImpl.class);
    private static final String QUERY_TIMEOUT_HINT = "jakarta.persistence.query.timeout";
    private static final String LOCK_TIMEOUT_HINT = "jakarta.persistence.lock.timeout";

    @PersistenceContext
    private EntityManager em;

    private final WatcherJsonCodec codec;
    private final int queryTimeoutMs;

    public JpaWatcherRepositoryImpl(
            WatcherJsonCodec codec,
            @Value("${app.repository.queryTimeoutMs:10000}") int queryTimeoutMs
    ) {
        this.codec = codec;
        this.queryTimeoutMs = Math.max(queryTimeoutMs, 1);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Watcher> findDue(Instant notCheckedSince, int limit) {
        long t0 = System.nanoTime();
        if (notCheckedSince == null) {
            throw new IllegalArgumentException("notCheckedSince é obrigatório em findDue()");
        }
        int lim = Math.min(Math.max(limit, 1), 1000);

        String jpql = """
          SELECT w FROM WatcherEntity w
          WHERE w.status = :active
            AND (w.lastCheckAt IS NULL OR w.lastCheckAt < :cutoff)
          ORDER BY w.lastCheckAt ASC NULLS FIRST, w.id ASC
        """;
        TypedQuery<WatcherEntity> q = em.createQuery(jpql, WatcherEntity.class);
        q.setParameter("active", WatcherStatus.ACTIVE);
        q.setParameter("cutoff", notCheckedSince);
        q.setHint(QUERY_TIMEOUT_HINT, queryTimeoutMs);
        q.setMaxResults(lim);

        List<Watcher> out = q.getResultList().stream().map(this::toDomain).toList();

        long tookMs = (System.nanoTime() - t0) / 1_000_000;
        log.debug("[JPA] findDue cutoff={} limit={} resultados={} tookMs={}", notCheckedSince, lim, out.size(), tookMs);
        return out;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Watcher> findById(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        WatcherEntity e = em.find(WatcherEntity.class, id, Map.of(QUERY_TIMEOUT_HINT, queryTimeoutMs));
        return Optional.ofNullable(e).map(this::toDomain);
    }

    @Override
    @Transactional
    public void recordOutcome(String id, WatcherOutcome outcome) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id é obrigatório em recordOutcome()");
        }
        if (outcome == null || outcome.checkedAt() == null) {
            throw new IllegalArgumentException("outcome.checkedAt é obrigatório em recordOutcome()");
        }
        long t0 = System.nanoTime();

        WatcherEntity e = em.find(WatcherEntity.class, id, LockModeType.PESSIMISTIC_WRITE,
                Map.of(LOCK_TIMEOUT_HINT, queryTimeoutMs));
        if (e == null) {
            log.warn("[JPA] recordOutcome: watcher id={} não existe mais; delta descartado.", id);
            return;
        }

        e.setLastCheckAt(outcome.checkedAt());
        if (outcome.success()) {
            e.setErrorCount(0);
            if (outcome.snapshot() != null) {
                e.setLastSnapshotJson(codec.writeSnapshot(outcome.snapshot()));
            }
            if (outcome.alerted()) {
                e.setLastAlertAt(outcome.checkedAt());
            }
        } else {
            int errors = e.getErrorCount() + Math.max(outcome.errorIncrement(), 0);
            e.setErrorCount(errors);
            if (e.getStatus() == WatcherStatus.ACTIVE && outcome.reachesThreshold(errors)) {
                e.setStatus(WatcherStatus.ERROR);
                log.warn("[JPA] watcher id={} atingiu {} falhas consecutivas; status -> ERROR", id, errors);
            }
        }

        long tookMs = (System.nanoTime() - t0) / 1_000_000;
        log.debug("[JPA] recordOutcome id={} success={} errorCount={} status={} tookMs={}",
                id, outcome.success(), e.getErrorCount(), e.getStatus(), tookMs);
    }

    @Override
    @Transactional
    public boolean reactivate(String id) {
        WatcherEntity e = (id == null) ? null : em.find(WatcherEntity.class, id, LockModeType.PESSIMISTIC_WRITE,
                Map.of(LOCK_TIMEOUT_HINT, queryTimeoutMs));
        if (e == null) {
            return false;
        }
        WatcherStatus before = e.getStatus();
        e.setStatus(WatcherStatus.ACTIVE);
        e.setErrorCount(0);
        log.info("[JPA] reactivate id={} status {} -> ACTIVE", id, before);
        return true;
    }

    private Watcher toDomain(WatcherEntity e) {
        return new Watcher(
                e.getId(),
                e.getUrl(),
                e.getDomain(),
                codec.readRules(e.getRulesJson(), e.getId()),
                e.getIntervalSeconds(),
                e.getStatus(),
                e.getLastCheckAt(),
                e.getLastAlertAt(),
                e.getErrorCount(),
                codec.readSnapshot(e.getLastSnapshotJson(), e.getId())
        );
    }
}
