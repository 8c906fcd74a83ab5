package tech.andrefsramos.product_watcher.adapters.outbound.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.product_watcher.core.domain.CheckJob;
import tech.andrefsramos.product_watcher.core.ports.JobQueue;

import java.time.Duration;
import java.util.Comparator;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/*
 * Finalidade

 * Fila de jobs em memória do processo, ordenada por prioridade (menor primeiro) e, em empate,
 * por ordem de chegada.

 * - Um watcherId fica "pendente" do enqueue até o complete(), cobrindo tanto o tempo na fila
 *   quanto a execução. Enquanto pendente, novos enqueue do mesmo id são ignorados.
 * - claim() ocupa o mesmo conjunto de pendentes sem enfileirar (verificação manual): o agendador
 *   e os workers não disparam outra verificação do mesmo watcher enquanto ela roda.
 * - O conteúdo é volátil: num restart o agendador volta a despachar a partir do estado persistido.
 */
public class InMemoryJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobQueue.class);

    private static final Comparator<Queued> ORDER =
            Comparator.comparingInt((Queued q) -> q.job().priority()).thenComparingLong(Queued::seq);

    private final PriorityBlockingQueue<Queued> queue = new PriorityBlockingQueue<>(64, ORDER);
    private final Set<String> pending = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public boolean enqueueUnique(CheckJob job) {
        if (job == null || job.watcherId() == null) {
            throw new IllegalArgumentException("job e watcherId são obrigatórios");
        }
        if (!pending.add(job.watcherId())) {
            return false;
        }
        queue.offer(new Queued(job, sequence.incrementAndGet()));
        return true;
    }

    @Override
    public boolean isPending(String watcherId) {
        return watcherId != null && pending.contains(watcherId);
    }

    @Override
    public boolean claim(String watcherId) {
        if (watcherId == null || watcherId.isBlank()) {
            throw new IllegalArgumentException("watcherId é obrigatório");
        }
        return pending.add(watcherId);
    }

    @Override
    public Optional<CheckJob> take(Duration timeout) throws InterruptedException {
        Queued q = queue.poll(Math.max(timeout.toMillis(), 0), TimeUnit.MILLISECONDS);
        return Optional.ofNullable(q).map(Queued::job);
    }

    @Override
    public void complete(String watcherId) {
        if (watcherId != null && !pending.remove(watcherId)) {
            log.debug("[Queue] complete() para watcherId={} que não estava pendente", watcherId);
        }
    }

    @Override
    public int size() {
        return queue.size();
    }

    public int pendingCount() {
        return pending.size();
    }

    private record Queued(CheckJob job, long seq) {}
}
