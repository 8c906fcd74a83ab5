package tech.andrefsramos.product_watcher.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/*
 * Finalidade

 * Habilita o Spring Scheduling para o laço do agendador ({@code DispatchScheduler}) e a limpeza
 * periódica do throttle ({@code ThrottleEvictionJob}). O pool de threads do scheduler é ajustado
 * em application.yml (spring.task.scheduling.pool.size) para que um job não atrase o outro.
 */

@Configuration
@EnableScheduling
public class SchedulingConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    public SchedulingConfig() {
        log.info("[Scheduling] Scheduler global ativado: agendador de watchers e limpeza de throttle.");
    }
}
