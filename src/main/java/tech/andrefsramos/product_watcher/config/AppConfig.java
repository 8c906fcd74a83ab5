package tech.andrefsramos.product_watcher.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import tech.andrefsramos.product_watcher.adapters.outbound.extraction.DemoStoreAdapter;
import tech.andrefsramos.product_watcher.adapters.outbound.extraction.GenericProductAdapter;
import tech.andrefsramos.product_watcher.adapters.outbound.http.ConditionalPageFetcher;
import tech.andrefsramos.product_watcher.adapters.outbound.notify.CompositeAlertSink;
import tech.andrefsramos.product_watcher.adapters.outbound.queue.InMemoryJobQueue;
import tech.andrefsramos.product_watcher.core.application.CheckWatcherUseCase;
import tech.andrefsramos.product_watcher.core.application.DispatchDueWatchersUseCase;
import tech.andrefsramos.product_watcher.core.application.ReactivateWatcherUseCase;
import tech.andrefsramos.product_watcher.core.application.ThrottleCoordinator;
import tech.andrefsramos.product_watcher.core.application.impl.DomainThrottleService;
import tech.andrefsramos.product_watcher.core.application.impl.DueWatcherDispatchService;
import tech.andrefsramos.product_watcher.core.application.impl.ProductAdapterRegistry;
import tech.andrefsramos.product_watcher.core.application.impl.WatcherCheckService;
import tech.andrefsramos.product_watcher.core.application.impl.WatcherReactivationService;
import tech.andrefsramos.product_watcher.core.ports.AlertSink;
import tech.andrefsramos.product_watcher.core.ports.JobQueue;
import tech.andrefsramos.product_watcher.core.ports.PageFetcherPort;
import tech.andrefsramos.product_watcher.core.ports.ProductAdapter;
import tech.andrefsramos.product_watcher.core.ports.WatcherRepository;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/*
 * Finalidade

 * Composição dos casos de uso e portas do worker, com dependências explícitas via construtor.
 * Parâmetros vêm de application.yml / env (prefixo app.*); valores inválidos são ajustados
 * com aviso em log em vez de derrubar a inicialização.

 * Visão Geral dos Beans

 * - ThrottleCoordinator: backoff por domínio + semáforo global de fetches.
 * - PageFetcherPort: GET condicional (ETag/Last-Modified) via Jsoup.
 * - ProductAdapterRegistry: adapters por domínio com o genérico como fallback.
 * - AlertSink (Composite): agrega os destinos concretos (tabela de alertas, log).
 * - JobQueue: fila em memória com dedup por watcherId.
 * - CheckWatcherUseCase / DispatchDueWatchersUseCase / ReactivateWatcherUseCase.
 */

@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    /* ============================= ThrottleCoordinator ============================= */

    @Bean
    ThrottleCoordinator throttleCoordinator(
            Clock clock,
            @Value("${app.throttle.baseDelayMs:5000}") long baseDelayMs,
            @Value("${app.throttle.multiplier:2}") double multiplier,
            @Value("${app.throttle.maxDelayMs:300000}") long maxDelayMs,
            @Value("${app.throttle.errorCap:10}") int errorCap,
            @Value("${app.throttle.entryTtlSeconds:3600}") long entryTtlSeconds,
            @Value("${app.throttle.maxConcurrentFetches:10}") int maxConcurrentFetches
    ) {
        if (baseDelayMs < 0) {
            log.warn("[AppConfig] app.throttle.baseDelayMs={} inválido. Ajustando para 0.", baseDelayMs);
            baseDelayMs = 0;
        }
        if (multiplier < 1.0) {
            log.warn("[AppConfig] app.throttle.multiplier={} inválido. Ajustando para 1.", multiplier);
            multiplier = 1.0;
        }
        if (maxDelayMs < baseDelayMs) {
            log.warn("[AppConfig] app.throttle.maxDelayMs={} menor que baseDelayMs={}. Ajustando.", maxDelayMs, baseDelayMs);
            maxDelayMs = baseDelayMs;
        }
        if (errorCap < 0) {
            log.warn("[AppConfig] app.throttle.errorCap={} inválido. Ajustando para 0.", errorCap);
            errorCap = 0;
        }
        if (entryTtlSeconds < 1) {
            log.warn("[AppConfig] app.throttle.entryTtlSeconds={} inválido. Ajustando para 3600.", entryTtlSeconds);
            entryTtlSeconds = 3600;
        }
        if (maxConcurrentFetches < 1) {
            log.warn("[AppConfig] app.throttle.maxConcurrentFetches={} inválido. Ajustando para 1.", maxConcurrentFetches);
            maxConcurrentFetches = 1;
        }

        return new DomainThrottleService(
                clock,
                Duration.ofMillis(baseDelayMs),
                multiplier,
                Duration.ofMillis(maxDelayMs),
                errorCap,
                Duration.ofSeconds(entryTtlSeconds),
                maxConcurrentFetches
        );
    }

    /* ============================= PageFetcherPort ============================= */

    @Bean
    PageFetcherPort pageFetcher(
            @Value("${app.fetch.timeoutMs:30000}") int timeoutMs,
            @Value("${app.fetch.userAgent:ProductWatcherBot/1.0 (+https://andrefsramos.tech/bot)}") String userAgent,
            @Value("${app.fetch.maxBodyBytes:5242880}") int maxBodyBytes
    ) {
        if (timeoutMs < 1000) {
            log.warn("[AppConfig] app.fetch.timeoutMs={} inválido. Ajustando para 1000.", timeoutMs);
            timeoutMs = 1000;
        }
        if (maxBodyBytes < 0) {
            log.warn("[AppConfig] app.fetch.maxBodyBytes={} inválido. Ajustando para 0 (ilimitado).", maxBodyBytes);
            maxBodyBytes = 0;
        }
        log.info("[AppConfig] PageFetcherPort inicializado (timeoutMs={}, maxBodyBytes={}, userAgent='{}')",
                timeoutMs, maxBodyBytes, userAgent);
        return new ConditionalPageFetcher(userAgent, timeoutMs, maxBodyBytes);
    }

    /* ============================= Adapters ============================= */

    @Bean
    GenericProductAdapter genericProductAdapter(ObjectMapper objectMapper) {
        return new GenericProductAdapter(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "app.adapters.demo.enabled", havingValue = "true", matchIfMissing = true)
    DemoStoreAdapter demoStoreAdapter() {
        log.info("[AppConfig] DemoStoreAdapter habilitado para example.com");
        return new DemoStoreAdapter();
    }

    @Bean
    ProductAdapterRegistry productAdapterRegistry(List<ProductAdapter> adapters, GenericProductAdapter fallback) {
        return new ProductAdapterRegistry(adapters, fallback);
    }

    /* ============================= AlertSink (Composite) ============================= */

    @Bean
    @Primary
    public AlertSink alertSink(List<AlertSink> sinks) {
        List<AlertSink> delegates = (sinks == null) ? List.of() : sinks;
        delegates = delegates.stream()
                .filter(s -> !(s instanceof CompositeAlertSink))
                .toList();

        if (delegates.isEmpty()) {
            log.warn("[AppConfig] Nenhum AlertSink concreto encontrado. Alertas serão descartados.");
        } else {
            log.info("[AppConfig] AlertSinks concretos detectados: {}",
                    delegates.stream().map(s -> s.getClass().getSimpleName()).toList());
        }
        return new CompositeAlertSink(delegates);
    }

    /* ============================= JobQueue ============================= */

    @Bean
    JobQueue jobQueue() {
        return new InMemoryJobQueue();
    }

    /* ============================= Use cases ============================= */

    @Bean
    CheckWatcherUseCase checkWatcherUseCase(
            WatcherRepository watcherRepository,
            ThrottleCoordinator throttleCoordinator,
            PageFetcherPort pageFetcher,
            ProductAdapterRegistry productAdapterRegistry,
            AlertSink alertSink,
            Clock clock,
            @Value("${app.watcher.errorThreshold:5}") int errorThreshold,
            @Value("${app.worker.permitTimeoutMs:60000}") long permitTimeoutMs
    ) {
        final long t0 = System.nanoTime();
        try {
            Objects.requireNonNull(watcherRepository, "watcherRepository is required");

            if (errorThreshold < 1) {
                log.warn("[AppConfig] app.watcher.errorThreshold={} inválido. Ajustando para 1.", errorThreshold);
                errorThreshold = 1;
            }
            if (permitTimeoutMs < 0) {
                log.warn("[AppConfig] app.worker.permitTimeoutMs={} inválido. Ajustando para 0.", permitTimeoutMs);
                permitTimeoutMs = 0;
            }

            CheckWatcherUseCase bean = new WatcherCheckService(
                    watcherRepository, throttleCoordinator, pageFetcher, productAdapterRegistry,
                    alertSink, clock, errorThreshold, Duration.ofMillis(permitTimeoutMs));

            long tookMs = (System.nanoTime() - t0) / 1_000_000;
            log.info("[AppConfig] CheckWatcherUseCase inicializado (errorThreshold={}, permitTimeoutMs={}) tookMs={}ms",
                    errorThreshold, permitTimeoutMs, tookMs);
            return bean;
        } catch (RuntimeException e) {
            log.error("[AppConfig] Erro ao criar CheckWatcherUseCase: {}", e.getMessage(), e);
            throw e;
        }
    }

    @Bean
    DispatchDueWatchersUseCase dispatchDueWatchersUseCase(
            WatcherRepository watcherRepository,
            JobQueue jobQueue,
            Clock clock,
            @Value("${app.scheduler.recheckFloorSeconds:60}") long recheckFloorSeconds,
            @Value("${app.scheduler.batchLimit:100}") int batchLimit
    ) {
        if (recheckFloorSeconds < 0) {
            log.warn("[AppConfig] app.scheduler.recheckFloorSeconds={} inválido. Ajustando para 0.", recheckFloorSeconds);
            recheckFloorSeconds = 0;
        }
        if (batchLimit < 1) {
            log.warn("[AppConfig] app.scheduler.batchLimit={} inválido. Ajustando para 1.", batchLimit);
            batchLimit = 1;
        }
        log.info("[AppConfig] DispatchDueWatchersUseCase inicializado (recheckFloorSeconds={}, batchLimit={})",
                recheckFloorSeconds, batchLimit);
        return new DueWatcherDispatchService(
                watcherRepository, jobQueue, clock, Duration.ofSeconds(recheckFloorSeconds), batchLimit);
    }

    @Bean
    ReactivateWatcherUseCase reactivateWatcherUseCase(WatcherRepository watcherRepository) {
        return new WatcherReactivationService(watcherRepository);
    }
}
