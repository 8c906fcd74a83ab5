package tech.andrefsramos.product_watcher.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.product_watcher.core.domain.DomainNames;
import tech.andrefsramos.product_watcher.core.ports.ProductAdapter;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/*
 * Finalidade

 * Resolve o {@link ProductAdapter} responsável por um domínio:
 *  1) Correspondência exata ("shop.com").
 *  2) Curinga pelo sufixo mais longo ("*.eu.shop.com" vence "*.shop.com" para "x.eu.shop.com").
 *     O curinga não cobre o domínio nu: "*.shop.com" não atende "shop.com".
 *  3) Adapter genérico (fallback).

 * A tabela é montada uma vez no construtor; em caso de conflito o primeiro adapter registrado vence.
 */
public class ProductAdapterRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProductAdapterRegistry.class);

    private final Map<String, ProductAdapter> exact = new HashMap<>();
    private final Map<String, ProductAdapter> wildcardSuffixes = new LinkedHashMap<>();
    private final ProductAdapter fallback;

    public ProductAdapterRegistry(List<ProductAdapter> adapters, ProductAdapter fallback) {
        this.fallback = Objects.requireNonNull(fallback, "fallback adapter is required");

        Map<String, ProductAdapter> wildcards = new HashMap<>();
        for (ProductAdapter adapter : adapters == null ? List.<ProductAdapter>of() : adapters) {
            if (adapter == fallback) continue;
            for (String pattern : adapter.domains()) {
                register(adapter, pattern, wildcards);
            }
        }

        wildcards.entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, ProductAdapter> en) -> en.getKey().length()).reversed())
                .forEachOrdered(en -> wildcardSuffixes.put(en.getKey(), en.getValue()));

        log.info("[Adapters] registro montado: exatos={} curingas={} fallback={}",
                exact.keySet(), wildcardSuffixes.keySet(), fallback.getClass().getSimpleName());
    }

    public ProductAdapter resolve(String domain) {
        String d = DomainNames.normalize(domain);

        ProductAdapter a = exact.get(d);
        if (a != null) {
            return a;
        }

        for (Map.Entry<String, ProductAdapter> en : wildcardSuffixes.entrySet()) {
            if (d.endsWith(en.getKey())) {
                return en.getValue();
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("[Adapters] nenhum adapter específico para domain={}, usando {}",
                    d, fallback.getClass().getSimpleName());
        }
        return fallback;
    }

    public ProductAdapter fallback() {
        return fallback;
    }

    private void register(ProductAdapter adapter, String pattern, Map<String, ProductAdapter> wildcards) {
        if (pattern == null || pattern.isBlank()) return;
        String p = pattern.trim();
        if (p.startsWith("*.")) {
            String suffix = "." + DomainNames.normalize(p.substring(2));
            if (wildcards.putIfAbsent(suffix, adapter) != null) {
                log.warn("[Adapters] curinga duplicado '{}' ignorado para {}", p, adapter.getClass().getSimpleName());
            }
        } else {
            String d = DomainNames.normalize(p);
            if (exact.putIfAbsent(d, adapter) != null) {
                log.warn("[Adapters] domínio duplicado '{}' ignorado para {}", d, adapter.getClass().getSimpleName());
            }
        }
    }
}
