package tech.andrefsramos.product_watcher.core.domain;

/**
 * Unidade efêmera de despacho. A identidade é o watcherId: no máximo um job
 * enfileirado ou em execução por watcher.
 */
public record CheckJob(String watcherId, String url, String domain, int priority) {}
