package tech.andrefsramos.product_watcher.core.domain;

/*
 * TRANSIENT: timeout, erro de conexão, 5xx.
 * PERMANENT: 4xx, URL malformada.

 * Ambos contam igualmente para backoff e erro do watcher; a distinção serve apenas para log.
 */
public enum FetchFailureKind {
    TRANSIENT,
    PERMANENT
}
