package tech.andrefsramos.product_watcher.core.domain;

/**
 * Validadores de cache HTTP devolvidos pela origem. ETag tem preferência sobre Last-Modified.
 */
public record CacheValidator(String etag, String lastModified) {

    public boolean isEmpty() {
        return (etag == null || etag.isBlank()) && (lastModified == null || lastModified.isBlank());
    }
}
