package tech.andrefsramos.product_watcher.core.ports;

import tech.andrefsramos.product_watcher.core.domain.CacheValidator;
import tech.andrefsramos.product_watcher.core.domain.FetchResult;

public interface PageFetcherPort {

    FetchResult fetch(String url);

    FetchResult fetch(String url, CacheValidator cachedValidator);
}
