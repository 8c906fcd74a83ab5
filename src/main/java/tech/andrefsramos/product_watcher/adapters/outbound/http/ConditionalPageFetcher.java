package tech.andrefsramos.product_watcher.adapters.outbound.http;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.product_watcher.core.domain.CacheValidator;
import tech.andrefsramos.product_watcher.core.domain.FetchFailureKind;
import tech.andrefsramos.product_watcher.core.domain.FetchResult;
import tech.andrefsramos.product_watcher.core.ports.PageFetcherPort;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.MalformedURLException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ConditionalPageFetcher

 * Finalidade

 * Executa um único GET condicional (sem retry) com timeout rígido, usando Jsoup:
 *   - Cabeçalhos fixos: User-Agent descritivo, Accept e Accept-Language.
 *   - Se houver validador em cache para a URL: If-None-Match (ETag) e/ou If-Modified-Since.
 *   - 304 vira {@link FetchResult.Kind#UNCHANGED}; 2xx vira FETCHED com os validadores novos.
 *   - Qualquer outro status, erro de rede ou timeout vira FAILED tipado (sem stack trace).

 * O retry fica a cargo do agendador e do backoff por domínio; aqui não há segunda tentativa.
 * O cache de validadores é volátil: perdê-lo só reduz a taxa de 304.
 */
public class ConditionalPageFetcher implements PageFetcherPort {

    private static final Logger log = LoggerFactory.getLogger(ConditionalPageFetcher.class);

    private static final String ACCEPT =
            "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    private static final String ACCEPT_LANG =
            "en-US,en;q=0.9";

    private final Map<String, CacheValidator> validators = new ConcurrentHashMap<>();
    private final String userAgent;
    private final int timeoutMs;
    private final int maxBodyBytes;

    public ConditionalPageFetcher(String userAgent, int timeoutMs, int maxBodyBytes) {
        this.userAgent = userAgent;
        this.timeoutMs = timeoutMs;
        this.maxBodyBytes = maxBodyBytes;
    }

    @Override
    public FetchResult fetch(String url) {
        return fetch(url, validators.get(url));
    }

    @Override
    public FetchResult fetch(String url, CacheValidator cachedValidator) {
        long start = System.nanoTime();
        try {
            Connection conn = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .timeout(timeoutMs)
                    .maxBodySize(maxBodyBytes)
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .header("Accept", ACCEPT)
                    .header("Accept-Language", ACCEPT_LANG)
                    .method(Connection.Method.GET);

            if (cachedValidator != null && !cachedValidator.isEmpty()) {
                if (cachedValidator.etag() != null && !cachedValidator.etag().isBlank()) {
                    conn.header("If-None-Match", cachedValidator.etag());
                }
                if (cachedValidator.lastModified() != null && !cachedValidator.lastModified().isBlank()) {
                    conn.header("If-Modified-Since", cachedValidator.lastModified());
                }
            }

            Connection.Response r = conn.execute();
            int code = r.statusCode();
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            if (code == 304) {
                log.debug("[Fetch] 304 Not Modified url={} elapsedMs={}ms", url, elapsedMs);
                return FetchResult.unchanged();
            }

            if (code >= 200 && code < 300) {
                String body = r.body();
                // validadores só entram no cache depois que o corpo foi lido por completo
                CacheValidator fresh = new CacheValidator(r.header("ETag"), r.header("Last-Modified"));
                if (fresh.isEmpty()) {
                    validators.remove(url);
                } else {
                    validators.put(url, fresh);
                }
                if (log.isDebugEnabled()) {
                    log.debug("[Fetch] sucesso url={} status={} bytes={} etag={} elapsedMs={}ms",
                            url, code, body == null ? 0 : body.length(), fresh.etag(), elapsedMs);
                }
                return FetchResult.fetched(body, fresh, code);
            }

            FetchFailureKind kind = classifyStatus(code);
            log.warn("[Fetch] status não-2xx url={} status={} kind={} elapsedMs={}ms", url, code, kind, elapsedMs);
            return FetchResult.failed(kind, code, "HTTP " + code);

        } catch (SocketTimeoutException ex) {
            return failure(url, start, FetchFailureKind.TRANSIENT, "timeout after " + timeoutMs + " ms");
        } catch (MalformedURLException | IllegalArgumentException ex) {
            return failure(url, start, FetchFailureKind.PERMANENT, "malformed url: " + ex.getClass().getSimpleName());
        } catch (UnknownHostException | ConnectException ex) {
            return failure(url, start, FetchFailureKind.TRANSIENT, "connection error: " + ex.getClass().getSimpleName());
        } catch (IOException ex) {
            return failure(url, start, FetchFailureKind.TRANSIENT, "io error: " + ex.getClass().getSimpleName());
        } catch (UncheckedIOException ex) {
            return failure(url, start, FetchFailureKind.TRANSIENT, "io error while reading body: "
                    + ex.getCause().getClass().getSimpleName());
        }
    }

    public CacheValidator cachedValidator(String url) {
        return validators.get(url);
    }

    public void forget(String url) {
        validators.remove(url);
    }

    /*
     * 5xx, 408 (timeout), 429 (rate limit) e 401/403/407 (autenticação) são tratados como
     * transitórios; os demais 4xx e 3xx não seguidos como permanentes.
     */
    static FetchFailureKind classifyStatus(int code) {
        if (code >= 500) return FetchFailureKind.TRANSIENT;
        if (code == 408 || code == 429 || code == 401 || code == 403 || code == 407) return FetchFailureKind.TRANSIENT;
        return FetchFailureKind.PERMANENT;
    }

    private FetchResult failure(String url, long start, FetchFailureKind kind, String reason) {
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        log.warn("[Fetch] falha url={} kind={} reason='{}' elapsedMs={}ms", url, kind, reason, elapsedMs);
        return FetchResult.failed(kind, -1, reason);
    }
}
