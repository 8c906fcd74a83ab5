package tech.andrefsramos.product_watcher.core.domain;

/*
 * Finalidade

 * Resultado de um GET condicional:
 *  - FETCHED:   corpo + validadores novos.
 *  - UNCHANGED: origem respondeu 304; nenhum corpo, nada a processar.
 *  - FAILED:    falha tipada com código HTTP (ou -1) e motivo curto (nunca stack trace).
 */
public record FetchResult(
        Kind kind,
        String body,
        CacheValidator validator,
        FetchFailureKind failureKind,
        int statusCode,
        String reason
) {

    public enum Kind { FETCHED, UNCHANGED, FAILED }

    public static FetchResult fetched(String body, CacheValidator validator, int statusCode) {
        return new FetchResult(Kind.FETCHED, body, validator, null, statusCode, null);
    }

    public static FetchResult unchanged() {
        return new FetchResult(Kind.UNCHANGED, null, null, null, 304, null);
    }

    public static FetchResult failed(FetchFailureKind failureKind, int statusCode, String reason) {
        return new FetchResult(Kind.FAILED, null, null, failureKind, statusCode, reason);
    }

    public boolean isFailure() {
        return kind == Kind.FAILED;
    }
}
