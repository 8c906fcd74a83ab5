package tech.andrefsramos.product_watcher.core.domain;

public enum CheckStatus {
    SUCCESS(true, false),
    UNCHANGED(true, false),
    FETCH_FAILED(false, true),
    PARSE_FAILED(false, true),
    ERROR(false, true),
    NOT_ACTIVE(false, false),
    NOT_FOUND(false, false),
    SKIPPED(false, false),
    CANCELLED(false, false);

    private final boolean success;
    private final boolean countedAsFailure;

    CheckStatus(boolean success, boolean countedAsFailure) {
        this.success = success;
        this.countedAsFailure = countedAsFailure;
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isCountedAsFailure() {
        return countedAsFailure;
    }
}
