package tech.andrefsramos.product_watcher.core.domain;

public enum AlertType {
    PRICE_CHANGE("price_change"),
    BACK_IN_STOCK("back_in_stock"),
    SIZE_AVAILABLE("size_available");

    private final String code;

    AlertType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
