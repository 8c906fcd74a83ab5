package tech.andrefsramos.product_watcher.adapters.inbound.api.dto;

public record ThrottleStatusResponse(String domain, int errorCount, long currentDelayMs, long waitMs) {}
