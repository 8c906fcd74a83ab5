package tech.andrefsramos.product_watcher.adapters.inbound.api.dto;

public record DispatchResponse(int queued) {}
