package tech.andrefsramos.product_watcher.core.domain;

/**
 * Fato imutável produzido pela avaliação de regras. O core apenas constrói o evento;
 * persistência e entrega ficam com o {@code AlertSink}.
 */
public record AlertEvent(String watcherId, AlertType type, AlertPayload payload) {}
