package io.roundrelay.model;

public record PendingCorrelation(String correlationId, Participant destination) {
}
