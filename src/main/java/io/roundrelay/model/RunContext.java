package io.roundrelay.model;

public record RunContext(long runId) {
}
