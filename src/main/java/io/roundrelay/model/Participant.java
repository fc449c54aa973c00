package io.roundrelay.model;

public record Participant(String address, long nodeId) {
}
