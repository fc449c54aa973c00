package io.roundrelay.model;

public record ErrorInfo(long code, String reason) {
    public ErrorInfo {
        reason = reason == null ? "" : reason;
    }
}
