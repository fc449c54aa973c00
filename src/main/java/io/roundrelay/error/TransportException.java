package io.roundrelay.error;

public final class TransportException extends RoundRelayException {
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
