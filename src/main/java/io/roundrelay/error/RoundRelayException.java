package io.roundrelay.error;

public class RoundRelayException extends RuntimeException {
    public RoundRelayException(String message) {
        super(message);
    }

    public RoundRelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
