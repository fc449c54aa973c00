package io.roundrelay.error;

public final class EnvelopeCodecException extends RoundRelayException {
    public EnvelopeCodecException(String message) {
        super(message);
    }

    public EnvelopeCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
