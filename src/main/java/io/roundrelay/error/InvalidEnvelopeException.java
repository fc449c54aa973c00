package io.roundrelay.error;

/**
 * Raised when an envelope does not belong to the current run or was not built by this coordinator.
 * Always a caller bug; never retried.
 */
public final class InvalidEnvelopeException extends RoundRelayException {
    public InvalidEnvelopeException(String message) {
        super(message);
    }
}
