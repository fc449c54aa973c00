package io.roundrelay.error;

/**
 * Thrown by a {@link io.roundrelay.spi.PayloadCipher} when no key is known for the peer.
 * The transport adapter falls back to plaintext on this error instead of dropping the message.
 */
public class MissingKeyMaterialException extends RoundRelayException {
    public MissingKeyMaterialException(String message) {
        super(message);
    }
}
