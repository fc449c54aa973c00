package io.roundrelay.spi;

import io.roundrelay.error.MissingKeyMaterialException;

/**
 * End-to-end encryption of request and response bodies between the coordinator and one peer.
 */
public interface PayloadCipher {

    /**
     * @throws MissingKeyMaterialException when no key is known for the recipient
     * @throws IllegalArgumentException    when the recipient or its parameters are malformed
     */
    byte[] encrypt(byte[] plaintext, String recipientAddress);

    /**
     * @throws MissingKeyMaterialException when no key is known for the sender
     */
    byte[] decrypt(byte[] ciphertext, String senderAddress);
}
