package io.roundrelay.spi;

import java.util.Optional;

/**
 * Store-and-forward transport the orchestrator writes requests to and polls responses from.
 *
 * <p>Implementations must be safe for concurrent use by several orchestrators. Repeated {@link #get} calls
 * for the same id return the same bytes until {@link #release} is called.
 */
public interface Transport {

    /**
     * Writes a request for {@code recipientAddress} keyed by {@code correlationId}.
     *
     * @throws RuntimeException when the request could not be written
     */
    void put(String correlationId, String recipientAddress, byte[] body);

    /**
     * Returns the response body for {@code correlationId}, or empty while none has arrived.
     */
    Optional<byte[]> get(String correlationId);

    /**
     * Drops the request and any response kept for {@code correlationId}.
     */
    default void release(String correlationId) {
    }
}
