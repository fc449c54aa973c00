package io.roundrelay.transport;

import io.roundrelay.error.TransportException;
import io.roundrelay.spi.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Store-and-forward over a folder that an external sync tool replicates between coordinator and participants.
 * Requests are tracked in memory, so responses to requests written before a restart are not picked up.
 *
 * <p>A correlation stays tracked until it is released. Requests that time out and fire-and-forget stop
 * envelopes are never released by the orchestrator; call {@link #forgetPending()} at the end of a run to drop
 * them from memory. Their files stay on disk for the participants and the sync tool.
 */
public final class DirectoryTransport implements Transport {
    private static final Logger LOG = LoggerFactory.getLogger(DirectoryTransport.class);

    private final DirectoryLayout layout;
    private final String senderAddress;
    private final ConcurrentMap<String, Path> pendingRequests;

    public DirectoryTransport(DirectoryLayout layout, String senderAddress) {
        if (layout == null) {
            throw new IllegalArgumentException("layout cannot be null");
        }
        if (senderAddress == null || senderAddress.isBlank()) {
            throw new IllegalArgumentException("senderAddress cannot be blank");
        }
        this.layout = layout;
        this.senderAddress = senderAddress.trim();
        this.pendingRequests = new ConcurrentHashMap<>();
    }

    @Override
    public void put(String correlationId, String recipientAddress, byte[] body) {
        Path requestFile = layout.requestFile(recipientAddress, senderAddress, correlationId);
        try {
            DirectoryLayout.writeAtomically(requestFile, body);
        } catch (IOException e) {
            throw new TransportException("Failed to write request " + correlationId + " for " + recipientAddress, e);
        }
        pendingRequests.put(correlationId, requestFile);
        LOG.debug("Wrote request {} to {}", correlationId, requestFile);
    }

    @Override
    public Optional<byte[]> get(String correlationId) {
        Path requestFile = pendingRequests.get(correlationId);
        if (requestFile == null) {
            LOG.warn("Unknown correlation id {}", correlationId);
            return Optional.empty();
        }
        Path responseFile = DirectoryLayout.responseFileFor(requestFile);
        try {
            return Optional.of(Files.readAllBytes(responseFile));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new TransportException("Failed to read response " + responseFile, e);
        }
    }

    @Override
    public void release(String correlationId) {
        Path requestFile = pendingRequests.remove(correlationId);
        if (requestFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(requestFile);
            Files.deleteIfExists(DirectoryLayout.responseFileFor(requestFile));
        } catch (IOException e) {
            throw new TransportException("Failed to clean up files for " + correlationId, e);
        }
        LOG.debug("Released correlation {}", correlationId);
    }

    public DirectoryLayout layout() {
        return layout;
    }

    public String senderAddress() {
        return senderAddress;
    }

    /**
     * Stops tracking every outstanding correlation without touching the files.
     *
     * @return the number of correlations dropped
     */
    public int forgetPending() {
        int dropped = 0;
        for (String correlationId : pendingRequests.keySet()) {
            if (pendingRequests.remove(correlationId) != null) {
                dropped++;
            }
        }
        if (dropped > 0) {
            LOG.debug("Forgot {} unreleased correlation(s)", dropped);
        }
        return dropped;
    }

    public int pendingCount() {
        return pendingRequests.size();
    }
}
