package io.roundrelay.transport;

import io.roundrelay.error.EnvelopeCodecException;
import io.roundrelay.error.MissingKeyMaterialException;
import io.roundrelay.model.MessageEnvelope;
import io.roundrelay.model.Participant;
import io.roundrelay.model.PendingCorrelation;
import io.roundrelay.spi.EnvelopeCodec;
import io.roundrelay.spi.PayloadCipher;
import io.roundrelay.spi.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;

public final class TransportAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(TransportAdapter.class);

    private final Transport transport;
    private final EnvelopeCodec codec;
    private final PayloadCipher cipher;
    private final boolean encryptionEnabled;

    public TransportAdapter(Transport transport, EnvelopeCodec codec) {
        this(transport, codec, null, false);
    }

    public TransportAdapter(Transport transport, EnvelopeCodec codec, PayloadCipher cipher, boolean encryptionEnabled) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.transport = transport;
        this.codec = codec;
        this.cipher = cipher;
        this.encryptionEnabled = encryptionEnabled && cipher != null;
        if (encryptionEnabled && cipher == null) {
            LOG.warn("Encryption requested but no payload cipher configured; messages will be sent in plaintext");
        }
    }

    public boolean encryptionEnabled() {
        return encryptionEnabled;
    }

    /**
     * Sends {@code envelope} to {@code destination} and returns the correlation id to poll, or empty when this
     * destination had to be skipped. Never throws for per-destination problems.
     */
    public Optional<PendingCorrelation> submit(MessageEnvelope envelope, Participant destination) {
        String correlationId = UUID.randomUUID().toString();
        byte[] plaintext;
        try {
            plaintext = codec.encode(envelope.withMessageId(correlationId));
        } catch (RuntimeException e) {
            LOG.error("Failed to encode message for {} (node {}); skipping destination",
                    destination.address(), destination.nodeId(), e);
            return Optional.empty();
        }

        byte[] body = plaintext;
        boolean encrypted = false;
        if (encryptionEnabled) {
            try {
                body = cipher.encrypt(plaintext, destination.address());
                encrypted = true;
            } catch (MissingKeyMaterialException | IllegalArgumentException e) {
                LOG.warn("Encryption unavailable for {} ({}); falling back to plaintext for node {}",
                        destination.address(), e.getMessage(), destination.nodeId());
                body = plaintext;
            } catch (RuntimeException e) {
                LOG.error("Encryption failed for {}; skipping node {}",
                        destination.address(), destination.nodeId(), e);
                return Optional.empty();
            }
        }

        try {
            transport.put(correlationId, destination.address(), body);
        } catch (RuntimeException e) {
            LOG.error("Failed to submit message to {}; skipping node {}",
                    destination.address(), destination.nodeId(), e);
            return Optional.empty();
        }
        LOG.debug("Pushed {} message {} to {} (type={}, group={}, {} bytes)",
                encrypted ? "encrypted" : "plaintext", correlationId, destination.address(),
                envelope.messageType(), envelope.groupId(), body.length);
        return Optional.of(new PendingCorrelation(correlationId, destination));
    }

    public ResolveResult resolve(PendingCorrelation correlation) {
        String correlationId = correlation.correlationId();
        Optional<byte[]> response;
        try {
            response = transport.get(correlationId);
        } catch (RuntimeException e) {
            LOG.warn("Transport read failed for {} from {}; will poll again: {}",
                    correlationId, correlation.destination().address(), e.getMessage());
            return ResolveResult.pending();
        }
        if (response.isEmpty()) {
            return ResolveResult.pending();
        }

        ResolveResult result = decodeResponse(correlation, response.get());
        release(correlationId);
        return result;
    }

    private ResolveResult decodeResponse(PendingCorrelation correlation, byte[] raw) {
        String correlationId = correlation.correlationId();
        String sender = correlation.destination().address();
        if (raw.length == 0) {
            LOG.warn("Empty response for message {} from {}; dropping", correlationId, sender);
            return ResolveResult.failed("empty response");
        }

        byte[] body = raw;
        if (encryptionEnabled) {
            try {
                body = cipher.decrypt(raw, sender);
                LOG.debug("Decrypted response for message {}", correlationId);
            } catch (RuntimeException e) {
                // Peers may not support encryption yet; read the bytes as plaintext.
                LOG.debug("Response for message {} treated as plaintext: {}", correlationId, e.getMessage());
                body = raw;
            }
        }

        MessageEnvelope envelope;
        try {
            envelope = codec.decode(body);
        } catch (EnvelopeCodecException e) {
            LOG.warn("Corrupt response for message {} from {}; dropping: {}", correlationId, sender, e.getMessage());
            return ResolveResult.failed("corrupt response: " + e.getMessage());
        }
        if (envelope.hasError()) {
            LOG.warn("Message {} from {} returned error code={} reason={}",
                    correlationId, sender, envelope.error().code(), envelope.error().reason());
            return ResolveResult.failed("participant error " + envelope.error().code() + ": " + envelope.error().reason());
        }
        LOG.debug("Pulled response for message {} from {} ({} bytes)", correlationId, sender, body.length);
        return ResolveResult.resolved(envelope);
    }

    private void release(String correlationId) {
        try {
            transport.release(correlationId);
        } catch (RuntimeException e) {
            LOG.warn("Failed to release correlation {}: {}", correlationId, e.getMessage());
        }
    }
}
