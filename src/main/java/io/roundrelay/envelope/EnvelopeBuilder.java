package io.roundrelay.envelope;

import io.roundrelay.error.InvalidEnvelopeException;
import io.roundrelay.error.RunNotStartedException;
import io.roundrelay.identity.IdentityMapper;
import io.roundrelay.model.MessageEnvelope;
import io.roundrelay.model.Participant;
import io.roundrelay.model.RunContext;

import java.util.concurrent.atomic.AtomicReference;

public final class EnvelopeBuilder {
    private final IdentityMapper identityMapper;
    private final long defaultTtlSeconds;
    private final AtomicReference<RunContext> runContext;

    public EnvelopeBuilder(IdentityMapper identityMapper, long defaultTtlSeconds) {
        if (defaultTtlSeconds <= 0L) {
            throw new IllegalArgumentException("defaultTtlSeconds must be > 0: " + defaultTtlSeconds);
        }
        this.identityMapper = identityMapper;
        this.defaultTtlSeconds = defaultTtlSeconds;
        this.runContext = new AtomicReference<>();
    }

    public RunContext startRun(long runId) {
        RunContext created = new RunContext(runId);
        if (!runContext.compareAndSet(null, created)) {
            throw new IllegalStateException(
                    "Run already started with id " + runContext.get().runId() + "; cannot switch to " + runId);
        }
        return created;
    }

    public RunContext runContext() {
        RunContext current = runContext.get();
        if (current == null) {
            throw new RunNotStartedException();
        }
        return current;
    }

    public boolean runStarted() {
        return runContext.get() != null;
    }

    public MessageEnvelope build(byte[] payload, String messageType, String dstAddress, String groupId) {
        return build(payload, messageType, dstAddress, groupId, null);
    }

    public MessageEnvelope build(byte[] payload, String messageType, String dstAddress, String groupId, Long ttlSeconds) {
        Participant destination = identityMapper.participant(dstAddress);
        long runId = runContext().runId();
        if (messageType == null || messageType.isBlank()) {
            throw new InvalidEnvelopeException("messageType cannot be blank");
        }
        long ttl = ttlSeconds == null ? defaultTtlSeconds : ttlSeconds;
        if (ttl <= 0L) {
            throw new InvalidEnvelopeException("ttlSeconds must be > 0 (current: " + ttl + ")");
        }
        return MessageEnvelope.request(
                runId,
                identityMapper.coordinatorNodeId(),
                destination.nodeId(),
                groupId,
                ttl,
                messageType,
                payload
        );
    }

    public void validate(MessageEnvelope envelope) {
        if (envelope == null) {
            throw new InvalidEnvelopeException("envelope cannot be null");
        }
        long currentRun = runContext().runId();
        if (envelope.runId() != currentRun) {
            throw new InvalidEnvelopeException(
                    "runId " + envelope.runId() + " does not match current run " + currentRun + ": " + envelope);
        }
        if (envelope.srcNodeId() != identityMapper.coordinatorNodeId()) {
            throw new InvalidEnvelopeException(
                    "srcNodeId " + envelope.srcNodeId() + " is not this coordinator ("
                            + identityMapper.coordinatorNodeId() + "): " + envelope);
        }
        if (!envelope.messageId().isEmpty()) {
            throw new InvalidEnvelopeException("messageId must be empty before submission: " + envelope);
        }
        if (!envelope.replyToMessageId().isEmpty()) {
            throw new InvalidEnvelopeException("replyToMessageId must be empty for a request: " + envelope);
        }
        if (envelope.ttlSeconds() <= 0L) {
            throw new InvalidEnvelopeException("ttlSeconds must be > 0: " + envelope);
        }
    }
}
