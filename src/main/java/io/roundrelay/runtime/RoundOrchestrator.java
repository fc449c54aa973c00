package io.roundrelay.runtime;

import io.roundrelay.codec.JsonEnvelopeCodec;
import io.roundrelay.config.OrchestratorConfig;
import io.roundrelay.envelope.EnvelopeBuilder;
import io.roundrelay.identity.IdentityMapper;
import io.roundrelay.model.MessageEnvelope;
import io.roundrelay.model.Participant;
import io.roundrelay.model.PendingCorrelation;
import io.roundrelay.model.RunContext;
import io.roundrelay.observability.AuditLogger;
import io.roundrelay.spi.EnvelopeCodec;
import io.roundrelay.spi.PayloadCipher;
import io.roundrelay.spi.Transport;
import io.roundrelay.transport.ResolveResult;
import io.roundrelay.transport.TransportAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Scatter/gather engine between a coordinator's round logic and a store-and-forward transport.
 *
 * <p>One instance serves one run against a fixed participant set and is driven by a single thread.
 * Only caller mistakes (malformed envelopes, unknown participants, a run that was never started) surface as
 * exceptions; per-destination failures shrink the returned result set instead.
 */
public final class RoundOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(RoundOrchestrator.class);
    private static final long MAX_TIMEOUT_NANOS = Long.MAX_VALUE / 4;

    private final OrchestratorConfig config;
    private final IdentityMapper identityMapper;
    private final EnvelopeBuilder envelopeBuilder;
    private final TransportAdapter transportAdapter;
    private final ShutdownBroadcaster shutdownBroadcaster;
    private final AuditLogger auditLogger;
    private volatile RoundSummary lastRoundSummary;

    public RoundOrchestrator(OrchestratorConfig config, Collection<String> participantAddresses, Transport transport) {
        this(config, participantAddresses, transport, new JsonEnvelopeCodec(), null, null);
    }

    public RoundOrchestrator(
            OrchestratorConfig config,
            Collection<String> participantAddresses,
            Transport transport,
            EnvelopeCodec codec,
            PayloadCipher cipher,
            AuditLogger auditLogger
    ) {
        this.config = config;
        this.identityMapper = new IdentityMapper(participantAddresses, config.coordinatorNodeId());
        this.envelopeBuilder = new EnvelopeBuilder(identityMapper, config.defaultTtlSeconds());
        this.transportAdapter = new TransportAdapter(transport, codec, cipher, config.encryptionEnabled());
        this.auditLogger = auditLogger;
        this.shutdownBroadcaster = new ShutdownBroadcaster(identityMapper, envelopeBuilder, transportAdapter, auditLogger);
        LOG.debug("Initialized orchestrator for {} participants (encryption {})",
                identityMapper.size(), transportAdapter.encryptionEnabled() ? "enabled" : "disabled");
    }

    public RunContext startRun(long runId) {
        RunContext context = envelopeBuilder.startRun(runId);
        LOG.info("Started run {} with {} participants", runId, identityMapper.size());
        audit(AuditLogger.AuditEvent.of(
                "run.start",
                runId,
                null,
                "ok",
                Map.of("participants", identityMapper.size())
        ));
        return context;
    }

    public RunContext runContext() {
        return envelopeBuilder.runContext();
    }

    public MessageEnvelope buildMessage(byte[] payload, String messageType, String dstAddress, String groupId) {
        return envelopeBuilder.build(payload, messageType, dstAddress, groupId);
    }

    public MessageEnvelope buildMessage(
            byte[] payload,
            String messageType,
            String dstAddress,
            String groupId,
            long ttlSeconds
    ) {
        return envelopeBuilder.build(payload, messageType, dstAddress, groupId, ttlSeconds);
    }

    public List<Long> listParticipantNodeIds() {
        return identityMapper.nodeIds();
    }

    public IdentityMapper identityMapper() {
        return identityMapper;
    }

    /**
     * Sends every envelope and waits, without a deadline, until each one has been answered or has failed.
     */
    public List<MessageEnvelope> sendAndReceive(List<MessageEnvelope> envelopes) {
        return sendAndReceive(envelopes, null);
    }

    /**
     * Sends every envelope, then polls for replies until all have arrived or {@code timeout} has elapsed.
     *
     * <p>A configured message timeout replaces {@code timeout}. A {@code null} timeout waits indefinitely.
     * Replies come back in no particular order; compare the size of the result with the number of envelopes
     * to detect a partial round.
     */
    public List<MessageEnvelope> sendAndReceive(List<MessageEnvelope> envelopes, Duration timeout) {
        if (envelopes == null) {
            throw new IllegalArgumentException("envelopes cannot be null");
        }
        Duration effectiveTimeout = config.messageTimeoutOverride().orElse(timeout);
        if (effectiveTimeout != null && effectiveTimeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + effectiveTimeout);
        }
        long runId = envelopeBuilder.runContext().runId();

        List<Dispatch> dispatches = new ArrayList<>(envelopes.size());
        for (MessageEnvelope envelope : envelopes) {
            envelopeBuilder.validate(envelope);
            Participant destination = identityMapper.participantFor(envelope.dstNodeId());
            dispatches.add(new Dispatch(envelope, destination));
        }
        if (effectiveTimeout == null) {
            LOG.debug("Round timeout = none: waiting indefinitely for replies");
        } else {
            LOG.debug("Round timeout = {} ms: moving on after that if replies are missing", effectiveTimeout.toMillis());
        }

        long startedAt = System.nanoTime();
        Map<String, PendingCorrelation> pending = new LinkedHashMap<>();
        for (Dispatch dispatch : dispatches) {
            Optional<PendingCorrelation> correlation = transportAdapter.submit(dispatch.envelope(), dispatch.destination());
            correlation.ifPresent(c -> pending.put(c.correlationId(), c));
        }
        int submitted = pending.size();
        if (submitted < dispatches.size()) {
            LOG.warn("{} of {} message(s) could not be submitted and are dropped from this round",
                    dispatches.size() - submitted, dispatches.size());
        }

        long deadline = effectiveTimeout == null ? Long.MAX_VALUE : startedAt + toNanos(effectiveTimeout);
        long pollMs = Math.max(1L, config.pollInterval().toMillis());
        Map<String, MessageEnvelope> results = new LinkedHashMap<>();
        int failed = 0;
        boolean timedOut = false;
        while (true) {
            Iterator<PendingCorrelation> iterator = pending.values().iterator();
            while (iterator.hasNext()) {
                PendingCorrelation correlation = iterator.next();
                ResolveResult result = transportAdapter.resolve(correlation);
                if (result instanceof ResolveResult.Resolved resolved) {
                    results.put(correlation.correlationId(), resolved.envelope());
                    iterator.remove();
                } else if (result.isFailed()) {
                    failed++;
                    iterator.remove();
                }
            }
            if (pending.isEmpty()) {
                break;
            }
            long remainingNanos = deadline - System.nanoTime();
            if (effectiveTimeout != null && remainingNanos <= 0L) {
                timedOut = true;
                break;
            }
            long sleepMs = effectiveTimeout == null
                    ? pollMs
                    : Math.min(pollMs, Math.max(1L, TimeUnit.NANOSECONDS.toMillis(remainingNanos + 999_999L)));
            try {
                Thread.sleep(sleepMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for {} repl(ies); returning partial results", pending.size());
                timedOut = true;
                break;
            }
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
        if (!pending.isEmpty()) {
            LOG.warn("Timeout reached. {} message(s) sent out but not replied.", pending.size());
        }
        RoundSummary summary = new RoundSummary(
                runId,
                groupIdOf(envelopes),
                dispatches.size(),
                submitted,
                results.size(),
                failed,
                pending.size(),
                elapsedMs,
                timedOut
        );
        lastRoundSummary = summary;
        LOG.info("Round finished: {}/{} replies in {} ms (failed={}, unanswered={}, dropped={})",
                summary.received(), summary.requested(), elapsedMs, failed, summary.unanswered(), summary.dropped());
        audit(AuditLogger.AuditEvent.of(
                "round.scatter_gather",
                runId,
                summary.groupId(),
                summary.complete() ? "complete" : "partial",
                summary.toAuditDetails()
        ));
        return new ArrayList<>(results.values());
    }

    public List<MessageEnvelope> sendStopSignal() {
        return sendStopSignal(OrchestratorConfig.DEFAULT_STOP_REASON);
    }

    public List<MessageEnvelope> sendStopSignal(String reason) {
        return sendStopSignal(reason, OrchestratorConfig.DEFAULT_STOP_GROUP_ID, config.stopTtlSeconds());
    }

    /**
     * Sends a {@code system} stop envelope to every participant without waiting for acknowledgement.
     *
     * @return the envelopes that were built, one per participant
     */
    public List<MessageEnvelope> sendStopSignal(String reason, String groupId, long ttlSeconds) {
        return shutdownBroadcaster.broadcast(reason, groupId, ttlSeconds);
    }

    public Optional<RoundSummary> lastRoundSummary() {
        return Optional.ofNullable(lastRoundSummary);
    }

    // Audit write failures never reach the caller.
    private void audit(AuditLogger.AuditEvent event) {
        if (auditLogger == null) {
            return;
        }
        try {
            auditLogger.log(event);
        } catch (RuntimeException e) {
            LOG.warn("Failed to write audit event {} for run {}: {}", event.action(), event.runId(), e.getMessage());
        }
    }

    private static long toNanos(Duration timeout) {
        if (timeout.compareTo(Duration.ofNanos(MAX_TIMEOUT_NANOS)) >= 0) {
            return MAX_TIMEOUT_NANOS;
        }
        return timeout.toNanos();
    }

    private static String groupIdOf(List<MessageEnvelope> envelopes) {
        String groupId = null;
        for (MessageEnvelope envelope : envelopes) {
            if (groupId == null) {
                groupId = envelope.groupId();
            } else if (!groupId.equals(envelope.groupId())) {
                return "*";
            }
        }
        return groupId == null ? "" : groupId;
    }

    private record Dispatch(MessageEnvelope envelope, Participant destination) {
    }
}
