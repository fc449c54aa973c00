package io.roundrelay.runtime;

import io.roundrelay.codec.StopSignal;
import io.roundrelay.envelope.EnvelopeBuilder;
import io.roundrelay.identity.IdentityMapper;
import io.roundrelay.model.MessageEnvelope;
import io.roundrelay.model.MessageTypes;
import io.roundrelay.model.Participant;
import io.roundrelay.observability.AuditLogger;
import io.roundrelay.transport.TransportAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class ShutdownBroadcaster {
    private static final Logger LOG = LoggerFactory.getLogger(ShutdownBroadcaster.class);

    private final IdentityMapper identityMapper;
    private final EnvelopeBuilder envelopeBuilder;
    private final TransportAdapter transportAdapter;
    private final AuditLogger auditLogger;

    ShutdownBroadcaster(
            IdentityMapper identityMapper,
            EnvelopeBuilder envelopeBuilder,
            TransportAdapter transportAdapter,
            AuditLogger auditLogger
    ) {
        this.identityMapper = identityMapper;
        this.envelopeBuilder = envelopeBuilder;
        this.transportAdapter = transportAdapter;
        this.auditLogger = auditLogger;
    }

    List<MessageEnvelope> broadcast(String reason, String groupId, long ttlSeconds) {
        long runId = envelopeBuilder.runContext().runId();
        byte[] payload = StopSignal.of(reason).encode();
        List<MessageEnvelope> sent = new ArrayList<>();
        int delivered = 0;
        for (Participant participant : identityMapper.participants()) {
            MessageEnvelope envelope = envelopeBuilder.build(
                    payload,
                    MessageTypes.SYSTEM,
                    participant.address(),
                    groupId,
                    ttlSeconds
            );
            envelopeBuilder.validate(envelope);
            sent.add(envelope);
            // Fire-and-forget: nobody polls for acknowledgements of a stop.
            if (transportAdapter.submit(envelope, participant).isPresent()) {
                delivered++;
            }
        }
        LOG.info("Sent stop signal to {}/{} participants (group={}, reason={})",
                delivered, sent.size(), groupId, reason);
        if (auditLogger != null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", reason);
            details.put("participants", sent.size());
            details.put("submitted", delivered);
            try {
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "run.stop_broadcast",
                        runId,
                        groupId,
                        delivered == sent.size() ? "ok" : "partial",
                        details
                ));
            } catch (RuntimeException e) {
                LOG.warn("Failed to write stop broadcast audit event for run {}: {}", runId, e.getMessage());
            }
        }
        return List.copyOf(sent);
    }
}
