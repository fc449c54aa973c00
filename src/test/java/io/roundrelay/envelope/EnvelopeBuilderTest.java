package io.roundrelay.envelope;

import io.roundrelay.error.InvalidEnvelopeException;
import io.roundrelay.error.RunNotStartedException;
import io.roundrelay.error.UnknownParticipantException;
import io.roundrelay.identity.IdentityMapper;
import io.roundrelay.model.MessageEnvelope;
import io.roundrelay.model.MessageTypes;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

final class EnvelopeBuilderTest {
    private static final long COORDINATOR = 1L;
    private static final byte[] PAYLOAD = "weights".getBytes(StandardCharsets.UTF_8);

    private IdentityMapper mapper;
    private EnvelopeBuilder builder;

    @BeforeEach
    void setUp() {
        mapper = new IdentityMapper(List.of("alice@example.org", "bob@example.org"), COORDINATOR);
        builder = new EnvelopeBuilder(mapper, 600L);
    }

    @Test
    void builtEnvelopeCarriesRunSourceAndDefaultTtl() {
        builder.startRun(77L);

        MessageEnvelope envelope = builder.build(PAYLOAD, MessageTypes.TRAIN, "bob@example.org", "round-1");

        Assertions.assertEquals(77L, envelope.runId());
        Assertions.assertEquals(COORDINATOR, envelope.srcNodeId());
        Assertions.assertEquals(mapper.resolve("bob@example.org"), envelope.dstNodeId());
        Assertions.assertEquals("", envelope.messageId());
        Assertions.assertEquals("", envelope.replyToMessageId());
        Assertions.assertEquals("round-1", envelope.groupId());
        Assertions.assertEquals(600L, envelope.ttlSeconds());
        Assertions.assertEquals(MessageTypes.TRAIN, envelope.messageType());
        Assertions.assertArrayEquals(PAYLOAD, envelope.payload());
        Assertions.assertFalse(envelope.hasError());
        Assertions.assertDoesNotThrow(() -> builder.validate(envelope));
    }

    @Test
    void explicitTtlOverridesDefault() {
        builder.startRun(1L);

        MessageEnvelope envelope = builder.build(PAYLOAD, MessageTypes.EVALUATE, "alice@example.org", "round-2", 30L);

        Assertions.assertEquals(30L, envelope.ttlSeconds());
        Assertions.assertThrows(InvalidEnvelopeException.class,
                () -> builder.build(PAYLOAD, MessageTypes.EVALUATE, "alice@example.org", "round-2", 0L));
    }

    @Test
    void unknownDestinationIsRejected() {
        builder.startRun(1L);

        UnknownParticipantException error = Assertions.assertThrows(UnknownParticipantException.class,
                () -> builder.build(PAYLOAD, MessageTypes.TRAIN, "not-a-participant", "round-1"));
        Assertions.assertEquals("not-a-participant", error.address());
    }

    @Test
    void buildingBeforeRunStartsFails() {
        Assertions.assertFalse(builder.runStarted());
        Assertions.assertThrows(RunNotStartedException.class, () -> builder.runContext());
        Assertions.assertThrows(RunNotStartedException.class,
                () -> builder.build(PAYLOAD, MessageTypes.TRAIN, "bob@example.org", "round-1"));
    }

    @Test
    void runCanOnlyBeStartedOnce() {
        builder.startRun(5L);

        Assertions.assertThrows(IllegalStateException.class, () -> builder.startRun(6L));
        Assertions.assertEquals(5L, builder.runContext().runId());
    }

    @Test
    void validateRejectsEachMutatedField() {
        builder.startRun(9L);
        MessageEnvelope good = builder.build(PAYLOAD, MessageTypes.TRAIN, "alice@example.org", "g");

        List<MessageEnvelope> mutated = List.of(
                copy(good, 10L, good.messageId(), good.srcNodeId(), good.replyToMessageId(), good.ttlSeconds()),
                copy(good, good.runId(), good.messageId(), 2L, good.replyToMessageId(), good.ttlSeconds()),
                copy(good, good.runId(), "msg-1", good.srcNodeId(), good.replyToMessageId(), good.ttlSeconds()),
                copy(good, good.runId(), good.messageId(), good.srcNodeId(), "msg-0", good.ttlSeconds()),
                copy(good, good.runId(), good.messageId(), good.srcNodeId(), good.replyToMessageId(), 0L),
                copy(good, good.runId(), good.messageId(), good.srcNodeId(), good.replyToMessageId(), -5L)
        );

        for (MessageEnvelope envelope : mutated) {
            Assertions.assertThrows(InvalidEnvelopeException.class, () -> builder.validate(envelope),
                    "expected rejection of " + envelope);
        }
    }

    private static MessageEnvelope copy(
            MessageEnvelope base,
            long runId,
            String messageId,
            long srcNodeId,
            String replyTo,
            long ttl
    ) {
        return new MessageEnvelope(runId, messageId, srcNodeId, base.dstNodeId(), replyTo, base.groupId(), ttl,
                base.messageType(), base.payload(), base.error());
    }
}
