package io.roundrelay.codec;

import io.roundrelay.error.EnvelopeCodecException;
import io.roundrelay.model.ErrorInfo;
import io.roundrelay.model.MessageEnvelope;
import io.roundrelay.model.MessageTypes;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

final class JsonEnvelopeCodecTest {
    private final JsonEnvelopeCodec codec = new JsonEnvelopeCodec();

    @Test
    void replyEnvelopeSurvivesEncodingWithBinaryPayloadAndError() {
        byte[] payload = new byte[]{0, 1, 2, (byte) 0xFF, 42};
        MessageEnvelope request = MessageEnvelope.request(3L, 1L, 99L, "round-4", 120L, MessageTypes.TRAIN, payload)
                .withMessageId("corr-1");
        MessageEnvelope failedReply = request.replyWithError(new ErrorInfo(7L, "out of memory"));

        MessageEnvelope decodedRequest = codec.decode(codec.encode(request));
        MessageEnvelope decodedReply = codec.decode(codec.encode(failedReply));

        Assertions.assertEquals(request, decodedRequest);
        Assertions.assertArrayEquals(payload, decodedRequest.payload());
        Assertions.assertEquals("corr-1", decodedReply.replyToMessageId());
        Assertions.assertEquals(99L, decodedReply.srcNodeId());
        Assertions.assertEquals(1L, decodedReply.dstNodeId());
        Assertions.assertTrue(decodedReply.hasError());
        Assertions.assertEquals("out of memory", decodedReply.error().reason());
    }

    @Test
    void emptyBodyIsRejected() {
        Assertions.assertThrows(EnvelopeCodecException.class, () -> codec.decode(new byte[0]));
        Assertions.assertThrows(EnvelopeCodecException.class, () -> codec.decode(null));
    }

    @Test
    void malformedOrForeignJsonIsRejected() {
        Assertions.assertThrows(EnvelopeCodecException.class,
                () -> codec.decode("{not json".getBytes(StandardCharsets.UTF_8)));
        Assertions.assertThrows(EnvelopeCodecException.class,
                () -> codec.decode("{\"error\":\"boom\",\"timestamp\":\"2026-01-01T00:00:00Z\"}".getBytes(StandardCharsets.UTF_8)));
        Assertions.assertThrows(EnvelopeCodecException.class,
                () -> codec.decode("{}".getBytes(StandardCharsets.UTF_8)));
        Assertions.assertThrows(EnvelopeCodecException.class,
                () -> codec.decode("null".getBytes(StandardCharsets.UTF_8)));
    }
}
