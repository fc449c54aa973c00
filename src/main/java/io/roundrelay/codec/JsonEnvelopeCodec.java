package io.roundrelay.codec;

import io.roundrelay.error.EnvelopeCodecException;
import io.roundrelay.model.MessageEnvelope;
import io.roundrelay.spi.EnvelopeCodec;
import io.roundrelay.util.Jsons;

import java.io.IOException;

/**
 * Compact JSON form of {@link MessageEnvelope}; the payload travels as a base64 string.
 */
public final class JsonEnvelopeCodec implements EnvelopeCodec {

    @Override
    public byte[] encode(MessageEnvelope envelope) {
        try {
            return Jsons.compact().writeValueAsBytes(envelope);
        } catch (IOException e) {
            throw new EnvelopeCodecException("Failed to encode envelope: " + envelope, e);
        }
    }

    @Override
    public MessageEnvelope decode(byte[] body) {
        if (body == null || body.length == 0) {
            throw new EnvelopeCodecException("Empty envelope body");
        }
        MessageEnvelope envelope;
        try {
            envelope = Jsons.compact().readValue(body, MessageEnvelope.class);
        } catch (IOException e) {
            throw new EnvelopeCodecException("Malformed envelope body (" + body.length + " bytes)", e);
        }
        if (envelope == null) {
            throw new EnvelopeCodecException("Envelope body is JSON null");
        }
        if (envelope.messageType() == null || envelope.messageType().isBlank()) {
            throw new EnvelopeCodecException("Envelope is missing messageType");
        }
        return envelope;
    }
}
