package io.roundrelay.spi;

import io.roundrelay.error.EnvelopeCodecException;
import io.roundrelay.model.MessageEnvelope;

public interface EnvelopeCodec {

    byte[] encode(MessageEnvelope envelope);

    /**
     * @throws EnvelopeCodecException when the bytes are empty or not a well-formed envelope
     */
    MessageEnvelope decode(byte[] body);
}
