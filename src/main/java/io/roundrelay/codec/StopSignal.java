package io.roundrelay.codec;

import com.fasterxml.jackson.databind.JsonNode;
import io.roundrelay.model.MessageEnvelope;
import io.roundrelay.model.MessageTypes;
import io.roundrelay.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Payload of the terminal {@code system} envelope sent to every participant when a run ends.
 */
public record StopSignal(String action, String reason) {
    public static final String ACTION_STOP = "stop";

    public StopSignal {
        action = action == null || action.isBlank() ? ACTION_STOP : action;
        reason = reason == null ? "" : reason;
    }

    public static StopSignal of(String reason) {
        return new StopSignal(ACTION_STOP, reason);
    }

    public byte[] encode() {
        return Jsons.toCompactJson(this).getBytes(StandardCharsets.UTF_8);
    }

    public static Optional<StopSignal> decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(payload);
        } catch (IOException ignored) {
            return Optional.empty();
        }
        if (node == null || !node.isObject() || !ACTION_STOP.equals(node.path("action").asText(""))) {
            return Optional.empty();
        }
        return Optional.of(new StopSignal(ACTION_STOP, node.path("reason").asText("")));
    }

    public static Optional<StopSignal> from(MessageEnvelope envelope) {
        if (envelope == null || !MessageTypes.SYSTEM.equals(envelope.messageType())) {
            return Optional.empty();
        }
        return decode(envelope.payload());
    }
}
