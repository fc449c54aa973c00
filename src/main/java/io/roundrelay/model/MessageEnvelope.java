package io.roundrelay.model;

import java.util.Arrays;
import java.util.Objects;

public record MessageEnvelope(
        long runId,
        String messageId,
        long srcNodeId,
        long dstNodeId,
        String replyToMessageId,
        String groupId,
        long ttlSeconds,
        String messageType,
        byte[] payload,
        ErrorInfo error
) {
    public MessageEnvelope {
        messageId = messageId == null ? "" : messageId;
        replyToMessageId = replyToMessageId == null ? "" : replyToMessageId;
        groupId = groupId == null ? "" : groupId;
        payload = payload == null ? new byte[0] : payload.clone();
    }

    public static MessageEnvelope request(
            long runId,
            long srcNodeId,
            long dstNodeId,
            String groupId,
            long ttlSeconds,
            String messageType,
            byte[] payload
    ) {
        return new MessageEnvelope(runId, "", srcNodeId, dstNodeId, "", groupId, ttlSeconds, messageType, payload, null);
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public boolean hasError() {
        return error != null;
    }

    public MessageEnvelope withMessageId(String newMessageId) {
        return new MessageEnvelope(runId, newMessageId, srcNodeId, dstNodeId, replyToMessageId, groupId,
                ttlSeconds, messageType, payload, error);
    }

    /**
     * Builds the reply a participant sends back for this request: source and destination are swapped
     * and {@code replyToMessageId} points at this envelope's message id.
     */
    public MessageEnvelope reply(String replyMessageType, byte[] replyPayload) {
        return new MessageEnvelope(runId, "", dstNodeId, srcNodeId, messageId, groupId, ttlSeconds,
                replyMessageType, replyPayload, null);
    }

    public MessageEnvelope replyWithError(ErrorInfo replyError) {
        return new MessageEnvelope(runId, "", dstNodeId, srcNodeId, messageId, groupId, ttlSeconds,
                messageType, new byte[0], replyError);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MessageEnvelope other)) {
            return false;
        }
        return runId == other.runId
                && srcNodeId == other.srcNodeId
                && dstNodeId == other.dstNodeId
                && ttlSeconds == other.ttlSeconds
                && messageId.equals(other.messageId)
                && replyToMessageId.equals(other.replyToMessageId)
                && groupId.equals(other.groupId)
                && Objects.equals(messageType, other.messageType)
                && Arrays.equals(payload, other.payload)
                && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(runId, messageId, srcNodeId, dstNodeId, replyToMessageId, groupId, ttlSeconds,
                messageType, error);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "MessageEnvelope[runId=" + runId
                + ", messageId=" + messageId
                + ", srcNodeId=" + srcNodeId
                + ", dstNodeId=" + dstNodeId
                + ", replyToMessageId=" + replyToMessageId
                + ", groupId=" + groupId
                + ", ttlSeconds=" + ttlSeconds
                + ", messageType=" + messageType
                + ", payloadBytes=" + payload.length
                + ", error=" + error + "]";
    }
}
