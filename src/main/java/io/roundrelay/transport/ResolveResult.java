package io.roundrelay.transport;

import io.roundrelay.model.MessageEnvelope;

/**
 * Outcome of polling one correlation id. {@link Pending} is the normal state of an unanswered request,
 * not an error.
 */
public interface ResolveResult {

    static ResolveResult pending() {
        return Pending.INSTANCE;
    }

    static ResolveResult failed(String reason) {
        return new Failed(reason);
    }

    static ResolveResult resolved(MessageEnvelope envelope) {
        return new Resolved(envelope);
    }

    default boolean isPending() {
        return this instanceof Pending;
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }

    default boolean isResolved() {
        return this instanceof Resolved;
    }

    final class Pending implements ResolveResult {
        private static final Pending INSTANCE = new Pending();

        private Pending() {
        }

        @Override
        public String toString() {
            return "Pending";
        }
    }

    record Failed(String reason) implements ResolveResult {
    }

    record Resolved(MessageEnvelope envelope) implements ResolveResult {
    }
}
