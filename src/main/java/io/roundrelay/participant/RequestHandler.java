package io.roundrelay.participant;

/**
 * Participant-side handler: receives the raw request body and returns the raw reply body, or {@code null}
 * when no reply should be written.
 */
@FunctionalInterface
public interface RequestHandler {
    byte[] handle(byte[] requestBody) throws Exception;
}
