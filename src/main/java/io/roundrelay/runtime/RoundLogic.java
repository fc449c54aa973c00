package io.roundrelay.runtime;

/**
 * The coordinator's protocol for one run: builds messages, calls
 * {@link RoundOrchestrator#sendAndReceive} once per round and aggregates the replies.
 */
@FunctionalInterface
public interface RoundLogic<T> {
    T run(RoundOrchestrator orchestrator) throws Exception;
}
