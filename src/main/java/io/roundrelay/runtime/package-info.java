/**
 * Round orchestration package.
 *
 * <p>{@link io.roundrelay.runtime.RoundOrchestrator} owns one run: it resolves destinations, validates and
 * submits envelopes, polls for replies against a wall-clock deadline, and broadcasts the final stop signal.
 */
package io.roundrelay.runtime;
