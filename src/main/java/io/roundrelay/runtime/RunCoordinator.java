package io.roundrelay.runtime;

import io.roundrelay.config.OrchestratorConfig;
import io.roundrelay.error.RoundRelayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a coordinator's round logic against an orchestrator and always ends the run with a stop broadcast,
 * whether the logic returned normally or threw.
 */
public final class RunCoordinator {
    private static final Logger LOG = LoggerFactory.getLogger(RunCoordinator.class);

    private final RoundOrchestrator orchestrator;
    private final String completionReason;

    public RunCoordinator(RoundOrchestrator orchestrator) {
        this(orchestrator, OrchestratorConfig.DEFAULT_STOP_REASON);
    }

    public RunCoordinator(RoundOrchestrator orchestrator, String completionReason) {
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        this.orchestrator = orchestrator;
        this.completionReason = completionReason == null || completionReason.isBlank()
                ? OrchestratorConfig.DEFAULT_STOP_REASON
                : completionReason;
    }

    public <T> T execute(long runId, RoundLogic<T> logic) {
        orchestrator.startRun(runId);
        Throwable failure = null;
        try {
            T result = logic.run(orchestrator);
            LOG.info("Run {} completed", runId);
            return result;
        } catch (RuntimeException | Error e) {
            failure = e;
            throw e;
        } catch (Exception e) {
            failure = e;
            throw new RoundRelayException("Round logic failed for run " + runId, e);
        } finally {
            String reason = failure == null ? completionReason : "Run aborted: " + describe(failure);
            if (failure != null) {
                LOG.error("Run {} failed; notifying participants", runId, failure);
            }
            try {
                orchestrator.sendStopSignal(reason);
            } catch (RuntimeException stopFailure) {
                if (failure == null) {
                    throw stopFailure;
                }
                failure.addSuppressed(stopFailure);
            }
        }
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return message == null || message.isBlank()
                ? failure.getClass().getSimpleName()
                : failure.getClass().getSimpleName() + ": " + message;
    }
}
