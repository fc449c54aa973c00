package io.roundrelay.error;

public final class RunNotStartedException extends RoundRelayException {
    public RunNotStartedException() {
        super("Run has not been started; call startRun(runId) first");
    }
}
