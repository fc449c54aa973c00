package io.roundrelay.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts for one scatter/gather call. {@code requested - received} destinations are missing from the
 * round, whether their submission failed, their reply failed or they did not answer in time.
 */
public record RoundSummary(
        long runId,
        String groupId,
        int requested,
        int submitted,
        int received,
        int failed,
        int unanswered,
        long elapsedMs,
        boolean timedOut
) {
    public int dropped() {
        return requested - submitted;
    }

    public boolean complete() {
        return received == requested;
    }

    Map<String, Object> toAuditDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requested", requested);
        details.put("submitted", submitted);
        details.put("received", received);
        details.put("failed", failed);
        details.put("unanswered", unanswered);
        details.put("elapsed_ms", elapsedMs);
        details.put("timed_out", timedOut);
        return details;
    }
}
