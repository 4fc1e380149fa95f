package com.williamcallahan.setforge.service.pipeline;

import com.williamcallahan.setforge.domain.checkpoint.ProgressSnapshot;
import java.util.List;
import java.util.Objects;

/**
 * What a generation run accomplished.
 *
 * @param sessionId session the run wrote to
 * @param status overall result
 * @param recorded items recorded during this run
 * @param deadLettered items moved to the dead-letter queue during this run
 * @param skipped items not started because the run was stopping
 * @param alreadyDone items skipped because an earlier run finished them
 * @param progress session progress at the end of the run
 * @param recentFailures most recent dead-letter reasons
 */
public record GenerationRunSummary(
        String sessionId,
        Status status,
        int recorded,
        int deadLettered,
        int skipped,
        int alreadyDone,
        ProgressSnapshot progress,
        List<String> recentFailures) {

    /**
     * Overall result of a run.
     */
    public enum Status {
        /** Every started item was recorded. */
        COMPLETED,
        /** The run finished but some items were dead-lettered. */
        PARTIAL_SUCCESS,
        /** The run stopped on a shutdown request before the input or target was exhausted. */
        INCOMPLETE,
        /** A fatal provider failure stopped the run. */
        ABORTED
    }

    public GenerationRunSummary {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(progress, "progress");
        recentFailures = List.copyOf(recentFailures);
    }
}
