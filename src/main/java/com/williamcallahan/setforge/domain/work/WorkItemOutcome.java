package com.williamcallahan.setforge.domain.work;

import com.williamcallahan.setforge.domain.deadletter.DeadLetterEntry;
import java.util.Objects;

/**
 * Terminal state a work item reached during a run.
 */
public sealed interface WorkItemOutcome
        permits WorkItemOutcome.Recorded, WorkItemOutcome.DeadLettered, WorkItemOutcome.Skipped {

    WorkItem item();

    /**
     * The generation was durably appended to the session output.
     */
    record Recorded(WorkItem item, String providerName, boolean sessionCompleted) implements WorkItemOutcome {
        public Recorded {
            Objects.requireNonNull(item, "item");
            Objects.requireNonNull(providerName, "providerName");
        }
    }

    /**
     * Retries were exhausted and the item was moved to the dead-letter queue.
     */
    record DeadLettered(WorkItem item, DeadLetterEntry entry) implements WorkItemOutcome {
        public DeadLettered {
            Objects.requireNonNull(item, "item");
            Objects.requireNonNull(entry, "entry");
        }
    }

    /**
     * The item never started because the run was stopping; it remains in the input set.
     */
    record Skipped(WorkItem item, String reason) implements WorkItemOutcome {
        public Skipped {
            Objects.requireNonNull(item, "item");
            Objects.requireNonNull(reason, "reason");
        }
    }
}
