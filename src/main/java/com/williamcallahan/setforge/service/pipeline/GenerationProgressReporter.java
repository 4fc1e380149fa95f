package com.williamcallahan.setforge.service.pipeline;

import com.williamcallahan.setforge.domain.checkpoint.ProgressSnapshot;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs progress after each recorded item and remembers the most recent failures.
 */
public class GenerationProgressReporter {
    private static final Logger log = LoggerFactory.getLogger(GenerationProgressReporter.class);

    static final int RECENT_FAILURE_LIMIT = 10;

    private final Deque<String> recentFailures = new ConcurrentLinkedDeque<>();

    public void recordSuccess(ProgressSnapshot progress) {
        log.info(
                "[PIPELINE] Progress {}/{} ({})",
                progress.currentCount(),
                progress.targetSize(),
                String.format(Locale.ROOT, "%.1f%%", progress.percentage()));
    }

    public void recordFailure(String itemId, String reason) {
        recentFailures.addLast(itemId + ": " + reason);
        while (recentFailures.size() > RECENT_FAILURE_LIMIT) {
            recentFailures.pollFirst();
        }
        log.warn("[PIPELINE] {} dead-lettered: {}", itemId, reason);
    }

    /**
     * Most recent failures, oldest first.
     */
    public List<String> recentFailures() {
        return new ArrayList<>(recentFailures);
    }
}
