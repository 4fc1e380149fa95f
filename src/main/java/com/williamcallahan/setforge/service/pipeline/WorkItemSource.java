package com.williamcallahan.setforge.service.pipeline;

import com.williamcallahan.setforge.domain.work.WorkItem;
import java.io.IOException;
import java.util.stream.Stream;

/**
 * Supplies the work items of a run.
 */
@FunctionalInterface
public interface WorkItemSource {

    /**
     * Opens a stream of items; callers close it.
     *
     * @throws IOException when the underlying input cannot be enumerated
     */
    Stream<WorkItem> items() throws IOException;
}
