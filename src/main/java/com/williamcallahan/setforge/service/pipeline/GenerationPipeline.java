package com.williamcallahan.setforge.service.pipeline;

import com.williamcallahan.setforge.config.AppProperties;
import com.williamcallahan.setforge.config.GenerationSettings;
import com.williamcallahan.setforge.domain.checkpoint.GeneratedArtifact;
import com.williamcallahan.setforge.domain.checkpoint.ProgressSnapshot;
import com.williamcallahan.setforge.domain.checkpoint.SessionHandle;
import com.williamcallahan.setforge.domain.generation.DispatchOutcome;
import com.williamcallahan.setforge.domain.generation.FailureCategory;
import com.williamcallahan.setforge.domain.generation.GenerationPayload;
import com.williamcallahan.setforge.domain.work.WorkItem;
import com.williamcallahan.setforge.domain.work.WorkItemOutcome;
import com.williamcallahan.setforge.service.checkpoint.CheckpointManager;
import com.williamcallahan.setforge.service.checkpoint.SessionCompletedException;
import com.williamcallahan.setforge.service.deadletter.DeadLetterQueue;
import com.williamcallahan.setforge.service.orchestration.ProviderFatalException;
import com.williamcallahan.setforge.service.orchestration.RequestOrchestrator;
import com.williamcallahan.setforge.service.retry.ItemAttemptException;
import com.williamcallahan.setforge.service.retry.RetryPolicy;
import com.williamcallahan.setforge.service.retry.RetryResult;
import com.williamcallahan.setforge.service.retry.RetryingItemProcessor;
import com.williamcallahan.setforge.support.Sleeper;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives a generation run from input items to checkpointed output.
 *
 * <p>Items already recorded in the session or already dead-lettered are skipped. Every other item
 * is submitted to a fixed worker pool and processed under retries. Submission waits for a free
 * worker, so no more items are read from the source than can run at once. The shutdown flag and
 * session completion are checked before an item is submitted and again when it starts, so once
 * either is set no new item begins while in-flight items finish.</p>
 *
 * <p>Whatever ends the run, in-flight items are awaited and the checkpoint is flushed before
 * {@code run} returns or throws. A fatal provider failure or a failure reading the source sets the
 * shutdown flag and is rethrown after that drain.</p>
 */
@Service
public class GenerationPipeline {
    private static final Logger log = LoggerFactory.getLogger(GenerationPipeline.class);

    private final RequestOrchestrator orchestrator;
    private final CheckpointManager checkpointManager;
    private final DeadLetterQueue deadLetterQueue;
    private final GenerationPromptTemplate promptTemplate;
    private final GenerationShutdownSignal shutdownSignal;
    private final AppProperties appProperties;
    private final Sleeper sleeper;
    private final Clock clock;

    public GenerationPipeline(
            RequestOrchestrator orchestrator,
            CheckpointManager checkpointManager,
            DeadLetterQueue deadLetterQueue,
            GenerationPromptTemplate promptTemplate,
            GenerationShutdownSignal shutdownSignal,
            AppProperties appProperties,
            Sleeper sleeper,
            Clock clock) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.checkpointManager = Objects.requireNonNull(checkpointManager, "checkpointManager");
        this.deadLetterQueue = Objects.requireNonNull(deadLetterQueue, "deadLetterQueue");
        this.promptTemplate = Objects.requireNonNull(promptTemplate, "promptTemplate");
        this.shutdownSignal = Objects.requireNonNull(shutdownSignal, "shutdownSignal");
        this.appProperties = Objects.requireNonNull(appProperties, "appProperties");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs over the text files in {@code options.inputDir()}.
     */
    public GenerationRunSummary run(GenerationRunOptions options) throws IOException, InterruptedException {
        return run(options, new FileWorkItemSource(options.inputDir(), appProperties.getInput()));
    }

    /**
     * Runs over the items of {@code source}.
     *
     * @return counts and final progress of the run
     * @throws ProviderFatalException when a provider fails fatally
     * @throws IOException when the source cannot be enumerated
     * @throws InterruptedException if interrupted while waiting for workers
     */
    public GenerationRunSummary run(GenerationRunOptions options, WorkItemSource source)
            throws IOException, InterruptedException {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(source, "source");
        shutdownSignal.beginRun();
        try {
            return execute(options, source);
        } finally {
            shutdownSignal.endRun();
        }
    }

    private GenerationRunSummary execute(GenerationRunOptions options, WorkItemSource source)
            throws IOException, InterruptedException {
        SessionHandle session =
                checkpointManager.initializeSession(options.targetSize(), options.qualityThreshold(), options.resume());
        RunCounters counters = new RunCounters();
        GenerationProgressReporter reporter = new GenerationProgressReporter();
        if (session.completed()) {
            log.info("[PIPELINE] Session {} is already complete; nothing to do", session.sessionId());
            return summarize(session, counters, reporter, false, false);
        }

        GenerationSettings generation = appProperties.getGeneration();
        RetryPolicy policy =
                new RetryPolicy(options.maxRetries(), generation.getBaseDelay(), generation.getMaxBackoff());
        RetryingItemProcessor processor =
                new RetryingItemProcessor(deadLetterQueue, options.concurrency(), policy, sleeper);
        Set<String> completedIds = checkpointManager.completedItemIds();
        AtomicReference<ProviderFatalException> fatalFailure = new AtomicReference<>();

        log.info(
                "[PIPELINE] Starting session {} at {}/{} with concurrency {} and {} attempts per item",
                session.sessionId(),
                session.currentCount(),
                session.state().targetSize(),
                options.concurrency(),
                options.maxRetries());

        ExecutorService workers = Executors.newFixedThreadPool(options.concurrency(), workerThreadFactory());
        Semaphore startSlots = new Semaphore(options.concurrency());
        List<Future<WorkItemOutcome>> submitted = new ArrayList<>();
        try (Stream<WorkItem> items = source.items()) {
            Iterator<WorkItem> iterator = items.iterator();
            while (!shouldStopStarting() && iterator.hasNext()) {
                WorkItem item = iterator.next();
                if (completedIds.contains(item.id()) || deadLetterQueue.contains(item.id())) {
                    counters.alreadyDone.incrementAndGet();
                    continue;
                }
                startSlots.acquire();
                if (shouldStopStarting()) {
                    startSlots.release();
                    counters.skipped.incrementAndGet();
                    break;
                }
                submitted.add(workers.submit(() -> {
                    try {
                        return processItem(item, processor, reporter, fatalFailure);
                    } finally {
                        startSlots.release();
                    }
                }));
            }
        } catch (IOException | RuntimeException sourceFailure) {
            shutdownSignal.requestShutdown("reading work items failed");
            log.error(
                    "[PIPELINE] Failed to read work items; finishing {} submitted items", submitted.size(), sourceFailure);
            throw sourceFailure;
        } catch (InterruptedException interrupted) {
            shutdownSignal.requestShutdown("pipeline thread interrupted");
            throw interrupted;
        } finally {
            drain(workers, submitted, counters);
        }

        ProviderFatalException fatal = fatalFailure.get();
        if (fatal != null) {
            GenerationRunSummary aborted = summarize(session, counters, reporter, true, true);
            log.error(
                    "[PIPELINE] Run {} by fatal failure from {} (recorded={}, dead-lettered={})",
                    aborted.status(),
                    fatal.getProviderName(),
                    aborted.recorded(),
                    aborted.deadLettered());
            throw fatal;
        }
        GenerationRunSummary summary =
                summarize(session, counters, reporter, shutdownSignal.isShutdownRequested(), false);
        log.info(
                "[PIPELINE] Run finished: {} (recorded={}, dead-lettered={}, skipped={}, already done={})",
                summary.status(),
                summary.recorded(),
                summary.deadLettered(),
                summary.skipped(),
                summary.alreadyDone());
        return summary;
    }

    /**
     * Waits for every submitted item, then flushes the checkpoint. Runs on every exit path.
     */
    private void drain(ExecutorService workers, List<Future<WorkItemOutcome>> submitted, RunCounters counters)
            throws InterruptedException {
        workers.shutdown();
        try {
            for (Future<WorkItemOutcome> future : submitted) {
                try {
                    count(future.get(), counters);
                } catch (ExecutionException taskFailure) {
                    counters.failedUnrecorded.incrementAndGet();
                    log.error("[PIPELINE] Work item task failed", taskFailure.getCause());
                } catch (CancellationException cancelled) {
                    counters.skipped.incrementAndGet();
                }
            }
        } catch (InterruptedException interrupted) {
            shutdownSignal.requestShutdown("pipeline thread interrupted");
            workers.shutdownNow();
            throw interrupted;
        } finally {
            checkpointManager.flush();
        }
    }

    private WorkItemOutcome processItem(
            WorkItem item,
            RetryingItemProcessor processor,
            GenerationProgressReporter reporter,
            AtomicReference<ProviderFatalException> fatalFailure)
            throws InterruptedException {
        if (shutdownSignal.isShutdownRequested()) {
            return new WorkItemOutcome.Skipped(item, "shutdown requested");
        }
        if (checkpointManager.isCompleted()) {
            return new WorkItemOutcome.Skipped(item, "session target reached");
        }
        RetryResult<DispatchOutcome.Success> result;
        try {
            result = processor.process(item, this::attemptGeneration);
        } catch (ProviderFatalException fatal) {
            fatalFailure.compareAndSet(null, fatal);
            shutdownSignal.requestShutdown("fatal failure from provider " + fatal.getProviderName());
            return new WorkItemOutcome.Skipped(item, "run aborted");
        }
        if (!result.succeeded()) {
            var entry = result.deadLetter().orElseThrow();
            reporter.recordFailure(item.id(), entry.reason());
            return new WorkItemOutcome.DeadLettered(item, entry);
        }
        DispatchOutcome.Success success = result.value().orElseThrow();
        try {
            boolean completedSession = checkpointManager.recordItem(new GeneratedArtifact(
                    item.id(), success.providerName(), success.model(), success.content(), clock.instant()));
            ProgressSnapshot progress = checkpointManager.getProgress();
            reporter.recordSuccess(progress);
            return new WorkItemOutcome.Recorded(item, success.providerName(), completedSession);
        } catch (SessionCompletedException surplus) {
            log.info("[PIPELINE] Discarding {}: session target already reached", item.id());
            return new WorkItemOutcome.Skipped(item, "session target reached");
        }
    }

    private DispatchOutcome.Success attemptGeneration(WorkItem item) throws InterruptedException {
        GenerationSettings generation = appProperties.getGeneration();
        GenerationPayload payload =
                new GenerationPayload(promptTemplate.render(item), generation.getMaxTokens(), generation.getTemperature());
        DispatchOutcome outcome = orchestrator.dispatch(payload);
        if (outcome instanceof DispatchOutcome.Success success) {
            return success;
        }
        if (outcome instanceof DispatchOutcome.Fatal fatal) {
            throw new ProviderFatalException(fatal.providerName(), fatal.detail(), fatal.cause());
        }
        if (outcome instanceof DispatchOutcome.Retryable retryable) {
            throw new ItemAttemptException(
                    retryable.category(), retryable.providerName() + " " + retryable.category() + ": " + retryable.detail());
        }
        DispatchOutcome.SoftFailure soft = (DispatchOutcome.SoftFailure) outcome;
        throw new ItemAttemptException(
                FailureCategory.MALFORMED_RESPONSE, soft.providerName() + " returned no usable content: " + soft.detail());
    }

    private boolean shouldStopStarting() {
        return shutdownSignal.isShutdownRequested() || checkpointManager.isCompleted();
    }

    private static void count(WorkItemOutcome outcome, RunCounters counters) {
        if (outcome instanceof WorkItemOutcome.Recorded) {
            counters.recorded.incrementAndGet();
        } else if (outcome instanceof WorkItemOutcome.DeadLettered) {
            counters.deadLettered.incrementAndGet();
        } else {
            counters.skipped.incrementAndGet();
        }
    }

    private GenerationRunSummary summarize(
            SessionHandle session,
            RunCounters counters,
            GenerationProgressReporter reporter,
            boolean interrupted,
            boolean aborted) {
        ProgressSnapshot progress = checkpointManager.getProgress();
        GenerationRunSummary.Status status;
        if (aborted) {
            status = GenerationRunSummary.Status.ABORTED;
        } else if (interrupted && !progress.completed()) {
            status = GenerationRunSummary.Status.INCOMPLETE;
        } else if (counters.deadLettered.get() > 0 || counters.failedUnrecorded.get() > 0) {
            status = GenerationRunSummary.Status.PARTIAL_SUCCESS;
        } else {
            status = GenerationRunSummary.Status.COMPLETED;
        }
        return new GenerationRunSummary(
                session.sessionId(),
                status,
                counters.recorded.get(),
                counters.deadLettered.get(),
                counters.skipped.get(),
                counters.alreadyDone.get(),
                progress,
                reporter.recentFailures());
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread worker = new Thread(runnable, "setforge-worker-" + sequence.incrementAndGet());
            worker.setDaemon(true);
            return worker;
        };
    }

    private static final class RunCounters {
        private final AtomicInteger recorded = new AtomicInteger();
        private final AtomicInteger deadLettered = new AtomicInteger();
        private final AtomicInteger skipped = new AtomicInteger();
        private final AtomicInteger alreadyDone = new AtomicInteger();
        private final AtomicInteger failedUnrecorded = new AtomicInteger();
    }
}
