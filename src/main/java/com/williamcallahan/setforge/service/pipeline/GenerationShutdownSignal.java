package com.williamcallahan.setforge.service.pipeline;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Cooperative stop flag polled by the pipeline between work items.
 *
 * <p>Set when the application context closes (including JVM shutdown) and when a fatal provider
 * failure aborts a run. Context close then waits, up to the drain timeout, for in-flight items to
 * finish.</p>
 */
@Component
public class GenerationShutdownSignal {
    private static final Logger log = LoggerFactory.getLogger(GenerationShutdownSignal.class);

    private final AtomicBoolean requested = new AtomicBoolean();
    private final Duration drainTimeout;
    private volatile CountDownLatch activeRun = new CountDownLatch(0);

    public GenerationShutdownSignal(@Value("${app.generation.drain-timeout:120s}") Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public void requestShutdown(String reason) {
        if (requested.compareAndSet(false, true)) {
            log.warn("[PIPELINE] Shutdown requested: {}", reason);
        }
    }

    public boolean isShutdownRequested() {
        return requested.get();
    }

    void beginRun() {
        requested.set(false);
        activeRun = new CountDownLatch(1);
    }

    void endRun() {
        activeRun.countDown();
    }

    @PreDestroy
    void onContextClose() throws InterruptedException {
        CountDownLatch run = activeRun;
        if (run.getCount() == 0) {
            return;
        }
        requestShutdown("application context closing");
        log.info("[PIPELINE] Waiting up to {}s for in-flight items to finish", drainTimeout.toSeconds());
        if (!run.await(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("[PIPELINE] In-flight items did not finish within {}s", drainTimeout.toSeconds());
        }
    }
}
