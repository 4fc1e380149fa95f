package com.williamcallahan.setforge.cli;

import com.williamcallahan.setforge.config.AppProperties;
import com.williamcallahan.setforge.domain.deadletter.DeadLetterEntry;
import com.williamcallahan.setforge.service.checkpoint.CheckpointManager;
import com.williamcallahan.setforge.service.deadletter.DeadLetterQueue;
import com.williamcallahan.setforge.service.pipeline.GenerationPipeline;
import com.williamcallahan.setforge.service.pipeline.GenerationRunOptions;
import com.williamcallahan.setforge.service.pipeline.GenerationRunSummary;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point for generation runs and operator maintenance.
 *
 * <p>Flags: {@code --concurrency=K}, {@code --max-retries=N}, {@code --target-size=T},
 * {@code --resume} or {@code --fresh}, {@code --input-dir=PATH}, {@code --list-dead-letters},
 * {@code --purge-dead-letters[=DAYS]} and {@code --cleanup-sessions[=DAYS]}. Unset flags fall back
 * to {@code app.generation.*}; retention flags without a value use the configured retention days.</p>
 */
@Component
@ConditionalOnProperty(prefix = "app.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GenerationCommandLine implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(GenerationCommandLine.class);

    static final String CONCURRENCY = "concurrency";
    static final String MAX_RETRIES = "max-retries";
    static final String TARGET_SIZE = "target-size";
    static final String RESUME = "resume";
    static final String FRESH = "fresh";
    static final String INPUT_DIR = "input-dir";
    static final String LIST_DEAD_LETTERS = "list-dead-letters";
    static final String CLEANUP_SESSIONS = "cleanup-sessions";
    static final String PURGE_DEAD_LETTERS = "purge-dead-letters";

    private final GenerationPipeline pipeline;
    private final CheckpointManager checkpointManager;
    private final DeadLetterQueue deadLetterQueue;
    private final AppProperties appProperties;

    public GenerationCommandLine(
            GenerationPipeline pipeline,
            CheckpointManager checkpointManager,
            DeadLetterQueue deadLetterQueue,
            AppProperties appProperties) {
        this.pipeline = pipeline;
        this.checkpointManager = checkpointManager;
        this.deadLetterQueue = deadLetterQueue;
        this.appProperties = appProperties;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (args.containsOption(LIST_DEAD_LETTERS)) {
            listDeadLetters();
            return;
        }
        if (args.containsOption(PURGE_DEAD_LETTERS)) {
            int keepDays = intOption(args, PURGE_DEAD_LETTERS, appProperties.getDeadLetter().getRetentionDays());
            int removed = deadLetterQueue.purgeOlderThan(Duration.ofDays(keepDays));
            log.info("Purged {} dead-letter entries older than {} days", removed, keepDays);
            return;
        }
        if (args.containsOption(CLEANUP_SESSIONS)) {
            int keepDays = intOption(args, CLEANUP_SESSIONS, appProperties.getCheckpoint().getRetentionDays());
            int removed = checkpointManager.cleanupOldSessions(keepDays);
            log.info("Removed {} completed sessions older than {} days", removed, keepDays);
            return;
        }

        GenerationRunOptions options = resolveOptions(args);
        log.info("===============================================");
        log.info("Starting generation run");
        log.info("===============================================");
        log.info("Input directory: {}", options.inputDir().toAbsolutePath());
        log.info("Concurrency: {}, attempts per item: {}", options.concurrency(), options.maxRetries());
        log.info("Target size: {}, resume: {}", options.targetSize(), options.resume());

        GenerationRunSummary summary = pipeline.run(options);

        log.info("===============================================");
        log.info("GENERATION RUN {}", summary.status());
        log.info("===============================================");
        log.info("Session: {}", summary.sessionId());
        log.info(
                "Progress: {}/{} ({})",
                summary.progress().currentCount(),
                summary.progress().targetSize(),
                String.format(Locale.ROOT, "%.1f%%", summary.progress().percentage()));
        log.info("Recorded this run: {}", summary.recorded());
        log.info("Dead-lettered this run: {}", summary.deadLettered());
        log.info("Skipped (run stopping): {}", summary.skipped());
        log.info("Already done before this run: {}", summary.alreadyDone());
        if (!summary.recentFailures().isEmpty()) {
            log.info("Recent failures:");
            summary.recentFailures().forEach(failure -> log.info("  {}", failure));
        }
    }

    /**
     * Overlays command-line flags on the configured defaults.
     */
    GenerationRunOptions resolveOptions(ApplicationArguments args) {
        GenerationRunOptions defaults = GenerationRunOptions.defaults(appProperties.getGeneration());
        boolean resume = defaults.resume();
        if (args.containsOption(RESUME)) {
            resume = true;
        }
        if (args.containsOption(FRESH)) {
            resume = false;
        }
        String inputDir = stringOption(args, INPUT_DIR);
        return new GenerationRunOptions(
                intOption(args, CONCURRENCY, defaults.concurrency()),
                intOption(args, MAX_RETRIES, defaults.maxRetries()),
                longOption(args, TARGET_SIZE, defaults.targetSize()),
                defaults.qualityThreshold(),
                resume,
                inputDir == null ? defaults.inputDir() : Path.of(inputDir));
    }

    private void listDeadLetters() {
        List<DeadLetterEntry> entries = deadLetterQueue.list();
        log.info("Dead-letter queue {} holds {} items", deadLetterQueue.directory().toAbsolutePath(), entries.size());
        for (DeadLetterEntry entry : entries) {
            log.info("  {} [{}] {}", entry.itemId(), entry.failedAt(), entry.reason());
        }
    }

    private static String stringOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int intOption(ApplicationArguments args, String name, int fallback) {
        String value = stringOption(args, name);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException invalid) {
            throw new IllegalArgumentException("--" + name + " must be an integer, got '" + value + "'", invalid);
        }
    }

    private static long longOption(ApplicationArguments args, String name, long fallback) {
        String value = stringOption(args, name);
        if (value == null) {
            return fallback;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException invalid) {
            throw new IllegalArgumentException("--" + name + " must be an integer, got '" + value + "'", invalid);
        }
    }
}
