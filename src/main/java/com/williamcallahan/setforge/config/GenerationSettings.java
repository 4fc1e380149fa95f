package com.williamcallahan.setforge.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Defaults for a generation run, bound from {@code app.generation}.
 *
 * Command-line flags override the run-shaping values per invocation.
 */
public class GenerationSettings {

    private static final int CONCURRENCY_DEF = 12;
    private static final int MAX_RETRIES_DEF = 3;
    private static final Duration BASE_DELAY_DEF = Duration.ofSeconds(1);
    private static final Duration MAX_BACKOFF_DEF = Duration.ofSeconds(30);
    private static final long TARGET_SIZE_DEF = 100;
    private static final double QUALITY_THRESHOLD_DEF = 0.8d;
    private static final int MAX_TOKENS_DEF = 1024;
    private static final double TEMPERATURE_DEF = 0.1d;
    private static final String INPUT_DIR_DEF = "data/input";
    private static final String PROMPT_TEMPLATE_DEF =
            "Generate a question and answer pair grounded in the following text.\n\n{content}";
    private static final int MIN_POSITIVE = 1;
    private static final String CONCURRENCY_KEY = "app.generation.concurrency";
    private static final String MAX_RETRIES_KEY = "app.generation.max-retries";
    private static final String BASE_DELAY_KEY = "app.generation.base-delay";
    private static final String MAX_BACKOFF_KEY = "app.generation.max-backoff";
    private static final String TARGET_SIZE_KEY = "app.generation.target-size";
    private static final String QUALITY_KEY = "app.generation.quality-threshold";
    private static final String MAX_TOKENS_KEY = "app.generation.max-tokens";
    private static final String TEMPERATURE_KEY = "app.generation.temperature";
    private static final String TEMPLATE_KEY = "app.generation.prompt-template";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String NON_NEG_FMT = "%s must be 0 or greater.";
    private static final String RANGE_FMT = "%s must be between %s and %s.";
    private static final String PLACEHOLDER_FMT = "%s must contain the %s placeholder.";

    private int concurrency = CONCURRENCY_DEF;
    private int maxRetries = MAX_RETRIES_DEF;
    private Duration baseDelay = BASE_DELAY_DEF;
    private Duration maxBackoff = MAX_BACKOFF_DEF;
    private long targetSize = TARGET_SIZE_DEF;
    private double qualityThreshold = QUALITY_THRESHOLD_DEF;
    private int maxTokens = MAX_TOKENS_DEF;
    private double temperature = TEMPERATURE_DEF;
    private boolean resume = true;
    private String inputDir = INPUT_DIR_DEF;
    private String promptTemplate = PROMPT_TEMPLATE_DEF;

    public GenerationSettings() {}

    /**
     * Validates generation settings.
     */
    public void validateConfiguration() {
        requirePositive(CONCURRENCY_KEY, concurrency);
        requirePositive(MAX_RETRIES_KEY, maxRetries);
        requirePositive(TARGET_SIZE_KEY, targetSize);
        requirePositive(MAX_TOKENS_KEY, maxTokens);
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NON_NEG_FMT, BASE_DELAY_KEY));
        }
        if (maxBackoff == null || maxBackoff.isNegative() || maxBackoff.isZero()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, MAX_BACKOFF_KEY));
        }
        if (qualityThreshold < 0.0d || qualityThreshold > 1.0d) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, RANGE_FMT, QUALITY_KEY, 0.0d, 1.0d));
        }
        if (temperature < 0.0d || temperature > 2.0d) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, RANGE_FMT, TEMPERATURE_KEY, 0.0d, 2.0d));
        }
        if (promptTemplate == null || !promptTemplate.contains("{content}")) {
            throw new IllegalArgumentException(
                    String.format(Locale.ROOT, PLACEHOLDER_FMT, TEMPLATE_KEY, "{content}"));
        }
    }

    private static void requirePositive(String key, long value) {
        if (value < MIN_POSITIVE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, key));
        }
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(final int concurrency) {
        this.concurrency = concurrency;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(final int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public void setBaseDelay(final Duration baseDelay) {
        this.baseDelay = baseDelay;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(final Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    public long getTargetSize() {
        return targetSize;
    }

    public void setTargetSize(final long targetSize) {
        this.targetSize = targetSize;
    }

    public double getQualityThreshold() {
        return qualityThreshold;
    }

    public void setQualityThreshold(final double qualityThreshold) {
        this.qualityThreshold = qualityThreshold;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(final int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(final double temperature) {
        this.temperature = temperature;
    }

    public boolean isResume() {
        return resume;
    }

    public void setResume(final boolean resume) {
        this.resume = resume;
    }

    public String getInputDir() {
        return inputDir;
    }

    public void setInputDir(final String inputDir) {
        this.inputDir = inputDir;
    }

    public String getPromptTemplate() {
        return promptTemplate;
    }

    public void setPromptTemplate(final String promptTemplate) {
        this.promptTemplate = promptTemplate;
    }
}
