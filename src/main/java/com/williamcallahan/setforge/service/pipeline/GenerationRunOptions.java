package com.williamcallahan.setforge.service.pipeline;

import com.williamcallahan.setforge.config.GenerationSettings;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Per-run settings, defaulted from {@code app.generation} and overridable from the command line.
 *
 * @param concurrency items in flight at once
 * @param maxRetries attempts per item
 * @param targetSize items that complete a fresh session
 * @param qualityThreshold threshold stored with a fresh session
 * @param resume reopen the latest incomplete session
 * @param inputDir directory scanned for input files
 */
public record GenerationRunOptions(
        int concurrency, int maxRetries, long targetSize, double qualityThreshold, boolean resume, Path inputDir) {
    public GenerationRunOptions {
        Objects.requireNonNull(inputDir, "inputDir");
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        if (targetSize < 1) {
            throw new IllegalArgumentException("targetSize must be at least 1");
        }
    }

    public static GenerationRunOptions defaults(GenerationSettings settings) {
        return new GenerationRunOptions(
                settings.getConcurrency(),
                settings.getMaxRetries(),
                settings.getTargetSize(),
                settings.getQualityThreshold(),
                settings.isResume(),
                Path.of(settings.getInputDir()));
    }
}
