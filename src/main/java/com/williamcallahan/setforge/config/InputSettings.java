package com.williamcallahan.setforge.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Input file filtering, bound from {@code app.input}.
 */
public class InputSettings {

    private static final long MIN_SIZE_DEF = 100L;
    private static final long MAX_SIZE_DEF = 10L * 1024 * 1024;
    private static final String EXTENSIONS_KEY = "app.input.extensions";
    private static final String MIN_SIZE_KEY = "app.input.min-file-size-bytes";
    private static final String MAX_SIZE_KEY = "app.input.max-file-size-bytes";
    private static final String EMPTY_FMT = "%s must list at least one extension.";
    private static final String NON_NEG_FMT = "%s must be 0 or greater.";
    private static final String BOUND_FMT = "%s must be greater than %s (got %d <= %d).";

    private List<String> extensions = new ArrayList<>(List.of(".txt", ".md"));
    private long minFileSizeBytes = MIN_SIZE_DEF;
    private long maxFileSizeBytes = MAX_SIZE_DEF;

    public InputSettings() {}

    /**
     * Validates input settings.
     */
    public void validateConfiguration() {
        if (extensions == null || extensions.isEmpty()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, EMPTY_FMT, EXTENSIONS_KEY));
        }
        if (minFileSizeBytes < 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NON_NEG_FMT, MIN_SIZE_KEY));
        }
        if (maxFileSizeBytes <= minFileSizeBytes) {
            throw new IllegalArgumentException(String.format(
                    Locale.ROOT, BOUND_FMT, MAX_SIZE_KEY, MIN_SIZE_KEY, maxFileSizeBytes, minFileSizeBytes));
        }
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public void setExtensions(final List<String> extensions) {
        this.extensions = extensions;
    }

    public long getMinFileSizeBytes() {
        return minFileSizeBytes;
    }

    public void setMinFileSizeBytes(final long minFileSizeBytes) {
        this.minFileSizeBytes = minFileSizeBytes;
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public void setMaxFileSizeBytes(final long maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }
}
