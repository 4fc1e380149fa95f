package com.williamcallahan.setforge.config;

import java.util.Locale;

/**
 * Locations of checkpoint and dead-letter state, bound from {@code app.checkpoint} and
 * {@code app.dead-letter}.
 */
public class StorageSettings {

    private static final String CHECKPOINT_DIR_DEF = "checkpoints";
    private static final String DEAD_LETTER_DIR_DEF = "data/dead_letter_queue";
    private static final int RETENTION_DAYS_DEF = 7;
    private static final String DIR_FMT = "%s must not be blank.";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private final String prefix;
    private String dir;
    private int retentionDays = RETENTION_DAYS_DEF;

    private StorageSettings(String prefix, String defaultDir) {
        this.prefix = prefix;
        this.dir = defaultDir;
    }

    static StorageSettings checkpoint() {
        return new StorageSettings("app.checkpoint", CHECKPOINT_DIR_DEF);
    }

    static StorageSettings deadLetter() {
        return new StorageSettings("app.dead-letter", DEAD_LETTER_DIR_DEF);
    }

    /**
     * Validates storage settings.
     */
    public void validateConfiguration() {
        if (dir == null || dir.isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, DIR_FMT, prefix + ".dir"));
        }
        if (retentionDays < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, prefix + ".retention-days"));
        }
    }

    public String getDir() {
        return dir;
    }

    public void setDir(final String dir) {
        this.dir = dir;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public void setRetentionDays(final int retentionDays) {
        this.retentionDays = retentionDays;
    }
}
