package com.williamcallahan.setforge.support;

import com.williamcallahan.setforge.config.AppProperties;
import java.nio.file.Path;

/**
 * Default settings with checkpoint and dead-letter state kept under a test directory.
 */
public final class TestAppProperties {

    private TestAppProperties() {}

    /**
     * Uses {@code root/checkpoints} and {@code root/dlq}.
     */
    public static AppProperties storedUnder(Path root) {
        AppProperties appProperties = new AppProperties();
        appProperties.getCheckpoint().setDir(root.resolve("checkpoints").toString());
        appProperties.getDeadLetter().setDir(root.resolve("dlq").toString());
        return appProperties;
    }
}
