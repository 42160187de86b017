package com.example.treeinventory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable runtime settings for a checksum run.
 */
public record InventoryConfig(
        Path target,
        boolean continuePrevious,
        boolean startNew,
        boolean detailFiles,
        int parallelism,
        boolean followLinks,
        String recordFileName,
        Duration newRecordWarningDelay,
        Optional<Integer> maxEntries
) {
    public static final String DEFAULT_RECORD_FILE_NAME = "tree_checksum.json";

    /**
     * Settings for a plain run over {@code target} with the given parallelism.
     */
    public static InventoryConfig of(Path target, int parallelism) {
        return new InventoryConfig(
                target,
                false,
                false,
                false,
                parallelism,
                false,
                DEFAULT_RECORD_FILE_NAME,
                Duration.ZERO,
                Optional.empty()
        );
    }

    public InventoryConfig withContinuePrevious(boolean value) {
        return new InventoryConfig(target, value, startNew, detailFiles, parallelism, followLinks,
                recordFileName, newRecordWarningDelay, maxEntries);
    }

    public InventoryConfig withStartNew(boolean value) {
        return new InventoryConfig(target, continuePrevious, value, detailFiles, parallelism, followLinks,
                recordFileName, newRecordWarningDelay, maxEntries);
    }

    public InventoryConfig withDetailFiles(boolean value) {
        return new InventoryConfig(target, continuePrevious, startNew, value, parallelism, followLinks,
                recordFileName, newRecordWarningDelay, maxEntries);
    }

    public InventoryConfig withTarget(Path value) {
        return new InventoryConfig(value, continuePrevious, startNew, detailFiles, parallelism, followLinks,
                recordFileName, newRecordWarningDelay, maxEntries);
    }
}
