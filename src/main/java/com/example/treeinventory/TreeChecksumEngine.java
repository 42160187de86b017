package com.example.treeinventory;

import com.example.treeinventory.tree.DirectoryRecord;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Orchestrates a checksum run: selects new or resume mode, invalidates the ancestors of the
 * target, computes the target subtree, restores the ancestors bottom-up and persists the tree.
 */
public final class TreeChecksumEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(TreeChecksumEngine.class);

    private final InventoryConfig config;
    private final ProgressListener progressListener;
    private final ProcessingLimiter limiter;
    private final FileHasher hasher;

    public TreeChecksumEngine(InventoryConfig config, ProgressListener progressListener) {
        this(config, progressListener, ProcessingLimiter.NO_LIMIT, new FileHasher(new Tika()));
    }

    TreeChecksumEngine(InventoryConfig config,
                       ProgressListener progressListener,
                       ProcessingLimiter limiter,
                       FileHasher hasher) {
        this.config = config;
        this.progressListener = progressListener;
        this.limiter = limiter;
        this.hasher = hasher;
    }

    /**
     * Computes (or resumes computing) the checksum tree for the configured target and writes the
     * record file. A run stopped by the processing limiter saves a checkpoint and returns normally.
     *
     * @throws IllegalArgumentException if both new and continue modes are requested
     * @throws BranchFailedException if part of the tree could not be read; the partial record is
     *                               saved first
     */
    public void computeTree() throws IOException, InterruptedException {
        if (config.startNew() && config.continuePrevious()) {
            throw new IllegalArgumentException("Cannot specify both startNew and continuePrevious at the same time.");
        }
        Path target = config.target().toAbsolutePath().normalize();
        if (!Files.isDirectory(target)) {
            throw new IllegalArgumentException("Target is not a directory: " + target);
        }
        LOGGER.info("Calculating checksum for path '{}'...", target);

        RecordStore store;
        DirectoryRecord root;
        DirectoryRecord targetRecord;
        List<DirectoryRecord> ancestors;
        Optional<Path> existing = config.startNew()
                ? Optional.empty()
                : RecordStore.locateRecordFile(target, config.recordFileName());
        if (existing.isEmpty()) {
            store = new RecordStore(target.resolve(config.recordFileName()));
            if (config.startNew()) {
                prepareNewRecord(target, store);
            }
            root = targetRecord = new DirectoryRecord();
            ancestors = List.of();
        } else {
            LOGGER.info("Updating existing checksum file found at: {}", existing.get());
            store = new RecordStore(existing.get());
            root = store.load();
            RecordLocation location = store.locate(root, target);
            targetRecord = location.target();
            ancestors = location.ancestors();
            if (!config.continuePrevious()) {
                targetRecord.clear();
            }
        }
        root.setCalculatedAt(Instant.now());

        // Ancestors are stale until the target subtree is done.
        ancestors.forEach(DirectoryRecord::invalidate);
        LOGGER.debug("Ancestor records: root / {}", store.baseDirectory().relativize(target));
        LOGGER.debug("Using {} threads in parallel.", config.parallelism());

        ProgressCounters progress = new ProgressCounters();
        OccasionThrottle throttle = new OccasionThrottle(() -> onOccasion(store, root, progress));
        try (BranchScheduler scheduler = new BranchScheduler(config.parallelism())) {
            BranchCalculator calculator = new BranchCalculator(
                    config,
                    scheduler,
                    throttle,
                    progress,
                    new DirectoryEnumerator(config.followLinks()),
                    hasher,
                    limiter
            );
            try {
                calculator.computeBranch(targetRecord, target, ancestors.size());
            } catch (CalculationPausedException ex) {
                LOGGER.info("Stopping early after {} entries: {}", progress.filesDone(), ex.getMessage());
                store.save(root);
                LOGGER.info("Calculation paused with checkpoint.");
                return;
            } catch (BranchFailedException ex) {
                LOGGER.error("Checksum incomplete for {}; saving partial record for a later continue run.",
                        ex.path(), ex);
                store.save(root);
                throw ex;
            }
            LOGGER.debug("Peak parallel branches: {}", scheduler.peakInFlight());
            restoreAncestors(calculator, ancestors);
        }

        progressListener.onProgress(progress.totalFiles(), progress.filesDone());
        store.save(root);
        LOGGER.info("Done.");
    }

    /**
     * Recombines ancestor checksums from the innermost ancestor up to the root. Stops at the
     * first ancestor that stays incomplete, either never scanned or with another subdirectory
     * still unfinished from an earlier paused or failed run.
     */
    private void restoreAncestors(BranchCalculator calculator, List<DirectoryRecord> ancestors) {
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            DirectoryRecord ancestor = ancestors.get(i);
            boolean childrenComplete = ancestor.subdirectoriesOrEmpty().values().stream()
                    .allMatch(DirectoryRecord::isComplete);
            if (childrenComplete) {
                calculator.recalculate(ancestor);
            }
            if (!ancestor.isComplete()) {
                LOGGER.info("Higher-level records remain incomplete; run again with continuePrevious to finish them.");
                return;
            }
        }
    }

    private void prepareNewRecord(Path target, RecordStore store) throws IOException, InterruptedException {
        Path parent = target.getParent();
        Optional<Path> higher = RecordStore.locateRecordFile(parent, config.recordFileName());
        if (higher.isPresent()) {
            LOGGER.warn("Starting a new record file at: {}", store.path());
            LOGGER.warn("However a higher-level record file was found at: {}", higher.get());
            LOGGER.warn("Operations started above this directory will keep using the higher-level record.");
            LOGGER.warn("Consider removing startNew from your configuration or deleting the higher-level record if not intentional.");
            Thread.sleep(config.newRecordWarningDelay().toMillis());
            LOGGER.warn("Proceeding as requested.");
        }
        Files.deleteIfExists(store.path());
    }

    private void onOccasion(RecordStore store, DirectoryRecord root, ProgressCounters progress) {
        progressListener.onProgress(progress.totalFiles(), progress.filesDone());
        try {
            store.save(root);
        } catch (IOException ex) {
            LOGGER.warn("Failed to save checkpoint to {}", store.path(), ex);
        }
    }
}
