package com.example.treeinventory;

import com.example.treeinventory.tree.DirectoryRecord;
import com.example.treeinventory.tree.FileEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Computes a directory's aggregate and files-only checksums, recursing into subdirectories.
 *
 * <p>The aggregate checksum is MD5 over, in enumeration order, each subdirectory name followed
 * by that subdirectory's aggregate checksum, then the files-only checksum. The files-only
 * checksum is MD5 over each immediate file name followed by the file's content digest. All
 * digests enter their parent accumulator as lowercase hex text.
 */
public final class BranchCalculator {
    private static final Logger LOGGER = LoggerFactory.getLogger(BranchCalculator.class);

    private final BranchScheduler scheduler;
    private final OccasionThrottle throttle;
    private final ProgressCounters progress;
    private final DirectoryEnumerator enumerator;
    private final FileHasher hasher;
    private final ProcessingLimiter limiter;
    private final boolean continuePrevious;
    private final boolean detailFiles;
    private final String recordFileName;

    public BranchCalculator(InventoryConfig config,
                            BranchScheduler scheduler,
                            OccasionThrottle throttle,
                            ProgressCounters progress,
                            DirectoryEnumerator enumerator,
                            FileHasher hasher,
                            ProcessingLimiter limiter) {
        this.scheduler = scheduler;
        this.throttle = throttle;
        this.progress = progress;
        this.enumerator = enumerator;
        this.hasher = hasher;
        this.limiter = limiter;
        this.continuePrevious = config.continuePrevious();
        this.detailFiles = config.detailFiles();
        this.recordFileName = config.recordFileName();
    }

    /**
     * Populates {@code record} for {@code directory} in place. On return the record is complete.
     *
     * @param depth distance from the directory holding the record file; the record file and its
     *              temporary sibling are only excluded from hashing at depth 0
     * @throws BranchFailedException if the directory or anything below it could not be read;
     *                               sibling branches still run to completion first
     * @throws CalculationPausedException if the processing limit stopped part of the subtree
     */
    public void computeBranch(DirectoryRecord record, Path directory, int depth)
            throws BranchFailedException, CalculationPausedException, InterruptedException {
        long finished = progress.filesDone();
        if (limiter.shouldStop(finished)) {
            throw new CalculationPausedException(directory, finished);
        }
        throttle.maybeFire();

        record.invalidate();
        DirectoryListing listing;
        try {
            listing = enumerator.enumerate(directory);
        } catch (IOException ex) {
            throw new BranchFailedException(directory, ex);
        }
        progress.addDiscovered(listing.entryCount());

        NavigableMap<String, DirectoryRecord> children = prepareChildren(record, listing.subdirectories());
        scheduleChildren(children, directory, depth, listing.subdirectories());

        MessageDigest checksum = Checksums.newMd5();
        long totalSize = 0;
        for (String name : listing.subdirectories()) {
            DirectoryRecord child = children.get(name);
            Checksums.update(checksum, name);
            Checksums.update(checksum, child.getMd5());
            totalSize += child.getSize();
            progress.entryDone();
            throttle.maybeFire();
        }

        MessageDigest filesChecksum = Checksums.newMd5();
        Map<String, FileEntry> fileListing = detailFiles ? new ConcurrentSkipListMap<>() : null;
        int fileCount = 0;
        long filesSize = 0;
        for (String name : listing.files()) {
            if (depth == 0 && isRecordFile(name)) {
                progress.entryDone();
                continue;
            }
            Path file = directory.resolve(name);
            FileDigest digest;
            try {
                digest = hasher.hash(file);
            } catch (IOException ex) {
                throw new BranchFailedException(file, ex);
            }
            Checksums.update(filesChecksum, name);
            Checksums.update(filesChecksum, digest.md5());
            LOGGER.trace("Hashed {} as {}", file, digest.md5());
            fileCount++;
            filesSize += digest.size();
            if (fileListing != null) {
                fileListing.put(name, new FileEntry(digest.md5(), digest.size(), digest.lastModifiedAt(),
                        hasher.detectMimeType(file)));
            }
            progress.entryDone();
            throttle.maybeFire();
        }
        String filesOnly = Checksums.hex(filesChecksum);
        Checksums.update(checksum, filesOnly);

        record.setSize(totalSize + filesSize);
        record.setFileCount(fileCount);
        record.setFilesSize(filesSize);
        record.setMd5FilesOnly(filesOnly);
        record.setFileListing(fileListing);
        record.setMd5(Checksums.hex(checksum));
        LOGGER.debug("Computed {} for {}", record.getMd5(), directory);
    }

    /**
     * Recombines an already-scanned record's checksum from its children without touching the
     * filesystem. A record that was never scanned is left untouched.
     *
     * @throws IncompleteChildException if any subdirectory record has no checksum
     */
    public void recalculate(DirectoryRecord record) {
        MessageDigest checksum = Checksums.newMd5();
        for (Map.Entry<String, DirectoryRecord> entry : record.subdirectoriesOrEmpty().entrySet()) {
            DirectoryRecord child = entry.getValue();
            if (!child.isComplete()) {
                throw new IncompleteChildException(entry.getKey());
            }
            Checksums.update(checksum, entry.getKey());
            Checksums.update(checksum, child.getMd5());
        }
        if (record.getMd5FilesOnly() == null) {
            if (record.getMd5() == null) {
                // Never scanned: leave it for a continue run.
                return;
            }
            throw new IllegalStateException("Record has a checksum but no files-only checksum.");
        }
        Checksums.update(checksum, record.getMd5FilesOnly());
        record.setMd5(Checksums.hex(checksum));
    }

    private NavigableMap<String, DirectoryRecord> prepareChildren(DirectoryRecord record, List<String> names) {
        if (names.isEmpty()) {
            record.setSubdirectories(null);
            return new ConcurrentSkipListMap<>();
        }
        if (!continuePrevious) {
            record.setSubdirectories(null);
        }
        NavigableMap<String, DirectoryRecord> children = record.subdirectoriesForUpdate();
        // Entries for directories that disappeared since the last run would break recalculation.
        children.keySet().retainAll(new HashSet<>(names));
        for (String name : names) {
            children.computeIfAbsent(name, ignored -> new DirectoryRecord());
        }
        return children;
    }

    private void scheduleChildren(NavigableMap<String, DirectoryRecord> children,
                                  Path directory,
                                  int depth,
                                  List<String> names)
            throws BranchFailedException, CalculationPausedException, InterruptedException {
        List<Future<Void>> pending = new ArrayList<>();
        List<Throwable> failures = new ArrayList<>();
        for (String name : names) {
            DirectoryRecord child = children.get(name);
            if (isReusable(child)) {
                continue;
            }
            Path childPath = directory.resolve(name);
            if (scheduler.tryAdmit()) {
                pending.add(scheduler.submit(() -> {
                    computeBranch(child, childPath, depth + 1);
                    return null;
                }));
            } else {
                try {
                    computeBranch(child, childPath, depth + 1);
                } catch (BranchFailedException | CalculationPausedException | RuntimeException ex) {
                    // Async siblings must be joined before anything is rethrown.
                    failures.add(ex);
                }
            }
        }
        if (!pending.isEmpty()) {
            LOGGER.debug("{} subdirectories of {} were analyzed in parallel.", pending.size(), directory);
        }
        for (Future<Void> future : pending) {
            try {
                future.get();
            } catch (ExecutionException ex) {
                failures.add(ex.getCause());
            }
        }
        if (!failures.isEmpty()) {
            rethrow(failures);
        }
    }

    /**
     * Rethrows the most severe failure of a join: unchecked errors first, then read failures,
     * then pauses. The others are attached as suppressed.
     */
    private static void rethrow(List<Throwable> failures)
            throws BranchFailedException, CalculationPausedException {
        Throwable primary = failures.get(0);
        for (Throwable failure : failures) {
            if (severity(failure) > severity(primary)) {
                primary = failure;
            }
        }
        for (Throwable failure : failures) {
            if (failure != primary) {
                primary.addSuppressed(failure);
            }
        }
        if (primary instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (primary instanceof Error error) {
            throw error;
        }
        if (primary instanceof BranchFailedException failed) {
            throw failed;
        }
        if (primary instanceof CalculationPausedException paused) {
            throw paused;
        }
        throw new IllegalStateException("Unexpected branch failure", primary);
    }

    private static int severity(Throwable failure) {
        if (failure instanceof RuntimeException || failure instanceof Error) {
            return 3;
        }
        if (failure instanceof BranchFailedException) {
            return 2;
        }
        return 1;
    }

    /**
     * A complete child is reused as is, unless it comes from an older or edited record without a size.
     */
    private static boolean isReusable(DirectoryRecord child) {
        return child.isComplete() && child.getSize() != null;
    }

    private boolean isRecordFile(String name) {
        return name.equals(recordFileName) || name.equals(RecordStore.temporaryFileName(recordFileName));
    }
}
