package com.example.treeinventory;

import com.example.treeinventory.tree.DirectoryRecord;
import org.apache.tika.Tika;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TreeChecksumEngineTest {
    @Test
    void writesRecordFileForNewTree() throws Exception {
        Path root = Files.createTempDirectory("engine-new");
        BranchCalculatorTest.populate(root, 2, 2);

        new TreeChecksumEngine(InventoryConfig.of(root, 2), ProgressListener.noop()).computeTree();

        DirectoryRecord record = load(root);
        assertNotNull(record.getMd5());
        assertNotNull(record.getCalculatedAt());
        assertEquals(2, record.getSubdirectories().size());
        assertTrue(record.getSubdirectories().values().stream().allMatch(DirectoryRecord::isComplete));
    }

    @Test
    void rejectsNewAndContinueTogetherBeforeAnyWork() throws Exception {
        Path root = Files.createTempDirectory("engine-conflict");
        Files.writeString(root.resolve("file.txt"), "content");
        InventoryConfig config = InventoryConfig.of(root, 1).withStartNew(true).withContinuePrevious(true);

        assertThrows(IllegalArgumentException.class,
                () -> new TreeChecksumEngine(config, ProgressListener.noop()).computeTree());
        assertFalse(Files.exists(root.resolve(InventoryConfig.DEFAULT_RECORD_FILE_NAME)));
    }

    @Test
    void resumesFromCheckpoint() throws Exception {
        Path root = Files.createTempDirectory("engine-resume");
        for (int i = 0; i < 4; i++) {
            Path dir = Files.createDirectory(root.resolve("d" + i));
            Files.writeString(dir.resolve("one.txt"), "one" + i);
            Files.writeString(dir.resolve("two.txt"), "two" + i);
        }
        InventoryConfig fresh = InventoryConfig.of(root, 1).withStartNew(true);
        new TreeChecksumEngine(fresh, ProgressListener.noop()).computeTree();
        String uninterrupted = load(root).getMd5();

        CountingHasher firstHasher = new CountingHasher();
        new TreeChecksumEngine(fresh, ProgressListener.noop(), finished -> finished >= 3, firstHasher).computeTree();

        DirectoryRecord checkpoint = load(root);
        assertNull(checkpoint.getMd5());
        assertNotNull(checkpoint.getSubdirectories().get("d0").getMd5());
        assertNull(checkpoint.getSubdirectories().get("d3").getMd5());
        assertEquals(4, firstHasher.hashed.get());

        CountingHasher secondHasher = new CountingHasher();
        InventoryConfig resume = InventoryConfig.of(root, 2).withContinuePrevious(true);
        new TreeChecksumEngine(resume, ProgressListener.noop(), ProcessingLimiter.NO_LIMIT, secondHasher).computeTree();

        assertEquals(uninterrupted, load(root).getMd5());
        assertEquals(4, secondHasher.hashed.get());
    }

    @Test
    void nestedRecomputationInvalidatesAndRestoresAncestors() throws Exception {
        Path root = Files.createTempDirectory("engine-nested");
        BranchCalculatorTest.populate(root, 3, 2);
        Path nested = root.resolve("d1").resolve("d0");
        new TreeChecksumEngine(InventoryConfig.of(root, 2).withStartNew(true), ProgressListener.noop()).computeTree();
        String before = load(root).getMd5();

        Files.writeString(nested.resolve("d1").resolve("file0.txt"), "modified");

        // Stop before the nested branch starts to observe the invalidated checkpoint.
        new TreeChecksumEngine(InventoryConfig.of(nested, 2), ProgressListener.noop(),
                finished -> true, new FileHasher(new Tika())).computeTree();
        DirectoryRecord invalidated = load(root);
        assertNull(invalidated.getMd5());
        assertNull(invalidated.getSubdirectories().get("d1").getMd5());
        assertNotNull(invalidated.getSubdirectories().get("d0").getMd5());
        assertFalse(Files.exists(nested.resolve(InventoryConfig.DEFAULT_RECORD_FILE_NAME)));

        new TreeChecksumEngine(InventoryConfig.of(nested, 2), ProgressListener.noop()).computeTree();
        String restored = load(root).getMd5();
        assertNotNull(restored);
        assertNotEquals(before, restored);

        new TreeChecksumEngine(InventoryConfig.of(root, 3).withStartNew(true), ProgressListener.noop()).computeTree();
        assertEquals(load(root).getMd5(), restored);
    }

    @Test
    void siblingLeftPausedKeepsAncestorsIncompleteButSavesTheRun() throws Exception {
        Path root = Files.createTempDirectory("engine-paused-sibling");
        BranchCalculatorTest.populate(root, 1, 2);
        new TreeChecksumEngine(InventoryConfig.of(root, 1), ProgressListener.noop()).computeTree();

        new TreeChecksumEngine(InventoryConfig.of(root.resolve("d0"), 1), ProgressListener.noop(),
                finished -> true, new FileHasher(new Tika())).computeTree();
        String d1Before = load(root).getSubdirectories().get("d1").getMd5();

        Files.writeString(root.resolve("d1").resolve("file0.txt"), "modified");
        new TreeChecksumEngine(InventoryConfig.of(root.resolve("d1"), 1), ProgressListener.noop()).computeTree();

        DirectoryRecord afterSibling = load(root);
        assertNull(afterSibling.getMd5());
        assertNull(afterSibling.getSubdirectories().get("d0").getMd5());
        String d1After = afterSibling.getSubdirectories().get("d1").getMd5();
        assertNotNull(d1After);
        assertNotEquals(d1Before, d1After);

        new TreeChecksumEngine(InventoryConfig.of(root, 1).withContinuePrevious(true), ProgressListener.noop())
                .computeTree();
        String resumed = load(root).getMd5();
        assertNotNull(resumed);
        new TreeChecksumEngine(InventoryConfig.of(root, 1).withStartNew(true), ProgressListener.noop()).computeTree();
        assertEquals(load(root).getMd5(), resumed);
    }

    @Test
    void readFailureSavesPartialRecordAndPropagates() throws Exception {
        Path root = Files.createTempDirectory("engine-failure");
        Files.writeString(Files.createDirectory(root.resolve("good")).resolve("ok.txt"), "ok");
        Files.writeString(Files.createDirectory(root.resolve("bad")).resolve("broken.txt"), "broken");
        FileHasher failing = new FileHasher(new Tika()) {
            @Override
            public FileDigest hash(Path file) throws IOException {
                if (file.getFileName().toString().equals("broken.txt")) {
                    throw new IOException("simulated read failure");
                }
                return super.hash(file);
            }
        };

        assertThrows(BranchFailedException.class, () -> new TreeChecksumEngine(InventoryConfig.of(root, 2),
                ProgressListener.noop(), ProcessingLimiter.NO_LIMIT, failing).computeTree());

        DirectoryRecord partial = load(root);
        assertNull(partial.getMd5());
        assertNotNull(partial.getSubdirectories().get("good").getMd5());
        assertNull(partial.getSubdirectories().get("bad").getMd5());

        new TreeChecksumEngine(InventoryConfig.of(root, 2).withContinuePrevious(true), ProgressListener.noop())
                .computeTree();
        assertNotNull(load(root).getMd5());
    }

    @Test
    void startNewBelowExistingRecordKeepsTheHigherRecord() throws Exception {
        Path root = Files.createTempDirectory("engine-start-new");
        BranchCalculatorTest.populate(root, 2, 2);
        new TreeChecksumEngine(InventoryConfig.of(root, 1), ProgressListener.noop()).computeTree();
        String rootChecksum = load(root).getMd5();
        Path nested = root.resolve("d0");

        new TreeChecksumEngine(InventoryConfig.of(nested, 1).withStartNew(true), ProgressListener.noop()).computeTree();

        DirectoryRecord nestedRecord = load(nested);
        assertEquals(load(root).getSubdirectories().get("d0").getMd5(), nestedRecord.getMd5());
        assertEquals(rootChecksum, load(root).getMd5());
    }

    @Test
    void reportsFinalProgress() throws Exception {
        Path root = Files.createTempDirectory("engine-progress");
        BranchCalculatorTest.populate(root, 1, 2);
        long[] last = new long[2];

        new TreeChecksumEngine(InventoryConfig.of(root, 1), (totalFiles, filesDone) -> {
            last[0] = totalFiles;
            last[1] = filesDone;
        }).computeTree();

        assertEquals(8L, last[0]);
        assertEquals(8L, last[1]);
    }

    private static DirectoryRecord load(Path directory) throws IOException {
        return new RecordStore(directory.resolve(InventoryConfig.DEFAULT_RECORD_FILE_NAME)).load();
    }

    private static final class CountingHasher extends FileHasher {
        private final AtomicInteger hashed = new AtomicInteger();

        private CountingHasher() {
            super(new Tika());
        }

        @Override
        public FileDigest hash(Path file) throws IOException {
            hashed.incrementAndGet();
            return super.hash(file);
        }
    }
}
