package com.example.treeinventory;

import com.example.treeinventory.tree.DirectoryRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class RecordStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(RecordStore.class);

    private final ObjectMapper mapper;
    private final Path recordPath;

    /**
     * Manages persistence of a checksum record tree to a single JSON file.
     */
    public RecordStore(Path recordPath) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.recordPath = recordPath.toAbsolutePath().normalize();
    }

    /**
     * Walks upward from {@code directory} (inclusive) and returns the nearest record file.
     */
    public static Optional<Path> locateRecordFile(Path directory, String recordFileName) {
        Path current = directory == null ? null : directory.toAbsolutePath().normalize();
        while (current != null) {
            Path candidate = current.resolve(recordFileName);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    /**
     * Name of the file a save writes before moving it over the record file.
     */
    public static String temporaryFileName(String recordFileName) {
        return recordFileName + ".tmp";
    }

    public DirectoryRecord load() throws IOException {
        try (Reader reader = Files.newBufferedReader(recordPath)) {
            return mapper.readValue(reader, DirectoryRecord.class);
        }
    }

    /**
     * Writes the whole tree to a temporary sibling, then moves it over the record file.
     */
    public synchronized void save(DirectoryRecord root) throws IOException {
        LOGGER.info("Saving checksum to file: {}", recordPath);
        Path temporary = recordPath.resolveSibling(temporaryFileName(recordPath.getFileName().toString()));
        mapper.writerWithDefaultPrettyPrinter().writeValue(temporary.toFile(), root);
        try {
            Files.move(temporary, recordPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            LOGGER.debug("Atomic move not supported for {}, replacing in place", recordPath);
            Files.move(temporary, recordPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Finds the record for {@code targetDirectory} below {@code root}, whose directory is the one
     * holding the record file. Missing intermediate records are created empty.
     */
    public RecordLocation locate(DirectoryRecord root, Path targetDirectory) {
        Path base = baseDirectory();
        Path target = targetDirectory.toAbsolutePath().normalize();
        if (!target.startsWith(base)) {
            throw new IllegalArgumentException(target + " is not below the record directory " + base);
        }
        List<DirectoryRecord> ancestors = new ArrayList<>();
        DirectoryRecord current = root;
        for (Path part : base.relativize(target)) {
            String name = part.toString();
            if (name.isEmpty()) {
                continue;
            }
            ancestors.add(current);
            current = current.subdirectoriesForUpdate().computeIfAbsent(name, ignored -> new DirectoryRecord());
        }
        return new RecordLocation(current, List.copyOf(ancestors));
    }

    /**
     * Directory that the root record describes.
     */
    public Path baseDirectory() {
        return recordPath.getParent();
    }

    public Path path() {
        return recordPath;
    }
}
