package com.example.treeinventory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

public class ConfigLoader {
    private static final int DEFAULT_WARNING_SECONDS = 5;

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public InventoryConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        if (raw.target == null || raw.target.isBlank()) {
            throw new IllegalArgumentException("Config must include a target directory.");
        }
        boolean continuePrevious = raw.continuePrevious != null && raw.continuePrevious;
        boolean startNew = raw.startNew != null && raw.startNew;
        if (continuePrevious && startNew) {
            throw new IllegalArgumentException("Cannot specify both startNew and continuePrevious at the same time.");
        }

        int parallelism = raw.parallelism != null && raw.parallelism > 0
                ? raw.parallelism
                : Math.max(1, Runtime.getRuntime().availableProcessors());
        boolean detailFiles = raw.detailFiles != null && raw.detailFiles;
        boolean followLinks = raw.followLinks != null && raw.followLinks;
        String recordFileName = optionalString(raw.recordFileName, InventoryConfig.DEFAULT_RECORD_FILE_NAME);
        int warningSeconds = raw.newRecordWarningSeconds != null && raw.newRecordWarningSeconds >= 0
                ? raw.newRecordWarningSeconds
                : DEFAULT_WARNING_SECONDS;
        Optional<Integer> maxEntries = Optional.ofNullable(raw.maxEntries).filter(value -> value > 0);

        return new InventoryConfig(
                Path.of(raw.target),
                continuePrevious,
                startNew,
                detailFiles,
                parallelism,
                followLinks,
                recordFileName,
                Duration.ofSeconds(warningSeconds),
                maxEntries
        );
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String target;
        public Boolean continuePrevious;
        public Boolean startNew;
        public Boolean detailFiles;
        public Integer parallelism;
        public Boolean followLinks;
        public String recordFileName;
        public Integer newRecordWarningSeconds;
        public Integer maxEntries;
    }
}
