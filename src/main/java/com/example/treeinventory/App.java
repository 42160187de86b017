package com.example.treeinventory;

import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // Basic CLI contract: a single JSON config file path is required.
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar tree-inventory.jar <config.json>");
            System.exit(1);
        }
        InventoryConfig config = new ConfigLoader().load(Path.of(args[0]));
        ProcessingLimiter limiter = config.maxEntries()
                .map(max -> (ProcessingLimiter) finished -> finished >= max)
                .orElse(ProcessingLimiter.NO_LIMIT);
        ProgressListener progress = (totalFiles, filesDone) ->
                LOGGER.info("Progress: {}/{} entries", filesDone, totalFiles);
        TreeChecksumEngine engine = new TreeChecksumEngine(config, progress, limiter, new FileHasher(new Tika()));
        engine.computeTree();
    }
}
