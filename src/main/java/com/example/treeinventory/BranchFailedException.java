package com.example.treeinventory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A branch could not be completed because reading part of its subtree failed. The subtree
 * rooted at {@link #path()} keeps no aggregate checksum.
 */
public class BranchFailedException extends IOException {
    private final Path path;

    public BranchFailedException(Path path, Throwable cause) {
        super("Failed to compute checksum below " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
