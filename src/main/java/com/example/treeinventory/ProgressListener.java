package com.example.treeinventory;

/**
 * Receives progress on every occasion of a checksum run.
 */
@FunctionalInterface
public interface ProgressListener {
    void onProgress(long totalFiles, long filesDone);

    static ProgressListener noop() {
        return (totalFiles, filesDone) -> {
        };
    }
}
