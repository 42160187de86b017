package com.example.treeinventory;

import java.util.List;

/**
 * Immediate entries of one directory, each list sorted by name.
 */
public record DirectoryListing(
        List<String> files,
        List<String> subdirectories
) {
    public int entryCount() {
        return files.size() + subdirectories.size();
    }
}
