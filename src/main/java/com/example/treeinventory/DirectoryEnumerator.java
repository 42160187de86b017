package com.example.treeinventory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lists a directory's immediate files and subdirectories in lexicographic name order
 * ({@link String#compareTo}). The order feeds the checksum directly, so it never depends on
 * what the filesystem happens to return.
 */
public class DirectoryEnumerator {
    private final boolean followLinks;

    public DirectoryEnumerator(boolean followLinks) {
        this.followLinks = followLinks;
    }

    public DirectoryListing enumerate(Path directory) throws IOException {
        List<String> files = new ArrayList<>();
        List<String> subdirectories = new ArrayList<>();
        LinkOption[] linkOptions = followLinks ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                if (!followLinks && Files.isSymbolicLink(entry)) {
                    continue;
                }
                String name = entry.getFileName().toString();
                if (Files.isDirectory(entry, linkOptions)) {
                    subdirectories.add(name);
                } else if (Files.isRegularFile(entry, linkOptions)) {
                    files.add(name);
                }
            }
        }
        Collections.sort(files);
        Collections.sort(subdirectories);
        return new DirectoryListing(List.copyOf(files), List.copyOf(subdirectories));
    }
}
