package com.example.treeinventory;

import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;

public class FileHasher {
    private final Tika tika;

    public FileHasher(Tika tika) {
        this.tika = tika;
    }

    public FileDigest hash(Path file) throws IOException {
        BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
        MessageDigest digest = Checksums.newMd5();
        try (InputStream inputStream = Files.newInputStream(file)) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = inputStream.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return new FileDigest(Checksums.hex(digest), attributes.size(), attributes.lastModifiedTime().toInstant());
    }

    public String detectMimeType(Path file) {
        try {
            MediaType mediaType = MediaType.parse(tika.detect(file));
            return mediaType == null ? "application/octet-stream" : mediaType.toString();
        } catch (IOException ex) {
            return "application/octet-stream";
        }
    }
}
