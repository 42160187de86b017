package com.example.treeinventory.tree;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Persisted checksum node for one directory. Mirrors the filesystem: children are keyed by
 * subdirectory name and sorted the same way the enumerator orders them.
 *
 * <p>A record is complete iff {@code MD5} is present. Fields are written by a single branch
 * computation at a time, but may be serialized concurrently by a checkpoint, so they are
 * volatile and the aggregate checksum is always assigned last.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"calculated_at", "MD5", "MD5-files_only", "size", "n_files", "files-size", "file-listing", "subdirectories"})
public final class DirectoryRecord {
    private volatile Instant calculatedAt;
    private volatile String md5;
    private volatile String md5FilesOnly;
    private volatile Long size;
    private volatile Integer fileCount;
    private volatile Long filesSize;
    private volatile NavigableMap<String, FileEntry> fileListing;
    private volatile NavigableMap<String, DirectoryRecord> subdirectories;

    @JsonProperty("calculated_at")
    public Instant getCalculatedAt() {
        return calculatedAt;
    }

    @JsonProperty("calculated_at")
    public void setCalculatedAt(Instant calculatedAt) {
        this.calculatedAt = calculatedAt;
    }

    @JsonProperty("MD5")
    public String getMd5() {
        return md5;
    }

    @JsonProperty("MD5")
    public void setMd5(String md5) {
        this.md5 = md5;
    }

    @JsonProperty("MD5-files_only")
    public String getMd5FilesOnly() {
        return md5FilesOnly;
    }

    @JsonProperty("MD5-files_only")
    public void setMd5FilesOnly(String md5FilesOnly) {
        this.md5FilesOnly = md5FilesOnly;
    }

    @JsonProperty("size")
    public Long getSize() {
        return size;
    }

    @JsonProperty("size")
    public void setSize(Long size) {
        this.size = size;
    }

    @JsonProperty("n_files")
    public Integer getFileCount() {
        return fileCount;
    }

    @JsonProperty("n_files")
    public void setFileCount(Integer fileCount) {
        this.fileCount = fileCount;
    }

    @JsonProperty("files-size")
    public Long getFilesSize() {
        return filesSize;
    }

    @JsonProperty("files-size")
    public void setFilesSize(Long filesSize) {
        this.filesSize = filesSize;
    }

    @JsonProperty("file-listing")
    public NavigableMap<String, FileEntry> getFileListing() {
        return fileListing;
    }

    @JsonProperty("file-listing")
    public void setFileListing(Map<String, FileEntry> fileListing) {
        this.fileListing = fileListing == null ? null : new ConcurrentSkipListMap<>(fileListing);
    }

    @JsonProperty("subdirectories")
    public NavigableMap<String, DirectoryRecord> getSubdirectories() {
        return subdirectories;
    }

    @JsonProperty("subdirectories")
    public void setSubdirectories(Map<String, DirectoryRecord> subdirectories) {
        this.subdirectories = subdirectories == null ? null : new ConcurrentSkipListMap<>(subdirectories);
    }

    /**
     * Returns the child map, creating an empty one if this record has none yet.
     */
    @JsonIgnore
    public synchronized NavigableMap<String, DirectoryRecord> subdirectoriesForUpdate() {
        if (subdirectories == null) {
            subdirectories = new ConcurrentSkipListMap<>();
        }
        return subdirectories;
    }

    /**
     * Returns the children in name order, or an empty map for a record without subdirectories.
     */
    @JsonIgnore
    public NavigableMap<String, DirectoryRecord> subdirectoriesOrEmpty() {
        NavigableMap<String, DirectoryRecord> current = subdirectories;
        return current == null ? new ConcurrentSkipListMap<>() : current;
    }

    @JsonIgnore
    public boolean isComplete() {
        return md5 != null;
    }

    /**
     * Removes the aggregate checksum; the record stays incomplete until it is recomputed.
     */
    public void invalidate() {
        md5 = null;
    }

    /**
     * Wipes every field in place. Parents keep referencing this instance.
     */
    public synchronized void clear() {
        md5 = null;
        calculatedAt = null;
        md5FilesOnly = null;
        size = null;
        fileCount = null;
        filesSize = null;
        fileListing = null;
        subdirectories = null;
    }
}
