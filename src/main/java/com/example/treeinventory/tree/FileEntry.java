package com.example.treeinventory.tree;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Per-file detail written into a directory record's file listing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileEntry(
        @JsonProperty("MD5") String md5,
        @JsonProperty("size") long size,
        @JsonProperty("last-modified-at") Instant lastModifiedAt,
        @JsonProperty("mime-type") String mimeType
) {
}
