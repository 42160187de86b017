package com.example.treeinventory;

import java.time.Instant;

/**
 * Content digest of one file together with the attributes read alongside it.
 */
public record FileDigest(
        String md5,
        long size,
        Instant lastModifiedAt
) {
}
