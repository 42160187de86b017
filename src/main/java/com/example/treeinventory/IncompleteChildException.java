package com.example.treeinventory;

/**
 * A record was asked to recombine its checksum while one of its subdirectories had none.
 */
public class IncompleteChildException extends IllegalStateException {
    public IncompleteChildException(String childName) {
        super("Cannot recalculate this record because sub-record '" + childName
                + "' does not have a completed checksum.");
    }
}
