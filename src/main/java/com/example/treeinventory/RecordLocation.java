package com.example.treeinventory;

import com.example.treeinventory.tree.DirectoryRecord;

import java.util.List;

/**
 * The record for a target directory and the chain of its ancestor records, root first.
 */
public record RecordLocation(
        DirectoryRecord target,
        List<DirectoryRecord> ancestors
) {
}
