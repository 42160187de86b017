package com.example.treeinventory;

import java.nio.file.Path;

/**
 * Raised by a branch that was not started because the processing limit was reached.
 */
public class CalculationPausedException extends Exception {
    public CalculationPausedException(Path directory, long finishedEntries) {
        super("Paused before " + directory + " after " + finishedEntries + " entries");
    }
}
