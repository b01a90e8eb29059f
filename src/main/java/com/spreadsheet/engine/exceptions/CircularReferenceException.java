package com.spreadsheet.engine.exceptions;

/**
 * Thrown when an edge update would make the dependency graph cyclic
 * (e.g., a cell depending on itself, or a multi-cell loop).
 *
 * Users never see this: the engine probes for cycles first and stores #REF!
 * instead. Reaching it means a caller skipped the probe.
 */
public class CircularReferenceException extends RuntimeException {
    public CircularReferenceException(String message) {
        super(message);
    }
}
