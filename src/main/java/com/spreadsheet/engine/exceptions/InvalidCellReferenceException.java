package com.spreadsheet.engine.exceptions;

/**
 * Thrown when a cell id or range endpoint handed to the engine is not a
 * column-letter/row-number reference.
 * For example, "Invalid cell reference: A0".
 */
public class InvalidCellReferenceException extends RuntimeException {
    public InvalidCellReferenceException(String message) {
        super(message);
    }
}
