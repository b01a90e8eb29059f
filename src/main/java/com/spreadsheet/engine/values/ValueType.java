package com.spreadsheet.engine.values;

/**
 * Enumerates the kinds of value a formula can produce or a cell can hold.
 */
public enum ValueType {
    NUMBER,
    TEXT,
    BOOLEAN,
    EMPTY,
    ERROR,
    ARRAY
}
