package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.spreadsheet.engine.exceptions.InvalidCellReferenceException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifies one cell by column letters and row number, e.g. "B12".
 *
 * This is the only place references are normalized: parsing upper-cases the text and
 * strips the "$" absolute markers, so "$b$12", "B$12" and "B12" are the same key in every
 * map the engine keeps. Column and row indices are 0-based (A=0, row "1"=0).
 */
public final class CellId implements Comparable<CellId> {

    // Optional $, column letters, optional $, row digits
    private static final Pattern CELL_REF = Pattern.compile("^\\$?([A-Z]+)\\$?([0-9]+)$");

    private final int column;
    private final int row;
    private final String id;

    private CellId(int column, int row) {
        this.column = column;
        this.row = row;
        this.id = columnLetters(column) + (row + 1);
    }

    /**
     * Parses and normalizes a reference such as "A1", "$a$1" or "AA10".
     * Throws InvalidCellReferenceException if it is not a valid reference.
     */
    @JsonCreator
    public static CellId parse(String reference) {
        if (reference == null) {
            throw new InvalidCellReferenceException("Cell reference is null");
        }
        Matcher matcher = CELL_REF.matcher(reference.trim().toUpperCase());
        if (!matcher.matches()) {
            throw new InvalidCellReferenceException("Invalid cell reference: " + reference);
        }
        int row;
        try {
            row = Integer.parseInt(matcher.group(2)) - 1;
        } catch (NumberFormatException e) {
            throw new InvalidCellReferenceException("Row out of range: " + reference);
        }
        if (row < 0) {
            // Row 0 is invalid, rows start at 1
            throw new InvalidCellReferenceException("Invalid cell reference: " + reference);
        }
        return new CellId(columnIndex(matcher.group(1)), row);
    }

    /**
     * Builds a cell id from 0-based indices.
     */
    public static CellId of(int column, int row) {
        if (column < 0 || row < 0) {
            throw new InvalidCellReferenceException("Negative cell index: column " + column + ", row " + row);
        }
        return new CellId(column, row);
    }

    /**
     * Converts column letters ("A", "Z", "AA") to a 0-based index (0, 25, 26).
     */
    public static int columnIndex(String letters) {
        int index = 0;
        for (int i = 0; i < letters.length(); i++) {
            index = index * 26 + (letters.charAt(i) - 'A' + 1);
        }
        return index - 1;
    }

    /**
     * Converts a 0-based column index to its letters (0=A, 26=AA).
     */
    public static String columnLetters(int index) {
        StringBuilder letters = new StringBuilder();
        int num = index + 1;
        while (num > 0) {
            int remainder = (num - 1) % 26;
            letters.insert(0, (char) ('A' + remainder));
            num = (num - 1) / 26;
        }
        return letters.toString();
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    @Override
    public int compareTo(CellId other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellId)) {
            return false;
        }
        CellId other = (CellId) o;
        return column == other.column && row == other.row;
    }

    @Override
    public int hashCode() {
        return 31 * column + row;
    }

    @JsonValue
    @Override
    public String toString() {
        return id;
    }
}
