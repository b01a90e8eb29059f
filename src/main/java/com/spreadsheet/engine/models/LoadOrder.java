package com.spreadsheet.engine.models;

/**
 * Order in which a bulk load evaluates formula cells.
 */
public enum LoadOrder {
    /** Shortest formula text first. */
    LENGTH,
    /** Precedents before dependents; cells caught in cycles last, shortest first. */
    TOPOLOGICAL
}
