package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One entry of the persisted cell map consumed by bulk load:
 * { "value": "=A1*2", "formula": true }.
 * Formula values always begin with "=".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CellData {
    private String value;
    private boolean formula;

    // Default constructor needed for JSON (de)serialization
    public CellData() {
    }

    public CellData(String value, boolean formula) {
        this.value = value;
        this.formula = formula;
    }

    public static CellData raw(String value) {
        return new CellData(value, false);
    }

    public static CellData formula(String formula) {
        return new CellData(formula, true);
    }

    public String getValue() {
        return value;
    }

    public boolean isFormula() {
        return formula;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public void setFormula(boolean formula) {
        this.formula = formula;
    }
}
