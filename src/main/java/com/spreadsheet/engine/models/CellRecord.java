package com.spreadsheet.engine.models;

import com.spreadsheet.engine.parser.ast.AstNode;
import com.spreadsheet.engine.values.Value;

import java.util.Collections;
import java.util.Set;

/**
 * Represents the engine's state for one non-empty cell.
 * Stores:
 * - formula: the raw "=..." text, or null for a raw value
 * - value: the last computed result (number, text, boolean or error)
 * - ast: the parsed tree, present only for formulas that parsed and passed the cycle check
 * - dependencies: the cells the formula reads, ranges expanded to member cells
 */
public class CellRecord {
    private final String formula;
    private final AstNode ast;
    private final Set<CellId> dependencies;
    private Value value; // refreshed in place by recalculation

    public CellRecord(String formula, Value value, AstNode ast, Set<CellId> dependencies) {
        this.formula = formula;
        this.value = value;
        this.ast = ast;
        this.dependencies = dependencies == null ? null : Collections.unmodifiableSet(dependencies);
    }

    public static CellRecord raw(Value value) {
        return new CellRecord(null, value, null, null);
    }

    public String getFormula() {
        return formula;
    }

    public boolean isFormula() {
        return formula != null;
    }

    public Value getValue() {
        return value;
    }

    public void setValue(Value value) {
        this.value = value;
    }

    public AstNode getAst() {
        return ast;
    }

    public Set<CellId> getDependencies() {
        return dependencies;
    }
}
