package com.spreadsheet.engine.values;

import java.util.Objects;

/**
 * A spreadsheet error stored as a cell value (e.g. #DIV/0!).
 *
 * Errors are not exceptions: the evaluator returns them, cells store them,
 * and dependents read them like any other value. Two errors are equal when
 * they have the same {@link ErrorType}; the message is descriptive only.
 */
public final class FormulaError extends Value {

    private final ErrorType errorType;
    private final String message;

    public FormulaError(ErrorType errorType, String message) {
        this.errorType = Objects.requireNonNull(errorType, "errorType");
        this.message = message == null ? errorType.getDefaultMessage() : message;
    }

    public FormulaError(ErrorType errorType) {
        this(errorType, null);
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getCode() {
        return errorType.getCode();
    }

    public String getMessage() {
        return message;
    }

    @Override
    public ValueType getType() {
        return ValueType.ERROR;
    }

    @Override
    public Object toJson() {
        return errorType.getCode();
    }

    public static FormulaError divZero() {
        return new FormulaError(ErrorType.DIV_ZERO);
    }

    public static FormulaError divZero(String message) {
        return new FormulaError(ErrorType.DIV_ZERO, message);
    }

    public static FormulaError notAvailable(String message) {
        return new FormulaError(ErrorType.NOT_AVAILABLE, message);
    }

    public static FormulaError name(String message) {
        return new FormulaError(ErrorType.NAME, message);
    }

    public static FormulaError num(String message) {
        return new FormulaError(ErrorType.NUM, message);
    }

    public static FormulaError ref(String message) {
        return new FormulaError(ErrorType.REF, message);
    }

    public static FormulaError value(String message) {
        return new FormulaError(ErrorType.VALUE, message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FormulaError)) {
            return false;
        }
        return errorType == ((FormulaError) o).errorType;
    }

    @Override
    public int hashCode() {
        return errorType.hashCode();
    }

    @Override
    public String toString() {
        return errorType.getCode();
    }
}
