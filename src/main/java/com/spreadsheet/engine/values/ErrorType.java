package com.spreadsheet.engine.values;

/**
 * The closed set of spreadsheet error kinds, with the code shown in a cell
 * and the message used when no more specific one is given.
 */
public enum ErrorType {
    DIV_ZERO("#DIV/0!", "Division by zero"),
    NOT_AVAILABLE("#N/A", "Value not available"),
    NAME("#NAME?", "Invalid name"),
    NULL("#NULL!", "Null range"),
    NUM("#NUM!", "Invalid number"),
    REF("#REF!", "Invalid reference"),
    VALUE("#VALUE!", "Invalid value type");

    private final String code;
    private final String defaultMessage;

    ErrorType(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    /**
     * Resolves an error code such as "#n/a" (case-insensitive), or null when
     * the text is not one of the seven codes.
     */
    public static ErrorType fromCode(String code) {
        if (code == null) {
            return null;
        }
        String upper = code.trim().toUpperCase();
        for (ErrorType type : values()) {
            if (type.code.equals(upper)) {
                return type;
            }
        }
        return null;
    }
}
