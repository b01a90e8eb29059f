package com.spreadsheet.engine.exceptions;

/**
 * Thrown by the tokenizer and parser when formula text is not syntactically valid.
 * The engine turns it into a #NAME? value; it never escapes a public engine call.
 */
public class FormulaParseException extends RuntimeException {

    private final int position;

    public FormulaParseException(String message, int position) {
        super(message);
        this.position = position;
    }

    public FormulaParseException(String message, int position, Throwable cause) {
        super(message, cause);
        this.position = position;
    }

    /**
     * 0-based character offset (tokenizer) or token index (parser) where parsing failed.
     */
    public int getPosition() {
        return position;
    }
}
