package com.spreadsheet.engine.parser;

/**
 * One lexical token of a formula.
 * Cell references and identifiers are kept upper-cased; cell references keep
 * their "$" markers so later stages can tell absolute from relative.
 */
public class Token {
    private final TokenType type;
    private final String text;
    private final double number;
    private final int position;

    public Token(TokenType type, String text, int position) {
        this(type, text, 0, position);
    }

    public Token(TokenType type, String text, double number, int position) {
        this.type = type;
        this.text = text;
        this.number = number;
        this.position = position;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public double getNumber() {
        return number;
    }

    public boolean getBoolean() {
        return "TRUE".equals(text);
    }

    /** 0-based offset of the token's first character in the formula body. */
    public int getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
