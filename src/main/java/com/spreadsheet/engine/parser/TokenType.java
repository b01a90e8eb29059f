package com.spreadsheet.engine.parser;

/**
 * Token kinds produced by the {@link Tokenizer}.
 */
public enum TokenType {
    NUMBER,
    STRING,
    BOOLEAN,
    CELL_REF,
    IDENTIFIER,
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    COLON
}
