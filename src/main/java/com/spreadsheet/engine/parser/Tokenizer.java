package com.spreadsheet.engine.parser;

import com.spreadsheet.engine.exceptions.FormulaParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Scans a formula body (the text after the leading "=") into tokens.
 *
 * Example: "SUM(A1:B2, 5.5) * 2" becomes
 * IDENTIFIER(SUM) LEFT_PAREN CELL_REF(A1) COLON CELL_REF(B2) COMMA NUMBER(5.5)
 * RIGHT_PAREN OPERATOR(*) NUMBER(2).
 */
public class Tokenizer {

    private static final Pattern CELL_REF = Pattern.compile("^\\$?[A-Z]+\\$?[0-9]+$");
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Z_][A-Z0-9_]*$");
    private static final String OPERATOR_CHARS = "+-*/^&=<>!";

    private final String input;
    private int position;

    public Tokenizer(String input) {
        this.input = input == null ? "" : input;
    }

    /**
     * Tokenizes a whole formula body.
     * Throws FormulaParseException on an unterminated string, an invalid
     * identifier or any character outside the formula alphabet.
     */
    public static List<Token> tokenize(String input) {
        return new Tokenizer(input).readAll();
    }

    public List<Token> readAll() {
        List<Token> tokens = new ArrayList<>();
        position = 0;
        while (position < input.length()) {
            char c = input.charAt(position);

            if (isWhitespace(c)) {
                position++;
            } else if (isDigit(c) || (c == '.' && position + 1 < input.length() && isDigit(input.charAt(position + 1)))) {
                tokens.add(readNumber());
            } else if (c == '"' || c == '\'') {
                tokens.add(readString(c));
            } else if (isLetter(c) || c == '$') {
                tokens.add(readIdentifierOrCellRef());
            } else if (OPERATOR_CHARS.indexOf(c) >= 0) {
                tokens.add(readOperator());
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LEFT_PAREN, "(", position++));
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RIGHT_PAREN, ")", position++));
            } else if (c == ',') {
                tokens.add(new Token(TokenType.COMMA, ",", position++));
            } else if (c == ':') {
                tokens.add(new Token(TokenType.COLON, ":", position++));
            } else {
                throw new FormulaParseException("Unexpected character at pos " + position + ": " + c, position);
            }
        }
        return tokens;
    }

    private Token readNumber() {
        int start = position;
        while (position < input.length() && (isDigit(input.charAt(position)) || input.charAt(position) == '.')) {
            position++;
        }
        String text = input.substring(start, position);
        try {
            return new Token(TokenType.NUMBER, text, Double.parseDouble(text), start);
        } catch (NumberFormatException e) {
            throw new FormulaParseException("Invalid number at pos " + start + ": " + text, start, e);
        }
    }

    private Token readString(char quote) {
        int start = position;
        position++; // opening quote
        StringBuilder text = new StringBuilder();
        while (position < input.length()) {
            char c = input.charAt(position);
            if (c == quote) {
                position++;
                return new Token(TokenType.STRING, text.toString(), start);
            }
            if (c == '\\' && position + 1 < input.length()) {
                position++;
                text.append(input.charAt(position));
            } else {
                text.append(c);
            }
            position++;
        }
        throw new FormulaParseException("Unterminated string starting at pos " + start, start);
    }

    private Token readIdentifierOrCellRef() {
        int start = position;
        while (position < input.length()) {
            char c = input.charAt(position);
            if (isLetter(c) || isDigit(c) || c == '_' || c == '$') {
                position++;
            } else {
                break;
            }
        }
        String text = input.substring(start, position);
        String upper = text.toUpperCase();

        if (upper.equals("TRUE") || upper.equals("FALSE")) {
            return new Token(TokenType.BOOLEAN, upper, start);
        }
        if (CELL_REF.matcher(upper).matches()) {
            return new Token(TokenType.CELL_REF, upper, start);
        }
        if (IDENTIFIER.matcher(upper).matches()) {
            return new Token(TokenType.IDENTIFIER, upper, start);
        }
        throw new FormulaParseException("Invalid identifier or cell reference: " + text, start);
    }

    private Token readOperator() {
        int start = position;
        char c = input.charAt(position);
        char next = position + 1 < input.length() ? input.charAt(position + 1) : '\0';

        if ((c == '<' && next == '>') || (c == '!' && next == '=')) {
            position += 2;
            return new Token(TokenType.OPERATOR, "<>", start); // "!=" is normalized to "<>"
        }
        if ((c == '<' || c == '>') && next == '=') {
            position += 2;
            return new Token(TokenType.OPERATOR, c + "=", start);
        }
        position++;
        return new Token(TokenType.OPERATOR, String.valueOf(c), start);
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == 0x0B;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
