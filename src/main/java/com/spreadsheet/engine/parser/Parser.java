package com.spreadsheet.engine.parser;

import com.spreadsheet.engine.exceptions.FormulaParseException;
import com.spreadsheet.engine.exceptions.InvalidCellReferenceException;
import com.spreadsheet.engine.models.CellId;
import com.spreadsheet.engine.parser.ast.AstNode;
import com.spreadsheet.engine.parser.ast.BooleanNode;
import com.spreadsheet.engine.parser.ast.CellNode;
import com.spreadsheet.engine.parser.ast.FunctionNode;
import com.spreadsheet.engine.parser.ast.GroupNode;
import com.spreadsheet.engine.parser.ast.NumberNode;
import com.spreadsheet.engine.parser.ast.Operator;
import com.spreadsheet.engine.parser.ast.OperatorNode;
import com.spreadsheet.engine.parser.ast.RangeNode;
import com.spreadsheet.engine.parser.ast.StringNode;
import com.spreadsheet.engine.parser.ast.UnaryNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser from tokens to an AST.
 *
 * Precedence, lowest to highest:
 * comparison (= <> < <= > >=), concatenation (&), additive (+ -),
 * multiplicative (* /), power (^), unary prefix (+ -), primary.
 * All binary levels are left-associative; unary operators nest (--5).
 */
public class Parser {

    private final List<Token> tokens;
    private int position;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Convenience entry point: tokenizes and parses a formula body (no leading "=").
     */
    public static AstNode parseFormula(String body) {
        return new Parser(Tokenizer.tokenize(body)).parse();
    }

    public AstNode parse() {
        position = 0;
        if (isAtEnd()) {
            return new StringNode(""); // empty formula
        }
        AstNode ast = parseComparison();
        if (!isAtEnd()) {
            throw error("Unexpected token at end of formula: " + peek());
        }
        return ast;
    }

    private AstNode parseComparison() {
        AstNode left = parseConcatenation();
        while (matchOperator("=", "<>", "<", "<=", ">", ">=")) {
            Operator op = Operator.fromSymbol(previous().getText());
            left = new OperatorNode(op, left, parseConcatenation());
        }
        return left;
    }

    private AstNode parseConcatenation() {
        AstNode left = parseAdditive();
        while (matchOperator("&")) {
            left = new OperatorNode(Operator.CONCAT, left, parseAdditive());
        }
        return left;
    }

    private AstNode parseAdditive() {
        AstNode left = parseMultiplicative();
        while (matchOperator("+", "-")) {
            Operator op = Operator.fromSymbol(previous().getText());
            left = new OperatorNode(op, left, parseMultiplicative());
        }
        return left;
    }

    private AstNode parseMultiplicative() {
        AstNode left = parsePower();
        while (matchOperator("*", "/")) {
            Operator op = Operator.fromSymbol(previous().getText());
            left = new OperatorNode(op, left, parsePower());
        }
        return left;
    }

    private AstNode parsePower() {
        AstNode left = parseUnary();
        while (matchOperator("^")) {
            left = new OperatorNode(Operator.POWER, left, parseUnary());
        }
        return left;
    }

    private AstNode parseUnary() {
        if (matchOperator("+", "-")) {
            Operator op = Operator.fromSymbol(previous().getText());
            return new UnaryNode(op, parseUnary());
        }
        return parsePrimary();
    }

    private AstNode parsePrimary() {
        if (match(TokenType.NUMBER)) {
            return new NumberNode(previous().getNumber());
        }
        if (match(TokenType.STRING)) {
            return new StringNode(previous().getText());
        }
        if (match(TokenType.BOOLEAN)) {
            return new BooleanNode(previous().getBoolean());
        }

        if (match(TokenType.CELL_REF)) {
            Token start = previous();
            if (match(TokenType.COLON)) {
                if (!match(TokenType.CELL_REF)) {
                    throw error("Expected cell reference after : in range");
                }
                return new RangeNode(cellId(start), cellId(previous()));
            }
            cellId(start); // validates row >= 1
            return new CellNode(start.getText());
        }

        if (match(TokenType.IDENTIFIER)) {
            Token identifier = previous();
            if (match(TokenType.LEFT_PAREN)) {
                List<AstNode> args = parseArgumentList();
                if (!match(TokenType.RIGHT_PAREN)) {
                    throw error("Expected ) after function arguments");
                }
                return new FunctionNode(identifier.getText(), args);
            }
            // Named ranges are not supported
            throw new FormulaParseException("Unexpected identifier: " + identifier.getText(), position - 1);
        }

        if (match(TokenType.LEFT_PAREN)) {
            AstNode expression = parseComparison();
            if (!match(TokenType.RIGHT_PAREN)) {
                throw error("Expected ) after expression in parentheses");
            }
            return new GroupNode(expression);
        }

        if (isAtEnd()) {
            throw error("Unexpected end of formula");
        }
        throw error("Unexpected token: " + peek());
    }

    private List<AstNode> parseArgumentList() {
        List<AstNode> args = new ArrayList<>();
        if (!isAtEnd() && peek().getType() == TokenType.RIGHT_PAREN) {
            return args; // e.g. NOW()
        }
        args.add(parseComparison());
        while (match(TokenType.COMMA)) {
            args.add(parseComparison());
        }
        return args;
    }

    // --- Utility Methods ---

    private CellId cellId(Token token) {
        try {
            return CellId.parse(token.getText());
        } catch (InvalidCellReferenceException e) {
            throw new FormulaParseException(e.getMessage(), position - 1, e);
        }
    }

    private boolean match(TokenType type) {
        if (isAtEnd() || peek().getType() != type) {
            return false;
        }
        position++;
        return true;
    }

    private boolean matchOperator(String... symbols) {
        if (isAtEnd() || peek().getType() != TokenType.OPERATOR) {
            return false;
        }
        for (String symbol : symbols) {
            if (peek().getText().equals(symbol)) {
                position++;
                return true;
            }
        }
        return false;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }

    private boolean isAtEnd() {
        return position >= tokens.size();
    }

    private FormulaParseException error(String message) {
        return new FormulaParseException(message, position);
    }
}
