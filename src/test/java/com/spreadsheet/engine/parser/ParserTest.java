package com.spreadsheet.engine.parser;

import com.spreadsheet.engine.exceptions.FormulaParseException;
import com.spreadsheet.engine.parser.ast.AstNode;
import com.spreadsheet.engine.parser.ast.CellNode;
import com.spreadsheet.engine.parser.ast.FunctionNode;
import com.spreadsheet.engine.parser.ast.GroupNode;
import com.spreadsheet.engine.parser.ast.NumberNode;
import com.spreadsheet.engine.parser.ast.Operator;
import com.spreadsheet.engine.parser.ast.OperatorNode;
import com.spreadsheet.engine.parser.ast.RangeNode;
import com.spreadsheet.engine.parser.ast.StringNode;
import com.spreadsheet.engine.parser.ast.UnaryNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for precedence, associativity and error reporting of the parser.
 */
class ParserTest {

    /**
     * Multiplication binds tighter than addition: 1+2*3 is 1+(2*3).
     */
    @Test
    void testPrecedence() {
        OperatorNode root = (OperatorNode) Parser.parseFormula("1+2*3");
        assertEquals(Operator.ADD, root.getOperator());
        assertInstanceOf(NumberNode.class, root.getLeft());
        assertEquals(Operator.MULTIPLY, ((OperatorNode) root.getRight()).getOperator());
    }

    /**
     * Binary operators are left-associative: 10-4-3 is (10-4)-3.
     */
    @Test
    void testLeftAssociativity() {
        OperatorNode root = (OperatorNode) Parser.parseFormula("10-4-3");
        assertEquals(Operator.SUBTRACT, root.getOperator());
        assertInstanceOf(OperatorNode.class, root.getLeft());
        assertEquals(3.0, ((NumberNode) root.getRight()).getValue());
    }

    /**
     * Comparison is the loosest level, concatenation sits above it.
     */
    @Test
    void testComparisonAndConcatenation() {
        OperatorNode root = (OperatorNode) Parser.parseFormula("A1&\"x\"=B1+1");
        assertEquals(Operator.EQUAL, root.getOperator());
        assertEquals(Operator.CONCAT, ((OperatorNode) root.getLeft()).getOperator());
        assertEquals(Operator.ADD, ((OperatorNode) root.getRight()).getOperator());
    }

    /**
     * Prefix operators nest.
     */
    @Test
    void testNestedUnary() {
        UnaryNode outer = (UnaryNode) Parser.parseFormula("--5");
        assertInstanceOf(UnaryNode.class, outer.getOperand());
    }

    /**
     * Function calls with ranges, groups and empty argument lists.
     */
    @Test
    void testFunctionsRangesAndGroups() {
        FunctionNode sum = (FunctionNode) Parser.parseFormula("SUM(A1:B2, (C1))");
        assertEquals("SUM", sum.getName());
        assertEquals(2, sum.getArguments().size());
        RangeNode range = (RangeNode) sum.getArguments().get(0);
        assertEquals("A1:B2", range.toRange().toString());
        GroupNode group = (GroupNode) sum.getArguments().get(1);
        assertEquals("C1", ((CellNode) group.getExpression()).getCell().toString());

        FunctionNode now = (FunctionNode) Parser.parseFormula("now()");
        assertEquals("NOW", now.getName());
        assertTrue(now.getArguments().isEmpty());
    }

    /**
     * An empty formula is an empty string literal.
     */
    @Test
    void testEmptyFormula() {
        AstNode ast = Parser.parseFormula("");
        assertEquals("", ((StringNode) ast).getValue());
    }

    /**
     * Syntax errors: unbalanced parentheses, trailing tokens, bare identifiers, dangling operators.
     */
    @Test
    void testSyntaxErrors() {
        assertThrows(FormulaParseException.class, () -> Parser.parseFormula("(1+2"));
        assertThrows(FormulaParseException.class, () -> Parser.parseFormula("1 2"));
        assertThrows(FormulaParseException.class, () -> Parser.parseFormula("myRange + 1"));
        assertThrows(FormulaParseException.class, () -> Parser.parseFormula("1+"));
        assertThrows(FormulaParseException.class, () -> Parser.parseFormula("SUM(1,"));
        assertThrows(FormulaParseException.class, () -> Parser.parseFormula("A1:"));
    }
}
