package com.spreadsheet.engine.evaluation;

import com.spreadsheet.engine.functions.FormulaFunction;
import com.spreadsheet.engine.functions.FunctionArgs;
import com.spreadsheet.engine.models.CellRange;
import com.spreadsheet.engine.parser.ast.AstNode;
import com.spreadsheet.engine.parser.ast.AstVisitor;
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
import com.spreadsheet.engine.values.ArrayValue;
import com.spreadsheet.engine.values.FormulaError;
import com.spreadsheet.engine.values.NumberValue;
import com.spreadsheet.engine.values.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks a formula AST and computes its value.
 *
 * Cells and ranges are read through the {@link EvalContext}, never from storage.
 * Failures inside a formula come back as {@link FormulaError} values; nothing is thrown
 * for spreadsheet-level problems.
 */
public class Evaluator implements AstVisitor<Value> {

    private static final Logger logger = LoggerFactory.getLogger(Evaluator.class);

    private final EvalContext context;
    private final TypeCoercion coercion;

    public Evaluator(EvalContext context) {
        this.context = context;
        this.coercion = context.getCoercion();
    }

    /**
     * Evaluates a whole formula. An array result (e.g. "=A1:B2") collapses to its
     * top-left element, since a cell holds a single value.
     */
    public Value evaluate(AstNode ast) {
        Value result = coercion.scalar(ast.accept(this));
        return result == null ? Value.empty() : result;
    }

    @Override
    public Value visitNumber(NumberNode node) {
        return Value.of(node.getValue());
    }

    @Override
    public Value visitString(StringNode node) {
        return Value.of(node.getValue());
    }

    @Override
    public Value visitBoolean(BooleanNode node) {
        return Value.of(node.getValue());
    }

    @Override
    public Value visitCell(CellNode node) {
        Value value = context.getCellValue(node.getCell());
        return value == null ? Value.empty() : value;
    }

    @Override
    public Value visitRange(RangeNode node) {
        CellRange range = node.toRange();
        List<Value> values = context.getRangeValues(range.getTopLeft(), range.getBottomRight());
        return new ArrayValue(range.rowCount(), range.columnCount(), values);
    }

    @Override
    public Value visitGroup(GroupNode node) {
        return node.getExpression().accept(this);
    }

    @Override
    public Value visitUnary(UnaryNode node) {
        Value operand = coercion.scalar(node.getOperand().accept(this));
        if (operand.isError()) {
            return operand;
        }
        double number = coercion.toNumber(operand);
        return node.getOperator() == Operator.SUBTRACT ? Value.of(-number) : Value.of(number);
    }

    @Override
    public Value visitOperator(OperatorNode node) {
        Value left = coercion.scalar(node.getLeft().accept(this));
        Value right = coercion.scalar(node.getRight().accept(this));
        if (left.isError()) {
            return left;
        }
        if (right.isError()) {
            return right;
        }

        Operator op = node.getOperator();
        if (op == Operator.CONCAT) {
            return Value.of(coercion.toText(left) + coercion.toText(right));
        }
        if (op.isComparison()) {
            return Value.of(compare(op, coercion.compare(left, right)));
        }
        return checkFinite(arithmetic(op, coercion.toNumber(left), coercion.toNumber(right)));
    }

    @Override
    public Value visitFunction(FunctionNode node) {
        Optional<FormulaFunction> function = context.getFunctions().get(node.getName());
        if (!function.isPresent()) {
            logger.debug("Unknown function {}", node.getName());
            return FormulaError.name("Unknown function: " + node.getName());
        }
        List<Value> arguments = new ArrayList<>(node.getArguments().size());
        for (AstNode argument : node.getArguments()) {
            arguments.add(argument.accept(this));
        }
        Value result;
        try {
            result = function.get().apply(new FunctionArgs(node.getName(), arguments, coercion), context);
        } catch (ArithmeticException | DateTimeException e) {
            logger.debug("{} failed: {}", node.getName(), e.getMessage());
            return FormulaError.num(node.getName() + ": " + e.getMessage());
        }
        return checkFinite(result == null ? Value.empty() : result);
    }

    private static Value arithmetic(Operator op, double a, double b) {
        switch (op) {
            case ADD:
                return Value.of(a + b);
            case SUBTRACT:
                return Value.of(a - b);
            case MULTIPLY:
                return Value.of(a * b);
            case DIVIDE:
                if (b == 0) {
                    return FormulaError.divZero();
                }
                return Value.of(a / b);
            case POWER:
                if (a == 0 && b < 0) {
                    return FormulaError.divZero();
                }
                return Value.of(Math.pow(a, b));
            default:
                throw new IllegalStateException("Not an arithmetic operator: " + op);
        }
    }

    private static boolean compare(Operator op, int order) {
        switch (op) {
            case EQUAL:
                return order == 0;
            case NOT_EQUAL:
                return order != 0;
            case LESS:
                return order < 0;
            case LESS_OR_EQUAL:
                return order <= 0;
            case GREATER:
                return order > 0;
            case GREATER_OR_EQUAL:
                return order >= 0;
            default:
                throw new IllegalStateException("Not a comparison operator: " + op);
        }
    }

    private static Value checkFinite(Value value) {
        if (value instanceof NumberValue) {
            double number = ((NumberValue) value).getNumber();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                return FormulaError.num("Result is not a finite number");
            }
        }
        return value;
    }
}
