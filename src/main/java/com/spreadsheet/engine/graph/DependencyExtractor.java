package com.spreadsheet.engine.graph;

import com.spreadsheet.engine.models.CellId;
import com.spreadsheet.engine.parser.ast.AstNode;
import com.spreadsheet.engine.parser.ast.AstVisitor;
import com.spreadsheet.engine.parser.ast.BooleanNode;
import com.spreadsheet.engine.parser.ast.CellNode;
import com.spreadsheet.engine.parser.ast.FunctionNode;
import com.spreadsheet.engine.parser.ast.GroupNode;
import com.spreadsheet.engine.parser.ast.NumberNode;
import com.spreadsheet.engine.parser.ast.OperatorNode;
import com.spreadsheet.engine.parser.ast.RangeNode;
import com.spreadsheet.engine.parser.ast.StringNode;
import com.spreadsheet.engine.parser.ast.UnaryNode;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects every cell a formula reads. Ranges contribute each member cell,
 * so "=SUM(A1:A3)" depends on A1, A2 and A3.
 */
public class DependencyExtractor implements AstVisitor<Void> {

    private final Set<CellId> cells = new LinkedHashSet<>();

    public static Set<CellId> extract(AstNode ast) {
        DependencyExtractor extractor = new DependencyExtractor();
        ast.accept(extractor);
        return Collections.unmodifiableSet(extractor.cells);
    }

    @Override
    public Void visitNumber(NumberNode node) {
        return null;
    }

    @Override
    public Void visitString(StringNode node) {
        return null;
    }

    @Override
    public Void visitBoolean(BooleanNode node) {
        return null;
    }

    @Override
    public Void visitCell(CellNode node) {
        cells.add(node.getCell());
        return null;
    }

    @Override
    public Void visitRange(RangeNode node) {
        cells.addAll(node.toRange().cells());
        return null;
    }

    @Override
    public Void visitUnary(UnaryNode node) {
        return node.getOperand().accept(this);
    }

    @Override
    public Void visitOperator(OperatorNode node) {
        node.getLeft().accept(this);
        return node.getRight().accept(this);
    }

    @Override
    public Void visitGroup(GroupNode node) {
        return node.getExpression().accept(this);
    }

    @Override
    public Void visitFunction(FunctionNode node) {
        for (AstNode argument : node.getArguments()) {
            argument.accept(this);
        }
        return null;
    }
}
