package com.spreadsheet.engine.parser.ast;

/**
 * Visitor over formula trees. Implemented by the evaluator and the dependency extractor.
 */
public interface AstVisitor<R> {

    R visitNumber(NumberNode node);

    R visitString(StringNode node);

    R visitBoolean(BooleanNode node);

    R visitCell(CellNode node);

    R visitRange(RangeNode node);

    R visitUnary(UnaryNode node);

    R visitOperator(OperatorNode node);

    R visitGroup(GroupNode node);

    R visitFunction(FunctionNode node);
}
