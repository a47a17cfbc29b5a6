package com.tradelang.core.dsl;

/**
 * Visitor over {@link AstNode}. One method per node kind.
 */
public interface AstVisitor<R> {

    R visitNumber(AstNode.NumberLiteral node);

    R visitBoolean(AstNode.BooleanLiteral node);

    R visitField(AstNode.Field node);

    R visitIndicator(AstNode.Indicator node);

    R visitArithmetic(AstNode.Arithmetic node);

    R visitComparison(AstNode.Comparison node);

    R visitCombinator(AstNode.BoolCombinator node);
}
