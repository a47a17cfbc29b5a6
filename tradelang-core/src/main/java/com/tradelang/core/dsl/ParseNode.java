package com.tradelang.core.dsl;

import java.util.List;

/**
 * Node of the concrete parse tree. One node per grammar production; the
 * {@link AstBuilder} turns the tree into the typed AST.
 *
 * @param production which grammar rule produced this node
 * @param token      the token that names the node (operator, identifier, keyword), may be null
 * @param number     numeric value for {@link Production#NUMBER} nodes, null otherwise
 * @param children   sub-trees in source order
 */
public record ParseNode(Production production, Token token, Number number, List<ParseNode> children) {

    public ParseNode {
        children = List.copyOf(children);
    }

    /**
     * Grammar productions, one per rule of the strategy grammar.
     */
    public enum Production {
        STRATEGY,
        ENTRY_SECTION,
        EXIT_SECTION,
        OR_EXPR,
        AND_EXPR,
        COMPARISON,
        ARITHMETIC,
        NEGATION,
        NUMBER,
        IDENTIFIER,
        CALL,
        OUTPUT_SELECT,
        GROUP
    }

    static ParseNode of(Production production, Token token, List<ParseNode> children) {
        return new ParseNode(production, token, null, children);
    }

    static ParseNode leaf(Production production, Token token) {
        return new ParseNode(production, token, null, List.of());
    }

    static ParseNode number(Token token, Number value) {
        return new ParseNode(Production.NUMBER, token, value, List.of());
    }

    public ParseNode child(int index) {
        return children.get(index);
    }
}
