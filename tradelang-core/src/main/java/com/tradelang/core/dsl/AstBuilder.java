package com.tradelang.core.dsl;

import com.tradelang.core.dsl.AstNode.BoolCombinator;
import com.tradelang.core.dsl.ParseNode.Production;
import com.tradelang.core.indicators.IndicatorKind;
import com.tradelang.core.model.PriceField;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a concrete parse tree into a validated {@link AstNode} tree.
 *
 * Each production maps to exactly one node kind. Names, arity, output selectors
 * and operand types are checked here so nothing unknown reaches evaluation.
 */
public class AstBuilder {

    private enum ValueType { BOOLEAN, NUMERIC }

    public Strategy build(ParseNode tree) {
        if (tree.production() != Production.STRATEGY) {
            throw new IllegalArgumentException("Expected a STRATEGY node, got " + tree.production());
        }
        AstNode entry = condition(tree.child(0), "ENTRY");
        AstNode exit = condition(tree.child(1), "EXIT");
        return new Strategy(entry, exit);
    }

    /**
     * Build a standalone expression (no ENTRY/EXIT sections) of any type.
     */
    public AstNode buildExpression(ParseNode node) {
        return node(node);
    }

    private AstNode condition(ParseNode section, String name) {
        AstNode body = node(section.child(0));
        requireType(body, ValueType.BOOLEAN, name + " condition");
        return body;
    }

    private AstNode node(ParseNode node) {
        return switch (node.production()) {
            case OR_EXPR -> combinator(node, BoolCombinator.Kind.OR);
            case AND_EXPR -> combinator(node, BoolCombinator.Kind.AND);
            case COMPARISON -> comparison(node);
            case ARITHMETIC -> arithmetic(node);
            case NEGATION -> negation(node);
            case NUMBER -> new AstNode.NumberLiteral(node.number());
            case IDENTIFIER -> identifier(node.token());
            case CALL -> indicator(node, null);
            case OUTPUT_SELECT -> indicator(node.child(0), node.token());
            case GROUP -> node(node.child(0));
            case STRATEGY, ENTRY_SECTION, EXIT_SECTION ->
                throw new IllegalArgumentException("Unexpected " + node.production() + " inside an expression");
        };
    }

    private AstNode combinator(ParseNode node, BoolCombinator.Kind kind) {
        List<AstNode> children = new ArrayList<>();
        for (ParseNode child : node.children()) {
            children.add(node(child));
        }

        // A single operand is not a combinator
        if (children.size() == 1) {
            return children.get(0);
        }

        for (AstNode child : children) {
            requireType(child, ValueType.BOOLEAN, "Operand of " + kind);
        }
        return new BoolCombinator(kind, children);
    }

    private AstNode comparison(ParseNode node) {
        Token operator = node.token();
        ComparisonOp op;
        try {
            op = ComparisonOp.fromSymbol(operator.value());
        } catch (IllegalArgumentException e) {
            throw new DslValidationException("Unknown operator '" + operator.value() + "'",
                operator.value(), ComparisonOp.symbols());
        }

        AstNode left = node(node.child(0));
        AstNode right = node(node.child(1));
        requireType(left, ValueType.NUMERIC, "Left operand of " + op.symbol());
        requireType(right, ValueType.NUMERIC, "Right operand of " + op.symbol());
        return new AstNode.Comparison(op, left, right);
    }

    private AstNode arithmetic(ParseNode node) {
        ArithmeticOp op = switch (node.token().type()) {
            case PLUS -> ArithmeticOp.ADD;
            case MINUS -> ArithmeticOp.SUBTRACT;
            case MULTIPLY -> ArithmeticOp.MULTIPLY;
            case DIVIDE -> ArithmeticOp.DIVIDE;
            default -> throw new DslValidationException("Unknown operator '" + node.token().value() + "'",
                node.token().value(), List.of("+", "-", "*", "/"));
        };

        AstNode left = node(node.child(0));
        AstNode right = node(node.child(1));
        requireType(left, ValueType.NUMERIC, "Left operand of " + op.symbol());
        requireType(right, ValueType.NUMERIC, "Right operand of " + op.symbol());
        return new AstNode.Arithmetic(op, left, right);
    }

    private AstNode negation(ParseNode node) {
        AstNode operand = node(node.child(0));
        requireType(operand, ValueType.NUMERIC, "Operand of unary minus");
        return new AstNode.Arithmetic(ArithmeticOp.SUBTRACT, new AstNode.NumberLiteral(0L), operand);
    }

    private AstNode identifier(Token token) {
        String name = token.value();
        if ("true".equals(name) || "false".equals(name)) {
            return new AstNode.BooleanLiteral("true".equals(name));
        }

        Optional<PriceField> field = PriceField.fromId(name);
        if (field.isPresent()) {
            return new AstNode.Field(field.get().id());
        }

        Optional<IndicatorKind> kind = IndicatorKind.fromId(name);
        if (kind.isPresent()) {
            List<String> alternatives = new ArrayList<>(PriceField.ids());
            alternatives.add(kind.get().signature());
            throw new DslValidationException("Indicator '" + name + "' must be called with arguments", name,
                alternatives);
        }
        throw new DslValidationException("Unknown field '" + name + "'", name, PriceField.ids());
    }

    private AstNode indicator(ParseNode call, Token outputToken) {
        String name = call.token().value();
        IndicatorKind kind = IndicatorKind.fromId(name)
            .orElseThrow(() -> new DslValidationException("Unknown indicator '" + name + "'", name,
                IndicatorKind.ids()));

        int argCount = call.children().size();
        if (argCount < kind.minArgs() || argCount > kind.maxArgs()) {
            String expected = kind.minArgs() == kind.maxArgs()
                ? String.valueOf(kind.minArgs())
                : kind.minArgs() + " to " + kind.maxArgs();
            throw new DslValidationException("Indicator '" + name + "' takes " + expected
                + " arguments, got " + argCount, name, List.of(kind.signature()));
        }

        List<AstNode> args = new ArrayList<>();
        for (int i = 0; i < argCount; i++) {
            AstNode arg = node(call.child(i));
            if (i < kind.seriesCount()) {
                requireType(arg, ValueType.NUMERIC, "Argument " + (i + 1) + " of " + name);
            } else if (!(arg instanceof AstNode.NumberLiteral)) {
                String param = kind.params().get(i - kind.seriesCount()).name();
                throw new DslValidationException("Parameter '" + param + "' of " + name
                    + " must be a number literal", param,
                    kind.params().stream().map(IndicatorKind.Param::name).toList());
            }
            args.add(arg);
        }

        String output = kind.defaultOutput();
        if (outputToken != null) {
            output = outputToken.value();
            if (!kind.outputs().contains(output)) {
                throw new DslValidationException("Unknown output '" + output + "' for indicator '" + name + "'",
                    output, kind.outputs());
            }
        }

        return new AstNode.Indicator(kind.id(), args, output);
    }

    private static void requireType(AstNode node, ValueType expected, String role) {
        ValueType actual = typeOf(node);
        if (actual != expected) {
            String description = expected == ValueType.BOOLEAN ? "a condition" : "a numeric value";
            throw new DslValidationException(role + " must be " + description + ", got "
                + node.getClass().getSimpleName(), node.getClass().getSimpleName(), nodeKinds(expected));
        }
    }

    private static List<String> nodeKinds(ValueType type) {
        if (type == ValueType.BOOLEAN) {
            return List.of("BoolCombinator", "BooleanLiteral", "Comparison");
        }
        return List.of("Arithmetic", "Field", "Indicator", "NumberLiteral");
    }

    private static ValueType typeOf(AstNode node) {
        if (node instanceof AstNode.Comparison
                || node instanceof BoolCombinator
                || node instanceof AstNode.BooleanLiteral) {
            return ValueType.BOOLEAN;
        }
        return ValueType.NUMERIC;
    }
}
