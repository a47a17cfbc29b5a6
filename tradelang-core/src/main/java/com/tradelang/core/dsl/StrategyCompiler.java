package com.tradelang.core.dsl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for turning strategy text into a validated {@link Strategy}.
 */
public class StrategyCompiler {

    private static final Logger log = LoggerFactory.getLogger(StrategyCompiler.class);

    private final Parser parser = new Parser();
    private final AstBuilder builder = new AstBuilder();

    /**
     * Parse and validate strategy text.
     *
     * @throws DslSyntaxException     on a grammar violation
     * @throws DslValidationException on unknown names, wrong arity or mismatched types
     */
    public Strategy compile(String source) {
        ParseNode tree = parser.parse(source);
        Strategy strategy = builder.build(tree);
        log.debug("Compiled strategy: entry={}, exit={}", strategy.entry(), strategy.exit());
        return strategy;
    }

    /**
     * Compile a single boolean or numeric expression.
     */
    public AstNode compileExpression(String source) {
        return builder.buildExpression(parser.parseExpression(source));
    }

    /**
     * Validate strategy text without throwing.
     */
    public CompileResult check(String source) {
        try {
            return new CompileResult(true, compile(source), null, null);
        } catch (DslSyntaxException e) {
            return new CompileResult(false, null, e.getMessage(), e.getPosition());
        } catch (DslValidationException e) {
            return new CompileResult(false, null, e.getMessage(), null);
        }
    }

    /**
     * Result of checking strategy text.
     *
     * @param errorPosition character offset of a syntax error, null otherwise
     */
    public record CompileResult(boolean success, Strategy strategy, String error, Integer errorPosition) {}
}
