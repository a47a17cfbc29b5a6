package com.tradelang.core.dsl;

import java.util.Objects;

/**
 * A compiled strategy: one boolean condition for entering a position and one for leaving it.
 */
public record Strategy(AstNode entry, AstNode exit) {

    public Strategy {
        Objects.requireNonNull(entry, "entry");
        Objects.requireNonNull(exit, "exit");
    }
}
