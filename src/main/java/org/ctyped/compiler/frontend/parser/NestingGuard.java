package org.ctyped.compiler.frontend.parser;

import org.ctyped.compiler.api.ParseErrorCode;

/**
 * Bounds the recursion depth of the grammar so deeply nested input fails cleanly instead of
 * overflowing the call stack.
 * <p>
 * Use as {@code guard.enter(pos); try { ... } finally { guard.exit(); }}.
 */
final class NestingGuard {

    private final int maxDepth;
    private int depth;

    NestingGuard(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    void enter(int pos) {
        if (depth >= maxDepth) {
            throw new ParseFailure(ParseErrorCode.NESTING_TOO_DEEP, pos,
                    "Nesting deeper than " + maxDepth + " levels at token " + pos);
        }
        depth++;
    }

    void exit() {
        depth--;
    }

    int depth() {
        return depth;
    }
}
