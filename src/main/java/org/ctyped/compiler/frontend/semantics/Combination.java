package org.ctyped.compiler.frontend.semantics;

import org.ctyped.compiler.frontend.types.TypeExpression;

/**
 * The answer of {@link TypeOracle#combineTypes}.
 *
 * @param accepted Whether the operand types may be combined with the operator.
 * @param result The result type if accepted, otherwise {@code null}.
 */
public record Combination(boolean accepted, TypeExpression result) {

    private static final Combination REJECTED = new Combination(false, null);

    public static Combination accept(TypeExpression result) {
        return new Combination(true, result);
    }

    public static Combination reject() {
        return REJECTED;
    }
}
