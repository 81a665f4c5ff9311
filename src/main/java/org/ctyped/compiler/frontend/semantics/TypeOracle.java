package org.ctyped.compiler.frontend.semantics;

import org.ctyped.compiler.frontend.lexer.TokenType;
import org.ctyped.compiler.frontend.types.TypeExpression;

import java.util.Optional;

/**
 * Answers the typing questions the parser asks while it builds nodes.
 * <p>
 * Implementations must be pure: the same arguments always produce the same answer.
 */
public interface TypeOracle {

    /**
     * @param target The type named in the cast.
     * @param source The type of the operand being cast.
     * @return {@code true} if {@code (target) source} is a legal conversion.
     */
    boolean castIsLegal(TypeExpression target, TypeExpression source);

    /**
     * Computes the type of {@code left op right}.
     *
     * @param left The type of the left operand.
     * @param right The type of the right operand.
     * @param operator A binary operator token type such as {@link TokenType#PLUS}.
     * @return The accepted result type, or a rejection.
     */
    Combination combineTypes(TypeExpression left, TypeExpression right, TokenType operator);

    /**
     * Computes the result of storing a value of type {@code right} into an object of type {@code left}.
     *
     * @param left The assigned or initialized type.
     * @param right The type of the value.
     * @return The resulting type, or empty if no implicit conversion exists.
     */
    Optional<TypeExpression> resolveImplicitConversion(TypeExpression left, TypeExpression right);

    /**
     * @return {@code true} if both types denote the same C type.
     */
    boolean typesEqual(TypeExpression a, TypeExpression b);
}
