package org.ctyped.compiler.frontend.semantics;

import org.ctyped.compiler.frontend.lexer.TokenType;
import org.ctyped.compiler.frontend.types.BaseType.Tag;
import org.ctyped.compiler.frontend.types.TypeExpression;

import java.util.Optional;

/**
 * The C11 typing rules used by the parser.
 * <p>
 * Names are not resolved at parse time, so an {@code IDENTIFIER} placeholder unifies with
 * any type: combinations yield the resolved operand, casts involving it are legal and it is
 * equal to everything.
 */
public class CTypeOracle implements TypeOracle {

    @Override
    public boolean castIsLegal(TypeExpression target, TypeExpression source) {
        if (target.is(Tag.VOID) && target.children().isEmpty()) {
            return true;
        }
        if (isPlaceholder(target) || isPlaceholder(source)) {
            return true;
        }
        if (isAggregate(target) || isAggregate(source)) {
            return false;
        }
        // Arrays and functions cannot be cast to; as operands they decay to pointers.
        if (target.is(Tag.ARRAY) || target.is(Tag.FUNCTION)) {
            return false;
        }
        if (!isScalar(target) || !isScalar(source)) {
            return false;
        }
        boolean targetFloating = ArithmeticKind.of(target).map(ArithmeticKind::isFloating).orElse(false);
        boolean sourceFloating = ArithmeticKind.of(source).map(ArithmeticKind::isFloating).orElse(false);
        if (isPointerLike(target) && sourceFloating) {
            return false;
        }
        return !(isPointerLike(source) && targetFloating);
    }

    @Override
    public Combination combineTypes(TypeExpression left, TypeExpression right, TokenType operator) {
        return switch (operator) {
            case STAR, SLASH -> arithmetic(left, right, false);
            case PERCENT, AMPERSAND, CARET, PIPE -> arithmetic(left, right, true);
            case LEFT_OP, RIGHT_OP -> shift(left, right);
            case PLUS -> additive(left, right, false);
            case MINUS -> additive(left, right, true);
            case LESS, GREATER, LE_OP, GE_OP, EQ_OP, NE_OP, AND_OP, OR_OP ->
                    isScalarOrPlaceholder(left) && isScalarOrPlaceholder(right)
                            ? Combination.accept(TypeExpression.INT)
                            : Combination.reject();
            default -> Combination.reject();
        };
    }

    @Override
    public Optional<TypeExpression> resolveImplicitConversion(TypeExpression left, TypeExpression right) {
        if (isPlaceholder(left)) {
            return Optional.of(right);
        }
        if (isPlaceholder(right)) {
            return Optional.of(left);
        }
        Optional<ArithmeticKind> l = ArithmeticKind.of(left);
        Optional<ArithmeticKind> r = ArithmeticKind.of(right);
        if (l.isPresent() && r.isPresent()) {
            return Optional.of(left);
        }
        if (l.isPresent() && l.get() == ArithmeticKind.BOOL && isPointerLike(decay(right))) {
            return Optional.of(left);
        }
        if (isPointerLike(left)) {
            if (isPointerLike(decay(right)) || r.map(ArithmeticKind::isInteger).orElse(false)) {
                return Optional.of(left);
            }
            return Optional.empty();
        }
        if (left.is(Tag.ARRAY) && right.is(Tag.ARRAY)) {
            return Optional.of(left);
        }
        if (isAggregate(left) && isAggregate(right) && typesEqual(left, right)) {
            return Optional.of(left);
        }
        return Optional.empty();
    }

    @Override
    public boolean typesEqual(TypeExpression a, TypeExpression b) {
        if (isPlaceholder(a) || isPlaceholder(b)) {
            return true;
        }
        Optional<ArithmeticKind> ka = ArithmeticKind.of(a);
        Optional<ArithmeticKind> kb = ArithmeticKind.of(b);
        if (ka.isPresent() || kb.isPresent()) {
            return ka.equals(kb);
        }
        if (a.tag() != b.tag()) {
            return false;
        }
        if (a.is(Tag.ARRAY) && a.primary().length() != b.primary().length()) {
            return false;
        }
        if (isAggregate(a) && !a.children().isEmpty() && !b.children().isEmpty()
                && a.children().get(0).is(Tag.IDENTIFIER) && b.children().get(0).is(Tag.IDENTIFIER)) {
            // Tagged structs are equal by tag name.
            return a.children().get(0).primary().name().equals(b.children().get(0).primary().name());
        }
        if (a.children().size() != b.children().size()) {
            return false;
        }
        for (int i = 0; i < a.children().size(); i++) {
            if (!typesEqual(a.children().get(i), b.children().get(i))) {
                return false;
            }
        }
        return true;
    }

    private Combination arithmetic(TypeExpression left, TypeExpression right, boolean integerOnly) {
        Optional<ArithmeticKind> l = resolvedKind(left, right);
        Optional<ArithmeticKind> r = resolvedKind(right, left);
        if (l.isEmpty() || r.isEmpty()) {
            return bothPlaceholders(left, right) ? Combination.accept(left) : Combination.reject();
        }
        if (integerOnly && (l.get().isFloating() || r.get().isFloating())) {
            return Combination.reject();
        }
        return Combination.accept(l.get().commonWith(r.get()).toType());
    }

    private Combination shift(TypeExpression left, TypeExpression right) {
        Optional<ArithmeticKind> l = resolvedKind(left, right);
        Optional<ArithmeticKind> r = resolvedKind(right, left);
        if (l.isEmpty() || r.isEmpty()) {
            return bothPlaceholders(left, right) ? Combination.accept(left) : Combination.reject();
        }
        if (l.get().isFloating() || r.get().isFloating()) {
            return Combination.reject();
        }
        return Combination.accept(l.get().promote().toType());
    }

    private Combination additive(TypeExpression left, TypeExpression right, boolean subtract) {
        TypeExpression l = decay(left);
        TypeExpression r = decay(right);
        if (isPointerLike(l) && isIntegerOrPlaceholder(r)) {
            return Combination.accept(l);
        }
        if (!subtract && isIntegerOrPlaceholder(l) && isPointerLike(r)) {
            return Combination.accept(r);
        }
        if (subtract && isPointerLike(l) && isPointerLike(r)) {
            return Combination.accept(TypeExpression.LONG);
        }
        if (isPointerLike(l) || isPointerLike(r)) {
            return Combination.reject();
        }
        return arithmetic(left, right, false);
    }

    /**
     * The kind of {@code type}, or of {@code other} when {@code type} is an unresolved name.
     */
    private Optional<ArithmeticKind> resolvedKind(TypeExpression type, TypeExpression other) {
        if (isPlaceholder(type)) {
            return isPlaceholder(other) ? Optional.empty() : ArithmeticKind.of(other);
        }
        return ArithmeticKind.of(type);
    }

    private static boolean bothPlaceholders(TypeExpression a, TypeExpression b) {
        return isPlaceholder(a) && isPlaceholder(b);
    }

    private static boolean isPlaceholder(TypeExpression type) {
        return type.is(Tag.IDENTIFIER);
    }

    private static boolean isAggregate(TypeExpression type) {
        return type.is(Tag.STRUCT) || type.is(Tag.UNION);
    }

    private static boolean isPointerLike(TypeExpression type) {
        return type.is(Tag.POINTER) || type.is(Tag.VOID_POINTER);
    }

    private static TypeExpression decay(TypeExpression type) {
        if (type.is(Tag.ARRAY)) {
            return TypeExpression.pointerTo(type.element().orElse(TypeExpression.of(Tag.VOID)));
        }
        if (type.is(Tag.FUNCTION)) {
            return TypeExpression.pointerTo(type);
        }
        return type;
    }

    private static boolean isScalar(TypeExpression type) {
        return ArithmeticKind.of(type).isPresent() || isPointerLike(decay(type));
    }

    private static boolean isScalarOrPlaceholder(TypeExpression type) {
        return isPlaceholder(type) || isScalar(type);
    }

    private static boolean isIntegerOrPlaceholder(TypeExpression type) {
        return isPlaceholder(type) || ArithmeticKind.of(type).map(ArithmeticKind::isInteger).orElse(false);
    }
}
