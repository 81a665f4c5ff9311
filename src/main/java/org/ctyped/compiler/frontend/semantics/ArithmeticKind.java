package org.ctyped.compiler.frontend.semantics;

import org.ctyped.compiler.frontend.types.BaseType;
import org.ctyped.compiler.frontend.types.BaseType.Tag;
import org.ctyped.compiler.frontend.types.TypeExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The canonical arithmetic types, ordered by conversion rank.
 * <p>
 * A specifier combination such as {@code unsigned long int} is classified into exactly one kind,
 * which is what the usual arithmetic conversions operate on.
 */
public enum ArithmeticKind {
    BOOL(false, false),
    CHAR(false, false),
    UNSIGNED_CHAR(true, false),
    SHORT(false, false),
    UNSIGNED_SHORT(true, false),
    INT(false, false),
    UNSIGNED_INT(true, false),
    LONG(false, false),
    UNSIGNED_LONG(true, false),
    LONG_LONG(false, false),
    UNSIGNED_LONG_LONG(true, false),
    FLOAT(false, true),
    DOUBLE(false, true),
    LONG_DOUBLE(false, true);

    private final boolean unsigned;
    private final boolean floating;

    ArithmeticKind(boolean unsigned, boolean floating) {
        this.unsigned = unsigned;
        this.floating = floating;
    }

    public boolean isFloating() {
        return floating;
    }

    public boolean isInteger() {
        return !floating;
    }

    public boolean isUnsigned() {
        return unsigned;
    }

    /**
     * Classifies a type by its principal tag and its auxiliary specifiers.
     *
     * @param type Any type expression.
     * @return The arithmetic kind, or empty for pointers, aggregates, functions and placeholders.
     */
    public static Optional<ArithmeticKind> of(TypeExpression type) {
        Tag principal = type.tag();
        if (principal == Tag.ENUM) {
            return Optional.of(INT);
        }
        if (principal == Tag.SIZE_T) {
            return Optional.of(UNSIGNED_LONG);
        }
        if (!principal.isArithmeticSpecifier() && !principal.isQualifierOrMarker()) {
            return Optional.empty();
        }

        int longs = 0;
        boolean isUnsigned = false;
        boolean isChar = false;
        boolean isShort = false;
        boolean isBool = false;
        boolean isFloat = false;
        boolean isDouble = false;
        boolean any = false;
        for (BaseType b : specifiers(type)) {
            switch (b.tag()) {
                case LONG -> longs++;
                case UNSIGNED -> isUnsigned = true;
                case CHAR -> isChar = true;
                case SHORT -> isShort = true;
                case BOOL -> isBool = true;
                case FLOAT -> isFloat = true;
                case DOUBLE -> isDouble = true;
                case INT, SIGNED, COMPLEX, IMAGINARY -> { }
                default -> {
                    continue;
                }
            }
            any = true;
        }
        if (!any) {
            return Optional.empty();
        }
        if (isFloat) return Optional.of(FLOAT);
        if (isDouble) return Optional.of(longs > 0 ? LONG_DOUBLE : DOUBLE);
        if (isBool) return Optional.of(BOOL);
        if (isChar) return Optional.of(isUnsigned ? UNSIGNED_CHAR : CHAR);
        if (isShort) return Optional.of(isUnsigned ? UNSIGNED_SHORT : SHORT);
        if (longs >= 2) return Optional.of(isUnsigned ? UNSIGNED_LONG_LONG : LONG_LONG);
        if (longs == 1) return Optional.of(isUnsigned ? UNSIGNED_LONG : LONG);
        return Optional.of(isUnsigned ? UNSIGNED_INT : INT);
    }

    private static List<BaseType> specifiers(TypeExpression type) {
        if (type.auxiliary().isEmpty()) {
            return List.of(type.primary());
        }
        List<BaseType> all = new ArrayList<>(type.auxiliary().size() + 1);
        all.add(type.primary());
        all.addAll(type.auxiliary());
        return all;
    }

    /**
     * Integer promotion: everything ranked below {@code int} becomes {@code int}.
     */
    public ArithmeticKind promote() {
        return ordinal() < INT.ordinal() ? INT : this;
    }

    /**
     * The usual arithmetic conversions.
     *
     * @param other The kind of the other operand.
     * @return The common kind of both operands.
     */
    public ArithmeticKind commonWith(ArithmeticKind other) {
        ArithmeticKind a = promote();
        ArithmeticKind b = other.promote();
        // Unsigned kinds rank right after their signed counterpart, floating kinds above all integers.
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    /**
     * @return The canonical type expression of this kind.
     */
    public TypeExpression toType() {
        return switch (this) {
            case BOOL -> TypeExpression.of(Tag.BOOL);
            case CHAR -> TypeExpression.of(Tag.CHAR);
            case UNSIGNED_CHAR -> TypeExpression.of(Tag.UNSIGNED).withAuxiliary(List.of(BaseType.of(Tag.CHAR)));
            case SHORT -> TypeExpression.of(Tag.SHORT);
            case UNSIGNED_SHORT -> TypeExpression.of(Tag.UNSIGNED).withAuxiliary(List.of(BaseType.of(Tag.SHORT)));
            case INT -> TypeExpression.INT;
            case UNSIGNED_INT -> TypeExpression.of(Tag.UNSIGNED);
            case LONG -> TypeExpression.LONG;
            case UNSIGNED_LONG -> TypeExpression.of(Tag.UNSIGNED).withAuxiliary(List.of(BaseType.of(Tag.LONG)));
            case LONG_LONG -> TypeExpression.LONG.withAuxiliary(List.of(BaseType.of(Tag.LONG)));
            case UNSIGNED_LONG_LONG -> TypeExpression.of(Tag.UNSIGNED)
                    .withAuxiliary(List.of(BaseType.of(Tag.LONG), BaseType.of(Tag.LONG)));
            case FLOAT -> TypeExpression.of(Tag.FLOAT);
            case DOUBLE -> TypeExpression.DOUBLE;
            case LONG_DOUBLE -> TypeExpression.of(Tag.LONG).withAuxiliary(List.of(BaseType.of(Tag.DOUBLE)));
        };
    }
}
