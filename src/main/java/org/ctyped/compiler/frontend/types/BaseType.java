package org.ctyped.compiler.frontend.types;

import java.util.Objects;

/**
 * One primary tag of a {@link TypeExpression}.
 *
 * @param tag The kind of the type.
 * @param length The element count for {@link Tag#ARRAY}, {@link #UNSPECIFIED_LENGTH} if unknown, otherwise 0.
 * @param name The name for {@link Tag#IDENTIFIER}, otherwise {@code null}.
 */
public record BaseType(Tag tag, int length, String name) {

    /** Array length of {@code int a[]}. */
    public static final int UNSPECIFIED_LENGTH = -1;

    /**
     * The vocabulary of primary type tags.
     */
    public enum Tag {
        VOID, BOOL, CHAR, SHORT, INT, LONG, FLOAT, DOUBLE, SIGNED, UNSIGNED, COMPLEX, IMAGINARY,
        POINTER, VOID_POINTER, ARRAY, STRUCT, UNION, ENUM, FUNCTION,
        EXTERN, STATIC, THREAD_LOCAL, AUTO, REGISTER,
        CONST, RESTRICT, VOLATILE, ATOMIC,
        INLINE, NORETURN,
        SIZE_T, VARIADIC, IDENTIFIER, NONE,
        /** Flat grouping of unrelated parts, used by declarations and lists. */
        COMPOSITE;

        /**
         * @return {@code true} for the basic type-specifier keywords.
         */
        public boolean isArithmeticSpecifier() {
            return switch (this) {
                case BOOL, CHAR, SHORT, INT, LONG, FLOAT, DOUBLE, SIGNED, UNSIGNED, COMPLEX, IMAGINARY, SIZE_T -> true;
                default -> false;
            };
        }

        /**
         * @return {@code true} for tags that only decorate a principal type.
         */
        public boolean isQualifierOrMarker() {
            return switch (this) {
                case EXTERN, STATIC, THREAD_LOCAL, AUTO, REGISTER, CONST, RESTRICT, VOLATILE, ATOMIC,
                        INLINE, NORETURN -> true;
                default -> false;
            };
        }
    }

    public BaseType {
        Objects.requireNonNull(tag, "tag");
        if (tag == Tag.IDENTIFIER) {
            Objects.requireNonNull(name, "an identifier placeholder needs a name");
        }
    }

    public static BaseType of(Tag tag) {
        return new BaseType(tag, 0, null);
    }

    public static BaseType array(int length) {
        return new BaseType(Tag.ARRAY, length, null);
    }

    public static BaseType identifier(String name) {
        return new BaseType(Tag.IDENTIFIER, 0, name);
    }

    @Override
    public String toString() {
        return switch (tag) {
            case ARRAY -> length == UNSPECIFIED_LENGTH ? "array[]" : "array[" + length + "]";
            case IDENTIFIER -> "identifier(" + name + ")";
            default -> tag.name().toLowerCase();
        };
    }
}
