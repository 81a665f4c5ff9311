package org.ctyped.compiler.frontend.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable, tree-shaped C type.
 * <p>
 * {@code POINTER}, {@code ARRAY} and {@code ATOMIC} wrap their element in the first child.
 * {@code FUNCTION} wraps its result (or the declarator being built) in the first child and
 * holds the parameter-list type in the second child when there is one.
 * {@code auxiliary} holds the flat rest of a specifier sequence, such as the {@code long}
 * of {@code unsigned long} or the {@code const} of {@code const int}.
 *
 * @param primary The principal tag.
 * @param children Composed sub-types.
 * @param auxiliary Additional specifiers, qualifiers and markers.
 */
public record TypeExpression(BaseType primary, List<TypeExpression> children, List<BaseType> auxiliary) {

    public static final TypeExpression NONE = of(BaseType.Tag.NONE);
    public static final TypeExpression LONG = of(BaseType.Tag.LONG);
    public static final TypeExpression INT = of(BaseType.Tag.INT);
    public static final TypeExpression DOUBLE = of(BaseType.Tag.DOUBLE);
    public static final TypeExpression SIZE_T = of(BaseType.Tag.SIZE_T);

    public TypeExpression {
        Objects.requireNonNull(primary, "primary");
        children = List.copyOf(children);
        auxiliary = List.copyOf(auxiliary);
    }

    public static TypeExpression of(BaseType.Tag tag) {
        return new TypeExpression(BaseType.of(tag), List.of(), List.of());
    }

    public static TypeExpression of(BaseType base) {
        return new TypeExpression(base, List.of(), List.of());
    }

    public static TypeExpression identifier(String name) {
        return of(BaseType.identifier(name));
    }

    public static TypeExpression pointerTo(TypeExpression element) {
        return new TypeExpression(BaseType.of(BaseType.Tag.POINTER), List.of(element), List.of());
    }

    public static TypeExpression arrayOf(int length, TypeExpression element) {
        return new TypeExpression(BaseType.array(length), List.of(element), List.of());
    }

    /**
     * @param result The result type, or the declarator the function suffix is applied to.
     * @param parameters The parameter-list type, or {@code null} for {@code ()}.
     * @return A function type.
     */
    public static TypeExpression function(TypeExpression result, TypeExpression parameters) {
        List<TypeExpression> parts = parameters == null ? List.of(result) : List.of(result, parameters);
        return new TypeExpression(BaseType.of(BaseType.Tag.FUNCTION), parts, List.of());
    }

    /**
     * Groups unrelated types, or returns the single element unchanged.
     * @param parts The element types.
     * @return The only element, or a {@code COMPOSITE} of all of them.
     */
    public static TypeExpression flatten(List<TypeExpression> parts) {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return composite(parts);
    }

    public static TypeExpression composite(List<TypeExpression> parts) {
        return new TypeExpression(BaseType.of(BaseType.Tag.COMPOSITE), parts, List.of());
    }

    public BaseType.Tag tag() {
        return primary.tag();
    }

    public boolean is(BaseType.Tag tag) {
        return primary.tag() == tag;
    }

    /**
     * @return The first child, which is the element type of a pointer, array or atomic type.
     */
    public Optional<TypeExpression> element() {
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(0));
    }

    public boolean hasAuxiliary(BaseType.Tag tag) {
        return auxiliary.stream().anyMatch(b -> b.tag() == tag);
    }

    public TypeExpression withAuxiliary(List<BaseType> extra) {
        if (extra.isEmpty()) {
            return this;
        }
        List<BaseType> merged = new ArrayList<>(auxiliary);
        merged.addAll(extra);
        return new TypeExpression(primary, children, merged);
    }

    public TypeExpression withChildren(List<TypeExpression> newChildren) {
        return new TypeExpression(primary, newChildren, auxiliary);
    }

    /**
     * Replaces the innermost leaf of a wrapper chain.
     * <p>
     * Walks through the first child of {@code POINTER}, {@code ARRAY}, {@code ATOMIC} and
     * {@code FUNCTION} nodes and substitutes whatever sits at the bottom.
     *
     * @param leaf The type to put at the bottom of the chain.
     * @return The rebuilt chain. A type without wrappers is replaced by {@code leaf} entirely.
     */
    public TypeExpression replaceLeaf(TypeExpression leaf) {
        if (!isWrapper() || children.isEmpty()) {
            return leaf;
        }
        List<TypeExpression> rebuilt = new ArrayList<>(children);
        rebuilt.set(0, children.get(0).replaceLeaf(leaf));
        return withChildren(rebuilt);
    }

    /**
     * @return The innermost leaf of a wrapper chain.
     */
    public TypeExpression leaf() {
        TypeExpression t = this;
        while (t.isWrapper() && !t.children.isEmpty()) {
            t = t.children.get(0);
        }
        return t;
    }

    private boolean isWrapper() {
        return switch (primary.tag()) {
            case POINTER, ARRAY, ATOMIC, FUNCTION -> true;
            default -> false;
        };
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(primary.toString());
        if (!auxiliary.isEmpty()) {
            sb.append('{');
            for (int i = 0; i < auxiliary.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(auxiliary.get(i));
            }
            sb.append('}');
        }
        if (!children.isEmpty()) {
            sb.append('<');
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(children.get(i));
            }
            sb.append('>');
        }
        return sb.toString();
    }
}
