package org.ctyped.compiler.frontend.types;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TypeExpression} and {@link BaseType}.
 */
public class TypeExpressionTest {

    /**
     * Verifies that the leaf of a nested wrapper chain is found and replaced without touching the wrappers.
     */
    @Test
    @Tag("unit")
    void testReplaceLeafKeepsWrapperChain() {
        // Arrange
        TypeExpression declarator = TypeExpression.arrayOf(3, TypeExpression.pointerTo(TypeExpression.identifier("a")));

        // Act
        TypeExpression complete = declarator.replaceLeaf(TypeExpression.INT);

        // Assert
        assertThat(declarator.leaf()).isEqualTo(TypeExpression.identifier("a"));
        assertThat(complete).isEqualTo(TypeExpression.arrayOf(3, TypeExpression.pointerTo(TypeExpression.INT)));
        assertThat(complete.toString()).isEqualTo("array[3]<pointer<int>>");
    }

    /**
     * Verifies that a type without wrappers is replaced entirely.
     */
    @Test
    @Tag("unit")
    void testReplaceLeafOfPlainType() {
        // Act
        TypeExpression replaced = TypeExpression.identifier("x").replaceLeaf(TypeExpression.DOUBLE);

        // Assert
        assertThat(replaced).isEqualTo(TypeExpression.DOUBLE);
    }

    /**
     * Verifies that a function's parameter list is not part of the leaf walk.
     */
    @Test
    @Tag("unit")
    void testFunctionLeafIgnoresParameters() {
        // Arrange
        TypeExpression fn = TypeExpression.function(TypeExpression.identifier("f"), TypeExpression.INT);

        // Act
        TypeExpression complete = fn.replaceLeaf(TypeExpression.LONG);

        // Assert
        assertThat(complete.children()).containsExactly(TypeExpression.LONG, TypeExpression.INT);
        assertThat(TypeExpression.function(TypeExpression.NONE, null).children()).hasSize(1);
    }

    /**
     * Verifies that flatten only groups when there is more than one part.
     */
    @Test
    @Tag("unit")
    void testFlatten() {
        // Act
        TypeExpression single = TypeExpression.flatten(List.of(TypeExpression.INT));
        TypeExpression several = TypeExpression.flatten(List.of(TypeExpression.INT, TypeExpression.LONG));

        // Assert
        assertThat(single).isSameAs(TypeExpression.INT);
        assertThat(several.is(BaseType.Tag.COMPOSITE)).isTrue();
        assertThat(several.children()).containsExactly(TypeExpression.INT, TypeExpression.LONG);
    }

    /**
     * Verifies auxiliary tags and their rendering.
     */
    @Test
    @Tag("unit")
    void testAuxiliaryTags() {
        // Act
        TypeExpression t = TypeExpression.of(BaseType.Tag.UNSIGNED)
                .withAuxiliary(List.of(BaseType.of(BaseType.Tag.LONG), BaseType.of(BaseType.Tag.CONST)));

        // Assert
        assertThat(t.hasAuxiliary(BaseType.Tag.CONST)).isTrue();
        assertThat(t.hasAuxiliary(BaseType.Tag.VOLATILE)).isFalse();
        assertThat(t.toString()).isEqualTo("unsigned{long const}");
        assertThat(t.withAuxiliary(List.of())).isSameAs(t);
    }

    /**
     * Verifies the invariants enforced by the constructors.
     */
    @Test
    @Tag("unit")
    void testConstructionInvariants() {
        // Assert
        assertThatThrownBy(() -> new BaseType(BaseType.Tag.IDENTIFIER, 0, null)).isInstanceOf(NullPointerException.class);
        assertThat(BaseType.array(BaseType.UNSPECIFIED_LENGTH).toString()).isEqualTo("array[]");
        assertThat(TypeExpression.INT.element()).isEmpty();
        assertThat(TypeExpression.pointerTo(TypeExpression.INT).element()).contains(TypeExpression.INT);
    }
}
