package org.ctyped.compiler.frontend.semantics;

import org.ctyped.compiler.frontend.types.BaseType;
import org.ctyped.compiler.frontend.types.TypeExpression;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ArithmeticKind}.
 */
public class ArithmeticKindTest {

    private static TypeExpression specifiers(BaseType.Tag principal, BaseType.Tag... rest) {
        List<BaseType> auxiliary = new ArrayList<>();
        for (BaseType.Tag t : rest) {
            auxiliary.add(BaseType.of(t));
        }
        return TypeExpression.of(principal).withAuxiliary(auxiliary);
    }

    /**
     * Verifies that specifier combinations collapse to one kind regardless of order and qualifiers.
     */
    @Test
    @Tag("unit")
    void testClassification() {
        // Act & Assert
        assertThat(ArithmeticKind.of(specifiers(BaseType.Tag.UNSIGNED, BaseType.Tag.LONG, BaseType.Tag.LONG)))
                .contains(ArithmeticKind.UNSIGNED_LONG_LONG);
        assertThat(ArithmeticKind.of(specifiers(BaseType.Tag.LONG, BaseType.Tag.UNSIGNED, BaseType.Tag.INT)))
                .contains(ArithmeticKind.UNSIGNED_LONG);
        assertThat(ArithmeticKind.of(specifiers(BaseType.Tag.LONG, BaseType.Tag.DOUBLE))).contains(ArithmeticKind.LONG_DOUBLE);
        assertThat(ArithmeticKind.of(specifiers(BaseType.Tag.CHAR, BaseType.Tag.CONST, BaseType.Tag.UNSIGNED)))
                .contains(ArithmeticKind.UNSIGNED_CHAR);
        assertThat(ArithmeticKind.of(specifiers(BaseType.Tag.SIGNED))).contains(ArithmeticKind.INT);
        assertThat(ArithmeticKind.of(TypeExpression.of(BaseType.Tag.ENUM))).contains(ArithmeticKind.INT);
        assertThat(ArithmeticKind.of(TypeExpression.SIZE_T)).contains(ArithmeticKind.UNSIGNED_LONG);
    }

    /**
     * Verifies that non-arithmetic types have no kind.
     */
    @Test
    @Tag("unit")
    void testNonArithmeticTypes() {
        // Act & Assert
        assertThat(ArithmeticKind.of(TypeExpression.pointerTo(TypeExpression.INT))).isEmpty();
        assertThat(ArithmeticKind.of(TypeExpression.identifier("x"))).isEmpty();
        assertThat(ArithmeticKind.of(TypeExpression.of(BaseType.Tag.CONST))).isEmpty();
        assertThat(ArithmeticKind.of(TypeExpression.NONE)).isEmpty();
    }

    /**
     * Verifies integer promotion and the common type of two operands.
     */
    @Test
    @Tag("unit")
    void testPromotionAndCommonType() {
        // Act & Assert
        assertThat(ArithmeticKind.SHORT.promote()).isEqualTo(ArithmeticKind.INT);
        assertThat(ArithmeticKind.LONG.promote()).isEqualTo(ArithmeticKind.LONG);
        assertThat(ArithmeticKind.CHAR.commonWith(ArithmeticKind.BOOL)).isEqualTo(ArithmeticKind.INT);
        assertThat(ArithmeticKind.UNSIGNED_INT.commonWith(ArithmeticKind.LONG)).isEqualTo(ArithmeticKind.LONG);
        assertThat(ArithmeticKind.LONG_LONG.commonWith(ArithmeticKind.FLOAT)).isEqualTo(ArithmeticKind.FLOAT);
    }
}
