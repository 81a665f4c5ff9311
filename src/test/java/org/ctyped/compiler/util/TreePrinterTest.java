package org.ctyped.compiler.util;

import org.ctyped.compiler.frontend.parser.ast.NodeKind;
import org.ctyped.compiler.frontend.parser.ast.NodeKind.Production;
import org.ctyped.compiler.frontend.parser.ast.ParseNode;
import org.ctyped.compiler.frontend.types.TypeExpression;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TreePrinter}.
 */
public class TreePrinterTest {

    /**
     * Verifies one line per node, indented by depth, with kind and type.
     */
    @Test
    @Tag("unit")
    void testPrintsKindAndTypePerLine() {
        // Arrange
        ParseNode constant = ParseNode.leaf(new NodeKind.Constant(new NodeKind.ConstantValue.Int64(7)), TypeExpression.LONG);
        ParseNode name = ParseNode.leaf(new NodeKind.Identifier("x"), TypeExpression.identifier("x"));
        ParseNode root = ParseNode.of(Production.EXPRESSION, TypeExpression.LONG,
                ParseNode.of(Production.PRIMARY_EXPRESSION, TypeExpression.LONG, constant), name);

        // Act
        String text = TreePrinter.print(root);

        // Assert
        assertThat(text).isEqualTo(
                "EXPRESSION : long\n"
                        + "-PRIMARY_EXPRESSION : long\n"
                        + "--Constant(7) : long\n"
                        + "-Identifier(x) : identifier(x)\n");
    }
}
