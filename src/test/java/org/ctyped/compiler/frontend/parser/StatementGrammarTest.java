package org.ctyped.compiler.frontend.parser;

import org.ctyped.compiler.api.ParseErrorCode;
import org.ctyped.compiler.config.ParserOptions;
import org.ctyped.compiler.diagnostics.DiagnosticsEngine;
import org.ctyped.compiler.frontend.lexer.Lexer;
import org.ctyped.compiler.frontend.lexer.Token;
import org.ctyped.compiler.frontend.lexer.TokenType;
import org.ctyped.compiler.frontend.parser.ast.NodeKind;
import org.ctyped.compiler.frontend.parser.ast.NodeKind.Production;
import org.ctyped.compiler.frontend.semantics.CTypeOracle;
import org.ctyped.compiler.frontend.types.TypeExpression;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for statements and blocks.
 */
public class StatementGrammarTest {

    private static StatementGrammar statements(String source, ParserOptions options) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        return new Parser(tokens, new CTypeOracle(), options).statements();
    }

    private static StatementGrammar statements(String source) {
        return statements(source, ParserOptions.defaults());
    }

    /**
     * Verifies that only {@code return expression;} carries a type.
     */
    @Test
    @Tag("unit")
    void testReturnCarriesExpressionType() {
        // Act
        Parsed withValue = statements("return 1.5;").statement(0);
        Parsed bare = statements("return;").statement(0);

        // Assert
        assertThat(withValue.type()).isEqualTo(TypeExpression.DOUBLE);
        assertThat(withValue.position()).isEqualTo(3);
        assertThat(withValue.node().child(0).kind()).isEqualTo(new NodeKind.JumpStatement(TokenType.RETURN, null));
        assertThat(bare.type()).isEqualTo(TypeExpression.NONE);
        assertThat(bare.position()).isEqualTo(2);
    }

    /**
     * Verifies that a compound statement mixes declarations and statements and is typed none.
     */
    @Test
    @Tag("unit")
    void testCompoundStatement() {
        // Act
        Parsed block = statements("{ int a = 1; a = a + 1; return a; }").compoundStatement(0);
        Parsed empty = statements("{ }").compoundStatement(0);

        // Assert
        assertThat(block.type()).isEqualTo(TypeExpression.NONE);
        assertThat(block.position()).isEqualTo(16);
        assertThat(block.node().child(0).children()).hasSize(3);
        assertThat(block.node().child(0).child(0).child(0).kind()).isEqualTo(Production.DECLARATION);
        assertThat(block.node().child(0).child(1).child(0).kind()).isEqualTo(Production.STATEMENT);
        assertThat(empty.position()).isEqualTo(2);
        assertThat(empty.node().children()).isEmpty();
    }

    /**
     * Verifies if/else and switch with case and default labels.
     */
    @Test
    @Tag("unit")
    void testSelectionStatements() {
        // Act
        Parsed ifElse = statements("if (a) b = 1; else b = 2;").statement(0);
        Parsed dispatch = statements("switch (x) { case 1: y++; break; default: break; }").statement(0);

        // Assert
        assertThat(ifElse.node().child(0).kind()).isEqualTo(new NodeKind.SelectionStatement(TokenType.IF));
        assertThat(ifElse.node().child(0).children()).hasSize(3);
        assertThat(ifElse.type()).isEqualTo(TypeExpression.NONE);
        assertThat(dispatch.node().descendants()
                .filter(n -> n.kind() instanceof NodeKind.LabeledStatement).count()).isEqualTo(2);
        assertThat(dispatch.position()).isEqualTo(18);
    }

    /**
     * Verifies the three loop forms.
     */
    @Test
    @Tag("unit")
    void testIterationStatements() {
        // Act
        Parsed loop = statements("while (i < n) i++;").statement(0);
        Parsed post = statements("do x--; while (x);").statement(0);
        Parsed counted = statements("for (int i = 0; i < n; i++) sum += i;").statement(0);
        Parsed forever = statements("for (;;) ;").statement(0);

        // Assert
        assertThat(loop.node().child(0).kind()).isEqualTo(new NodeKind.IterationStatement(TokenType.WHILE));
        assertThat(post.position()).isEqualTo(9);
        assertThat(counted.node().child(0).children()).hasSize(4);
        assertThat(counted.node().child(0).child(0).kind()).isEqualTo(Production.DECLARATION);
        assertThat(forever.node().child(0).children()).hasSize(3);
        assertThat(forever.type()).isEqualTo(TypeExpression.NONE);
    }

    /**
     * Verifies labels and jumps.
     */
    @Test
    @Tag("unit")
    void testLabelsAndJumps() {
        // Act
        Parsed labeled = statements("done: goto done;").statement(0);

        // Assert
        assertThat(labeled.node().child(0).kind()).isEqualTo(new NodeKind.LabeledStatement(TokenType.IDENTIFIER, "done"));
        assertThat(labeled.node().descendants()
                .anyMatch(n -> n.kind().equals(new NodeKind.JumpStatement(TokenType.GOTO, "done")))).isTrue();
        assertThat(labeled.position()).isEqualTo(5);
    }

    /**
     * Verifies that a semantic error inside a block aborts the statement.
     */
    @Test
    @Tag("unit")
    void testHardFailureInsideBlockPropagates() {
        // Act & Assert
        assertThatThrownBy(() -> statements("{ x = 1; int y = \"s\"; }").statement(0))
                .isInstanceOfSatisfying(ParseFailure.class,
                        f -> assertThat(f.code()).isEqualTo(ParseErrorCode.ILLEGAL_ASSIGNMENT));
    }

    /**
     * Verifies that deeply nested blocks fail cleanly once the configured depth is exceeded.
     */
    @Test
    @Tag("unit")
    void testNestingLimit() {
        // Arrange
        String source = "{".repeat(20) + "}".repeat(20);
        ParserOptions shallow = new ParserOptions(16, ParserOptions.DEFAULT_FUNC_NAME_PLACEHOLDER, 2);

        // Act & Assert
        assertThatThrownBy(() -> statements(source, shallow).statement(0))
                .isInstanceOfSatisfying(ParseFailure.class,
                        f -> assertThat(f.code()).isEqualTo(ParseErrorCode.NESTING_TOO_DEEP));
        assertThat(statements(source).statement(0).position()).isEqualTo(40);
    }
}
