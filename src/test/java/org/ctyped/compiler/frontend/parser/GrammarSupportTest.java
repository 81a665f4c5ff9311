package org.ctyped.compiler.frontend.parser;

import org.ctyped.compiler.api.ParseErrorCode;
import org.ctyped.compiler.frontend.lexer.Token;
import org.ctyped.compiler.frontend.lexer.TokenType;
import org.ctyped.compiler.frontend.parser.ast.NodeKind;
import org.ctyped.compiler.frontend.parser.ast.ParseNode;
import org.ctyped.compiler.frontend.types.TypeExpression;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the backtracking combinators in {@link GrammarSupport}.
 */
public class GrammarSupportTest {

    // a , b , )
    private final TokenCursor cursor = new TokenCursor(List.of(
            Token.of(TokenType.IDENTIFIER, "a", null),
            Token.of(TokenType.COMMA, ",", null),
            Token.of(TokenType.IDENTIFIER, "b", null),
            Token.of(TokenType.COMMA, ",", null),
            Token.of(TokenType.RPAREN, ")", null)));

    private Parsed name(int pos) {
        Token t = cursor.expect(pos, TokenType.IDENTIFIER);
        return new Parsed(ParseNode.leaf(new NodeKind.Identifier(t.text()), TypeExpression.identifier(t.text())), pos + 1);
    }

    private static Parsed hardFailure(int pos) {
        throw new ParseFailure(ParseErrorCode.ILLEGAL_CAST, pos, "hard");
    }

    /**
     * Verifies that ordered choice returns the first alternative that succeeds.
     */
    @Test
    @Tag("unit")
    void testFirstOfPicksFirstSuccess() {
        // Arrange
        AtomicInteger tried = new AtomicInteger();

        // Act
        Parsed result = GrammarSupport.firstOf("test", 0,
                p -> { tried.incrementAndGet(); throw new ParseFailure(ParseErrorCode.UNEXPECTED_TOKEN, p, "no"); },
                this::name,
                p -> { tried.incrementAndGet(); return name(p); });

        // Assert
        assertThat(result.position()).isEqualTo(1);
        assertThat(tried.get()).isEqualTo(1);
    }

    /**
     * Verifies that exhausting all alternatives reports the last failure as cause and position.
     */
    @Test
    @Tag("unit")
    void testFirstOfReportsLastFailure() {
        // Act & Assert
        assertThatThrownBy(() -> GrammarSupport.firstOf("pair", 0,
                p -> { throw new ParseFailure(ParseErrorCode.UNEXPECTED_TOKEN, p, "first"); },
                p -> { throw new ParseFailure(ParseErrorCode.UNEXPECTED_TOKEN, p + 2, "second"); }))
                .isInstanceOfSatisfying(ParseFailure.class, f -> {
                    assertThat(f.code()).isEqualTo(ParseErrorCode.NO_VIABLE_ALTERNATIVE);
                    assertThat(f.position()).isEqualTo(2);
                    assertThat(f.getMessage()).contains("pair").contains("second");
                    assertThat(f.getCause()).isInstanceOf(ParseFailure.class);
                });
    }

    /**
     * Verifies that a hard failure aborts the choice without trying later alternatives.
     */
    @Test
    @Tag("unit")
    void testFirstOfPropagatesHardFailure() {
        // Arrange
        AtomicInteger tried = new AtomicInteger();

        // Act & Assert
        assertThatThrownBy(() -> GrammarSupport.firstOf("test", 0,
                GrammarSupportTest::hardFailure,
                p -> { tried.incrementAndGet(); return name(p); }))
                .isInstanceOfSatisfying(ParseFailure.class,
                        f -> assertThat(f.code()).isEqualTo(ParseErrorCode.ILLEGAL_CAST));
        assertThat(tried.get()).isZero();
    }

    /**
     * Verifies that optional and repeat swallow only recoverable failures.
     */
    @Test
    @Tag("unit")
    void testOptionalAndRepeat() {
        // Act
        GrammarSupport.Sequence none = GrammarSupport.repeat(this::name, 1);
        GrammarSupport.Sequence one = GrammarSupport.repeat(this::name, 0);

        // Assert
        assertThat(GrammarSupport.optional(this::name, 1)).isEmpty();
        assertThat(GrammarSupport.optional(this::name, 0)).isPresent();
        assertThat(none.isEmpty()).isTrue();
        assertThat(none.position()).isEqualTo(1);
        assertThat(one.nodes()).hasSize(1);
        assertThatThrownBy(() -> GrammarSupport.repeat(GrammarSupportTest::hardFailure, 0))
                .isInstanceOf(ParseFailure.class);
        assertThatThrownBy(() -> GrammarSupport.repeatAtLeastOnce(this::name, 1))
                .isInstanceOfSatisfying(ParseFailure.class,
                        f -> assertThat(f.code()).isEqualTo(ParseErrorCode.UNEXPECTED_TOKEN));
    }

    /**
     * Verifies that repetition stops when an item consumes nothing.
     */
    @Test
    @Tag("unit")
    void testRepeatStopsWithoutProgress() {
        // Act
        GrammarSupport.Sequence items = GrammarSupport.repeat(
                p -> new Parsed(ParseNode.leaf(NodeKind.Production.EXPRESSION_STATEMENT, TypeExpression.NONE), p), 0);

        // Assert
        assertThat(items.isEmpty()).isTrue();
        assertThat(items.position()).isZero();
    }

    /**
     * Verifies that a trailing separator is left unconsumed.
     */
    @Test
    @Tag("unit")
    void testSeparatedListLeavesTrailingSeparator() {
        // Act
        GrammarSupport.Sequence items = GrammarSupport.separatedList(this::name, TokenType.COMMA, cursor, 0);

        // Assert
        assertThat(items.nodes()).hasSize(2);
        assertThat(items.position()).isEqualTo(3);
    }
}
