package org.ctyped.compiler.frontend.parser;

import org.ctyped.compiler.api.ParseErrorCode;
import org.ctyped.compiler.frontend.parser.ast.NodeKind;
import org.ctyped.compiler.frontend.parser.ast.ParseNode;
import org.ctyped.compiler.frontend.types.TypeExpression;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for {@link RuleMemo}.
 */
public class RuleMemoTest {

    /**
     * Verifies that a successful rule runs once per position.
     */
    @Test
    @Tag("unit")
    void testSuccessIsReused() {
        // Arrange
        RuleMemo memo = new RuleMemo();
        AtomicInteger calls = new AtomicInteger();
        GrammarSupport.Rule rule = p -> {
            calls.incrementAndGet();
            return new Parsed(ParseNode.leaf(new NodeKind.Identifier("x"), TypeExpression.identifier("x")), p + 1);
        };

        // Act
        Parsed first = memo.apply(3, rule);
        Parsed second = memo.apply(3, rule);
        memo.apply(4, rule);

        // Assert
        assertThat(second).isSameAs(first);
        assertThat(calls.get()).isEqualTo(2);
    }

    /**
     * Verifies that recoverable failures are replayed and hard failures are not stored.
     */
    @Test
    @Tag("unit")
    void testFailuresByKind() {
        // Arrange
        RuleMemo memo = new RuleMemo();
        AtomicInteger calls = new AtomicInteger();
        GrammarSupport.Rule recoverable = p -> {
            calls.incrementAndGet();
            throw new ParseFailure(ParseErrorCode.UNEXPECTED_TOKEN, p, "no");
        };
        AtomicInteger hardCalls = new AtomicInteger();
        GrammarSupport.Rule hard = p -> {
            hardCalls.incrementAndGet();
            throw new ParseFailure(ParseErrorCode.ILLEGAL_CAST, p, "bad cast");
        };

        // Act & Assert
        assertThatThrownBy(() -> memo.apply(0, recoverable)).isInstanceOf(ParseFailure.class);
        assertThatThrownBy(() -> memo.apply(0, recoverable)).isInstanceOf(ParseFailure.class);
        assertThat(calls.get()).isEqualTo(1);
        assertThatThrownBy(() -> memo.apply(1, hard))
                .isInstanceOfSatisfying(ParseFailure.class,
                        f -> assertThat(f.code()).isEqualTo(ParseErrorCode.ILLEGAL_CAST));
        assertThatThrownBy(() -> memo.apply(1, hard)).isInstanceOf(ParseFailure.class);
        assertThat(hardCalls.get()).isEqualTo(2);
    }
}
