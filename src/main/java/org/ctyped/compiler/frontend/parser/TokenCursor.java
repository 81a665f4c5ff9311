package org.ctyped.compiler.frontend.parser;

import org.ctyped.compiler.frontend.lexer.Token;
import org.ctyped.compiler.frontend.lexer.TokenType;

import java.util.List;
import java.util.Optional;

/**
 * Read-only, position-indexed access to a token stream.
 * <p>
 * The cursor holds no position of its own. Every query takes the position as an argument and
 * none of them advance it; callers step past a token by using {@code pos + 1} once they commit
 * to building a node.
 */
public final class TokenCursor {

    private final List<Token> tokens;

    public TokenCursor(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    public int size() {
        return tokens.size();
    }

    public boolean atEnd(int pos) {
        return pos >= tokens.size();
    }

    /**
     * @param pos A token index.
     * @throws ParseFailure with {@code POSITION_OUT_OF_RANGE} if {@code pos} is past the end.
     */
    public void checkPosition(int pos) {
        if (pos < 0 || atEnd(pos)) {
            throw ParseFailure.outOfRange(pos, tokens.size());
        }
    }

    /**
     * @param pos A token index.
     * @return The token at {@code pos}.
     * @throws ParseFailure with {@code POSITION_OUT_OF_RANGE} if {@code pos} is past the end.
     */
    public Token token(int pos) {
        checkPosition(pos);
        return tokens.get(pos);
    }

    /**
     * Checks that the token at {@code pos} has the expected type.
     *
     * @param pos A token index.
     * @param expected The required token type.
     * @return The matching token. The caller advances past it.
     * @throws ParseFailure if {@code pos} is out of range or the token does not match.
     */
    public Token expect(int pos, TokenType expected) {
        Token t = token(pos);
        if (t.type() != expected) {
            throw ParseFailure.unexpected(pos, expected, t);
        }
        return t;
    }

    /**
     * @return {@code true} if there is a token at {@code pos} and it has the given type.
     */
    public boolean check(int pos, TokenType type) {
        return !atEnd(pos) && pos >= 0 && tokens.get(pos).type() == type;
    }

    public Optional<Token> peek(int pos) {
        return atEnd(pos) || pos < 0 ? Optional.empty() : Optional.of(tokens.get(pos));
    }
}
