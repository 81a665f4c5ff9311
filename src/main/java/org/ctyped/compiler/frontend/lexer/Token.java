package org.ctyped.compiler.frontend.lexer;

/**
 * A single token of a preprocessed C translation unit.
 *
 * @param type The kind of the token.
 * @param text The exact text of the token from the source code.
 * @param value The processed value: a {@link Long} for integer and character constants,
 *              a {@link Double} for floating constants, a {@link StringLiteralValue} for
 *              string literals, otherwise {@code null}.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The source label the token originates from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {

    /**
     * Creates a token without position information, mainly for token streams built by hand.
     *
     * @param type The kind of the token.
     * @param text The token text.
     * @param value The processed value, or {@code null}.
     * @return A new token located at line 0, column 0 of {@code <memory>}.
     */
    public static Token of(TokenType type, String text, Object value) {
        return new Token(type, text, value, 0, 0, "<memory>");
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + column;
    }
}
