package org.ctyped.compiler.frontend.parser;

import org.ctyped.compiler.api.ParseErrorCode;
import org.ctyped.compiler.frontend.lexer.Token;
import org.ctyped.compiler.frontend.lexer.TokenType;

/**
 * A failed grammar rule.
 * <p>
 * Rules signal failure by throwing; ordered choice and repetition catch recoverable failures
 * and try the next alternative at the original position. Failures are raised constantly while
 * backtracking, so no stack trace is captured.
 */
public final class ParseFailure extends RuntimeException {

    private final ParseErrorCode code;
    private final int position;

    public ParseFailure(ParseErrorCode code, int position, String message) {
        this(code, position, message, null);
    }

    public ParseFailure(ParseErrorCode code, int position, String message, ParseFailure cause) {
        super(message, cause, false, false);
        this.code = code;
        this.position = position;
    }

    static ParseFailure outOfRange(int position, int size) {
        return new ParseFailure(ParseErrorCode.POSITION_OUT_OF_RANGE, position,
                "Position " + position + " is out of range, the token stream has " + size + " tokens");
    }

    static ParseFailure unexpected(int position, TokenType expected, Token found) {
        return new ParseFailure(ParseErrorCode.UNEXPECTED_TOKEN, position,
                "Expected " + expected.display() + " but found '" + found.text() + "' at token " + position
                        + " (line " + found.line() + ")");
    }

    static ParseFailure unexpected(int position, String expected, Token found) {
        return new ParseFailure(ParseErrorCode.UNEXPECTED_TOKEN, position,
                "Expected " + expected + " but found '" + found.text() + "' at token " + position
                        + " (line " + found.line() + ")");
    }

    static ParseFailure noViableAlternative(String production, int position, ParseFailure last) {
        String detail = last == null ? "" : ": " + last.getMessage();
        int at = last == null ? position : last.position();
        return new ParseFailure(ParseErrorCode.NO_VIABLE_ALTERNATIVE, at,
                "Can not parse " + production + detail, last);
    }

    public ParseErrorCode code() {
        return code;
    }

    /**
     * @return The index of the token where the failure was detected.
     */
    public int position() {
        return position;
    }

    /**
     * @return {@code true} if another alternative may still be tried after this failure.
     */
    public boolean isRecoverable() {
        return code.isRecoverable();
    }
}
