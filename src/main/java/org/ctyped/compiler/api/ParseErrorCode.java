package org.ctyped.compiler.api;

/**
 * Defines unique, testable error codes for every way a parse can fail.
 * This decouples the test logic from the wording of the error messages.
 * <p>
 * Recoverable codes are ordinary control flow while the parser selects between
 * alternatives. All other codes abort the parse as soon as they are raised.
 */
public enum ParseErrorCode {
    // region Syntax errors (recoverable)
    /** A token was requested past the end of the token stream. */
    POSITION_OUT_OF_RANGE(true),
    /** The token at a position did not match the expected token. */
    UNEXPECTED_TOKEN(true),
    /** Every alternative of an ordered choice failed. */
    NO_VIABLE_ALTERNATIVE(true),
    // endregion

    // region Typing errors
    /** The type oracle rejected the operand types of a binary operator. */
    ILLEGAL_TYPE_COMBINATION(false),
    /** The type oracle rejected a cast. */
    ILLEGAL_CAST(false),
    /** No implicit conversion exists from the right-hand side to the assigned or initialized type. */
    ILLEGAL_ASSIGNMENT(false),
    /** The condition of a ternary is not integral, or its two branches have different types. */
    CONDITIONAL_TYPE_MISMATCH(false),
    /** An enumerator was assigned a non-integral constant expression. */
    ILLEGAL_ENUMERATOR_VALUE(false),
    // endregion

    // region Policy errors
    /** The input uses a construct this front end rejects on purpose (typedefs, some array declarators). */
    UNSUPPORTED_FEATURE(false),
    /** The input nests deeper than the configured maximum. */
    NESTING_TOO_DEEP(false),
    /** The translation unit ended before all tokens were consumed. */
    INCOMPLETE_PARSE(false),
    /** The lexer reported errors, so no parse was attempted. */
    LEXICAL_ERROR(false);
    // endregion

    private final boolean recoverable;

    ParseErrorCode(boolean recoverable) {
        this.recoverable = recoverable;
    }

    /**
     * @return {@code true} if a failure with this code may be discarded in favour of another alternative.
     */
    public boolean isRecoverable() {
        return recoverable;
    }
}
