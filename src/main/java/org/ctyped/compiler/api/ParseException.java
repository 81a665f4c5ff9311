package org.ctyped.compiler.api;

/**
 * An exception that is thrown when a translation unit cannot be parsed.
 * <p>
 * It is part of the public API and hides the internal failure types of the parser.
 */
public class ParseException extends Exception {

    private final ParseErrorCode code;
    private final SourceInfo sourceInfo;
    private final int position;

    /**
     * Constructs a new parse exception located in the source text.
     * @param code The error code of the failure that aborted the parse.
     * @param sourceInfo The label, line and column of the failing token.
     * @param position The token index where the failure was detected, or -1 if not token related.
     * @param message The detail message.
     * @param cause The internal failure, or {@code null}.
     */
    public ParseException(ParseErrorCode code, SourceInfo sourceInfo, int position, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.sourceInfo = sourceInfo;
        this.position = position;
    }

    public ParseErrorCode code() {
        return code;
    }

    public String sourceLabel() {
        return sourceInfo.fileName();
    }

    /**
     * @return Where the failure was detected. Line and column are 0 when no token can be blamed.
     */
    public SourceInfo sourceInfo() {
        return sourceInfo;
    }

    public int position() {
        return position;
    }
}
