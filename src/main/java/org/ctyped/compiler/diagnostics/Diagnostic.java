package org.ctyped.compiler.diagnostics;

/**
 * A single diagnostic message produced while lexing or parsing.
 *
 * @param type The severity of the diagnostic.
 * @param message The diagnostic message.
 * @param fileName The source label the issue belongs to.
 * @param lineNumber The line number of the issue, or 0 if unknown.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents a parse tree from being produced. */
        ERROR,
        /** A warning that does not prevent parsing. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, fileName, lineNumber, message);
    }
}
