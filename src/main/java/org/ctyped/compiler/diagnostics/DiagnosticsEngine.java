package org.ctyped.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects diagnostics reported by the lexer and the front end.
 * <p>
 * The grammar itself never reports here; failures travel as exceptions and are
 * recorded once, by the caller that gives up on the parse.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message    The error message.
     * @param fileName   The source label in which the error occurred.
     * @param lineNumber The line number of the error.
     */
    public void reportError(String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, fileName, lineNumber));
    }

    /**
     * Reports a warning.
     *
     * @param message    The warning message.
     * @param fileName   The source label in which the warning occurred.
     * @param lineNumber The line number of the warning.
     */
    public void reportWarning(String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, fileName, lineNumber));
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable view of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Discards all collected diagnostics so the engine can be reused for the next source.
     */
    public void clear() {
        diagnostics.clear();
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return One diagnostic per line.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
