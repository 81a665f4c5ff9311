package org.ctyped.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public front-end API and free of implementation details.
 *
 * @param fileName The source label the tokens came from.
 * @param lineNumber The line number, or 0 if unknown.
 * @param columnNumber The column number, or 0 if unknown.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
