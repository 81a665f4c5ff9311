package org.ctyped.compiler.api;

import org.ctyped.compiler.frontend.lexer.Token;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface of the C front end.
 */
public interface IFrontEnd {

    /**
     * Parses a finished token stream into a fully typed parse tree.
     *
     * @param tokens The tokens of one translation unit, in source order.
     * @param sourceLabel A label for the source, used in diagnostics.
     * @return The typed {@link ParseTree}.
     * @throws ParseException if the tokens do not form a well-typed translation unit.
     */
    ParseTree parse(List<Token> tokens, String sourceLabel) throws ParseException;

    /**
     * Tokenizes and parses source text.
     *
     * @param source The C source text, already preprocessed.
     * @param sourceLabel A label for the source, used in diagnostics.
     * @return The typed {@link ParseTree}.
     * @throws ParseException if lexing or parsing fails.
     */
    ParseTree parseSource(String source, String sourceLabel) throws ParseException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=ERROR up to 4=TRACE).
     */
    void setVerbosity(int level);

    /**
     * Parses the source code from a file.
     * @param sourcePath The path to the preprocessed C file.
     * @return The typed {@link ParseTree}.
     * @throws ParseException if lexing or parsing fails.
     * @throws IOException if the file cannot be read.
     */
    default ParseTree parseFile(Path sourcePath) throws ParseException, IOException {
        return parseSource(Files.readString(sourcePath), sourcePath.toString());
    }
}
