package org.ctyped.compiler;

import org.ctyped.compiler.api.IFrontEnd;
import org.ctyped.compiler.api.ParseErrorCode;
import org.ctyped.compiler.api.ParseException;
import org.ctyped.compiler.api.ParseTree;
import org.ctyped.compiler.api.SourceInfo;
import org.ctyped.compiler.config.ConfigLoader;
import org.ctyped.compiler.config.ParserOptions;
import org.ctyped.compiler.diagnostics.CompilerLogger;
import org.ctyped.compiler.diagnostics.Diagnostic;
import org.ctyped.compiler.diagnostics.DiagnosticsEngine;
import org.ctyped.compiler.frontend.lexer.Lexer;
import org.ctyped.compiler.frontend.lexer.Token;
import org.ctyped.compiler.frontend.parser.ParseFailure;
import org.ctyped.compiler.frontend.parser.Parser;
import org.ctyped.compiler.frontend.parser.ast.ParseNode;
import org.ctyped.compiler.frontend.semantics.CTypeOracle;
import org.ctyped.compiler.frontend.semantics.TypeOracle;
import org.ctyped.compiler.util.TreePrinter;

import java.util.List;

/**
 * The front-end implementation. It runs the lexer and the parser over one translation unit
 * and turns internal parse failures into {@link ParseException}s. It is not thread-safe.
 */
public class FrontEnd implements IFrontEnd {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final ParserOptions options;
    private final TypeOracle oracle;
    private int verbosity;

    /**
     * Creates a front end configured from {@link ConfigLoader#load()}.
     */
    public FrontEnd() {
        this(ParserOptions.fromConfig(ConfigLoader.load()));
    }

    /**
     * Creates a front end with the standard C typing rules.
     * @param options The parser options.
     */
    public FrontEnd(ParserOptions options) {
        this(options, new CTypeOracle());
    }

    /**
     * Creates a front end with custom typing rules.
     * @param options The parser options.
     * @param oracle The typing rules consulted by the parser.
     */
    public FrontEnd(ParserOptions options, TypeOracle oracle) {
        this.options = options;
        this.oracle = oracle;
        this.verbosity = options.verbosity();
    }

    /**
     * {@inheritDoc}
     * <p>
     * The diagnostics of a previous call are discarded first.
     */
    @Override
    public ParseTree parseSource(String source, String sourceLabel) throws ParseException {
        CompilerLogger.setLevel(verbosity);
        diagnostics.clear();

        Lexer lexer = new Lexer(source, diagnostics, sourceLabel);
        List<Token> tokens = lexer.scanTokens();
        if (diagnostics.hasErrors()) {
            int line = diagnostics.getDiagnostics().stream()
                    .filter(d -> d.type() == Diagnostic.Type.ERROR)
                    .findFirst()
                    .map(Diagnostic::lineNumber)
                    .orElse(0);
            throw new ParseException(ParseErrorCode.LEXICAL_ERROR, new SourceInfo(sourceLabel, line, 0), -1,
                    diagnostics.summary(), null);
        }
        CompilerLogger.debug("FrontEnd: " + sourceLabel + " has " + tokens.size() + " tokens");
        return parseTokens(tokens, sourceLabel);
    }

    @Override
    public ParseTree parse(List<Token> tokens, String sourceLabel) throws ParseException {
        CompilerLogger.setLevel(verbosity);
        diagnostics.clear();
        return parseTokens(tokens, sourceLabel);
    }

    private ParseTree parseTokens(List<Token> tokens, String sourceLabel) throws ParseException {
        Parser parser = new Parser(tokens, oracle, options);
        ParseNode root;
        try {
            root = parser.parse();
        } catch (ParseFailure failure) {
            SourceInfo location = failure.position() >= 0 && failure.position() < tokens.size()
                    ? new SourceInfo(sourceLabel, tokens.get(failure.position()).line(),
                            tokens.get(failure.position()).column())
                    : new SourceInfo(sourceLabel, 0, 0);
            diagnostics.reportError(failure.getMessage(), sourceLabel, location.lineNumber());
            CompilerLogger.error("FrontEnd: " + location + ": " + failure.code() + ": " + failure.getMessage());
            throw new ParseException(failure.code(), location, failure.position(), failure.getMessage(), failure);
        }
        if (CompilerLogger.isTraceEnabled()) {
            CompilerLogger.trace("Typed parse tree of " + sourceLabel + ":\n" + TreePrinter.print(root));
        }
        CompilerLogger.info("FrontEnd: parsed " + sourceLabel + " (" + tokens.size() + " tokens)");
        return new ParseTree(root, sourceLabel, tokens.size());
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    /**
     * @return The diagnostics collected during the last call.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics.getDiagnostics();
    }
}
