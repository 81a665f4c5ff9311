package org.ctyped.compiler.frontend.parser;

import org.ctyped.compiler.api.ParseErrorCode;
import org.ctyped.compiler.config.ParserOptions;
import org.ctyped.compiler.diagnostics.CompilerLogger;
import org.ctyped.compiler.frontend.lexer.Token;
import org.ctyped.compiler.frontend.parser.ast.NodeKind.Production;
import org.ctyped.compiler.frontend.parser.ast.ParseNode;
import org.ctyped.compiler.frontend.semantics.TypeOracle;
import org.ctyped.compiler.frontend.types.BaseType;
import org.ctyped.compiler.frontend.types.TypeExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.ctyped.compiler.frontend.parser.GrammarSupport.firstOf;
import static org.ctyped.compiler.frontend.parser.GrammarSupport.repeat;
import static org.ctyped.compiler.frontend.parser.GrammarSupport.repeatAtLeastOnce;

/**
 * The recursive-descent parser for a C11 translation unit. It consumes the tokens produced by
 * the {@link org.ctyped.compiler.frontend.lexer.Lexer} and builds a parse tree in which every
 * node carries its C type.
 * <p>
 * The grammar is split over {@link ExpressionGrammar}, {@link DeclarationGrammar} and
 * {@link StatementGrammar}; this class wires them together and owns the top-level rules.
 * A parser instance is bound to one token stream and is not thread-safe.
 */
public class Parser {

    private final TokenCursor cursor;
    private final TypeOracle oracle;
    private final ParserOptions options;
    private final NestingGuard guard;
    private final ExpressionGrammar expressions;
    private final DeclarationGrammar declarations;
    private final StatementGrammar statements;

    /**
     * Constructs a new Parser.
     * @param tokens The tokens of one translation unit.
     * @param oracle The typing rules consulted for every typed node.
     * @param options Limits and placeholders.
     */
    public Parser(List<Token> tokens, TypeOracle oracle, ParserOptions options) {
        this.cursor = new TokenCursor(tokens);
        this.oracle = oracle;
        this.options = options;
        this.guard = new NestingGuard(options.maxNestingDepth());
        this.expressions = new ExpressionGrammar(this);
        this.declarations = new DeclarationGrammar(this);
        this.statements = new StatementGrammar(this);
    }

    /**
     * Parses the whole token stream.
     *
     * @return The translation-unit node.
     * @throws ParseFailure if a rule fails or tokens remain after the last external declaration.
     */
    public ParseNode parse() {
        Parsed unit = translationUnit(0);
        if (!cursor.atEnd(unit.position())) {
            Token next = cursor.token(unit.position());
            throw new ParseFailure(ParseErrorCode.INCOMPLETE_PARSE, unit.position(),
                    "Parser did not consume all tokens: stopped at '" + next.text() + "' (token "
                            + unit.position() + " of " + cursor.size() + ", line " + next.line() + ")");
        }
        CompilerLogger.debug("Parsed " + unit.node().children().size() + " external declarations from "
                + cursor.size() + " tokens");
        return unit.node();
    }

    /**
     * translation-unit: external-declaration { external-declaration }
     * <p>
     * An empty token stream yields an empty translation unit.
     */
    Parsed translationUnit(int pos) {
        GrammarSupport.Sequence items = repeat(this::externalDeclaration, pos);
        TypeExpression type = TypeExpression.composite(types(items.nodes()));
        return new Parsed(new ParseNode(Production.TRANSLATION_UNIT, items.nodes(), type), items.position());
    }

    /**
     * external-declaration: function-definition | declaration
     */
    Parsed externalDeclaration(int pos) {
        Parsed inner = firstOf("external declaration", pos, this::functionDefinition, declarations::declaration);
        return wrap(Production.EXTERNAL_DECLARATION, inner);
    }

    /**
     * function-definition: declaration-specifiers declarator [declaration-list] compound-statement
     */
    Parsed functionDefinition(int pos) {
        Parsed specifiers = declarations.declarationSpecifiers(pos);
        Parsed declarator = declarations.declarator(specifiers.position());
        List<ParseNode> children = new ArrayList<>(List.of(specifiers.node(), declarator.node()));
        int p = declarator.position();

        Optional<Parsed> knr = GrammarSupport.optional(this::declarationList, p);
        if (knr.isPresent()) {
            children.add(knr.get().node());
            p = knr.get().position();
        }
        Parsed body = statements.compoundStatement(p);
        children.add(body.node());

        TypeExpression type = new TypeExpression(BaseType.of(BaseType.Tag.FUNCTION), types(children), List.of());
        return new Parsed(new ParseNode(Production.FUNCTION_DEFINITION, children, type), body.position());
    }

    /**
     * declaration-list: declaration { declaration }
     */
    Parsed declarationList(int pos) {
        GrammarSupport.Sequence items = repeatAtLeastOnce(declarations::declaration, pos);
        return new Parsed(new ParseNode(Production.DECLARATION_LIST, items.nodes(),
                TypeExpression.flatten(types(items.nodes()))), items.position());
    }

    /**
     * Wraps a single result in a node of the given production that inherits the child's type.
     */
    static Parsed wrap(Production kind, Parsed inner) {
        return new Parsed(ParseNode.of(kind, inner.type(), inner.node()), inner.position());
    }

    static List<TypeExpression> types(List<ParseNode> nodes) {
        List<TypeExpression> types = new ArrayList<>(nodes.size());
        for (ParseNode n : nodes) {
            types.add(n.type());
        }
        return types;
    }

    TokenCursor cursor() {
        return cursor;
    }

    TypeOracle oracle() {
        return oracle;
    }

    ParserOptions options() {
        return options;
    }

    NestingGuard guard() {
        return guard;
    }

    ExpressionGrammar expressions() {
        return expressions;
    }

    DeclarationGrammar declarations() {
        return declarations;
    }

    StatementGrammar statements() {
        return statements;
    }
}
