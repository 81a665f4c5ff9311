package org.ctyped.compiler.frontend.parser;

import org.ctyped.compiler.frontend.lexer.Token;
import org.ctyped.compiler.frontend.parser.ast.NodeKind;
import org.ctyped.compiler.frontend.parser.ast.NodeKind.Production;
import org.ctyped.compiler.frontend.parser.ast.ParseNode;
import org.ctyped.compiler.frontend.types.TypeExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.ctyped.compiler.frontend.lexer.TokenType.*;
import static org.ctyped.compiler.frontend.parser.GrammarSupport.firstOf;
import static org.ctyped.compiler.frontend.parser.GrammarSupport.repeatAtLeastOnce;

/**
 * Statements and blocks. Statements are typed {@code none}, except {@code return expression;}
 * which carries the type of the returned expression.
 */
final class StatementGrammar {

    private final Parser parser;
    private final TokenCursor cursor;

    StatementGrammar(Parser parser) {
        this.parser = parser;
        this.cursor = parser.cursor();
    }

    /**
     * statement: labeled | compound | expression | selection | iteration | jump
     */
    Parsed statement(int pos) {
        NestingGuard guard = parser.guard();
        guard.enter(pos);
        try {
            Parsed inner = firstOf("statement", pos, this::labeledStatement, this::compoundStatement,
                    this::expressionStatement, this::selectionStatement, this::iterationStatement,
                    this::jumpStatement);
            return Parser.wrap(Production.STATEMENT, inner);
        } finally {
            guard.exit();
        }
    }

    /**
     * labeled-statement: IDENTIFIER ':' statement | case constant-expression ':' statement
     * | default ':' statement
     */
    Parsed labeledStatement(int pos) {
        Token t = cursor.token(pos);
        switch (t.type()) {
            case IDENTIFIER -> {
                cursor.expect(pos + 1, COLON);
                Parsed body = statement(pos + 2);
                return new Parsed(ParseNode.of(new NodeKind.LabeledStatement(IDENTIFIER, t.text()),
                        TypeExpression.NONE, body.node()), body.position());
            }
            case CASE -> {
                Parsed value = parser.expressions().constantExpression(pos + 1);
                cursor.expect(value.position(), COLON);
                Parsed body = statement(value.position() + 1);
                return new Parsed(ParseNode.of(new NodeKind.LabeledStatement(CASE, null),
                        TypeExpression.NONE, value.node(), body.node()), body.position());
            }
            case DEFAULT -> {
                cursor.expect(pos + 1, COLON);
                Parsed body = statement(pos + 2);
                return new Parsed(ParseNode.of(new NodeKind.LabeledStatement(DEFAULT, null),
                        TypeExpression.NONE, body.node()), body.position());
            }
            default -> throw ParseFailure.unexpected(pos, "label", t);
        }
    }

    /**
     * compound-statement: '{' [block-item-list] '}'
     */
    Parsed compoundStatement(int pos) {
        cursor.expect(pos, LBRACE);
        if (cursor.check(pos + 1, RBRACE)) {
            return new Parsed(ParseNode.leaf(Production.COMPOUND_STATEMENT, TypeExpression.NONE), pos + 2);
        }
        Parsed items = blockItemList(pos + 1);
        cursor.expect(items.position(), RBRACE);
        return new Parsed(ParseNode.of(Production.COMPOUND_STATEMENT, TypeExpression.NONE, items.node()),
                items.position() + 1);
    }

    Parsed blockItemList(int pos) {
        GrammarSupport.Sequence items = repeatAtLeastOnce(this::blockItem, pos);
        return new Parsed(new ParseNode(Production.BLOCK_ITEM_LIST, items.nodes(), TypeExpression.NONE),
                items.position());
    }

    /**
     * block-item: declaration | statement
     */
    Parsed blockItem(int pos) {
        Parsed inner = firstOf("block item", pos, parser.declarations()::declaration, this::statement);
        return Parser.wrap(Production.BLOCK_ITEM, inner);
    }

    /**
     * expression-statement: [expression] ';'
     */
    Parsed expressionStatement(int pos) {
        if (cursor.check(pos, SEMICOLON)) {
            return new Parsed(ParseNode.leaf(Production.EXPRESSION_STATEMENT, TypeExpression.NONE), pos + 1);
        }
        Parsed expression = parser.expressions().expression(pos);
        cursor.expect(expression.position(), SEMICOLON);
        return new Parsed(ParseNode.of(Production.EXPRESSION_STATEMENT, TypeExpression.NONE, expression.node()),
                expression.position() + 1);
    }

    /**
     * selection-statement: if '(' expression ')' statement [else statement]
     * | switch '(' expression ')' statement
     */
    Parsed selectionStatement(int pos) {
        Token keyword = cursor.token(pos);
        if (keyword.type() != IF && keyword.type() != SWITCH) {
            throw ParseFailure.unexpected(pos, "'if' or 'switch'", keyword);
        }
        Parsed condition = parenthesizedExpression(pos + 1);
        Parsed body = statement(condition.position());
        List<ParseNode> children = new ArrayList<>(List.of(condition.node(), body.node()));
        int p = body.position();
        if (keyword.type() == IF && cursor.check(p, ELSE)) {
            Parsed otherwise = statement(p + 1);
            children.add(otherwise.node());
            p = otherwise.position();
        }
        return new Parsed(new ParseNode(new NodeKind.SelectionStatement(keyword.type()), children,
                TypeExpression.NONE), p);
    }

    /**
     * iteration-statement: while '(' expression ')' statement
     * | do statement while '(' expression ')' ';'
     * | for '(' ( expression-statement | declaration ) expression-statement [expression] ')' statement
     */
    Parsed iterationStatement(int pos) {
        Token keyword = cursor.token(pos);
        NodeKind kind = new NodeKind.IterationStatement(keyword.type());
        switch (keyword.type()) {
            case WHILE -> {
                Parsed condition = parenthesizedExpression(pos + 1);
                Parsed body = statement(condition.position());
                return new Parsed(ParseNode.of(kind, TypeExpression.NONE, condition.node(), body.node()),
                        body.position());
            }
            case DO -> {
                Parsed body = statement(pos + 1);
                cursor.expect(body.position(), WHILE);
                Parsed condition = parenthesizedExpression(body.position() + 1);
                cursor.expect(condition.position(), SEMICOLON);
                return new Parsed(ParseNode.of(kind, TypeExpression.NONE, body.node(), condition.node()),
                        condition.position() + 1);
            }
            case FOR -> {
                return forStatement(pos, kind);
            }
            default -> throw ParseFailure.unexpected(pos, "'while', 'do' or 'for'", keyword);
        }
    }

    private Parsed forStatement(int pos, NodeKind kind) {
        cursor.expect(pos + 1, LPAREN);
        Parsed init = firstOf("for initializer", pos + 2,
                this::expressionStatement, parser.declarations()::declaration);
        Parsed condition = expressionStatement(init.position());
        List<ParseNode> children = new ArrayList<>(List.of(init.node(), condition.node()));
        int p = condition.position();
        if (!cursor.check(p, RPAREN)) {
            Parsed step = parser.expressions().expression(p);
            children.add(step.node());
            p = step.position();
        }
        cursor.expect(p, RPAREN);
        Parsed body = statement(p + 1);
        children.add(body.node());
        return new Parsed(new ParseNode(kind, children, TypeExpression.NONE), body.position());
    }

    /**
     * jump-statement: goto IDENTIFIER ';' | continue ';' | break ';' | return [expression] ';'
     */
    Parsed jumpStatement(int pos) {
        Token keyword = cursor.token(pos);
        switch (keyword.type()) {
            case GOTO -> {
                Token label = cursor.expect(pos + 1, IDENTIFIER);
                cursor.expect(pos + 2, SEMICOLON);
                return new Parsed(ParseNode.leaf(new NodeKind.JumpStatement(GOTO, label.text()), TypeExpression.NONE),
                        pos + 3);
            }
            case CONTINUE, BREAK -> {
                cursor.expect(pos + 1, SEMICOLON);
                return new Parsed(ParseNode.leaf(new NodeKind.JumpStatement(keyword.type(), null),
                        TypeExpression.NONE), pos + 2);
            }
            case RETURN -> {
                NodeKind kind = new NodeKind.JumpStatement(RETURN, null);
                Optional<Parsed> value = cursor.check(pos + 1, SEMICOLON)
                        ? Optional.empty()
                        : Optional.of(parser.expressions().expression(pos + 1));
                if (value.isEmpty()) {
                    return new Parsed(ParseNode.leaf(kind, TypeExpression.NONE), pos + 2);
                }
                cursor.expect(value.get().position(), SEMICOLON);
                return new Parsed(ParseNode.of(kind, value.get().type(), value.get().node()),
                        value.get().position() + 1);
            }
            default -> throw ParseFailure.unexpected(pos, "jump statement", keyword);
        }
    }

    private Parsed parenthesizedExpression(int pos) {
        cursor.expect(pos, LPAREN);
        Parsed expression = parser.expressions().expression(pos + 1);
        cursor.expect(expression.position(), RPAREN);
        return new Parsed(expression.node(), expression.position() + 1);
    }
}
