package org.ctyped.compiler.frontend.parser;

import org.ctyped.compiler.api.ParseErrorCode;
import org.ctyped.compiler.frontend.lexer.StringLiteralValue;
import org.ctyped.compiler.frontend.lexer.Token;
import org.ctyped.compiler.frontend.lexer.TokenType;
import org.ctyped.compiler.frontend.parser.ast.NodeKind;
import org.ctyped.compiler.frontend.parser.ast.NodeKind.ConstantValue;
import org.ctyped.compiler.frontend.parser.ast.NodeKind.Production;
import org.ctyped.compiler.frontend.parser.ast.ParseNode;
import org.ctyped.compiler.frontend.semantics.Combination;
import org.ctyped.compiler.frontend.types.BaseType.Tag;
import org.ctyped.compiler.frontend.types.TypeExpression;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.ctyped.compiler.frontend.lexer.TokenType.*;
import static org.ctyped.compiler.frontend.parser.GrammarSupport.firstOf;
import static org.ctyped.compiler.frontend.parser.GrammarSupport.separatedList;

/**
 * The expression cascade, from primary expressions up to the comma operator.
 * <p>
 * Each binary level parses one operand of the next tighter level and then folds further
 * operands in from the left, asking the {@link org.ctyped.compiler.frontend.semantics.TypeOracle}
 * for the type of every fold.
 */
final class ExpressionGrammar {

    private static final Set<TokenType> UNARY_OPERATORS = EnumSet.of(AMPERSAND, STAR, PLUS, MINUS, TILDE, BANG);
    private static final Set<TokenType> ASSIGNMENT_OPERATORS = EnumSet.of(ASSIGN, MUL_ASSIGN, DIV_ASSIGN,
            MOD_ASSIGN, ADD_ASSIGN, SUB_ASSIGN, LEFT_ASSIGN, RIGHT_ASSIGN, AND_ASSIGN, XOR_ASSIGN, OR_ASSIGN);
    private static final List<TypeExpression> CONDITION_TYPES = List.of(
            TypeExpression.INT, TypeExpression.of(Tag.BOOL), TypeExpression.LONG,
            TypeExpression.of(Tag.SIGNED), TypeExpression.of(Tag.UNSIGNED), TypeExpression.of(Tag.CHAR));

    private final Parser parser;
    private final TokenCursor cursor;
    private final RuleMemo unaryMemo = new RuleMemo();
    private final RuleMemo castMemo = new RuleMemo();

    ExpressionGrammar(Parser parser) {
        this.parser = parser;
        this.cursor = parser.cursor();
    }

    // region Primary and postfix

    /**
     * primary-expression: IDENTIFIER | constant | string | '(' expression ')' | generic-selection
     */
    Parsed primaryExpression(int pos) {
        Parsed inner = firstOf("primary expression", pos,
                this::identifier, this::constant, this::string, this::parenthesized, this::genericSelection);
        return Parser.wrap(Production.PRIMARY_EXPRESSION, inner);
    }

    Parsed identifier(int pos) {
        Token t = cursor.expect(pos, IDENTIFIER);
        return new Parsed(ParseNode.leaf(new NodeKind.Identifier(t.text()), TypeExpression.identifier(t.text())),
                pos + 1);
    }

    /**
     * constant: I_CONSTANT | F_CONSTANT | ENUMERATION_CONSTANT
     * <p>
     * Integer constants are typed {@code long} so that later stages narrow them with explicit casts.
     */
    Parsed constant(int pos) {
        Token t = cursor.token(pos);
        return switch (t.type()) {
            case I_CONSTANT -> new Parsed(ParseNode.leaf(
                    new NodeKind.Constant(new ConstantValue.Int64(integerValue(t))), TypeExpression.LONG), pos + 1);
            case F_CONSTANT -> new Parsed(ParseNode.leaf(
                    new NodeKind.Constant(new ConstantValue.Float64(floatingValue(t))), TypeExpression.DOUBLE), pos + 1);
            case ENUMERATION_CONSTANT -> new Parsed(ParseNode.leaf(
                    new NodeKind.Constant(new ConstantValue.Enumerator(t.text())), TypeExpression.LONG), pos + 1);
            default -> throw ParseFailure.unexpected(pos, "constant", t);
        };
    }

    private static long integerValue(Token t) {
        return t.value() instanceof Number n ? n.longValue() : Long.decode(t.text());
    }

    private static double floatingValue(Token t) {
        return t.value() instanceof Number n ? n.doubleValue() : Double.parseDouble(t.text());
    }

    /**
     * string: STRING_LITERAL | __func__
     */
    Parsed string(int pos) {
        Token t = cursor.token(pos);
        StringLiteralValue value;
        if (t.type() == STRING_LITERAL) {
            value = t.value() instanceof StringLiteralValue v ? v : StringLiteralValue.plain(t.text());
        } else if (t.type() == FUNC_NAME) {
            value = StringLiteralValue.plain(parser.options().funcNamePlaceholder());
        } else {
            throw ParseFailure.unexpected(pos, "string literal", t);
        }
        TypeExpression type = TypeExpression.arrayOf(value.text().length(), TypeExpression.of(Tag.CHAR));
        return new Parsed(ParseNode.leaf(new NodeKind.StringLiteral(value), type), pos + 1);
    }

    private Parsed parenthesized(int pos) {
        cursor.expect(pos, LPAREN);
        Parsed inner = expression(pos + 1);
        cursor.expect(inner.position(), RPAREN);
        return new Parsed(inner.node(), inner.position() + 1);
    }

    /**
     * generic-selection: _Generic '(' assignment-expression ',' generic-assoc-list ')'
     */
    Parsed genericSelection(int pos) {
        cursor.expect(pos, GENERIC);
        cursor.expect(pos + 1, LPAREN);
        Parsed controlling = assignmentExpression(pos + 2);
        cursor.expect(controlling.position(), COMMA);
        GrammarSupport.Sequence associations =
                separatedList(this::genericAssociation, COMMA, cursor, controlling.position() + 1);
        cursor.expect(associations.position(), RPAREN);
        ParseNode list = new ParseNode(Production.GENERIC_ASSOC_LIST, associations.nodes(),
                TypeExpression.flatten(Parser.types(associations.nodes())));
        return new Parsed(ParseNode.of(Production.GENERIC_SELECTION, controlling.type(), controlling.node(), list),
                associations.position() + 1);
    }

    /**
     * generic-association: type-name ':' assignment-expression | default ':' assignment-expression
     */
    Parsed genericAssociation(int pos) {
        List<ParseNode> children = new ArrayList<>(2);
        int p;
        if (cursor.check(pos, DEFAULT)) {
            p = pos + 1;
        } else {
            Parsed typeName = parser.declarations().typeName(pos);
            children.add(typeName.node());
            p = typeName.position();
        }
        cursor.expect(p, COLON);
        Parsed value = assignmentExpression(p + 1);
        children.add(value.node());
        return new Parsed(new ParseNode(Production.GENERIC_ASSOCIATION, children, value.type()), value.position());
    }

    /**
     * postfix-expression: ( primary-expression | compound-literal ) { postfix-suffix }
     */
    Parsed postfixExpression(int pos) {
        Parsed base = firstOf("postfix expression", pos, this::primaryExpression, this::compoundLiteral);
        List<ParseNode> children = new ArrayList<>();
        children.add(base.node());
        TypeExpression type = base.type();
        int p = base.position();
        while (true) {
            Optional<Parsed> suffix = postfixSuffix(p, type);
            if (suffix.isEmpty()) {
                break;
            }
            children.add(suffix.get().node());
            type = suffix.get().type();
            p = suffix.get().position();
        }
        return new Parsed(new ParseNode(Production.POSTFIX_EXPRESSION, children, type), p);
    }

    /**
     * One of {@code '[' expression ']'}, {@code '(' [argument-expression-list] ')'},
     * {@code '.' IDENTIFIER}, {@code '->' IDENTIFIER}, {@code '++'} or {@code '--'}.
     *
     * @param operandType The type of everything to the left of the suffix.
     * @return The suffix node typed with the result of applying it, or empty if no suffix follows.
     */
    private Optional<Parsed> postfixSuffix(int pos, TypeExpression operandType) {
        return GrammarSupport.optional(p -> {
            Token t = cursor.token(p);
            NodeKind kind = new NodeKind.PostfixOperator(t.type());
            switch (t.type()) {
                case LBRACKET -> {
                    Parsed index = expression(p + 1);
                    cursor.expect(index.position(), RBRACKET);
                    TypeExpression element = subscriptType(operandType, index.type(), p);
                    return new Parsed(ParseNode.of(kind, element, index.node()), index.position() + 1);
                }
                case LPAREN -> {
                    TypeExpression result = operandType.is(Tag.FUNCTION)
                            ? operandType.element().orElse(operandType)
                            : operandType;
                    if (cursor.check(p + 1, RPAREN)) {
                        return new Parsed(ParseNode.leaf(kind, result), p + 2);
                    }
                    Parsed arguments = argumentExpressionList(p + 1);
                    cursor.expect(arguments.position(), RPAREN);
                    return new Parsed(ParseNode.of(kind, result, arguments.node()), arguments.position() + 1);
                }
                case DOT, PTR_OP -> {
                    Parsed member = identifier(p + 1);
                    return new Parsed(ParseNode.of(kind, member.type(), member.node()), member.position());
                }
                case INC_OP, DEC_OP -> {
                    return new Parsed(ParseNode.leaf(kind, operandType), p + 1);
                }
                default -> throw ParseFailure.unexpected(p, "postfix operator", t);
            }
        }, pos);
    }

    private TypeExpression subscriptType(TypeExpression base, TypeExpression index, int pos) {
        if (isIndexable(base)) {
            return base.element().orElse(TypeExpression.of(Tag.VOID));
        }
        if (isIndexable(index)) {
            return index.element().orElse(TypeExpression.of(Tag.VOID));
        }
        if (base.is(Tag.IDENTIFIER) || index.is(Tag.IDENTIFIER)) {
            return base.is(Tag.IDENTIFIER) ? base : index;
        }
        throw new ParseFailure(ParseErrorCode.ILLEGAL_TYPE_COMBINATION, pos,
                "Can not subscript " + base + " with " + index + " at token " + pos);
    }

    private static boolean isIndexable(TypeExpression t) {
        return t.is(Tag.POINTER) || t.is(Tag.ARRAY);
    }

    /**
     * compound-literal: '(' type-name ')' '{' initializer-list [','] '}'
     */
    Parsed compoundLiteral(int pos) {
        cursor.expect(pos, LPAREN);
        Parsed typeName = parser.declarations().typeName(pos + 1);
        cursor.expect(typeName.position(), RPAREN);
        cursor.expect(typeName.position() + 1, LBRACE);
        Parsed initializers = parser.declarations().initializerList(typeName.position() + 2);
        int p = initializers.position();
        if (cursor.check(p, COMMA)) {
            p++;
        }
        cursor.expect(p, RBRACE);
        return new Parsed(ParseNode.of(Production.COMPOUND_LITERAL, typeName.type(),
                typeName.node(), initializers.node()), p + 1);
    }

    /**
     * argument-expression-list: assignment-expression { ',' assignment-expression }
     */
    Parsed argumentExpressionList(int pos) {
        GrammarSupport.Sequence items = separatedList(this::assignmentExpression, COMMA, cursor, pos);
        return new Parsed(new ParseNode(Production.ARGUMENT_EXPRESSION_LIST, items.nodes(),
                TypeExpression.flatten(Parser.types(items.nodes()))), items.position());
    }

    // endregion

    // region Unary and cast

    /**
     * unary-expression: postfix-expression | ('++' | '--') unary-expression
     * | unary-operator cast-expression | sizeof unary-expression | sizeof '(' type-name ')'
     * | _Alignof '(' type-name ')'
     * <p>
     * Assignment first tries a unary expression and falls back to the conditional cascade at the
     * same position, so results are memoized per position.
     */
    Parsed unaryExpression(int pos) {
        return unaryMemo.apply(pos, this::unaryExpressionAt);
    }

    private Parsed unaryExpressionAt(int pos) {
        Parsed inner = firstOf("unary expression", pos,
                this::postfixExpression, this::prefixIncrement, this::unaryOperation,
                this::sizeofTypeName, this::sizeofExpression, this::alignofTypeName);
        return Parser.wrap(Production.UNARY_EXPRESSION, inner);
    }

    private Parsed prefixIncrement(int pos) {
        Token t = cursor.token(pos);
        if (t.type() != INC_OP && t.type() != DEC_OP) {
            throw ParseFailure.unexpected(pos, "'++' or '--'", t);
        }
        Parsed operand = unaryExpression(pos + 1);
        return new Parsed(ParseNode.of(new NodeKind.UnaryOperator(t.type()), operand.type(), operand.node()),
                operand.position());
    }

    private Parsed unaryOperation(int pos) {
        Token t = cursor.token(pos);
        if (!UNARY_OPERATORS.contains(t.type())) {
            throw ParseFailure.unexpected(pos, "unary operator", t);
        }
        Parsed operand = castExpression(pos + 1);
        TypeExpression type = switch (t.type()) {
            case AMPERSAND -> TypeExpression.pointerTo(operand.type());
            // The pointee is not resolved; a dereferenced value needs an explicit cast before use.
            case STAR -> TypeExpression.pointerTo(TypeExpression.of(Tag.VOID_POINTER));
            default -> operand.type();
        };
        return new Parsed(ParseNode.of(new NodeKind.UnaryOperator(t.type()), type, operand.node()),
                operand.position());
    }

    private Parsed sizeofTypeName(int pos) {
        return parenthesizedTypeOperator(pos, SIZEOF);
    }

    private Parsed alignofTypeName(int pos) {
        return parenthesizedTypeOperator(pos, ALIGNOF);
    }

    private Parsed parenthesizedTypeOperator(int pos, TokenType keyword) {
        cursor.expect(pos, keyword);
        cursor.expect(pos + 1, LPAREN);
        Parsed typeName = parser.declarations().typeName(pos + 2);
        cursor.expect(typeName.position(), RPAREN);
        return new Parsed(ParseNode.of(new NodeKind.UnaryOperator(keyword), TypeExpression.SIZE_T, typeName.node()),
                typeName.position() + 1);
    }

    private Parsed sizeofExpression(int pos) {
        cursor.expect(pos, SIZEOF);
        Parsed operand = unaryExpression(pos + 1);
        return new Parsed(ParseNode.of(new NodeKind.UnaryOperator(SIZEOF), TypeExpression.SIZE_T, operand.node()),
                operand.position());
    }

    /**
     * cast-expression: unary-expression | '(' type-name ')' cast-expression
     */
    Parsed castExpression(int pos) {
        return castMemo.apply(pos, this::castExpressionAt);
    }

    private Parsed castExpressionAt(int pos) {
        NestingGuard guard = parser.guard();
        guard.enter(pos);
        try {
            return firstOf("cast expression", pos,
                    p -> Parser.wrap(Production.CAST_EXPRESSION, unaryExpression(p)),
                    this::explicitCast);
        } finally {
            guard.exit();
        }
    }

    private Parsed explicitCast(int pos) {
        cursor.expect(pos, LPAREN);
        Parsed typeName = parser.declarations().typeName(pos + 1);
        cursor.expect(typeName.position(), RPAREN);
        Parsed operand = castExpression(typeName.position() + 1);
        if (!parser.oracle().castIsLegal(typeName.type(), operand.type())) {
            throw new ParseFailure(ParseErrorCode.ILLEGAL_CAST, pos,
                    "Can not cast " + operand.type() + " to " + typeName.type() + " at token " + pos);
        }
        return new Parsed(ParseNode.of(Production.CAST_EXPRESSION, typeName.type(), typeName.node(), operand.node()),
                operand.position());
    }

    // endregion

    // region Binary cascade

    Parsed multiplicativeExpression(int pos) {
        return binaryLevel(Production.MULTIPLICATIVE_EXPRESSION, this::castExpression, pos, STAR, SLASH, PERCENT);
    }

    Parsed additiveExpression(int pos) {
        return binaryLevel(Production.ADDITIVE_EXPRESSION, this::multiplicativeExpression, pos, PLUS, MINUS);
    }

    Parsed shiftExpression(int pos) {
        return binaryLevel(Production.SHIFT_EXPRESSION, this::additiveExpression, pos, LEFT_OP, RIGHT_OP);
    }

    Parsed relationalExpression(int pos) {
        return binaryLevel(Production.RELATIONAL_EXPRESSION, this::shiftExpression, pos, LESS, GREATER, LE_OP, GE_OP);
    }

    Parsed equalityExpression(int pos) {
        return binaryLevel(Production.EQUALITY_EXPRESSION, this::relationalExpression, pos, EQ_OP, NE_OP);
    }

    Parsed andExpression(int pos) {
        return binaryLevel(Production.AND_EXPRESSION, this::equalityExpression, pos, AMPERSAND);
    }

    Parsed exclusiveOrExpression(int pos) {
        return binaryLevel(Production.EXCLUSIVE_OR_EXPRESSION, this::andExpression, pos, CARET);
    }

    Parsed inclusiveOrExpression(int pos) {
        return binaryLevel(Production.INCLUSIVE_OR_EXPRESSION, this::exclusiveOrExpression, pos, PIPE);
    }

    Parsed logicalAndExpression(int pos) {
        return binaryLevel(Production.LOGICAL_AND_EXPRESSION, this::inclusiveOrExpression, pos, AND_OP);
    }

    Parsed logicalOrExpression(int pos) {
        return binaryLevel(Production.LOGICAL_OR_EXPRESSION, this::logicalAndExpression, pos, OR_OP);
    }

    /**
     * level: operand { op operand }, folded to the left.
     * <p>
     * Without an operator the level node simply takes the operand's type; every fold is typed by
     * the oracle and a rejected combination fails the whole expression.
     */
    private Parsed binaryLevel(Production level, GrammarSupport.Rule operand, int pos, TokenType... operators) {
        Parsed first = operand.apply(pos);
        ParseNode accumulated = first.node();
        int p = first.position();
        while (isOneOf(p, operators)) {
            TokenType operator = cursor.token(p).type();
            Parsed right = operand.apply(p + 1);
            Combination combination = parser.oracle().combineTypes(accumulated.type(), right.type(), operator);
            if (!combination.accepted()) {
                throw new ParseFailure(ParseErrorCode.ILLEGAL_TYPE_COMBINATION, p,
                        "Can not apply '" + operator.spelling() + "' to " + accumulated.type() + " and "
                                + right.type() + " at token " + p);
            }
            accumulated = ParseNode.of(new NodeKind.BinaryExpression(operator), combination.result(),
                    accumulated, right.node());
            p = right.position();
        }
        return new Parsed(ParseNode.of(level, accumulated.type(), accumulated), p);
    }

    private boolean isOneOf(int pos, TokenType... types) {
        Optional<Token> t = cursor.peek(pos);
        if (t.isEmpty()) {
            return false;
        }
        for (TokenType type : types) {
            if (t.get().type() == type) {
                return true;
            }
        }
        return false;
    }

    // endregion

    // region Conditional, assignment, comma

    /**
     * conditional-expression: logical-or-expression ['?' expression ':' conditional-expression]
     */
    Parsed conditionalExpression(int pos) {
        Parsed condition = logicalOrExpression(pos);
        if (!cursor.check(condition.position(), QUESTION)) {
            return Parser.wrap(Production.CONDITIONAL_EXPRESSION, condition);
        }
        int questionAt = condition.position();
        if (CONDITION_TYPES.stream().noneMatch(t -> parser.oracle().typesEqual(condition.type(), t))) {
            throw new ParseFailure(ParseErrorCode.CONDITIONAL_TYPE_MISMATCH, questionAt,
                    "Condition of type " + condition.type() + " is not an integer at token " + questionAt);
        }
        Parsed whenTrue = expression(questionAt + 1);
        cursor.expect(whenTrue.position(), COLON);
        Parsed whenFalse = conditionalExpression(whenTrue.position() + 1);
        if (!parser.oracle().typesEqual(whenTrue.type(), whenFalse.type())) {
            throw new ParseFailure(ParseErrorCode.CONDITIONAL_TYPE_MISMATCH, whenTrue.position(),
                    "Branches of '?:' have different types " + whenTrue.type() + " and " + whenFalse.type()
                            + " at token " + questionAt);
        }
        return new Parsed(ParseNode.of(Production.CONDITIONAL_EXPRESSION, whenFalse.type(),
                condition.node(), whenTrue.node(), whenFalse.node()), whenFalse.position());
    }

    /**
     * assignment-expression: unary-expression assignment-operator assignment-expression
     * | conditional-expression
     */
    Parsed assignmentExpression(int pos) {
        return firstOf("assignment expression", pos, this::assignment,
                p -> Parser.wrap(Production.ASSIGNMENT_EXPRESSION, conditionalExpression(p)));
    }

    private Parsed assignment(int pos) {
        Parsed target = unaryExpression(pos);
        Token operator = cursor.token(target.position());
        if (!ASSIGNMENT_OPERATORS.contains(operator.type())) {
            throw ParseFailure.unexpected(target.position(), "assignment operator", operator);
        }
        Parsed value = assignmentExpression(target.position() + 1);
        TypeExpression type = parser.oracle().resolveImplicitConversion(target.type(), value.type())
                .orElseThrow(() -> new ParseFailure(ParseErrorCode.ILLEGAL_ASSIGNMENT, target.position(),
                        "Can not assign " + value.type() + " to " + target.type() + " at token " + target.position()));
        ParseNode operatorNode = ParseNode.leaf(new NodeKind.AssignmentOperator(operator.type()), type);
        return new Parsed(ParseNode.of(Production.ASSIGNMENT_EXPRESSION, type,
                target.node(), operatorNode, value.node()), value.position());
    }

    /**
     * expression: assignment-expression { ',' assignment-expression }
     * <p>
     * A comma expression has the type of its last operand.
     */
    Parsed expression(int pos) {
        NestingGuard guard = parser.guard();
        guard.enter(pos);
        try {
            GrammarSupport.Sequence items = separatedList(this::assignmentExpression, COMMA, cursor, pos);
            TypeExpression type = items.nodes().get(items.nodes().size() - 1).type();
            return new Parsed(new ParseNode(Production.EXPRESSION, items.nodes(), type), items.position());
        } finally {
            guard.exit();
        }
    }

    /**
     * constant-expression: conditional-expression
     */
    Parsed constantExpression(int pos) {
        return Parser.wrap(Production.CONSTANT_EXPRESSION, conditionalExpression(pos));
    }

    // endregion
}
