package org.ctyped.compiler.frontend.parser;

import org.ctyped.compiler.api.ParseErrorCode;
import org.ctyped.compiler.frontend.lexer.Token;
import org.ctyped.compiler.frontend.lexer.TokenType;
import org.ctyped.compiler.frontend.parser.ast.NodeKind;
import org.ctyped.compiler.frontend.parser.ast.NodeKind.ConstantValue;
import org.ctyped.compiler.frontend.parser.ast.NodeKind.Production;
import org.ctyped.compiler.frontend.parser.ast.ParseNode;
import org.ctyped.compiler.frontend.types.BaseType;
import org.ctyped.compiler.frontend.types.BaseType.Tag;
import org.ctyped.compiler.frontend.types.TypeExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.ctyped.compiler.frontend.lexer.TokenType.*;
import static org.ctyped.compiler.frontend.parser.GrammarSupport.firstOf;
import static org.ctyped.compiler.frontend.parser.GrammarSupport.optional;
import static org.ctyped.compiler.frontend.parser.GrammarSupport.repeatAtLeastOnce;
import static org.ctyped.compiler.frontend.parser.GrammarSupport.separatedList;

/**
 * Declarations: specifiers, declarators, abstract declarators, type names and initializers.
 * <p>
 * Declarator types are built name first. The pointer chain wraps the declared name, then each
 * array or function suffix wraps the result from left to right, so {@code *a[3]} is typed
 * {@code array[3]<pointer<identifier(a)>>}. The specifier type is substituted at the leaf only
 * where a complete object type is needed: type names and initializer checks.
 */
final class DeclarationGrammar {

    private static final List<TypeExpression> ENUMERATOR_VALUE_TYPES = List.of(
            TypeExpression.INT, TypeExpression.of(Tag.BOOL), TypeExpression.LONG,
            TypeExpression.of(Tag.SIGNED), TypeExpression.of(Tag.UNSIGNED));

    private final Parser parser;
    private final TokenCursor cursor;

    DeclarationGrammar(Parser parser) {
        this.parser = parser;
        this.cursor = parser.cursor();
    }

    // region Declarations and specifiers

    /**
     * declaration: declaration-specifiers [init-declarator-list] ';' | static-assert-declaration
     */
    Parsed declaration(int pos) {
        return firstOf("declaration", pos, this::plainDeclaration,
                p -> Parser.wrap(Production.DECLARATION, staticAssertDeclaration(p)));
    }

    private Parsed plainDeclaration(int pos) {
        Parsed specifiers = declarationSpecifiers(pos);
        if (cursor.check(specifiers.position(), SEMICOLON)) {
            return new Parsed(ParseNode.of(Production.DECLARATION,
                    TypeExpression.composite(List.of(specifiers.type())), specifiers.node()),
                    specifiers.position() + 1);
        }
        Parsed declarators = initDeclaratorList(specifiers.position(), specifiers.type());
        cursor.expect(declarators.position(), SEMICOLON);
        TypeExpression type = TypeExpression.composite(List.of(specifiers.type(), declarators.type()));
        return new Parsed(ParseNode.of(Production.DECLARATION, type, specifiers.node(), declarators.node()),
                declarators.position() + 1);
    }

    /**
     * declaration-specifiers: declaration-specifier { declaration-specifier }
     */
    Parsed declarationSpecifiers(int pos) {
        GrammarSupport.Sequence items = repeatAtLeastOnce(this::declarationSpecifier, pos);
        return new Parsed(new ParseNode(Production.DECLARATION_SPECIFIERS, items.nodes(),
                flattenSpecifiers(items.nodes())), items.position());
    }

    private Parsed declarationSpecifier(int pos) {
        return firstOf("declaration specifier", pos, this::storageClassSpecifier, this::typeSpecifier,
                this::typeQualifier, this::functionSpecifier, this::alignmentSpecifier);
    }

    /**
     * Collapses a specifier sequence into one type: the first type specifier is the principal
     * type, every other specifier, qualifier and marker becomes an auxiliary tag.
     */
    static TypeExpression flattenSpecifiers(List<ParseNode> specifiers) {
        TypeExpression principal = null;
        List<BaseType> auxiliary = new ArrayList<>();
        for (ParseNode n : specifiers) {
            if (principal == null && isPrincipalCandidate(n.type())) {
                principal = n.type();
            }
        }
        for (ParseNode n : specifiers) {
            TypeExpression t = n.type();
            if (t == principal || t.is(Tag.NONE)) {
                continue;
            }
            if (principal == null) {
                principal = t;
                continue;
            }
            auxiliary.add(t.primary());
            auxiliary.addAll(t.auxiliary());
        }
        return principal == null ? TypeExpression.NONE : principal.withAuxiliary(auxiliary);
    }

    private static boolean isPrincipalCandidate(TypeExpression t) {
        if (t.is(Tag.NONE)) {
            return false;
        }
        return !t.tag().isQualifierOrMarker() || (t.is(Tag.ATOMIC) && !t.children().isEmpty());
    }

    Parsed storageClassSpecifier(int pos) {
        Token t = cursor.token(pos);
        Tag tag = switch (t.type()) {
            case EXTERN -> Tag.EXTERN;
            case STATIC -> Tag.STATIC;
            case THREAD_LOCAL -> Tag.THREAD_LOCAL;
            case AUTO -> Tag.AUTO;
            case REGISTER -> Tag.REGISTER;
            case TYPEDEF -> throw unsupportedTypedef(pos, t);
            default -> throw ParseFailure.unexpected(pos, "storage class specifier", t);
        };
        return new Parsed(ParseNode.leaf(new NodeKind.StorageClassSpecifier(t.type()), TypeExpression.of(tag)), pos + 1);
    }

    private static ParseFailure unsupportedTypedef(int pos, Token t) {
        return new ParseFailure(ParseErrorCode.UNSUPPORTED_FEATURE, pos,
                "typedef is not supported ('" + t.text() + "' at line " + t.line() + ")");
    }

    /**
     * type-specifier: a basic type keyword | struct-or-union-specifier | enum-specifier
     * | atomic-type-specifier
     */
    Parsed typeSpecifier(int pos) {
        Token t = cursor.token(pos);
        switch (t.type()) {
            case STRUCT, UNION -> {
                return wrapSpecifier(t.type(), structOrUnionSpecifier(pos));
            }
            case ENUM -> {
                return wrapSpecifier(ENUM, enumSpecifier(pos));
            }
            case ATOMIC -> {
                return wrapSpecifier(ATOMIC, atomicTypeSpecifier(pos));
            }
            case TYPEDEF_NAME -> throw unsupportedTypedef(pos, t);
            default -> {
                Tag tag = basicTypeTag(t.type());
                if (tag == null) {
                    throw ParseFailure.unexpected(pos, "type specifier", t);
                }
                return new Parsed(ParseNode.leaf(new NodeKind.TypeSpecifier(t.type()), TypeExpression.of(tag)), pos + 1);
            }
        }
    }

    private static Parsed wrapSpecifier(TokenType keyword, Parsed inner) {
        return new Parsed(ParseNode.of(new NodeKind.TypeSpecifier(keyword), inner.type(), inner.node()),
                inner.position());
    }

    private static Tag basicTypeTag(TokenType type) {
        return switch (type) {
            case VOID -> Tag.VOID;
            case CHAR -> Tag.CHAR;
            case SHORT -> Tag.SHORT;
            case INT -> Tag.INT;
            case LONG -> Tag.LONG;
            case FLOAT -> Tag.FLOAT;
            case DOUBLE -> Tag.DOUBLE;
            case SIGNED -> Tag.SIGNED;
            case UNSIGNED -> Tag.UNSIGNED;
            case BOOL -> Tag.BOOL;
            case COMPLEX -> Tag.COMPLEX;
            case IMAGINARY -> Tag.IMAGINARY;
            default -> null;
        };
    }

    Parsed typeQualifier(int pos) {
        Token t = cursor.token(pos);
        Tag tag = switch (t.type()) {
            case CONST -> Tag.CONST;
            case RESTRICT -> Tag.RESTRICT;
            case VOLATILE -> Tag.VOLATILE;
            case ATOMIC -> Tag.ATOMIC;
            default -> throw ParseFailure.unexpected(pos, "type qualifier", t);
        };
        return new Parsed(ParseNode.leaf(new NodeKind.TypeQualifier(t.type()), TypeExpression.of(tag)), pos + 1);
    }

    Parsed functionSpecifier(int pos) {
        Token t = cursor.token(pos);
        Tag tag = switch (t.type()) {
            case INLINE -> Tag.INLINE;
            case NORETURN -> Tag.NORETURN;
            default -> throw ParseFailure.unexpected(pos, "function specifier", t);
        };
        return new Parsed(ParseNode.leaf(new NodeKind.FunctionSpecifier(t.type()), TypeExpression.of(tag)), pos + 1);
    }

    /**
     * alignment-specifier: _Alignas '(' ( type-name | constant-expression ) ')'
     */
    Parsed alignmentSpecifier(int pos) {
        cursor.expect(pos, ALIGNAS);
        cursor.expect(pos + 1, LPAREN);
        Parsed operand = firstOf("alignment specifier", pos + 2,
                this::typeName, parser.expressions()::constantExpression);
        cursor.expect(operand.position(), RPAREN);
        return new Parsed(ParseNode.of(Production.ALIGNMENT_SPECIFIER, TypeExpression.NONE, operand.node()),
                operand.position() + 1);
    }

    /**
     * atomic-type-specifier: _Atomic '(' type-name ')'
     */
    Parsed atomicTypeSpecifier(int pos) {
        cursor.expect(pos, ATOMIC);
        cursor.expect(pos + 1, LPAREN);
        Parsed typeName = typeName(pos + 2);
        cursor.expect(typeName.position(), RPAREN);
        TypeExpression type = new TypeExpression(BaseType.of(Tag.ATOMIC), List.of(typeName.type()), List.of());
        return new Parsed(ParseNode.of(Production.ATOMIC_TYPE_SPECIFIER, type, typeName.node()),
                typeName.position() + 1);
    }

    /**
     * static-assert-declaration: _Static_assert '(' constant-expression ',' STRING_LITERAL ')' ';'
     */
    Parsed staticAssertDeclaration(int pos) {
        cursor.expect(pos, STATIC_ASSERT);
        cursor.expect(pos + 1, LPAREN);
        Parsed condition = parser.expressions().constantExpression(pos + 2);
        cursor.expect(condition.position(), COMMA);
        Parsed message = parser.expressions().string(condition.position() + 1);
        cursor.expect(message.position(), RPAREN);
        cursor.expect(message.position() + 1, SEMICOLON);
        return new Parsed(ParseNode.of(Production.STATIC_ASSERT_DECLARATION, TypeExpression.NONE,
                condition.node(), message.node()), message.position() + 2);
    }

    // endregion

    // region Struct, union and enum

    /**
     * struct-or-union-specifier: ( struct | union ) [IDENTIFIER] '{' struct-declaration-list '}'
     * | ( struct | union ) IDENTIFIER
     */
    Parsed structOrUnionSpecifier(int pos) {
        Token keyword = cursor.token(pos);
        if (keyword.type() != STRUCT && keyword.type() != UNION) {
            throw ParseFailure.unexpected(pos, "'struct' or 'union'", keyword);
        }
        Tag tag = keyword.type() == STRUCT ? Tag.STRUCT : Tag.UNION;
        int p = pos + 1;
        String name = null;
        List<TypeExpression> typeParts = new ArrayList<>();
        if (cursor.check(p, IDENTIFIER)) {
            name = cursor.token(p).text();
            typeParts.add(TypeExpression.identifier(name));
            p++;
        }
        List<ParseNode> children = new ArrayList<>();
        if (cursor.check(p, LBRACE)) {
            Parsed members = structDeclarationList(p + 1);
            cursor.expect(members.position(), RBRACE);
            children.add(members.node());
            typeParts.add(members.type());
            p = members.position() + 1;
        } else if (name == null) {
            throw ParseFailure.unexpected(p, "tag name or '{'", cursor.token(p));
        }
        TypeExpression type = new TypeExpression(BaseType.of(tag), typeParts, List.of());
        return new Parsed(new ParseNode(new NodeKind.StructOrUnion(keyword.type(), name), children, type), p);
    }

    Parsed structDeclarationList(int pos) {
        GrammarSupport.Sequence items = repeatAtLeastOnce(this::structDeclaration, pos);
        return new Parsed(new ParseNode(Production.STRUCT_DECLARATION_LIST, items.nodes(),
                TypeExpression.flatten(Parser.types(items.nodes()))), items.position());
    }

    /**
     * struct-declaration: specifier-qualifier-list [struct-declarator-list] ';' | static-assert-declaration
     */
    Parsed structDeclaration(int pos) {
        return firstOf("struct declaration", pos, this::memberDeclaration,
                p -> Parser.wrap(Production.STRUCT_DECLARATION, staticAssertDeclaration(p)));
    }

    private Parsed memberDeclaration(int pos) {
        Parsed specifiers = specifierQualifierList(pos);
        List<ParseNode> children = new ArrayList<>(List.of(specifiers.node()));
        List<TypeExpression> types = new ArrayList<>(List.of(specifiers.type()));
        int p = specifiers.position();
        if (!cursor.check(p, SEMICOLON)) {
            Parsed declarators = structDeclaratorList(p);
            children.add(declarators.node());
            types.add(declarators.type());
            p = declarators.position();
        }
        cursor.expect(p, SEMICOLON);
        return new Parsed(new ParseNode(Production.STRUCT_DECLARATION, children, TypeExpression.composite(types)),
                p + 1);
    }

    /**
     * specifier-qualifier-list: ( type-specifier | type-qualifier ) { type-specifier | type-qualifier }
     */
    Parsed specifierQualifierList(int pos) {
        GrammarSupport.Sequence items = repeatAtLeastOnce(
                p -> firstOf("specifier qualifier", p, this::typeSpecifier, this::typeQualifier), pos);
        return new Parsed(new ParseNode(Production.SPECIFIER_QUALIFIER_LIST, items.nodes(),
                flattenSpecifiers(items.nodes())), items.position());
    }

    Parsed structDeclaratorList(int pos) {
        GrammarSupport.Sequence items = separatedList(this::structDeclarator, COMMA, cursor, pos);
        return new Parsed(new ParseNode(Production.STRUCT_DECLARATOR_LIST, items.nodes(),
                TypeExpression.flatten(Parser.types(items.nodes()))), items.position());
    }

    /**
     * struct-declarator: ':' constant-expression | declarator [':' constant-expression]
     * <p>
     * An unnamed bit-field is typed {@code none}.
     */
    Parsed structDeclarator(int pos) {
        if (cursor.check(pos, COLON)) {
            Parsed width = parser.expressions().constantExpression(pos + 1);
            return new Parsed(ParseNode.of(Production.STRUCT_DECLARATOR, TypeExpression.NONE, width.node()),
                    width.position());
        }
        Parsed declarator = declarator(pos);
        if (cursor.check(declarator.position(), COLON)) {
            Parsed width = parser.expressions().constantExpression(declarator.position() + 1);
            return new Parsed(ParseNode.of(Production.STRUCT_DECLARATOR, declarator.type(),
                    declarator.node(), width.node()), width.position());
        }
        return Parser.wrap(Production.STRUCT_DECLARATOR, declarator);
    }

    /**
     * enum-specifier: enum [IDENTIFIER] '{' enumerator-list [','] '}' | enum IDENTIFIER
     */
    Parsed enumSpecifier(int pos) {
        cursor.expect(pos, ENUM);
        int p = pos + 1;
        String name = null;
        List<TypeExpression> typeParts = new ArrayList<>();
        if (cursor.check(p, IDENTIFIER)) {
            name = cursor.token(p).text();
            typeParts.add(TypeExpression.identifier(name));
            p++;
        }
        List<ParseNode> children = new ArrayList<>();
        if (cursor.check(p, LBRACE)) {
            Parsed enumerators = enumeratorList(p + 1);
            int q = enumerators.position();
            if (cursor.check(q, COMMA)) {
                q++;
            }
            cursor.expect(q, RBRACE);
            children.add(enumerators.node());
            if (name == null) {
                typeParts.add(enumerators.type());
            }
            p = q + 1;
        } else if (name == null) {
            throw ParseFailure.unexpected(p, "tag name or '{'", cursor.token(p));
        }
        TypeExpression type = new TypeExpression(BaseType.of(Tag.ENUM), typeParts, List.of());
        return new Parsed(new ParseNode(new NodeKind.EnumSpecifier(name), children, type), p);
    }

    Parsed enumeratorList(int pos) {
        GrammarSupport.Sequence items = separatedList(this::enumerator, COMMA, cursor, pos);
        return new Parsed(new ParseNode(Production.ENUMERATOR_LIST, items.nodes(),
                TypeExpression.flatten(Parser.types(items.nodes()))), items.position());
    }

    /**
     * enumerator: IDENTIFIER ['=' constant-expression]
     * <p>
     * An explicit value must have an integer type.
     */
    Parsed enumerator(int pos) {
        Token name = cursor.expect(pos, IDENTIFIER);
        ParseNode constant = ParseNode.leaf(new NodeKind.EnumerationConstant(name.text()),
                TypeExpression.identifier(name.text()));
        if (!cursor.check(pos + 1, ASSIGN)) {
            return new Parsed(ParseNode.of(Production.ENUMERATOR, constant.type(), constant), pos + 1);
        }
        Parsed value = parser.expressions().constantExpression(pos + 2);
        if (ENUMERATOR_VALUE_TYPES.stream().noneMatch(t -> parser.oracle().typesEqual(value.type(), t))) {
            throw new ParseFailure(ParseErrorCode.ILLEGAL_ENUMERATOR_VALUE, pos + 2,
                    "Enumerator '" + name.text() + "' can only be assigned an integer, got " + value.type());
        }
        TypeExpression type = TypeExpression.composite(List.of(constant.type(), value.type()));
        return new Parsed(ParseNode.of(Production.ENUMERATOR, type, constant, value.node()), value.position());
    }

    // endregion

    // region Declarators

    /**
     * init-declarator-list: init-declarator { ',' init-declarator }
     *
     * @param specifierType The flattened specifier type every declarator is checked against.
     */
    Parsed initDeclaratorList(int pos, TypeExpression specifierType) {
        GrammarSupport.Sequence items = separatedList(p -> initDeclarator(p, specifierType), COMMA, cursor, pos);
        return new Parsed(new ParseNode(Production.INIT_DECLARATOR_LIST, items.nodes(),
                TypeExpression.flatten(Parser.types(items.nodes()))), items.position());
    }

    /**
     * init-declarator: declarator ['=' initializer]
     */
    Parsed initDeclarator(int pos, TypeExpression specifierType) {
        Parsed declarator = declarator(pos);
        int p = declarator.position();
        if (!cursor.check(p, ASSIGN)) {
            return Parser.wrap(Production.INIT_DECLARATOR, declarator);
        }
        boolean braced = cursor.check(p + 1, LBRACE);
        Parsed initializer = initializer(p + 1);
        if (!braced) {
            TypeExpression declared = declarator.type().replaceLeaf(specifierType);
            if (parser.oracle().resolveImplicitConversion(declared, initializer.type()).isEmpty()) {
                throw new ParseFailure(ParseErrorCode.ILLEGAL_ASSIGNMENT, p,
                        "Can not initialize " + declared + " with " + initializer.type() + " at token " + p);
            }
        }
        return new Parsed(ParseNode.of(Production.INIT_DECLARATOR, declarator.type(),
                declarator.node(), initializer.node()), initializer.position());
    }

    /**
     * declarator: [pointer] direct-declarator
     */
    Parsed declarator(int pos) {
        NestingGuard guard = parser.guard();
        guard.enter(pos);
        try {
            if (!cursor.check(pos, STAR)) {
                return Parser.wrap(Production.DECLARATOR, directDeclarator(pos));
            }
            Parsed pointer = pointer(pos);
            Parsed direct = directDeclarator(pointer.position());
            TypeExpression type = applyPointer(pointer.type(), direct.type());
            return new Parsed(ParseNode.of(Production.DECLARATOR, type, pointer.node(), direct.node()),
                    direct.position());
        } finally {
            guard.exit();
        }
    }

    /**
     * Wraps the innermost leaf of {@code direct} in the pointer chain.
     */
    private static TypeExpression applyPointer(TypeExpression pointerChain, TypeExpression direct) {
        return direct.replaceLeaf(wrapInPointers(pointerChain, direct.leaf()));
    }

    /**
     * Rebuilds a pointer chain parsed without a pointee so that its innermost pointer points at {@code inner}.
     */
    private static TypeExpression wrapInPointers(TypeExpression chain, TypeExpression inner) {
        TypeExpression pointee = chain.children().isEmpty() ? inner : wrapInPointers(chain.children().get(0), inner);
        return new TypeExpression(chain.primary(), List.of(pointee), chain.auxiliary());
    }

    /**
     * pointer: '*' [type-qualifier-list] [pointer]
     * <p>
     * The result is a chain of pointer types without a pointee, qualifiers kept as auxiliary tags.
     */
    Parsed pointer(int pos) {
        cursor.expect(pos, STAR);
        List<ParseNode> children = new ArrayList<>();
        List<BaseType> qualifiers = new ArrayList<>();
        int p = pos + 1;
        Optional<Parsed> qualifierList = optional(this::typeQualifierList, p);
        if (qualifierList.isPresent()) {
            children.add(qualifierList.get().node());
            for (ParseNode q : qualifierList.get().node().children()) {
                qualifiers.add(q.type().primary());
            }
            p = qualifierList.get().position();
        }
        List<TypeExpression> next = List.of();
        if (cursor.check(p, STAR)) {
            Parsed inner = pointer(p);
            children.add(inner.node());
            next = List.of(inner.type());
            p = inner.position();
        }
        TypeExpression type = new TypeExpression(BaseType.of(Tag.POINTER), next, qualifiers);
        return new Parsed(new ParseNode(Production.POINTER, children, type), p);
    }

    Parsed typeQualifierList(int pos) {
        GrammarSupport.Sequence items = repeatAtLeastOnce(this::typeQualifier, pos);
        return new Parsed(new ParseNode(Production.TYPE_QUALIFIER_LIST, items.nodes(),
                TypeExpression.flatten(Parser.types(items.nodes()))), items.position());
    }

    /**
     * direct-declarator: ( IDENTIFIER | '(' declarator ')' ) { direct-declarator-suffix }
     */
    Parsed directDeclarator(int pos) {
        Parsed base;
        if (cursor.check(pos, LPAREN)) {
            Parsed inner = declarator(pos + 1);
            cursor.expect(inner.position(), RPAREN);
            base = new Parsed(inner.node(), inner.position() + 1);
        } else {
            base = parser.expressions().identifier(pos);
        }
        List<ParseNode> children = new ArrayList<>(List.of(base.node()));
        TypeExpression type = base.type();
        int p = base.position();
        while (true) {
            TypeExpression wrapped = type;
            Optional<Parsed> suffix = optional(q -> declaratorSuffix(q, wrapped, false), p);
            if (suffix.isEmpty()) {
                break;
            }
            children.add(suffix.get().node());
            type = suffix.get().type();
            p = suffix.get().position();
        }
        return new Parsed(new ParseNode(Production.DIRECT_DECLARATOR, children, type), p);
    }

    /**
     * An array suffix {@code '[' [assignment-expression] ']'} or a function suffix
     * {@code '(' [parameter-type-list | identifier-list] ')'} applied to {@code inner}.
     *
     * @param isAbstract Whether the suffix belongs to an abstract declarator, which has no identifier lists.
     */
    private Parsed declaratorSuffix(int pos, TypeExpression inner, boolean isAbstract) {
        Token open = cursor.token(pos);
        NodeKind kind = isAbstract
                ? new NodeKind.DirectAbstractDeclaratorSuffix(open.type())
                : new NodeKind.DirectDeclaratorSuffix(open.type());
        if (open.type() == LBRACKET) {
            rejectUnsupportedArrayForm(pos + 1);
            if (cursor.check(pos + 1, RBRACKET)) {
                return new Parsed(ParseNode.leaf(kind, TypeExpression.arrayOf(BaseType.UNSPECIFIED_LENGTH, inner)),
                        pos + 2);
            }
            Parsed size = parser.expressions().assignmentExpression(pos + 1);
            cursor.expect(size.position(), RBRACKET);
            TypeExpression type = TypeExpression.arrayOf(arrayLength(size.node()), inner);
            return new Parsed(ParseNode.of(kind, type, size.node()), size.position() + 1);
        }
        if (open.type() == LPAREN) {
            if (cursor.check(pos + 1, RPAREN)) {
                return new Parsed(ParseNode.leaf(kind, TypeExpression.function(inner, null)), pos + 2);
            }
            Parsed parameters = isAbstract
                    ? parameterTypeList(pos + 1)
                    : firstOf("function declarator", pos + 1, this::parameterTypeList, this::identifierList);
            cursor.expect(parameters.position(), RPAREN);
            return new Parsed(ParseNode.of(kind, TypeExpression.function(inner, parameters.type()), parameters.node()),
                    parameters.position() + 1);
        }
        throw ParseFailure.unexpected(pos, "'[' or '('", open);
    }

    /**
     * {@code [static ...]}, {@code [*]} and {@code [qualifier ...]} are rejected.
     */
    private void rejectUnsupportedArrayForm(int pos) {
        Optional<Token> t = cursor.peek(pos);
        if (t.isEmpty()) {
            return;
        }
        TokenType type = t.get().type();
        boolean unsupported = type == STATIC || type == CONST || type == RESTRICT || type == VOLATILE
                || type == ATOMIC || (type == STAR && cursor.check(pos + 1, RBRACKET));
        if (unsupported) {
            throw new ParseFailure(ParseErrorCode.UNSUPPORTED_FEATURE, pos,
                    "Array declarator form '[" + t.get().text() + "' is not supported (line " + t.get().line() + ")");
        }
    }

    /**
     * @return The value of an integer-constant size expression, otherwise {@link BaseType#UNSPECIFIED_LENGTH}.
     */
    private static int arrayLength(ParseNode size) {
        ParseNode n = size.unwrap();
        if (n.kind() instanceof NodeKind.Constant c && c.value() instanceof ConstantValue.Int64 v
                && v.value() >= 0 && v.value() <= Integer.MAX_VALUE) {
            return (int) v.value();
        }
        return BaseType.UNSPECIFIED_LENGTH;
    }

    /**
     * parameter-type-list: parameter-list [',' '...']
     * <p>
     * A variadic list carries the {@code VARIADIC} marker in its auxiliary tags.
     */
    Parsed parameterTypeList(int pos) {
        Parsed list = parameterList(pos);
        int p = list.position();
        boolean variadic = cursor.check(p, COMMA) && cursor.check(p + 1, ELLIPSIS);
        TypeExpression type = list.type();
        if (variadic) {
            type = type.withAuxiliary(List.of(BaseType.of(Tag.VARIADIC)));
            p += 2;
        }
        return new Parsed(ParseNode.of(new NodeKind.ParameterTypeList(variadic), type, list.node()), p);
    }

    Parsed parameterList(int pos) {
        GrammarSupport.Sequence items = separatedList(this::parameterDeclaration, COMMA, cursor, pos);
        return new Parsed(new ParseNode(Production.PARAMETER_LIST, items.nodes(),
                TypeExpression.flatten(Parser.types(items.nodes()))), items.position());
    }

    /**
     * parameter-declaration: declaration-specifiers ( declarator | [abstract-declarator] )
     * <p>
     * Typed with the specifier type substituted into the declarator.
     */
    Parsed parameterDeclaration(int pos) {
        Parsed specifiers = declarationSpecifiers(pos);
        Optional<Parsed> shape = optional(p -> firstOf("parameter declarator", p,
                this::declarator, this::abstractDeclarator), specifiers.position());
        if (shape.isEmpty()) {
            return Parser.wrap(Production.PARAMETER_DECLARATION, specifiers);
        }
        TypeExpression type = shape.get().type().replaceLeaf(specifiers.type());
        return new Parsed(ParseNode.of(Production.PARAMETER_DECLARATION, type, specifiers.node(), shape.get().node()),
                shape.get().position());
    }

    /**
     * identifier-list: IDENTIFIER { ',' IDENTIFIER }
     */
    Parsed identifierList(int pos) {
        GrammarSupport.Sequence items = separatedList(parser.expressions()::identifier, COMMA, cursor, pos);
        return new Parsed(new ParseNode(Production.IDENTIFIER_LIST, items.nodes(),
                TypeExpression.flatten(Parser.types(items.nodes()))), items.position());
    }

    /**
     * type-name: specifier-qualifier-list [abstract-declarator]
     */
    Parsed typeName(int pos) {
        Parsed specifiers = specifierQualifierList(pos);
        Optional<Parsed> shape = optional(this::abstractDeclarator, specifiers.position());
        if (shape.isEmpty()) {
            return Parser.wrap(Production.TYPE_NAME, specifiers);
        }
        TypeExpression type = shape.get().type().replaceLeaf(specifiers.type());
        return new Parsed(ParseNode.of(Production.TYPE_NAME, type, specifiers.node(), shape.get().node()),
                shape.get().position());
    }

    /**
     * abstract-declarator: pointer [direct-abstract-declarator] | direct-abstract-declarator
     * <p>
     * The missing name is represented by a {@code none} leaf.
     */
    Parsed abstractDeclarator(int pos) {
        NestingGuard guard = parser.guard();
        guard.enter(pos);
        try {
            if (!cursor.check(pos, STAR)) {
                return Parser.wrap(Production.ABSTRACT_DECLARATOR, directAbstractDeclarator(pos));
            }
            Parsed pointer = pointer(pos);
            Optional<Parsed> direct = optional(this::directAbstractDeclarator, pointer.position());
            if (direct.isEmpty()) {
                TypeExpression type = wrapInPointers(pointer.type(), TypeExpression.NONE);
                return new Parsed(ParseNode.of(Production.ABSTRACT_DECLARATOR, type, pointer.node()),
                        pointer.position());
            }
            TypeExpression type = applyPointer(pointer.type(), direct.get().type());
            return new Parsed(ParseNode.of(Production.ABSTRACT_DECLARATOR, type, pointer.node(), direct.get().node()),
                    direct.get().position());
        } finally {
            guard.exit();
        }
    }

    /**
     * direct-abstract-declarator: ( '(' abstract-declarator ')' | suffix ) { suffix }
     */
    Parsed directAbstractDeclarator(int pos) {
        List<ParseNode> children = new ArrayList<>();
        TypeExpression type;
        int p;
        Optional<Parsed> nested = optional(this::parenthesizedAbstractDeclarator, pos);
        if (nested.isPresent()) {
            children.add(nested.get().node());
            type = nested.get().type();
            p = nested.get().position();
        } else {
            Parsed first = declaratorSuffix(pos, TypeExpression.NONE, true);
            children.add(first.node());
            type = first.type();
            p = first.position();
        }
        while (true) {
            TypeExpression wrapped = type;
            Optional<Parsed> suffix = optional(q -> declaratorSuffix(q, wrapped, true), p);
            if (suffix.isEmpty()) {
                break;
            }
            children.add(suffix.get().node());
            type = suffix.get().type();
            p = suffix.get().position();
        }
        return new Parsed(new ParseNode(Production.DIRECT_ABSTRACT_DECLARATOR, children, type), p);
    }

    private Parsed parenthesizedAbstractDeclarator(int pos) {
        cursor.expect(pos, LPAREN);
        Parsed inner = abstractDeclarator(pos + 1);
        cursor.expect(inner.position(), RPAREN);
        return new Parsed(inner.node(), inner.position() + 1);
    }

    // endregion

    // region Initializers

    /**
     * initializer: assignment-expression | '{' initializer-list [','] '}'
     */
    Parsed initializer(int pos) {
        NestingGuard guard = parser.guard();
        guard.enter(pos);
        try {
            if (!cursor.check(pos, LBRACE)) {
                return Parser.wrap(Production.INITIALIZER, parser.expressions().assignmentExpression(pos));
            }
            Parsed list = initializerList(pos + 1);
            int p = list.position();
            if (cursor.check(p, COMMA)) {
                p++;
            }
            cursor.expect(p, RBRACE);
            return new Parsed(ParseNode.of(Production.INITIALIZER, list.type(), list.node()), p + 1);
        } finally {
            guard.exit();
        }
    }

    /**
     * initializer-list: [designation] initializer { ',' [designation] initializer }
     */
    Parsed initializerList(int pos) {
        GrammarSupport.Sequence items = separatedList(this::designatedInitializer, COMMA, cursor, pos);
        return new Parsed(new ParseNode(Production.INITIALIZER_LIST, items.nodes(),
                TypeExpression.flatten(Parser.types(items.nodes()))), items.position());
    }

    private Parsed designatedInitializer(int pos) {
        if (!cursor.check(pos, DOT) && !cursor.check(pos, LBRACKET)) {
            return initializer(pos);
        }
        Parsed designation = designation(pos);
        Parsed value = initializer(designation.position());
        return new Parsed(ParseNode.of(Production.DESIGNATION, value.type(), designation.node(), value.node()),
                value.position());
    }

    /**
     * designation: designator-list '='
     */
    Parsed designation(int pos) {
        GrammarSupport.Sequence designators = repeatAtLeastOnce(this::designator, pos);
        cursor.expect(designators.position(), ASSIGN);
        ParseNode list = new ParseNode(Production.DESIGNATOR_LIST, designators.nodes(),
                TypeExpression.flatten(Parser.types(designators.nodes())));
        return new Parsed(list, designators.position() + 1);
    }

    /**
     * designator: '[' constant-expression ']' | '.' IDENTIFIER
     */
    Parsed designator(int pos) {
        Token t = cursor.token(pos);
        if (t.type() == LBRACKET) {
            Parsed index = parser.expressions().constantExpression(pos + 1);
            cursor.expect(index.position(), RBRACKET);
            return new Parsed(ParseNode.of(Production.DESIGNATOR, index.type(), index.node()), index.position() + 1);
        }
        if (t.type() == DOT) {
            Parsed member = parser.expressions().identifier(pos + 1);
            return Parser.wrap(Production.DESIGNATOR, member);
        }
        throw ParseFailure.unexpected(pos, "'[' or '.'", t);
    }

    // endregion
}
