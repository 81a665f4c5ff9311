package org.ctyped.compiler.frontend.parser;

import org.ctyped.compiler.api.ParseErrorCode;
import org.ctyped.compiler.config.ParserOptions;
import org.ctyped.compiler.diagnostics.DiagnosticsEngine;
import org.ctyped.compiler.frontend.lexer.Lexer;
import org.ctyped.compiler.frontend.lexer.Token;
import org.ctyped.compiler.frontend.lexer.TokenType;
import org.ctyped.compiler.frontend.parser.ast.NodeKind;
import org.ctyped.compiler.frontend.parser.ast.NodeKind.Production;
import org.ctyped.compiler.frontend.parser.ast.ParseNode;
import org.ctyped.compiler.frontend.semantics.CTypeOracle;
import org.ctyped.compiler.frontend.types.BaseType;
import org.ctyped.compiler.frontend.types.TypeExpression;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for declarations, declarators, type names and initializers.
 */
public class DeclarationGrammarTest {

    private static DeclarationGrammar declarations(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        return new Parser(tokens, new CTypeOracle(), ParserOptions.defaults()).declarations();
    }

    private static void assertFailure(Runnable parse, ParseErrorCode expected) {
        assertThatThrownBy(parse::run)
                .isInstanceOfSatisfying(ParseFailure.class, f -> assertThat(f.code()).isEqualTo(expected));
    }

    private static List<ParseNode> nodesOfKind(ParseNode root, NodeKind kind) {
        return root.descendants().filter(n -> n.kind().equals(kind)).toList();
    }

    /**
     * Verifies that the pointer wraps the name before the array suffix does.
     */
    @Test
    @Tag("unit")
    void testPointerArrayDeclarator() {
        // Act
        Parsed declaration = declarations("int *a[3];").declaration(0);

        // Assert
        assertThat(declaration.position()).isEqualTo(7);
        assertThat(declaration.type()).isEqualTo(TypeExpression.composite(List.of(
                TypeExpression.INT,
                TypeExpression.arrayOf(3, TypeExpression.pointerTo(TypeExpression.identifier("a"))))));
    }

    /**
     * Verifies a parenthesized function-pointer declarator.
     */
    @Test
    @Tag("unit")
    void testFunctionPointerDeclarator() {
        // Act
        Parsed declarator = declarations("(*fp)(int)").declarator(0);

        // Assert
        assertThat(declarator.type()).isEqualTo(TypeExpression.function(
                TypeExpression.pointerTo(TypeExpression.identifier("fp")), TypeExpression.INT));
        assertThat(declarator.position()).isEqualTo(7);
    }

    /**
     * Verifies that a type name substitutes the specifier type into its abstract declarator.
     */
    @Test
    @Tag("unit")
    void testAbstractTypeName() {
        // Act
        Parsed pointer = declarations("char **").typeName(0);
        Parsed function = declarations("int (*)(void)").typeName(0);

        // Assert
        assertThat(pointer.type()).isEqualTo(TypeExpression.pointerTo(
                TypeExpression.pointerTo(TypeExpression.of(BaseType.Tag.CHAR))));
        assertThat(function.type()).isEqualTo(TypeExpression.function(
                TypeExpression.pointerTo(TypeExpression.INT), TypeExpression.of(BaseType.Tag.VOID)));
        assertThat(function.position()).isEqualTo(7);
    }

    /**
     * Verifies that the first type specifier is principal and everything else is auxiliary.
     */
    @Test
    @Tag("unit")
    void testSpecifierFlattening() {
        // Act
        Parsed specifiers = declarations("const unsigned long int n;").declarationSpecifiers(0);
        Parsed atomic = declarations("_Atomic(int) c;").declarationSpecifiers(0);
        Parsed qualified = declarations("_Atomic int c;").declarationSpecifiers(0);

        // Assert
        assertThat(specifiers.position()).isEqualTo(4);
        assertThat(specifiers.type().toString()).isEqualTo("unsigned{const long int}");
        assertThat(atomic.type()).isEqualTo(new TypeExpression(BaseType.of(BaseType.Tag.ATOMIC),
                List.of(TypeExpression.INT), List.of()));
        assertThat(qualified.type().is(BaseType.Tag.INT)).isTrue();
        assertThat(qualified.type().hasAuxiliary(BaseType.Tag.ATOMIC)).isTrue();
    }

    /**
     * Verifies that typedefs are rejected as unsupported.
     */
    @Test
    @Tag("unit")
    void testTypedefIsUnsupported() {
        // Act & Assert
        assertFailure(() -> declarations("typedef int myint;").declaration(0), ParseErrorCode.UNSUPPORTED_FEATURE);
    }

    /**
     * Verifies that the qualified and variable-length array forms are rejected as unsupported.
     */
    @Test
    @Tag("unit")
    void testUnsupportedArrayForms() {
        // Act & Assert
        assertFailure(() -> declarations("int a[static 3];").declaration(0), ParseErrorCode.UNSUPPORTED_FEATURE);
        assertFailure(() -> declarations("int a[const 3];").declaration(0), ParseErrorCode.UNSUPPORTED_FEATURE);
        assertFailure(() -> declarations("int a[*];").declaration(0), ParseErrorCode.UNSUPPORTED_FEATURE);
        assertThat(declarations("int a[];").declaration(0).type().children().get(1))
                .isEqualTo(TypeExpression.arrayOf(BaseType.UNSPECIFIED_LENGTH, TypeExpression.identifier("a")));
    }

    /**
     * Verifies that non-braced initializers are checked against the declared type.
     */
    @Test
    @Tag("unit")
    void testInitializerConversion() {
        // Act
        Parsed pointer = declarations("char *s = \"hi\";").declaration(0);
        Parsed braced = declarations("int a[2] = {1, 2,};").declaration(0);
        Parsed cast = declarations("int v = (int)*p;").declaration(0);

        // Assert
        assertThat(pointer.position()).isEqualTo(6);
        assertThat(braced.position()).isEqualTo(12);
        assertThat(cast.position()).isEqualTo(9);
        assertFailure(() -> declarations("int x = \"s\";").declaration(0), ParseErrorCode.ILLEGAL_ASSIGNMENT);
        assertFailure(() -> declarations("int v = *p;").declaration(0), ParseErrorCode.ILLEGAL_ASSIGNMENT);
    }

    /**
     * Verifies designated initializers.
     */
    @Test
    @Tag("unit")
    void testDesignatedInitializers() {
        // Act
        Parsed declaration = declarations("struct point p = { .x = 1, [0] = 2 };").declaration(0);

        // Assert
        assertThat(nodesOfKind(declaration.node(), Production.DESIGNATION)).hasSize(2);
        assertThat(nodesOfKind(declaration.node(), Production.DESIGNATOR)).hasSize(2);
    }

    /**
     * Verifies enumerator typing and the trailing comma of an enumerator list.
     */
    @Test
    @Tag("unit")
    void testEnumerators() {
        // Act
        Parsed declaration = declarations("enum color { RED, GREEN = 2, BLUE = 1 < 2, };").declaration(0);

        // Assert
        List<ParseNode> enumerators = nodesOfKind(declaration.node(), Production.ENUMERATOR);
        assertThat(enumerators).hasSize(3);
        assertThat(enumerators.get(0).type()).isEqualTo(TypeExpression.identifier("RED"));
        assertThat(enumerators.get(1).type()).isEqualTo(TypeExpression.composite(
                List.of(TypeExpression.identifier("GREEN"), TypeExpression.LONG)));
        assertThat(nodesOfKind(declaration.node(), new NodeKind.EnumSpecifier("color"))).hasSize(1);
        assertThat(declaration.type().children().get(0)).isEqualTo(new TypeExpression(BaseType.of(BaseType.Tag.ENUM),
                List.of(TypeExpression.identifier("color")), List.of()));
    }

    /**
     * Verifies that an enumerator value must be an integer.
     */
    @Test
    @Tag("unit")
    void testEnumeratorValueMustBeInteger() {
        // Act & Assert
        assertFailure(() -> declarations("enum { A = 1.5 };").declaration(0), ParseErrorCode.ILLEGAL_ENUMERATOR_VALUE);
        assertFailure(() -> declarations("enum { A = \"s\" };").declaration(0), ParseErrorCode.ILLEGAL_ENUMERATOR_VALUE);
    }

    /**
     * Verifies struct specifiers with members and bit-fields.
     */
    @Test
    @Tag("unit")
    void testStructSpecifier() {
        // Act
        Parsed declaration = declarations("struct point { int x, y; unsigned flags : 3; unsigned : 2; } p;")
                .declaration(0);
        Parsed anonymous = declarations("union { int i; float f; } u;").declaration(0);

        // Assert
        List<ParseNode> structs = nodesOfKind(declaration.node(), new NodeKind.StructOrUnion(TokenType.STRUCT, "point"));
        assertThat(structs).hasSize(1);
        TypeExpression type = structs.get(0).type();
        assertThat(type.is(BaseType.Tag.STRUCT)).isTrue();
        assertThat(type.children().get(0)).isEqualTo(TypeExpression.identifier("point"));
        assertThat(nodesOfKind(declaration.node(), Production.STRUCT_DECLARATION)).hasSize(3);
        assertThat(nodesOfKind(declaration.node(), Production.STRUCT_DECLARATOR))
                .extracting(ParseNode::type)
                .contains(TypeExpression.identifier("flags"), TypeExpression.NONE);
        assertThat(nodesOfKind(anonymous.node(), new NodeKind.StructOrUnion(TokenType.UNION, null))).hasSize(1);
    }

    /**
     * Verifies that a variadic parameter list is marked.
     */
    @Test
    @Tag("unit")
    void testVariadicParameters() {
        // Act
        Parsed declaration = declarations("int printf(const char *fmt, ...);").declaration(0);

        // Assert
        List<ParseNode> lists = declaration.node().descendants()
                .filter(n -> n.kind() instanceof NodeKind.ParameterTypeList).toList();
        assertThat(lists).hasSize(1);
        assertThat(lists.get(0).kind()).isEqualTo(new NodeKind.ParameterTypeList(true));
        assertThat(lists.get(0).type().hasAuxiliary(BaseType.Tag.VARIADIC)).isTrue();
        assertThat(lists.get(0).type().is(BaseType.Tag.POINTER)).isTrue();
        assertThat(nodesOfKind(declaration.node(), Production.PARAMETER_DECLARATION)).hasSize(1);
    }

    /**
     * Verifies static assertions as declarations.
     */
    @Test
    @Tag("unit")
    void testStaticAssert() {
        // Act
        Parsed declaration = declarations("_Static_assert(1, \"ok\");").declaration(0);

        // Assert
        assertThat(declaration.position()).isEqualTo(7);
        assertThat(declaration.node().kind()).isEqualTo(Production.DECLARATION);
        assertThat(declaration.node().child(0).kind()).isEqualTo(Production.STATIC_ASSERT_DECLARATION);
    }
}
