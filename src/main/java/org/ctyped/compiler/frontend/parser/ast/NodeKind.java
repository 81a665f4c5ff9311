package org.ctyped.compiler.frontend.parser.ast;

import org.ctyped.compiler.frontend.lexer.StringLiteralValue;
import org.ctyped.compiler.frontend.lexer.TokenType;

/**
 * The closed set of parse-node kinds. Each variant carries exactly the payload its production needs.
 */
public sealed interface NodeKind permits NodeKind.Production, NodeKind.Identifier, NodeKind.EnumerationConstant,
        NodeKind.Constant, NodeKind.StringLiteral, NodeKind.PostfixOperator, NodeKind.UnaryOperator,
        NodeKind.AssignmentOperator, NodeKind.BinaryExpression, NodeKind.StorageClassSpecifier,
        NodeKind.TypeSpecifier, NodeKind.StructOrUnion, NodeKind.EnumSpecifier, NodeKind.TypeQualifier,
        NodeKind.FunctionSpecifier, NodeKind.DirectDeclaratorSuffix, NodeKind.DirectAbstractDeclaratorSuffix,
        NodeKind.ParameterTypeList, NodeKind.LabeledStatement, NodeKind.SelectionStatement,
        NodeKind.IterationStatement, NodeKind.JumpStatement {

    /**
     * @return A short human-readable rendering used by the tree printer.
     */
    String describe();

    /**
     * Structural productions without payload.
     */
    enum Production implements NodeKind {
        TRANSLATION_UNIT, EXTERNAL_DECLARATION, FUNCTION_DEFINITION, DECLARATION_LIST,
        DECLARATION, DECLARATION_SPECIFIERS, INIT_DECLARATOR_LIST, INIT_DECLARATOR,
        STRUCT_DECLARATION_LIST, STRUCT_DECLARATION, SPECIFIER_QUALIFIER_LIST, STRUCT_DECLARATOR_LIST,
        STRUCT_DECLARATOR, ENUMERATOR_LIST, ENUMERATOR, ATOMIC_TYPE_SPECIFIER, ALIGNMENT_SPECIFIER,
        DECLARATOR, DIRECT_DECLARATOR, POINTER, TYPE_QUALIFIER_LIST, PARAMETER_LIST, PARAMETER_DECLARATION,
        IDENTIFIER_LIST, TYPE_NAME, ABSTRACT_DECLARATOR, DIRECT_ABSTRACT_DECLARATOR,
        INITIALIZER, INITIALIZER_LIST, DESIGNATION, DESIGNATOR_LIST, DESIGNATOR, STATIC_ASSERT_DECLARATION,
        STATEMENT, COMPOUND_STATEMENT, BLOCK_ITEM_LIST, BLOCK_ITEM, EXPRESSION_STATEMENT,
        PRIMARY_EXPRESSION, GENERIC_SELECTION, GENERIC_ASSOC_LIST, GENERIC_ASSOCIATION,
        POSTFIX_EXPRESSION, ARGUMENT_EXPRESSION_LIST, COMPOUND_LITERAL, UNARY_EXPRESSION, CAST_EXPRESSION,
        MULTIPLICATIVE_EXPRESSION, ADDITIVE_EXPRESSION, SHIFT_EXPRESSION, RELATIONAL_EXPRESSION,
        EQUALITY_EXPRESSION, AND_EXPRESSION, EXCLUSIVE_OR_EXPRESSION, INCLUSIVE_OR_EXPRESSION,
        LOGICAL_AND_EXPRESSION, LOGICAL_OR_EXPRESSION, CONDITIONAL_EXPRESSION, ASSIGNMENT_EXPRESSION,
        EXPRESSION, CONSTANT_EXPRESSION;

        @Override
        public String describe() {
            return name();
        }
    }

    /**
     * A name in expression or declarator position.
     * @param name The identifier.
     */
    record Identifier(String name) implements NodeKind {
        @Override
        public String describe() {
            return "Identifier(" + name + ")";
        }
    }

    /**
     * An enumerator being declared, or an enumeration-constant token in an expression.
     * @param name The enumerator name.
     */
    record EnumerationConstant(String name) implements NodeKind {
        @Override
        public String describe() {
            return "EnumerationConstant(" + name + ")";
        }
    }

    /**
     * @param value The literal value.
     */
    record Constant(ConstantValue value) implements NodeKind {
        @Override
        public String describe() {
            return "Constant(" + value + ")";
        }
    }

    /**
     * The value of a constant token.
     */
    sealed interface ConstantValue permits ConstantValue.Int64, ConstantValue.Float64, ConstantValue.Enumerator {
        /**
         * An integer or character constant.
         * @param value The value, unsigned constants kept as their two's-complement bits.
         */
        record Int64(long value) implements ConstantValue {
            @Override
            public String toString() {
                return Long.toString(value);
            }
        }

        /**
         * A floating constant.
         * @param value The value.
         */
        record Float64(double value) implements ConstantValue {
            @Override
            public String toString() {
                return Double.toString(value);
            }
        }

        /**
         * An enumeration constant, identified by name.
         * @param name The enumerator name.
         */
        record Enumerator(String name) implements ConstantValue {
            @Override
            public String toString() {
                return name;
            }
        }
    }

    /**
     * A string literal or {@code __func__}.
     * @param value The literal text and encoding.
     */
    record StringLiteral(StringLiteralValue value) implements NodeKind {
        @Override
        public String describe() {
            return "StringLiteral(" + value + ")";
        }
    }

    /**
     * One postfix suffix: {@code [ ( . -> ++ --}.
     * @param operator The token that opens the suffix.
     */
    record PostfixOperator(TokenType operator) implements NodeKind {
        @Override
        public String describe() {
            return "PostfixOperator(" + operator.spelling() + ")";
        }
    }

    /**
     * @param operator One of {@code ++ -- & * + - ~ ! sizeof _Alignof}.
     */
    record UnaryOperator(TokenType operator) implements NodeKind {
        @Override
        public String describe() {
            return "UnaryOperator(" + operator.spelling() + ")";
        }
    }

    /**
     * @param operator {@code =} or a compound assignment operator.
     */
    record AssignmentOperator(TokenType operator) implements NodeKind {
        @Override
        public String describe() {
            return "AssignmentOperator(" + operator.spelling() + ")";
        }
    }

    /**
     * A folded binary operation. Children are the left and right operand.
     * @param operator The binary operator.
     */
    record BinaryExpression(TokenType operator) implements NodeKind {
        @Override
        public String describe() {
            return "BinaryExpression(" + operator.spelling() + ")";
        }
    }

    /**
     * @param keyword {@code extern static _Thread_local auto register}. {@code typedef} is never accepted.
     */
    record StorageClassSpecifier(TokenType keyword) implements NodeKind {
        @Override
        public String describe() {
            return "StorageClassSpecifier(" + keyword.spelling() + ")";
        }
    }

    /**
     * @param keyword A basic type keyword, or {@code struct union enum _Atomic} for the compound forms.
     */
    record TypeSpecifier(TokenType keyword) implements NodeKind {
        @Override
        public String describe() {
            return "TypeSpecifier(" + keyword.spelling() + ")";
        }
    }

    /**
     * @param keyword {@code struct} or {@code union}.
     * @param tag The tag name, or {@code null} for an anonymous definition.
     */
    record StructOrUnion(TokenType keyword, String tag) implements NodeKind {
        @Override
        public String describe() {
            return "StructOrUnion(" + keyword.spelling() + (tag == null ? "" : " " + tag) + ")";
        }
    }

    /**
     * @param tag The tag name, or {@code null} for an anonymous enumeration.
     */
    record EnumSpecifier(String tag) implements NodeKind {
        @Override
        public String describe() {
            return "EnumSpecifier(" + (tag == null ? "" : tag) + ")";
        }
    }

    /**
     * @param keyword {@code const restrict volatile _Atomic}.
     */
    record TypeQualifier(TokenType keyword) implements NodeKind {
        @Override
        public String describe() {
            return "TypeQualifier(" + keyword.spelling() + ")";
        }
    }

    /**
     * @param keyword {@code inline} or {@code _Noreturn}.
     */
    record FunctionSpecifier(TokenType keyword) implements NodeKind {
        @Override
        public String describe() {
            return "FunctionSpecifier(" + keyword.spelling() + ")";
        }
    }

    /**
     * An array or function suffix of a direct declarator.
     * @param opener {@code [} or {@code (}.
     */
    record DirectDeclaratorSuffix(TokenType opener) implements NodeKind {
        @Override
        public String describe() {
            return "DirectDeclaratorSuffix(" + opener.spelling() + ")";
        }
    }

    /**
     * An array or function suffix of a direct abstract declarator.
     * @param opener {@code [} or {@code (}.
     */
    record DirectAbstractDeclaratorSuffix(TokenType opener) implements NodeKind {
        @Override
        public String describe() {
            return "DirectAbstractDeclaratorSuffix(" + opener.spelling() + ")";
        }
    }

    /**
     * @param variadic Whether the list ends in {@code , ...}.
     */
    record ParameterTypeList(boolean variadic) implements NodeKind {
        @Override
        public String describe() {
            return variadic ? "ParameterTypeList(...)" : "ParameterTypeList";
        }
    }

    /**
     * @param keyword {@link TokenType#IDENTIFIER} for a named label, otherwise {@code case} or {@code default}.
     * @param label The label name, or {@code null} for {@code case} and {@code default}.
     */
    record LabeledStatement(TokenType keyword, String label) implements NodeKind {
        @Override
        public String describe() {
            return "LabeledStatement(" + (label != null ? label : keyword.spelling()) + ")";
        }
    }

    /**
     * @param keyword {@code if} or {@code switch}.
     */
    record SelectionStatement(TokenType keyword) implements NodeKind {
        @Override
        public String describe() {
            return "SelectionStatement(" + keyword.spelling() + ")";
        }
    }

    /**
     * @param keyword {@code while do for}.
     */
    record IterationStatement(TokenType keyword) implements NodeKind {
        @Override
        public String describe() {
            return "IterationStatement(" + keyword.spelling() + ")";
        }
    }

    /**
     * @param keyword {@code goto continue break return}.
     * @param label The target of a {@code goto}, otherwise {@code null}.
     */
    record JumpStatement(TokenType keyword, String label) implements NodeKind {
        @Override
        public String describe() {
            return "JumpStatement(" + keyword.spelling() + (label == null ? "" : " " + label) + ")";
        }
    }
}
