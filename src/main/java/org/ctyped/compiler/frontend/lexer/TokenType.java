package org.ctyped.compiler.frontend.lexer;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Defines all token kinds of C11 after preprocessing.
 * <p>
 * Keywords and punctuators carry their spelling. The literal and name kinds carry {@code null}.
 */
public enum TokenType {
    // Names and literals
    IDENTIFIER(null),
    TYPEDEF_NAME(null),
    ENUMERATION_CONSTANT(null),
    I_CONSTANT(null),
    F_CONSTANT(null),
    STRING_LITERAL(null),
    FUNC_NAME("__func__"),

    // Keywords
    AUTO("auto"),
    BREAK("break"),
    CASE("case"),
    CHAR("char"),
    CONST("const"),
    CONTINUE("continue"),
    DEFAULT("default"),
    DO("do"),
    DOUBLE("double"),
    ELSE("else"),
    ENUM("enum"),
    EXTERN("extern"),
    FLOAT("float"),
    FOR("for"),
    GOTO("goto"),
    IF("if"),
    INLINE("inline"),
    INT("int"),
    LONG("long"),
    REGISTER("register"),
    RESTRICT("restrict"),
    RETURN("return"),
    SHORT("short"),
    SIGNED("signed"),
    SIZEOF("sizeof"),
    STATIC("static"),
    STRUCT("struct"),
    SWITCH("switch"),
    TYPEDEF("typedef"),
    UNION("union"),
    UNSIGNED("unsigned"),
    VOID("void"),
    VOLATILE("volatile"),
    WHILE("while"),
    ALIGNAS("_Alignas"),
    ALIGNOF("_Alignof"),
    ATOMIC("_Atomic"),
    BOOL("_Bool"),
    COMPLEX("_Complex"),
    GENERIC("_Generic"),
    IMAGINARY("_Imaginary"),
    NORETURN("_Noreturn"),
    STATIC_ASSERT("_Static_assert"),
    THREAD_LOCAL("_Thread_local"),

    // Punctuators
    ELLIPSIS("..."),
    RIGHT_ASSIGN(">>="),
    LEFT_ASSIGN("<<="),
    ADD_ASSIGN("+="),
    SUB_ASSIGN("-="),
    MUL_ASSIGN("*="),
    DIV_ASSIGN("/="),
    MOD_ASSIGN("%="),
    AND_ASSIGN("&="),
    XOR_ASSIGN("^="),
    OR_ASSIGN("|="),
    RIGHT_OP(">>"),
    LEFT_OP("<<"),
    INC_OP("++"),
    DEC_OP("--"),
    PTR_OP("->"),
    AND_OP("&&"),
    OR_OP("||"),
    LE_OP("<="),
    GE_OP(">="),
    EQ_OP("=="),
    NE_OP("!="),
    SEMICOLON(";"),
    LBRACE("{"),
    RBRACE("}"),
    COMMA(","),
    COLON(":"),
    ASSIGN("="),
    LPAREN("("),
    RPAREN(")"),
    LBRACKET("["),
    RBRACKET("]"),
    DOT("."),
    AMPERSAND("&"),
    BANG("!"),
    TILDE("~"),
    MINUS("-"),
    PLUS("+"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    LESS("<"),
    GREATER(">"),
    CARET("^"),
    PIPE("|"),
    QUESTION("?");

    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> keywords = new HashMap<>();
        for (TokenType type : values()) {
            if (type.isKeyword()) {
                keywords.put(type.spelling, type);
            }
        }
        KEYWORDS = Collections.unmodifiableMap(keywords);
    }

    private final String spelling;

    TokenType(String spelling) {
        this.spelling = spelling;
    }

    /**
     * @return The fixed source spelling, or {@code null} for names and literals.
     */
    public String spelling() {
        return spelling;
    }

    public boolean isKeyword() {
        return ordinal() >= AUTO.ordinal() && ordinal() <= THREAD_LOCAL.ordinal();
    }

    public boolean isPunctuator() {
        return ordinal() >= ELLIPSIS.ordinal();
    }

    /**
     * @return The spelling if there is one, otherwise the enum name. Used in error messages.
     */
    public String display() {
        return spelling != null ? "'" + spelling + "'" : name();
    }

    /**
     * Looks up a keyword. {@code __func__} is not a keyword but a predefined identifier
     * and is resolved here as well.
     *
     * @param word An identifier-shaped word.
     * @return The keyword type, if the word is reserved.
     */
    public static Optional<TokenType> keyword(String word) {
        if (FUNC_NAME.spelling.equals(word)) {
            return Optional.of(FUNC_NAME);
        }
        return Optional.ofNullable(KEYWORDS.get(word));
    }
}
