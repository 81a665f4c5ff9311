package org.ctyped.compiler.frontend.lexer;

import org.ctyped.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts preprocessed C source text into a sequence of tokens.
 * <p>
 * Character constants become {@link TokenType#I_CONSTANT} tokens. Adjacent string literals
 * are concatenated. Preprocessor lines are reported as errors and skipped.
 * No end-of-file token is appended: the parser treats the end of the list as the end of input.
 */
public class Lexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;
    private boolean lineHasTokens = false;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being lexed, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\r', '\t', '\f', '\u000B':
                break;
            case '\n':
                newLine();
                break;
            case '#':
                if (!lineHasTokens) {
                    error("Preprocessor directives are not supported; preprocess the source first");
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else {
                    error("Unexpected character: #");
                }
                break;
            case '"': string(StringLiteralValue.Encoding.PLAIN); break;
            case '\'': character(); break;
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '?': addToken(TokenType.QUESTION); break;
            case '~': addToken(TokenType.TILDE); break;
            case '.':
                if (isDigit(peek())) {
                    number();
                } else if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    addToken(TokenType.ELLIPSIS);
                } else {
                    addToken(TokenType.DOT);
                }
                break;
            case '+':
                addToken(match('+') ? TokenType.INC_OP : match('=') ? TokenType.ADD_ASSIGN : TokenType.PLUS);
                break;
            case '-':
                addToken(match('-') ? TokenType.DEC_OP
                        : match('=') ? TokenType.SUB_ASSIGN
                        : match('>') ? TokenType.PTR_OP
                        : TokenType.MINUS);
                break;
            case '*': addToken(match('=') ? TokenType.MUL_ASSIGN : TokenType.STAR); break;
            case '%': addToken(match('=') ? TokenType.MOD_ASSIGN : TokenType.PERCENT); break;
            case '^': addToken(match('=') ? TokenType.XOR_ASSIGN : TokenType.CARET); break;
            case '!': addToken(match('=') ? TokenType.NE_OP : TokenType.BANG); break;
            case '=': addToken(match('=') ? TokenType.EQ_OP : TokenType.ASSIGN); break;
            case '&':
                addToken(match('&') ? TokenType.AND_OP : match('=') ? TokenType.AND_ASSIGN : TokenType.AMPERSAND);
                break;
            case '|':
                addToken(match('|') ? TokenType.OR_OP : match('=') ? TokenType.OR_ASSIGN : TokenType.PIPE);
                break;
            case '<':
                if (match('<')) {
                    addToken(match('=') ? TokenType.LEFT_ASSIGN : TokenType.LEFT_OP);
                } else {
                    addToken(match('=') ? TokenType.LE_OP : TokenType.LESS);
                }
                break;
            case '>':
                if (match('>')) {
                    addToken(match('=') ? TokenType.RIGHT_ASSIGN : TokenType.RIGHT_OP);
                } else {
                    addToken(match('=') ? TokenType.GE_OP : TokenType.GREATER);
                }
                break;
            case '/':
                if (match('/')) {
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(match('=') ? TokenType.DIV_ASSIGN : TokenType.SLASH);
                }
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            if (advance() == '\n') newLine();
        }
        error("Unterminated block comment");
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);

        StringLiteralValue.Encoding encoding = encodingPrefix(text);
        if (encoding != null && peek() == '"') {
            advance();
            string(encoding);
            return;
        }
        if (encoding != null && peek() == '\'') {
            advance();
            character();
            return;
        }

        addToken(TokenType.keyword(text).orElse(TokenType.IDENTIFIER));
    }

    private static StringLiteralValue.Encoding encodingPrefix(String text) {
        return switch (text) {
            case "u8" -> StringLiteralValue.Encoding.UTF8;
            case "u" -> StringLiteralValue.Encoding.UTF16;
            case "U" -> StringLiteralValue.Encoding.UTF32;
            case "L" -> StringLiteralValue.Encoding.WIDE;
            default -> null;
        };
    }

    private void number() {
        boolean floating = false;
        boolean hex = source.charAt(start) == '0' && (peek() == 'x' || peek() == 'X');
        if (hex) {
            advance();
            while (isHexDigit(peek())) advance();
            if (peek() == '.') {
                floating = true;
                advance();
                while (isHexDigit(peek())) advance();
            }
            if (peek() == 'p' || peek() == 'P') {
                floating = true;
                exponent();
            }
        } else {
            while (isDigit(peek())) advance();
            if (peek() == '.' || source.charAt(start) == '.') {
                floating = true;
                if (peek() == '.') advance();
                while (isDigit(peek())) advance();
            }
            if (peek() == 'e' || peek() == 'E') {
                floating = true;
                exponent();
            }
        }
        int digitsEnd = current;
        while (isAlpha(peek())) advance();
        String suffix = source.substring(digitsEnd, current).toLowerCase();
        String digits = source.substring(start, digitsEnd);

        if (floating) {
            if (!suffix.isEmpty() && !suffix.equals("f") && !suffix.equals("l")) {
                error("Invalid floating constant suffix: " + suffix);
                return;
            }
            try {
                addToken(TokenType.F_CONSTANT, Double.parseDouble(hex && !digits.contains("p") && !digits.contains("P")
                        ? digits + "p0" : digits));
            } catch (NumberFormatException e) {
                error("Invalid floating constant: " + digits);
            }
            return;
        }

        if (!suffix.matches("u?(l|ll)?|(l|ll)u")) {
            error("Invalid integer constant suffix: " + suffix);
            return;
        }
        try {
            long value;
            if (hex) {
                value = Long.parseUnsignedLong(digits.substring(2), 16);
            } else if (digits.length() > 1 && digits.charAt(0) == '0') {
                value = Long.parseUnsignedLong(digits.substring(1), 8);
            } else {
                value = Long.parseUnsignedLong(digits);
            }
            addToken(TokenType.I_CONSTANT, value);
        } catch (NumberFormatException e) {
            error("Invalid integer constant: " + digits);
        }
    }

    private void exponent() {
        advance();
        if (peek() == '+' || peek() == '-') advance();
        if (!isDigit(peek())) {
            error("Missing exponent digits");
            return;
        }
        while (isDigit(peek())) advance();
    }

    private void character() {
        if (peek() == '\'') {
            advance();
            error("Empty character constant");
            return;
        }
        long value = 0;
        int units = 0;
        while (peek() != '\'' && peek() != '\n' && !isAtEnd()) {
            int unit = peek() == '\\' ? escape() : advance();
            value = (value << 8) | (unit & 0xFF);
            units++;
        }
        if (peek() != '\'') {
            error("Unterminated character constant");
            return;
        }
        advance();
        if (units > 1) {
            diagnostics.reportWarning("Multi-character character constant " + source.substring(start, current),
                    logicalFileName, startLine);
        }
        addToken(TokenType.I_CONSTANT, value);
    }

    private void string(StringLiteralValue.Encoding encoding) {
        int contentStart = current;
        while (peek() != '"' && !isAtEnd()) {
            if (peek() == '\n') {
                error("Unterminated string literal");
                return;
            }
            if (peek() == '\\') {
                advance();
                if (!isAtEnd()) advance();
            } else {
                advance();
            }
        }
        if (isAtEnd()) {
            error("Unterminated string literal");
            return;
        }
        String text = source.substring(contentStart, current);
        advance(); // closing quote

        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() == TokenType.STRING_LITERAL) {
            Token previous = tokens.remove(tokens.size() - 1);
            StringLiteralValue prior = (StringLiteralValue) previous.value();
            StringLiteralValue.Encoding merged = prior.encoding() != StringLiteralValue.Encoding.PLAIN
                    ? prior.encoding() : encoding;
            tokens.add(new Token(TokenType.STRING_LITERAL,
                    previous.text() + " " + source.substring(start, current),
                    new StringLiteralValue(prior.text() + text, merged),
                    previous.line(), previous.column(), logicalFileName));
            return;
        }
        addToken(TokenType.STRING_LITERAL, new StringLiteralValue(text, encoding));
    }

    /**
     * Consumes one escape sequence starting at the backslash.
     * @return The code unit it denotes, or 0 if the line or the input ends after the backslash.
     */
    private int escape() {
        advance();
        if (isAtEnd() || peek() == '\n') {
            return 0;
        }
        char c = advance();
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case 'a': return 7;
            case 'b': return '\b';
            case 'f': return '\f';
            case 'v': return 11;
            case '\\', '\'', '"', '?': return c;
            case 'x': {
                int value = 0;
                while (isHexDigit(peek())) value = value * 16 + Character.digit(advance(), 16);
                return value;
            }
            default:
                if (c >= '0' && c <= '7') {
                    int value = c - '0';
                    for (int i = 0; i < 2 && peek() >= '0' && peek() <= '7'; i++) {
                        value = value * 8 + (advance() - '0');
                    }
                    return value;
                }
                error("Unknown escape sequence: \\" + c);
                return c;
        }
    }

    private void newLine() {
        line++;
        column = 1;
        lineHasTokens = false;
    }

    private void error(String message) {
        diagnostics.reportError(message, logicalFileName, startLine);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        current++;
        column++;
        return source.charAt(current - 1);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn, logicalFileName));
        lineHasTokens = true;
    }
}
