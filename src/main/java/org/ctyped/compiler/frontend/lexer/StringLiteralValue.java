package org.ctyped.compiler.frontend.lexer;

/**
 * The payload of a string-literal token.
 *
 * @param text The characters between the quotes, escape sequences left as written.
 * @param encoding The encoding prefix of the literal.
 */
public record StringLiteralValue(String text, Encoding encoding) {

    /**
     * The encoding prefixes of C11 string literals.
     */
    public enum Encoding {
        /** No prefix. */
        PLAIN(""),
        /** {@code u8"..."} */
        UTF8("u8"),
        /** {@code u"..."} */
        UTF16("u"),
        /** {@code U"..."} */
        UTF32("U"),
        /** {@code L"..."} */
        WIDE("L");

        private final String prefix;

        Encoding(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    public static StringLiteralValue plain(String text) {
        return new StringLiteralValue(text, Encoding.PLAIN);
    }

    @Override
    public String toString() {
        return encoding.prefix + "\"" + text + "\"";
    }
}
