package io.reportxform.core.parse;

/**
 * A lexical token of field-code text.
 *
 * @param type   token type
 * @param text   source text of the token (unescaped content for strings, the switch
 *               character for switches)
 * @param value  decoded literal value for numbers and dates, otherwise {@code null}
 * @param offset zero-based start offset in the source text
 */
record Token(Type type, String text, Object value, int offset) {

    enum Type {
        STRING,
        NUMBER,
        DATE,
        IDENTIFIER,
        OPERATOR,
        BANG,
        DOT,
        COMMA,
        LEFT_PAREN,
        RIGHT_PAREN,
        LEFT_BRACE,
        RIGHT_BRACE,
        SWITCH,
        EOF
    }

    boolean is(Type expected) {
        return type == expected;
    }

    /** Case-insensitive keyword test for identifier tokens. */
    boolean isKeyword(String keyword) {
        return type == Type.IDENTIFIER && text.equalsIgnoreCase(keyword);
    }

    boolean isOperator(String symbol) {
        return type == Type.OPERATOR && text.equals(symbol);
    }
}
