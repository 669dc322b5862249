package io.casengine.core.parser;

/**
 * One lexical token.
 *
 * @param type   token kind
 * @param text   source text of the token
 * @param column 1-based column of the first character
 */
record Token(Type type, String text, int column) {

    enum Type {
        NUMBER,
        IDENTIFIER,
        PLUS,
        MINUS,
        STAR,
        SLASH,
        CARET,
        LPAREN,
        RPAREN,
        COMMA,
        EQUALS,
        END
    }

    boolean is(Type t) {
        return type == t;
    }

    /** Token as shown in error messages. */
    String describe() {
        return type == Type.END ? "end of input" : "'" + text + "'";
    }
}
