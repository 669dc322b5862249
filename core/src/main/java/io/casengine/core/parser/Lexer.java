package io.casengine.core.parser;

import io.casengine.core.parser.Token.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits expression text into tokens. Unknown characters are collected as errors rather than
 * thrown, so one pass reports all of them. {@code **} is accepted as a synonym for {@code ^}.
 * Numbers may carry a decimal exponent ({@code 1e-3}).
 */
final class Lexer {

    private final String text;
    private final List<Token> tokens = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private int pos;

    Lexer(String text) {
        this.text = text;
    }

    /** Tokens ending with {@link Type#END}; meaningful only if {@link #errors()} is empty. */
    List<Token> tokenize() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < text.length()
                    && Character.isDigit(text.charAt(pos + 1)))) {
                number();
            } else if (Character.isLetter(c)) {
                identifier();
            } else {
                symbol(c);
            }
        }
        tokens.add(new Token(Type.END, "", text.length() + 1));
        return tokens;
    }

    List<String> errors() {
        return errors;
    }

    private void number() {
        int start = pos;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        if (pos < text.length() && text.charAt(pos) == '.') {
            pos++;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
            if (pos < text.length() && text.charAt(pos) == '.') {
                errors.add("Malformed number '" + text.substring(start, pos + 1) + "' at column " + (start + 1));
                pos++;
                return;
            }
        }
        if (exponentFollows()) {
            pos++;
            if (text.charAt(pos) == '+' || text.charAt(pos) == '-') {
                pos++;
            }
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
        }
        String literal = text.substring(start, pos);
        if (Double.isInfinite(Double.parseDouble(literal))) {
            errors.add("Number '" + literal + "' at column " + (start + 1) + " is out of range");
            return;
        }
        tokens.add(new Token(Type.NUMBER, literal, start + 1));
    }

    /** {@code e3}, {@code E-4}, {@code e+2}; a bare {@code e} stays the constant (as in {@code 2e}). */
    private boolean exponentFollows() {
        if (pos >= text.length() || (text.charAt(pos) != 'e' && text.charAt(pos) != 'E')) {
            return false;
        }
        int next = pos + 1;
        if (next < text.length() && (text.charAt(next) == '+' || text.charAt(next) == '-')) {
            next++;
        }
        return next < text.length() && Character.isDigit(text.charAt(next));
    }

    private void identifier() {
        int start = pos;
        while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
        }
        tokens.add(new Token(Type.IDENTIFIER, text.substring(start, pos), start + 1));
    }

    private void symbol(char c) {
        int column = pos + 1;
        Type type;
        switch (c) {
            case '+' -> type = Type.PLUS;
            case '-' -> type = Type.MINUS;
            case '*' -> {
                if (pos + 1 < text.length() && text.charAt(pos + 1) == '*') {
                    tokens.add(new Token(Type.CARET, "**", column));
                    pos += 2;
                    return;
                }
                type = Type.STAR;
            }
            case '/' -> type = Type.SLASH;
            case '^' -> type = Type.CARET;
            case '(' -> type = Type.LPAREN;
            case ')' -> type = Type.RPAREN;
            case ',' -> type = Type.COMMA;
            case '=' -> type = Type.EQUALS;
            default -> {
                errors.add("Unexpected character '" + c + "' at column " + column);
                pos++;
                return;
            }
        }
        tokens.add(new Token(type, String.valueOf(c), column));
        pos++;
    }
}
