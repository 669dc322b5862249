package io.casengine.core.parser;

import io.casengine.core.model.Expr;
import io.casengine.core.model.Expr.Num;
import io.casengine.core.model.MathFunctions;
import io.casengine.core.model.ParseResult;
import io.casengine.core.parser.Token.Type;
import io.casengine.core.spi.ExpressionParser;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link ExpressionParser}: a hand-written recursive-descent parser.
 *
 * <p>
 * Precedence, loosest first:
 * <ol>
 * <li>{@code =} (at most one, top level only)
 * <li>{@code +} and {@code -}
 * <li>{@code *}, {@code /} and implicit multiplication ({@code 2x}, {@code 3(x+1)})
 * <li>unary minus ({@code -x^2} is {@code -(x^2)})
 * <li>{@code ^}, right-associative ({@code 2^3^2} is {@code 2^9})
 * </ol>
 *
 * <p>
 * A name followed by {@code (} is a function call when it is a known function or longer than one
 * letter; a single letter followed by {@code (} is a variable times a group. Unary minus on a
 * literal folds into the literal; otherwise it becomes {@code -1 * u}. The names {@code pi} and
 * {@code e} are constants and are not reported as variables.
 *
 * <p>
 * Thread-safe and stateless: every call builds its own lexer and cursor.
 */
public final class RecursiveDescentParser implements ExpressionParser {

    private static final Logger LOG = LoggerFactory.getLogger(RecursiveDescentParser.class);

    /** Deepest nesting accepted before the input is rejected. */
    static final int MAX_DEPTH = 200;

    @Override
    public ParseResult parse(String text) {
        if (text == null || text.isBlank()) {
            return ParseResult.failure(List.of("Expression is empty"));
        }
        Lexer lexer = new Lexer(text);
        List<Token> tokens = lexer.tokenize();
        if (!lexer.errors().isEmpty()) {
            LOG.debug("parse.rejected errors={}", lexer.errors());
            return ParseResult.failure(lexer.errors());
        }
        Cursor cursor = new Cursor(tokens);
        try {
            Expr ast = cursor.equation();
            return ParseResult.success(ast, cursor.variables, cursor.functions);
        } catch (SyntaxError e) {
            LOG.debug("parse.rejected errors=[{}]", e.getMessage());
            return ParseResult.failure(List.of(e.getMessage()));
        }
    }

    /** Aborts a parse; converted to a failed {@link ParseResult} at the top. */
    private static final class SyntaxError extends RuntimeException {
        private static final long serialVersionUID = 1L;

        SyntaxError(String message) {
            super(message, null, false, false);
        }
    }

    private static final class Cursor {
        private final List<Token> tokens;
        private final Set<String> variables = new LinkedHashSet<>();
        private final Set<String> functions = new LinkedHashSet<>();
        private int index;
        private int depth;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        Expr equation() {
            Expr lhs = expression();
            if (peek().is(Type.EQUALS)) {
                next();
                Expr rhs = expression();
                if (peek().is(Type.EQUALS)) {
                    throw error("Only one '=' is allowed, found another at column " + peek().column());
                }
                expect(Type.END);
                return new Expr.Equation(lhs, rhs);
            }
            expect(Type.END);
            return lhs;
        }

        private Expr expression() {
            enter();
            Expr left = term();
            while (peek().is(Type.PLUS) || peek().is(Type.MINUS)) {
                Type op = next().type();
                Expr right = term();
                left = op == Type.PLUS ? Expr.add(left, right) : Expr.sub(left, right);
            }
            depth--;
            return left;
        }

        private Expr term() {
            Expr left = unary();
            while (true) {
                Token t = peek();
                if (t.is(Type.STAR) || t.is(Type.SLASH)) {
                    next();
                    Expr right = unary();
                    left = t.is(Type.STAR) ? Expr.mul(left, right) : Expr.div(left, right);
                } else if (t.is(Type.IDENTIFIER) || t.is(Type.LPAREN)) {
                    // implicit multiplication: 2x, 3(x + 1), (x + 1)(x - 1)
                    left = Expr.mul(left, unary());
                } else if (t.is(Type.NUMBER)) {
                    throw error("Unexpected number " + t.describe() + " at column " + t.column());
                } else {
                    return left;
                }
            }
        }

        private Expr unary() {
            if (peek().is(Type.MINUS)) {
                next();
                enter();
                Expr operand = unary();
                depth--;
                return operand instanceof Num n ? Expr.num(-n.value()) : Expr.neg(operand);
            }
            if (peek().is(Type.PLUS)) {
                next();
                return unary();
            }
            return power();
        }

        private Expr power() {
            Expr base = primary();
            if (peek().is(Type.CARET)) {
                next();
                enter();
                Expr exponent = unary();
                depth--;
                return Expr.pow(base, exponent);
            }
            return base;
        }

        private Expr primary() {
            Token t = next();
            switch (t.type()) {
                case NUMBER -> {
                    return Expr.num(Double.parseDouble(t.text()));
                }
                case IDENTIFIER -> {
                    return name(t);
                }
                case LPAREN -> {
                    Expr inner = expression();
                    expect(Type.RPAREN);
                    return inner;
                }
                default -> throw error(t.is(Type.END)
                        ? "Unexpected end of input"
                        : "Unexpected " + t.describe() + " at column " + t.column());
            }
        }

        private Expr name(Token t) {
            String name = t.text();
            boolean call = peek().is(Type.LPAREN) && (MathFunctions.isKnown(name) || name.length() > 1);
            if (call) {
                next();
                List<Expr> args = new ArrayList<>();
                if (!peek().is(Type.RPAREN)) {
                    args.add(expression());
                    while (peek().is(Type.COMMA)) {
                        next();
                        args.add(expression());
                    }
                }
                expect(Type.RPAREN);
                functions.add(name);
                return new Expr.Call(name, args);
            }
            if (MathFunctions.isKnown(name)) {
                throw error("Function '" + name + "' at column " + t.column() + " needs parenthesised arguments");
            }
            if (!MathFunctions.CONSTANTS.contains(name)) {
                variables.add(name);
            }
            return Expr.var(name);
        }

        private void enter() {
            if (++depth > MAX_DEPTH) {
                throw error("Expression nests deeper than " + MAX_DEPTH + " levels");
            }
        }

        private Token peek() {
            return tokens.get(index);
        }

        private Token next() {
            Token t = tokens.get(index);
            if (!t.is(Type.END)) {
                index++;
            }
            return t;
        }

        private void expect(Type type) {
            Token t = peek();
            if (!t.is(type)) {
                String wanted = switch (type) {
                    case RPAREN -> "')'";
                    case END -> "end of input";
                    default -> type.name();
                };
                throw error("Expected " + wanted + " but found " + t.describe() + " at column " + t.column());
            }
            next();
        }

        private static SyntaxError error(String message) {
            return new SyntaxError(message);
        }
    }
}
