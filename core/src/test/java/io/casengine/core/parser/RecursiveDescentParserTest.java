package io.casengine.core.parser;

import static io.casengine.core.model.Expr.add;
import static io.casengine.core.model.Expr.call;
import static io.casengine.core.model.Expr.div;
import static io.casengine.core.model.Expr.mul;
import static io.casengine.core.model.Expr.neg;
import static io.casengine.core.model.Expr.num;
import static io.casengine.core.model.Expr.pow;
import static io.casengine.core.model.Expr.sub;
import static io.casengine.core.model.Expr.var;
import static org.assertj.core.api.Assertions.assertThat;

import io.casengine.core.model.Expr;
import io.casengine.core.model.ParseResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link RecursiveDescentParser}. */
@DisplayName("RecursiveDescentParser")
class RecursiveDescentParserTest {

    private static final Expr X = var("x");

    private final RecursiveDescentParser parser = new RecursiveDescentParser();

    private Expr ast(String text) {
        ParseResult result = parser.parse(text);
        assertThat(result.errors()).as("errors for '%s'", text).isEmpty();
        assertThat(result.valid()).isTrue();
        return result.ast();
    }

    private String error(String text) {
        ParseResult result = parser.parse(text);
        assertThat(result.valid()).as("'%s' should be rejected", text).isFalse();
        assertThat(result.ast()).isNull();
        assertThat(result.errors()).isNotEmpty();
        return result.errors().get(0);
    }

    @Nested
    @DisplayName("precedence and associativity")
    class Precedence {

        @Test
        @DisplayName("multiplication binds tighter than addition")
        void mulOverAdd() {
            assertThat(ast("1 + 2 * x")).isEqualTo(add(num(1), mul(num(2), X)));
        }

        @Test
        @DisplayName("subtraction and division are left-associative")
        void leftAssociative() {
            assertThat(ast("x - 1 - 2")).isEqualTo(sub(sub(X, num(1)), num(2)));
            assertThat(ast("x / 2 / 3")).isEqualTo(div(div(X, num(2)), num(3)));
        }

        @Test
        @DisplayName("powers are right-associative")
        void powerRightAssociative() {
            assertThat(ast("2^3^2")).isEqualTo(pow(num(2), pow(num(3), num(2))));
        }

        @Test
        @DisplayName("unary minus binds looser than a power")
        void unaryMinusBelowPower() {
            assertThat(ast("-x^2")).isEqualTo(neg(pow(X, num(2))));
            assertThat(ast("2^-1")).isEqualTo(pow(num(2), num(-1)));
        }

        @Test
        @DisplayName("a negated literal folds into the literal")
        void negativeLiteral() {
            assertThat(ast("-3")).isEqualTo(num(-3));
            assertThat(ast("-(x)")).isEqualTo(neg(X));
            assertThat(ast("2 * -x")).isEqualTo(mul(num(2), neg(X)));
        }

        @Test
        @DisplayName("** is a synonym for ^")
        void doubleStarPower() {
            assertThat(ast("x ** 2")).isEqualTo(pow(X, num(2)));
        }
    }

    @Nested
    @DisplayName("numbers")
    class Numbers {

        @Test
        @DisplayName("a decimal exponent belongs to the literal")
        void scientificNotation() {
            assertThat(ast("1e-3")).isEqualTo(num(0.001));
            assertThat(ast("2.5E+2")).isEqualTo(num(250));
            assertThat(ast("3e2x")).isEqualTo(mul(num(300), X));
            assertThat(parser.parse("1e-3").variables()).isEmpty();
        }

        @Test
        @DisplayName("e without exponent digits is still the constant")
        void bareE() {
            assertThat(ast("2e")).isEqualTo(mul(num(2), var("e")));
            assertThat(ast("2e^x")).isEqualTo(mul(num(2), pow(var("e"), X)));
        }

        @Test
        @DisplayName("a literal that overflows a double is rejected")
        void outOfRange() {
            assertThat(error("1e999")).isEqualTo("Number '1e999' at column 1 is out of range");
            assertThat(error("x + 2E400")).contains("out of range");
        }
    }

    @Nested
    @DisplayName("implicit multiplication")
    class Implicit {

        @Test
        @DisplayName("number before a variable or group")
        void numberBeforeName() {
            assertThat(ast("2x + 3")).isEqualTo(add(mul(num(2), X), num(3)));
            assertThat(ast("3(x + 1)")).isEqualTo(mul(num(3), add(X, num(1))));
            assertThat(ast(".5x")).isEqualTo(mul(num(0.5), X));
        }

        @Test
        @DisplayName("adjacent groups and calls")
        void adjacentGroups() {
            assertThat(ast("(x + 1)(x - 1)")).isEqualTo(mul(add(X, num(1)), sub(X, num(1))));
            assertThat(ast("sin(x)cos(x)")).isEqualTo(mul(call("sin", X), call("cos", X)));
        }

        @Test
        @DisplayName("a single letter before a group is a product, not a call")
        void singleLetterBeforeGroup() {
            assertThat(ast("x(y + 1)")).isEqualTo(mul(X, add(var("y"), num(1))));
        }
    }

    @Nested
    @DisplayName("names")
    class Names {

        @Test
        @DisplayName("known and multi-letter names before a group are calls")
        void calls() {
            var result = parser.parse("sin(x) + gamma(x) + atan2(y, x)");

            assertThat(result.valid()).isTrue();
            assertThat(result.functions()).containsExactly("sin", "gamma", "atan2");
            assertThat(result.ast()).isEqualTo(add(
                    add(call("sin", X), call("gamma", X)), call("atan2", var("y"), X)));
        }

        @Test
        @DisplayName("variables are reported in order of first occurrence, constants excluded")
        void variables() {
            var result = parser.parse("pi*r^2 + e^t + r");

            assertThat(result.variables()).containsExactly("r", "t");
        }

        @Test
        @DisplayName("equations parse at the top level")
        void equation() {
            assertThat(ast("2x + 3 = 7")).isEqualTo(new Expr.Equation(add(mul(num(2), X), num(3)), num(7)));
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @ParameterizedTest(name = "''{0}''")
        @ValueSource(strings = {"", "   "})
        @DisplayName("blank input")
        void blank(String text) {
            assertThat(error(text)).isEqualTo("Expression is empty");
        }

        @Test
        @DisplayName("null input is rejected like blank input")
        void nullInput() {
            assertThat(error(null)).isEqualTo("Expression is empty");
        }

        @ParameterizedTest(name = "''{0}'' -> {1}")
        @CsvSource(
                quoteCharacter = '"',
                delimiter = '|',
                value = {
                    "(x + 1      | Expected ')' but found end of input at column 7",
                    "x +         | Unexpected end of input",
                    "x = 1 = 2   | Only one '=' is allowed, found another at column 7",
                    "sin x       | Function 'sin' at column 1 needs parenthesised arguments",
                    "2 3         | Unexpected number '3' at column 3",
                    "x )         | Expected end of input but found ')' at column 3",
                    "* x         | Unexpected '*' at column 1"
                })
        @DisplayName("syntax errors name the column")
        void syntaxErrors(String text, String message) {
            assertThat(error(text)).isEqualTo(message);
        }

        @Test
        @DisplayName("every bad character is reported")
        void lexicalErrors() {
            var result = parser.parse("x $ y # z");

            assertThat(result.errors())
                    .containsExactly("Unexpected character '$' at column 3", "Unexpected character '#' at column 7");
        }

        @Test
        @DisplayName("malformed numbers")
        void malformedNumber() {
            assertThat(error("1.2.3")).startsWith("Malformed number '1.2.'");
        }

        @Test
        @DisplayName("excessive nesting is rejected instead of overflowing the stack")
        void nestingLimit() {
            String deep = "(".repeat(RecursiveDescentParser.MAX_DEPTH + 50) + "x"
                    + ")".repeat(RecursiveDescentParser.MAX_DEPTH + 50);

            assertThat(error(deep)).contains("nests deeper than " + RecursiveDescentParser.MAX_DEPTH);
            assertThat(error("-".repeat(1000) + "x")).contains("nests deeper");
        }
    }
}
