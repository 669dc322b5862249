package io.casengine.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.casengine.core.error.UnsupportedSymbolException;
import io.casengine.core.model.Expr;
import io.casengine.core.model.SimplifyOptions;
import io.casengine.core.model.Step;
import io.casengine.core.model.StepLog;
import io.casengine.core.parser.RecursiveDescentParser;
import io.casengine.core.rules.RuleRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link Differentiator}. */
@DisplayName("Differentiator")
class DifferentiatorTest {

    private static final double H = 1e-5;

    private final Differentiator differentiator = new Differentiator();
    private final Simplifier simplifier = new Simplifier(RuleRegistry.standard());
    private final RecursiveDescentParser parser = new RecursiveDescentParser();

    private Expr parse(String text) {
        return parser.parse(text).ast();
    }

    private Expr derivative(String text) {
        Expr raw = differentiator.derivative(parse(text), "x", new StepLog());
        return simplifier.simplify(raw, SimplifyOptions.DEFAULT);
    }

    @Nested
    @DisplayName("closed forms")
    class ClosedForms {

        @Test
        @DisplayName("power rule")
        void powerRule() {
            assertThat(derivative("x^3")).hasToString("3*x^2");
        }

        @Test
        @DisplayName("product rule")
        void productRule() {
            assertThat(derivative("x*sin(x)")).hasToString("sin(x) + x*cos(x)");
        }

        @Test
        @DisplayName("constants and other variables differentiate to zero")
        void constants() {
            assertThat(derivative("5")).isEqualTo(Expr.num(0));
            assertThat(derivative("y^2 + pi")).isEqualTo(Expr.num(0));
            assertThat(derivative("x")).isEqualTo(Expr.num(1));
        }

        @Test
        @DisplayName("standard function table")
        void standardFunctions() {
            assertThat(derivative("sin(x)")).hasToString("cos(x)");
            assertThat(derivative("cos(x)")).hasToString("-sin(x)");
            assertThat(derivative("exp(x)")).hasToString("exp(x)");
        }
    }

    @ParameterizedTest(name = "d/dx {0}")
    @ValueSource(
            strings = {
                "x^3 - 2x + 7",
                "sin(x)*cos(x)",
                "exp(2x)/x",
                "ln(x^2 + 1)",
                "sqrt(x)",
                "tan(x)",
                "x^x",
                "2^x",
                "atan(x)",
                "asin(x/2)",
                "cosh(x)*sinh(x)",
                "log(x)",
                "abs(x - 3)",
                "sec(x) + csc(x) + cot(x)",
                "tanh(3x)",
                "acos(x/2)",
                "(x^2 + 1)^3/(x + 2)"
            })
    @DisplayName("agrees with a central difference")
    void matchesFiniteDifference(String text) {
        Expr f = parse(text);
        Expr df = derivative(text);
        for (double x : new double[] {0.4, 1.1, 1.7}) {
            double expected = (NumericEvaluator.at(f, "x", x + H) - NumericEvaluator.at(f, "x", x - H)) / (2 * H);
            double actual = NumericEvaluator.at(df, "x", x);
            assertThat(actual)
                    .as("d/dx %s at x = %s (derivative %s)", text, x, df)
                    .isCloseTo(expected, within(1e-5 * Math.max(1, Math.abs(expected))));
        }
    }

    @ParameterizedTest(name = "d/dx ({0}) + ({1})")
    @CsvSource(
            delimiter = '|',
            value = {"x^2 | sin(x)", "exp(2x) | ln(x)", "x*cos(x) | 1/x"})
    @DisplayName("the derivative of a sum is the sum of the derivatives")
    void linearity(String a, String b) {
        Expr sum = derivative("(" + a + ") + (" + b + ")");
        Expr parts = simplifier.simplify(Expr.add(derivative(a), derivative(b)), SimplifyOptions.DEFAULT);
        for (double x : new double[] {0.5, 1.3}) {
            assertThat(NumericEvaluator.at(sum, "x", x))
                    .isCloseTo(NumericEvaluator.at(parts, "x", x), within(1e-9));
        }
    }

    @Nested
    @DisplayName("steps")
    class Steps {

        @Test
        @DisplayName("product and chain rules are recorded")
        void recordsRules() {
            var log = new StepLog();

            differentiator.derivative(parse("x*sin(2x)"), "x", log);

            assertThat(log.steps()).extracting(Step::rule).contains("product-rule", "chain-rule");
            assertThat(log.steps()).allSatisfy(s -> assertThat(s.operation()).isEqualTo("differentiate"));
        }
    }

    @Nested
    @DisplayName("unsupported input")
    class Unsupported {

        @Test
        @DisplayName("unknown functions name the symbol")
        void unknownFunction() {
            assertThatThrownBy(() -> derivative("gamma(x)"))
                    .isInstanceOf(UnsupportedSymbolException.class)
                    .hasMessageContaining("gamma")
                    .satisfies(e -> assertThat(((UnsupportedSymbolException) e).symbol()).isEqualTo("gamma"));
        }

        @Test
        @DisplayName("unknown functions are reported even with a constant argument")
        void unknownFunctionOfConstant() {
            assertThatThrownBy(() -> derivative("x + gamma(2)"))
                    .isInstanceOf(UnsupportedSymbolException.class)
                    .satisfies(e -> assertThat(((UnsupportedSymbolException) e).symbol()).isEqualTo("gamma"));
        }

        @Test
        @DisplayName("equations and unevaluated integrals are rejected")
        void equationsAndIntegrals() {
            assertThatThrownBy(() -> differentiator.derivative(parse("x = 1"), "x", new StepLog()))
                    .isInstanceOf(UnsupportedSymbolException.class)
                    .satisfies(e -> assertThat(((UnsupportedSymbolException) e).symbol()).isEqualTo("="));
            var integral = Expr.call("integral", Expr.var("x"), Expr.var("x"));
            assertThatThrownBy(() -> differentiator.derivative(integral, "x", new StepLog()))
                    .isInstanceOf(UnsupportedSymbolException.class)
                    .satisfies(e -> assertThat(((UnsupportedSymbolException) e).symbol()).isEqualTo("integral"));
        }

        @Test
        @DisplayName("partial steps travel on the exception")
        void partialSteps() {
            assertThatThrownBy(() -> differentiator.derivative(parse("x*sin(x) + gamma(x)"), "x", new StepLog()))
                    .isInstanceOf(UnsupportedSymbolException.class)
                    .satisfies(e -> assertThat(((UnsupportedSymbolException) e).partialSteps())
                            .extracting(Step::rule)
                            .contains("product-rule"));
        }
    }
}
