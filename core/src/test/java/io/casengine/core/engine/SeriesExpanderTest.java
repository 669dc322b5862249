package io.casengine.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.casengine.core.error.NumericEvaluationException;
import io.casengine.core.model.Expr;
import io.casengine.core.model.SeriesExpansion;
import io.casengine.core.model.StepLog;
import io.casengine.core.parser.RecursiveDescentParser;
import io.casengine.core.rules.RuleRegistry;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link SeriesExpander}. */
@DisplayName("SeriesExpander")
class SeriesExpanderTest {

    private final SeriesExpander expander =
            new SeriesExpander(new Simplifier(RuleRegistry.standard()), new Differentiator(), CasConfig.DEFAULT);
    private final RecursiveDescentParser parser = new RecursiveDescentParser();

    private SeriesExpansion expand(String text, double center, int order, StepLog log) {
        return expander.expand(text, parser.parse(text).ast(), "x", center, order, log);
    }

    private SeriesExpansion expand(String text, double center, int order) {
        return expand(text, center, order, new StepLog());
    }

    @Nested
    @DisplayName("Maclaurin series")
    class Maclaurin {

        @Test
        @DisplayName("exp(x) has reciprocal factorial coefficients")
        void exponential() {
            var series = expand("exp(x)", 0, 5);

            assertThat(series.terms())
                    .extracting(Expr::toString)
                    .containsExactly("1", "x", "1/2*x^2", "1/6*x^3", "1/24*x^4", "1/120*x^5");
            assertThat(series.remainder()).hasToString("1/720*x^6");
            assertThat(series.convergenceRadius()).isInfinite();
        }

        @Test
        @DisplayName("sin(x) keeps only odd powers")
        void sine() {
            var series = expand("sin(x)", 0, 5);

            assertThat(series.terms()).hasSize(6);
            assertThat(series.terms().get(0)).isEqualTo(Expr.num(0));
            assertThat(series.polynomial()).hasToString("x - 1/6*x^3 + 1/120*x^5");
            assertThat(series.convergenceRadius()).isInfinite();
        }

        @Test
        @DisplayName("the geometric series has radius one")
        void geometric() {
            var series = expand("1/(1 - x)", 0, 6);

            assertThat(series.convergenceRadius()).isCloseTo(1.0, within(1e-9));
        }

        @Test
        @DisplayName("a polynomial reproduces itself with an unbounded radius")
        void polynomial() {
            var series = expand("x^3 + 2x", 0, 5);

            assertThat(series.polynomial()).hasToString("2*x + x^3");
            assertThat(series.remainder()).isEqualTo(Expr.num(0));
            assertThat(series.convergenceRadius()).isInfinite();
        }
    }

    @Test
    @DisplayName("a shifted center approximates the function nearby")
    void shiftedCenter() {
        var series = expand("exp(x)", 1, 2);

        double approx = NumericEvaluator.evaluate(series.polynomial(), Map.of("x", 1.1));
        assertThat(approx).isCloseTo(Math.exp(1.1), within(1e-3));
        assertThat(series.center()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("one taylor-term step per included power")
    void steps() {
        var log = new StepLog();

        expand("cos(x)", 0, 4, log);

        assertThat(log.steps()).hasSize(5).allSatisfy(step -> assertThat(step.rule()).isEqualTo("taylor-term"));
    }

    @Test
    @DisplayName("order zero keeps only the constant term")
    void orderZero() {
        var series = expand("cos(x)", 0, 0);

        assertThat(series.terms()).containsExactly(Expr.num(1));
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("no finite value at the center")
        void singularCenter() {
            assertThatThrownBy(() -> expand("ln(x)", 0, 3))
                    .isInstanceOf(NumericEvaluationException.class)
                    .hasMessageContaining("no finite value");
            assertThatThrownBy(() -> expand("1/x", 0, 3)).isInstanceOf(NumericEvaluationException.class);
        }

        @Test
        @DisplayName("negative order")
        void negativeOrder() {
            assertThatThrownBy(() -> expand("exp(x)", 0, -1))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("order must not be negative");
        }
    }

    @Test
    @DisplayName("radius estimate from coefficients")
    void radiusEstimate() {
        assertThat(SeriesExpander.radius(new double[] {1, 0.5, 0.25, 0.125})).isCloseTo(2.0, within(1e-12));
        assertThat(SeriesExpander.radius(new double[] {3, 0, 0})).isInfinite();
    }
}
