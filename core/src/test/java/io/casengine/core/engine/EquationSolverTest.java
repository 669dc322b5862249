package io.casengine.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.casengine.core.error.SolverUnavailableException;
import io.casengine.core.error.SolverUnavailableException.Reason;
import io.casengine.core.model.EquationKind;
import io.casengine.core.model.EquationSolution;
import io.casengine.core.model.Expr;
import io.casengine.core.model.Expr.Equation;
import io.casengine.core.model.Step;
import io.casengine.core.model.StepLog;
import io.casengine.core.parser.RecursiveDescentParser;
import io.casengine.core.rules.RuleRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link EquationSolver}. */
@DisplayName("EquationSolver")
class EquationSolverTest {

    private final Simplifier simplifier = new Simplifier(RuleRegistry.standard());
    private final RecursiveDescentParser parser = new RecursiveDescentParser();

    private EquationSolution solve(String text, CasConfig config) {
        return new EquationSolver(simplifier, config).solve((Equation) parser.parse(text).ast(), "x", new StepLog());
    }

    private EquationSolution solve(String text) {
        return solve(text, CasConfig.DEFAULT);
    }

    private static List<Double> values(EquationSolution solution) {
        return solution.solutions().stream()
                .map(root -> NumericEvaluator.evaluate(root, Map.of()))
                .toList();
    }

    private static List<String> rules(EquationSolution solution) {
        return solution.steps().stream().map(Step::rule).toList();
    }

    @Nested
    @DisplayName("linear")
    class Linear {

        @Test
        @DisplayName("2x + 3 = 7 gives x = 2")
        void numeric() {
            var solution = solve("2x + 3 = 7");

            assertThat(solution.kind()).isEqualTo(EquationKind.LINEAR);
            assertThat(solution.solutions()).containsExactly(Expr.num(2));
            assertThat(solution.domain()).isEqualTo("real");
            assertThat(rules(solution)).startsWith("move-to-one-side").endsWith("linear-isolation");
        }

        @Test
        @DisplayName("symbolic coefficients stay symbolic")
        void symbolic() {
            var solution = solve("a*x + b = 0");

            assertThat(solution.kind()).isEqualTo(EquationKind.LINEAR);
            assertThat(solution.solutions()).singleElement().hasToString("-b/a");
        }
    }

    @Nested
    @DisplayName("quadratic")
    class Quadratic {

        @Test
        @DisplayName("two rational roots in ascending order")
        void twoRoots() {
            var solution = solve("x^2 - 5x + 6 = 0");

            assertThat(solution.kind()).isEqualTo(EquationKind.QUADRATIC);
            assertThat(solution.solutions()).containsExactly(Expr.num(2), Expr.num(3));
        }

        @Test
        @DisplayName("a negative discriminant yields no real roots")
        void noRealRoots() {
            var solution = solve("x^2 + 1 = 0");

            assertThat(solution.kind()).isEqualTo(EquationKind.QUADRATIC);
            assertThat(solution.solutions()).isEmpty();
            assertThat(rules(solution)).contains("no-real-roots");
        }

        @Test
        @DisplayName("a zero discriminant repeats the root")
        void repeatedRoot() {
            var solution = solve("x^2 - 2x + 1 = 0");

            assertThat(solution.solutions()).containsExactly(Expr.num(1), Expr.num(1));
            assertThat(rules(solution)).contains("repeated-root");
        }

        @Test
        @DisplayName("irrational roots keep their square root")
        void irrationalRoots() {
            var solution = solve("x^2 = 2");

            assertThat(values(solution)).hasSize(2);
            assertThat(values(solution).get(0)).isCloseTo(-Math.sqrt(2), within(1e-12));
            assertThat(values(solution).get(1)).isCloseTo(Math.sqrt(2), within(1e-12));
            assertThat(solution.solutions()).allSatisfy(root -> assertThat(root.toString()).contains("sqrt"));
        }
    }

    @Nested
    @DisplayName("higher-degree polynomials")
    class Polynomials {

        @Test
        @DisplayName("rational roots and synthetic division solve a cubic")
        void cubic() {
            var solution = solve("x^3 - 6x^2 + 11x - 6 = 0");

            assertThat(solution.kind()).isEqualTo(EquationKind.POLYNOMIAL);
            assertThat(solution.domain()).isEqualTo("real");
            assertThat(solution.solutions()).containsExactly(Expr.num(1), Expr.num(2), Expr.num(3));
            assertThat(rules(solution)).contains("rational-root", "synthetic-division");
        }

        @Test
        @DisplayName("a zero root is found first")
        void zeroRoot() {
            var solution = solve("x^3 = 4x");

            assertThat(values(solution)).containsExactly(-2.0, 0.0, 2.0);
        }

        @Test
        @DisplayName("a cubic with a symbolic coefficient needs a numerical method")
        void symbolicCubic() {
            assertThatThrownBy(() -> solve("x^3 + y = 0"))
                    .isInstanceOf(SolverUnavailableException.class)
                    .hasMessageContaining("coefficient of x^0 is symbolic (y)")
                    .satisfies(e -> assertThat(((SolverUnavailableException) e).reason())
                            .isEqualTo(Reason.NEEDS_NUMERICAL_METHOD));
        }
    }

    @Nested
    @DisplayName("transcendental")
    class Transcendental {

        @Test
        @DisplayName("numeric roots of sin(x) = 0 in the search interval")
        void sine() {
            var solution = solve("sin(x) = 0");

            assertThat(solution.kind()).isEqualTo(EquationKind.TRANSCENDENTAL);
            assertThat(solution.domain()).isEqualTo("real, searched [-10.0, 10.0]");
            var roots = values(solution);
            assertThat(roots).hasSize(7);
            for (int k = -3; k <= 3; k++) {
                assertThat(roots.get(k + 3)).isCloseTo(k * Math.PI, within(1e-7));
            }
            assertThat(rules(solution)).contains("numeric-root");
        }

        @Test
        @DisplayName("disabled fallback needs a numerical method")
        void fallbackDisabled() {
            var config = CasConfig.builder().numericFallback(false).build();

            assertThatThrownBy(() -> solve("sin(x) = 0", config))
                    .isInstanceOf(SolverUnavailableException.class)
                    .satisfies(e -> {
                        var failure = (SolverUnavailableException) e;
                        assertThat(failure.reason()).isEqualTo(Reason.NEEDS_NUMERICAL_METHOD);
                        assertThat(failure.partialSteps()).extracting(Step::rule).startsWith("move-to-one-side");
                    });
        }

        @Test
        @DisplayName("a rational equation is solved numerically under the same kind")
        void rational() {
            var solution = solve("1/x = 2");

            assertThat(solution.kind()).isEqualTo(EquationKind.TRANSCENDENTAL);
            assertThat(values(solution)).singleElement().satisfies(r -> assertThat(r).isCloseTo(0.5, within(1e-9)));
        }

        @Test
        @DisplayName("another free variable rules out a numeric search")
        void otherVariable() {
            assertThatThrownBy(() -> solve("sin(x) = y"))
                    .isInstanceOf(SolverUnavailableException.class)
                    .hasMessageContaining("also depends on y")
                    .satisfies(e -> assertThat(((SolverUnavailableException) e).reason())
                            .isEqualTo(Reason.NEEDS_NUMERICAL_METHOD));
        }

        @Test
        @DisplayName("no root in the interval is unsolved")
        void noRoot() {
            assertThatThrownBy(() -> solve("exp(x) = 0"))
                    .isInstanceOf(SolverUnavailableException.class)
                    .satisfies(e -> assertThat(((SolverUnavailableException) e).reason()).isEqualTo(Reason.UNSOLVED));
        }
    }

    @Test
    @DisplayName("an equation without the variable is unsolved")
    void missingVariable() {
        assertThatThrownBy(() -> solve("y = 3"))
                .isInstanceOf(SolverUnavailableException.class)
                .hasMessageContaining("does not depend on x")
                .satisfies(e -> assertThat(((SolverUnavailableException) e).reason()).isEqualTo(Reason.UNSOLVED));
    }
}
