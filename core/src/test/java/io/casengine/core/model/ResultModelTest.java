package io.casengine.core.model;

import static io.casengine.core.model.Expr.div;
import static io.casengine.core.model.Expr.mul;
import static io.casengine.core.model.Expr.num;
import static io.casengine.core.model.Expr.pow;
import static io.casengine.core.model.Expr.var;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Result records")
class ResultModelTest {

    private static final Expr X = var("x");

    @Nested
    @DisplayName("SeriesExpansion.polynomial")
    class Polynomial {

        @Test
        @DisplayName("joins non-zero terms lowest power first")
        void joinsTerms() {
            var series = series(List.of(num(1), X, mul(div(num(1), num(2)), pow(X, num(2)))));

            assertThat(series.polynomial()).hasToString("1 + x + 1/2*x^2");
        }

        @Test
        @DisplayName("negative terms become subtractions and zero terms are skipped")
        void negativeTerms() {
            var series = series(List.of(num(0), X, num(0), mul(div(num(-1), num(6)), pow(X, num(3)))));

            assertThat(series.polynomial()).hasToString("x - 1/6*x^3");
        }

        @Test
        @DisplayName("all-zero terms give 0")
        void allZero() {
            assertThat(series(List.of(num(0), num(0))).polynomial()).isEqualTo(num(0));
        }

        private SeriesExpansion series(List<Expr> terms) {
            return new SeriesExpansion("f", "x", 0, terms.size() - 1, terms, num(0), Double.POSITIVE_INFINITY);
        }
    }

    @Test
    @DisplayName("EquationSolution.assignments maps system solutions by variable")
    void assignments() {
        var solution = new EquationSolution(
                "x,y",
                List.of(new Expr.Equation(X, num(2)), new Expr.Equation(var("y"), num(1))),
                EquationKind.SYSTEM,
                "real",
                List.of());

        assertThat(solution.assignments()).containsExactly(
                org.assertj.core.api.Assertions.entry("x", num(2)),
                org.assertj.core.api.Assertions.entry("y", num(1)));
    }

    @Test
    @DisplayName("single-equation solutions have no assignments")
    void noAssignmentsForRoots() {
        var solution = new EquationSolution("x", List.of(num(2), num(3)), EquationKind.QUADRATIC, "real", List.of());

        assertThat(solution.assignments()).isEmpty();
    }

    @Test
    @DisplayName("ParseResult keeps variable order and requires an ast when valid")
    void parseResult() {
        var ok = ParseResult.success(X, Set.of("x"), Set.of());
        assertThat(ok.valid()).isTrue();
        assertThat(ParseResult.failure(List.of("bad")).ast()).isNull();
        assertThatThrownBy(() -> new ParseResult(true, null, List.of(), Set.of(), Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("options and bounds validate their inputs")
    void validation() {
        assertThatThrownBy(() -> new SimplifyOptions(0, TargetForm.SIMPLIFIED, Domain.REAL))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxSteps");
        assertThatThrownBy(() -> new DefiniteBounds(0, Double.POSITIVE_INFINITY))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("finite");
        assertThat(SimplifyOptions.DEFAULT.withTargetForm(TargetForm.EXPANDED).maxSteps()).isEqualTo(50);
    }
}
