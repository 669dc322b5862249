package io.casengine.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import io.casengine.core.error.NoUniqueSolutionException;
import io.casengine.core.error.SolverUnavailableException;
import io.casengine.core.model.EquationKind;
import io.casengine.core.model.EquationSolution;
import io.casengine.core.model.Expr;
import io.casengine.core.model.Expr.Equation;
import io.casengine.core.model.Step;
import io.casengine.core.model.StepLog;
import io.casengine.core.parser.RecursiveDescentParser;
import io.casengine.core.rules.RuleRegistry;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link LinearSystemSolver}. */
@DisplayName("LinearSystemSolver")
class LinearSystemSolverTest {

    private final LinearSystemSolver solver =
            new LinearSystemSolver(new Simplifier(RuleRegistry.standard()), CasConfig.DEFAULT);
    private final RecursiveDescentParser parser = new RecursiveDescentParser();

    private EquationSolution solve(List<String> variables, String... equations) {
        List<Equation> parsed = Arrays.stream(equations)
                .map(text -> (Equation) parser.parse(text).ast())
                .toList();
        return solver.solve(parsed, variables, new StepLog());
    }

    @Test
    @DisplayName("solves a 2x2 system")
    void twoByTwo() {
        var solution = solve(List.of("x", "y"), "x + y = 3", "x - y = 1");

        assertThat(solution.kind()).isEqualTo(EquationKind.SYSTEM);
        assertThat(solution.variable()).isEqualTo("x,y");
        assertThat(solution.assignments()).containsExactly(entry("x", Expr.num(2)), entry("y", Expr.num(1)));
        assertThat(solution.solutions()).first().hasToString("x = 2");
    }

    @Test
    @DisplayName("2x + y = 5 and x - y = 1 give x = 2, y = 1")
    void eliminationWithFractionalFactor() {
        var solution = solve(List.of("x", "y"), "2x + y = 5", "x - y = 1");

        assertThat(solution.assignments()).containsExactly(entry("x", Expr.num(2)), entry("y", Expr.num(1)));
    }

    @Test
    @DisplayName("assignments follow the requested variable order")
    void variableOrder() {
        var solution = solve(List.of("y", "x"), "x + y = 3", "x - y = 1");

        assertThat(solution.assignments()).containsExactly(entry("y", Expr.num(1)), entry("x", Expr.num(2)));
    }

    @Test
    @DisplayName("solves a 3x3 system with pivoting")
    void threeByThree() {
        var solution = solve(List.of("x", "y", "z"), "x + y + z = 6", "2y + 5z = -4", "2x + 5y - z = 27");

        assertThat(solution.assignments())
                .containsExactly(entry("x", Expr.num(5)), entry("y", Expr.num(3)), entry("z", Expr.num(-2)));
        assertThat(solution.steps())
                .extracting(Step::rule)
                .contains("coefficient-extraction", "elimination", "back-substitution");
    }

    @Test
    @DisplayName("a singular system has no unique solution")
    void singular() {
        assertThatThrownBy(() -> solve(List.of("x", "y"), "x + y = 2", "2x + 2y = 4"))
                .isInstanceOf(NoUniqueSolutionException.class)
                .hasMessageContaining("singular");
    }

    @Test
    @DisplayName("a non-square system has no unique solution")
    void nonSquare() {
        assertThatThrownBy(() -> solve(List.of("x", "y"), "x + y = 2"))
                .isInstanceOf(NoUniqueSolutionException.class)
                .hasMessageContaining("1 equations for 2 variables");
    }

    @Test
    @DisplayName("a product of unknowns is not linear")
    void nonlinear() {
        assertThatThrownBy(() -> solve(List.of("x", "y"), "x*y = 1", "x + y = 2"))
                .isInstanceOf(SolverUnavailableException.class)
                .hasMessageContaining("not linear");
    }
}
