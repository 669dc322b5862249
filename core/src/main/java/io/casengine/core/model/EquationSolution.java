package io.casengine.core.model;

import io.casengine.core.model.Expr.Equation;
import io.casengine.core.model.Expr.Var;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Solutions of an equation or a linear system.
 *
 * <p>
 * For {@link EquationKind#SYSTEM} each solution is an {@code Equation(Var(v), value)} node and
 * {@code variable} is the comma-joined variable list. For a single equation the solutions are the
 * root expressions; an empty list means no real roots exist.
 *
 * @param variable  solved-for variable (or comma-joined list for systems)
 * @param solutions root expressions, or assignments for systems
 * @param kind      classification
 * @param domain    domain the solutions were sought in, e.g. {@code "real"}
 * @param steps     ordered step trace
 */
public record EquationSolution(
        String variable, List<Expr> solutions, EquationKind kind, String domain, List<Step> steps) {

    public EquationSolution {
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(domain, "domain must not be null");
        solutions = List.copyOf(solutions);
        steps = List.copyOf(steps);
    }

    /**
     * Variable assignments of a system solution, in variable order. Empty for single-equation
     * results.
     */
    public Map<String, Expr> assignments() {
        Map<String, Expr> out = new LinkedHashMap<>();
        for (Expr s : solutions) {
            if (s instanceof Equation eq && eq.lhs() instanceof Var v) {
                out.put(v.name(), eq.rhs());
            }
        }
        return out;
    }
}
