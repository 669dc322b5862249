package io.casengine.core.engine;

import io.casengine.core.error.NoUniqueSolutionException;
import io.casengine.core.error.SolverUnavailableException;
import io.casengine.core.error.SolverUnavailableException.Reason;
import io.casengine.core.model.Constants;
import io.casengine.core.model.EquationKind;
import io.casengine.core.model.EquationSolution;
import io.casengine.core.model.Expr;
import io.casengine.core.model.Expr.Equation;
import io.casengine.core.model.SimplifyOptions;
import io.casengine.core.model.StepLog;
import io.casengine.core.model.TargetForm;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Solves square systems of linear equations by Gaussian elimination with partial pivoting.
 * Every row swap, elimination and back-substitution is recorded as a step.
 *
 * <p>
 * Thread-safe.
 */
public final class LinearSystemSolver {

    private static final Logger LOG = LoggerFactory.getLogger(LinearSystemSolver.class);

    static final String OPERATION = "solve-system";

    /** Pivots smaller than this mean the system is singular. */
    static final double PIVOT_EPSILON = 1e-9;

    private final Simplifier simplifier;
    private final SimplifyOptions options;
    private final PolynomialExtractor extractor;

    public LinearSystemSolver(Simplifier simplifier, CasConfig config) {
        this.simplifier = simplifier;
        this.options = config.simplifyOptions().withTargetForm(TargetForm.SIMPLIFIED);
        this.extractor = new PolynomialExtractor(simplifier, options);
    }

    /**
     * Solves the system for the given variables.
     *
     * @throws NoUniqueSolutionException if the system is not square or is singular
     * @throws SolverUnavailableException if an equation is not linear in the variables
     */
    public EquationSolution solve(List<Equation> equations, List<String> variables, StepLog log) {
        int n = variables.size();
        if (equations.size() != n) {
            throw new NoUniqueSolutionException(
                    "A unique solution needs as many equations as variables, got " + equations.size()
                            + " equations for " + n + " variables",
                    OPERATION,
                    log.steps());
        }

        double[][] a = new double[n][n];
        double[] b = new double[n];
        for (int i = 0; i < n; i++) {
            Equation eq = equations.get(i);
            Expr normalized = simplifier.simplify(Expr.sub(eq.lhs(), eq.rhs()), options);
            for (int j = 0; j < n; j++) {
                a[i][j] = linearCoefficient(normalized, variables.get(j), variables, log);
            }
            Map<String, Double> zeros = new HashMap<>();
            variables.forEach(v -> zeros.put(v, 0.0));
            OptionalDouble constant = NumericEvaluator.tryEvaluate(normalized, zeros);
            if (constant.isEmpty()) {
                throw notLinear(normalized, log);
            }
            b[i] = -constant.getAsDouble();
            log.record(OPERATION, eq, row(a[i], b[i], variables), "coefficient-extraction",
                    "Write equation " + (i + 1) + " as a row of coefficients");
        }

        for (int k = 0; k < n; k++) {
            int pivot = k;
            for (int i = k + 1; i < n; i++) {
                if (Math.abs(a[i][k]) > Math.abs(a[pivot][k])) {
                    pivot = i;
                }
            }
            if (Math.abs(a[pivot][k]) < PIVOT_EPSILON) {
                LOG.debug("solve-system.singular column={} pivot={}", k, a[pivot][k]);
                throw new NoUniqueSolutionException(
                        "The system is singular: no usable pivot for " + variables.get(k),
                        OPERATION,
                        log.steps());
            }
            if (pivot != k) {
                double[] rowTmp = a[k];
                a[k] = a[pivot];
                a[pivot] = rowTmp;
                double bTmp = b[k];
                b[k] = b[pivot];
                b[pivot] = bTmp;
                log.record(OPERATION, row(a[pivot], b[pivot], variables), row(a[k], b[k], variables), "row-swap",
                        "Swap rows " + (k + 1) + " and " + (pivot + 1) + " to use the largest pivot");
            }
            for (int i = k + 1; i < n; i++) {
                double factor = a[i][k] / a[k][k];
                if (factor == 0) {
                    continue;
                }
                Expr before = row(a[i], b[i], variables);
                for (int j = k; j < n; j++) {
                    a[i][j] -= factor * a[k][j];
                }
                a[i][k] = 0;
                b[i] -= factor * b[k];
                log.record(OPERATION, before, row(a[i], b[i], variables), "elimination",
                        "Subtract " + format(factor) + " times row " + (k + 1) + " from row " + (i + 1));
            }
        }

        double[] x = new double[n];
        for (int i = n - 1; i >= 0; i--) {
            double sum = b[i];
            for (int j = i + 1; j < n; j++) {
                sum -= a[i][j] * x[j];
            }
            x[i] = sum / a[i][i];
            log.record(OPERATION, row(a[i], b[i], variables), assignment(variables.get(i), x[i]),
                    "back-substitution", "Solve row " + (i + 1) + " for " + variables.get(i));
        }

        List<Expr> solutions = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            solutions.add(assignment(variables.get(i), x[i]));
        }
        return new EquationSolution(String.join(",", variables), solutions, EquationKind.SYSTEM, "real", log.steps());
    }

    private double linearCoefficient(Expr normalized, String variable, List<String> variables, StepLog log) {
        Optional<Map<Integer, Expr>> coefficients = extractor.coefficients(normalized, variable);
        if (coefficients.isEmpty() || PolynomialExtractor.degree(coefficients.get()) > 1) {
            throw notLinear(normalized, log);
        }
        Expr c = PolynomialExtractor.coefficient(coefficients.get(), 1);
        OptionalDouble v = Constants.valueOf(c);
        if (v.isEmpty()) {
            // a coefficient mentioning another unknown is a product of unknowns
            throw notLinear(normalized, log);
        }
        return v.getAsDouble();
    }

    private static SolverUnavailableException notLinear(Expr normalized, StepLog log) {
        return new SolverUnavailableException(
                "Equation is not linear in the system variables: " + normalized + " = 0",
                Reason.UNSOLVED,
                OPERATION,
                log.steps());
    }

    private static Equation assignment(String variable, double value) {
        double nearest = Math.rint(value);
        double cleaned = Math.abs(value - nearest) < PIVOT_EPSILON ? nearest : value;
        return new Equation(Expr.var(variable), Constants.constant(cleaned));
    }

    /** A row as {@code a1*x + a2*y + ... = b}. */
    private static Equation row(double[] coefficients, double rhs, List<String> variables) {
        Expr lhs = null;
        for (int j = 0; j < coefficients.length; j++) {
            double c = coefficients[j];
            if (c == 0) {
                continue;
            }
            Expr v = Expr.var(variables.get(j));
            if (lhs == null) {
                lhs = term(c, v);
            } else if (c < 0) {
                lhs = Expr.sub(lhs, term(-c, v));
            } else {
                lhs = Expr.add(lhs, term(c, v));
            }
        }
        return new Equation(lhs == null ? Expr.num(0) : lhs, Constants.constant(rhs));
    }

    private static Expr term(double c, Expr v) {
        if (c == 1) {
            return v;
        }
        if (c == -1) {
            return Expr.neg(v);
        }
        return Expr.mul(Constants.constant(c), v);
    }

    private static String format(double value) {
        return Constants.constant(value).toString();
    }
}
