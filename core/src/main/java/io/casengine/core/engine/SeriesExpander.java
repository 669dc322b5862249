package io.casengine.core.engine;

import io.casengine.core.error.NumericEvaluationException;
import io.casengine.core.model.Constants;
import io.casengine.core.model.Expr;
import io.casengine.core.model.SeriesExpansion;
import io.casengine.core.model.SimplifyOptions;
import io.casengine.core.model.StepLog;
import io.casengine.core.model.TargetForm;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Truncated Taylor expansion around a point.
 *
 * <p>
 * The n-th derivative is built from the (n-1)-th and simplified before it is evaluated at the
 * center, so the trees stay small. The term after the last requested one is kept as the
 * remainder. The convergence radius is a ratio-test estimate over consecutive non-zero
 * coefficients, not a proof.
 *
 * <p>
 * Thread-safe.
 */
public final class SeriesExpander {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesExpander.class);

    static final String OPERATION = "series";

    /** Coefficients at or below this magnitude count as zero. */
    static final double ZERO_COEFFICIENT = 1e-12;

    private final Simplifier simplifier;
    private final Differentiator differentiator;
    private final SimplifyOptions options;

    public SeriesExpander(Simplifier simplifier, Differentiator differentiator, CasConfig config) {
        this.simplifier = Objects.requireNonNull(simplifier, "simplifier must not be null");
        this.differentiator = Objects.requireNonNull(differentiator, "differentiator must not be null");
        this.options = config.simplifyOptions().withTargetForm(TargetForm.SIMPLIFIED);
    }

    /**
     * Expands {@code expr} in {@code variable} around {@code center} up to power {@code order}.
     *
     * @throws IllegalArgumentException if {@code order} is negative
     * @throws NumericEvaluationException if a derivative has no finite value at {@code center}
     */
    public SeriesExpansion expand(String source, Expr expr, String variable, double center, int order, StepLog log) {
        if (order < 0) {
            throw new IllegalArgumentException("order must not be negative, got: " + order);
        }
        if (!Double.isFinite(center)) {
            throw new IllegalArgumentException("center must be finite, got: " + center);
        }

        double[] coefficients = new double[order + 2];
        List<Expr> terms = new ArrayList<>(order + 1);
        Expr remainder = null;
        Expr derivative = simplifier.simplify(expr, options);
        double factorial = 1;
        for (int n = 0; n <= order + 1; n++) {
            if (n > 0) {
                factorial *= n;
                derivative = simplifier.simplify(differentiator.derivative(derivative, variable, new StepLog()), options);
            }
            double value = NumericEvaluator.at(derivative, variable, center);
            if (!Double.isFinite(value)) {
                throw new NumericEvaluationException(
                        "Derivative " + n + " of " + expr + " has no finite value at " + variable + " = "
                                + Constants.constant(center),
                        OPERATION,
                        log.steps());
            }
            coefficients[n] = value / factorial;
            Expr term = term(coefficients[n], variable, center, n);
            if (n <= order) {
                terms.add(term);
                log.record(OPERATION, derivative, term, "taylor-term",
                        "f^(" + n + ")(" + Constants.constant(center) + ")/" + n + "! * (" + displacement(variable, center)
                                + ")^" + n);
            } else {
                remainder = term;
            }
        }

        // a derivative that is identically zero ends the series: it is a polynomial
        boolean terminates = Constants.isNumber(derivative, 0);
        double radius = terminates ? Double.POSITIVE_INFINITY : radius(coefficients);
        LOG.debug("series.expanded variable={} center={} order={} radius={}", variable, center, order, radius);
        return new SeriesExpansion(source, variable, center, order, terms, remainder, radius);
    }

    private Expr term(double coefficient, String variable, double center, int power) {
        if (Math.abs(coefficient) <= ZERO_COEFFICIENT) {
            return Expr.num(0);
        }
        Expr c = Constants.constant(coefficient);
        if (power == 0) {
            return c;
        }
        Expr base = displacement(variable, center);
        Expr powered = power == 1 ? base : Expr.pow(base, Expr.num(power));
        return simplifier.simplify(Expr.mul(c, powered), options);
    }

    private static Expr displacement(String variable, double center) {
        Expr x = Expr.var(variable);
        if (center == 0) {
            return x;
        }
        return center > 0 ? Expr.sub(x, Constants.constant(center)) : Expr.add(x, Constants.constant(-center));
    }

    /**
     * Estimates {@code |c_j / c_k|^(1/(k-j))} for consecutive non-zero coefficients. Estimates
     * that keep growing by a steady or increasing amount mean the radius is unbounded; otherwise
     * the last estimate is used.
     */
    static double radius(double[] coefficients) {
        List<Double> estimates = new ArrayList<>();
        int previous = -1;
        for (int k = 0; k < coefficients.length; k++) {
            if (Math.abs(coefficients[k]) <= ZERO_COEFFICIENT) {
                continue;
            }
            if (previous >= 0) {
                double ratio = Math.abs(coefficients[previous] / coefficients[k]);
                estimates.add(Math.pow(ratio, 1.0 / (k - previous)));
            }
            previous = k;
        }
        if (estimates.isEmpty()) {
            return Double.POSITIVE_INFINITY;
        }
        if (estimates.size() >= 2 && growsWithoutBound(estimates)) {
            return Double.POSITIVE_INFINITY;
        }
        return estimates.get(estimates.size() - 1);
    }

    private static boolean growsWithoutBound(List<Double> estimates) {
        double lastIncrement = 0;
        for (int i = 1; i < estimates.size(); i++) {
            double increment = estimates.get(i) - estimates.get(i - 1);
            if (increment <= 0) {
                return false;
            }
            if (i > 1 && increment < 0.9 * lastIncrement) {
                return false;
            }
            lastIncrement = increment;
        }
        return true;
    }
}
