package io.casengine.core.engine;

import static io.casengine.core.model.Expr.call;
import static io.casengine.core.model.Expr.div;
import static io.casengine.core.model.Expr.mul;
import static io.casengine.core.model.Expr.neg;
import static io.casengine.core.model.Expr.num;
import static io.casengine.core.model.Expr.pow;
import static io.casengine.core.model.Expr.sub;

import io.casengine.core.error.SolverUnavailableException;
import io.casengine.core.error.SolverUnavailableException.Reason;
import io.casengine.core.model.Constants;
import io.casengine.core.model.Expr;
import io.casengine.core.model.Expr.Equation;
import io.casengine.core.model.EquationKind;
import io.casengine.core.model.EquationSolution;
import io.casengine.core.model.MathFunctions;
import io.casengine.core.model.SimplifyOptions;
import io.casengine.core.model.StepLog;
import io.casengine.core.model.TargetForm;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies and solves a single equation in one variable.
 *
 * <p>
 * The equation is moved to one side ({@code lhs - rhs = 0}) and simplified. A polynomial of
 * degree 1 or 2 is solved in closed form (symbolic coefficients allowed). Higher degrees with
 * integer coefficients try the rational root theorem, deflating by synthetic division until a
 * quadratic remains. Anything else, including functions of the variable, falls back to numeric
 * root finding over the configured interval when the config allows it.
 *
 * <p>
 * Thread-safe.
 */
public final class EquationSolver {

    private static final Logger LOG = LoggerFactory.getLogger(EquationSolver.class);

    static final String OPERATION = "solve";

    /** Discriminants within this distance of zero count as zero. */
    static final double DISCRIMINANT_EPSILON = 1e-12;

    private static final int MAX_RATIONAL_CANDIDATE = 100_000;

    private final Simplifier simplifier;
    private final CasConfig config;
    private final SimplifyOptions options;
    private final PolynomialExtractor extractor;

    public EquationSolver(Simplifier simplifier, CasConfig config) {
        this.simplifier = simplifier;
        this.config = config;
        this.options = config.simplifyOptions().withTargetForm(TargetForm.SIMPLIFIED);
        this.extractor = new PolynomialExtractor(simplifier, options);
    }

    /**
     * Solves {@code equation} for {@code variable}.
     *
     * @throws SolverUnavailableException if the equation has no solvable dependency on the
     *     variable, or only a numeric method could solve it and that is disabled or finds nothing
     */
    public EquationSolution solve(Equation equation, String variable, StepLog log) {
        Expr moved = sub(equation.lhs(), equation.rhs());
        log.record(OPERATION, equation, moved, "move-to-one-side", "Subtract the right-hand side from both sides");
        Expr normalized = simplifier.simplify(moved, options, log).result();

        if (!normalized.contains(variable)) {
            throw new SolverUnavailableException(
                    "Equation does not depend on " + variable + " after simplification: " + normalized + " = 0",
                    Reason.UNSOLVED,
                    OPERATION,
                    log.steps());
        }

        Optional<Map<Integer, Expr>> polynomial = extractor.coefficients(normalized, variable);
        if (polynomial.isEmpty()) {
            List<Expr> roots = numericRoots(normalized, variable, log, EquationKind.TRANSCENDENTAL);
            return solution(variable, roots, EquationKind.TRANSCENDENTAL, searchedDomain(), log);
        }

        Map<Integer, Expr> coefficients = polynomial.get();
        int degree = PolynomialExtractor.degree(coefficients);
        LOG.debug("solve.classify variable={} degree={} expression={}", variable, degree, normalized);
        return switch (degree) {
            case 0 -> throw new SolverUnavailableException(
                    "Equation has no dependency on " + variable + ": " + normalized + " = 0",
                    Reason.UNSOLVED,
                    OPERATION,
                    log.steps());
            case 1 -> solution(
                    variable,
                    List.of(linear(coefficients, variable, normalized, log)),
                    EquationKind.LINEAR,
                    "real",
                    log);
            case 2 -> solution(
                    variable, quadratic(coefficients, normalized, log), EquationKind.QUADRATIC, "real", log);
            default -> polynomial(variable, coefficients, normalized, log);
        };
    }

    private Expr linear(Map<Integer, Expr> c, String variable, Expr normalized, StepLog log) {
        Expr a = PolynomialExtractor.coefficient(c, 1);
        Expr b = PolynomialExtractor.coefficient(c, 0);
        Expr root = simplifier.simplify(div(neg(b), a), options);
        log.record(
                OPERATION,
                normalized,
                new Equation(Expr.var(variable), root),
                "linear-isolation",
                "For a*x + b = 0, x = -b/a");
        return root;
    }

    private List<Expr> quadratic(Map<Integer, Expr> c, Expr normalized, StepLog log) {
        Expr a = PolynomialExtractor.coefficient(c, 2);
        Expr b = PolynomialExtractor.coefficient(c, 1);
        Expr k = PolynomialExtractor.coefficient(c, 0);
        OptionalDouble av = Constants.valueOf(a);
        OptionalDouble bv = Constants.valueOf(b);
        OptionalDouble kv = Constants.valueOf(k);

        if (av.isPresent() && bv.isPresent() && kv.isPresent()) {
            return numericQuadratic(av.getAsDouble(), bv.getAsDouble(), kv.getAsDouble(), normalized, log);
        }

        Expr discriminant = simplifier.simplify(sub(pow(b, num(2)), mul(mul(num(4), a), k)), options);
        log.record(OPERATION, normalized, discriminant, "discriminant", "D = b^2 - 4*a*c");
        Expr sqrtD = call("sqrt", discriminant);
        Expr twoA = mul(num(2), a);
        Expr minus = simplifier.simplify(div(sub(neg(b), sqrtD), twoA), options);
        Expr plus = simplifier.simplify(div(Expr.add(neg(b), sqrtD), twoA), options);
        log.record(OPERATION, normalized, minus, "quadratic-formula", "x = (-b - sqrt(D))/(2*a)");
        log.record(OPERATION, normalized, plus, "quadratic-formula", "x = (-b + sqrt(D))/(2*a)");
        return List.of(minus, plus);
    }

    private List<Expr> numericQuadratic(double a, double b, double c, Expr normalized, StepLog log) {
        double d = b * b - 4 * a * c;
        log.record(OPERATION, normalized, Constants.constant(d), "discriminant", "D = b^2 - 4*a*c");
        if (d < -DISCRIMINANT_EPSILON) {
            log.record(
                    OPERATION,
                    normalized,
                    Constants.constant(d),
                    "no-real-roots",
                    "The discriminant is negative, so there are no real roots");
            return List.of();
        }
        if (Math.abs(d) <= DISCRIMINANT_EPSILON) {
            Expr root = Constants.constant(-b / (2 * a));
            log.record(OPERATION, normalized, root, "repeated-root", "D = 0, so x = -b/(2*a) is a double root");
            return List.of(root, root);
        }
        Expr minus;
        Expr plus;
        if (Constants.exact(Math.sqrt(d)).isPresent()) {
            minus = Constants.constant((-b - Math.sqrt(d)) / (2 * a));
            plus = Constants.constant((-b + Math.sqrt(d)) / (2 * a));
        } else {
            Expr sqrtD = call("sqrt", Constants.constant(d));
            Expr twoA = Constants.constant(2 * a);
            minus = simplifier.simplify(div(sub(Constants.constant(-b), sqrtD), twoA), options);
            plus = simplifier.simplify(div(Expr.add(Constants.constant(-b), sqrtD), twoA), options);
        }
        log.record(OPERATION, normalized, minus, "quadratic-formula", "x = (-b - sqrt(D))/(2*a)");
        log.record(OPERATION, normalized, plus, "quadratic-formula", "x = (-b + sqrt(D))/(2*a)");
        return List.of(minus, plus);
    }

    private EquationSolution polynomial(
            String variable, Map<Integer, Expr> coefficients, Expr normalized, StepLog log) {
        int degree = PolynomialExtractor.degree(coefficients);
        double[] poly = integerCoefficients(coefficients, degree);
        if (poly == null) {
            for (int i = degree; i >= 0; i--) {
                Expr c = PolynomialExtractor.coefficient(coefficients, i);
                Optional<String> symbol = freeSymbol(c, variable);
                if (symbol.isPresent()) {
                    throw new SolverUnavailableException(
                            "No closed form for degree " + degree + " and the coefficient of " + variable + "^" + i
                                    + " is symbolic (" + c + "), so the roots cannot be searched numerically",
                            Reason.NEEDS_NUMERICAL_METHOD,
                            OPERATION,
                            log.steps());
                }
            }
            List<Expr> roots = numericRoots(normalized, variable, log, EquationKind.POLYNOMIAL);
            return solution(variable, roots, EquationKind.POLYNOMIAL, searchedDomain(), log);
        }

        List<Expr> roots = new ArrayList<>();
        // poly[i] is the coefficient of x^i
        while (poly.length - 1 > 2) {
            OptionalDouble root = rationalRoot(poly);
            if (root.isEmpty()) {
                break;
            }
            double r = root.getAsDouble();
            Expr rootExpr = Constants.constant(r);
            log.record(OPERATION, normalized, rootExpr, "rational-root", "p/q is a root, with p dividing the "
                    + "constant term and q dividing the leading coefficient");
            poly = syntheticDivision(poly, r);
            log.record(
                    OPERATION,
                    normalized,
                    toExpr(poly, variable),
                    "synthetic-division",
                    "Divide by (" + variable + " - " + rootExpr + ") to lower the degree");
            roots.add(rootExpr);
        }

        Expr remaining = toExpr(poly, variable);
        int remainingDegree = poly.length - 1;
        if (remainingDegree == 2) {
            roots.addAll(numericQuadratic(poly[2], poly[1], poly[0], remaining, log));
        } else if (remainingDegree == 1) {
            Expr root = Constants.constant(-poly[0] / poly[1]);
            log.record(OPERATION, remaining, root, "linear-isolation", "For a*x + b = 0, x = -b/a");
            roots.add(root);
        } else if (remainingDegree > 2) {
            roots.addAll(numericRoots(remaining, variable, log, EquationKind.POLYNOMIAL));
            sortNumeric(roots);
            return solution(variable, roots, EquationKind.POLYNOMIAL, searchedDomain(), log);
        }
        sortNumeric(roots);
        return solution(variable, roots, EquationKind.POLYNOMIAL, "real", log);
    }

    private List<Expr> numericRoots(Expr f, String variable, StepLog log, EquationKind kind) {
        Optional<String> symbol = freeSymbol(f, variable);
        if (symbol.isPresent()) {
            throw new SolverUnavailableException(
                    "No closed-form solution for " + f + " = 0 and it also depends on " + symbol.get()
                            + ", so the roots cannot be searched numerically",
                    Reason.NEEDS_NUMERICAL_METHOD,
                    OPERATION,
                    log.steps());
        }
        if (!config.numericFallback()) {
            throw new SolverUnavailableException(
                    "No closed-form solution for " + f + " = 0 and numeric fallback is disabled",
                    Reason.NEEDS_NUMERICAL_METHOD,
                    OPERATION,
                    log.steps());
        }
        RootFinder finder = new RootFinder(config.rootSearchMin(), config.rootSearchMax(), config.rootSearchSamples());
        List<Double> found = finder.findRoots(x -> NumericEvaluator.at(f, variable, x));
        if (found.isEmpty()) {
            throw new SolverUnavailableException(
                    "No real root of " + f + " = 0 found in " + searchedInterval(),
                    Reason.UNSOLVED,
                    OPERATION,
                    log.steps());
        }
        List<Expr> roots = new ArrayList<>();
        for (double r : found) {
            Expr root = Constants.constant(r);
            log.record(OPERATION, f, root, "numeric-root", "Bracketed a sign change and refined it by bisection");
            roots.add(root);
        }
        LOG.debug("solve.numeric kind={} roots={} interval={}", kind, found.size(), searchedInterval());
        return roots;
    }

    /** First variable other than {@code variable} and the named constants, if any. */
    private static Optional<String> freeSymbol(Expr expr, String variable) {
        if (expr instanceof Expr.Var v) {
            return v.name().equals(variable) || MathFunctions.CONSTANTS.contains(v.name())
                    ? Optional.empty()
                    : Optional.of(v.name());
        }
        for (Expr child : expr.children()) {
            Optional<String> found = freeSymbol(child, variable);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /** Coefficients low-to-high if all are integers, otherwise null. */
    private static double[] integerCoefficients(Map<Integer, Expr> coefficients, int degree) {
        double[] out = new double[degree + 1];
        for (int i = 0; i <= degree; i++) {
            OptionalDouble v = Constants.valueOf(PolynomialExtractor.coefficient(coefficients, i));
            if (v.isEmpty() || !Constants.isInteger(v.getAsDouble())) {
                return null;
            }
            out[i] = v.getAsDouble();
        }
        return out;
    }

    private static OptionalDouble rationalRoot(double[] poly) {
        if (poly[0] == 0) {
            return OptionalDouble.of(0);
        }
        long constant = Math.abs((long) poly[0]);
        long leading = Math.abs((long) poly[poly.length - 1]);
        if (constant > MAX_RATIONAL_CANDIDATE || leading > MAX_RATIONAL_CANDIDATE) {
            return OptionalDouble.empty();
        }
        for (long p : divisors(constant)) {
            for (long q : divisors(leading)) {
                for (int sign : new int[] {1, -1}) {
                    double candidate = sign * (double) p / q;
                    if (Math.abs(evaluate(poly, candidate)) < 1e-9) {
                        return OptionalDouble.of(candidate);
                    }
                }
            }
        }
        return OptionalDouble.empty();
    }

    private static List<Long> divisors(long n) {
        List<Long> out = new ArrayList<>();
        for (long d = 1; d <= n; d++) {
            if (n % d == 0) {
                out.add(d);
            }
        }
        return out;
    }

    private static double evaluate(double[] poly, double x) {
        double acc = 0;
        for (int i = poly.length - 1; i >= 0; i--) {
            acc = acc * x + poly[i];
        }
        return acc;
    }

    /** Divides by {@code (x - r)}; the remainder is dropped because r is a root. */
    static double[] syntheticDivision(double[] poly, double r) {
        int n = poly.length - 1;
        double[] quotient = new double[n];
        double carry = 0;
        for (int i = n; i >= 1; i--) {
            carry = poly[i] + carry * r;
            quotient[i - 1] = carry;
        }
        return quotient;
    }

    private Expr toExpr(double[] poly, String variable) {
        Expr acc = null;
        for (int i = poly.length - 1; i >= 0; i--) {
            if (poly[i] == 0) {
                continue;
            }
            Expr power = i == 0 ? null : i == 1 ? Expr.var(variable) : pow(Expr.var(variable), num(i));
            Expr term = power == null ? Constants.constant(poly[i]) : mul(Constants.constant(poly[i]), power);
            acc = acc == null ? term : Expr.add(acc, term);
        }
        return acc == null ? num(0) : simplifier.simplify(acc, options);
    }

    private static void sortNumeric(List<Expr> roots) {
        if (roots.stream().allMatch(Constants::isConstant)) {
            roots.sort((a, b) -> Double.compare(
                    Constants.valueOf(a).getAsDouble(), Constants.valueOf(b).getAsDouble()));
        }
    }

    private String searchedDomain() {
        return "real, searched " + searchedInterval();
    }

    private String searchedInterval() {
        return "[" + config.rootSearchMin() + ", " + config.rootSearchMax() + "]";
    }

    private static EquationSolution solution(
            String variable, List<Expr> roots, EquationKind kind, String domain, StepLog log) {
        return new EquationSolution(variable, roots, kind, domain, log.steps());
    }
}
