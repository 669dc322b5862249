package io.casengine.core.engine;

import io.casengine.core.model.Constants;
import io.casengine.core.model.Expr;
import io.casengine.core.model.Expr.BinaryOp;
import io.casengine.core.model.Expr.Equation;
import io.casengine.core.model.Expr.Var;
import io.casengine.core.model.Operator;
import io.casengine.core.model.SimplifyOptions;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Reads an expression as a polynomial in one variable. Coefficients may be symbolic as long as
 * they are free of that variable. Used by the equation solver, the linear-system solver and the
 * integrator's linear-argument rules.
 */
final class PolynomialExtractor {

    /** Highest integer power of a sum that is multiplied out. */
    static final int MAX_POWER = 32;

    private final Simplifier simplifier;
    private final SimplifyOptions options;

    PolynomialExtractor(Simplifier simplifier, SimplifyOptions options) {
        this.simplifier = simplifier;
        this.options = options;
    }

    /**
     * Coefficients by degree, simplified, with zero coefficients dropped. An empty map is the zero
     * polynomial. Empty optional if {@code expr} is not a polynomial in {@code variable}.
     */
    Optional<Map<Integer, Expr>> coefficients(Expr expr, String variable) {
        Map<Integer, Expr> raw = extract(expr, variable);
        if (raw == null) {
            return Optional.empty();
        }
        Map<Integer, Expr> out = new TreeMap<>();
        raw.forEach((degree, coefficient) -> {
            Expr c = simplifier.simplify(coefficient, options);
            if (!Constants.isNumber(c, 0)) {
                out.put(degree, c);
            }
        });
        return Optional.of(out);
    }

    /** Highest key, or 0 for the zero polynomial. */
    static int degree(Map<Integer, Expr> coefficients) {
        int degree = 0;
        for (int k : coefficients.keySet()) {
            degree = Math.max(degree, k);
        }
        return degree;
    }

    static Expr coefficient(Map<Integer, Expr> coefficients, int degree) {
        return coefficients.getOrDefault(degree, Expr.num(0));
    }

    private static Map<Integer, Expr> extract(Expr expr, String variable) {
        if (expr instanceof Equation) {
            return null;
        }
        if (!expr.contains(variable)) {
            return single(0, expr);
        }
        if (expr instanceof Var) {
            return single(1, Expr.num(1));
        }
        if (!(expr instanceof BinaryOp b)) {
            // a function of the variable
            return null;
        }
        Map<Integer, Expr> left;
        Map<Integer, Expr> right;
        switch (b.op()) {
            case ADD, SUB -> {
                left = extract(b.left(), variable);
                right = extract(b.right(), variable);
                if (left == null || right == null) {
                    return null;
                }
                Map<Integer, Expr> sum = new TreeMap<>(left);
                right.forEach((k, v) -> {
                    Expr existing = sum.get(k);
                    if (b.op() == Operator.ADD) {
                        sum.put(k, existing == null ? v : Expr.add(existing, v));
                    } else {
                        sum.put(k, existing == null ? Expr.neg(v) : Expr.sub(existing, v));
                    }
                });
                return sum;
            }
            case MUL -> {
                left = extract(b.left(), variable);
                right = extract(b.right(), variable);
                if (left == null || right == null) {
                    return null;
                }
                return multiply(left, right);
            }
            case DIV -> {
                if (b.right().contains(variable)) {
                    return null;
                }
                left = extract(b.left(), variable);
                if (left == null) {
                    return null;
                }
                Map<Integer, Expr> quotient = new TreeMap<>();
                left.forEach((k, v) -> quotient.put(k, Expr.div(v, b.right())));
                return quotient;
            }
            case POW -> {
                OptionalDouble n = Constants.valueOf(b.right());
                if (n.isEmpty()
                        || !Constants.isInteger(n.getAsDouble())
                        || n.getAsDouble() < 0
                        || n.getAsDouble() > MAX_POWER) {
                    return null;
                }
                Map<Integer, Expr> base = extract(b.left(), variable);
                if (base == null) {
                    return null;
                }
                Map<Integer, Expr> result = single(0, Expr.num(1));
                for (int i = 0; i < (int) n.getAsDouble(); i++) {
                    result = multiply(result, base);
                }
                return result;
            }
            default -> {
                return null;
            }
        }
    }

    private static Map<Integer, Expr> multiply(Map<Integer, Expr> a, Map<Integer, Expr> b) {
        Map<Integer, Expr> out = new TreeMap<>();
        a.forEach((i, x) -> b.forEach((j, y) -> {
            Expr term = Expr.mul(x, y);
            out.merge(i + j, term, Expr::add);
        }));
        return out;
    }

    private static Map<Integer, Expr> single(int degree, Expr coefficient) {
        Map<Integer, Expr> out = new TreeMap<>();
        out.put(degree, coefficient);
        return out;
    }
}
