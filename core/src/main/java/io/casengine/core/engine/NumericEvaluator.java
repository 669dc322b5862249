package io.casengine.core.engine;

import io.casengine.core.error.NumericEvaluationException;
import io.casengine.core.model.Expr;
import io.casengine.core.model.Expr.BinaryOp;
import io.casengine.core.model.Expr.Call;
import io.casengine.core.model.Expr.Num;
import io.casengine.core.model.Expr.Var;
import io.casengine.core.model.MathFunctions;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Evaluates an expression tree to a double. Variables are looked up in a binding map; the
 * constants {@code pi} and {@code e} are always bound. Stateless and thread-safe.
 */
public final class NumericEvaluator {

    private NumericEvaluator() {}

    /**
     * Evaluates {@code expr} with the given bindings.
     *
     * @throws NumericEvaluationException if a variable is unbound, a function is unknown, or the
     *     value is not finite
     */
    public static double evaluate(Expr expr, Map<String, Double> bindings) {
        double v = eval(expr, bindings);
        if (!Double.isFinite(v)) {
            throw new NumericEvaluationException(
                    "Expression has no finite value: " + expr + " with " + bindings, "evaluate", List.of());
        }
        return v;
    }

    /** Like {@link #evaluate} but returns empty instead of throwing. */
    public static OptionalDouble tryEvaluate(Expr expr, Map<String, Double> bindings) {
        try {
            return OptionalDouble.of(evaluate(expr, bindings));
        } catch (NumericEvaluationException e) {
            return OptionalDouble.empty();
        }
    }

    /** Value of a closed expression, or empty if it has free variables or no finite value. */
    public static OptionalDouble tryEvaluate(Expr expr) {
        return tryEvaluate(expr, Map.of());
    }

    /** Evaluates {@code expr} at {@code variable = x}; NaN when undefined. */
    static double at(Expr expr, String variable, double x) {
        try {
            return eval(expr, Map.of(variable, x));
        } catch (NumericEvaluationException e) {
            return Double.NaN;
        }
    }

    private static double eval(Expr expr, Map<String, Double> bindings) {
        if (expr instanceof Num n) {
            return n.value();
        }
        if (expr instanceof Var v) {
            Double bound = bindings.get(v.name());
            if (bound != null) {
                return bound;
            }
            OptionalDouble c = MathFunctions.constant(v.name());
            if (c.isPresent()) {
                return c.getAsDouble();
            }
            throw new NumericEvaluationException("Unbound variable: " + v.name(), "evaluate", List.of());
        }
        if (expr instanceof BinaryOp b) {
            double l = eval(b.left(), bindings);
            double r = eval(b.right(), bindings);
            return switch (b.op()) {
                case ADD -> l + r;
                case SUB -> l - r;
                case MUL -> l * r;
                case DIV -> l / r;
                case POW -> Math.pow(l, r);
            };
        }
        if (expr instanceof Call c) {
            if (c.args().size() != 1) {
                throw new NumericEvaluationException(
                        "No numeric value for " + c.name() + " with " + c.args().size() + " arguments",
                        "evaluate",
                        List.of());
            }
            OptionalDouble v = MathFunctions.apply(c.name(), eval(c.arg(), bindings));
            if (v.isEmpty()) {
                throw new NumericEvaluationException("Unknown function: " + c.name(), "evaluate", List.of());
            }
            return v.getAsDouble();
        }
        throw new NumericEvaluationException("An equation has no numeric value: " + expr, "evaluate", List.of());
    }
}
