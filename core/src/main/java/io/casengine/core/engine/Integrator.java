package io.casengine.core.engine;

import static io.casengine.core.model.Expr.add;
import static io.casengine.core.model.Expr.call;
import static io.casengine.core.model.Expr.div;
import static io.casengine.core.model.Expr.mul;
import static io.casengine.core.model.Expr.neg;
import static io.casengine.core.model.Expr.num;
import static io.casengine.core.model.Expr.pow;
import static io.casengine.core.model.Expr.sub;

import io.casengine.core.error.UnsupportedSymbolException;
import io.casengine.core.model.Constants;
import io.casengine.core.model.Expr;
import io.casengine.core.model.Expr.BinaryOp;
import io.casengine.core.model.Expr.Call;
import io.casengine.core.model.Expr.Equation;
import io.casengine.core.model.Expr.Var;
import io.casengine.core.model.SimplifyOptions;
import io.casengine.core.model.StepLog;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Table-driven antiderivatives of one variable. Covers constants, powers, sums, constant factors,
 * the elementary functions and their linear substitutions {@code f(a*x + b)}. Anything else becomes
 * the unevaluated terminal {@code integral(expr, x)}.
 *
 * <p>
 * The result is unsimplified and has no integration constant; the caller adds both.
 */
public final class Integrator {

    static final String OPERATION = "integrate";

    /** Name of the unevaluated integral node. */
    public static final String UNEVALUATED = "integral";

    private final PolynomialExtractor extractor;

    public Integrator(Simplifier simplifier, SimplifyOptions options) {
        this.extractor = new PolynomialExtractor(simplifier, options);
    }

    /**
     * Antiderivative of {@code expr} with respect to {@code variable}.
     *
     * @throws UnsupportedSymbolException if {@code expr} is an equation
     */
    public Expr antiderivative(Expr expr, String variable, StepLog log) {
        if (expr instanceof Equation) {
            throw new UnsupportedSymbolException(
                    "Cannot integrate an equation: " + expr, "=", OPERATION, log.steps());
        }
        return new Pass(variable, log).integrate(expr);
    }

    /** {@code true} if the tree still holds an unevaluated integral. */
    public static boolean isUnevaluated(Expr expr) {
        if (expr instanceof Call c && c.name().equals(UNEVALUATED)) {
            return true;
        }
        for (Expr child : expr.children()) {
            if (isUnevaluated(child)) {
                return true;
            }
        }
        return false;
    }

    private final class Pass {
        private final String variable;
        private final Var x;
        private final StepLog log;

        Pass(String variable, StepLog log) {
            this.variable = variable;
            this.x = Expr.var(variable);
            this.log = log;
        }

        Expr integrate(Expr expr) {
            if (!expr.contains(variable)) {
                return record(expr, mul(expr, x), "constant-rule", "Integral of a constant c is c*x");
            }
            if (expr instanceof Var) {
                return record(expr, div(pow(x, num(2)), num(2)), "power-rule", "Integral of x is x^2/2");
            }
            if (expr instanceof Call c) {
                return function(c);
            }
            BinaryOp b = (BinaryOp) expr;
            return switch (b.op()) {
                case ADD -> record(expr, add(integrate(b.left()), integrate(b.right())), "sum-rule",
                        "Integrate a sum term by term");
                case SUB -> record(expr, sub(integrate(b.left()), integrate(b.right())), "sum-rule",
                        "Integrate a difference term by term");
                case MUL -> product(b);
                case DIV -> quotient(b);
                case POW -> power(b);
            };
        }

        private Expr product(BinaryOp b) {
            if (!b.left().contains(variable)) {
                return record(b, mul(b.left(), integrate(b.right())), "constant-multiple",
                        "Move the constant factor " + b.left() + " outside the integral");
            }
            if (!b.right().contains(variable)) {
                return record(b, mul(b.right(), integrate(b.left())), "constant-multiple",
                        "Move the constant factor " + b.right() + " outside the integral");
            }
            return unevaluated(b);
        }

        private Expr quotient(BinaryOp b) {
            Expr numerator = b.left();
            Expr denominator = b.right();
            if (!denominator.contains(variable)) {
                return record(b, div(integrate(numerator), denominator), "constant-multiple",
                        "Move the constant divisor " + denominator + " outside the integral");
            }
            if (numerator.contains(variable)) {
                return unevaluated(b);
            }
            // c/(a*x + b) = c*ln(a*x + b)/a
            Optional<Linear> linear = linear(denominator);
            if (linear.isPresent()) {
                Expr log = divideBySlope(call("ln", denominator), linear.get());
                Expr out = Constants.isNumber(numerator, 1) ? log : mul(numerator, log);
                return record(b, out, "reciprocal-rule", "Integral of c/u for linear u is c*ln(u)/u'");
            }
            return unevaluated(b);
        }

        private Expr power(BinaryOp b) {
            Expr base = b.left();
            Expr exponent = b.right();
            if (!exponent.contains(variable)) {
                Optional<Linear> linear = linear(base);
                if (linear.isEmpty()) {
                    return unevaluated(b);
                }
                OptionalDouble n = Constants.valueOf(exponent);
                if (n.isPresent() && n.getAsDouble() == -1) {
                    return record(b, divideBySlope(call("ln", base), linear.get()), "reciprocal-rule",
                            "Integral of u^-1 is ln(u)");
                }
                Expr raised = n.isPresent() ? Constants.constant(n.getAsDouble() + 1) : add(exponent, num(1));
                Expr out = divideBySlope(div(pow(base, raised), raised), linear.get());
                return record(b, out, "power-rule", "Integral of u^n is u^(n+1)/(n+1)");
            }
            if (!base.contains(variable)) {
                Optional<Linear> linear = linear(exponent);
                if (linear.isEmpty()) {
                    return unevaluated(b);
                }
                OptionalDouble a = Constants.valueOf(base);
                if (a.isPresent() && a.getAsDouble() == 1) {
                    return record(b, x, "constant-rule", "1^u is 1, whose integral is x");
                }
                // a^u/ln(a) needs a > 0 and a != 1; a symbolic base is assumed to qualify
                if (a.isPresent() && !(a.getAsDouble() > 0)) {
                    return unevaluated(b);
                }
                Expr out = divideBySlope(div(b, call("ln", base)), linear.get());
                return record(b, out, "exponential-rule", "Integral of a^u is a^u/ln(a)");
            }
            return unevaluated(b);
        }

        private Expr function(Call c) {
            if (c.args().size() != 1) {
                return unevaluated(c);
            }
            Expr u = c.arg();
            Optional<Linear> linear = linear(u);
            if (linear.isEmpty()) {
                return unevaluated(c);
            }
            Expr outer = outerAntiderivative(c.name(), u);
            if (outer == null) {
                return unevaluated(c);
            }
            Expr out = divideBySlope(outer, linear.get());
            String rule = u instanceof Var ? "standard-integral" : "linear-substitution";
            return record(c, out, rule, "Integral of " + c.name() + " from the table of standard integrals");
        }

        private Optional<Linear> linear(Expr u) {
            if (u instanceof Var v && v.name().equals(variable)) {
                return Optional.of(new Linear(num(1)));
            }
            Optional<Map<Integer, Expr>> coefficients = extractor.coefficients(u, variable);
            if (coefficients.isEmpty() || PolynomialExtractor.degree(coefficients.get()) != 1) {
                return Optional.empty();
            }
            return Optional.of(new Linear(PolynomialExtractor.coefficient(coefficients.get(), 1)));
        }

        private Expr unevaluated(Expr expr) {
            Expr out = call(UNEVALUATED, expr, x);
            log.record(OPERATION, expr, out, "no-rule", "No integration rule applies; left unevaluated");
            return out;
        }

        private Expr record(Expr before, Expr after, String rule, String explanation) {
            log.record(OPERATION, before, after, rule, explanation);
            return after;
        }
    }

    /** The slope {@code a} of a linear argument {@code a*x + b}. */
    private record Linear(Expr slope) {}

    private static Expr divideBySlope(Expr antiderivative, Linear linear) {
        return Constants.isNumber(linear.slope(), 1) ? antiderivative : div(antiderivative, linear.slope());
    }

    /** F(u) with F' = f, for the functions whose antiderivative is in closed form. */
    static Expr outerAntiderivative(String name, Expr u) {
        return switch (name) {
            case "sin" -> neg(call("cos", u));
            case "cos" -> call("sin", u);
            case "tan" -> neg(call("ln", call("abs", call("cos", u))));
            case "exp" -> call("exp", u);
            case "ln" -> sub(mul(u, call("ln", u)), u);
            case "sqrt" -> mul(div(num(2), num(3)), pow(u, div(num(3), num(2))));
            case "sinh" -> call("cosh", u);
            case "cosh" -> call("sinh", u);
            case "sec" -> call("ln", call("abs", add(call("sec", u), call("tan", u))));
            default -> null;
        };
    }
}
