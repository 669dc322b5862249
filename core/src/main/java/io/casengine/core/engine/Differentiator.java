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
import io.casengine.core.model.Expr.Num;
import io.casengine.core.model.Expr.Var;
import io.casengine.core.model.StepLog;
import java.util.OptionalDouble;

/**
 * Symbolic differentiation by structural recursion. Produces an unsimplified derivative; the
 * caller simplifies once after all requested applications.
 *
 * <p>
 * Steps are recorded for the product, quotient, power and chain rules. Thread-safe.
 */
public final class Differentiator {

    static final String OPERATION = "differentiate";

    /**
     * One application of d/d{@code variable}.
     *
     * @throws UnsupportedSymbolException for an unknown function, a wrong arity, an equation, or
     *     an unevaluated integral
     */
    public Expr derivative(Expr expr, String variable, StepLog log) {
        return new Pass(variable, log).d(expr);
    }

    private static final class Pass {
        private final String variable;
        private final StepLog log;

        Pass(String variable, StepLog log) {
            this.variable = variable;
            this.log = log;
        }

        Expr d(Expr expr) {
            if (expr instanceof Equation) {
                throw unsupported("=", "Cannot differentiate an equation: " + expr);
            }
            if (expr instanceof Num) {
                return num(0);
            }
            if (expr instanceof Var v) {
                return num(v.name().equals(variable) ? 1 : 0);
            }
            if (expr instanceof Call c) {
                return function(c);
            }
            if (!expr.contains(variable) && !containsCall(expr)) {
                return num(0);
            }
            BinaryOp b = (BinaryOp) expr;
            return switch (b.op()) {
                case ADD -> add(d(b.left()), d(b.right()));
                case SUB -> sub(d(b.left()), d(b.right()));
                case MUL -> product(b);
                case DIV -> quotient(b);
                case POW -> power(b);
            };
        }

        private Expr product(BinaryOp b) {
            Expr u = b.left();
            Expr v = b.right();
            if (!u.contains(variable) && !containsCall(u)) {
                return mul(u, d(v));
            }
            if (!v.contains(variable) && !containsCall(v)) {
                return mul(d(u), v);
            }
            Expr out = add(mul(d(u), v), mul(u, d(v)));
            log.record(OPERATION, b, out, "product-rule", "d/dx (u*v) = u'*v + u*v'");
            return out;
        }

        private Expr quotient(BinaryOp b) {
            Expr u = b.left();
            Expr v = b.right();
            if (!v.contains(variable) && !containsCall(v)) {
                return div(d(u), v);
            }
            Expr out = div(sub(mul(d(u), v), mul(u, d(v))), pow(v, num(2)));
            log.record(OPERATION, b, out, "quotient-rule", "d/dx (u/v) = (u'*v - u*v')/v^2");
            return out;
        }

        private Expr power(BinaryOp b) {
            Expr base = b.left();
            Expr exponent = b.right();
            Expr out;
            if (!exponent.contains(variable)) {
                Expr reduced = decrement(exponent);
                if (base instanceof Var v && v.name().equals(variable)) {
                    out = mul(exponent, pow(base, reduced));
                } else {
                    out = mul(mul(exponent, pow(base, reduced)), d(base));
                }
                log.record(OPERATION, b, out, "power-rule", "d/dx u^n = n*u^(n-1)*u'");
            } else if (!base.contains(variable)) {
                out = mul(mul(b, call("ln", base)), d(exponent));
                log.record(OPERATION, b, out, "exponential-rule", "d/dx a^u = a^u*ln(a)*u'");
            } else {
                out = mul(b, add(mul(d(exponent), call("ln", base)), div(mul(exponent, d(base)), base)));
                log.record(
                        OPERATION, b, out, "general-power-rule", "d/dx u^v = u^v*(v'*ln(u) + v*u'/u)");
            }
            return out;
        }

        private Expr function(Call c) {
            if (c.name().equals("integral")) {
                throw unsupported("integral", "Cannot differentiate an unevaluated integral: " + c);
            }
            if (c.args().size() != 1) {
                throw unsupported(
                        c.name(), "Function " + c.name() + " takes 1 argument, got " + c.args().size() + ": " + c);
            }
            Expr u = c.arg();
            Expr outer = outerDerivative(c.name(), u);
            if (outer == null) {
                throw unsupported(c.name(), "No differentiation rule for function: " + c.name());
            }
            if (!u.contains(variable)) {
                return num(0);
            }
            if (u instanceof Var) {
                return outer;
            }
            Expr out = mul(outer, d(u));
            log.record(OPERATION, c, out, "chain-rule", "d/dx f(u) = f'(u)*u'");
            return out;
        }

        private UnsupportedSymbolException unsupported(String symbol, String message) {
            return new UnsupportedSymbolException(message, symbol, OPERATION, log.steps());
        }
    }

    /** f'(u) for the supported unary functions, or null. */
    static Expr outerDerivative(String name, Expr u) {
        return switch (name) {
            case "sin" -> call("cos", u);
            case "cos" -> neg(call("sin", u));
            case "tan" -> pow(call("sec", u), num(2));
            case "sec" -> mul(call("sec", u), call("tan", u));
            case "csc" -> neg(mul(call("csc", u), call("cot", u)));
            case "cot" -> neg(pow(call("csc", u), num(2)));
            case "asin" -> div(num(1), call("sqrt", sub(num(1), pow(u, num(2)))));
            case "acos" -> neg(div(num(1), call("sqrt", sub(num(1), pow(u, num(2))))));
            case "atan" -> div(num(1), add(num(1), pow(u, num(2))));
            case "sinh" -> call("cosh", u);
            case "cosh" -> call("sinh", u);
            case "tanh" -> sub(num(1), pow(call("tanh", u), num(2)));
            case "exp" -> call("exp", u);
            case "ln" -> div(num(1), u);
            case "log" -> div(num(1), mul(u, call("ln", num(10))));
            case "sqrt" -> div(num(1), mul(num(2), call("sqrt", u)));
            case "abs" -> div(u, call("abs", u));
            default -> null;
        };
    }

    private static Expr decrement(Expr exponent) {
        OptionalDouble n = Constants.valueOf(exponent);
        return n.isPresent() ? Constants.constant(n.getAsDouble() - 1) : sub(exponent, num(1));
    }

    /** Calls are always visited so unsupported functions are reported even in constant subtrees. */
    private static boolean containsCall(Expr expr) {
        if (expr instanceof Call) {
            return true;
        }
        for (Expr child : expr.children()) {
            if (containsCall(child)) {
                return true;
            }
        }
        return false;
    }
}
