package io.casengine.core.rules;

import io.casengine.core.model.Constants;
import io.casengine.core.model.Expr;
import io.casengine.core.model.Expr.BinaryOp;
import io.casengine.core.model.Expr.Call;
import io.casengine.core.model.Operator;
import io.casengine.core.spi.RewriteRule;
import io.casengine.core.spi.RuleCategory;
import java.util.List;
import java.util.OptionalDouble;

/** Trigonometric identities. */
public final class TrigonometricRules {

    private static final RuleCategory CAT = RuleCategory.TRIGONOMETRIC;

    private TrigonometricRules() {}

    public static List<RewriteRule> all() {
        return List.of(
                NamedRule.of("pythagorean-identity", CAT, "Apply sin(u)^2 + cos(u)^2 = 1",
                        TrigonometricRules::pythagorean),
                NamedRule.of("trig-quotient", CAT, "Apply sin(u)/cos(u) = tan(u) and cos(u)/sin(u) = cot(u)",
                        TrigonometricRules::quotient),
                NamedRule.of("trig-parity", CAT, "sin and tan are odd, cos is even",
                        TrigonometricRules::parity));
    }

    static Expr pythagorean(Expr expr) {
        if (!(expr instanceof BinaryOp b) || b.op() != Operator.ADD) {
            return expr;
        }
        if (isPythagoreanPair(b.left(), b.right())) {
            return Expr.num(1);
        }
        // (a + sin^2) + cos^2
        if (b.left() instanceof BinaryOp inner
                && inner.op() == Operator.ADD
                && isPythagoreanPair(inner.right(), b.right())) {
            return Expr.add(inner.left(), Expr.num(1));
        }
        return expr;
    }

    private static boolean isPythagoreanPair(Expr a, Expr b) {
        Expr sinArg = squaredArgument(a, "sin");
        Expr cosArg = squaredArgument(b, "cos");
        if (sinArg == null || cosArg == null) {
            sinArg = squaredArgument(b, "sin");
            cosArg = squaredArgument(a, "cos");
        }
        return sinArg != null && sinArg.equals(cosArg);
    }

    /** For {@code f(u)^2} returns {@code u}, otherwise null. */
    private static Expr squaredArgument(Expr expr, String function) {
        if (expr instanceof BinaryOp p
                && p.op() == Operator.POW
                && Constants.isNumber(p.right(), 2)
                && p.left() instanceof Call c
                && c.isUnary(function)) {
            return c.arg();
        }
        return null;
    }

    static Expr quotient(Expr expr) {
        if (expr instanceof BinaryOp b
                && b.op() == Operator.DIV
                && b.left() instanceof Call top
                && b.right() instanceof Call bottom
                && top.args().size() == 1
                && bottom.args().size() == 1
                && top.arg().equals(bottom.arg())) {
            if (top.name().equals("sin") && bottom.name().equals("cos")) {
                return Expr.call("tan", top.arg());
            }
            if (top.name().equals("cos") && bottom.name().equals("sin")) {
                return Expr.call("cot", top.arg());
            }
        }
        return expr;
    }

    static Expr parity(Expr expr) {
        if (!(expr instanceof Call c) || c.args().size() != 1) {
            return expr;
        }
        boolean odd = c.name().equals("sin") || c.name().equals("tan");
        if (!odd && !c.name().equals("cos")) {
            return expr;
        }
        Expr positive = negatedArgument(c.arg());
        if (positive == null) {
            return expr;
        }
        Expr flipped = Expr.call(c.name(), positive);
        return odd ? Expr.neg(flipped) : flipped;
    }

    /** For {@code -u}, {@code (-c)*u} or a negative constant, returns the positive counterpart; else null. */
    private static Expr negatedArgument(Expr arg) {
        OptionalDouble v = Constants.valueOf(arg);
        if (v.isPresent()) {
            return v.getAsDouble() < 0 ? Constants.constant(-v.getAsDouble()) : null;
        }
        if (arg instanceof BinaryOp m && m.op() == Operator.MUL) {
            OptionalDouble c = Constants.valueOf(m.left());
            if (c.isPresent() && c.getAsDouble() < 0) {
                double magnitude = -c.getAsDouble();
                return magnitude == 1 ? m.right() : Expr.mul(Constants.constant(magnitude), m.right());
            }
        }
        return null;
    }
}
