package io.casengine.core.rules;

import io.casengine.core.model.Constants;
import io.casengine.core.model.Expr;
import io.casengine.core.model.Expr.BinaryOp;
import io.casengine.core.model.Expr.Call;
import io.casengine.core.model.Expr.Var;
import io.casengine.core.model.Operator;
import io.casengine.core.spi.RewriteRule;
import io.casengine.core.spi.RuleCategory;
import java.util.List;
import java.util.OptionalDouble;

/** Laws of logarithms. Sum and difference laws need positive arguments and are real-only. */
public final class LogarithmicRules {

    private static final RuleCategory CAT = RuleCategory.LOGARITHMIC;

    private LogarithmicRules() {}

    public static List<RewriteRule> all() {
        return List.of(
                NamedRule.realOnly("log-sum", CAT, "Apply ln(a) + ln(b) = ln(a*b)", LogarithmicRules::logSum),
                NamedRule.realOnly("log-difference", CAT, "Apply ln(a) - ln(b) = ln(a/b)",
                        LogarithmicRules::logDifference),
                NamedRule.of("log-power", CAT, "Apply ln(u^n) = n*ln(u)", LogarithmicRules::logPower),
                NamedRule.realOnly("log-exp-inverse", CAT, "ln and exp are inverse functions",
                        LogarithmicRules::logOfExp),
                NamedRule.of("log-of-one", CAT, "Apply ln(1) = 0 and ln(e) = 1", LogarithmicRules::logOfOne));
    }

    static Expr logSum(Expr expr) {
        if (expr instanceof BinaryOp b && b.op() == Operator.ADD && isLn(b.left()) && isLn(b.right())) {
            return Expr.call("ln", Expr.mul(((Call) b.left()).arg(), ((Call) b.right()).arg()));
        }
        return expr;
    }

    static Expr logDifference(Expr expr) {
        if (expr instanceof BinaryOp b && b.op() == Operator.SUB && isLn(b.left()) && isLn(b.right())) {
            return Expr.call("ln", Expr.div(((Call) b.left()).arg(), ((Call) b.right()).arg()));
        }
        return expr;
    }

    static Expr logPower(Expr expr) {
        if (expr instanceof Call c && c.isUnary("ln") && c.arg() instanceof BinaryOp p && p.op() == Operator.POW) {
            OptionalDouble n = Constants.valueOf(p.right());
            // ln(x^2) = 2*ln(x) fails for negative x
            if (n.isPresent() && !(Constants.isInteger(n.getAsDouble()) && n.getAsDouble() % 2 == 0)) {
                return Expr.mul(p.right(), Expr.call("ln", p.left()));
            }
        }
        return expr;
    }

    static Expr logOfExp(Expr expr) {
        if (expr instanceof Call c && c.isUnary("ln") && c.arg() instanceof Call inner && inner.isUnary("exp")) {
            return inner.arg();
        }
        return expr;
    }

    static Expr logOfOne(Expr expr) {
        if (expr instanceof Call c && c.isUnary("ln")) {
            if (Constants.isNumber(c.arg(), 1)) {
                return Expr.num(0);
            }
            if (c.arg() instanceof Var v && v.name().equals("e")) {
                return Expr.num(1);
            }
        }
        return expr;
    }

    private static boolean isLn(Expr expr) {
        return expr instanceof Call c && c.isUnary("ln");
    }
}
