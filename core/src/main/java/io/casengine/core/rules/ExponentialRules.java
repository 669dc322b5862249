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

/** Laws of exponents and the exponential function. */
public final class ExponentialRules {

    private static final RuleCategory CAT = RuleCategory.EXPONENTIAL;

    private ExponentialRules() {}

    public static List<RewriteRule> all() {
        return List.of(
                NamedRule.of("natural-base", CAT, "Write powers of e with the exponential function",
                        ExponentialRules::naturalBase),
                NamedRule.of("product-of-powers", CAT, "Add exponents of powers with the same base",
                        ExponentialRules::productOfPowers),
                NamedRule.of("quotient-of-powers", CAT, "Subtract exponents of powers with the same base",
                        ExponentialRules::quotientOfPowers),
                NamedRule.of("power-of-power", CAT, "Multiply exponents of a power raised to an integer power",
                        ExponentialRules::powerOfPower),
                NamedRule.of("exp-product", CAT, "Apply exp(a)*exp(b) = exp(a + b)",
                        ExponentialRules::expProduct),
                NamedRule.realOnly("exp-log-inverse", CAT, "exp and ln are inverse functions",
                        ExponentialRules::expOfLog));
    }

    static Expr naturalBase(Expr expr) {
        if (expr instanceof BinaryOp b && b.op() == Operator.POW && b.left() instanceof Var v && v.name().equals("e")) {
            return Expr.call("exp", b.right());
        }
        return expr;
    }

    static Expr productOfPowers(Expr expr) {
        if (!(expr instanceof BinaryOp b) || b.op() != Operator.MUL) {
            return expr;
        }
        Expr merged = merge(b.left(), b.right());
        if (merged != null) {
            return merged;
        }
        // x*(x*y) = x^2*y
        if (b.right() instanceof BinaryOp inner && inner.op() == Operator.MUL) {
            Expr head = merge(b.left(), inner.left());
            if (head != null) {
                return Expr.mul(head, inner.right());
            }
        }
        return expr;
    }

    private static Expr merge(Expr a, Expr b) {
        if (Constants.isConstant(a) || Constants.isConstant(b) || !base(a).equals(base(b))) {
            return null;
        }
        return Expr.pow(base(a), Expr.add(exponent(a), exponent(b)));
    }

    static Expr quotientOfPowers(Expr expr) {
        if (expr instanceof BinaryOp b
                && b.op() == Operator.DIV
                && !Constants.isConstant(b.left())
                && !Constants.isConstant(b.right())
                && (b.left() instanceof BinaryOp || b.right() instanceof BinaryOp)
                && base(b.left()).equals(base(b.right()))) {
            return Expr.pow(base(b.left()), Expr.sub(exponent(b.left()), exponent(b.right())));
        }
        return expr;
    }

    private static Expr base(Expr e) {
        return e instanceof BinaryOp p && p.op() == Operator.POW ? p.left() : e;
    }

    private static Expr exponent(Expr e) {
        return e instanceof BinaryOp p && p.op() == Operator.POW ? p.right() : Expr.num(1);
    }

    static Expr powerOfPower(Expr expr) {
        if (expr instanceof BinaryOp outer
                && outer.op() == Operator.POW
                && outer.left() instanceof BinaryOp inner
                && inner.op() == Operator.POW) {
            OptionalDouble n = Constants.valueOf(outer.right());
            if (n.isPresent() && Constants.isInteger(n.getAsDouble())) {
                return Expr.pow(inner.left(), Expr.mul(inner.right(), outer.right()));
            }
        }
        return expr;
    }

    static Expr expProduct(Expr expr) {
        if (expr instanceof BinaryOp b
                && b.op() == Operator.MUL
                && b.left() instanceof Call l
                && b.right() instanceof Call r
                && l.isUnary("exp")
                && r.isUnary("exp")) {
            return Expr.call("exp", Expr.add(l.arg(), r.arg()));
        }
        return expr;
    }

    static Expr expOfLog(Expr expr) {
        if (expr instanceof Call c && c.isUnary("exp") && c.arg() instanceof Call inner && inner.isUnary("ln")) {
            return inner.arg();
        }
        return expr;
    }
}
