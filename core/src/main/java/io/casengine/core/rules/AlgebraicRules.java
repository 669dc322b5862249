package io.casengine.core.rules;

import io.casengine.core.model.Constants;
import io.casengine.core.model.Expr;
import io.casengine.core.model.Expr.BinaryOp;
import io.casengine.core.model.Operator;
import io.casengine.core.rules.SumTerms.Term;
import io.casengine.core.spi.RewriteRule;
import io.casengine.core.spi.RuleCategory;
import io.casengine.core.spi.RuleStage;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Coefficient handling, like-term collection and fraction reduction. Expansion and factoring
 * are registered under their own {@link RuleStage}s.
 */
public final class AlgebraicRules {

    private static final RuleCategory CAT = RuleCategory.ALGEBRAIC;

    /** Largest integer power of a sum that expansion multiplies out. */
    static final int MAX_EXPANDED_POWER = 6;

    private AlgebraicRules() {}

    public static List<RewriteRule> all() {
        return List.of(
                NamedRule.of("coefficient-ordering", CAT, "Move numeric coefficients to the front and merge them",
                        AlgebraicRules::orderCoefficients),
                NamedRule.of("combine-like-terms", CAT, "Add the coefficients of terms with the same symbolic part",
                        AlgebraicRules::combineLikeTerms),
                NamedRule.of("simplify-fractions", CAT, "Reduce numeric coefficients across a fraction and merge nested divisions",
                        AlgebraicRules::simplifyFractions),
                NamedRule.staged("expand-products", CAT, "Distribute products over sums", RuleStage.EXPAND,
                        AlgebraicRules::expandProducts),
                NamedRule.staged("factor-common-term", CAT, "Pull a factor shared by every term out of the sum",
                        RuleStage.FACTOR, Factoring::factorCommonTerm));
    }

    static Expr orderCoefficients(Expr expr) {
        if (!(expr instanceof BinaryOp b) || b.op() != Operator.MUL) {
            return expr;
        }
        boolean leftConst = Constants.isConstant(b.left());
        boolean rightConst = Constants.isConstant(b.right());
        if (rightConst && !leftConst) {
            return Expr.mul(b.right(), b.left());
        }
        // c*(d*x) = (c*d)*x
        if (leftConst && b.right() instanceof BinaryOp inner && inner.op() == Operator.MUL) {
            OptionalDouble d = Constants.valueOf(inner.left());
            if (d.isPresent()) {
                double product = Constants.valueOf(b.left()).getAsDouble() * d.getAsDouble();
                return Expr.mul(Constants.constant(product), inner.right());
            }
        }
        if (!leftConst) {
            // x*(c*y) = c*(x*y)
            if (b.right() instanceof BinaryOp inner
                    && inner.op() == Operator.MUL
                    && Constants.isConstant(inner.left())) {
                return Expr.mul(inner.left(), Expr.mul(b.left(), inner.right()));
            }
            // (c*x)*y = c*(x*y)
            if (b.left() instanceof BinaryOp inner
                    && inner.op() == Operator.MUL
                    && Constants.isConstant(inner.left())) {
                return Expr.mul(inner.left(), Expr.mul(inner.right(), b.right()));
            }
        }
        return expr;
    }

    static Expr combineLikeTerms(Expr expr) {
        if (!SumTerms.isSum(expr)) {
            return expr;
        }
        List<Term> terms = SumTerms.flatten(expr);
        List<Term> groups = new ArrayList<>();
        for (Term t : terms) {
            int at = indexOfRest(groups, t.rest());
            if (at < 0) {
                groups.add(t);
            } else {
                Term g = groups.get(at);
                groups.set(at, new Term(g.coefficient() + t.coefficient(), g.rest()));
            }
        }
        if (groups.size() == terms.size()) {
            return expr;
        }
        return SumTerms.rebuild(groups);
    }

    private static int indexOfRest(List<Term> groups, Expr rest) {
        for (int i = 0; i < groups.size(); i++) {
            Expr r = groups.get(i).rest();
            if (rest == null ? r == null : rest.equals(r)) {
                return i;
            }
        }
        return -1;
    }

    static Expr simplifyFractions(Expr expr) {
        if (!(expr instanceof BinaryOp b)) {
            return expr;
        }
        // c*(a/d) = (c/d)*a
        if (b.op() == Operator.MUL
                && b.right() instanceof BinaryOp frac
                && frac.op() == Operator.DIV
                && !Constants.isConstant(frac)) {
            OptionalDouble c = Constants.valueOf(b.left());
            OptionalDouble d = Constants.valueOf(frac.right());
            if (c.isPresent() && d.isPresent() && d.getAsDouble() != 0) {
                return coefficientTimes(c.getAsDouble() / d.getAsDouble(), frac.left());
            }
        }
        // a*(1/u) = a/u and (1/u)*a = a/u
        if (b.op() == Operator.MUL) {
            if (isReciprocal(b.right())) {
                return Expr.div(b.left(), ((BinaryOp) b.right()).right());
            }
            if (isReciprocal(b.left())) {
                return Expr.div(b.right(), ((BinaryOp) b.left()).right());
            }
        }
        if (b.op() != Operator.DIV || Constants.isConstant(b)) {
            return expr;
        }
        OptionalDouble d = Constants.valueOf(b.right());
        // (a/c)/d = a/(c*d)
        if (d.isPresent() && d.getAsDouble() != 0 && b.left() instanceof BinaryOp inner && inner.op() == Operator.DIV) {
            OptionalDouble c = Constants.valueOf(inner.right());
            if (c.isPresent() && c.getAsDouble() != 0 && !Constants.isConstant(inner)) {
                return Expr.div(inner.left(), Constants.constant(c.getAsDouble() * d.getAsDouble()));
            }
        }
        // (c*a)/d = (c/d)*a
        if (d.isPresent() && d.getAsDouble() != 0 && b.left() instanceof BinaryOp num && num.op() == Operator.MUL) {
            OptionalDouble c = Constants.valueOf(num.left());
            if (c.isPresent()) {
                return coefficientTimes(c.getAsDouble() / d.getAsDouble(), num.right());
            }
        }
        // (c*a)/(d*b) and c/(d*b): divide integer coefficients by their gcd
        SumTerms.Term top = SumTerms.split(b.left());
        SumTerms.Term bottom = SumTerms.split(b.right());
        if (bottom.rest() == null) {
            return expr;
        }
        double c = top.coefficient();
        double e = bottom.coefficient();
        if (!Constants.isInteger(c) || !Constants.isInteger(e) || e == 0) {
            return expr;
        }
        long g = Constants.gcd((long) c, (long) e);
        if (g <= 1) {
            return expr;
        }
        Expr numerator = SumTerms.product(c / g, top.rest());
        Expr denominator = SumTerms.product(e / g, bottom.rest());
        return Expr.div(numerator, denominator);
    }

    /** {@code 1/u} for a non-constant {@code u}. */
    private static boolean isReciprocal(Expr expr) {
        return expr instanceof BinaryOp b
                && b.op() == Operator.DIV
                && Constants.isNumber(b.left(), 1)
                && !Constants.isConstant(b.right());
    }

    private static Expr coefficientTimes(double coefficient, Expr rest) {
        return coefficient == 1 ? rest : Expr.mul(Constants.constant(coefficient), rest);
    }

    static Expr expandProducts(Expr expr) {
        if (!(expr instanceof BinaryOp b)) {
            return expr;
        }
        if (b.op() == Operator.MUL) {
            if (b.right() instanceof BinaryOp sum && SumTerms.isSum(sum)) {
                return new BinaryOp(sum.op(), Expr.mul(b.left(), sum.left()), Expr.mul(b.left(), sum.right()));
            }
            if (b.left() instanceof BinaryOp sum && SumTerms.isSum(sum)) {
                return new BinaryOp(sum.op(), Expr.mul(sum.left(), b.right()), Expr.mul(sum.right(), b.right()));
            }
        }
        if (b.op() == Operator.POW && SumTerms.isSum(b.left())) {
            OptionalDouble n = Constants.valueOf(b.right());
            if (n.isPresent()
                    && Constants.isInteger(n.getAsDouble())
                    && n.getAsDouble() >= 2
                    && n.getAsDouble() <= MAX_EXPANDED_POWER) {
                double k = n.getAsDouble();
                Expr rest = k == 2 ? b.left() : Expr.pow(b.left(), Expr.num(k - 1));
                return Expr.mul(b.left(), rest);
            }
        }
        return expr;
    }
}
