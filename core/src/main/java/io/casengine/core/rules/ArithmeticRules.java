package io.casengine.core.rules;

import static io.casengine.core.model.Constants.isNumber;

import io.casengine.core.model.Constants;
import io.casengine.core.model.Expr;
import io.casengine.core.model.Expr.BinaryOp;
import io.casengine.core.model.Expr.Call;
import io.casengine.core.model.MathFunctions;
import io.casengine.core.model.Operator;
import io.casengine.core.spi.RewriteRule;
import io.casengine.core.spi.RuleCategory;
import java.util.List;
import java.util.OptionalDouble;

/** Numeric folding and the identities of {@code + - * / ^}. */
public final class ArithmeticRules {

    private static final RuleCategory CAT = RuleCategory.ARITHMETIC;

    private ArithmeticRules() {}

    public static List<RewriteRule> all() {
        return List.of(
                NamedRule.of("constant-folding", CAT, "Evaluate operations on numeric constants",
                        ArithmeticRules::foldConstants),
                NamedRule.of("additive-identity", CAT, "Adding or subtracting zero leaves a value unchanged",
                        ArithmeticRules::additiveIdentity),
                NamedRule.of("multiplicative-identity", CAT, "Multiplying by one leaves a value unchanged",
                        ArithmeticRules::multiplicativeIdentity),
                NamedRule.of("zero-product", CAT, "Any product with a zero factor is zero",
                        ArithmeticRules::zeroProduct),
                NamedRule.of("power-identity", CAT, "Apply x^1 = x, x^0 = 1, 1^x = 1 and 0^n = 0",
                        ArithmeticRules::powerIdentity),
                NamedRule.of("division-identity", CAT, "Apply x/1 = x, 0/x = 0 and x/(-1) = -x",
                        ArithmeticRules::divisionIdentity),
                NamedRule.of("self-subtraction", CAT, "A value minus itself is zero",
                        ArithmeticRules::selfSubtraction),
                NamedRule.of("self-division", CAT, "A non-zero value divided by itself is one",
                        ArithmeticRules::selfDivision),
                NamedRule.of("negation-normalisation", CAT, "Turn additions of negative terms into subtractions",
                        ArithmeticRules::normaliseNegation));
    }

    static Expr foldConstants(Expr expr) {
        if (expr instanceof BinaryOp b) {
            OptionalDouble l = Constants.valueOf(b.left());
            OptionalDouble r = Constants.valueOf(b.right());
            if (l.isEmpty() || r.isEmpty()) {
                return expr;
            }
            double a = l.getAsDouble();
            double c = r.getAsDouble();
            return switch (b.op()) {
                case ADD -> finite(a + c, expr);
                case SUB -> finite(a - c, expr);
                case MUL -> finite(a * c, expr);
                case DIV -> c == 0 ? expr : finite(a / c, expr);
                case POW -> Constants.exact(Math.pow(a, c)).orElse(expr);
            };
        }
        if (expr instanceof Call call && call.args().size() == 1) {
            OptionalDouble arg = Constants.valueOf(call.arg());
            if (arg.isEmpty()) {
                return expr;
            }
            OptionalDouble v = MathFunctions.apply(call.name(), arg.getAsDouble());
            // only exact integers: sqrt(4) folds, sqrt(5) stays symbolic
            if (v.isPresent() && Constants.isInteger(v.getAsDouble())) {
                return Expr.num(v.getAsDouble());
            }
        }
        return expr;
    }

    private static Expr finite(double value, Expr fallback) {
        return Double.isFinite(value) ? Constants.constant(value) : fallback;
    }

    static Expr additiveIdentity(Expr expr) {
        if (expr instanceof BinaryOp b) {
            if (b.op() == Operator.ADD) {
                if (isNumber(b.left(), 0)) {
                    return b.right();
                }
                if (isNumber(b.right(), 0)) {
                    return b.left();
                }
            } else if (b.op() == Operator.SUB) {
                if (isNumber(b.right(), 0)) {
                    return b.left();
                }
                if (isNumber(b.left(), 0)) {
                    return Expr.neg(b.right());
                }
            }
        }
        return expr;
    }

    static Expr multiplicativeIdentity(Expr expr) {
        if (expr instanceof BinaryOp b && b.op() == Operator.MUL) {
            if (isNumber(b.left(), 1)) {
                return b.right();
            }
            if (isNumber(b.right(), 1)) {
                return b.left();
            }
        }
        return expr;
    }

    static Expr zeroProduct(Expr expr) {
        if (expr instanceof BinaryOp b && b.op() == Operator.MUL && (isNumber(b.left(), 0) || isNumber(b.right(), 0))) {
            return Expr.num(0);
        }
        return expr;
    }

    static Expr powerIdentity(Expr expr) {
        if (!(expr instanceof BinaryOp b) || b.op() != Operator.POW) {
            return expr;
        }
        if (isNumber(b.right(), 1)) {
            return b.left();
        }
        if (isNumber(b.right(), 0) && !isNumber(b.left(), 0)) {
            return Expr.num(1);
        }
        if (isNumber(b.left(), 1)) {
            return Expr.num(1);
        }
        if (isNumber(b.left(), 0) && Constants.valueOf(b.right()).orElse(0) > 0) {
            return Expr.num(0);
        }
        return expr;
    }

    static Expr divisionIdentity(Expr expr) {
        if (!(expr instanceof BinaryOp b) || b.op() != Operator.DIV) {
            return expr;
        }
        if (isNumber(b.right(), 1)) {
            return b.left();
        }
        if (isNumber(b.right(), -1)) {
            return Expr.neg(b.left());
        }
        if (isNumber(b.left(), 0) && !isNumber(b.right(), 0)) {
            return Expr.num(0);
        }
        return expr;
    }

    static Expr selfSubtraction(Expr expr) {
        if (expr instanceof BinaryOp b && b.op() == Operator.SUB && b.left().equals(b.right())) {
            return Expr.num(0);
        }
        return expr;
    }

    static Expr selfDivision(Expr expr) {
        if (expr instanceof BinaryOp b
                && b.op() == Operator.DIV
                && b.left().equals(b.right())
                && !isNumber(b.right(), 0)) {
            return Expr.num(1);
        }
        return expr;
    }

    static Expr normaliseNegation(Expr expr) {
        if (!(expr instanceof BinaryOp b)) {
            return expr;
        }
        if (b.op() == Operator.MUL
                && isNumber(b.left(), -1)
                && b.right() instanceof BinaryOp inner
                && inner.op() == Operator.MUL
                && isNumber(inner.left(), -1)) {
            return inner.right();
        }
        if (b.op() != Operator.ADD && b.op() != Operator.SUB) {
            return expr;
        }
        Expr negated = negatedMagnitude(b.right());
        if (negated == null) {
            return expr;
        }
        return b.op() == Operator.ADD ? Expr.sub(b.left(), negated) : Expr.add(b.left(), negated);
    }

    /** For {@code -c} or {@code (-c)*u} with {@code c > 0}, returns {@code c} or {@code c*u}; else null. */
    static Expr negatedMagnitude(Expr expr) {
        OptionalDouble v = Constants.valueOf(expr);
        if (v.isPresent()) {
            return v.getAsDouble() < 0 ? Constants.constant(-v.getAsDouble()) : null;
        }
        if (expr instanceof BinaryOp m && m.op() == Operator.MUL) {
            OptionalDouble c = Constants.valueOf(m.left());
            if (c.isPresent() && c.getAsDouble() < 0) {
                double magnitude = -c.getAsDouble();
                return magnitude == 1 ? m.right() : Expr.mul(Constants.constant(magnitude), m.right());
            }
        }
        return null;
    }
}
