package io.casengine.core.rules;

import io.casengine.core.model.Constants;
import io.casengine.core.model.Expr;
import io.casengine.core.model.Expr.BinaryOp;
import io.casengine.core.model.Operator;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Flattens chains of {@code +} and {@code -} into signed terms and rebuilds them. A term is a
 * numeric coefficient times an optional symbolic rest; a {@code null} rest is a pure constant.
 */
final class SumTerms {

    record Term(double coefficient, Expr rest) {}

    private SumTerms() {}

    static boolean isSum(Expr expr) {
        return expr instanceof BinaryOp b && (b.op() == Operator.ADD || b.op() == Operator.SUB);
    }

    /** Signed terms of {@code expr}, left to right. A non-sum yields a single term. */
    static List<Term> flatten(Expr expr) {
        List<Term> out = new ArrayList<>();
        collect(expr, 1.0, out);
        return out;
    }

    private static void collect(Expr expr, double sign, List<Term> out) {
        if (expr instanceof BinaryOp b && (b.op() == Operator.ADD || b.op() == Operator.SUB)) {
            collect(b.left(), sign, out);
            collect(b.right(), b.op() == Operator.ADD ? sign : -sign, out);
            return;
        }
        Term t = split(expr);
        out.add(new Term(sign * t.coefficient(), t.rest()));
    }

    /** Splits one product into coefficient and rest: {@code 3*x}, {@code x*3}, {@code x/2}. */
    static Term split(Expr expr) {
        OptionalDouble c = Constants.valueOf(expr);
        if (c.isPresent()) {
            return new Term(c.getAsDouble(), null);
        }
        if (expr instanceof BinaryOp b) {
            if (b.op() == Operator.MUL) {
                OptionalDouble left = Constants.valueOf(b.left());
                if (left.isPresent()) {
                    return new Term(left.getAsDouble(), b.right());
                }
                OptionalDouble right = Constants.valueOf(b.right());
                if (right.isPresent()) {
                    return new Term(right.getAsDouble(), b.left());
                }
            } else if (b.op() == Operator.DIV) {
                OptionalDouble den = Constants.valueOf(b.right());
                if (den.isPresent() && den.getAsDouble() != 0) {
                    Term num = split(b.left());
                    if (num.rest() != null) {
                        return new Term(num.coefficient() / den.getAsDouble(), num.rest());
                    }
                }
            }
        }
        return new Term(1.0, expr);
    }

    /** Coefficient times rest, without sign handling. */
    static Expr product(double coefficient, Expr rest) {
        if (rest == null) {
            return Constants.constant(coefficient);
        }
        if (coefficient == 1) {
            return rest;
        }
        if (coefficient == -1) {
            return Expr.neg(rest);
        }
        return Expr.mul(Constants.constant(coefficient), rest);
    }

    /**
     * Left-associative sum of the terms. Negative terms after the first become subtractions; zero
     * terms are dropped. An empty (or all-zero) list rebuilds to {@code 0}.
     */
    static Expr rebuild(List<Term> terms) {
        Expr acc = null;
        for (Term t : terms) {
            if (t.coefficient() == 0) {
                continue;
            }
            if (acc == null) {
                acc = product(t.coefficient(), t.rest());
            } else if (t.coefficient() < 0) {
                acc = Expr.sub(acc, product(-t.coefficient(), t.rest()));
            } else {
                acc = Expr.add(acc, product(t.coefficient(), t.rest()));
            }
        }
        return acc == null ? Expr.num(0) : acc;
    }
}
