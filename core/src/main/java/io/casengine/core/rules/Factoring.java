package io.casengine.core.rules;

import io.casengine.core.model.Constants;
import io.casengine.core.model.Expr;
import io.casengine.core.model.Expr.BinaryOp;
import io.casengine.core.model.Operator;
import io.casengine.core.rules.SumTerms.Term;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Common-factor extraction: {@code a*b + a*c = a*(b + c)}, {@code x^3 + x^2 = x^2*(x + 1)} and
 * {@code 2*x + 4 = 2*(x + 2)}. Only positive integer powers are compared; the numeric factor is
 * the gcd of the term coefficients when they are all integers.
 */
final class Factoring {

    /** One factor of a product: {@code base^exponent}. */
    private record Factor(Expr base, double exponent) {}

    /** A term as coefficient times factors. */
    private record Product(double coefficient, List<Factor> factors) {}

    private Factoring() {}

    static Expr factorCommonTerm(Expr expr) {
        if (!SumTerms.isSum(expr)) {
            return expr;
        }
        List<Term> terms = SumTerms.flatten(expr);
        List<Product> products = new ArrayList<>();
        for (Term t : terms) {
            List<Factor> factors = new ArrayList<>();
            if (t.rest() != null) {
                collectFactors(t.rest(), factors);
            }
            products.add(new Product(t.coefficient(), factors));
        }

        List<Factor> common = commonFactors(products);
        long g = coefficientGcd(products);
        if (common.isEmpty() && g <= 1) {
            return expr;
        }

        List<Term> quotients = new ArrayList<>();
        for (Product p : products) {
            List<Factor> remaining = divide(p.factors(), common);
            quotients.add(new Term(p.coefficient() / g, productOf(remaining)));
        }
        Expr factor = productOf(common);
        Expr inner = SumTerms.rebuild(quotients);
        if (factor == null) {
            return Expr.mul(Expr.num(g), inner);
        }
        return g == 1 ? Expr.mul(factor, inner) : Expr.mul(Expr.num(g), Expr.mul(factor, inner));
    }

    private static void collectFactors(Expr expr, List<Factor> out) {
        if (expr instanceof BinaryOp b && b.op() == Operator.MUL) {
            collectFactors(b.left(), out);
            collectFactors(b.right(), out);
            return;
        }
        if (expr instanceof BinaryOp b && b.op() == Operator.POW) {
            OptionalDouble n = Constants.valueOf(b.right());
            if (n.isPresent() && Constants.isInteger(n.getAsDouble()) && n.getAsDouble() > 0) {
                merge(out, new Factor(b.left(), n.getAsDouble()));
                return;
            }
        }
        merge(out, new Factor(expr, 1));
    }

    private static void merge(List<Factor> factors, Factor f) {
        for (int i = 0; i < factors.size(); i++) {
            if (factors.get(i).base().equals(f.base())) {
                factors.set(i, new Factor(f.base(), factors.get(i).exponent() + f.exponent()));
                return;
            }
        }
        factors.add(f);
    }

    private static List<Factor> commonFactors(List<Product> products) {
        List<Factor> common = new ArrayList<>(products.get(0).factors());
        for (int i = 1; i < products.size(); i++) {
            List<Factor> next = new ArrayList<>();
            for (Factor c : common) {
                for (Factor f : products.get(i).factors()) {
                    if (f.base().equals(c.base())) {
                        next.add(new Factor(c.base(), Math.min(c.exponent(), f.exponent())));
                    }
                }
            }
            common = next;
        }
        return common;
    }

    private static long coefficientGcd(List<Product> products) {
        long g = 0;
        for (Product p : products) {
            if (!Constants.isInteger(p.coefficient())) {
                return 1;
            }
            g = Constants.gcd(g, (long) p.coefficient());
        }
        return g == 0 ? 1 : g;
    }

    private static List<Factor> divide(List<Factor> factors, List<Factor> divisor) {
        List<Factor> out = new ArrayList<>();
        for (Factor f : factors) {
            double exponent = f.exponent();
            for (Factor d : divisor) {
                if (d.base().equals(f.base())) {
                    exponent -= d.exponent();
                }
            }
            if (exponent > 0) {
                out.add(new Factor(f.base(), exponent));
            }
        }
        return out;
    }

    private static Expr productOf(List<Factor> factors) {
        Expr acc = null;
        for (Factor f : factors) {
            Expr e = f.exponent() == 1 ? f.base() : Expr.pow(f.base(), Expr.num(f.exponent()));
            acc = acc == null ? e : Expr.mul(acc, e);
        }
        return acc;
    }
}
