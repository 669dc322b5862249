package io.casengine.core.model;

import io.casengine.core.model.Expr.BinaryOp;
import io.casengine.core.model.Expr.Num;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Numeric-constant helpers shared by the rule library and the engine components. A constant is
 * either a {@link Num} or an exact fraction {@code p/q} of two numbers.
 */
public final class Constants {

    /** Largest denominator tried when recovering an exact fraction from a double. */
    static final int MAX_DENOMINATOR = 1000;

    private static final double FRACTION_TOLERANCE = 1e-12;

    private Constants() {}

    /** Value of a numeric literal or a fraction of two literals; empty for anything else. */
    public static OptionalDouble valueOf(Expr expr) {
        if (expr instanceof Num n) {
            return OptionalDouble.of(n.value());
        }
        if (expr instanceof BinaryOp b
                && b.op() == Operator.DIV
                && b.left() instanceof Num p
                && b.right() instanceof Num q
                && q.value() != 0) {
            return OptionalDouble.of(p.value() / q.value());
        }
        return OptionalDouble.empty();
    }

    public static boolean isConstant(Expr expr) {
        return valueOf(expr).isPresent();
    }

    /** {@code true} if {@code expr} is a literal with the given value. */
    public static boolean isNumber(Expr expr, double value) {
        return expr instanceof Num n && n.value() == value;
    }

    public static boolean isInteger(double value) {
        return Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15;
    }

    /**
     * Exact representation of {@code value}: an integer literal, or a reduced fraction with a
     * denominator of at most {@value #MAX_DENOMINATOR}. Empty if neither fits.
     */
    public static Optional<Expr> exact(double value) {
        if (!Double.isFinite(value)) {
            return Optional.empty();
        }
        if (isInteger(value)) {
            return Optional.of(new Num(value));
        }
        double tolerance = FRACTION_TOLERANCE * Math.max(1.0, Math.abs(value));
        for (int q = 2; q <= MAX_DENOMINATOR; q++) {
            double p = Math.rint(value * q);
            if (Math.abs(p / q - value) <= tolerance && Math.abs(p) < 1e15) {
                long g = gcd((long) Math.abs(p), q);
                return Optional.of(Expr.div(new Num(p / g), new Num((double) q / g)));
            }
        }
        return Optional.empty();
    }

    /** Exact form of {@code value} when one exists, otherwise a plain literal. */
    public static Expr constant(double value) {
        return exact(value).orElseGet(() -> new Num(value));
    }

    public static long gcd(long a, long b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }
}
