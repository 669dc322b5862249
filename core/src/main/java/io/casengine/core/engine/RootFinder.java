package io.casengine.core.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * Numeric real-root search over a fixed interval: a uniform sample scan, bisection on every sign
 * change, and ternary refinement of local minima of {@code |f|} for roots that touch zero without
 * crossing it. Sign changes across poles are rejected by checking the residual.
 */
final class RootFinder {

    /** A bisection result with a larger residual is a pole, not a root. */
    static final double RESIDUAL_TOLERANCE = 1e-6;

    private static final double TANGENT_TOLERANCE = 1e-9;
    private static final double DUPLICATE_TOLERANCE = 1e-7;
    private static final double INTEGER_SNAP = 1e-7;
    private static final int ITERATIONS = 200;

    private final double min;
    private final double max;
    private final int samples;

    RootFinder(double min, double max, int samples) {
        this.min = min;
        this.max = max;
        this.samples = samples;
    }

    /** Distinct roots of {@code f} in {@code [min, max]}, ascending. */
    List<Double> findRoots(DoubleUnaryOperator f) {
        double step = (max - min) / samples;
        double[] xs = new double[samples + 1];
        double[] ys = new double[samples + 1];
        for (int i = 0; i <= samples; i++) {
            xs[i] = min + i * step;
            ys[i] = f.applyAsDouble(xs[i]);
        }

        List<Double> roots = new ArrayList<>();
        for (int i = 0; i <= samples; i++) {
            if (ys[i] == 0) {
                roots.add(xs[i]);
                continue;
            }
            if (i < samples && Double.isFinite(ys[i]) && Double.isFinite(ys[i + 1]) && ys[i] * ys[i + 1] < 0) {
                double root = bisect(f, xs[i], xs[i + 1], ys[i]);
                if (Math.abs(f.applyAsDouble(root)) <= RESIDUAL_TOLERANCE) {
                    roots.add(root);
                }
            }
            if (i > 0 && i < samples && isTouchingMinimum(ys[i - 1], ys[i], ys[i + 1])) {
                double root = refineMinimum(f, xs[i - 1], xs[i + 1]);
                if (Math.abs(f.applyAsDouble(root)) <= TANGENT_TOLERANCE) {
                    roots.add(root);
                }
            }
        }
        return clean(roots);
    }

    private static boolean isTouchingMinimum(double before, double at, double after) {
        if (!Double.isFinite(before) || !Double.isFinite(at) || !Double.isFinite(after)) {
            return false;
        }
        // same sign on both sides: a crossing is handled by bisection
        boolean sameSide = before * at > 0 && at * after > 0;
        return sameSide && Math.abs(at) < Math.abs(before) && Math.abs(at) <= Math.abs(after);
    }

    private static double bisect(DoubleUnaryOperator f, double lo, double hi, double fLo) {
        double a = lo;
        double b = hi;
        double fa = fLo;
        for (int i = 0; i < ITERATIONS && b - a > 0; i++) {
            double mid = (a + b) / 2;
            if (mid <= a || mid >= b) {
                break;
            }
            double fm = f.applyAsDouble(mid);
            if (fm == 0) {
                return mid;
            }
            if (fa * fm < 0) {
                b = mid;
            } else {
                a = mid;
                fa = fm;
            }
        }
        return (a + b) / 2;
    }

    private static double refineMinimum(DoubleUnaryOperator f, double lo, double hi) {
        double a = lo;
        double b = hi;
        for (int i = 0; i < ITERATIONS; i++) {
            double m1 = a + (b - a) / 3;
            double m2 = b - (b - a) / 3;
            if (Math.abs(f.applyAsDouble(m1)) < Math.abs(f.applyAsDouble(m2))) {
                b = m2;
            } else {
                a = m1;
            }
        }
        return (a + b) / 2;
    }

    private static List<Double> clean(List<Double> roots) {
        List<Double> sorted = new ArrayList<>();
        for (double r : roots) {
            double nearest = Math.rint(r);
            sorted.add(Math.abs(r - nearest) < INTEGER_SNAP ? nearest + 0.0 : r);
        }
        Collections.sort(sorted);
        List<Double> out = new ArrayList<>();
        for (double r : sorted) {
            if (out.isEmpty() || Math.abs(r - out.get(out.size() - 1)) > DUPLICATE_TOLERANCE) {
                out.add(r);
            }
        }
        return out;
    }
}
