package io.casengine.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A truncated Taylor series.
 *
 * @param source            the input text
 * @param variable          expansion variable
 * @param center            expansion point
 * @param order             highest included power
 * @param terms             {@code order + 1} terms, lowest power first; zero terms are {@code Num(0)}
 * @param remainder         the order+1 term, an approximation of the truncation error
 * @param convergenceRadius estimated radius, {@link Double#POSITIVE_INFINITY} when unbounded
 */
public record SeriesExpansion(
        String source,
        String variable,
        double center,
        int order,
        List<Expr> terms,
        Expr remainder,
        double convergenceRadius) {

    public SeriesExpansion {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(remainder, "remainder must not be null");
        terms = List.copyOf(terms);
    }

    /** Sum of the non-zero terms, lowest power first; {@code Num(0)} if all are zero. */
    public Expr polynomial() {
        Expr sum = null;
        for (Expr term : terms) {
            if (Constants.isNumber(term, 0)) {
                continue;
            }
            if (sum == null) {
                sum = term;
            } else if (term instanceof Expr.BinaryOp b
                    && b.op() == Operator.MUL
                    && Constants.valueOf(b.left()).orElse(0) < 0) {
                double c = -Constants.valueOf(b.left()).getAsDouble();
                Expr magnitude = c == 1 ? b.right() : Expr.mul(Constants.constant(c), b.right());
                sum = Expr.sub(sum, magnitude);
            } else if (Constants.valueOf(term).orElse(0) < 0) {
                sum = Expr.sub(sum, Constants.constant(-Constants.valueOf(term).getAsDouble()));
            } else {
                sum = Expr.add(sum, term);
            }
        }
        return sum == null ? Expr.num(0) : sum;
    }
}
