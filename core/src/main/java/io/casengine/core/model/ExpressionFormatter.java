package io.casengine.core.model;

import io.casengine.core.model.Expr.BinaryOp;
import io.casengine.core.model.Expr.Call;
import io.casengine.core.model.Expr.Equation;
import io.casengine.core.model.Expr.Num;
import io.casengine.core.model.Expr.Var;
import java.util.StringJoiner;

/**
 * Renders an {@link Expr} as compact infix text, e.g. {@code 3*x^2} or
 * {@code sin(x) + x*cos(x)}. Additive operators are spaced; multiplicative and power operators
 * are not. Parentheses are emitted only where precedence or associativity requires them.
 */
public final class ExpressionFormatter {

    private ExpressionFormatter() {}

    public static String format(Expr expr) {
        if (expr instanceof Num n) {
            return formatNumber(n.value());
        }
        if (expr instanceof Var v) {
            return v.name();
        }
        if (expr instanceof Call c) {
            StringJoiner args = new StringJoiner(", ", c.name() + "(", ")");
            for (Expr arg : c.args()) {
                args.add(format(arg));
            }
            return args.toString();
        }
        if (expr instanceof Equation eq) {
            return format(eq.lhs()) + " = " + format(eq.rhs());
        }
        return formatBinary((BinaryOp) expr);
    }

    /** Integral values print without a fractional part. */
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static String formatBinary(BinaryOp b) {
        Operator op = b.op();
        if (op == Operator.MUL && b.left() instanceof Num n && n.value() == -1) {
            String operand = format(b.right());
            if (needsParens(b.right(), op.precedence()) || operand.startsWith("-")) {
                operand = "(" + operand + ")";
            }
            return "-" + operand;
        }

        String left = format(b.left());
        boolean wrapLeft = op == Operator.POW
                ? b.left() instanceof BinaryOp || left.startsWith("-")
                : needsParens(b.left(), op.precedence());
        if (wrapLeft) {
            left = "(" + left + ")";
        }

        String right = format(b.right());
        boolean wrapRight = right.startsWith("-")
                || needsParens(b.right(), op.precedence())
                || (!op.isAssociative() && b.right() instanceof BinaryOp rb && rb.op().precedence() == op.precedence());
        if (wrapRight) {
            right = "(" + right + ")";
        }

        return switch (op) {
            case ADD, SUB -> left + " " + op.symbol() + " " + right;
            case MUL, DIV, POW -> left + op.symbol() + right;
        };
    }

    private static boolean needsParens(Expr child, int parentPrecedence) {
        if (child instanceof Equation) {
            return true;
        }
        if (!(child instanceof BinaryOp b)) {
            return false;
        }
        // -1*u renders as unary minus, which binds like multiplication
        return b.op().precedence() < parentPrecedence;
    }
}
