package io.casengine.core.render;

import io.casengine.core.model.Expr;
import io.casengine.core.model.Expr.BinaryOp;
import io.casengine.core.model.Expr.Call;
import io.casengine.core.model.Expr.Equation;
import io.casengine.core.model.Expr.Num;
import io.casengine.core.model.Expr.Var;
import io.casengine.core.model.ExpressionFormatter;
import io.casengine.core.model.Operator;
import io.casengine.core.spi.LatexRenderer;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Default {@link LatexRenderer}. Fractions become {@code \frac}, powers use braces, known
 * functions use their LaTeX operator names and {@code integral(f, x)} renders as an integral sign.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class DefaultLatexRenderer implements LatexRenderer {

    private static final Map<String, String> OPERATOR_NAMES = Map.ofEntries(
            Map.entry("sin", "\\sin"),
            Map.entry("cos", "\\cos"),
            Map.entry("tan", "\\tan"),
            Map.entry("sec", "\\sec"),
            Map.entry("csc", "\\csc"),
            Map.entry("cot", "\\cot"),
            Map.entry("asin", "\\arcsin"),
            Map.entry("acos", "\\arccos"),
            Map.entry("atan", "\\arctan"),
            Map.entry("sinh", "\\sinh"),
            Map.entry("cosh", "\\cosh"),
            Map.entry("tanh", "\\tanh"),
            Map.entry("ln", "\\ln"),
            Map.entry("log", "\\log"));

    @Override
    public String render(Expr expr) {
        if (expr instanceof Num n) {
            return ExpressionFormatter.formatNumber(n.value());
        }
        if (expr instanceof Var v) {
            return v.name().equals("pi") ? "\\pi" : v.name();
        }
        if (expr instanceof Equation eq) {
            return render(eq.lhs()) + " = " + render(eq.rhs());
        }
        if (expr instanceof Call c) {
            return call(c);
        }
        return binary((BinaryOp) expr);
    }

    private String binary(BinaryOp b) {
        Operator op = b.op();
        switch (op) {
            case ADD -> {
                return render(b.left()) + " + " + render(b.right());
            }
            case SUB -> {
                return render(b.left()) + " - " + wrapIf(b.right(), isSum(b.right()));
            }
            case MUL -> {
                if (b.left() instanceof Num n && n.value() == -1) {
                    return "-" + wrapIf(b.right(), isSum(b.right()));
                }
                String left = wrapIf(b.left(), isSum(b.left()));
                String right = wrapIf(b.right(), isSum(b.right()));
                boolean juxtapose = b.left() instanceof Num
                        && !right.isEmpty()
                        && !Character.isDigit(right.charAt(0))
                        && right.charAt(0) != '-';
                return juxtapose ? left + right : left + " \\cdot " + right;
            }
            case DIV -> {
                return "\\frac{" + render(b.left()) + "}{" + render(b.right()) + "}";
            }
            case POW -> {
                boolean wrapBase = b.left() instanceof BinaryOp
                        || b.left() instanceof Call
                        || (b.left() instanceof Num n && n.value() < 0);
                return wrapIf(b.left(), wrapBase) + "^{" + render(b.right()) + "}";
            }
            default -> throw new IllegalStateException("Unknown operator: " + op);
        }
    }

    private String call(Call c) {
        if (c.name().equals("integral") && c.args().size() == 2) {
            return "\\int " + render(c.args().get(0)) + " \\, d" + render(c.args().get(1));
        }
        if (c.args().size() == 1) {
            String arg = render(c.arg());
            switch (c.name()) {
                case "sqrt" -> {
                    return "\\sqrt{" + arg + "}";
                }
                case "exp" -> {
                    return "e^{" + arg + "}";
                }
                case "abs" -> {
                    return "\\left|" + arg + "\\right|";
                }
                default -> {
                    String name = OPERATOR_NAMES.get(c.name());
                    if (name != null) {
                        return name + "\\left(" + arg + "\\right)";
                    }
                }
            }
        }
        StringJoiner args = new StringJoiner(", ", "\\operatorname{" + c.name() + "}\\left(", "\\right)");
        c.args().forEach(a -> args.add(render(a)));
        return args.toString();
    }

    private String wrapIf(Expr expr, boolean wrap) {
        String s = render(expr);
        return wrap ? "\\left(" + s + "\\right)" : s;
    }

    private static boolean isSum(Expr expr) {
        return expr instanceof BinaryOp b && (b.op() == Operator.ADD || b.op() == Operator.SUB);
    }
}
