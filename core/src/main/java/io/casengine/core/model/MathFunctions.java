package io.casengine.core.model;

import java.util.OptionalDouble;
import java.util.Set;

/**
 * Numeric table of the built-in unary functions. Shared by constant folding and numeric
 * evaluation so both agree on names and semantics.
 */
public final class MathFunctions {

    /** Functions with a numeric implementation. */
    public static final Set<String> NAMES = Set.of(
            "sin", "cos", "tan", "sec", "csc", "cot", "asin", "acos", "atan", "sinh", "cosh", "tanh", "exp", "ln",
            "log", "sqrt", "abs");

    /** Names parsed as constants rather than variables. */
    public static final Set<String> CONSTANTS = Set.of("pi", "e");

    private MathFunctions() {}

    public static boolean isKnown(String name) {
        return NAMES.contains(name);
    }

    /**
     * Applies the named function. Empty if the name is unknown; a domain error yields
     * {@code NaN} (inside the optional) so callers can distinguish the two cases.
     */
    public static OptionalDouble apply(String name, double x) {
        double v;
        switch (name) {
            case "sin" -> v = Math.sin(x);
            case "cos" -> v = Math.cos(x);
            case "tan" -> v = Math.tan(x);
            case "sec" -> v = 1 / Math.cos(x);
            case "csc" -> v = 1 / Math.sin(x);
            case "cot" -> v = 1 / Math.tan(x);
            case "asin" -> v = Math.asin(x);
            case "acos" -> v = Math.acos(x);
            case "atan" -> v = Math.atan(x);
            case "sinh" -> v = Math.sinh(x);
            case "cosh" -> v = Math.cosh(x);
            case "tanh" -> v = Math.tanh(x);
            case "exp" -> v = Math.exp(x);
            case "ln" -> v = x > 0 ? Math.log(x) : Double.NaN;
            case "log" -> v = x > 0 ? Math.log10(x) : Double.NaN;
            case "sqrt" -> v = x >= 0 ? Math.sqrt(x) : Double.NaN;
            case "abs" -> v = Math.abs(x);
            default -> {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.of(v);
    }

    /** Value of a named constant, or empty. */
    public static OptionalDouble constant(String name) {
        return switch (name) {
            case "pi" -> OptionalDouble.of(Math.PI);
            case "e" -> OptionalDouble.of(Math.E);
            default -> OptionalDouble.empty();
        };
    }
}
