package io.casengine.core.model;

/** Classification of a solved equation. */
public enum EquationKind {
    LINEAR,
    QUADRATIC,
    POLYNOMIAL,
    /**
     * Anything that is not a polynomial in the variable and is solved numerically: functions of
     * the variable, and also rational equations such as {@code 1/x = 2}.
     */
    TRANSCENDENTAL,
    SYSTEM
}
