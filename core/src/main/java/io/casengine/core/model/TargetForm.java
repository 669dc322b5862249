package io.casengine.core.model;

/** Shape the simplifier should leave an expression in. */
public enum TargetForm {
    SIMPLIFIED,
    /** Distribute products and small integer powers of sums. */
    EXPANDED,
    /** Pull common factors out of sums. */
    FACTORED
}
