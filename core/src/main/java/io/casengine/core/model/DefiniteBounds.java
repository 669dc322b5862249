package io.casengine.core.model;

/** Bounds of a definite integral. Both must be finite; {@code lower > upper} is allowed. */
public record DefiniteBounds(double lower, double upper) {

    public DefiniteBounds {
        if (!Double.isFinite(lower) || !Double.isFinite(upper)) {
            throw new IllegalArgumentException("Bounds must be finite, got: [" + lower + ", " + upper + "]");
        }
    }
}
