package io.casengine.core.model;

/**
 * Number domain assumed by domain-sensitive rules. Identities such as {@code ln(a)+ln(b) = ln(a*b)}
 * only hold for positive reals and are disabled for {@link #COMPLEX}.
 */
public enum Domain {
    REAL,
    COMPLEX
}
