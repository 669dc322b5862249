package io.casengine.core.spi;

/**
 * Rule families. The simplifier applies them in declaration order within each pass.
 */
public enum RuleCategory {
    ARITHMETIC,
    ALGEBRAIC,
    TRIGONOMETRIC,
    EXPONENTIAL,
    LOGARITHMIC
}
