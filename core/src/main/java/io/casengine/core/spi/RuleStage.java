package io.casengine.core.spi;

/**
 * When the simplifier runs a rule. Expansion and factoring undo each other, so they only run in
 * the target-form stage that asks for them.
 */
public enum RuleStage {
    /** Part of every fixpoint pass. */
    FIXPOINT,
    /** Only when the target form is expanded. */
    EXPAND,
    /** Only when the target form is factored. */
    FACTOR
}
