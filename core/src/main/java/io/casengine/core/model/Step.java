package io.casengine.core.model;

import java.util.Objects;

/**
 * One explainable transformation. {@code before} and {@code after} are the local subtree the rule
 * rewrote, not the whole expression.
 *
 * @param index       1-based position in the trace
 * @param operation   the entry point that produced the step (e.g. {@code "simplify"})
 * @param before      subtree before the rewrite
 * @param after       subtree after the rewrite
 * @param rule        id of the applied rule (e.g. {@code "combine-like-terms"})
 * @param explanation human-readable sentence
 */
public record Step(int index, String operation, Expr before, Expr after, String rule, String explanation) {

    public Step {
        if (index < 1) {
            throw new IllegalArgumentException("index must be >= 1, got: " + index);
        }
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(before, "before must not be null");
        Objects.requireNonNull(after, "after must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(explanation, "explanation must not be null");
    }
}
