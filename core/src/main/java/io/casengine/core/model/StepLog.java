package io.casengine.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only step trace owned by a single call. Indices are assigned in application order,
 * starting at 1. Not thread-safe; never shared between calls.
 */
public final class StepLog {

    private final List<Step> steps = new ArrayList<>();

    /** Appends a step and returns it. */
    public Step record(String operation, Expr before, Expr after, String rule, String explanation) {
        Step step = new Step(steps.size() + 1, operation, before, after, rule, explanation);
        steps.add(step);
        return step;
    }

    /** Appends the given steps, renumbering them to continue this log. */
    public void appendAll(List<Step> other) {
        for (Step s : other) {
            record(s.operation(), s.before(), s.after(), s.rule(), s.explanation());
        }
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    /** Immutable snapshot of the steps recorded so far. */
    public List<Step> steps() {
        return List.copyOf(steps);
    }
}
