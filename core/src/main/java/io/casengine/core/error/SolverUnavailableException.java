package io.casengine.core.error;

import io.casengine.core.model.Step;
import java.util.List;

/**
 * Thrown when an equation cannot be solved by the available methods. URN:
 * {@code urn:cas-engine:error:solver-unavailable}
 */
public final class SolverUnavailableException extends CasEvaluationException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:cas-engine:error:solver-unavailable";

    /** Why no solution was produced. */
    public enum Reason {
        /** Only a numeric method could solve it, and numeric fallback is disabled. */
        NEEDS_NUMERICAL_METHOD,
        /** No method produced a solution. */
        UNSOLVED
    }

    private final Reason reason;

    public SolverUnavailableException(String message, Reason reason, String operation, List<Step> partialSteps) {
        super(message, operation, partialSteps);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    @Override
    public String urn() {
        return URN;
    }
}
