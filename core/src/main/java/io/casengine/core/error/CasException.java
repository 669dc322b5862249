package io.casengine.core.error;

import io.casengine.core.model.Step;
import java.util.List;

/**
 * Abstract base for all cas-engine exceptions. Never thrown directly; use the concrete subclasses
 * under {@link CasInputException} or {@link CasEvaluationException}.
 *
 * <p>
 * Steps recorded before the failure travel on the exception so callers can still show how far
 * the computation got.
 */
public abstract class CasException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        EVALUATION
    }

    private final String operation;
    private final Phase phase;
    private final transient List<Step> partialSteps;

    protected CasException(String message, String operation, Phase phase, List<Step> partialSteps) {
        super(message);
        this.operation = operation;
        this.phase = phase;
        this.partialSteps = partialSteps == null ? List.of() : List.copyOf(partialSteps);
    }

    protected CasException(String message, Throwable cause, String operation, Phase phase, List<Step> partialSteps) {
        super(message, cause);
        this.operation = operation;
        this.phase = phase;
        this.partialSteps = partialSteps == null ? List.of() : List.copyOf(partialSteps);
    }

    /** The entry point that failed (e.g. {@code "differentiate"}), or {@code null} if not yet known. */
    public String operation() {
        return operation;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }

    /** Steps completed before the failure; empty if none. */
    public List<Step> partialSteps() {
        return partialSteps;
    }

    /** Problem-type URN identifying the concrete error kind. */
    public abstract String urn();
}
