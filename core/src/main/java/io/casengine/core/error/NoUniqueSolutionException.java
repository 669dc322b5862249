package io.casengine.core.error;

import io.casengine.core.model.Step;
import java.util.List;

/**
 * Thrown when a linear system is singular or not square. URN:
 * {@code urn:cas-engine:error:no-unique-solution}
 */
public final class NoUniqueSolutionException extends CasEvaluationException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:cas-engine:error:no-unique-solution";

    public NoUniqueSolutionException(String message, String operation, List<Step> partialSteps) {
        super(message, operation, partialSteps);
    }

    @Override
    public String urn() {
        return URN;
    }
}
