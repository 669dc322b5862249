package io.casengine.core.error;

import io.casengine.core.model.Step;
import java.util.List;

/**
 * Abstract parent for failures while transforming a valid expression: no rule exists, no unique
 * answer exists, or a numeric value is undefined.
 */
public abstract class CasEvaluationException extends CasException {

    private static final long serialVersionUID = 1L;

    protected CasEvaluationException(String message, String operation, List<Step> partialSteps) {
        super(message, operation, Phase.EVALUATION, partialSteps);
    }

    protected CasEvaluationException(String message, Throwable cause, String operation, List<Step> partialSteps) {
        super(message, cause, operation, Phase.EVALUATION, partialSteps);
    }
}
