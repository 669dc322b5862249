package io.casengine.core.error;

import io.casengine.core.model.Step;
import java.util.List;

/**
 * Thrown when an expression has no finite numeric value where one is required, e.g. a series
 * coefficient at a singular point. URN: {@code urn:cas-engine:error:numeric-evaluation-failed}
 */
public final class NumericEvaluationException extends CasEvaluationException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:cas-engine:error:numeric-evaluation-failed";

    public NumericEvaluationException(String message, String operation, List<Step> partialSteps) {
        super(message, operation, partialSteps);
    }

    @Override
    public String urn() {
        return URN;
    }
}
