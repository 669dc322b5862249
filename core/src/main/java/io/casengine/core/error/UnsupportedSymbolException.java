package io.casengine.core.error;

import io.casengine.core.model.Step;
import java.util.List;

/**
 * Thrown when an operation meets a function or node it has no rule for, e.g. the derivative of
 * {@code gamma(x)}. URN: {@code urn:cas-engine:error:unsupported-symbol}
 */
public final class UnsupportedSymbolException extends CasEvaluationException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:cas-engine:error:unsupported-symbol";

    private final String symbol;

    public UnsupportedSymbolException(String message, String symbol, String operation, List<Step> partialSteps) {
        super(message, operation, partialSteps);
        this.symbol = symbol;
    }

    /** The offending function name or node kind. */
    public String symbol() {
        return symbol;
    }

    @Override
    public String urn() {
        return URN;
    }
}
