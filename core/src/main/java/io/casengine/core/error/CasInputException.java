package io.casengine.core.error;

/**
 * Abstract parent for errors in the caller's input. Raised before any transformation runs, so
 * these never carry partial steps.
 */
public abstract class CasInputException extends CasException {

    private static final long serialVersionUID = 1L;

    protected CasInputException(String message, String operation) {
        super(message, operation, Phase.PARSE, null);
    }
}
