package io.casengine.core.error;

import java.util.List;

/**
 * Thrown when expression text cannot be parsed, or parses to the wrong shape (e.g. a solve
 * request without {@code =}). URN: {@code urn:cas-engine:error:parse-failed}
 */
public final class ExpressionParseException extends CasInputException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:cas-engine:error:parse-failed";

    private final List<String> errors;

    public ExpressionParseException(String operation, List<String> errors) {
        super("Invalid expression: " + String.join("; ", errors), operation);
        this.errors = List.copyOf(errors);
    }

    /** Individual parse error messages, in input order. */
    public List<String> errors() {
        return errors;
    }

    @Override
    public String urn() {
        return URN;
    }
}
