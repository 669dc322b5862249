package io.casengine.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Result of a simplify, differentiate or integrate call.
 *
 * <p>
 * Thread-safe and immutable.
 *
 * @param original the input text as supplied by the caller
 * @param result   the final expression
 * @param steps    ordered step trace
 * @param latex    LaTeX rendering of {@code result}, if a renderer produced one
 * @param numeric  numeric value of {@code result} (definite integrals, constant expressions)
 * @param metadata structural facts about the input and result
 * @param warnings conditions the caller must see, e.g. an undefined definite integral
 */
public record CasResult(
        String original,
        Expr result,
        List<Step> steps,
        Optional<String> latex,
        OptionalDouble numeric,
        Metadata metadata,
        List<String> warnings) {

    public CasResult {
        Objects.requireNonNull(original, "original must not be null");
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(latex, "latex must not be null");
        Objects.requireNonNull(numeric, "numeric must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        steps = List.copyOf(steps);
        warnings = List.copyOf(warnings);
    }

    /** Compact infix text of {@link #result()}. */
    public String resultText() {
        return ExpressionFormatter.format(result);
    }

    /**
     * @param complexity    node count of the result tree
     * @param operatorsUsed operator symbols occurring in the result, in first-occurrence order
     * @param variables     variables referenced by the input
     * @param functions     functions referenced by the input
     */
    public record Metadata(int complexity, List<String> operatorsUsed, List<String> variables, List<String> functions) {
        public Metadata {
            operatorsUsed = List.copyOf(operatorsUsed);
            variables = List.copyOf(variables);
            functions = List.copyOf(functions);
        }
    }
}
