package io.casengine.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of parsing expression text.
 *
 * @param valid     {@code true} if {@code ast} is present and {@code errors} empty
 * @param ast       parsed tree, or {@code null} when invalid
 * @param errors    parse error messages, in input order
 * @param variables variable names in order of first occurrence, excluding the constants {@code pi} and {@code e}
 * @param functions function names referenced
 */
public record ParseResult(boolean valid, Expr ast, List<String> errors, Set<String> variables, Set<String> functions) {

    public ParseResult {
        Objects.requireNonNull(errors, "errors must not be null");
        Objects.requireNonNull(variables, "variables must not be null");
        Objects.requireNonNull(functions, "functions must not be null");
        if (valid && ast == null) {
            throw new IllegalArgumentException("valid parse result must carry an ast");
        }
        errors = List.copyOf(errors);
        variables = Collections.unmodifiableSet(new LinkedHashSet<>(variables));
        functions = Collections.unmodifiableSet(new LinkedHashSet<>(functions));
    }

    public static ParseResult success(Expr ast, Set<String> variables, Set<String> functions) {
        return new ParseResult(true, ast, List.of(), variables, functions);
    }

    public static ParseResult failure(List<String> errors) {
        return new ParseResult(false, null, errors, Set.of(), Set.of());
    }
}
