package io.casengine.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.casengine.core.error.CasException;
import io.casengine.core.error.ExpressionParseException;
import io.casengine.core.error.SolverUnavailableException;
import io.casengine.core.error.UnsupportedSymbolException;
import io.casengine.core.model.CasResult;
import io.casengine.core.model.EquationSolution;
import io.casengine.core.model.Expr;
import io.casengine.core.model.SeriesExpansion;
import io.casengine.core.model.Step;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Builds JSON views of results and errors for outer surfaces such as the CLI.
 *
 * <p>
 * Expressions are written as compact infix text. Errors become RFC 9457 problem documents with
 * {@code type}, {@code title}, {@code status}, {@code detail} and {@code instance} members, plus
 * the extension members {@code operation} and {@code partialSteps}.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class ResultJsonBuilder {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final int INPUT_ERROR_STATUS = 400;
    static final int EVALUATION_ERROR_STATUS = 422;

    /** JSON for a simplify, differentiate or integrate result. */
    public JsonNode result(CasResult result) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("original", result.original());
        node.put("result", result.resultText());
        if (result.latex().isPresent()) {
            node.put("latex", result.latex().get());
        } else {
            node.putNull("latex");
        }
        putNumber(node, "numeric", result.numeric());

        ObjectNode metadata = node.putObject("metadata");
        metadata.put("complexity", result.metadata().complexity());
        putStrings(metadata.putArray("operatorsUsed"), result.metadata().operatorsUsed());
        putStrings(metadata.putArray("variables"), result.metadata().variables());
        putStrings(metadata.putArray("functions"), result.metadata().functions());

        node.set("steps", steps(result.steps()));
        putStrings(node.putArray("warnings"), result.warnings());
        return node;
    }

    /** JSON for an equation or system solution. */
    public JsonNode solution(EquationSolution solution) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("variable", solution.variable());
        node.put("kind", solution.kind().name().toLowerCase(Locale.ROOT));
        node.put("domain", solution.domain());
        ArrayNode solutions = node.putArray("solutions");
        ArrayNode values = node.putArray("values");
        for (Expr s : solution.solutions()) {
            solutions.add(s.toString());
            Expr value = s instanceof Expr.Equation eq ? eq.rhs() : s;
            OptionalDouble v = NumericEvaluator.tryEvaluate(value);
            if (v.isPresent()) {
                values.add(v.getAsDouble());
            } else {
                values.addNull();
            }
        }
        if (!solution.assignments().isEmpty()) {
            ObjectNode assignments = node.putObject("assignments");
            solution.assignments().forEach((name, value) -> assignments.put(name, value.toString()));
        }
        node.set("steps", steps(solution.steps()));
        return node;
    }

    /** JSON for a Taylor series. An unbounded radius is written as the string {@code "Infinity"}. */
    public JsonNode series(SeriesExpansion series) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("source", series.source());
        node.put("variable", series.variable());
        node.put("center", series.center());
        node.put("order", series.order());
        ArrayNode terms = node.putArray("terms");
        series.terms().forEach(t -> terms.add(t.toString()));
        node.put("polynomial", series.polynomial().toString());
        node.put("remainder", series.remainder().toString());
        if (Double.isInfinite(series.convergenceRadius())) {
            node.put("convergenceRadius", "Infinity");
        } else {
            node.put("convergenceRadius", series.convergenceRadius());
        }
        return node;
    }

    /**
     * RFC 9457 problem document for a failed call. Input errors map to status 400, evaluation
     * errors to 422.
     */
    public JsonNode problem(CasException exception) {
        ObjectNode node = MAPPER.createObjectNode();
        boolean input = exception.phase() == CasException.Phase.PARSE;
        node.put("type", exception.urn());
        node.put("title", input ? "Invalid Expression" : "Computation Failed");
        node.put("status", input ? INPUT_ERROR_STATUS : EVALUATION_ERROR_STATUS);
        node.put("detail", exception.detail());
        if (exception.operation() != null) {
            node.put("instance", "urn:cas-engine:operation:" + exception.operation());
            node.put("operation", exception.operation());
        } else {
            node.putNull("instance");
        }

        if (exception instanceof ExpressionParseException parse) {
            putStrings(node.putArray("errors"), parse.errors());
        } else if (exception instanceof UnsupportedSymbolException unsupported) {
            node.put("symbol", unsupported.symbol());
        } else if (exception instanceof SolverUnavailableException unavailable) {
            node.put("reason", unavailable.reason().name().toLowerCase(Locale.ROOT));
        }
        node.set("partialSteps", steps(exception.partialSteps()));
        return node;
    }

    // --- Private helpers ---

    private static ArrayNode steps(List<Step> steps) {
        ArrayNode array = MAPPER.createArrayNode();
        for (Step step : steps) {
            ObjectNode s = array.addObject();
            s.put("index", step.index());
            s.put("operation", step.operation());
            s.put("rule", step.rule());
            s.put("before", step.before().toString());
            s.put("after", step.after().toString());
            s.put("explanation", step.explanation());
        }
        return array;
    }

    private static void putNumber(ObjectNode node, String field, OptionalDouble value) {
        if (value.isPresent()) {
            node.put(field, value.getAsDouble());
        } else {
            node.putNull(field);
        }
    }

    private static void putStrings(ArrayNode array, List<String> values) {
        values.forEach(array::add);
    }
}
