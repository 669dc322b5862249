package io.casengine.core.engine;

import io.casengine.core.error.CasException;
import io.casengine.core.error.ExpressionParseException;
import io.casengine.core.model.CasResult;
import io.casengine.core.model.Constants;
import io.casengine.core.model.DefiniteBounds;
import io.casengine.core.model.EquationSolution;
import io.casengine.core.model.Expr;
import io.casengine.core.model.Expr.BinaryOp;
import io.casengine.core.model.Expr.Equation;
import io.casengine.core.model.ParseResult;
import io.casengine.core.model.SeriesExpansion;
import io.casengine.core.model.SimplifyOptions;
import io.casengine.core.model.StepLog;
import io.casengine.core.model.TargetForm;
import io.casengine.core.parser.RecursiveDescentParser;
import io.casengine.core.render.DefaultLatexRenderer;
import io.casengine.core.rules.RuleRegistry;
import io.casengine.core.spi.CasTelemetryListener;
import io.casengine.core.spi.ExpressionParser;
import io.casengine.core.spi.LatexRenderer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.function.Supplier;
import java.util.function.ToIntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point of the library: parses text, runs one of the engine components on the tree and
 * packages the result with its step trace.
 *
 * <p>
 * Every call parses first; an invalid parse short-circuits with
 * {@link ExpressionParseException} before any transformation runs. While a call runs, the MDC key
 * {@value #MDC_OPERATION} holds the operation name.
 *
 * <p>
 * Thread-safe: all collaborators are stateless, and every call owns its own {@link StepLog}.
 */
public final class CasEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CasEngine.class);

    /** MDC key set for the duration of an entry-point call. */
    public static final String MDC_OPERATION = "casOperation";

    /** Variable added to indefinite integrals. */
    public static final String INTEGRATION_CONSTANT = "C";

    private final CasConfig config;
    private final ExpressionParser parser;
    private final LatexRenderer latexRenderer;
    private final CasTelemetryListener telemetryListener;
    private final Simplifier simplifier;
    private final Differentiator differentiator;
    private final Integrator integrator;
    private final EquationSolver equationSolver;
    private final LinearSystemSolver linearSystemSolver;
    private final SeriesExpander seriesExpander;

    /** Creates an engine with the default configuration, parser, renderer and rules. */
    public CasEngine() {
        this(CasConfig.DEFAULT);
    }

    /**
     * Creates an engine with the given configuration and the default collaborators.
     *
     * @param config engine-wide defaults
     */
    public CasEngine(CasConfig config) {
        this(config, null);
    }

    /**
     * Creates an engine with the given configuration and telemetry listener.
     *
     * @param config            engine-wide defaults
     * @param telemetryListener optional listener for operation lifecycle events, may be null
     */
    public CasEngine(CasConfig config, CasTelemetryListener telemetryListener) {
        this(config, new RecursiveDescentParser(), new DefaultLatexRenderer(), RuleRegistry.standard(), telemetryListener);
    }

    /**
     * Creates an engine with all collaborators.
     *
     * @param config            engine-wide defaults
     * @param parser            turns text into trees
     * @param latexRenderer     renders results as LaTeX
     * @param rules             rewrite rules used by every simplification
     * @param telemetryListener optional listener for operation lifecycle events, may be null
     */
    public CasEngine(
            CasConfig config,
            ExpressionParser parser,
            LatexRenderer latexRenderer,
            RuleRegistry rules,
            CasTelemetryListener telemetryListener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.latexRenderer = Objects.requireNonNull(latexRenderer, "latexRenderer must not be null");
        this.telemetryListener = telemetryListener; // nullable
        this.simplifier = new Simplifier(rules);
        this.differentiator = new Differentiator();
        this.integrator = new Integrator(simplifier, config.simplifyOptions().withTargetForm(TargetForm.SIMPLIFIED));
        this.equationSolver = new EquationSolver(simplifier, config);
        this.linearSystemSolver = new LinearSystemSolver(simplifier, config);
        this.seriesExpander = new SeriesExpander(simplifier, differentiator, config);
    }

    /** The configuration this engine was built with. */
    public CasConfig config() {
        return config;
    }

    // --- Simplify ---

    /** Simplifies {@code text} with the configured defaults. */
    public CasResult simplify(String text) {
        return simplify(text, config.simplifyOptions());
    }

    /**
     * Simplifies {@code text}.
     *
     * @throws ExpressionParseException if the text does not parse
     */
    public CasResult simplify(String text, SimplifyOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        return run(Simplifier.OPERATION, text, () -> {
            ParseResult parsed = parse(text, Simplifier.OPERATION);
            StepLog log = new StepLog();
            Simplifier.Outcome outcome = simplifier.simplify(parsed.ast(), options, log);
            return result(text, parsed, outcome.result(), log, OptionalDouble.empty(), outcome.warnings());
        }, r -> r.steps().size());
    }

    /** Simplifies an already-built tree with the configured defaults, without a trace. */
    public Expr simplifyTree(Expr expr) {
        return simplifier.simplify(expr, config.simplifyOptions());
    }

    // --- Differentiate ---

    public CasResult differentiate(String text, String variable) {
        return differentiate(text, variable, 1);
    }

    /**
     * Differentiates {@code text} {@code order} times with respect to {@code variable}, then
     * simplifies once.
     *
     * @param variable the variable, or null for the configured default
     * @throws IllegalArgumentException if {@code order < 1}
     * @throws io.casengine.core.error.UnsupportedSymbolException if a node has no rule
     */
    public CasResult differentiate(String text, String variable, int order) {
        if (order < 1) {
            throw new IllegalArgumentException("order must be at least 1, got: " + order);
        }
        String v = variableOrDefault(variable);
        return run(Differentiator.OPERATION, text, () -> {
            ParseResult parsed = parse(text, Differentiator.OPERATION);
            StepLog log = new StepLog();
            Expr current = parsed.ast();
            for (int i = 0; i < order; i++) {
                current = differentiator.derivative(current, v, log);
            }
            Simplifier.Outcome outcome = simplifier.simplify(current, config.simplifyOptions(), log);
            return result(text, parsed, outcome.result(), log, OptionalDouble.empty(), outcome.warnings());
        }, r -> r.steps().size());
    }

    // --- Integrate ---

    /** Indefinite integral; the result carries the constant {@code C}. */
    public CasResult integrate(String text, String variable) {
        return integrate(text, variable, Optional.empty());
    }

    /** Definite integral over {@code bounds}; the numeric value is {@code F(upper) - F(lower)}. */
    public CasResult integrate(String text, String variable, DefiniteBounds bounds) {
        return integrate(text, variable, Optional.of(bounds));
    }

    /**
     * Integrates {@code text} with respect to {@code variable}. Integrands without a rule stay
     * as unevaluated {@code integral(f, x)} nodes.
     *
     * @param variable the variable, or null for the configured default
     * @param bounds   bounds of a definite integral, or empty for an antiderivative
     */
    public CasResult integrate(String text, String variable, Optional<DefiniteBounds> bounds) {
        Objects.requireNonNull(bounds, "bounds must not be null");
        String v = variableOrDefault(variable);
        return run(Integrator.OPERATION, text, () -> {
            ParseResult parsed = parse(text, Integrator.OPERATION);
            StepLog log = new StepLog();
            Expr antiderivative = integrator.antiderivative(parsed.ast(), v, log);
            Simplifier.Outcome outcome = simplifier.simplify(antiderivative, config.simplifyOptions(), log);
            List<String> warnings = new ArrayList<>(outcome.warnings());
            Expr f = outcome.result();
            if (bounds.isEmpty()) {
                Expr withConstant = Expr.add(f, Expr.var(INTEGRATION_CONSTANT));
                log.record(Integrator.OPERATION, f, withConstant, "integration-constant",
                        "Add the constant of integration");
                return result(text, parsed, withConstant, log, OptionalDouble.empty(), warnings);
            }
            OptionalDouble value = evaluateBounds(f, v, bounds.get(), log, warnings);
            return result(text, parsed, f, log, value, warnings);
        }, r -> r.steps().size());
    }

    private OptionalDouble evaluateBounds(
            Expr antiderivative, String variable, DefiniteBounds bounds, StepLog log, List<String> warnings) {
        if (Integrator.isUnevaluated(antiderivative)) {
            warnings.add("No closed-form antiderivative was found; the definite integral was not evaluated");
            return OptionalDouble.empty();
        }
        double value = NumericEvaluator.at(antiderivative, variable, bounds.upper())
                - NumericEvaluator.at(antiderivative, variable, bounds.lower());
        if (!Double.isFinite(value)) {
            LOG.warn(
                    "integrate.undefined lower={} upper={} antiderivative={}",
                    bounds.lower(),
                    bounds.upper(),
                    antiderivative);
            warnings.add("The definite integral is undefined on [" + Constants.constant(bounds.lower()) + ", "
                    + Constants.constant(bounds.upper()) + "]");
            return OptionalDouble.empty();
        }
        log.record(Integrator.OPERATION, antiderivative, Constants.constant(value), "evaluate-bounds",
                "F(" + Constants.constant(bounds.upper()) + ") - F(" + Constants.constant(bounds.lower()) + ")");
        return OptionalDouble.of(value);
    }

    // --- Solve ---

    /**
     * Solves a single equation for {@code variable}.
     *
     * @param variable the variable, or null for the configured default
     * @throws ExpressionParseException if the text does not parse to an equation
     */
    public EquationSolution solveEquation(String text, String variable) {
        String v = variableOrDefault(variable);
        return run(EquationSolver.OPERATION, text, () -> {
            Equation equation = parseEquation(text, EquationSolver.OPERATION);
            return equationSolver.solve(equation, v, new StepLog());
        }, s -> s.steps().size());
    }

    /**
     * Solves a square linear system.
     *
     * @throws io.casengine.core.error.NoUniqueSolutionException if the system is singular or not
     *     square
     */
    public EquationSolution solveLinearSystem(List<String> equations, List<String> variables) {
        Objects.requireNonNull(equations, "equations must not be null");
        Objects.requireNonNull(variables, "variables must not be null");
        String source = String.join("; ", equations);
        return run(LinearSystemSolver.OPERATION, source, () -> {
            List<Equation> parsed = new ArrayList<>();
            for (String text : equations) {
                parsed.add(parseEquation(text, LinearSystemSolver.OPERATION));
            }
            return linearSystemSolver.solve(parsed, List.copyOf(variables), new StepLog());
        }, s -> s.steps().size());
    }

    // --- Series ---

    /** Taylor series around 0 of the configured default order. */
    public SeriesExpansion expandSeries(String text, String variable) {
        return expandSeries(text, variable, 0, config.seriesOrder());
    }

    /**
     * Taylor series of {@code text} around {@code center} up to power {@code order}.
     *
     * @param variable the variable, or null for the configured default
     * @throws IllegalArgumentException if {@code order < 0}
     * @throws io.casengine.core.error.NumericEvaluationException if a coefficient is undefined
     */
    public SeriesExpansion expandSeries(String text, String variable, double center, int order) {
        if (order < 0) {
            throw new IllegalArgumentException("order must not be negative, got: " + order);
        }
        String v = variableOrDefault(variable);
        return run(SeriesExpander.OPERATION, text, () -> {
            ParseResult parsed = parse(text, SeriesExpander.OPERATION);
            return seriesExpander.expand(text, parsed.ast(), v, center, order, new StepLog());
        }, s -> s.terms().size());
    }

    // --- Private helpers ---

    private ParseResult parse(String text, String operation) {
        ParseResult parsed = parser.parse(text);
        if (!parsed.valid()) {
            throw new ExpressionParseException(operation, parsed.errors());
        }
        return parsed;
    }

    private Equation parseEquation(String text, String operation) {
        ParseResult parsed = parse(text, operation);
        if (!(parsed.ast() instanceof Equation equation)) {
            throw new ExpressionParseException(operation, List.of("Expected an equation containing '=': " + text));
        }
        return equation;
    }

    private String variableOrDefault(String variable) {
        return variable == null || variable.isBlank() ? config.defaultVariable() : variable;
    }

    private CasResult result(
            String text,
            ParseResult parsed,
            Expr result,
            StepLog log,
            OptionalDouble numeric,
            List<String> warnings) {
        OptionalDouble value = numeric.isPresent() ? numeric : NumericEvaluator.tryEvaluate(result);
        CasResult.Metadata metadata = new CasResult.Metadata(
                result.size(),
                operatorsUsed(result),
                List.copyOf(parsed.variables()),
                List.copyOf(parsed.functions()));
        return new CasResult(
                text,
                result,
                log.steps(),
                Optional.ofNullable(latexRenderer.render(result)),
                value,
                metadata,
                warnings);
    }

    private static List<String> operatorsUsed(Expr expr) {
        Set<String> out = new LinkedHashSet<>();
        collectOperators(expr, out);
        return List.copyOf(out);
    }

    private static void collectOperators(Expr expr, Set<String> out) {
        if (expr instanceof BinaryOp b) {
            out.add(b.op().symbol());
        } else if (expr instanceof Equation) {
            out.add("=");
        }
        for (Expr child : expr.children()) {
            collectOperators(child, out);
        }
    }

    /** Runs one entry point with MDC, logging and telemetry around it. */
    private <T> T run(String operation, String source, Supplier<T> body, ToIntFunction<T> stepCount) {
        Objects.requireNonNull(source, "text must not be null");
        MDC.put(MDC_OPERATION, operation);
        long start = System.nanoTime();
        notifyStarted(operation, source);
        try {
            T out = body.get();
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            int steps = stepCount.applyAsInt(out);
            LOG.info("cas.operation op={} steps={} duration_ms={}", operation, steps, durationMs);
            notifyCompleted(operation, source, durationMs, steps);
            return out;
        } catch (CasException e) {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            LOG.warn(
                    "cas.operation_failed op={} error={} duration_ms={} detail={}",
                    operation,
                    e.urn(),
                    durationMs,
                    e.detail());
            notifyFailed(operation, source, durationMs, e);
            throw e;
        } finally {
            MDC.remove(MDC_OPERATION);
        }
    }

    private void notifyStarted(String operation, String source) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onOperationStarted(new CasTelemetryListener.OperationStartedEvent(operation, source));
        } catch (Exception e) {
            LOG.warn("CasTelemetryListener.onOperationStarted failed", e);
        }
    }

    private void notifyCompleted(String operation, String source, long durationMs, int steps) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onOperationCompleted(
                    new CasTelemetryListener.OperationCompletedEvent(operation, source, durationMs, steps));
        } catch (Exception e) {
            LOG.warn("CasTelemetryListener.onOperationCompleted failed", e);
        }
    }

    private void notifyFailed(String operation, String source, long durationMs, CasException error) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onOperationFailed(new CasTelemetryListener.OperationFailedEvent(
                    operation, source, durationMs, error.urn(), error.detail()));
        } catch (Exception e) {
            LOG.warn("CasTelemetryListener.onOperationFailed failed", e);
        }
    }
}
