package io.casengine.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.casengine.cli.config.CliConfig;
import io.casengine.cli.config.ConfigLoadException;
import io.casengine.cli.config.ConfigLoader;
import io.casengine.core.engine.CasEngine;
import io.casengine.core.engine.ResultJsonBuilder;
import io.casengine.core.error.CasException;
import io.casengine.core.model.DefiniteBounds;
import io.casengine.core.model.ParseResult;
import io.casengine.core.model.TargetForm;
import io.casengine.core.parser.RecursiveDescentParser;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line application: parses arguments, loads configuration, runs one engine call and
 * prints its JSON view.
 *
 * <p>
 * Exit codes: {@value #EXIT_OK} on success, {@value #EXIT_COMPUTATION_FAILED} when the engine
 * raises a {@link CasException} (a problem document is printed to standard output), and
 * {@value #EXIT_USAGE} for usage and configuration errors (a message is printed to standard
 * error).
 */
public final class CliApp {

    private static final Logger LOG = LoggerFactory.getLogger(CliApp.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final int EXIT_OK = 0;
    static final int EXIT_COMPUTATION_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(
            System.lineSeparator(),
            "Usage: cas <command> <args> [options]",
            "",
            "Commands:",
            "  simplify <expr>          [--target-form simplified|expanded|factored]",
            "  differentiate <expr>     [--var x] [--order n]",
            "  integrate <expr>         [--var x] [--from a --to b]",
            "  solve <equation>         [--var x]",
            "  solve-system <eq>...     [--vars x,y]",
            "  series <expr>            [--var x] [--center c] [--order n]",
            "",
            "Options:",
            "  --config <path>          YAML configuration (default: ./cas-engine.yaml if present)");

    private final PrintStream out;
    private final PrintStream err;
    private final Function<String, String> envLookup;
    private final Consumer<CliConfig> loggingSetup;
    private final ResultJsonBuilder json = new ResultJsonBuilder();

    /** Creates an application that configures Logback from the loaded configuration. */
    public CliApp(PrintStream out, PrintStream err, Function<String, String> envLookup) {
        this(out, err, envLookup, c -> LogbackConfigurator.configure(c.loggingFormat(), c.loggingLevel()));
    }

    CliApp(PrintStream out, PrintStream err, Function<String, String> envLookup, Consumer<CliConfig> loggingSetup) {
        this.out = out;
        this.err = err;
        this.envLookup = envLookup;
        this.loggingSetup = loggingSetup;
    }

    /** Runs one command and returns the process exit code. */
    public int run(String[] args) {
        if (args.length == 0 || isHelp(args[0])) {
            (args.length == 0 ? err : out).println(USAGE);
            return args.length == 0 ? EXIT_USAGE : EXIT_OK;
        }
        CliArguments arguments;
        CliConfig config;
        try {
            arguments = CliArguments.parse(args);
            config = ConfigLoader.resolve(arguments.configPath().orElse(null), envLookup);
        } catch (UsageException | ConfigLoadException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        loggingSetup.accept(config);
        LOG.debug("cli.start command={} args={}", arguments.command(), Arrays.toString(args));

        CasEngine engine = new CasEngine(config.engine());
        try {
            print(execute(engine, arguments));
            return EXIT_OK;
        } catch (CasException e) {
            print(json.problem(e));
            return EXIT_COMPUTATION_FAILED;
        } catch (UsageException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private JsonNode execute(CasEngine engine, CliArguments a) {
        String variable = a.option("var").orElse(null);
        return switch (a.command()) {
            case "simplify" -> {
                TargetForm form = a.option("target-form")
                        .map(CliApp::targetForm)
                        .orElse(engine.config().targetForm());
                yield json.result(engine.simplify(
                        a.expression(), engine.config().simplifyOptions().withTargetForm(form)));
            }
            case "differentiate" -> json.result(engine.differentiate(a.expression(), variable, a.intOption("order", 1)));
            case "integrate" -> json.result(engine.integrate(a.expression(), variable, bounds(a)));
            case "solve" -> json.solution(engine.solveEquation(a.expression(), variable));
            case "solve-system" -> json.solution(engine.solveLinearSystem(equations(a), systemVariables(a)));
            case "series" -> json.series(engine.expandSeries(
                    a.expression(),
                    variable,
                    a.doubleOption("center").orElse(0.0),
                    a.intOption("order", engine.config().seriesOrder())));
            default -> throw new UsageException("Unknown command: " + a.command());
        };
    }

    private static Optional<DefiniteBounds> bounds(CliArguments a) {
        Optional<Double> from = a.doubleOption("from");
        Optional<Double> to = a.doubleOption("to");
        if (from.isPresent() != to.isPresent()) {
            throw new UsageException("--from and --to must be given together");
        }
        return from.map(lower -> new DefiniteBounds(lower, to.get()));
    }

    private static List<String> equations(CliArguments a) {
        if (a.positionals().isEmpty()) {
            throw new UsageException("solve-system expects at least one equation");
        }
        return a.positionals();
    }

    /** {@code --vars x,y}, or the variables of the equations in order of first occurrence. */
    private static List<String> systemVariables(CliArguments a) {
        Optional<String> vars = a.option("vars");
        if (vars.isPresent()) {
            List<String> out = new ArrayList<>();
            for (String v : vars.get().split(",")) {
                if (!v.isBlank()) {
                    out.add(v.trim());
                }
            }
            return out;
        }
        RecursiveDescentParser parser = new RecursiveDescentParser();
        Set<String> found = new LinkedHashSet<>();
        for (String equation : a.positionals()) {
            ParseResult parsed = parser.parse(equation);
            if (parsed.valid()) {
                found.addAll(parsed.variables());
            }
        }
        return List.copyOf(found);
    }

    private static TargetForm targetForm(String value) {
        try {
            return TargetForm.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UsageException("--target-form expects simplified, expanded or factored, got: " + value, e);
        }
    }

    private static boolean isHelp(String arg) {
        return arg.equals("--help") || arg.equals("-h") || arg.equals("help");
    }

    private void print(JsonNode node) {
        try {
            out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialise result", e);
        }
    }
}
