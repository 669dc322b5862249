package io.casengine.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed command line: {@code <command> <positional>... [--option value]...}.
 *
 * <p>
 * Every option takes exactly one value. A value may start with a single {@code -} (negative
 * numbers, negated expressions); only {@code --} introduces an option.
 *
 * @param command     the sub-command, e.g. {@code simplify}
 * @param positionals expression or equation texts
 * @param options     option values by name, without the leading dashes
 */
record CliArguments(String command, List<String> positionals, Map<String, String> options) {

    static final Set<String> COMMANDS =
            Set.of("simplify", "differentiate", "integrate", "solve", "solve-system", "series");

    static final Set<String> OPTIONS =
            Set.of("var", "vars", "order", "from", "to", "center", "target-form", "config");

    CliArguments {
        positionals = List.copyOf(positionals);
        options = Map.copyOf(options);
    }

    /**
     * @throws UsageException for an unknown command or option, or an option without a value
     */
    static CliArguments parse(String[] args) {
        if (args.length == 0) {
            throw new UsageException("Missing command");
        }
        String command = args[0];
        if (!COMMANDS.contains(command)) {
            throw new UsageException("Unknown command: " + command);
        }
        List<String> positionals = new ArrayList<>();
        Map<String, String> options = new LinkedHashMap<>();
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--")) {
                String name = arg.substring(2);
                if (!OPTIONS.contains(name)) {
                    throw new UsageException("Unknown option: " + arg);
                }
                if (i + 1 >= args.length) {
                    throw new UsageException(arg + " requires a value");
                }
                options.put(name, args[++i]);
            } else {
                positionals.add(arg);
            }
        }
        return new CliArguments(command, positionals, options);
    }

    Optional<String> option(String name) {
        return Optional.ofNullable(options.get(name));
    }

    Optional<Path> configPath() {
        return option("config").map(Path::of);
    }

    int intOption(String name, int defaultValue) {
        String raw = options.get(name);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("--" + name + " expects an integer, got: " + raw, e);
        }
    }

    Optional<Double> doubleOption(String name) {
        String raw = options.get(name);
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(raw.trim()));
        } catch (NumberFormatException e) {
            throw new UsageException("--" + name + " expects a number, got: " + raw, e);
        }
    }

    /** The single positional argument of a one-expression command. */
    String expression() {
        if (positionals.size() != 1) {
            throw new UsageException(command + " expects exactly one expression, got " + positionals.size());
        }
        return positionals.get(0);
    }
}
