package io.casengine.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.casengine.core.model.Domain;
import io.casengine.core.model.TargetForm;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link CliConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code cas-engine.yaml} from the current directory if it exists, otherwise
 * starts from the built-in defaults</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path, which must exist</li>
 * </ul>
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable counts as set only if it is
 * defined and non-blank after trimming; blank values leave the YAML value in place.
 *
 * <table>
 * <caption>Environment overlay</caption>
 * <tr><th>Variable</th><th>YAML key</th></tr>
 * <tr><td>{@code CAS_MAX_STEPS}</td><td>{@code engine.max-steps}</td></tr>
 * <tr><td>{@code CAS_TARGET_FORM}</td><td>{@code engine.target-form}</td></tr>
 * <tr><td>{@code CAS_DOMAIN}</td><td>{@code engine.domain}</td></tr>
 * <tr><td>{@code CAS_DEFAULT_VARIABLE}</td><td>{@code engine.default-variable}</td></tr>
 * <tr><td>{@code CAS_SERIES_ORDER}</td><td>{@code engine.series-order}</td></tr>
 * <tr><td>{@code CAS_NUMERIC_FALLBACK}</td><td>{@code engine.numeric-fallback}</td></tr>
 * <tr><td>{@code CAS_LOG_FORMAT}</td><td>{@code logging.format}</td></tr>
 * <tr><td>{@code CAS_LOG_LEVEL}</td><td>{@code logging.level}</td></tr>
 * </table>
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** File looked up in the working directory when no {@code --config} is given. */
    public static final String DEFAULT_CONFIG_FILE = "cas-engine.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the given file, or the default file, or the defaults, and applies the overlay.
     *
     * @param configPath explicit path from {@code --config}, or null
     * @param envLookup  environment variable lookup; {@code null} results mean unset
     * @throws ConfigLoadException if an explicit file is missing, or any file or value is invalid
     */
    public static CliConfig resolve(Path configPath, Function<String, String> envLookup) {
        if (configPath != null) {
            return load(configPath, envLookup);
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        if (Files.exists(fallback)) {
            return load(fallback, envLookup);
        }
        return build(YAML_MAPPER.createObjectNode(), envLookup, "defaults");
    }

    /** Loads {@code configPath} with overrides from {@link System#getenv}. */
    public static CliConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads {@code configPath} with overrides from the supplied lookup function.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds invalid values
     */
    public static CliConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = YAML_MAPPER.createObjectNode();
        }
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }
        return build(root, envLookup, configPath.toString());
    }

    private static CliConfig build(JsonNode root, Function<String, String> envLookup, String source) {
        CliConfig.Builder builder = CliConfig.builder();
        try {
            // --- YAML mapping ---
            JsonNode engine = root.path("engine");
            if (engine.has("max-steps")) builder.maxSteps(requireInt(engine, "max-steps"));
            if (engine.has("target-form")) builder.targetForm(targetForm(engine.get("target-form").asText()));
            if (engine.has("domain")) builder.domain(domain(engine.get("domain").asText()));
            if (engine.has("default-variable"))
                builder.defaultVariable(engine.get("default-variable").asText());
            if (engine.has("series-order")) builder.seriesOrder(requireInt(engine, "series-order"));
            if (engine.has("numeric-fallback"))
                builder.numericFallback(engine.get("numeric-fallback").asBoolean());

            JsonNode rootSearch = engine.path("root-search");
            if (rootSearch.has("min")) builder.rootSearchMin(rootSearch.get("min").asDouble());
            if (rootSearch.has("max")) builder.rootSearchMax(rootSearch.get("max").asDouble());
            if (rootSearch.has("samples")) builder.rootSearchSamples(requireInt(rootSearch, "samples"));

            JsonNode logging = root.path("logging");
            if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
            if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

            // --- Environment variable overlay ---
            envInt(envLookup, "CAS_MAX_STEPS", builder::maxSteps);
            envString(envLookup, "CAS_TARGET_FORM", v -> builder.targetForm(targetForm(v)));
            envString(envLookup, "CAS_DOMAIN", v -> builder.domain(domain(v)));
            envString(envLookup, "CAS_DEFAULT_VARIABLE", builder::defaultVariable);
            envInt(envLookup, "CAS_SERIES_ORDER", builder::seriesOrder);
            envString(envLookup, "CAS_NUMERIC_FALLBACK", v -> builder.numericFallback(Boolean.parseBoolean(v)));
            envString(envLookup, "CAS_LOG_FORMAT", builder::loggingFormat);
            envString(envLookup, "CAS_LOG_LEVEL", builder::loggingLevel);

            CliConfig config = builder.build();
            validateLogging(config);
            return config;
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    private static void validateLogging(CliConfig config) {
        String format = config.loggingFormat().toLowerCase(Locale.ROOT);
        if (!format.equals("text") && !format.equals("json")) {
            throw new ConfigLoadException(
                    "Invalid logging format '" + config.loggingFormat() + "': expected text or json");
        }
    }

    // --- Value conversion ---

    static TargetForm targetForm(String value) {
        try {
            return TargetForm.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(
                    "Invalid target form '" + value + "': expected simplified, expanded or factored", e);
        }
    }

    static Domain domain(String value) {
        try {
            return Domain.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid domain '" + value + "': expected real or complex", e);
        }
    }

    private static int requireInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new ConfigLoadException("Expected an integer for '" + field + "', got: " + value);
        }
        return value.asInt();
    }

    // --- Env var helpers ---

    /** {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException("Expected an integer for " + envVar + ", got: " + raw, e);
            }
        }
    }
}
