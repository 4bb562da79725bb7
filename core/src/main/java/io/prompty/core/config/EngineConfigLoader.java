package io.prompty.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.prompty.core.engine.EngineOptions;
import io.prompty.core.engine.ErrorStrategy;
import io.prompty.core.engine.ResourceLimits;
import io.prompty.core.parse.Delimiters;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Iterator;
import java.util.Set;
import java.util.function.Function;

/**
 * Loads {@link EngineOptions} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * delimiters:
 *   open: "{~"
 *   close: "~}"
 * error-strategy: throw
 * limits:
 *   max-depth: 10
 *   max-loop-iterations: 10000
 *   max-output-bytes: 10485760
 *   execution-timeout-ms: 30000
 *   resolver-timeout-ms: 5000
 *   function-timeout-ms: 1000
 * </pre>
 *
 * <p>
 * Missing keys keep their defaults. Unknown keys are rejected so that typos do not silently fall
 * back to defaults. Environment variables ({@code PROMPTY_ERROR_STRATEGY},
 * {@code PROMPTY_MAX_DEPTH}, ...) take precedence over file values when set to a non-blank value.
 */
public final class EngineConfigLoader {

    public static final String ENV_ERROR_STRATEGY = "PROMPTY_ERROR_STRATEGY";
    public static final String ENV_MAX_DEPTH = "PROMPTY_MAX_DEPTH";
    public static final String ENV_MAX_LOOP_ITERATIONS = "PROMPTY_MAX_LOOP_ITERATIONS";
    public static final String ENV_MAX_OUTPUT_BYTES = "PROMPTY_MAX_OUTPUT_BYTES";
    public static final String ENV_EXECUTION_TIMEOUT_MS = "PROMPTY_EXECUTION_TIMEOUT_MS";
    public static final String ENV_RESOLVER_TIMEOUT_MS = "PROMPTY_RESOLVER_TIMEOUT_MS";
    public static final String ENV_FUNCTION_TIMEOUT_MS = "PROMPTY_FUNCTION_TIMEOUT_MS";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("delimiters", "error-strategy", "limits");
    private static final Set<String> KNOWN_DELIMITER_KEYS = Set.of("open", "close");
    private static final Set<String> KNOWN_LIMIT_KEYS = Set.of(
            "max-depth",
            "max-loop-iterations",
            "max-output-bytes",
            "execution-timeout-ms",
            "resolver-timeout-ms",
            "function-timeout-ms");

    private EngineConfigLoader() {
        // utility class
    }

    /** Loads options from {@code configPath}, applying overrides from {@link System#getenv}. */
    public static EngineOptions load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads options from {@code configPath}, applying overrides from {@code envLookup}. A lookup
     * result of {@code null} means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds invalid values
     */
    public static EngineOptions load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            return load(in, envLookup);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read configuration: " + configPath, e);
        }
    }

    /** Loads options from a YAML stream. The stream is not closed. */
    public static EngineOptions load(InputStream yaml, Function<String, String> envLookup) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration", e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return applyEnvOverrides(EngineOptions.builder(), ResourceLimits.DEFAULT, envLookup);
        }
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping");
        }
        rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "");

        EngineOptions.Builder builder = EngineOptions.builder();

        JsonNode delimiters = root.path("delimiters");
        if (!delimiters.isMissingNode()) {
            rejectUnknownKeys(delimiters, KNOWN_DELIMITER_KEYS, "delimiters.");
            Delimiters defaults = Delimiters.DEFAULT;
            try {
                builder.delimiters(new Delimiters(
                        textOrDefault(delimiters, "open", defaults.open()),
                        textOrDefault(delimiters, "close", defaults.close())));
            } catch (IllegalArgumentException e) {
                throw new ConfigLoadException("Invalid delimiters: " + e.getMessage(), e);
            }
        }

        if (root.has("error-strategy")) {
            builder.defaultErrorStrategy(strategy(root.get("error-strategy").asText(), "error-strategy"));
        }

        ResourceLimits defaults = ResourceLimits.DEFAULT;
        JsonNode limits = root.path("limits");
        if (!limits.isMissingNode()) {
            rejectUnknownKeys(limits, KNOWN_LIMIT_KEYS, "limits.");
        }
        ResourceLimits yamlLimits = limits(
                intValue(longOrDefault(limits, "max-depth", defaults.maxDepth()), "limits.max-depth"),
                intValue(
                        longOrDefault(limits, "max-loop-iterations", defaults.maxLoopIterations()),
                        "limits.max-loop-iterations"),
                longOrDefault(limits, "max-output-bytes", defaults.maxOutputBytes()),
                longOrDefault(limits, "execution-timeout-ms", defaults.executionTimeout().toMillis()),
                longOrDefault(limits, "resolver-timeout-ms", defaults.resolverTimeout().toMillis()),
                longOrDefault(limits, "function-timeout-ms", defaults.functionTimeout().toMillis()));

        return applyEnvOverrides(builder, yamlLimits, envLookup);
    }

    private static EngineOptions applyEnvOverrides(
            EngineOptions.Builder builder, ResourceLimits base, Function<String, String> envLookup) {
        if (isSet(envLookup, ENV_ERROR_STRATEGY)) {
            builder.defaultErrorStrategy(strategy(envLookup.apply(ENV_ERROR_STRATEGY).trim(), ENV_ERROR_STRATEGY));
        }
        ResourceLimits limits = limits(
                intValue(envLongOrDefault(envLookup, ENV_MAX_DEPTH, base.maxDepth()), ENV_MAX_DEPTH),
                intValue(
                        envLongOrDefault(envLookup, ENV_MAX_LOOP_ITERATIONS, base.maxLoopIterations()),
                        ENV_MAX_LOOP_ITERATIONS),
                envLongOrDefault(envLookup, ENV_MAX_OUTPUT_BYTES, base.maxOutputBytes()),
                envLongOrDefault(envLookup, ENV_EXECUTION_TIMEOUT_MS, base.executionTimeout().toMillis()),
                envLongOrDefault(envLookup, ENV_RESOLVER_TIMEOUT_MS, base.resolverTimeout().toMillis()),
                envLongOrDefault(envLookup, ENV_FUNCTION_TIMEOUT_MS, base.functionTimeout().toMillis()));
        return builder.limits(limits).build();
    }

    private static ResourceLimits limits(
            int maxDepth,
            int maxLoopIterations,
            long maxOutputBytes,
            long executionTimeoutMs,
            long resolverTimeoutMs,
            long functionTimeoutMs) {
        try {
            return new ResourceLimits(
                    maxDepth,
                    maxLoopIterations,
                    maxOutputBytes,
                    Duration.ofMillis(executionTimeoutMs),
                    Duration.ofMillis(resolverTimeoutMs),
                    Duration.ofMillis(functionTimeoutMs));
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid limits: " + e.getMessage(), e);
        }
    }

    private static int intValue(long value, String key) {
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            throw new ConfigLoadException(
                    "Value out of range for " + key + ": '" + value + "' (maximum " + Integer.MAX_VALUE + ")", e);
        }
    }

    private static ErrorStrategy strategy(String value, String key) {
        return ErrorStrategy.fromAttribute(value)
                .orElseThrow(() -> new ConfigLoadException("Invalid value for " + key + ": '" + value
                        + "' (expected one of throw, default, remove, keepraw, log)"));
    }

    private static void rejectUnknownKeys(JsonNode node, Set<String> known, String prefix) {
        if (!node.isObject()) {
            throw new ConfigLoadException("Expected a mapping at '" + (prefix.isEmpty() ? "<root>" : prefix) + "'");
        }
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!known.contains(name)) {
                throw new ConfigLoadException("Unknown configuration key: '" + prefix + name + "'");
            }
        }
    }

    // --- env helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static long envLongOrDefault(Function<String, String> envLookup, String envVar, long fallback) {
        if (!isSet(envLookup, envVar)) {
            return fallback;
        }
        String raw = envLookup.apply(envVar).trim();
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Invalid integer for " + envVar + ": '" + raw + "'", e);
        }
    }

    // --- YAML helpers ---

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        return node.has(field) ? node.get(field).asText() : defaultValue;
    }

    private static long longOrDefault(JsonNode node, String field, long defaultValue) {
        if (!node.has(field)) {
            return defaultValue;
        }
        JsonNode value = node.get(field);
        if (!value.isIntegralNumber()) {
            throw new ConfigLoadException("Invalid integer for limits." + field + ": '" + value.asText() + "'");
        }
        if (!value.canConvertToLong()) {
            throw new ConfigLoadException("Value out of range for limits." + field + ": '" + value.asText() + "'");
        }
        return value.asLong();
    }
}
