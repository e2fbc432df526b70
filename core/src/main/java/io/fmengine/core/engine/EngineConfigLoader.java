package io.fmengine.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.fmengine.core.error.EngineConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;

/**
 * Loads {@link EngineConfig} from YAML with an environment variable overlay.
 *
 * <p>Recognised keys:
 * <pre>
 * expansion:
 *   max-depth: 2
 * enumeration:
 *   parallelism: 4
 *   limit: 1000
 * </pre>
 * Missing keys keep the values of {@link EngineConfig#DEFAULT}.
 *
 * <p>{@code FM_MAX_DEPTH}, {@code FM_PARALLELISM} and {@code FM_LIMIT} override the YAML values. A
 * variable counts as set only if it is defined and non-blank after trimming.
 */
public final class EngineConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_MAX_DEPTH = "FM_MAX_DEPTH";
    static final String ENV_PARALLELISM = "FM_PARALLELISM";
    static final String ENV_LIMIT = "FM_LIMIT";

    private EngineConfigLoader() {
        // utility class
    }

    /** Loads from a YAML file with overrides from {@link System#getenv}. */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads from a YAML file with overrides from {@code envLookup}, which returns {@code null} for
     * undefined variables.
     *
     * @throws EngineConfigException if the file is missing, is not valid YAML, or holds an invalid value
     */
    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            throw new EngineConfigException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            return load(in, envLookup);
        } catch (IOException e) {
            throw new EngineConfigException("Failed to read configuration: " + configPath, e);
        }
    }

    /** Loads from a YAML stream with overrides from {@code envLookup}. The stream is not closed. */
    public static EngineConfig load(InputStream yaml, Function<String, String> envLookup) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        Objects.requireNonNull(envLookup, "envLookup must not be null");
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (IOException e) {
            throw new EngineConfigException("Failed to parse YAML configuration", e);
        }
        return mapToConfig(root == null ? YAML_MAPPER.missingNode() : root, envLookup);
    }

    /** {@link EngineConfig#DEFAULT} with only the environment overlay applied. */
    public static EngineConfig fromEnvironment(Function<String, String> envLookup) {
        Objects.requireNonNull(envLookup, "envLookup must not be null");
        return mapToConfig(YAML_MAPPER.missingNode(), envLookup);
    }

    private static EngineConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        EngineConfig defaults = EngineConfig.DEFAULT;
        JsonNode expansion = root.path("expansion");
        JsonNode enumeration = root.path("enumeration");

        long maxDepth = yamlLong(expansion, "max-depth", defaults.maxDepth());
        long parallelism = yamlLong(enumeration, "parallelism", defaults.parallelism());
        long limit = yamlLong(enumeration, "limit", defaults.defaultLimit());

        maxDepth = envLongOrDefault(envLookup, ENV_MAX_DEPTH, maxDepth);
        parallelism = envLongOrDefault(envLookup, ENV_PARALLELISM, parallelism);
        limit = envLongOrDefault(envLookup, ENV_LIMIT, limit);

        try {
            return new EngineConfig(Math.toIntExact(maxDepth), Math.toIntExact(parallelism), limit);
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new EngineConfigException("Invalid engine configuration: " + e.getMessage(), e);
        }
    }

    private static long yamlLong(JsonNode section, String field, long defaultValue) {
        JsonNode node = section.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.canConvertToLong() || !node.isIntegralNumber()) {
            throw new EngineConfigException(
                    "Configuration key '" + field + "' must be an integer, got: " + node.asText());
        }
        return node.asLong();
    }

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static long envLongOrDefault(Function<String, String> envLookup, String envVar, long yamlDefault) {
        if (!isSet(envLookup, envVar)) {
            return yamlDefault;
        }
        String value = envLookup.apply(envVar).trim();
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new EngineConfigException(
                    "Environment variable " + envVar + " must be an integer, got: '" + value + "'", e);
        }
    }
}
