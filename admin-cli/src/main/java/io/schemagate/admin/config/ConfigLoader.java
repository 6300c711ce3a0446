package io.schemagate.admin.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link AdminConfig} from a YAML file and overlays environment
 * variables.
 *
 * <p>
 * YAML layout:
 *
 * <pre>
 * storage:
 *   dir: ./schema_storage
 * approval:
 *   reviewers: [admin, schema_reviewer, lead_developer]
 *   admins: [admin, system_admin]
 * suggestions:
 *   unknown-field-min-rate: 0.0
 *   deprecate-below-rate: 0.1
 *   require-above-rate: 0.9
 * logging:
 *   format: text
 *   level: INFO
 * </pre>
 *
 * <p>
 * Environment variables win over YAML values. A variable counts as set only
 * when it is defined and non-blank after trimming. Reviewer lists in the
 * environment are comma-separated.
 *
 * <p>
 * An explicitly requested file that does not exist is an error. When no
 * {@code --config} argument is given and {@value #DEFAULT_CONFIG_FILE} is
 * absent, defaults plus environment overrides are used.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Config file looked up in the working directory when no --config is given. */
    public static final String DEFAULT_CONFIG_FILE = "schemagate.yaml";

    private ConfigLoader() {
        // utility class
    }

    /** Loads the given file with overrides from the real process environment. */
    public static AdminConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the given file with overrides from {@code envLookup}.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or invalid
     */
    public static AdminConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath.toAbsolutePath()
                    + ". Use --config <path> to point at an existing file.");
        }
        try {
            JsonNode root = YAML_MAPPER.readTree(configPath.toFile());
            if (root == null || root.isMissingNode() || root.isNull()) {
                root = YAML_MAPPER.createObjectNode();
            }
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
            }
            AdminConfig config = mapToConfig(root, envLookup);
            LOG.debug("Loaded configuration from {}", configPath);
            return config;
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (Exception e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /** Builds a configuration from defaults and environment overrides only. */
    public static AdminConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
    }

    /**
     * Resolves the configuration for a command line: the {@code --config}
     * file when given, otherwise {@value #DEFAULT_CONFIG_FILE} in
     * {@code workingDir} when present, otherwise defaults.
     */
    public static AdminConfig resolve(String[] args, Path workingDir, Function<String, String> envLookup) {
        Path explicit = resolveConfigPath(args);
        if (explicit != null) {
            return load(explicit, envLookup);
        }
        Path fallback = workingDir.resolve(DEFAULT_CONFIG_FILE);
        if (Files.exists(fallback)) {
            return load(fallback, envLookup);
        }
        LOG.debug("No {} found in {}, using defaults", DEFAULT_CONFIG_FILE, workingDir);
        return fromEnvironment(envLookup);
    }

    /**
     * Returns the path following {@code --config}, or {@code null} when the
     * option is absent.
     *
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return null;
    }

    private static AdminConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        AdminConfig.Builder builder = AdminConfig.builder();

        JsonNode storage = root.path("storage");
        if (storage.has("dir")) {
            builder.storageDir(storage.get("dir").asText());
        }

        JsonNode approval = root.path("approval");
        if (approval.has("reviewers")) {
            builder.reviewers(names(approval.get("reviewers"), "approval.reviewers"));
        }
        if (approval.has("admins")) {
            builder.admins(names(approval.get("admins"), "approval.admins"));
        }

        JsonNode suggestions = root.path("suggestions");
        if (suggestions.has("unknown-field-min-rate")) {
            builder.unknownFieldMinRate(rate(suggestions, "unknown-field-min-rate"));
        }
        if (suggestions.has("deprecate-below-rate")) {
            builder.deprecateBelowRate(rate(suggestions, "deprecate-below-rate"));
        }
        if (suggestions.has("require-above-rate")) {
            builder.requireAboveRate(rate(suggestions, "require-above-rate"));
        }

        JsonNode logging = root.path("logging");
        builder.loggingFormat(textOrDefault(logging, "format", "text"));
        builder.loggingLevel(textOrDefault(logging, "level", "INFO"));

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(AdminConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "SCHEMAGATE_STORAGE_DIR", builder::storageDir);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        envNames(envLookup, "SCHEMAGATE_REVIEWERS", builder::reviewers);
        envNames(envLookup, "SCHEMAGATE_ADMINS", builder::admins);

        envDouble(envLookup, "SCHEMAGATE_SUGGEST_UNKNOWN_MIN_RATE", builder::unknownFieldMinRate);
        envDouble(envLookup, "SCHEMAGATE_SUGGEST_DEPRECATE_BELOW_RATE", builder::deprecateBelowRate);
        envDouble(envLookup, "SCHEMAGATE_SUGGEST_REQUIRE_ABOVE_RATE", builder::requireAboveRate);
    }

    /**
     * Returns {@code true} if the env var is "set": defined and non-blank
     * after trimming.
     */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envNames(Function<String, String> envLookup, String envVar, Consumer<Set<String>> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Arrays.stream(envLookup.apply(envVar).split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toCollection(LinkedHashSet::new)));
        }
    }

    private static void envDouble(Function<String, String> envLookup, String envVar, DoubleConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Double.parseDouble(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be a number, got '" + raw + "'", e);
            }
        }
    }

    private static Set<String> names(JsonNode node, String key) {
        if (!node.isArray()) {
            throw new ConfigLoadException(key + " must be a list of names");
        }
        Set<String> names = new LinkedHashSet<>();
        for (JsonNode item : node) {
            String name = item.asText().trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    private static double rate(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.isNumber()) {
            throw new ConfigLoadException("suggestions." + field + " must be a number");
        }
        return value.asDouble();
    }

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        return node.has(field) ? node.get(field).asText() : defaultValue;
    }
}
