package io.supervisedproxy.server.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ProxyConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * File resolution:
 * <ul>
 * <li>{@code --config /path/to/config.yaml}: the file must exist</li>
 * <li>otherwise {@code supervised-proxy.yaml} in the current directory, if
 * present</li>
 * <li>otherwise defaults plus environment only</li>
 * </ul>
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable is
 * "set" if and only if it is defined and its trimmed value is non-empty;
 * blank values leave the YAML value in place.
 *
 * <p>
 * Every loaded configuration is validated before it is returned.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "supervised-proxy.yaml";

    private static final Set<String> LOG_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR");
    private static final Set<String> LOG_FORMATS = Set.of("json", "text");

    private ConfigLoader() {
        // utility class
    }

    /**
     * Resolves and loads the configuration for the given command line, using
     * {@link System#getenv} for the overlay.
     *
     * @param args command-line arguments
     * @return a validated {@link ProxyConfig}
     * @throws ConfigLoadException if loading or validation fails
     */
    public static ProxyConfig resolve(String[] args) {
        return resolve(args, System::getenv, Path.of(DEFAULT_CONFIG_FILE));
    }

    /**
     * Resolves and loads the configuration for the given command line.
     *
     * @param args          command-line arguments
     * @param envLookup     environment variable lookup; {@code null} means
     *                      undefined
     * @param defaultConfig file read when {@code --config} is absent, if it
     *                      exists
     * @return a validated {@link ProxyConfig}
     */
    public static ProxyConfig resolve(String[] args, Function<String, String> envLookup, Path defaultConfig) {
        Path explicit = resolveConfigPath(args);
        if (explicit != null) {
            return load(explicit, envLookup);
        }
        if (Files.isRegularFile(defaultConfig)) {
            return load(defaultConfig, envLookup);
        }
        return fromEnvironment(envLookup);
    }

    /**
     * Loads a {@link ProxyConfig} from a YAML file, applying overrides from
     * {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return a validated {@link ProxyConfig}
     * @throws ConfigLoadException if the file is missing, the YAML is invalid or
     *                             validation fails
     */
    public static ProxyConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link ProxyConfig} from a YAML file, applying overrides from the
     * supplied lookup function.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup; {@code null} means undefined
     * @return a validated {@link ProxyConfig}
     * @throws ConfigLoadException if the file is missing, the YAML is invalid or
     *                             validation fails
     */
    public static ProxyConfig load(Path configPath, Function<String, String> envLookup) {
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
        if (root == null || root.isNull() || root.isMissingNode()) {
            root = MissingNode.getInstance();
        } else if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }
        return validate(mapToConfig(root, envLookup));
    }

    /**
     * Builds a configuration from defaults and environment variables only.
     *
     * @param envLookup environment variable lookup
     * @return a validated {@link ProxyConfig}
     */
    public static ProxyConfig fromEnvironment(Function<String, String> envLookup) {
        return validate(mapToConfig(MissingNode.getInstance(), envLookup));
    }

    /**
     * Extracts the {@code --config} argument.
     *
     * @param args command-line arguments
     * @return the path given after {@code --config}, or {@code null} when the
     *         option is absent
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new ConfigLoadException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return null;
    }

    /**
     * Checks a configuration for values the proxy cannot run with.
     *
     * @param config configuration to check
     * @return {@code config}, for chaining
     * @throws ConfigLoadException naming the first offending key
     */
    public static ProxyConfig validate(ProxyConfig config) {
        if (config.backendCommand().isEmpty()
                || config.backendCommand().get(0).isBlank()) {
            throw new ConfigLoadException(
                    "backend.command is required (set it in the config file or via BACKEND_COMMAND)");
        }
        requireText(config.proxyHost(), "proxy.host");
        requireText(config.backendHost(), "backend.host");
        requireText(config.backendPortEnv(), "backend.port-env");
        requireText(config.readinessPhrase(), "readiness.phrase");
        requireRange(config.proxyPort(), 0, 65535, "proxy.port");
        requireRange(config.backendPort(), 1, 65535, "backend.port");
        if (config.proxyPort() == config.backendPort()) {
            throw new ConfigLoadException("proxy.port and backend.port must differ, both are " + config.proxyPort());
        }
        requirePositive(config.maxBodyBytes(), "proxy.max-body-bytes");
        requirePositive(config.shutdownDrainTimeoutMs(), "proxy.shutdown.drain-timeout-ms");
        requirePositive(config.backendConnectTimeoutMs(), "backend.connect-timeout-ms");
        requirePositive(config.backendReadTimeoutMs(), "backend.read-timeout-ms");
        requirePositive(config.backendStopTimeoutMs(), "backend.stop-timeout-ms");
        requirePositive(config.readinessPollIntervalMs(), "readiness.poll-interval-ms");
        requirePositive(config.readinessTimeoutMs(), "readiness.timeout-ms");
        if (config.upgradeIdleTimeoutMs() <= 0) {
            throw new ConfigLoadException(
                    "upgrade.idle-timeout-ms must be positive, got " + config.upgradeIdleTimeoutMs());
        }
        requirePath(config.upgradePath(), "upgrade.path");
        requirePath(config.upgradeBackendPath(), "upgrade.backend-path");
        if (config.loggingLevel() == null
                || !LOG_LEVELS.contains(config.loggingLevel().toUpperCase(Locale.ROOT))) {
            throw new ConfigLoadException(
                    "logging.level must be one of " + LOG_LEVELS + ", got '" + config.loggingLevel() + "'");
        }
        if (config.loggingFormat() == null
                || !LOG_FORMATS.contains(config.loggingFormat().toLowerCase(Locale.ROOT))) {
            throw new ConfigLoadException(
                    "logging.format must be 'json' or 'text', got '" + config.loggingFormat() + "'");
        }
        return config;
    }

    /**
     * Maps a parsed YAML tree to a {@link ProxyConfig} via the builder, then
     * overlays environment variable overrides.
     */
    private static ProxyConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ProxyConfig.Builder builder = ProxyConfig.builder();

        // --- YAML mapping ---

        JsonNode proxy = root.path("proxy");
        yamlText(proxy, "host", builder::proxyHost);
        yamlInt(proxy, "port", "proxy.port", builder::proxyPort);
        yamlInt(proxy, "max-body-bytes", "proxy.max-body-bytes", builder::maxBodyBytes);
        yamlInt(
                proxy.path("shutdown"),
                "drain-timeout-ms",
                "proxy.shutdown.drain-timeout-ms",
                builder::shutdownDrainTimeoutMs);

        JsonNode backend = root.path("backend");
        if (backend.has("command")) builder.backendCommand(commandFromYaml(backend.get("command")));
        yamlText(backend, "working-dir", builder::backendWorkingDir);
        yamlText(backend, "host", builder::backendHost);
        yamlInt(backend, "port", "backend.port", builder::backendPort);
        yamlText(backend, "port-env", builder::backendPortEnv);
        if (backend.has("environment")) builder.backendEnvironment(environmentFromYaml(backend.get("environment")));
        yamlInt(backend, "connect-timeout-ms", "backend.connect-timeout-ms", builder::backendConnectTimeoutMs);
        yamlInt(backend, "read-timeout-ms", "backend.read-timeout-ms", builder::backendReadTimeoutMs);
        yamlInt(backend, "stop-timeout-ms", "backend.stop-timeout-ms", builder::backendStopTimeoutMs);

        JsonNode readiness = root.path("readiness");
        yamlText(readiness, "phrase", builder::readinessPhrase);
        yamlInt(readiness, "poll-interval-ms", "readiness.poll-interval-ms", builder::readinessPollIntervalMs);
        yamlInt(readiness, "timeout-ms", "readiness.timeout-ms", builder::readinessTimeoutMs);

        JsonNode upgrade = root.path("upgrade");
        yamlText(upgrade, "path", builder::upgradePath);
        yamlText(upgrade, "backend-path", builder::upgradeBackendPath);
        if (upgrade.has("idle-timeout-ms")) {
            JsonNode node = upgrade.get("idle-timeout-ms");
            if (!node.canConvertToLong() || !node.isIntegralNumber()) {
                throw new ConfigLoadException("upgrade.idle-timeout-ms must be an integer, got '" + node.asText() + "'");
            }
            builder.upgradeIdleTimeoutMs(node.asLong());
        }

        JsonNode logging = root.path("logging");
        yamlText(logging, "format", builder::loggingFormat);
        yamlText(logging, "level", builder::loggingLevel);

        // --- Environment variable overlay ---
        applyEnvOverrides(builder, envLookup);

        return builder.build();
    }

    private static void applyEnvOverrides(ProxyConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "PROXY_HOST", builder::proxyHost);
        envString(envLookup, "BACKEND_WORKING_DIR", builder::backendWorkingDir);
        envString(envLookup, "BACKEND_HOST", builder::backendHost);
        envString(envLookup, "BACKEND_PORT_ENV", builder::backendPortEnv);
        envString(envLookup, "READINESS_PHRASE", builder::readinessPhrase);
        envString(envLookup, "UPGRADE_PATH", builder::upgradePath);
        envString(envLookup, "UPGRADE_BACKEND_PATH", builder::upgradeBackendPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
        envString(envLookup, "BACKEND_COMMAND", value -> builder.backendCommand(splitCommand(value)));

        envInt(envLookup, "PROXY_PORT", builder::proxyPort);
        envInt(envLookup, "PROXY_MAX_BODY_BYTES", builder::maxBodyBytes);
        envInt(envLookup, "PROXY_SHUTDOWN_DRAIN_TIMEOUT_MS", builder::shutdownDrainTimeoutMs);
        envInt(envLookup, "BACKEND_PORT", builder::backendPort);
        envInt(envLookup, "BACKEND_CONNECT_TIMEOUT_MS", builder::backendConnectTimeoutMs);
        envInt(envLookup, "BACKEND_READ_TIMEOUT_MS", builder::backendReadTimeoutMs);
        envInt(envLookup, "BACKEND_STOP_TIMEOUT_MS", builder::backendStopTimeoutMs);
        envInt(envLookup, "READINESS_POLL_INTERVAL_MS", builder::readinessPollIntervalMs);
        envInt(envLookup, "READINESS_TIMEOUT_MS", builder::readinessTimeoutMs);
        if (isSet(envLookup, "UPGRADE_IDLE_TIMEOUT_MS")) {
            String raw = envLookup.apply("UPGRADE_IDLE_TIMEOUT_MS").trim();
            try {
                builder.upgradeIdleTimeoutMs(Long.parseLong(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException("UPGRADE_IDLE_TIMEOUT_MS must be an integer, got '" + raw + "'", e);
            }
        }
    }

    private static List<String> commandFromYaml(JsonNode node) {
        if (node.isTextual()) {
            return splitCommand(node.asText());
        }
        if (!node.isArray()) {
            throw new ConfigLoadException("backend.command must be a list of strings or a single string");
        }
        List<String> command = new ArrayList<>();
        node.forEach(element -> {
            if (!element.isValueNode()) {
                throw new ConfigLoadException("backend.command entries must be strings");
            }
            command.add(element.asText());
        });
        return command;
    }

    private static Map<String, String> environmentFromYaml(JsonNode node) {
        if (!node.isObject()) {
            throw new ConfigLoadException("backend.environment must be a mapping of names to values");
        }
        Map<String, String> environment = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> {
            if (!entry.getValue().isValueNode() || entry.getValue().isNull()) {
                throw new ConfigLoadException("backend.environment." + entry.getKey() + " must be a scalar value");
            }
            environment.put(entry.getKey(), entry.getValue().asText());
        });
        return environment;
    }

    private static List<String> splitCommand(String value) {
        String trimmed = value.trim();
        return trimmed.isEmpty() ? List.of() : Arrays.asList(trimmed.split("\\s+"));
    }

    // --- Validation helpers ---

    private static void requireText(String value, String key) {
        if (value == null || value.isBlank()) {
            throw new ConfigLoadException(key + " is required and must not be blank");
        }
    }

    private static void requireRange(int value, int min, int max, String key) {
        if (value < min || value > max) {
            throw new ConfigLoadException(key + " must be between " + min + " and " + max + ", got " + value);
        }
    }

    private static void requirePositive(int value, String key) {
        if (value <= 0) {
            throw new ConfigLoadException(key + " must be positive, got " + value);
        }
    }

    private static void requirePath(String value, String key) {
        if (value == null || !value.startsWith("/")) {
            throw new ConfigLoadException(key + " must start with '/', got '" + value + "'");
        }
    }

    // --- Env var helpers ---

    /**
     * Returns {@code true} if the env var is "set": defined AND non-blank after
     * trimming.
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

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + raw + "'", e);
            }
        }
    }

    // --- YAML helpers ---

    private static void yamlText(JsonNode node, String field, Consumer<String> setter) {
        if (node.has(field) && !node.get(field).isNull()) {
            setter.accept(node.get(field).asText());
        }
    }

    private static void yamlInt(JsonNode node, String field, String key, IntConsumer setter) {
        if (!node.has(field)) {
            return;
        }
        JsonNode value = node.get(field);
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            setter.accept(value.asInt());
            return;
        }
        if (value.isTextual()) {
            try {
                setter.accept(Integer.parseInt(value.asText().trim()));
                return;
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(key + " must be an integer, got '" + value.asText() + "'", e);
            }
        }
        throw new ConfigLoadException(key + " must be an integer, got '" + value.asText() + "'");
    }
}
