package io.supervisedproxy.server.config;

import io.supervisedproxy.core.process.BackendLaunchSpec;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration of the supervised proxy.
 *
 * <p>
 * Every field has a default except {@code backendCommand}, which is required.
 * Use {@link #builder()} to construct instances.
 *
 * @param proxyHost                bind address of the public listener
 * @param proxyPort                public port; {@code 0} picks a free port
 * @param maxBodyBytes             largest inbound request body accepted
 * @param shutdownDrainTimeoutMs   how long in-flight requests may run on stop
 * @param backendCommand           executable and arguments of the backend
 * @param backendWorkingDir        backend working directory, {@code null} to
 *                                 inherit
 * @param backendHost              internal address the backend listens on
 * @param backendPort              internal port handed to the backend
 * @param backendPortEnv           environment variable carrying
 *                                 {@code backendPort} to the backend
 * @param backendEnvironment       additional environment for the backend
 * @param backendConnectTimeoutMs  TCP connect timeout towards the backend
 * @param backendReadTimeoutMs     upper bound for one forwarded call
 * @param backendStopTimeoutMs     grace period before the backend is killed
 * @param readinessPhrase          output phrase announcing the backend is
 *                                 listening
 * @param readinessPollIntervalMs  readiness poll interval
 * @param readinessTimeoutMs       readiness wait ceiling
 * @param upgradePath              public WebSocket path
 * @param upgradeBackendPath       backend WebSocket path
 * @param upgradeIdleTimeoutMs     idle timeout of inbound WebSocket sessions
 * @param loggingFormat            json or text
 * @param loggingLevel             root log level
 */
public record ProxyConfig(
        String proxyHost,
        int proxyPort,
        int maxBodyBytes,
        int shutdownDrainTimeoutMs,
        List<String> backendCommand,
        String backendWorkingDir,
        String backendHost,
        int backendPort,
        String backendPortEnv,
        Map<String, String> backendEnvironment,
        int backendConnectTimeoutMs,
        int backendReadTimeoutMs,
        int backendStopTimeoutMs,
        String readinessPhrase,
        int readinessPollIntervalMs,
        int readinessTimeoutMs,
        String upgradePath,
        String upgradeBackendPath,
        long upgradeIdleTimeoutMs,
        String loggingFormat,
        String loggingLevel) {

    public ProxyConfig {
        backendCommand = backendCommand == null ? List.of() : List.copyOf(backendCommand);
        backendEnvironment = backendEnvironment == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(backendEnvironment));
    }

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Base URL of the backend's HTTP listener, without trailing slash. */
    public String backendBaseUrl() {
        return "http://" + backendHost + ":" + backendPort;
    }

    /** Address of the backend's WebSocket endpoint. */
    public URI backendUpgradeUri() {
        return URI.create("ws://" + backendHost + ":" + backendPort + upgradeBackendPath);
    }

    /**
     * Launch description for the backend. The configured environment is applied
     * first, then {@code backendPortEnv=backendPort} so the port override always
     * wins.
     */
    public BackendLaunchSpec toLaunchSpec() {
        Map<String, String> environment = new HashMap<>(backendEnvironment);
        environment.put(backendPortEnv, Integer.toString(backendPort));
        Path workingDir = backendWorkingDir != null ? Path.of(backendWorkingDir) : null;
        return new BackendLaunchSpec(backendCommand, workingDir, environment);
    }

    public Duration readinessPollInterval() {
        return Duration.ofMillis(readinessPollIntervalMs);
    }

    public Duration readinessTimeout() {
        return Duration.ofMillis(readinessTimeoutMs);
    }

    public Duration backendStopTimeout() {
        return Duration.ofMillis(backendStopTimeoutMs);
    }

    /**
     * Builder for {@link ProxyConfig}. All fields have defaults except
     * {@code backendCommand}.
     */
    public static final class Builder {
        private String proxyHost = "0.0.0.0";
        private int proxyPort = 5000;
        private int maxBodyBytes = 10_485_760; // 10 MB
        private int shutdownDrainTimeoutMs = 5000;
        private List<String> backendCommand = List.of();
        private String backendWorkingDir;
        private String backendHost = "127.0.0.1";
        private int backendPort = 5001;
        private String backendPortEnv = "PORT";
        private Map<String, String> backendEnvironment = new LinkedHashMap<>();
        private int backendConnectTimeoutMs = 5000;
        private int backendReadTimeoutMs = 30000;
        private int backendStopTimeoutMs = 5000;
        private String readinessPhrase = "serving on port";
        private int readinessPollIntervalMs = 1000;
        private int readinessTimeoutMs = 30000;
        private String upgradePath = "/ws";
        private String upgradeBackendPath = "/ws";
        private long upgradeIdleTimeoutMs = 3_600_000L;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder proxyHost(String proxyHost) {
            this.proxyHost = proxyHost;
            return this;
        }

        public Builder proxyPort(int proxyPort) {
            this.proxyPort = proxyPort;
            return this;
        }

        public Builder maxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = maxBodyBytes;
            return this;
        }

        public Builder shutdownDrainTimeoutMs(int shutdownDrainTimeoutMs) {
            this.shutdownDrainTimeoutMs = shutdownDrainTimeoutMs;
            return this;
        }

        public Builder backendCommand(List<String> backendCommand) {
            this.backendCommand = backendCommand;
            return this;
        }

        public Builder backendWorkingDir(String backendWorkingDir) {
            this.backendWorkingDir = backendWorkingDir;
            return this;
        }

        public Builder backendHost(String backendHost) {
            this.backendHost = backendHost;
            return this;
        }

        public Builder backendPort(int backendPort) {
            this.backendPort = backendPort;
            return this;
        }

        public Builder backendPortEnv(String backendPortEnv) {
            this.backendPortEnv = backendPortEnv;
            return this;
        }

        public Builder backendEnvironment(Map<String, String> backendEnvironment) {
            this.backendEnvironment = new LinkedHashMap<>(backendEnvironment);
            return this;
        }

        public Builder backendEnv(String name, String value) {
            this.backendEnvironment.put(name, value);
            return this;
        }

        public Builder backendConnectTimeoutMs(int backendConnectTimeoutMs) {
            this.backendConnectTimeoutMs = backendConnectTimeoutMs;
            return this;
        }

        public Builder backendReadTimeoutMs(int backendReadTimeoutMs) {
            this.backendReadTimeoutMs = backendReadTimeoutMs;
            return this;
        }

        public Builder backendStopTimeoutMs(int backendStopTimeoutMs) {
            this.backendStopTimeoutMs = backendStopTimeoutMs;
            return this;
        }

        public Builder readinessPhrase(String readinessPhrase) {
            this.readinessPhrase = readinessPhrase;
            return this;
        }

        public Builder readinessPollIntervalMs(int readinessPollIntervalMs) {
            this.readinessPollIntervalMs = readinessPollIntervalMs;
            return this;
        }

        public Builder readinessTimeoutMs(int readinessTimeoutMs) {
            this.readinessTimeoutMs = readinessTimeoutMs;
            return this;
        }

        public Builder upgradePath(String upgradePath) {
            this.upgradePath = upgradePath;
            return this;
        }

        public Builder upgradeBackendPath(String upgradeBackendPath) {
            this.upgradeBackendPath = upgradeBackendPath;
            return this;
        }

        public Builder upgradeIdleTimeoutMs(long upgradeIdleTimeoutMs) {
            this.upgradeIdleTimeoutMs = upgradeIdleTimeoutMs;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public ProxyConfig build() {
            return new ProxyConfig(
                    proxyHost,
                    proxyPort,
                    maxBodyBytes,
                    shutdownDrainTimeoutMs,
                    backendCommand,
                    backendWorkingDir,
                    backendHost,
                    backendPort,
                    backendPortEnv,
                    backendEnvironment,
                    backendConnectTimeoutMs,
                    backendReadTimeoutMs,
                    backendStopTimeoutMs,
                    readinessPhrase,
                    readinessPollIntervalMs,
                    readinessTimeoutMs,
                    upgradePath,
                    upgradeBackendPath,
                    upgradeIdleTimeoutMs,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
