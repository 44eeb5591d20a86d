package io.supervisedproxy.server.proxy;

import io.javalin.Javalin;
import io.javalin.http.Handler;
import io.javalin.http.HandlerType;
import io.supervisedproxy.core.error.BackendLaunchException;
import io.supervisedproxy.core.process.BackendLauncher;
import io.supervisedproxy.core.process.BackendProcess;
import io.supervisedproxy.core.process.ReadinessMonitor;
import io.supervisedproxy.core.process.ReadinessPredicate;
import io.supervisedproxy.server.config.ConfigLoader;
import io.supervisedproxy.server.config.ProxyConfig;
import io.supervisedproxy.server.websocket.UpgradeBridge;
import io.supervisedproxy.server.websocket.UpgradeRequiredHandler;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the proxy startup sequence.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Load configuration from YAML + env overlay, configure Logback</li>
 * <li>Launch the backend on its internal port</li>
 * <li>Start the readiness monitor and the exit watcher</li>
 * <li>Wait for readiness, bounded; on timeout warn and carry on</li>
 * <li>Start the Javalin server: upgrade path first, then the catch-all
 * forwarder</li>
 * </ol>
 *
 * <p>
 * Only a failed backend launch aborts startup. This class is separate from
 * {@link io.supervisedproxy.server.SupervisedProxyMain} to allow integration
 * testing without going through {@code main()}.
 */
public final class ProxyApp {

    private static final Logger LOG = LoggerFactory.getLogger(ProxyApp.class);

    /** Methods relayed by the catch-all route. */
    static final List<HandlerType> FORWARDED_METHODS = List.of(
            HandlerType.GET,
            HandlerType.POST,
            HandlerType.PUT,
            HandlerType.DELETE,
            HandlerType.PATCH,
            HandlerType.HEAD,
            HandlerType.OPTIONS);

    /** Largest WebSocket message relayed in either direction. */
    private static final long MAX_WS_MESSAGE_BYTES = 16L * 1024 * 1024;

    private final Javalin app;
    private final BackendProcess backend;
    private final UpgradeBridge bridge;
    private final ProxyConfig config;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private ProxyApp(Javalin app, BackendProcess backend, UpgradeBridge bridge, ProxyConfig config) {
        this.app = app;
        this.backend = backend;
        this.bridge = bridge;
        this.config = config;
    }

    /**
     * Loads configuration for the given command line, then runs
     * {@link #start(ProxyConfig)}.
     *
     * @param args command-line arguments (e.g. {@code --config proxy.yaml})
     * @return a running proxy
     * @throws BackendLaunchException if the backend cannot be spawned
     * @throws InterruptedException   if interrupted while waiting for readiness
     */
    public static ProxyApp start(String[] args) throws BackendLaunchException, InterruptedException {
        ProxyConfig config = ConfigLoader.resolve(args);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded: backend command={}", config.backendCommand());
        return start(config);
    }

    /**
     * Executes the startup sequence for an already loaded configuration.
     *
     * @param config validated configuration
     * @return a running proxy
     * @throws BackendLaunchException if the backend cannot be spawned
     * @throws InterruptedException   if interrupted while waiting for readiness;
     *                                the backend is stopped first
     */
    public static ProxyApp start(ProxyConfig config) throws BackendLaunchException, InterruptedException {
        long startTime = System.nanoTime();

        // 1. Launch the backend on its internal port
        BackendProcess backend = BackendLauncher.start(config.toLaunchSpec());

        // 2. Drain its output and watch for an exit we did not ask for
        new ReadinessMonitor(backend, ReadinessPredicate.containsIgnoreCase(config.readinessPhrase())).start();
        backend.onExit().thenAccept(exited -> {
            if (!exited.isStopping()) {
                LOG.warn(
                        "Backend pid={} exited with code {}; it will not be restarted",
                        exited.pid(),
                        exited.exitCode().isPresent() ? exited.exitCode().getAsInt() : "unknown");
            }
        });

        // 3. Bounded wait for readiness, then serve regardless
        boolean ready;
        try {
            ready = backend.awaitReady(config.readinessPollInterval(), config.readinessTimeout());
        } catch (InterruptedException e) {
            backend.stop(config.backendStopTimeout());
            throw e;
        }
        if (ready) {
            LOG.info("Backend ready after {} ms", elapsedMs(startTime));
        } else {
            LOG.warn(
                    "Backend did not report '{}' within {} ms (alive={}); serving anyway",
                    config.readinessPhrase(),
                    config.readinessTimeoutMs(),
                    backend.isAlive());
        }

        // 4. Start the public listener
        UpgradeBridge bridge = new UpgradeBridge(config);
        Javalin app;
        try {
            app = createServer(config, bridge, new ForwardingHandler(new UpstreamClient(config)));
            app.start(config.proxyHost(), config.proxyPort());
        } catch (RuntimeException e) {
            backend.stop(config.backendStopTimeout());
            throw e;
        }

        LOG.info(
                "supervised-proxy started: port={}, backend={}, upgrade={} -> {}, backendPid={}, ready={}, startupMs={}",
                app.port(),
                config.backendBaseUrl(),
                config.upgradePath(),
                bridge.backendUri(),
                backend.pid(),
                backend.isReady(),
                elapsedMs(startTime));

        return new ProxyApp(app, backend, bridge, config);
    }

    /**
     * Builds the Javalin server with its routes. Routes registered first win, so
     * the upgrade path is claimed before the catch-all.
     */
    static Javalin createServer(ProxyConfig config, UpgradeBridge bridge, Handler forwarder) {
        Javalin app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;
            javalinConfig.http.disableCompression();
            javalinConfig.http.maxRequestSize = config.maxBodyBytes();
            javalinConfig.jetty.modifyServer(server -> server.setStopTimeout(config.shutdownDrainTimeoutMs()));
            javalinConfig.jetty.modifyWebSocketServletFactory(factory -> {
                factory.setIdleTimeout(Duration.ofMillis(config.upgradeIdleTimeoutMs()));
                factory.setMaxTextMessageSize(MAX_WS_MESSAGE_BYTES);
                factory.setMaxBinaryMessageSize(MAX_WS_MESSAGE_BYTES);
            });
        });

        app.ws(config.upgradePath(), bridge);
        Handler upgradeRequired = new UpgradeRequiredHandler();
        for (HandlerType method : FORWARDED_METHODS) {
            app.addHttpHandler(method, config.upgradePath(), upgradeRequired);
        }

        for (HandlerType method : FORWARDED_METHODS) {
            app.addHttpHandler(method, "/", forwarder);
            app.addHttpHandler(method, "/<path>", forwarder);
        }
        return app;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    /** Returns the port the proxy is listening on. */
    public int port() {
        return app.port();
    }

    /** Returns the Javalin application. */
    public Javalin javalin() {
        return app;
    }

    /** Returns the supervised backend. */
    public BackendProcess backend() {
        return backend;
    }

    /** Returns the WebSocket bridge. */
    public UpgradeBridge bridge() {
        return bridge;
    }

    /** Returns the proxy configuration. */
    public ProxyConfig config() {
        return config;
    }

    /**
     * Stops the proxy: ends open WebSocket sessions with {@code 1001}, stops
     * Javalin (draining in-flight requests), then terminates the backend.
     * Repeated calls are no-ops.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        bridge.closeAll();
        app.stop();
        backend.stop(config.backendStopTimeout());
        LOG.info("supervised-proxy stopped");
    }
}
