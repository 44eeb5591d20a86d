package io.supervisedproxy.server;

import io.supervisedproxy.server.proxy.ProxyApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the supervised proxy.
 *
 * <p>
 * Delegates to {@link ProxyApp#start(String[])} and registers
 * {@link ProxyApp#stop()} as a shutdown hook, so the backend goes down with
 * the front end. A configuration error or a failed backend launch is logged
 * and ends the JVM with exit code 1; a slow backend does not.
 */
public final class SupervisedProxyMain {

    private static final Logger LOG = LoggerFactory.getLogger(SupervisedProxyMain.class);

    private SupervisedProxyMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config supervised-proxy.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            ProxyApp proxy = ProxyApp.start(args);
            Runtime.getRuntime().addShutdownHook(new Thread(proxy::stop, "proxy-shutdown"));
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
