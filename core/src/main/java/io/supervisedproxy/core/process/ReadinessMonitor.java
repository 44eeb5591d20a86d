package io.supervisedproxy.core.process;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains the backend's merged output and flips its readiness flag.
 *
 * <p>
 * Each line is echoed to the {@code io.supervisedproxy.backend} logger before
 * it is tested, so the operator sees the backend's own output even after
 * readiness. Only the first matching line has an effect.
 *
 * <p>
 * Runs until the stream reaches end-of-file, which happens when the backend
 * exits.
 */
public final class ReadinessMonitor implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(ReadinessMonitor.class);
    private static final Logger BACKEND_LOG = LoggerFactory.getLogger("io.supervisedproxy.backend");

    private final BackendProcess backend;
    private final ReadinessPredicate predicate;

    public ReadinessMonitor(BackendProcess backend, ReadinessPredicate predicate) {
        this.backend = backend;
        this.predicate = predicate;
    }

    /**
     * Starts draining on a daemon thread named {@code backend-output-<pid>}.
     *
     * @return the started thread
     */
    public Thread start() {
        Thread thread = new Thread(this, "backend-output-" + backend.pid());
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    @Override
    public void run() {
        try (BufferedReader reader =
                new BufferedReader(new InputStreamReader(backend.output(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                BACKEND_LOG.info("{}", line);
                if (!backend.isReady() && predicate.test(line) && backend.markReady()) {
                    LOG.info("Backend pid={} reported ready", backend.pid());
                }
            }
            LOG.debug("Backend pid={} output closed", backend.pid());
        } catch (IOException e) {
            LOG.debug("Backend pid={} output stream failed: {}", backend.pid(), e.getMessage());
        }
    }
}
