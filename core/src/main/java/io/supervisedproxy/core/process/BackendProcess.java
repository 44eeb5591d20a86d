package io.supervisedproxy.core.process;

import java.io.InputStream;
import java.time.Duration;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle on a spawned backend process and its readiness state.
 *
 * <p>
 * Readiness is a one-way latch: {@link #markReady()} flips it from
 * {@code false} to {@code true} at most once and nothing flips it back. The
 * {@link ReadinessMonitor} is the only writer; the front controller and any
 * request handler may read it concurrently.
 *
 * <p>
 * A backend that exits on its own is not restarted. Its exit is observable
 * through {@link #onExit()}.
 *
 * <p>
 * This class is thread-safe.
 */
public final class BackendProcess {

    private static final Logger LOG = LoggerFactory.getLogger(BackendProcess.class);

    private final Process process;
    private final AtomicBoolean ready = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);

    BackendProcess(Process process) {
        this.process = process;
    }

    /** Operating-system process id. */
    public long pid() {
        return process.pid();
    }

    /** Whether the process is still running. */
    public boolean isAlive() {
        return process.isAlive();
    }

    /** The merged stdout/stderr stream of the process. */
    public InputStream output() {
        return process.getInputStream();
    }

    /** Whether the readiness phrase has been observed. */
    public boolean isReady() {
        return ready.get();
    }

    /**
     * Records that the backend reported readiness.
     *
     * @return {@code true} for the single call that performed the transition,
     *         {@code false} if the backend was already ready
     */
    public boolean markReady() {
        return ready.compareAndSet(false, true);
    }

    /**
     * Polls the readiness flag every {@code pollInterval} until {@code ceiling}
     * has elapsed.
     *
     * <p>
     * Returns early with {@code false} when the process has already exited
     * without becoming ready, since no further output can arrive.
     *
     * @param pollInterval delay between checks
     * @param ceiling      total time to wait
     * @return whether readiness was observed within the ceiling
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean awaitReady(Duration pollInterval, Duration ceiling) throws InterruptedException {
        long intervalMs = Math.max(1, pollInterval.toMillis());
        long deadline = System.nanoTime() + ceiling.toNanos();
        while (!ready.get()) {
            if (!process.isAlive()) {
                return ready.get();
            }
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                return false;
            }
            Thread.sleep(Math.min(intervalMs, remainingMs));
        }
        return true;
    }

    /** Completes when the process terminates, for whatever reason. */
    public CompletableFuture<BackendProcess> onExit() {
        return process.onExit().thenApply(p -> this);
    }

    /** Exit code, or empty while the process is running. */
    public OptionalInt exitCode() {
        return process.isAlive() ? OptionalInt.empty() : OptionalInt.of(process.exitValue());
    }

    /** Whether {@link #stop(Duration)} has been requested. */
    public boolean isStopping() {
        return stopping.get();
    }

    /**
     * Terminates the process: polite termination first, forced termination if
     * it is still running after {@code grace}. Child processes spawned by the
     * backend are terminated with it. Repeated calls are no-ops.
     *
     * @param grace how long to wait for a clean exit
     */
    public void stop(Duration grace) {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        if (!process.isAlive()) {
            LOG.debug("Backend pid={} already exited", pid());
            return;
        }

        LOG.info("Stopping backend pid={}", pid());
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Backend pid={} did not exit within {} ms, killing it", pid(), grace.toMillis());
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    @Override
    public String toString() {
        return "BackendProcess[pid=" + pid() + ", ready=" + ready.get() + ", alive=" + isAlive() + "]";
    }
}
