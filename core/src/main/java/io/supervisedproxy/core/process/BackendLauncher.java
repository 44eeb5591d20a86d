package io.supervisedproxy.core.process;

import io.supervisedproxy.core.error.BackendLaunchException;
import java.io.IOException;
import java.nio.file.Files;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spawns the backend as a child process.
 *
 * <p>
 * The child inherits the front end's environment plus the overrides in the
 * {@link BackendLaunchSpec}. Standard error is merged into standard output so
 * the {@link ReadinessMonitor} sees a single ordered stream of lines.
 */
public final class BackendLauncher {

    private static final Logger LOG = LoggerFactory.getLogger(BackendLauncher.class);

    private BackendLauncher() {}

    /**
     * Starts the backend described by {@code spec}.
     *
     * @param spec command, working directory and environment overrides
     * @return a handle on the running process, not yet ready
     * @throws BackendLaunchException if the working directory does not exist
     *                                or the operating system refuses to start
     *                                the command
     */
    public static BackendProcess start(BackendLaunchSpec spec) throws BackendLaunchException {
        ProcessBuilder builder = new ProcessBuilder(spec.command()).redirectErrorStream(true);

        if (spec.workingDirectory() != null) {
            if (!Files.isDirectory(spec.workingDirectory())) {
                throw new BackendLaunchException(
                        "Backend working directory does not exist: " + spec.workingDirectory(), spec.command());
            }
            builder.directory(spec.workingDirectory().toFile());
        }
        builder.environment().putAll(spec.environment());

        Process process;
        try {
            process = builder.start();
        } catch (IOException | SecurityException e) {
            throw new BackendLaunchException(
                    "Failed to start backend " + spec.command() + ": " + e.getMessage(), spec.command(), e);
        }

        LOG.info(
                "Backend started: pid={}, command={}, workingDir={}, envOverrides={}",
                process.pid(),
                spec.command(),
                spec.workingDirectory() != null ? spec.workingDirectory() : "(inherited)",
                spec.environment().keySet());
        return new BackendProcess(process);
    }
}
