package io.supervisedproxy.core.error;

import java.util.List;

/**
 * The backend process could not be spawned: missing executable, missing
 * working directory, or an I/O error from the operating system.
 *
 * <p>
 * This is the only failure that is allowed to abort the front end; every
 * other failure is contained to one request or one upgrade session.
 */
public class BackendLaunchException extends Exception {

    private static final long serialVersionUID = 1L;

    private final List<String> command;

    public BackendLaunchException(String message, List<String> command) {
        super(message);
        this.command = List.copyOf(command);
    }

    public BackendLaunchException(String message, List<String> command, Throwable cause) {
        super(message, cause);
        this.command = List.copyOf(command);
    }

    /** The command line that failed to start. */
    public List<String> command() {
        return command;
    }
}
