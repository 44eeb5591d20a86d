package io.supervisedproxy.core.process;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * What to run as the backend and how.
 *
 * @param command          executable followed by its arguments; never empty
 * @param workingDirectory directory to start in, or {@code null} to inherit
 *                         the front end's
 * @param environment      variables added to (or replacing) the inherited
 *                         environment; carries the internal port override
 */
public record BackendLaunchSpec(List<String> command, Path workingDirectory, Map<String, String> environment) {

    public BackendLaunchSpec {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command is required");
        }
        command = List.copyOf(command);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }
}
