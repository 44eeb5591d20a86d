package io.supervisedproxy.server.config;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML, a
 * malformed number or a value that does not validate. The message names the
 * offending key and is meant for startup error output.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
