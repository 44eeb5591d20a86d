package io.supervisedproxy.server.proxy;

/**
 * Base exception for failures talking to the backend.
 *
 * <p>
 * Subtypes represent specific failure modes:
 * <ul>
 * <li>{@link UpstreamConnectException}: connection refused, reset, host
 * unreachable
 * <li>{@link UpstreamTimeoutException}: read timeout exceeded
 * </ul>
 * Either way the client sees a {@code 502}.
 */
public abstract class UpstreamException extends Exception {

    private static final long serialVersionUID = 1L;

    protected UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
