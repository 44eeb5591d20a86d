package io.supervisedproxy.server.proxy;

/**
 * The backend could not be reached or dropped the connection: refused, reset,
 * connect timeout, or an unusable target address.
 */
public class UpstreamConnectException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    public UpstreamConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
