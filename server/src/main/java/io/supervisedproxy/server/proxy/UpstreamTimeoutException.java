package io.supervisedproxy.server.proxy;

/** The backend accepted the call but did not answer within the read timeout. */
public class UpstreamTimeoutException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    public UpstreamTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
