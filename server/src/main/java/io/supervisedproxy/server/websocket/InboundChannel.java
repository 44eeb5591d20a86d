package io.supervisedproxy.server.websocket;

import java.nio.ByteBuffer;

/**
 * The client-facing half of an upgrade session.
 *
 * <p>
 * Sends are invoked from one thread at a time. Implementations may throw on a
 * channel that is already closed; callers treat that as the end of the
 * backend-to-client direction.
 */
public interface InboundChannel {

    /** Identifier used in logs and the session registry. */
    String id();

    void sendText(String text) throws Exception;

    void sendBinary(ByteBuffer data) throws Exception;

    /** Starts the close handshake with the client. */
    void close(int statusCode, String reason) throws Exception;
}
