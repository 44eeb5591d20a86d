package io.supervisedproxy.server.websocket;

import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One client WebSocket paired with one backend WebSocket.
 *
 * <p>
 * The two directions run independently:
 * <ul>
 * <li>client to backend: messages are chained onto the backend connect
 * future, so they are sent in arrival order and wait for the connection if it
 * is not open yet. The client's read loop waits for each send through
 * {@link #awaitDelivery}, so a slow backend slows the client down instead of
 * building a queue</li>
 * <li>backend to client: {@link BackendListener} relays one complete message
 * at a time</li>
 * </ul>
 * A direction ends when its source closes or fails, or a send into its sink
 * fails. As soon as either direction has ended both channels are closed; the
 * session is finished once both directions have ended, or after
 * {@link #CLOSE_TIMEOUT} if a peer never completes its close handshake.
 *
 * <p>
 * Payloads are relayed untouched: text stays text, binary stays binary.
 */
public final class UpgradeSession {

    private static final Logger LOG = LoggerFactory.getLogger(UpgradeSession.class);

    static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    /** Status sent to the client when the backend cannot be reached. */
    static final int BACKEND_UNAVAILABLE = 1011;

    private static final int NORMAL_CLOSURE = 1000;

    private final InboundChannel inbound;
    private final CompletableFuture<Void> toBackendDone = new CompletableFuture<>();
    private final CompletableFuture<Void> toClientDone = new CompletableFuture<>();
    private final CompletableFuture<Void> finished;
    private final AtomicBoolean closing = new AtomicBoolean(false);
    private final AtomicReference<CloseStatus> closeStatus = new AtomicReference<>();
    private final AtomicBoolean outboundCloseSent = new AtomicBoolean(false);

    private volatile CompletableFuture<WebSocket> connect;
    private CompletableFuture<WebSocket> sendChain; // guarded by this

    UpgradeSession(InboundChannel inbound) {
        this.inbound = inbound;
        this.finished = CompletableFuture.allOf(toBackendDone, toClientDone);
    }

    /** Identifier of the client-side channel. */
    public String id() {
        return inbound.id();
    }

    /** Completes once both directions have ended. */
    public CompletableFuture<Void> finished() {
        return finished;
    }

    /** Whether either direction has ended and the channels are being closed. */
    public boolean isClosing() {
        return closing.get();
    }

    /**
     * Opens the backend connection and arms the teardown.
     *
     * @param connector opens the backend WebSocket with the given listener
     */
    void start(BackendConnector connector) {
        CompletableFuture<WebSocket> opening;
        try {
            opening = connector.connect(new BackendListener(this));
        } catch (RuntimeException e) {
            opening = CompletableFuture.failedFuture(e);
        }
        connect = opening;
        synchronized (this) {
            sendChain = opening;
        }
        opening.whenComplete((webSocket, error) -> {
            if (error != null) {
                LOG.warn("Session {}: backend WebSocket connect failed: {}", id(), rootMessage(error));
                closeStatus.compareAndSet(null, new CloseStatus(BACKEND_UNAVAILABLE, "Backend unavailable"));
                toClientDone.complete(null);
                toBackendDone.complete(null);
            } else {
                LOG.debug("Session {}: backend WebSocket connected", id());
            }
        });

        CompletableFuture.anyOf(toBackendDone, toClientDone).whenComplete((ignored, error) -> closeBoth());
    }

    // ── client to backend ──

    /**
     * Queues a text message for the backend.
     *
     * @return completes once the backend accepted the message; already complete
     *         if the message was dropped because the direction has ended
     */
    CompletableFuture<?> forwardText(String message) {
        return enqueue(webSocket -> webSocket.sendText(message, true));
    }

    CompletableFuture<?> forwardBinary(byte[] message) {
        return enqueue(webSocket -> webSocket.sendBinary(ByteBuffer.wrap(message), true));
    }

    private synchronized CompletableFuture<?> enqueue(Function<WebSocket, CompletableFuture<WebSocket>> send) {
        if (sendChain == null || toBackendDone.isDone() || closing.get()) {
            return CompletableFuture.completedFuture(null);
        }
        sendChain = sendChain.thenCompose(send);
        sendChain.whenComplete((webSocket, error) -> {
            if (error != null && toBackendDone.complete(null)) {
                LOG.debug("Session {}: client-to-backend direction ended: {}", id(), rootMessage(error));
            }
        });
        return sendChain;
    }

    /**
     * Blocks the caller, the client's read loop, until {@code sent} completes,
     * so at most one client message per session is in flight towards the
     * backend. If the backend does not take the message within
     * {@code timeout} the client-to-backend direction ends.
     *
     * @param sent    future returned by {@link #forwardText(String)} or
     *                {@link #forwardBinary(byte[])}
     * @param timeout upper bound for the backend to accept the message
     */
    void awaitDelivery(CompletableFuture<?> sent, Duration timeout) {
        try {
            sent.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            closeStatus.compareAndSet(null, new CloseStatus(BACKEND_UNAVAILABLE, "Backend not accepting messages"));
            if (toBackendDone.complete(null)) {
                LOG.warn("Session {}: backend did not accept a message within {} ms, closing", id(), timeout.toMillis());
            }
        } catch (ExecutionException e) {
            // the send chain already ended the direction
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            toBackendDone.complete(null);
        }
    }

    void clientClosed(int statusCode, String reason) {
        closeStatus.compareAndSet(null, new CloseStatus(statusCode, reason));
        if (toBackendDone.complete(null)) {
            LOG.debug("Session {}: client closed ({})", id(), statusCode);
        }
    }

    void clientFailed(Throwable error) {
        if (toBackendDone.complete(null)) {
            LOG.debug("Session {}: client channel failed: {}", id(), rootMessage(error));
        }
    }

    // ── backend to client ──

    void relayTextToClient(String message) {
        if (toClientDone.isDone()) {
            return;
        }
        try {
            inbound.sendText(message);
        } catch (Exception e) {
            endToClient(e);
        }
    }

    void relayBinaryToClient(byte[] message) {
        if (toClientDone.isDone()) {
            return;
        }
        try {
            inbound.sendBinary(ByteBuffer.wrap(message));
        } catch (Exception e) {
            endToClient(e);
        }
    }

    private void endToClient(Exception e) {
        if (toClientDone.complete(null)) {
            LOG.debug("Session {}: backend-to-client direction ended: {}", id(), rootMessage(e));
        }
    }

    void backendClosed(int statusCode, String reason) {
        closeStatus.compareAndSet(null, new CloseStatus(statusCode, reason));
        if (toClientDone.complete(null)) {
            LOG.debug("Session {}: backend closed ({})", id(), statusCode);
        }
    }

    void backendFailed(Throwable error) {
        if (toClientDone.complete(null)) {
            LOG.debug("Session {}: backend channel failed: {}", id(), rootMessage(error));
        }
    }

    // ── teardown ──

    /** Ends the session from outside, e.g. on shutdown. */
    public void close() {
        closeStatus.compareAndSet(null, new CloseStatus(1001, "Proxy shutting down"));
        toBackendDone.complete(null);
        toClientDone.complete(null);
    }

    private void closeBoth() {
        if (!closing.compareAndSet(false, true)) {
            return;
        }
        CloseStatus status = closeStatus.get() != null ? closeStatus.get() : new CloseStatus(NORMAL_CLOSURE, "");
        try {
            inbound.close(status.relayableCode(), status.reason());
        } catch (Exception e) {
            LOG.debug("Session {}: client channel already closed: {}", id(), rootMessage(e));
        }

        // the close frame goes out after any message still queued for the backend
        CompletableFuture<WebSocket> pending;
        synchronized (this) {
            pending = sendChain;
        }
        if (pending != null) {
            pending.handle((ws, error) -> {
                WebSocket webSocket = connectedSocket();
                if (webSocket != null) {
                    closeOutbound(webSocket);
                }
                return null;
            });
        }

        // a peer that never finishes the close handshake must not pin the session
        CompletableFuture.delayedExecutor(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)
                .execute(() -> {
                    WebSocket webSocket = connectedSocket();
                    if (webSocket != null && !webSocket.isInputClosed()) {
                        webSocket.abort();
                    }
                    toBackendDone.complete(null);
                    toClientDone.complete(null);
                });
        LOG.debug("Session {}: closing both channels ({})", id(), status.code());
    }

    private WebSocket connectedSocket() {
        CompletableFuture<WebSocket> opening = connect;
        if (opening == null || !opening.isDone() || opening.isCompletedExceptionally()) {
            return null;
        }
        return opening.join();
    }

    private void closeOutbound(WebSocket webSocket) {
        if (webSocket.isOutputClosed() || !outboundCloseSent.compareAndSet(false, true)) {
            return;
        }
        CloseStatus status = closeStatus.get() != null ? closeStatus.get() : new CloseStatus(NORMAL_CLOSURE, "");
        try {
            webSocket.sendClose(status.relayableCode(), status.reason()).whenComplete((ws, error) -> {
                if (error != null) {
                    LOG.debug("Session {}: backend close failed, aborting: {}", id(), rootMessage(error));
                    webSocket.abort();
                }
            });
        } catch (RuntimeException e) {
            LOG.debug("Session {}: backend close rejected, aborting: {}", id(), e.getMessage());
            webSocket.abort();
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getClass().getSimpleName() + (root.getMessage() != null ? ": " + root.getMessage() : "");
    }

    /** Close status propagated from the side that ended first. */
    record CloseStatus(int code, String reason) {

        CloseStatus {
            reason = reason == null ? "" : reason;
        }

        /**
         * Codes such as 1005 (no status) and 1006 (abnormal) describe a closure
         * but may not be sent in a close frame; those become 1000.
         */
        int relayableCode() {
            if (code == 1000 || code == 1001 || code == 1008 || code == 1011) {
                return code;
            }
            return code >= 3000 && code <= 4999 ? code : NORMAL_CLOSURE;
        }
    }
}
