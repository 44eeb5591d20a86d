package io.supervisedproxy.server.websocket;

import io.javalin.websocket.WsConfig;
import io.supervisedproxy.server.config.ProxyConfig;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges client WebSockets on the upgrade path to the backend's WebSocket
 * endpoint.
 *
 * <p>
 * Registered with {@code Javalin.ws(path, bridge)}. Each accepted client
 * connection gets its own {@link UpgradeSession} and its own backend
 * connection; sessions share nothing but the {@link HttpClient}. A failure in
 * one session never affects another.
 */
public final class UpgradeBridge implements Consumer<WsConfig> {

    private static final Logger LOG = LoggerFactory.getLogger(UpgradeBridge.class);

    private final HttpClient httpClient;
    private final URI backendUri;
    private final Duration connectTimeout;
    private final Duration sendTimeout;
    private final Map<String, UpgradeSession> sessions = new ConcurrentHashMap<>();

    /**
     * Creates a bridge to the backend WebSocket endpoint of the given
     * configuration.
     *
     * @param config proxy configuration
     */
    public UpgradeBridge(ProxyConfig config) {
        this(
                config.backendUpgradeUri(),
                Duration.ofMillis(config.backendConnectTimeoutMs()),
                Duration.ofMillis(config.backendReadTimeoutMs()));
    }

    /**
     * Creates a bridge with explicit timeouts.
     *
     * @param sendTimeout how long one client message may wait for the backend
     *                    to accept it, connecting included
     */
    UpgradeBridge(URI backendUri, Duration connectTimeout, Duration sendTimeout) {
        this.backendUri = backendUri;
        this.connectTimeout = connectTimeout;
        this.sendTimeout = sendTimeout.compareTo(connectTimeout) < 0 ? connectTimeout : sendTimeout;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .build();
    }

    @Override
    public void accept(WsConfig ws) {
        ws.onConnect(ctx -> open(new JavalinInboundChannel(ctx)));
        ws.onMessage(ctx -> {
            UpgradeSession session = sessions.get(ctx.sessionId());
            if (session != null) {
                session.awaitDelivery(session.forwardText(ctx.message()), sendTimeout);
            }
        });
        ws.onBinaryMessage(ctx -> {
            UpgradeSession session = sessions.get(ctx.sessionId());
            if (session != null) {
                int offset = ctx.offset();
                session.awaitDelivery(
                        session.forwardBinary(Arrays.copyOfRange(ctx.data(), offset, offset + ctx.length())),
                        sendTimeout);
            }
        });
        ws.onClose(ctx -> {
            UpgradeSession session = sessions.get(ctx.sessionId());
            if (session != null) {
                session.clientClosed(ctx.status(), ctx.reason());
            }
        });
        ws.onError(ctx -> {
            UpgradeSession session = sessions.get(ctx.sessionId());
            if (session != null) {
                session.clientFailed(ctx.error());
            }
        });
    }

    /**
     * Starts a session for a freshly accepted client connection.
     *
     * @param inbound the client-facing channel
     * @return the started session
     */
    UpgradeSession open(InboundChannel inbound) {
        UpgradeSession session = new UpgradeSession(inbound);
        sessions.put(session.id(), session);
        session.finished().whenComplete((ignored, error) -> {
            sessions.remove(session.id(), session);
            LOG.debug("Session {} finished, {} active", session.id(), sessions.size());
        });

        LOG.debug("Session {} accepted, connecting to {}", session.id(), backendUri);
        session.start(listener -> httpClient
                .newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(backendUri, listener));
        return session;
    }

    /** Number of sessions that have not finished yet. */
    public int activeSessions() {
        return sessions.size();
    }

    /** Ends every open session, used on shutdown. */
    public void closeAll() {
        if (!sessions.isEmpty()) {
            LOG.info("Closing {} open WebSocket session(s)", sessions.size());
        }
        sessions.values().forEach(UpgradeSession::close);
    }

    /** Backend WebSocket address. */
    public URI backendUri() {
        return backendUri;
    }
}
