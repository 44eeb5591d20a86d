package io.supervisedproxy.server.websocket;

import java.net.http.WebSocket;
import java.util.concurrent.CompletableFuture;

/** Opens the backend-facing half of an upgrade session. */
@FunctionalInterface
interface BackendConnector {

    CompletableFuture<WebSocket> connect(WebSocket.Listener listener);
}
