package io.supervisedproxy.server.websocket;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * JDK WebSocket client for tests. Collects complete messages ({@link String}
 * for text, {@code byte[]} for binary) and the close status it receives.
 */
public final class WsTestClient implements WebSocket.Listener {

    private static final long TIMEOUT_SECONDS = 10;

    private final BlockingQueue<Object> received = new LinkedBlockingQueue<>();
    private final CompletableFuture<Integer> closeCode = new CompletableFuture<>();
    private final StringBuilder text = new StringBuilder();
    private final ByteArrayOutputStream binary = new ByteArrayOutputStream();
    private volatile String closeReason;
    private WebSocket webSocket;

    private WsTestClient() {}

    public static WsTestClient connect(URI uri) throws Exception {
        WsTestClient client = new WsTestClient();
        client.webSocket = HttpClient.newHttpClient()
                .newWebSocketBuilder()
                .buildAsync(uri, client)
                .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        return client;
    }

    public void sendText(String message) throws Exception {
        webSocket.sendText(message, true).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    public void sendBinary(byte[] message) throws Exception {
        webSocket.sendBinary(ByteBuffer.wrap(message), true).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    public void close(int statusCode, String reason) throws Exception {
        webSocket.sendClose(statusCode, reason).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    /** Next complete message, or {@code null} if none arrives in time. */
    public Object next() throws InterruptedException {
        return received.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    /** Close status sent by the server. */
    public int awaitCloseCode() throws Exception {
        return closeCode.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    public String closeReason() {
        return closeReason;
    }

    @Override
    public void onOpen(WebSocket webSocket) {
        webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
        text.append(data);
        if (last) {
            received.add(text.toString());
            text.setLength(0);
        }
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
        byte[] chunk = new byte[data.remaining()];
        data.get(chunk);
        binary.writeBytes(chunk);
        if (last) {
            received.add(binary.toByteArray());
            binary.reset();
        }
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
        closeReason = reason;
        closeCode.complete(statusCode);
        return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
        closeCode.completeExceptionally(error);
    }

    @Override
    public String toString() {
        return "WsTestClient" + received.stream()
                .map(m -> m instanceof byte[] bytes ? new String(bytes, StandardCharsets.UTF_8) : m.toString())
                .toList();
    }
}
