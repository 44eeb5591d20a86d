package io.supervisedproxy.server.websocket;

import io.javalin.websocket.WsContext;
import java.nio.ByteBuffer;

/** {@link InboundChannel} over a Javalin WebSocket session. */
final class JavalinInboundChannel implements InboundChannel {

    private final WsContext ctx;

    JavalinInboundChannel(WsContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public String id() {
        return ctx.sessionId();
    }

    @Override
    public void sendText(String text) {
        ctx.send(text);
    }

    @Override
    public void sendBinary(ByteBuffer data) {
        ctx.send(data);
    }

    @Override
    public void close(int statusCode, String reason) {
        ctx.closeSession(statusCode, reason);
    }
}
