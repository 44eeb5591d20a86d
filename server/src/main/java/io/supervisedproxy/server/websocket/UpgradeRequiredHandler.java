package io.supervisedproxy.server.websocket;

import io.javalin.http.Context;
import io.javalin.http.Handler;

/**
 * Answers plain HTTP requests on the upgrade path: the path only speaks
 * WebSocket.
 */
public final class UpgradeRequiredHandler implements Handler {

    static final int UPGRADE_REQUIRED = 426;

    @Override
    public void handle(Context ctx) {
        ctx.status(UPGRADE_REQUIRED);
        ctx.header("Upgrade", "websocket");
        ctx.contentType("text/plain; charset=utf-8");
        ctx.result("Upgrade Required");
    }
}
