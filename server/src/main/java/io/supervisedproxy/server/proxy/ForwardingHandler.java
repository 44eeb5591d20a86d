package io.supervisedproxy.server.proxy;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.supervisedproxy.core.model.ProxyRequest;
import io.supervisedproxy.core.model.ProxyResponse;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Catch-all handler relaying a request to the backend and its response back.
 *
 * <p>
 * A transport failure towards the backend never escapes this handler: the
 * client receives {@code 502} with a short plain-text diagnostic and other
 * requests are unaffected. Requests arriving before the backend reported
 * readiness are forwarded the same way.
 *
 * <p>
 * This class is thread-safe; all state is local to each
 * {@link #handle(Context)} invocation.
 */
public final class ForwardingHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(ForwardingHandler.class);

    static final int BAD_GATEWAY = 502;
    static final String ERROR_PREFIX = "Proxy error: ";

    private final UpstreamClient upstreamClient;

    public ForwardingHandler(UpstreamClient upstreamClient) {
        this.upstreamClient = upstreamClient;
    }

    @Override
    public void handle(Context ctx) {
        ProxyRequest request = RequestMapper.toProxyRequest(ctx);

        ProxyResponse response;
        try {
            response = upstreamClient.forward(request);
        } catch (UpstreamException e) {
            LOG.warn("Backend unavailable for {} {}: {}", request.method(), request.pathWithQuery(), e.getMessage());
            writeProxyError(ctx, e.getMessage());
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writeProxyError(ctx, "interrupted while waiting for backend");
            return;
        }

        writeResponse(ctx, response);
    }

    static void writeResponse(Context ctx, ProxyResponse response) {
        ctx.status(response.statusCode());
        HttpServletResponse res = ctx.res();
        response.headers().forEach((name, values) -> {
            // replace server defaults such as Date, then append the rest
            res.setHeader(name, values.get(0));
            for (String value : values.subList(1, values.size())) {
                res.addHeader(name, value);
            }
        });
        if (!response.headers().contains("content-type")) {
            // drop the serving layer's default so the client sees the backend's headers only
            res.setContentType(null);
        }
        ctx.result(response.body());
    }

    private static void writeProxyError(Context ctx, String diagnostic) {
        String message = diagnostic != null && !diagnostic.isBlank() ? diagnostic : "backend unreachable";
        ctx.status(BAD_GATEWAY);
        ctx.contentType("text/plain; charset=utf-8");
        ctx.result(ERROR_PREFIX + message);
    }
}
