package io.supervisedproxy.server.proxy;

import io.javalin.http.Context;
import io.supervisedproxy.core.model.HttpHeaders;
import io.supervisedproxy.core.model.ProxyRequest;
import jakarta.servlet.http.HttpServletRequest;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Captures a Javalin {@link Context} as a {@link ProxyRequest}.
 *
 * <p>
 * Path and query string are taken in their raw, still percent-encoded form;
 * every header value is kept, in the order the client sent it.
 */
public final class RequestMapper {

    private RequestMapper() {
        // utility class
    }

    /**
     * Maps the inbound request.
     *
     * @param ctx the Javalin request context
     * @return the request to forward
     */
    public static ProxyRequest toProxyRequest(Context ctx) {
        HttpServletRequest req = ctx.req();
        String path = req.getRequestURI();
        if (path == null || path.isEmpty()) {
            path = ctx.path();
        }
        Map<String, String> cookies = ctx.cookieMap();
        return new ProxyRequest(
                ctx.method().name(),
                path,
                ctx.queryString(),
                headersOf(req),
                ctx.bodyAsBytes(),
                cookies != null ? new LinkedHashMap<>(cookies) : Map.of());
    }

    /** All request headers with lowercase names and every value in order. */
    static HttpHeaders headersOf(HttpServletRequest req) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        Enumeration<String> names = req.getHeaderNames();
        if (names == null) {
            return HttpHeaders.empty();
        }
        while (names.hasMoreElements()) {
            String name = names.nextElement();
            List<String> values = headers.computeIfAbsent(name.toLowerCase(Locale.ROOT), k -> new ArrayList<>());
            Enumeration<String> raw = req.getHeaders(name);
            if (raw != null) {
                while (raw.hasMoreElements()) {
                    values.add(raw.nextElement());
                }
            }
        }
        return HttpHeaders.ofMulti(headers);
    }
}
