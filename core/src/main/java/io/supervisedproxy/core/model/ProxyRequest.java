package io.supervisedproxy.core.model;

import java.util.Map;

/**
 * An inbound request captured for forwarding to the backend.
 *
 * <p>
 * Nothing here is interpreted: the body is an opaque byte sequence and the
 * path and query string are kept in their raw (still percent-encoded) form so
 * the backend sees exactly what the client sent.
 *
 * @param method      HTTP method, upper case
 * @param path        raw request path, always starting with {@code /}
 * @param queryString raw query string without the leading {@code ?}, or
 *                    {@code null}
 * @param headers     inbound headers, all values preserved
 * @param body        request body, empty when there is none
 * @param cookies     cookies parsed from the inbound request
 */
public record ProxyRequest(
        String method, String path, String queryString, HttpHeaders headers, byte[] body, Map<String, String> cookies) {

    public ProxyRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method is required");
        }
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (headers == null) {
            headers = HttpHeaders.empty();
        }
        if (body == null) {
            body = new byte[0];
        }
        cookies = cookies == null ? Map.of() : Map.copyOf(cookies);
    }

    /**
     * Path plus query string, the form used to address the backend.
     *
     * @return e.g. {@code /candles/EURUSD?count=50}
     */
    public String pathWithQuery() {
        if (queryString == null || queryString.isEmpty()) {
            return path;
        }
        return path + "?" + queryString;
    }
}
