package io.supervisedproxy.core.model;

import java.nio.charset.StandardCharsets;

/**
 * A backend response as relayed to the client.
 *
 * @param statusCode HTTP status code
 * @param headers    response headers with the proxy-managed ones already
 *                   removed
 * @param body       response body, empty for no-body responses
 */
public record ProxyResponse(int statusCode, HttpHeaders headers, byte[] body) {

    public ProxyResponse {
        if (headers == null) {
            headers = HttpHeaders.empty();
        }
        if (body == null) {
            body = new byte[0];
        }
    }

    /** Body decoded as UTF-8, for logging and tests. */
    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
