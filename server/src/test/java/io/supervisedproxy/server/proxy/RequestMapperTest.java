package io.supervisedproxy.server.proxy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.javalin.http.Context;
import io.javalin.http.HandlerType;
import io.supervisedproxy.core.model.ProxyRequest;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RequestMapper")
class RequestMapperTest {

    @Test
    @DisplayName("method, raw path and raw query string are captured")
    void methodPathQuery() {
        Context ctx = mockContext(HandlerType.GET, "/candles/EUR%2FUSD", "count=50&tf=M1", Map.of());

        ProxyRequest request = RequestMapper.toProxyRequest(ctx);

        assertThat(request.method()).isEqualTo("GET");
        assertThat(request.path()).isEqualTo("/candles/EUR%2FUSD");
        assertThat(request.queryString()).isEqualTo("count=50&tf=M1");
        assertThat(request.pathWithQuery()).isEqualTo("/candles/EUR%2FUSD?count=50&tf=M1");
    }

    @Test
    @DisplayName("repeated headers keep every value in order, names lowercased")
    void multiValueHeaders() {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("X-Trace", List.of("one", "two"));
        headers.put("Content-Type", List.of("application/json"));
        Context ctx = mockContext(HandlerType.POST, "/orders", null, headers);

        ProxyRequest request = RequestMapper.toProxyRequest(ctx);

        assertThat(request.headers().names()).containsExactlyInAnyOrder("x-trace", "content-type");
        assertThat(request.headers().all("X-TRACE")).containsExactly("one", "two");
        assertThat(request.headers().first("content-type")).isEqualTo("application/json");
    }

    @Test
    @DisplayName("body bytes and cookies are captured")
    void bodyAndCookies() {
        Context ctx = mockContext(HandlerType.PUT, "/settings", null, Map.of());
        when(ctx.bodyAsBytes()).thenReturn("{\"theme\":\"dark\"}".getBytes(StandardCharsets.UTF_8));
        when(ctx.cookieMap()).thenReturn(Map.of("session", "abc123"));

        ProxyRequest request = RequestMapper.toProxyRequest(ctx);

        assertThat(new String(request.body(), StandardCharsets.UTF_8)).isEqualTo("{\"theme\":\"dark\"}");
        assertThat(request.cookies()).containsOnly(Map.entry("session", "abc123"));
    }

    @Test
    @DisplayName("root path and absent body")
    void rootPathNoBody() {
        Context ctx = mockContext(HandlerType.DELETE, "/", null, Map.of());

        ProxyRequest request = RequestMapper.toProxyRequest(ctx);

        assertThat(request.path()).isEqualTo("/");
        assertThat(request.body()).isEmpty();
        assertThat(request.cookies()).isEmpty();
        assertThat(request.headers().isEmpty()).isTrue();
    }

    // ---- Helper ----

    private static Context mockContext(
            HandlerType method, String uri, String query, Map<String, List<String>> headers) {
        Context ctx = mock(Context.class);
        HttpServletRequest req = mock(HttpServletRequest.class);

        when(ctx.req()).thenReturn(req);
        when(ctx.method()).thenReturn(method);
        when(ctx.path()).thenReturn(uri);
        when(ctx.queryString()).thenReturn(query);
        when(ctx.bodyAsBytes()).thenReturn(new byte[0]);
        when(ctx.cookieMap()).thenReturn(Map.of());
        when(req.getRequestURI()).thenReturn(uri);
        when(req.getHeaderNames()).thenReturn(Collections.enumeration(headers.keySet()));
        headers.forEach((name, values) -> when(req.getHeaders(name)).thenReturn(Collections.enumeration(values)));

        return ctx;
    }
}
