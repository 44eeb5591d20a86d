package io.supervisedproxy.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProxyRequestTest {

    @Test
    void nullsAreDefaulted() {
        ProxyRequest request = new ProxyRequest("GET", null, null, null, null, null);

        assertThat(request.path()).isEqualTo("/");
        assertThat(request.headers().isEmpty()).isTrue();
        assertThat(request.body()).isEmpty();
        assertThat(request.cookies()).isEmpty();
    }

    @Test
    void methodIsRequired() {
        assertThatThrownBy(() -> new ProxyRequest(" ", "/", null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pathWithQueryKeepsRawEncoding() {
        ProxyRequest request =
                new ProxyRequest("GET", "/api/candles/EUR%2FUSD", "count=50&tf=1m", null, null, null);
        assertThat(request.pathWithQuery()).isEqualTo("/api/candles/EUR%2FUSD?count=50&tf=1m");
    }

    @Test
    void pathWithQueryOmitsEmptyQuery() {
        assertThat(new ProxyRequest("GET", "/health", "", null, null, null).pathWithQuery())
                .isEqualTo("/health");
    }

    @Test
    void cookiesAreCopied() {
        Map<String, String> cookies = new HashMap<>(Map.of("session", "abc"));
        ProxyRequest request = new ProxyRequest("GET", "/", null, null, null, cookies);

        cookies.put("other", "x");

        assertThat(request.cookies()).containsOnlyKeys("session");
    }
}
