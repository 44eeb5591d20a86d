package io.supervisedproxy.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HttpHeadersTest {

    // ── Case-insensitive lookup ──

    @Test
    void firstIsCaseInsensitive() {
        HttpHeaders headers = HttpHeaders.of(Map.of("Content-Type", "application/json"));
        assertThat(headers.first("content-type")).isEqualTo("application/json");
        assertThat(headers.first("CONTENT-TYPE")).isEqualTo("application/json");
    }

    @Test
    void firstReturnsNullForMissingHeader() {
        assertThat(HttpHeaders.of(Map.of("Accept", "text/html")).first("X-Missing"))
                .isNull();
    }

    @Test
    void containsIsCaseInsensitive() {
        HttpHeaders headers = HttpHeaders.of(Map.of("X-Request-ID", "abc"));
        assertThat(headers.contains("x-request-id")).isTrue();
        assertThat(headers.contains("content-type")).isFalse();
    }

    // ── Multi-value ──

    @Test
    void repeatedValuesKeepReceivedOrder() {
        HttpHeaders headers = HttpHeaders.ofMulti(Map.of("Set-Cookie", List.of("b=2", "a=1", "c=3")));
        assertThat(headers.all("set-cookie")).containsExactly("b=2", "a=1", "c=3");
        assertThat(headers.first("set-cookie")).isEqualTo("b=2");
    }

    @Test
    void namesDifferingOnlyInCaseAreMerged() {
        Map<String, List<String>> raw = new LinkedHashMap<>();
        raw.put("X-Trace", List.of("one"));
        raw.put("x-trace", List.of("two"));

        HttpHeaders headers = HttpHeaders.ofMulti(raw);

        assertThat(headers.names()).containsExactly("x-trace");
        assertThat(headers.all("X-TRACE")).containsExactly("one", "two");
    }

    @Test
    void emptyValueListsAreDropped() {
        Map<String, List<String>> raw = new LinkedHashMap<>();
        raw.put("Accept", List.of());
        assertThat(HttpHeaders.ofMulti(raw).isEmpty()).isTrue();
    }

    @Test
    void allIsUnmodifiable() {
        HttpHeaders headers = HttpHeaders.ofMulti(Map.of("via", List.of("1.1 a")));
        assertThatThrownBy(() -> headers.all("via").add("1.1 b")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void laterChangesToSourceMapDoNotLeakIn() {
        List<String> values = new ArrayList<>(List.of("a"));
        Map<String, List<String>> raw = new LinkedHashMap<>();
        raw.put("X-A", values);
        HttpHeaders headers = HttpHeaders.ofMulti(raw);

        values.add("b");

        assertThat(headers.all("x-a")).containsExactly("a");
    }

    // ── without() ──

    @Test
    void withoutRemovesNamesCaseInsensitively() {
        Map<String, List<String>> raw = new LinkedHashMap<>();
        raw.put("Content-Length", List.of("12"));
        raw.put("Transfer-Encoding", List.of("chunked"));
        raw.put("X-Custom", List.of("keep"));

        HttpHeaders filtered = HttpHeaders.ofMulti(raw).without(List.of("content-length", "TRANSFER-ENCODING"));

        assertThat(filtered.names()).containsExactly("x-custom");
    }

    @Test
    void withoutReturnsSameInstanceWhenNothingMatches() {
        HttpHeaders headers = HttpHeaders.of(Map.of("Accept", "*/*"));
        assertThat(headers.without(List.of("connection"))).isSameAs(headers);
    }

    @Test
    void withoutLeavesOriginalUntouched() {
        HttpHeaders headers = HttpHeaders.of(Map.of("Connection", "close", "Accept", "*/*"));
        headers.without(List.of("connection"));
        assertThat(headers.contains("connection")).isTrue();
    }

    // ── Views ──

    @Test
    void multiValueMapHasLowercaseKeys() {
        HttpHeaders headers = HttpHeaders.of(Map.of("Content-Type", "text/plain"));
        assertThat(headers.toMultiValueMap()).containsOnlyKeys("content-type");
    }

    @Test
    void forEachVisitsEveryName() {
        HttpHeaders headers = HttpHeaders.ofMulti(Map.of("A", List.of("1", "2"), "B", List.of("3")));
        Map<String, List<String>> seen = new LinkedHashMap<>();
        headers.forEach(seen::put);
        assertThat(seen).containsOnlyKeys("a", "b");
        assertThat(seen.get("a")).containsExactly("1", "2");
    }

    @Test
    void equalityIgnoresSourceCase() {
        assertThat(HttpHeaders.of(Map.of("Accept", "x"))).isEqualTo(HttpHeaders.of(Map.of("accept", "x")));
    }
}
