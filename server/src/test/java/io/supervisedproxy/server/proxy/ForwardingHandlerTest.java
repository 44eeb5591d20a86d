package io.supervisedproxy.server.proxy;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** End-to-end forwarding through the proxy's Javalin server. */
@DisplayName("ForwardingHandler")
class ForwardingHandlerTest extends ProxyTestHarness {

    @AfterEach
    void tearDown() {
        stopInfrastructure();
    }

    @Nested
    @DisplayName("with a reachable backend")
    class Reachable {

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {"GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS"})
        @DisplayName("every method is relayed with its body")
        void methodsRelayed(String method) throws Exception {
            startInfrastructure();

            HttpResponse<String> response = send(method, "/api/items", "{\"n\":1}");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("X-Backend-Method")).hasValue(method);
            assertThat(receivedRequests.get("/api/items").method()).isEqualTo(method);
            assertThat(receivedRequests.get("/api/items").body()).isEqualTo("{\"n\":1}");
        }

        @Test
        @DisplayName("HEAD is relayed without a body")
        void headRelayed() throws Exception {
            startInfrastructure();

            HttpResponse<String> response = send("HEAD", "/api/items", null);

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("X-Backend-Method")).hasValue("HEAD");
            assertThat(response.body()).isEmpty();
        }

        @Test
        @DisplayName("the root path is forwarded")
        void rootPath() throws Exception {
            startInfrastructure();

            HttpResponse<String> response = send("GET", "/", null);

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).contains("\"path\":\"/\"");
        }

        @Test
        @DisplayName("nested path and raw query string are forwarded unchanged")
        void nestedPathWithQuery() throws Exception {
            startInfrastructure();

            HttpResponse<String> response = send("GET", "/candles/EUR%2FUSD/history?count=50&tf=M1", null);

            assertThat(response.statusCode()).isEqualTo(200);
            ReceivedRequest received = receivedRequests.get("/candles/EUR%2FUSD/history");
            assertThat(received).isNotNull();
            assertThat(received.query()).isEqualTo("count=50&tf=M1");
        }

        @Test
        @DisplayName("backend status, headers and body are relayed as is")
        void responseRelayed() throws Exception {
            startInfrastructure();
            registerBackendHandler(
                    "/login",
                    201,
                    Map.of(
                            "Content-Type", List.of("application/json"),
                            "Set-Cookie", List.of("session=abc; Path=/", "theme=dark; Path=/")),
                    "{\"ok\":true}");

            HttpResponse<String> response = send("POST", "/login", "{}");

            assertThat(response.statusCode()).isEqualTo(201);
            assertThat(response.headers().firstValue("Content-Type")).hasValue("application/json");
            assertThat(response.headers().allValues("Set-Cookie"))
                    .containsExactly("session=abc; Path=/", "theme=dark; Path=/");
            assertThat(response.body()).isEqualTo("{\"ok\":true}");
        }

        @Test
        @DisplayName("backend error statuses pass through untouched")
        void backendErrorPassesThrough() throws Exception {
            startInfrastructure();
            registerBackendHandler(
                    "/missing", 404, Map.of("Content-Type", List.of("application/json")), "{\"error\":\"nope\"}");

            HttpResponse<String> response = send("GET", "/missing", null);

            assertThat(response.statusCode()).isEqualTo(404);
            assertThat(response.body()).isEqualTo("{\"error\":\"nope\"}");
        }

        @Test
        @DisplayName("no Content-Type is added when the backend sends none")
        void noDefaultContentType() throws Exception {
            startInfrastructure();
            registerBackendHandler("/raw", 200, Map.of(), "raw");

            HttpResponse<String> response = send("GET", "/raw", null);

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type")).isEmpty();
            assertThat(response.body()).isEqualTo("raw");
        }

        @Test
        @DisplayName("content-encoding never reaches the client, even for a coding the proxy cannot decode")
        void undecodableEncodingHeaderDropped() throws Exception {
            startInfrastructure();
            registerBackendHandler(
                    "/brotli",
                    200,
                    Map.of("Content-Type", List.of("application/octet-stream"), "Content-Encoding", List.of("br")),
                    "abc");

            HttpResponse<String> response = send("GET", "/brotli", null);

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Encoding")).isEmpty();
            assertThat(response.headers().firstValue("Content-Type")).hasValue("application/octet-stream");
            assertThat(response.body()).isEqualTo("abc");
        }

        @Test
        @DisplayName("a body above the configured limit is refused before forwarding")
        void bodyTooLarge() throws Exception {
            startInfrastructure(config -> config.maxBodyBytes(1024));

            HttpResponse<String> response = send("POST", "/upload", "x".repeat(4096));

            assertThat(response.statusCode()).isEqualTo(413);
            assertThat(receivedRequests).doesNotContainKey("/upload");
        }
    }

    @Nested
    @DisplayName("with an unreachable backend")
    class Unreachable {

        @Test
        @DisplayName("answers 502 with a plain-text diagnostic")
        void badGateway() throws Exception {
            startProxy(baseConfig(closedPort()).build());

            HttpResponse<String> response = send("GET", "/api/prices", null);

            assertThat(response.statusCode()).isEqualTo(502);
            assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                    type -> assertThat(type).startsWith("text/plain"));
            assertThat(response.body()).startsWith("Proxy error: ");
        }

        @Test
        @DisplayName("each request fails on its own and the proxy keeps serving")
        void keepsServing() throws Exception {
            startProxy(baseConfig(closedPort()).build());

            for (int i = 0; i < 3; i++) {
                assertThat(send("POST", "/api/orders", "{}").statusCode()).isEqualTo(502);
            }
        }
    }
}
