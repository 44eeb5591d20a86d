package io.supervisedproxy.server.proxy;

import static org.assertj.core.api.Assertions.assertThat;

import io.supervisedproxy.server.websocket.WsTestClient;
import java.net.URI;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * The upgrade path is registered before the catch-all, so it is never
 * forwarded as plain HTTP.
 */
@DisplayName("Upgrade path routing")
class UpgradePathRoutingTest extends ProxyTestHarness {

    @AfterEach
    void tearDown() {
        stopInfrastructure();
    }

    @ParameterizedTest(name = "{0} /ws")
    @ValueSource(strings = {"GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS"})
    @DisplayName("plain HTTP on the upgrade path answers 426")
    void upgradeRequired(String method) throws Exception {
        startInfrastructure();

        HttpResponse<String> response = send(method, "/ws", null);

        assertThat(response.statusCode()).isEqualTo(426);
        assertThat(response.headers().firstValue("Upgrade")).hasValue("websocket");
        assertThat(response.body()).isEqualTo("Upgrade Required");
        assertThat(receivedRequests).doesNotContainKey("/ws");
    }

    @Test
    @DisplayName("a configured upgrade path replaces the default one")
    void customUpgradePath() throws Exception {
        startInfrastructure(config -> config.upgradePath("/stream"));

        assertThat(send("GET", "/stream", null).statusCode()).isEqualTo(426);
        assertThat(send("GET", "/ws", null).statusCode()).isEqualTo(200);
        assertThat(receivedRequests).containsKey("/ws");
    }

    @Test
    @DisplayName("paths below the upgrade path are ordinary requests")
    void subPathForwarded() throws Exception {
        startInfrastructure();

        HttpResponse<String> response = send("GET", "/ws/history", null);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(receivedRequests).containsKey("/ws/history");
    }

    @Test
    @DisplayName("an upgrade request reaches the bridge, not the forwarder")
    void upgradeGoesToBridge() throws Exception {
        // the mock backend speaks no WebSocket, so the bridge cannot connect
        startInfrastructure();

        WsTestClient client = WsTestClient.connect(URI.create("ws://127.0.0.1:" + proxyPort + "/ws"));

        assertThat(client.awaitCloseCode()).isEqualTo(1011);
        // the only request the backend saw on /ws is the bridge's own handshake
        assertThat(receivedRequests.get("/ws").headers().get("Upgrade")).containsExactly("websocket");
    }
}
