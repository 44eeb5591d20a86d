package io.supervisedproxy.server.proxy;

import io.supervisedproxy.core.model.HttpHeaders;
import io.supervisedproxy.core.model.ProxyRequest;
import io.supervisedproxy.core.model.ProxyResponse;
import io.supervisedproxy.server.config.ProxyConfig;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDK {@link HttpClient}-based forwarder to the supervised backend.
 *
 * <p>
 * One call per inbound request, never retried. Redirects are relayed rather
 * than followed so clients see the backend's 3xx responses themselves. Uses
 * HTTP/1.1 for all backend connections.
 *
 * <p>
 * This class is thread-safe. The underlying {@link HttpClient} is designed for
 * concurrent use.
 */
public final class UpstreamClient {

    private static final Logger LOG = LoggerFactory.getLogger(UpstreamClient.class);

    /**
     * Response headers never copied to the client: the body may be re-encoded or
     * re-framed by the serving layer.
     */
    static final List<String> EXCLUDED_RESPONSE_HEADERS =
            List.of("content-encoding", "content-length", "transfer-encoding", "connection");

    /**
     * Request headers not forwarded. {@code host} is dropped so the backend sees
     * its own address; the rest are hop-by-hop or managed by the JDK client.
     */
    private static final Set<String> SKIPPED_REQUEST_HEADERS = Set.of(
            "host",
            "connection",
            "content-length",
            "expect",
            "upgrade",
            "keep-alive",
            "proxy-connection",
            "te",
            "trailer",
            "transfer-encoding");

    /** Content codings {@link #decode(String, byte[])} understands. */
    private static final Set<String> DECODABLE_ENCODINGS = Set.of("gzip", "x-gzip", "deflate", "identity");

    private final HttpClient httpClient;
    private final String backendBaseUrl;
    private final Duration readTimeout;

    /**
     * Creates an {@code UpstreamClient} for the configured backend address and
     * timeouts.
     *
     * @param config proxy configuration
     */
    public UpstreamClient(ProxyConfig config) {
        this(
                config.backendBaseUrl(),
                Duration.ofMillis(config.backendConnectTimeoutMs()),
                Duration.ofMillis(config.backendReadTimeoutMs()));
    }

    UpstreamClient(String backendBaseUrl, Duration connectTimeout, Duration readTimeout) {
        this.backendBaseUrl = backendBaseUrl;
        this.readTimeout = readTimeout;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();

        LOG.debug("UpstreamClient initialized: backend={}", backendBaseUrl);
    }

    /**
     * Forwards one request to the backend.
     *
     * @param request the captured inbound request
     * @return the backend's status, headers minus the excluded set, and body
     * @throws UpstreamConnectException if the backend is unreachable, refuses or
     *                                  resets the connection
     * @throws UpstreamTimeoutException if the backend does not answer within the
     *                                  read timeout
     * @throws InterruptedException     if the thread is interrupted while waiting
     */
    public ProxyResponse forward(ProxyRequest request) throws UpstreamException, InterruptedException {
        URI targetUri;
        try {
            targetUri = URI.create(backendBaseUrl + request.pathWithQuery());
        } catch (IllegalArgumentException e) {
            throw new UpstreamConnectException("Invalid backend target " + request.pathWithQuery(), e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(targetUri)
                .timeout(readTimeout)
                .method(
                        request.method(),
                        request.body().length > 0
                                ? HttpRequest.BodyPublishers.ofByteArray(request.body())
                                : HttpRequest.BodyPublishers.noBody());

        request.headers().forEach((name, values) -> {
            if (SKIPPED_REQUEST_HEADERS.contains(name)) {
                return;
            }
            if ("accept-encoding".equals(name)) {
                builder.header(name, acceptEncoding(values));
                return;
            }
            for (String value : values) {
                try {
                    builder.header(name, value);
                } catch (IllegalArgumentException e) {
                    LOG.debug("Not forwarding header {}: {}", name, e.getMessage());
                }
            }
        });
        if (!request.headers().contains("cookie") && !request.cookies().isEmpty()) {
            builder.header("Cookie", cookieHeader(request.cookies()));
        }

        LOG.debug("Forwarding {} {} to {}", request.method(), request.pathWithQuery(), targetUri);

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpConnectTimeoutException e) {
            throw new UpstreamConnectException("Connect timeout to " + targetUri, e);
        } catch (HttpTimeoutException e) {
            throw new UpstreamTimeoutException("Read timeout from " + targetUri, e);
        } catch (ConnectException e) {
            throw new UpstreamConnectException("Connection refused by " + targetUri, e);
        } catch (IOException e) {
            throw new UpstreamConnectException("Failed to reach " + targetUri + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new UpstreamConnectException("Backend rejected request to " + targetUri + ": " + e.getMessage(), e);
        }

        byte[] body = response.body() != null ? response.body() : new byte[0];
        HttpHeaders received = HttpHeaders.ofMulti(response.headers().map());

        String encoding = received.first("content-encoding");
        if (encoding != null && body.length > 0) {
            byte[] decoded = decode(encoding, body);
            if (decoded != null) {
                body = decoded;
            } else {
                LOG.warn(
                        "Backend answered {} {} with undecodable content-encoding '{}', relaying raw body",
                        request.method(),
                        request.pathWithQuery(),
                        encoding);
            }
        }

        LOG.debug("Backend responded: {} {} -> {}", request.method(), request.pathWithQuery(), response.statusCode());

        return new ProxyResponse(response.statusCode(), received.without(EXCLUDED_RESPONSE_HEADERS), body);
    }

    /**
     * Returns the underlying {@link HttpClient}, package-private for tests.
     */
    HttpClient httpClient() {
        return httpClient;
    }

    private static String cookieHeader(Map<String, String> cookies) {
        return cookies.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining("; "));
    }

    /**
     * Narrows the client's {@code Accept-Encoding} to the codings this class can
     * decode, keeping the client's order and quality values.
     *
     * @return the narrowed header value, {@code identity} if nothing is left
     */
    static String acceptEncoding(List<String> values) {
        String narrowed = values.stream()
                .flatMap(value -> Arrays.stream(value.split(",")))
                .map(String::trim)
                .filter(token -> {
                    String coding = token.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
                    return DECODABLE_ENCODINGS.contains(coding);
                })
                .collect(Collectors.joining(", "));
        return narrowed.isEmpty() ? "identity" : narrowed;
    }

    /**
     * Decodes a gzip or deflate body.
     *
     * @return the decoded bytes, or {@code null} for an unknown encoding or a
     *         corrupt body
     */
    private static byte[] decode(String encoding, byte[] body) {
        String normalized = encoding.trim().toLowerCase(Locale.ROOT);
        try {
            switch (normalized) {
                case "gzip", "x-gzip" -> {
                    try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(body))) {
                        return in.readAllBytes();
                    }
                }
                case "deflate" -> {
                    try (InputStream in = new InflaterInputStream(new ByteArrayInputStream(body))) {
                        return in.readAllBytes();
                    }
                }
                case "identity" -> {
                    return body;
                }
                default -> {
                    return null;
                }
            }
        } catch (IOException e) {
            LOG.debug("Could not decode {} response body: {}", normalized, e.getMessage());
            return null;
        }
    }
}
