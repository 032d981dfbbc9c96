package fr.lapetina.loadbalancer.infrastructure.http;

import fr.lapetina.loadbalancer.domain.model.Backend;
import fr.lapetina.loadbalancer.domain.model.ProxyRequest;
import fr.lapetina.loadbalancer.domain.model.ProxyResponse;
import fr.lapetina.loadbalancer.infrastructure.NamedThreadFactory;
import fr.lapetina.loadbalancer.infrastructure.health.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client for talking to backends: request forwarding and health probes.
 *
 * Uses java.net.http.HttpClient on a dedicated executor that is shut down
 * with the client. Response bodies are buffered in full, up to a fixed cap,
 * before being handed back to the caller.
 */
public class BackendHttpClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackendHttpClient.class);

    /**
     * Hop-by-hop headers, never forwarded in either direction.
     */
    public static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection", "keep-alive", "proxy-authenticate", "proxy-authorization",
            "te", "trailer", "transfer-encoding", "upgrade"
    );

    // Managed by java.net.http itself
    private static final Set<String> RESTRICTED_REQUEST_HEADERS = Set.of(
            "host", "content-length", "expect"
    );

    public static final int DEFAULT_MAX_BODY_BYTES = 10 * 1024 * 1024;

    private final HttpClient httpClient;
    private final ExecutorService executor;
    private final Duration requestTimeout;
    private final int maxResponseBytes;

    public BackendHttpClient(Duration connectTimeout, Duration requestTimeout, int maxResponseBytes) {
        if (maxResponseBytes <= 0) {
            throw new IllegalArgumentException("maxResponseBytes must be positive");
        }
        this.requestTimeout = requestTimeout;
        this.maxResponseBytes = maxResponseBytes;
        this.executor = Executors.newCachedThreadPool(new NamedThreadFactory("backend-http", true));
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .executor(executor)
                .build();
    }

    public BackendHttpClient(Duration connectTimeout, Duration requestTimeout) {
        this(connectTimeout, requestTimeout, DEFAULT_MAX_BODY_BYTES);
    }

    public BackendHttpClient() {
        this(Duration.ofSeconds(2), Duration.ofSeconds(30));
    }

    /**
     * Forwards a request to the backend and waits for the full response.
     *
     * @throws HttpTimeoutException       if the backend does not answer within the request timeout
     * @throws ResponseTooLargeException if the response body exceeds the configured cap
     * @throws IOException                if the backend cannot be reached or the exchange breaks
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public ProxyResponse forward(Backend backend, ProxyRequest request) throws IOException, InterruptedException {
        HttpRequest httpRequest = buildForwardRequest(backend, request);

        log.debug("Forwarding request: requestId={}, backend={}, method={}, uri={}",
                request.requestId(), backend.getName(), request.method(), httpRequest.uri());

        HttpResponse<InputStream> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofInputStream());
        byte[] body = readBounded(response.body(), backend);
        return new ProxyResponse(response.statusCode(), filterResponseHeaders(response.headers().map()), body);
    }

    // Closing the stream early aborts the rest of an oversized body
    private byte[] readBounded(InputStream in, Backend backend) throws IOException {
        int limit = maxResponseBytes == Integer.MAX_VALUE ? maxResponseBytes : maxResponseBytes + 1;
        byte[] body;
        try (in) {
            body = in.readNBytes(limit);
        }
        if (body.length > maxResponseBytes) {
            throw new ResponseTooLargeException(backend.getName(), maxResponseBytes);
        }
        return body;
    }

    public int getMaxResponseBytes() {
        return maxResponseBytes;
    }

    HttpRequest buildForwardRequest(Backend backend, ProxyRequest request) {
        URI uri = resolve(backend, request.pathAndQuery());

        HttpRequest.BodyPublisher body = request.body().length == 0
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .method(request.method(), body);

        for (Map.Entry<String, List<String>> header : request.headers().entrySet()) {
            String name = header.getKey();
            String lower = name.toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP_HEADERS.contains(lower) || RESTRICTED_REQUEST_HEADERS.contains(lower)
                    || lower.equals("x-forwarded-for")) {
                continue;
            }
            for (String value : header.getValue()) {
                try {
                    builder.header(name, value);
                } catch (IllegalArgumentException e) {
                    log.debug("Header not forwarded: name={}, reason={}", name, e.getMessage());
                }
            }
        }

        builder.header("X-Forwarded-For", forwardedFor(request));
        String host = request.firstHeader("Host");
        if (host != null && !host.isBlank()) {
            builder.header("X-Forwarded-Host", host);
        }
        if (request.firstHeader("X-Forwarded-Proto") == null) {
            builder.header("X-Forwarded-Proto", "http");
        }
        if (request.requestId() != null) {
            builder.setHeader("X-Request-ID", request.requestId());
        }

        return builder.build();
    }

    private static String forwardedFor(ProxyRequest request) {
        String clientIp = stripPort(request.clientAddress());
        String prior = request.firstHeader("X-Forwarded-For");
        if (prior == null || prior.isBlank()) {
            return clientIp;
        }
        return prior + ", " + clientIp;
    }

    private static String stripPort(String address) {
        if (address.startsWith("[")) {
            int end = address.indexOf(']');
            return end > 0 ? address.substring(1, end) : address;
        }
        int colon = address.lastIndexOf(':');
        // Single colon means ipv4:port, several mean a bare ipv6 address
        if (colon > 0 && address.indexOf(':') == colon) {
            return address.substring(0, colon);
        }
        return address;
    }

    static URI resolve(Backend backend, String pathAndQuery) {
        String base = backend.getName();
        return URI.create(base + pathAndQuery);
    }

    private static Map<String, List<String>> filterResponseHeaders(Map<String, List<String>> headers) {
        Map<String, List<String>> filtered = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> header : headers.entrySet()) {
            String lower = header.getKey().toLowerCase(Locale.ROOT);
            if (lower.startsWith(":") || HOP_BY_HOP_HEADERS.contains(lower) || lower.equals("content-length")) {
                continue;
            }
            filtered.put(header.getKey(), header.getValue());
        }
        return filtered;
    }

    /**
     * Probes {@code <backend><path>} with a GET.
     * The returned future never completes exceptionally: errors and timeouts give an unhealthy result.
     */
    public CompletableFuture<ProbeResult> healthCheck(Backend backend, String path, Duration timeout) {
        long start = System.nanoTime();

        URI uri;
        HttpRequest request;
        try {
            uri = resolve(backend, path);
            request = HttpRequest.newBuilder()
                    .uri(uri)
                    .timeout(timeout)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(ProbeResult.failure(e.getMessage(), 0));
        }

        log.debug("Health check started: backend={}, uri={}", backend.getName(), uri);

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                // The request timeout does not cover connection setup
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, ex) -> {
                    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                    if (ex != null) {
                        String error = describe(ex);
                        log.debug("Health check error: backend={}, error={}", backend.getName(), error);
                        return ProbeResult.failure(error, latencyMs);
                    }
                    log.debug("Health check response: backend={}, status={}, latencyMs={}",
                            backend.getName(), response.statusCode(), latencyMs);
                    return ProbeResult.ofStatus(response.statusCode(), latencyMs);
                });
    }

    private static String describe(Throwable ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof TimeoutException || cause instanceof HttpTimeoutException) {
            return "timeout";
        }
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
