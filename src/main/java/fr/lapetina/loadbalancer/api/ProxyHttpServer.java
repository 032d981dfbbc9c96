package fr.lapetina.loadbalancer.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.loadbalancer.dispatch.RequestDispatcher;
import fr.lapetina.loadbalancer.domain.model.DispatchResult;
import fr.lapetina.loadbalancer.domain.model.ProxyRequest;
import fr.lapetina.loadbalancer.domain.model.ProxyResponse;
import fr.lapetina.loadbalancer.infrastructure.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Front HTTP server using JDK's built-in HttpServer.
 *
 * Every path and method is handed to the {@link RequestDispatcher}; the
 * backend's status, headers and body are written back unchanged. Each
 * request runs on its own pooled worker thread.
 *
 * Request bodies are buffered in full before dispatch. A body above the
 * configured cap is refused with 413 and never reaches a backend.
 */
public final class ProxyHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProxyHttpServer.class);

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    private final HttpServer server;
    private final ExecutorService executor;
    private final RequestDispatcher dispatcher;
    private final int maxBodyBytes;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ProxyHttpServer(String host, int port, int backlog, int maxBodyBytes, RequestDispatcher dispatcher)
            throws IOException {
        if (maxBodyBytes <= 0) {
            throw new IllegalArgumentException("maxBodyBytes must be positive");
        }
        this.dispatcher = dispatcher;
        this.maxBodyBytes = maxBodyBytes;
        this.server = HttpServer.create(new InetSocketAddress(host, port), backlog);
        this.executor = Executors.newCachedThreadPool(new NamedThreadFactory("proxy-worker", true));
        server.setExecutor(executor);
        server.createContext("/", new ProxyHandler());

        log.info("Proxy server configured: host={}, port={}, algorithm={}, backends={}, maxBodyBytes={}",
                host, getPort(), dispatcher.getAlgorithm().getConfigName(), dispatcher.getPool().size(), maxBodyBytes);
    }

    public void start() {
        server.start();
        log.info("Proxy server started on port {}", getPort());
    }

    /**
     * Bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdownNow();
        log.info("Proxy server stopped");
    }

    private class ProxyHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = resolveRequestId(exchange);
            MDC.put("requestId", requestId);

            try {
                exchange.getResponseHeaders().set(REQUEST_ID_HEADER, requestId);

                byte[] body = readBody(exchange);
                if (body == null) {
                    log.warn("Request body too large: method={}, path={}, maxBodyBytes={}",
                            exchange.getRequestMethod(), exchange.getRequestURI().getRawPath(), maxBodyBytes);
                    sendError(exchange, 413, "Request body exceeds " + maxBodyBytes + " bytes");
                    return;
                }

                ProxyRequest request = toProxyRequest(exchange, requestId, body);
                DispatchResult result = dispatcher.dispatch(request);

                if (result.isError()) {
                    sendError(exchange, result.statusCode(), result.errorMessage());
                } else {
                    sendResponse(exchange, result.response());
                }
            } catch (Exception e) {
                log.error("Error handling proxied request", e);
                try {
                    sendError(exchange, 500, "Internal server error");
                } catch (IOException | RuntimeException sendFailure) {
                    // Headers may already be on the wire
                    log.debug("Could not send error response: {}", sendFailure.getMessage());
                }
            } finally {
                exchange.close();
                MDC.remove("requestId");
            }
        }
    }

    private static String resolveRequestId(HttpExchange exchange) {
        String incoming = exchange.getRequestHeaders().getFirst(REQUEST_ID_HEADER);
        return incoming != null && !incoming.isBlank() ? incoming : UUID.randomUUID().toString();
    }

    /**
     * Reads the request body, or returns null when it is larger than the cap.
     */
    private byte[] readBody(HttpExchange exchange) throws IOException {
        String declared = exchange.getRequestHeaders().getFirst("Content-Length");
        if (declared != null) {
            try {
                if (Long.parseLong(declared.trim()) > maxBodyBytes) {
                    return null;
                }
            } catch (NumberFormatException e) {
                log.debug("Ignoring malformed Content-Length: {}", declared);
            }
        }

        int limit = maxBodyBytes == Integer.MAX_VALUE ? maxBodyBytes : maxBodyBytes + 1;
        try (InputStream is = exchange.getRequestBody()) {
            byte[] body = is.readNBytes(limit);
            return body.length > maxBodyBytes ? null : body;
        }
    }

    private static ProxyRequest toProxyRequest(HttpExchange exchange, String requestId, byte[] body) {
        URI uri = exchange.getRequestURI();
        String pathAndQuery = uri.getRawPath() + (uri.getRawQuery() != null ? "?" + uri.getRawQuery() : "");

        InetSocketAddress remote = exchange.getRemoteAddress();
        String clientAddress = remote.getAddress() != null
                ? remote.getAddress().getHostAddress() + ":" + remote.getPort()
                : remote.getHostString();

        return new ProxyRequest(
                exchange.getRequestMethod(),
                pathAndQuery,
                exchange.getRequestHeaders(),
                body,
                clientAddress,
                requestId
        );
    }

    private static void sendResponse(HttpExchange exchange, ProxyResponse response) throws IOException {
        for (Map.Entry<String, List<String>> header : response.headers().entrySet()) {
            // The JDK server writes its own Date header
            if ("date".equals(header.getKey().toLowerCase(Locale.ROOT))) {
                continue;
            }
            exchange.getResponseHeaders().put(header.getKey(), header.getValue());
        }

        int status = response.statusCode();
        byte[] body = response.body();
        boolean noBody = "HEAD".equalsIgnoreCase(exchange.getRequestMethod())
                || status == 204 || status == 304 || body.length == 0;

        if (noBody) {
            exchange.sendResponseHeaders(status, -1);
            return;
        }
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(Map.of("error", message != null ? message : "error"));
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
