package fr.lapetina.loadbalancer.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.loadbalancer.domain.model.Backend;
import fr.lapetina.loadbalancer.domain.model.BackendPool;
import fr.lapetina.loadbalancer.domain.strategy.SelectionAlgorithm;
import fr.lapetina.loadbalancer.infrastructure.NamedThreadFactory;
import fr.lapetina.loadbalancer.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Admin HTTP server on its own port.
 *
 * Endpoints:
 * - GET /metrics - Prometheus metrics endpoint
 * - GET /status - Pool snapshot as JSON
 */
public final class AdminHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdminHttpServer.class);

    private final HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final MetricsRegistry metricsRegistry;
    private final BackendPool pool;
    private final SelectionAlgorithm algorithm;

    public AdminHttpServer(
            String host,
            int port,
            MetricsRegistry metricsRegistry,
            BackendPool pool,
            SelectionAlgorithm algorithm
    ) throws IOException {
        this.metricsRegistry = metricsRegistry;
        this.pool = pool;
        this.algorithm = algorithm;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = HttpServer.create(new InetSocketAddress(host, port), 0);
        this.executor = Executors.newFixedThreadPool(2, new NamedThreadFactory("admin-http", true));
        server.setExecutor(executor);

        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/status", new StatusHandler());
        server.createContext("/", exchange -> {
            try {
                sendError(exchange, 404, "Not Found");
            } finally {
                exchange.close();
            }
        });

        log.info("Admin server configured on port {}", getPort());
    }

    public void start() {
        server.start();
        log.info("Admin server started on port {}", getPort());
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
        log.info("Admin server stopped");
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                if (!exactPath(exchange, "/metrics")) {
                    sendError(exchange, 404, "Not Found");
                    return;
                }
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                byte[] bytes = metricsRegistry.scrape().getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
                exchange.sendResponseHeaders(200, bytes.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            } finally {
                exchange.close();
            }
        }
    }

    // ==================== STATUS HANDLER ====================

    private class StatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                if (!exactPath(exchange, "/status")) {
                    sendError(exchange, 404, "Not Found");
                    return;
                }
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }
                sendJson(exchange, 200, snapshot());
            } finally {
                exchange.close();
            }
        }
    }

    Map<String, Object> snapshot() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("algorithm", algorithm.getConfigName());
        status.put("poolSize", pool.size());
        status.put("aliveCount", pool.aliveCount());

        List<Map<String, Object>> backends = new ArrayList<>();
        for (Backend backend : pool) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("address", backend.getName());
            info.put("health", backend.getHealth().name());
            info.put("activeConnections", backend.getActiveConnections());
            info.put("requestCount", backend.getRequestCount());
            info.put("lastProbeMs", backend.getLastProbeLatencyMs());
            long lastCheck = backend.getLastHealthCheck();
            info.put("lastHealthCheck", lastCheck > 0 ? Instant.ofEpochMilli(lastCheck) : null);
            backends.add(info);
        }
        status.put("backends", backends);
        return status;
    }

    // ==================== HELPER METHODS ====================

    private static boolean exactPath(HttpExchange exchange, String path) {
        return path.equals(exchange.getRequestURI().getPath());
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJson(exchange, statusCode, Map.of("error", message));
    }
}
