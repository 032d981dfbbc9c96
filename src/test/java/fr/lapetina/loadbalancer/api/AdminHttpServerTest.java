package fr.lapetina.loadbalancer.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.loadbalancer.domain.model.Backend;
import fr.lapetina.loadbalancer.domain.model.BackendPool;
import fr.lapetina.loadbalancer.domain.strategy.SelectionAlgorithm;
import fr.lapetina.loadbalancer.infrastructure.metrics.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class AdminHttpServerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient = HttpClient.newHttpClient();

    private Backend a;
    private Backend b;
    private MetricsRegistry metrics;
    private AdminHttpServer server;

    @BeforeEach
    void setUp() throws Exception {
        a = Backend.of("http://localhost:9000");
        b = Backend.of("http://localhost:9001");
        BackendPool pool = BackendPool.of(a, b);

        metrics = new MetricsRegistry("admin");
        for (Backend backend : pool) {
            metrics.registerBackend(backend);
        }

        server = new AdminHttpServer("127.0.0.1", 0, metrics, pool, SelectionAlgorithm.LEAST_CONN);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
        metrics.close();
    }

    private HttpResponse<String> send(String method, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + path))
                .method(method, HttpRequest.BodyPublishers.noBody())
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("should describe the pool on /status")
    void shouldServeStatus() throws Exception {
        a.recordStart();
        a.recordStart();
        a.recordEnd();
        b.setAlive(false);
        b.setLastProbeLatencyMs(17);

        HttpResponse<String> response = send("GET", "/status");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).contains("application/json");

        JsonNode status = objectMapper.readTree(response.body());
        assertThat(status.get("algorithm").asText()).isEqualTo("leastconn");
        assertThat(status.get("poolSize").asInt()).isEqualTo(2);
        assertThat(status.get("aliveCount").asInt()).isEqualTo(1);

        JsonNode first = status.get("backends").get(0);
        assertThat(first.get("address").asText()).isEqualTo("http://localhost:9000");
        assertThat(first.get("health").asText()).isEqualTo("ALIVE");
        assertThat(first.get("activeConnections").asInt()).isEqualTo(1);
        assertThat(first.get("requestCount").asLong()).isEqualTo(2);
        assertThat(first.get("lastHealthCheck").isNull()).isTrue();

        JsonNode second = status.get("backends").get(1);
        assertThat(second.get("health").asText()).isEqualTo("DEAD");
        assertThat(second.get("lastProbeMs").asLong()).isEqualTo(17);
        assertThat(Instant.parse(second.get("lastHealthCheck").asText())).isBeforeOrEqualTo(Instant.now());
    }

    @Test
    @DisplayName("should expose Prometheus metrics on /metrics")
    void shouldServeMetrics() throws Exception {
        b.setAlive(false);

        HttpResponse<String> response = send("GET", "/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                type -> assertThat(type).startsWith("text/plain"));
        assertThat(response.body())
                .contains("admin_backend_health{backend=\"http://localhost:9000\",} 1.0")
                .contains("admin_backend_health{backend=\"http://localhost:9001\",} 0.0")
                .contains("admin_active_connections")
                .contains("jvm_memory_used_bytes");
    }

    @Test
    @DisplayName("should answer 404 for unknown paths")
    void shouldAnswer404() throws Exception {
        assertThat(send("GET", "/").statusCode()).isEqualTo(404);
        assertThat(send("GET", "/statusx").statusCode()).isEqualTo(404);

        HttpResponse<String> response = send("GET", "/nothing");
        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(objectMapper.readTree(response.body()).get("error").asText()).isEqualTo("Not Found");
    }

    @Test
    @DisplayName("should answer 405 for non-GET methods")
    void shouldAnswer405() throws Exception {
        assertThat(send("POST", "/status").statusCode()).isEqualTo(405);
        assertThat(send("DELETE", "/metrics").statusCode()).isEqualTo(405);
    }
}
