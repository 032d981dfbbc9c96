package fr.lapetina.loadbalancer.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import fr.lapetina.loadbalancer.LoadBalancerApplication;
import fr.lapetina.loadbalancer.LoadBalancerFactory;
import fr.lapetina.loadbalancer.domain.model.BackendPool;
import fr.lapetina.loadbalancer.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.loadbalancer.infrastructure.config.LoadBalancerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.any;
import static com.github.tomakehurst.wiremock.client.WireMock.anyUrl;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * End-to-end tests: real proxy and admin servers in front of two stub backends.
 */
class LoadBalancerIntegrationTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(2))
            .build();

    private WireMockServer backendA;
    private WireMockServer backendB;
    private LoadBalancerApplication app;

    @BeforeEach
    void setUp() {
        backendA = startBackend("backend-a");
        backendB = startBackend("backend-b");
    }

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.close();
        }
        backendA.stop();
        backendB.stop();
    }

    private static WireMockServer startBackend(String name) {
        WireMockServer server = new WireMockServer(wireMockConfig().dynamicPort().bindAddress("127.0.0.1"));
        server.start();
        stubHealth(server, 200);
        server.stubFor(any(anyUrl()).atPriority(5)
                .willReturn(aResponse().withStatus(200).withHeader("X-Served-By", name).withBody(name)));
        return server;
    }

    private static void stubHealth(WireMockServer server, int status) {
        server.stubFor(get(urlEqualTo("/health")).atPriority(1).willReturn(aResponse().withStatus(status)));
    }

    private static LoadBalancerConfig config(String algorithm, String... backends) {
        LoadBalancerConfig config = new LoadBalancerConfig();
        config.getServer().setHost("127.0.0.1");
        config.getServer().setPort(0);
        config.setBackends(List.of(backends));
        config.setAlgorithm(algorithm);
        config.getHealthCheck().setIntervalMs(100);
        config.getHealthCheck().setTimeoutMs(500);
        config.getTimeouts().setConnectTimeoutMs(500);
        config.getTimeouts().setRequestTimeoutMs(2000);
        config.getEvents().setRingBufferSize(256);
        config.getMetrics().setPort(0);
        config.getMetrics().setPrefix("it");
        return config;
    }

    private static String address(WireMockServer server) {
        return "http://127.0.0.1:" + server.port();
    }

    private LoadBalancerApplication start(String algorithm) throws Exception {
        app = new LoadBalancerApplication(LoadBalancerFactory.create(
                config(algorithm, address(backendA), address(backendB))));
        app.start();
        return app;
    }

    private HttpResponse<String> proxyGet(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(proxyUri(path)).GET().build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI proxyUri(String path) {
        return URI.create("http://127.0.0.1:" + app.getProxyServer().getPort() + path);
    }

    private BackendPool pool() {
        return app.getFactory().getPool();
    }

    @Test
    @DisplayName("should rotate requests across backends with round robin")
    void shouldRoundRobin() throws Exception {
        start("roundrobin");

        List<String> servedBy = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            HttpResponse<String> response = proxyGet("/api/items");
            assertThat(response.statusCode()).isEqualTo(200);
            servedBy.add(response.body());
        }

        assertThat(servedBy).containsExactly("backend-a", "backend-b", "backend-a", "backend-b");
        assertThat(pool().get(0).getRequestCount()).isEqualTo(2);
        assertThat(pool().get(1).getRequestCount()).isEqualTo(2);
        assertThat(pool().get(0).getActiveConnections()).isZero();
    }

    @Test
    @DisplayName("should pass method, body and backend headers through")
    void shouldPassThrough() throws Exception {
        start("leastconn");

        HttpRequest request = HttpRequest.newBuilder(proxyUri("/orders?priority=high"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString("{\"qty\":3}"))
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("X-Served-By")).contains("backend-a");
        backendA.verify(postRequestedFor(urlEqualTo("/orders?priority=high"))
                .withHeader("Content-Type", equalTo("application/json"))
                .withHeader("X-Forwarded-For", equalTo("127.0.0.1"))
                .withRequestBody(equalTo("{\"qty\":3}")));
    }

    @Test
    @DisplayName("should echo and forward the request id")
    void shouldPropagateRequestId() throws Exception {
        start("roundrobin");

        HttpRequest request = HttpRequest.newBuilder(proxyUri("/trace"))
                .header("X-Request-ID", "trace-123")
                .GET()
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(response.headers().firstValue("X-Request-ID")).contains("trace-123");
        backendA.verify(getRequestedFor(urlEqualTo("/trace"))
                .withHeader("X-Request-ID", equalTo("trace-123")));

        HttpResponse<String> generated = proxyGet("/trace");
        assertThat(generated.headers().firstValue("X-Request-ID")).hasValueSatisfying(
                id -> assertThat(id).isNotBlank());
    }

    @Test
    @DisplayName("should route around a backend that fails its health check and take it back once it recovers")
    void shouldFailOverAndRecover() throws Exception {
        start("roundrobin");

        stubHealth(backendB, 500);
        await().atMost(Duration.ofSeconds(5)).until(() -> !pool().get(1).isAlive());

        for (int i = 0; i < 4; i++) {
            assertThat(proxyGet("/").body()).isEqualTo("backend-a");
        }

        stubHealth(backendB, 200);
        await().atMost(Duration.ofSeconds(5)).until(() -> pool().get(1).isAlive());

        List<String> servedBy = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            servedBy.add(proxyGet("/").body());
        }
        assertThat(servedBy).contains("backend-a", "backend-b");
    }

    @Test
    @DisplayName("should answer 503 with a JSON error when every backend is down")
    void shouldAnswer503WhenAllDown() throws Exception {
        start("random");

        stubHealth(backendA, 503);
        stubHealth(backendB, 503);
        await().atMost(Duration.ofSeconds(5)).until(() -> pool().aliveCount() == 0);

        HttpResponse<String> response = proxyGet("/anything");

        assertThat(response.statusCode()).isEqualTo(503);
        assertThat(response.headers().firstValue("Content-Type")).contains("application/json");
        JsonNode body = objectMapper.readTree(response.body());
        assertThat(body.get("error").asText()).isEqualTo("No backends available");
    }

    @Test
    @DisplayName("should answer 502 when the chosen backend stops answering")
    void shouldAnswer502WhenBackendVanishes() throws Exception {
        LoadBalancerConfig config = config("roundrobin", address(backendA), address(backendB));
        config.getHealthCheck().setEnabled(false);
        app = new LoadBalancerApplication(LoadBalancerFactory.create(config));
        app.start();

        backendA.stop();

        HttpResponse<String> response = proxyGet("/");

        assertThat(response.statusCode()).isEqualTo(502);
        assertThat(objectMapper.readTree(response.body()).has("error")).isTrue();
        assertThat(pool().get(0).getActiveConnections()).isZero();
    }

    @Test
    @DisplayName("should refuse an oversized request body without reaching a backend")
    void shouldRefuseOversizedRequest() throws Exception {
        LoadBalancerConfig config = config("roundrobin", address(backendA), address(backendB));
        config.getServer().setMaxBodyBytes(1024);
        app = new LoadBalancerApplication(LoadBalancerFactory.create(config));
        app.start();

        HttpRequest request = HttpRequest.newBuilder(proxyUri("/upload"))
                .POST(HttpRequest.BodyPublishers.ofString("x".repeat(4096)))
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(413);
        assertThat(objectMapper.readTree(response.body()).get("error").asText()).contains("1024");
        assertThat(pool().get(0).getRequestCount()).isZero();
        assertThat(pool().get(1).getRequestCount()).isZero();
        backendA.verify(0, postRequestedFor(urlEqualTo("/upload")));
    }

    @Test
    @DisplayName("should answer 502 when a backend response exceeds the body cap")
    void shouldAnswer502ForOversizedResponse() throws Exception {
        LoadBalancerConfig config = config("roundrobin", address(backendA), address(backendB));
        config.getServer().setMaxBodyBytes(1024);
        config.getHealthCheck().setEnabled(false);
        app = new LoadBalancerApplication(LoadBalancerFactory.create(config));
        app.start();
        backendA.stubFor(get(urlEqualTo("/report")).willReturn(aResponse().withStatus(200).withBody("y".repeat(2048))));

        HttpResponse<String> response = proxyGet("/report");

        assertThat(response.statusCode()).isEqualTo(502);
        assertThat(objectMapper.readTree(response.body()).get("error").asText()).contains("exceeds 1024 bytes");
        assertThat(pool().get(0).getActiveConnections()).isZero();
    }

    @Test
    @DisplayName("should report traffic on the admin endpoints")
    void shouldReportOnAdminEndpoints() throws Exception {
        start("leastconn");
        proxyGet("/one");
        proxyGet("/two");

        String admin = "http://127.0.0.1:" + app.getAdminServer().getPort();

        HttpResponse<String> status = httpClient.send(
                HttpRequest.newBuilder(URI.create(admin + "/status")).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        JsonNode snapshot = objectMapper.readTree(status.body());
        assertThat(snapshot.get("algorithm").asText()).isEqualTo("leastconn");
        assertThat(snapshot.get("aliveCount").asInt()).isEqualTo(2);

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            HttpResponse<String> metrics = httpClient.send(
                    HttpRequest.newBuilder(URI.create(admin + "/metrics")).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            assertThat(metrics.statusCode()).isEqualTo(200);
            assertThat(metrics.body()).contains("it_requests_total").contains("it_health_check_duration");
        });
    }

    @Test
    @DisplayName("should refuse to start with an invalid backend address")
    void shouldRejectInvalidBackend() {
        LoadBalancerConfig config = config("roundrobin", address(backendA), "ftp://files.example.com");

        assertThatThrownBy(() -> LoadBalancerFactory.create(config))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("ftp://files.example.com");
    }
}
