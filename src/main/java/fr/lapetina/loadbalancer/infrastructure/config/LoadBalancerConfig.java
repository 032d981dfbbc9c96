package fr.lapetina.loadbalancer.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the load balancer.
 * Designed to be populated from YAML.
 */
public class LoadBalancerConfig {

    private ServerConfig server = new ServerConfig();
    private List<String> backends = new ArrayList<>();
    private String algorithm = "roundrobin";
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private EventsConfig events = new EventsConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public List<String> getBackends() { return backends; }
    public void setBackends(List<String> backends) { this.backends = backends; }

    public String getAlgorithm() { return algorithm; }
    public void setAlgorithm(String algorithm) { this.algorithm = algorithm; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public EventsConfig getEvents() { return events; }
    public void setEvents(EventsConfig events) { this.events = events; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Front HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8000;
        private String host = "0.0.0.0";
        private int backlog = 100;
        // Cap on buffered request and response bodies
        private int maxBodyBytes = 10 * 1024 * 1024;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getMaxBodyBytes() { return maxBodyBytes; }
        public void setMaxBodyBytes(int maxBodyBytes) { this.maxBodyBytes = maxBodyBytes; }
    }

    /**
     * Health check configuration.
     */
    public static class HealthCheckConfig {
        private boolean enabled = true;
        private long intervalMs = 5000;
        private long timeoutMs = 2000;
        private String path = "/health";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
    }

    /**
     * Forwarding timeout configuration.
     */
    public static class TimeoutsConfig {
        private long connectTimeoutMs = 2000;
        private long requestTimeoutMs = 30000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * LMAX Disruptor configuration for the event pipeline.
     */
    public static class EventsConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Metrics and admin endpoint configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private int port = 2112;
        private String prefix = "lb";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
