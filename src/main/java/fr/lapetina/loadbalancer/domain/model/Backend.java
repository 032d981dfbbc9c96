package fr.lapetina.loadbalancer.domain.model;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One upstream server in the pool.
 * Thread-safe: liveness is written by the health monitor while any number
 * of request threads read it and update the counters.
 */
public final class Backend {
    private final URI address;

    // Mutable state - thread-safe
    private final AtomicReference<BackendHealth> health;
    private final AtomicInteger activeConnections;
    private final AtomicLong requestCount;
    private volatile long lastHealthCheck;
    private volatile long lastProbeLatencyMs;

    private Backend(Builder builder) {
        this.address = parseAddress(builder.address);
        this.health = new AtomicReference<>(builder.initialHealth);
        this.activeConnections = new AtomicInteger(0);
        this.requestCount = new AtomicLong(0);
        this.lastHealthCheck = 0L;
        this.lastProbeLatencyMs = -1L;
    }

    /**
     * Creates an initially alive backend for the given address.
     *
     * @throws IllegalArgumentException if the address is not an absolute http(s) URL with a host
     */
    public static Backend of(String address) {
        return builder().address(address).build();
    }

    public URI getAddress() {
        return address;
    }

    /**
     * Address without a trailing slash. This is the backend's identity: equality,
     * logs and metric tags all use it.
     */
    public String getName() {
        String value = address.toString();
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    public BackendHealth getHealth() {
        return health.get();
    }

    public boolean isAlive() {
        return health.get() == BackendHealth.ALIVE;
    }

    /**
     * Sets liveness. Called by the health monitor only.
     *
     * @return the liveness before this call
     */
    public boolean setAlive(boolean alive) {
        BackendHealth previous = health.getAndSet(alive ? BackendHealth.ALIVE : BackendHealth.DEAD);
        this.lastHealthCheck = System.currentTimeMillis();
        return previous == BackendHealth.ALIVE;
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    /**
     * Marks a request as dispatched to this backend.
     * Must be paired with exactly one {@link #recordEnd()}.
     */
    public void recordStart() {
        activeConnections.incrementAndGet();
        requestCount.incrementAndGet();
    }

    /**
     * Marks a dispatched request as finished, whatever its outcome.
     *
     * @throws IllegalStateException if there is no matching {@link #recordStart()}
     */
    public void recordEnd() {
        while (true) {
            int current = activeConnections.get();
            if (current <= 0) {
                throw new IllegalStateException("recordEnd without matching recordStart on " + getName());
            }
            if (activeConnections.compareAndSet(current, current - 1)) {
                return;
            }
        }
    }

    public long getLastHealthCheck() {
        return lastHealthCheck;
    }

    public long getLastProbeLatencyMs() {
        return lastProbeLatencyMs;
    }

    public void setLastProbeLatencyMs(long latencyMs) {
        this.lastProbeLatencyMs = latencyMs;
    }

    private static URI parseAddress(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Backend address is required");
        }
        URI uri;
        try {
            uri = new URI(address.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid backend address '" + address + "': " + e.getMessage(), e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new IllegalArgumentException(
                    "Invalid backend address '" + address + "': scheme must be http or https");
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("Invalid backend address '" + address + "': missing host");
        }
        return uri;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Backend that = (Backend) o;
        return getName().equals(that.getName());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getName());
    }

    @Override
    public String toString() {
        return "Backend{" +
                "address=" + address +
                ", health=" + health.get() +
                ", active=" + activeConnections.get() +
                ", requests=" + requestCount.get() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String address;
        private BackendHealth initialHealth = BackendHealth.ALIVE;

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder initialHealth(BackendHealth health) {
            this.initialHealth = Objects.requireNonNull(health, "Initial health is required");
            return this;
        }

        public Backend build() {
            return new Backend(this);
        }
    }
}
