package fr.lapetina.loadbalancer.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.loadbalancer.disruptor.handlers.ClearingHandler;
import fr.lapetina.loadbalancer.disruptor.handlers.EventLogHandler;
import fr.lapetina.loadbalancer.disruptor.handlers.MetricsHandler;
import fr.lapetina.loadbalancer.domain.event.EventPublisher;
import fr.lapetina.loadbalancer.domain.event.HealthEvent;
import fr.lapetina.loadbalancer.domain.event.LoadBalancerEvent;
import fr.lapetina.loadbalancer.domain.event.LoadBalancerEventFactory;
import fr.lapetina.loadbalancer.domain.event.RequestEvent;
import fr.lapetina.loadbalancer.infrastructure.NamedThreadFactory;
import fr.lapetina.loadbalancer.infrastructure.config.LoadBalancerConfig;
import fr.lapetina.loadbalancer.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Disruptor pipeline carrying request and health reports to the logging and
 * metrics collaborators.
 *
 * Publishing never blocks the caller: HTTP handler threads and health probe
 * callbacks claim a slot with {@code tryNext()}, and when the ring buffer is
 * full the report is dropped and counted.
 *
 * PRODUCER TYPE: MULTI, since every HTTP handler thread and the health
 * monitor publish concurrently.
 *
 * HANDLER GRAPH:
 * <pre>
 *   EventLogHandler ─┐
 *                    ├─&gt; ClearingHandler
 *   MetricsHandler  ─┘
 * </pre>
 * The two collaborators run in parallel; the slot is cleared once both have seen it.
 */
public final class EventPipeline implements EventPublisher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventPipeline.class);

    private final Disruptor<LoadBalancerEvent> disruptor;
    private final RingBuffer<LoadBalancerEvent> ringBuffer;
    private final MetricsRegistry metricsRegistry;
    private final long shutdownTimeoutMs;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong droppedEvents = new AtomicLong();

    private EventPipeline(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;
        this.shutdownTimeoutMs = builder.shutdownTimeoutMs;

        this.disruptor = new Disruptor<>(
                new LoadBalancerEventFactory(),
                builder.ringBufferSize,
                new NamedThreadFactory("event-handler", true),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        disruptor
                .handleEventsWith(new EventLogHandler(), new MetricsHandler(metricsRegistry))
                .then(new ClearingHandler());

        disruptor.setDefaultExceptionHandler(new LoggingExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("EventPipeline created: ringBufferSize={}, waitStrategy={}",
                builder.ringBufferSize, builder.waitStrategy);
    }

    /**
     * Starts the handler threads.
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("EventPipeline already closed");
        }
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("EventPipeline started");
        }
    }

    @Override
    public void publishRequest(RequestEvent event) {
        long sequence = claim();
        if (sequence < 0) {
            return;
        }
        try {
            ringBuffer.get(sequence).initialize(event);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    @Override
    public void publishHealth(HealthEvent event) {
        long sequence = claim();
        if (sequence < 0) {
            return;
        }
        try {
            ringBuffer.get(sequence).initialize(event);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /**
     * Claims a slot without waiting.
     *
     * @return the claimed sequence, or -1 if the event must be dropped
     */
    private long claim() {
        if (closed.get()) {
            recordDrop("pipeline closed");
            return -1;
        }
        try {
            return ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            recordDrop("ring buffer full");
            return -1;
        }
    }

    private void recordDrop(String reason) {
        long dropped = droppedEvents.incrementAndGet();
        metricsRegistry.incrementDroppedEvents();
        // Log the first drop and then every 1000th to avoid flooding
        if (dropped == 1 || dropped % 1000 == 0) {
            log.warn("Event dropped: reason={}, totalDropped={}", reason, dropped);
        }
    }

    public long getDroppedEvents() {
        return droppedEvents.get();
    }

    /**
     * Returns current ring buffer remaining capacity.
     */
    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Drains pending events, then stops the handler threads.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true) && running.compareAndSet(true, false)) {
            log.info("Shutting down EventPipeline...");
            try {
                disruptor.shutdown(shutdownTimeoutMs, TimeUnit.MILLISECONDS);
                log.info("EventPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("EventPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Logs handler failures and lets the pipeline carry on with the next event.
     */
    private static final class LoggingExceptionHandler implements ExceptionHandler<LoadBalancerEvent> {

        @Override
        public void handleEventException(Throwable ex, long sequence, LoadBalancerEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during EventPipeline start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during EventPipeline shutdown", ex);
        }
    }

    /**
     * Builder for EventPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private long shutdownTimeoutMs = 5_000;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (size <= 0 || Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder shutdownTimeoutMs(long timeoutMs) {
            this.shutdownTimeoutMs = timeoutMs;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(LoadBalancerConfig config) {
            ringBufferSize(config.getEvents().getRingBufferSize());
            this.waitStrategy = config.getEvents().getWaitStrategy();
            return this;
        }

        public EventPipeline build() {
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            if (waitStrategy == null) {
                waitStrategy = "blocking";
            }
            return new EventPipeline(this);
        }
    }
}
