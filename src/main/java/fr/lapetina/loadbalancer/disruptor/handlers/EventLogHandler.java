package fr.lapetina.loadbalancer.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.loadbalancer.domain.event.HealthEvent;
import fr.lapetina.loadbalancer.domain.event.LoadBalancerEvent;
import fr.lapetina.loadbalancer.domain.event.RequestEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every request and health report to its own log stream.
 *
 * The {@code fr.lapetina.loadbalancer.access} and
 * {@code fr.lapetina.loadbalancer.health} loggers are routed to separate
 * appenders by the logging configuration.
 */
public final class EventLogHandler implements EventHandler<LoadBalancerEvent> {

    public static final String ACCESS_LOGGER = "fr.lapetina.loadbalancer.access";
    public static final String HEALTH_LOGGER = "fr.lapetina.loadbalancer.health";

    private final Logger accessLog;
    private final Logger healthLog;

    public EventLogHandler() {
        this(LoggerFactory.getLogger(ACCESS_LOGGER), LoggerFactory.getLogger(HEALTH_LOGGER));
    }

    public EventLogHandler(Logger accessLog, Logger healthLog) {
        this.accessLog = accessLog;
        this.healthLog = healthLog;
    }

    @Override
    public void onEvent(LoadBalancerEvent event, long sequence, boolean endOfBatch) {
        if (event.getType() == null) {
            return;
        }
        switch (event.getType()) {
            case REQUEST -> logRequest(event.getRequestEvent());
            case HEALTH -> logHealth(event.getHealthEvent());
        }
    }

    private void logRequest(RequestEvent request) {
        accessLog.info("client={} method={} path={} backend={} status={} latencyMs={} algorithm={}",
                request.clientAddress(), request.method(), request.path(), request.backendAddress(),
                request.statusCode(), request.latencyMs(), request.algorithm());
    }

    private void logHealth(HealthEvent health) {
        healthLog.info("backend={} alive={} latencyMs={}",
                health.backendAddress(), health.alive(), health.latencyMs());
    }
}
