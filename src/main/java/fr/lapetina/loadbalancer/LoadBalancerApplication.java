package fr.lapetina.loadbalancer;

import fr.lapetina.loadbalancer.api.AdminHttpServer;
import fr.lapetina.loadbalancer.api.ProxyHttpServer;
import fr.lapetina.loadbalancer.infrastructure.config.LoadBalancerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the HTTP load balancer.
 */
public class LoadBalancerApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancerApplication.class);

    private final LoadBalancerFactory factory;
    private final ProxyHttpServer proxyServer;
    private final AdminHttpServer adminServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public LoadBalancerApplication(String configPath) throws Exception {
        this(LoadBalancerFactory.create(configPath));
    }

    public LoadBalancerApplication(LoadBalancerFactory factory) throws Exception {
        log.info("Starting HTTP load balancer...");

        this.factory = factory.start();
        LoadBalancerConfig config = factory.getConfig();

        ProxyHttpServer proxy = null;
        try {
            proxy = new ProxyHttpServer(
                    config.getServer().getHost(),
                    config.getServer().getPort(),
                    config.getServer().getBacklog(),
                    config.getServer().getMaxBodyBytes(),
                    factory.getDispatcher()
            );

            this.adminServer = config.getMetrics().isEnabled()
                    ? new AdminHttpServer(
                            config.getServer().getHost(),
                            config.getMetrics().getPort(),
                            factory.getMetricsRegistry(),
                            factory.getPool(),
                            factory.getAlgorithm())
                    : null;
        } catch (Exception e) {
            if (proxy != null) {
                proxy.close();
            }
            factory.close();
            throw e;
        }
        this.proxyServer = proxy;

        log.info("HTTP load balancer initialized");
    }

    public void start() {
        proxyServer.start();
        if (adminServer != null) {
            adminServer.start();
        }
        log.info("HTTP load balancer started: port={}, algorithm={}, backends={}",
                proxyServer.getPort(), factory.getAlgorithm().getConfigName(), factory.getPool().size());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public LoadBalancerFactory getFactory() {
        return factory;
    }

    public ProxyHttpServer getProxyServer() {
        return proxyServer;
    }

    public AdminHttpServer getAdminServer() {
        return adminServer;
    }

    @Override
    public void close() {
        log.info("Shutting down HTTP load balancer...");

        try {
            proxyServer.close();
        } catch (Exception e) {
            log.warn("Error closing proxy server", e);
        }

        if (adminServer != null) {
            try {
                adminServer.close();
            } catch (Exception e) {
                log.warn("Error closing admin server", e);
            }
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("HTTP load balancer shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            LoadBalancerApplication app = new LoadBalancerApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start HTTP load balancer", e);
            System.exit(1);
        }
    }
}
