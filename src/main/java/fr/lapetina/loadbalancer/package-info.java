/**
 * HTTP Load Balancer - reverse proxy spreading requests over a fixed pool of backends.
 *
 * <p>Each request is routed to an alive backend chosen by round robin, least
 * connections or random selection. A background monitor probes every backend
 * periodically and flips its liveness on each result. Request and health
 * reports go through an LMAX Disruptor ring buffer to the access log, the
 * health log and Micrometer.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.loadbalancer.LoadBalancerFactory} - Wires pool, selector, monitor,
 *       dispatcher and event pipeline from YAML configuration</li>
 *   <li>{@link fr.lapetina.loadbalancer.LoadBalancerApplication} - Standalone proxy and admin servers</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (LoadBalancerFactory factory = LoadBalancerFactory.create("config.yaml").start()) {
 *     DispatchResult result = factory.getDispatcher().dispatch(ProxyRequest.get("/api/users"));
 *     System.out.println(result.statusCode());
 * }
 * }</pre>
 *
 * @see fr.lapetina.loadbalancer.LoadBalancerFactory
 * @see fr.lapetina.loadbalancer.dispatch.RequestDispatcher
 */
package fr.lapetina.loadbalancer;
