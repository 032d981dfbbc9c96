/**
 * Configuration loading and validation.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.loadbalancer.infrastructure.config.LoadBalancerConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.loadbalancer.infrastructure.config.ConfigLoader} - YAML loading and validation</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - Front HTTP server settings (host, port, backlog)</li>
 *   <li>{@code backends} - Ordered list of backend addresses</li>
 *   <li>{@code algorithm} - {@code roundrobin}, {@code leastconn}, anything else selects random</li>
 *   <li>{@code healthCheck} - Probe interval, timeout and path</li>
 *   <li>{@code timeouts} - Forwarding connect and request timeouts</li>
 *   <li>{@code events} - Ring buffer and wait strategy for the event pipeline</li>
 *   <li>{@code metrics} - Admin port and Prometheus metric prefix</li>
 * </ul>
 */
package fr.lapetina.loadbalancer.infrastructure.config;
