/**
 * HTTP surface built on the JDK's {@code com.sun.net.httpserver}.
 *
 * <ul>
 *   <li>{@link fr.lapetina.loadbalancer.api.ProxyHttpServer} - front server, proxies every path</li>
 *   <li>{@link fr.lapetina.loadbalancer.api.AdminHttpServer} - {@code /metrics} and {@code /status}</li>
 * </ul>
 */
package fr.lapetina.loadbalancer.api;
