/**
 * Backend selection algorithms.
 *
 * <p>All implementations are thread-safe and only read backend state.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Config name</th><th>Algorithm</th><th>Behaviour</th></tr>
 *   <tr><td>{@code roundrobin}</td><td>{@code ROUND_ROBIN}</td><td>Shared cursor, first alive from the cursor position</td></tr>
 *   <tr><td>{@code leastconn}</td><td>{@code LEAST_CONN}</td><td>Fewest active connections, first in pool order on ties</td></tr>
 *   <tr><td>anything else</td><td>{@code RANDOM}</td><td>Uniform sampling among alive backends</td></tr>
 * </table>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * BackendSelector selector = new BackendSelector();
 * Optional<Backend> backend = selector.selectBackend(pool, SelectionAlgorithm.fromName("leastconn"));
 * }</pre>
 *
 * @see fr.lapetina.loadbalancer.domain.strategy.BackendSelector
 * @see fr.lapetina.loadbalancer.domain.strategy.LoadBalancingStrategy
 */
package fr.lapetina.loadbalancer.domain.strategy;
