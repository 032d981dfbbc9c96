/**
 * Domain model classes for the backend pool.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.loadbalancer.domain.model.Backend} - Thread-safe upstream server with liveness and counters</li>
 *   <li>{@link fr.lapetina.loadbalancer.domain.model.BackendPool} - Ordered, fixed-membership set of backends</li>
 *   <li>{@link fr.lapetina.loadbalancer.domain.model.ProxyRequest} - Immutable inbound request</li>
 *   <li>{@link fr.lapetina.loadbalancer.domain.model.ProxyResponse} - Immutable backend response</li>
 *   <li>{@link fr.lapetina.loadbalancer.domain.model.DispatchResult} - Outcome of one dispatch</li>
 *   <li>{@link fr.lapetina.loadbalancer.domain.model.ErrorType} - Error categories and their status codes</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>{@code Backend} keeps liveness in an {@code AtomicReference} and its counters in
 * {@code AtomicInteger}/{@code AtomicLong}; there is no pool-wide lock. Everything else
 * in this package is immutable.
 */
package fr.lapetina.loadbalancer.domain.model;
