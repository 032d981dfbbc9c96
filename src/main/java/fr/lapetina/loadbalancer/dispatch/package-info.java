/**
 * Request dispatch: backend selection, forwarding and connection accounting.
 *
 * <p>{@link fr.lapetina.loadbalancer.dispatch.RequestDispatcher} maps every
 * outcome to a status code:
 * <ul>
 *   <li>no alive backend - 503</li>
 *   <li>backend response - passed through unchanged</li>
 *   <li>request timeout - 504</li>
 *   <li>connection or I/O failure - 502</li>
 *   <li>unexpected failure - 500</li>
 * </ul>
 */
package fr.lapetina.loadbalancer.dispatch;
