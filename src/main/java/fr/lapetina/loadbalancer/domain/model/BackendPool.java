package fr.lapetina.loadbalancer.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered collection of backends with membership fixed at construction.
 *
 * Only the backends' own state changes over the pool's lifetime, so the
 * list can be shared between request threads and the health monitor
 * without locking.
 */
public final class BackendPool implements Iterable<Backend> {

    private final List<Backend> backends;

    private BackendPool(List<Backend> backends) {
        this.backends = Collections.unmodifiableList(backends);
    }

    /**
     * Creates a pool preserving the given order.
     *
     * @throws IllegalArgumentException if the same address appears twice
     */
    public static BackendPool of(Collection<Backend> backends) {
        List<Backend> copy = new ArrayList<>(backends.size());
        Set<Backend> seen = new HashSet<>();
        for (Backend backend : backends) {
            if (!seen.add(backend)) {
                throw new IllegalArgumentException("Duplicate backend address: " + backend.getName());
            }
            copy.add(backend);
        }
        return new BackendPool(copy);
    }

    public static BackendPool of(Backend... backends) {
        return of(List.of(backends));
    }

    /**
     * Builds a pool from raw addresses.
     *
     * @throws IllegalArgumentException on the first malformed address
     */
    public static BackendPool fromAddresses(List<String> addresses) {
        List<Backend> backends = new ArrayList<>(addresses.size());
        for (String address : addresses) {
            backends.add(Backend.of(address));
        }
        return of(backends);
    }

    public static BackendPool empty() {
        return new BackendPool(List.of());
    }

    public Backend get(int index) {
        return backends.get(index);
    }

    public int size() {
        return backends.size();
    }

    public boolean isEmpty() {
        return backends.isEmpty();
    }

    public List<Backend> getBackends() {
        return backends;
    }

    public Optional<Backend> findByName(String name) {
        for (Backend backend : backends) {
            if (backend.getName().equals(name) || backend.getAddress().toString().equals(name)) {
                return Optional.of(backend);
            }
        }
        return Optional.empty();
    }

    /**
     * Counts backends currently alive. The result is a snapshot and may be stale immediately.
     */
    public int aliveCount() {
        int count = 0;
        for (Backend backend : backends) {
            if (backend.isAlive()) {
                count++;
            }
        }
        return count;
    }

    @Override
    public Iterator<Backend> iterator() {
        return backends.iterator();
    }

    @Override
    public String toString() {
        return "BackendPool{size=" + backends.size() + ", backends=" + backends + '}';
    }
}
