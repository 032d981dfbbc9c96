package fr.lapetina.loadbalancer.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable inbound request as received by the front server.
 *
 * @param method        HTTP method
 * @param pathAndQuery  raw path including the query string, always starting with '/'
 * @param headers       request headers, case-insensitive keys
 * @param body          request body, empty array when absent
 * @param clientAddress remote address of the caller (ip or ip:port)
 * @param requestId     id used to correlate logs
 */
public record ProxyRequest(
        String method,
        String pathAndQuery,
        Map<String, List<String>> headers,
        byte[] body,
        String clientAddress,
        String requestId
) {
    public ProxyRequest {
        Objects.requireNonNull(method, "method is required");
        Objects.requireNonNull(pathAndQuery, "pathAndQuery is required");
        if (!pathAndQuery.startsWith("/")) {
            pathAndQuery = "/" + pathAndQuery;
        }
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> {
                if (name != null && values != null) {
                    copy.put(name, List.copyOf(values));
                }
            });
        }
        headers = Collections.unmodifiableMap(copy);
        body = body != null ? body : new byte[0];
        clientAddress = clientAddress != null ? clientAddress : "unknown";
    }

    /**
     * Path without the query string.
     */
    public String path() {
        int q = pathAndQuery.indexOf('?');
        return q >= 0 ? pathAndQuery.substring(0, q) : pathAndQuery;
    }

    public String firstHeader(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public static ProxyRequest get(String pathAndQuery) {
        return new ProxyRequest("GET", pathAndQuery, Map.of(), null, "127.0.0.1", null);
    }
}
