package fr.lapetina.loadbalancer.domain.model;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable response returned by a backend, passed through to the caller.
 */
public record ProxyResponse(
        int statusCode,
        Map<String, List<String>> headers,
        byte[] body
) {
    public ProxyResponse {
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
    }

    public static ProxyResponse of(int statusCode, String body) {
        return new ProxyResponse(statusCode, Map.of(), body.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
