package com.crustdata.mcp.model.request;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized description of one outbound API call.
 * The query map keeps insertion order and is empty when the request has no query string;
 * the body is null when the request carries none.
 */
public record RequestDescriptor(
    HttpMethod method,
    String path,
    Map<String, String> query,
    Object body
) {
    public RequestDescriptor {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        query = query == null || query.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(query));
    }

    public static RequestDescriptor get(final String path, final Map<String, String> query) {
        return new RequestDescriptor(HttpMethod.GET, path, query, null);
    }

    public static RequestDescriptor post(final String path, final Map<String, String> query, final Object body) {
        return new RequestDescriptor(HttpMethod.POST, path, query, body);
    }

    public boolean hasBody() {
        return body != null;
    }
}
