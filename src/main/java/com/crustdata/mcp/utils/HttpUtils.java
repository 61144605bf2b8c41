package com.crustdata.mcp.utils;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpExchange;

/**
 * Utility methods for HTTP operations on the embedded tool server.
 */
public class HttpUtils {
    private static final Logger LOG = LoggerFactory.getLogger(HttpUtils.class);

    public static final String TEXT_PLAIN = "text/plain; charset=utf-8";
    public static final String APPLICATION_JSON = "application/json; charset=utf-8";

    /**
     * Parse query parameters from the URL, e.g. ?format=json
     */
    public static Map<String, String> parseQueryParams(HttpExchange exchange) {
        var query = exchange.getRequestURI().getRawQuery();
        if (query == null) return Map.of();

        return Arrays.stream(query.split("&"))
            .filter(p -> p.contains("="))
            .map(p -> p.split("=", 2))
            .filter(kv -> kv.length == 2)
            .collect(Collectors.toMap(
                kv -> decodeUrlParameter(kv[0]),
                kv -> decodeUrlParameter(kv[1]),
                (v1, v2) -> v1 // In case of duplicate keys, keep the first value
            ));
    }

    /**
     * Helper method to decode URL parameters safely
     */
    private static String decodeUrlParameter(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            LOG.warn("Error decoding URL parameter: {} - {}", value, e.getMessage());
            return value;
        }
    }

    /**
     * Read the request body as a JSON object. An empty body is treated as {@code {}}.
     *
     * @throws IllegalArgumentException if the body is not a JSON object
     */
    public static Map<String, Object> readJsonBody(HttpExchange exchange) throws IOException {
        var body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        if (body.isBlank()) return Map.of();
        return Json.readObject(body);
    }

    /**
     * Send an HTTP response with the given status and content type
     */
    public static void sendResponse(HttpExchange exchange, int status, String response, String contentType)
            throws IOException {
        var bytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (var os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    /**
     * Escape a string for use inside a JSON string literal. Control characters without a short
     * escape are written as {@code \\uXXXX}.
     */
    public static String escapeJson(String text) {
        if (text == null) {
            return null;
        }

        final StringBuilder sb = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            final char ch = text.charAt(i);
            switch (ch) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (ch < 0x20) {
                        sb.append(String.format("\\u%04x", (int) ch));
                    } else {
                        sb.append(ch);
                    }
                }
            }
        }
        return sb.toString();
    }
}
