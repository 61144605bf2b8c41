package com.crustdata.mcp.client;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.crustdata.mcp.model.request.RequestDescriptor;
import com.crustdata.mcp.utils.Json;

/**
 * Renders a {@link RequestDescriptor} as stable text for inspection.
 *
 * <pre>
 * DRY RUN: request not sent
 * POST https://api.crustdata.com/screener/web-search?fetch_content=true
 * Authorization: Token ****abcd
 * Body:
 * {"query":"rust jobs"}
 * </pre>
 *
 * The Authorization line appears only when a token is configured, and the Body lines only
 * when the request has a body. Query keys and values are form-encoded in descriptor order;
 * the body is compact JSON in its own key and element order.
 */
public class DryRunFormatter {
    static final String HEADER = "DRY RUN: request not sent";

    private final String baseUrl;
    private final String apiToken;

    public DryRunFormatter(String baseUrl, String apiToken) {
        this.baseUrl = stripTrailingSlash(baseUrl == null ? "" : baseUrl);
        this.apiToken = apiToken == null ? "" : apiToken;
    }

    public String format(RequestDescriptor request) {
        final List<String> lines = new ArrayList<>();
        lines.add(HEADER);
        lines.add(request.method().name() + " " + baseUrl + request.path() + queryString(request.query()));
        if (!apiToken.isEmpty()) {
            lines.add("Authorization: Token " + mask(apiToken));
        }
        if (request.hasBody()) {
            lines.add("Body:");
            lines.add(Json.serialize(request.body()));
        }
        return String.join("\n", lines);
    }

    static String queryString(Map<String, String> query) {
        if (query.isEmpty()) return "";
        return query.entrySet().stream()
            .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
            .collect(Collectors.joining("&", "?", ""));
    }

    static String mask(String token) {
        if (token.length() <= 8) return "****";
        return "****" + token.substring(token.length() - 4);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
