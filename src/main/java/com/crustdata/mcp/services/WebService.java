package com.crustdata.mcp.services;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.crustdata.mcp.api.McpTool;
import com.crustdata.mcp.client.CrustdataTransport;
import com.crustdata.mcp.model.ToolOutput;
import com.crustdata.mcp.model.input.WebFetchInput;
import com.crustdata.mcp.model.input.WebSearchInput;
import com.crustdata.mcp.model.request.RequestDescriptor;
import com.crustdata.mcp.model.response.DryRunResult;

/**
 * Service class for the web endpoints: SERP search and page fetch
 */
public class WebService {
    static final String SEARCH_PATH = "/screener/web-search";
    static final String FETCH_PATH = "/screener/web-fetch";

    private final CrustdataTransport transport;

    /**
     * Creates a new WebService
     *
     * @param transport the transport that executes built requests
     */
    public WebService(CrustdataTransport transport) {
        this.transport = transport;
    }

    @McpTool(name = "crustdata_web_search", title = "Web Search", responseType = DryRunResult.class,
        description = "Perform a web search using Crustdata's SERP API.\n\n"
            + "Returns search results with titles, URLs, snippets, and positions. Useful for competitive\n"
            + "intelligence, market research and lead generation. Rate limit: 15 requests per minute;\n"
            + "typically 5-15 results per search, no pagination.")
    public ToolOutput webSearch(WebSearchInput params) {
        return transport.execute(buildWebSearchRequest(params));
    }

    @McpTool(name = "crustdata_web_fetch", title = "Web Fetch", responseType = DryRunResult.class,
        description = "Fetch HTML content from one or more URLs.\n\n"
            + "Returns the page title and full HTML content for each URL. URLs must start with http://\n"
            + "or https://, at most 10 per request. Only publicly accessible pages are fetched.")
    public ToolOutput webFetch(WebFetchInput params) {
        return transport.execute(buildWebFetchRequest(params));
    }

    /**
     * POST /screener/web-search. Optional fields enter the body only when supplied, with the
     * dates renamed to startDate/endDate; fetch_content goes in the query string only when true.
     */
    public static RequestDescriptor buildWebSearchRequest(WebSearchInput params) {
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", params.query());
        params.geolocation().ifPresent(v -> body.put("geolocation", v));
        params.sources().ifPresent(v -> body.put("sources", v));
        params.site().ifPresent(v -> body.put("site", v));
        params.startDate().ifPresent(v -> body.put("startDate", v));
        params.endDate().ifPresent(v -> body.put("endDate", v));

        final Map<String, String> query = params.fetchContent() ? Map.of("fetch_content", "true") : null;
        return RequestDescriptor.post(SEARCH_PATH, query, Collections.unmodifiableMap(body));
    }

    public static RequestDescriptor buildWebFetchRequest(WebFetchInput params) {
        return RequestDescriptor.post(FETCH_PATH, null, Map.of("urls", params.urls()));
    }
}
