package com.crustdata.mcp.api;

import java.io.IOException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crustdata.mcp.McpServerManager;
import com.crustdata.mcp.model.StatusOutput;
import com.crustdata.mcp.model.ToolOutput;
import com.crustdata.mcp.telemetry.TelemetryLogger;
import com.crustdata.mcp.utils.HttpUtils;
import com.crustdata.mcp.utils.Json;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

/**
 * Discovers @McpTool methods on the service objects and publishes them.
 * Each tool gets a {@code POST /<tool_name>} endpoint; {@code GET /mcp/tools} lists them all.
 */
public class ApiHandlerRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ApiHandlerRegistry.class);

    public static final String TOOLS_ENDPOINT = "/mcp/tools";

    private final McpServerManager serverManager;
    private final TelemetryLogger telemetryLogger;
    private final Map<String, ToolDef> tools = new LinkedHashMap<>();

    /**
     * Creates a new ApiHandlerRegistry
     *
     * @param serverManager   the server manager
     * @param telemetryLogger the telemetry sink for tool invocations
     * @param services        objects whose @McpTool methods become tools
     * @throws IllegalArgumentException if two tools share a name or a tool method is malformed
     */
    public ApiHandlerRegistry(McpServerManager serverManager, TelemetryLogger telemetryLogger, Object... services) {
        this.serverManager = serverManager;
        this.telemetryLogger = telemetryLogger;
        for (final Object service : services) {
            discoverTools(service);
        }
    }

    private void discoverTools(Object service) {
        // getDeclaredMethods() has no defined order, so sort for a stable listing
        final Method[] methods = service.getClass().getDeclaredMethods();
        Arrays.sort(methods, Comparator.comparing(Method::getName));
        for (final Method method : methods) {
            final McpTool annotation = method.getAnnotation(McpTool.class);
            if (annotation == null) continue;

            final ToolDef tool = ToolDef.fromMethod(service, method, annotation);
            if (tools.putIfAbsent(tool.getName(), tool) != null) {
                throw new IllegalArgumentException("Duplicate tool name: " + tool.getName());
            }
            LOG.debug("Discovered tool {} on {}", tool.getName(), service.getClass().getSimpleName());
        }
    }

    /**
     * Register all API endpoints with the server
     */
    public void registerAllEndpoints() {
        if (!serverManager.isServerRunning()) {
            LOG.warn("Cannot register endpoints: Server is not running");
            return;
        }

        final HttpServer server = serverManager.getServer();
        server.createContext(TOOLS_ENDPOINT, this::handleToolListing);
        for (final ToolDef tool : tools.values()) {
            server.createContext("/" + tool.getName(), createToolHandler(tool));
        }

        LOG.info("Registered {} tool endpoints: {}", tools.size(), tools.keySet());
    }

    /**
     * Shutdown the telemetry logger and save final reports
     */
    public void shutdown() {
        telemetryLogger.shutdown();
        LOG.info("Telemetry logger shut down successfully");
    }

    /**
     * Validate the arguments and invoke the named tool, recording telemetry.
     *
     * @throws IllegalArgumentException if no tool has that name
     * @throws ValidationException      if the arguments violate the tool's schema
     */
    public ToolOutput callTool(String toolName, Map<String, Object> arguments) {
        final ToolDef tool = getTool(toolName)
            .orElseThrow(() -> new IllegalArgumentException("Unknown tool: " + toolName));

        final long startTime = telemetryLogger.logToolStart(toolName);
        try {
            final ToolOutput output = tool.call(arguments);
            telemetryLogger.logToolSuccess(toolName, startTime, output.toDisplayText().length());
            return output;
        } catch (RuntimeException e) {
            telemetryLogger.logToolFailure(toolName, startTime, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    public Optional<ToolDef> getTool(String toolName) {
        return Optional.ofNullable(tools.get(toolName));
    }

    public List<ToolDef> getTools() {
        return List.copyOf(tools.values());
    }

    /**
     * JSON body of the /mcp/tools listing.
     */
    public String toToolsJson() {
        final List<Map<String, Object>> entries = new ArrayList<>();
        for (final ToolDef tool : tools.values()) {
            entries.add(tool.toToolMap());
        }
        return Json.serialize(Map.of("tools", entries));
    }

    private void handleToolListing(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            HttpUtils.sendResponse(exchange, 405, "Method not allowed: use GET", HttpUtils.TEXT_PLAIN);
            return;
        }
        HttpUtils.sendResponse(exchange, 200, toToolsJson(), HttpUtils.APPLICATION_JSON);
    }

    /**
     * Build the POST handler for one tool. {@code ?format=json} selects structured output.
     */
    private HttpHandler createToolHandler(ToolDef tool) {
        return exchange -> {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                HttpUtils.sendResponse(exchange, 405, "Method not allowed: use POST", HttpUtils.TEXT_PLAIN);
                return;
            }
            final boolean json = "json".equalsIgnoreCase(HttpUtils.parseQueryParams(exchange).get("format"));

            try {
                final Map<String, Object> arguments = HttpUtils.readJsonBody(exchange);
                final ToolOutput output = callTool(tool.getName(), arguments);
                if (json) {
                    HttpUtils.sendResponse(exchange, 200, output.toStructuredJson(), HttpUtils.APPLICATION_JSON);
                } else {
                    HttpUtils.sendResponse(exchange, 200, output.toDisplayText(), HttpUtils.TEXT_PLAIN);
                }
            } catch (ValidationException e) {
                LOG.debug("Rejected {} call: {}", tool.getName(), e.getViolations());
                sendError(exchange, 400, e.getMessage(), json);
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage(), json);
            } catch (RuntimeException e) {
                LOG.error("Tool {} failed", tool.getName(), e);
                sendError(exchange, 500, "Internal error: " + e.getMessage(), json);
            }
        };
    }

    private static void sendError(HttpExchange exchange, int status, String message, boolean json)
            throws IOException {
        final StatusOutput error = StatusOutput.error(message);
        if (json) {
            HttpUtils.sendResponse(exchange, status, error.toStructuredJson(), HttpUtils.APPLICATION_JSON);
        } else {
            HttpUtils.sendResponse(exchange, status, error.toDisplayText(), HttpUtils.TEXT_PLAIN);
        }
    }
}
