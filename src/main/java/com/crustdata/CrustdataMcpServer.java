package com.crustdata;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crustdata.mcp.McpServerManager;
import com.crustdata.mcp.ServerConfig;
import com.crustdata.mcp.api.ApiHandlerRegistry;
import com.crustdata.mcp.client.CrustdataTransport;
import com.crustdata.mcp.client.DryRunFormatter;
import com.crustdata.mcp.client.DryRunTransport;
import com.crustdata.mcp.services.PeopleService;
import com.crustdata.mcp.services.WebService;
import com.crustdata.mcp.telemetry.TelemetryLogger;

/**
 * Starts an HTTP server exposing the Crustdata tools to MCP clients.
 * Every tool runs in dry-run mode: requests are built and rendered, never sent.
 */
public class CrustdataMcpServer {
    private static final Logger LOG = LoggerFactory.getLogger(CrustdataMcpServer.class);

    private final McpServerManager serverManager;
    private final ApiHandlerRegistry apiHandlerRegistry;

    public CrustdataMcpServer(ServerConfig config) {
        final CrustdataTransport transport =
            new DryRunTransport(new DryRunFormatter(config.getApiBaseUrl(), config.getApiToken()));
        final TelemetryLogger telemetryLogger = new TelemetryLogger(config.getTelemetryDir(), config.isTelemetryEnabled());
        telemetryLogger.init();

        this.serverManager = new McpServerManager(config);
        this.apiHandlerRegistry = new ApiHandlerRegistry(serverManager, telemetryLogger,
            new PeopleService(transport),
            new WebService(transport));
        LOG.info("Initialized {} tools", apiHandlerRegistry.getTools().size());
    }

    /**
     * Start the HTTP server and register endpoints
     */
    public void start() throws IOException {
        serverManager.startServer();
        apiHandlerRegistry.registerAllEndpoints();
    }

    public void stop() {
        serverManager.stopServer();
        apiHandlerRegistry.shutdown();
    }

    public McpServerManager getServerManager() {
        return serverManager;
    }

    public ApiHandlerRegistry getApiHandlerRegistry() {
        return apiHandlerRegistry;
    }

    public static void main(String[] args) {
        final CrustdataMcpServer server = new CrustdataMcpServer(ServerConfig.load());
        try {
            server.start();
        } catch (IOException e) {
            LOG.error("Failed to start HTTP server", e);
            System.exit(1);
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "crustdata-mcp-shutdown"));
    }
}
