package com.crustdata.mcp;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpServer;

/**
 * Manages the embedded HTTP server that publishes the tools
 */
public class McpServerManager {
    private static final Logger LOG = LoggerFactory.getLogger(McpServerManager.class);

    private final ServerConfig config;
    private HttpServer server;
    private ExecutorService executor;

    /**
     * Creates a new McpServerManager
     *
     * @param config the server configuration
     */
    public McpServerManager(ServerConfig config) {
        this.config = config;
    }

    /**
     * Start the HTTP server on the configured port
     *
     * @return true if the server was started successfully
     * @throws IOException if the server socket could not be bound
     */
    public synchronized boolean startServer() throws IOException {
        // Stop existing server if running (e.g., on restart)
        if (server != null) {
            LOG.info("Stopping existing HTTP server before starting new one.");
            stopServer();
        }

        final int port = config.getPort();
        final HttpServer created = HttpServer.create(new InetSocketAddress(port), 0);
        executor = Executors.newFixedThreadPool(config.getThreads(), runnable -> {
            final Thread thread = new Thread(runnable, "crustdata-mcp-http");
            thread.setDaemon(true);
            return thread;
        });
        created.setExecutor(executor);
        created.start();
        server = created;
        LOG.info("Crustdata MCP HTTP server started on port {}", getPort());
        return true;
    }

    /**
     * Stop the HTTP server if it is running
     */
    public synchronized void stopServer() {
        if (server != null) {
            LOG.info("Stopping Crustdata MCP HTTP server...");
            server.stop(1); // Allow a second for in-flight exchanges to finish
            server = null;
            executor.shutdown();
            executor = null;
            LOG.info("Crustdata MCP HTTP server stopped.");
        }
    }

    /**
     * Get the current HTTP server instance
     *
     * @return the HTTP server or null if not running
     */
    public synchronized HttpServer getServer() {
        return server;
    }

    /**
     * Check if the server is running
     *
     * @return true if the server is running
     */
    public synchronized boolean isServerRunning() {
        return server != null;
    }

    /**
     * The port actually bound, which differs from the configured one when that is 0.
     *
     * @return the bound port, or -1 if the server is not running
     */
    public synchronized int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }
}
