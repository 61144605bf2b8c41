package com.crustdata.mcp.telemetry;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Telemetry logger for tracking MCP tool usage, success rates, and failure patterns.
 * Appends one JSON event per line to {@code mcp_telemetry_<date>.jsonl} and writes a summary
 * at shutdown. A disabled logger keeps its counters but writes nothing.
 */
public class TelemetryLogger {
    private static final Logger LOG = LoggerFactory.getLogger(TelemetryLogger.class);

    static final String LOG_FILE_PREFIX = "mcp_telemetry_";
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Gson gson;
    private final Path telemetryDir;
    private final boolean enabled;
    private final Map<String, ToolMetrics> toolMetrics = new ConcurrentHashMap<>();
    private final AtomicLong sessionRequestCount = new AtomicLong(0);
    private final String sessionId;
    private final long sessionStartTime;

    /**
     * Metrics tracked for each tool
     */
    private static class ToolMetrics {
        final AtomicLong invocationCount = new AtomicLong(0);
        final AtomicLong successCount = new AtomicLong(0);
        final AtomicLong failureCount = new AtomicLong(0);
        final AtomicLong totalDurationMs = new AtomicLong(0);
        final AtomicLong maxDurationMs = new AtomicLong(0);
        final Map<String, AtomicLong> errorCounts = new ConcurrentHashMap<>();
    }

    /**
     * Telemetry event structure, serialized field by field by Gson
     */
    static class TelemetryEvent {
        final String timestamp = Instant.now().toString();
        final String sessionId;
        final String eventType;
        final String toolName;
        final boolean success;
        final String errorType;
        final String errorMessage;
        final long durationMs;
        final Map<String, Object> metadata;

        TelemetryEvent(String sessionId, String eventType, String toolName, boolean success,
                       String errorType, String errorMessage, long durationMs, Map<String, Object> metadata) {
            this.sessionId = sessionId;
            this.eventType = eventType;
            this.toolName = toolName;
            this.success = success;
            this.errorType = errorType;
            this.errorMessage = errorMessage;
            this.durationMs = durationMs;
            this.metadata = metadata;
        }
    }

    public TelemetryLogger(String telemetryDirPath) {
        this(telemetryDirPath, true);
    }

    public TelemetryLogger(String telemetryDirPath, boolean enabled) {
        this.gson = new GsonBuilder().create(); // No pretty printing for JSONL format
        this.telemetryDir = Paths.get(telemetryDirPath);
        this.enabled = enabled;
        this.sessionStartTime = System.currentTimeMillis();
        this.sessionId = "session_" + UUID.randomUUID();

        if (enabled) {
            try {
                Files.createDirectories(telemetryDir);
                LOG.info("Telemetry directory created/verified at: {}", telemetryDir);
            } catch (IOException e) {
                LOG.error("Failed to create telemetry directory {}", telemetryDir, e);
            }
        }
    }

    /**
     * A logger that only counts; nothing is written to disk.
     */
    public static TelemetryLogger disabled() {
        return new TelemetryLogger(System.getProperty("java.io.tmpdir"), false);
    }

    /**
     * Initialize the telemetry logger after construction.
     */
    public void init() {
        logSessionEvent("SESSION_START");
    }

    /**
     * Log the start of a tool invocation
     *
     * @return the start timestamp to pass to logToolSuccess / logToolFailure
     */
    public long logToolStart(String toolName) {
        final long startTime = System.currentTimeMillis();
        sessionRequestCount.incrementAndGet();
        final ToolMetrics metrics = toolMetrics.computeIfAbsent(toolName, k -> new ToolMetrics());
        metrics.invocationCount.incrementAndGet();

        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sessionRequestNumber", sessionRequestCount.get());
        metadata.put("totalInvocations", metrics.invocationCount.get());
        writeEvent(new TelemetryEvent(sessionId, "TOOL_START", toolName, true, null, null, 0, metadata));
        return startTime;
    }

    /**
     * Log successful tool completion
     */
    public void logToolSuccess(String toolName, long startTime, int responseLength) {
        final long duration = System.currentTimeMillis() - startTime;
        final ToolMetrics metrics = toolMetrics.computeIfAbsent(toolName, k -> new ToolMetrics());
        metrics.successCount.incrementAndGet();
        recordDuration(metrics, duration);

        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("responseLength", responseLength);
        metadata.put("successRate", successRate(metrics));
        writeEvent(new TelemetryEvent(sessionId, "TOOL_SUCCESS", toolName, true, null, null, duration, metadata));
    }

    /**
     * Log tool failure
     */
    public void logToolFailure(String toolName, long startTime, String errorType, String errorMessage) {
        final long duration = System.currentTimeMillis() - startTime;
        final ToolMetrics metrics = toolMetrics.computeIfAbsent(toolName, k -> new ToolMetrics());
        metrics.failureCount.incrementAndGet();
        recordDuration(metrics, duration);
        final String errorKey = errorType != null ? errorType : "UNKNOWN_ERROR";
        metrics.errorCounts.computeIfAbsent(errorKey, k -> new AtomicLong(0)).incrementAndGet();

        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("successRate", successRate(metrics));
        writeEvent(new TelemetryEvent(sessionId, "TOOL_FAILURE", toolName, false, errorKey, errorMessage,
            duration, metadata));
    }

    /**
     * Log session-level events
     */
    public void logSessionEvent(String eventType) {
        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sessionDuration", System.currentTimeMillis() - sessionStartTime);
        metadata.put("totalRequests", sessionRequestCount.get());
        metadata.put("uniqueToolsUsed", toolMetrics.size());
        writeEvent(new TelemetryEvent(sessionId, eventType, null, true, null, null, 0, metadata));
    }

    /**
     * Write the per-tool summary for this session, pretty-printed
     */
    public void writeSummary() {
        if (!enabled) return;

        final Map<String, Object> tools = new LinkedHashMap<>();
        toolMetrics.forEach((toolName, metrics) -> {
            final Map<String, Object> toolSummary = new LinkedHashMap<>();
            toolSummary.put("invocations", metrics.invocationCount.get());
            toolSummary.put("successes", metrics.successCount.get());
            toolSummary.put("failures", metrics.failureCount.get());
            toolSummary.put("successRate", successRate(metrics));
            toolSummary.put("avgDurationMs", averageDuration(metrics));
            toolSummary.put("maxDurationMs", metrics.maxDurationMs.get());
            toolSummary.put("errorTypes", metrics.errorCounts);
            tools.put(toolName, toolSummary);
        });

        final Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("date", today());
        summary.put("sessionId", sessionId);
        summary.put("totalRequests", sessionRequestCount.get());
        summary.put("sessionDurationMs", System.currentTimeMillis() - sessionStartTime);
        summary.put("tools", tools);

        final Path summaryFile = telemetryDir.resolve("summary_" + today() + ".json");
        try (Writer writer = Files.newBufferedWriter(summaryFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            new GsonBuilder().setPrettyPrinting().create().toJson(summary, writer);
            writer.write("\n");
            LOG.info("Telemetry summary written to: {}", summaryFile);
        } catch (IOException e) {
            LOG.error("Failed to write telemetry summary {}", summaryFile, e);
        }
    }

    /**
     * Shutdown telemetry and generate final reports
     */
    public void shutdown() {
        logSessionEvent("SESSION_END");
        writeSummary();
    }

    public long getInvocationCount(String toolName) {
        final ToolMetrics metrics = toolMetrics.get(toolName);
        return metrics == null ? 0 : metrics.invocationCount.get();
    }

    public long getSuccessCount(String toolName) {
        final ToolMetrics metrics = toolMetrics.get(toolName);
        return metrics == null ? 0 : metrics.successCount.get();
    }

    public long getFailureCount(String toolName) {
        final ToolMetrics metrics = toolMetrics.get(toolName);
        return metrics == null ? 0 : metrics.failureCount.get();
    }

    public boolean isEnabled() {
        return enabled;
    }

    Path getTelemetryDir() {
        return telemetryDir;
    }

    // Helper methods

    private synchronized void writeEvent(TelemetryEvent event) {
        if (!enabled) return;
        final Path logFile = telemetryDir.resolve(LOG_FILE_PREFIX + today() + ".jsonl");
        try {
            final String jsonLine = gson.toJson(event) + "\n";
            Files.write(logFile, jsonLine.getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            LOG.error("Failed to write telemetry event to {}", logFile, e);
        }
    }

    private static String today() {
        return DATE_FORMAT.format(LocalDate.now(ZoneOffset.UTC));
    }

    private static void recordDuration(ToolMetrics metrics, long duration) {
        metrics.totalDurationMs.addAndGet(duration);
        metrics.maxDurationMs.updateAndGet(max -> Math.max(max, duration));
    }

    private static double averageDuration(ToolMetrics metrics) {
        final long completed = metrics.successCount.get() + metrics.failureCount.get();
        return completed == 0 ? 0.0 : (double) metrics.totalDurationMs.get() / completed;
    }

    private static double successRate(ToolMetrics metrics) {
        final long invocations = metrics.invocationCount.get();
        return invocations == 0 ? 0.0 : (double) metrics.successCount.get() / invocations;
    }
}
