package com.crustdata.mcp.model;

import com.crustdata.mcp.utils.HttpUtils;

/**
 * Output reporting success or failure of a request, used for error responses.
 */
public record StatusOutput(boolean success, String message) implements ToolOutput {

    /** Convenience factory for a successful result. */
    public static StatusOutput ok(String message) {
        return new StatusOutput(true, message);
    }

    /** Convenience factory for an error result. */
    public static StatusOutput error(String message) {
        return new StatusOutput(false, message);
    }

    @Override
    public String toStructuredJson() {
        return "{\"success\": " + success + ", \"message\": \"" + HttpUtils.escapeJson(message) + "\"}";
    }

    @Override
    public String toDisplayText() {
        return message;
    }
}
