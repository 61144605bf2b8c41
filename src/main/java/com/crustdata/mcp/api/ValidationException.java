package com.crustdata.mcp.api;

import java.util.List;

/**
 * Thrown when raw tool input violates the tool's declared schema.
 * Carries every violation found, each formatted as {@code field: reason}.
 */
public class ValidationException extends RuntimeException {
    private final String toolName;
    private final List<String> violations;

    public ValidationException(final String toolName, final List<String> violations) {
        super("Invalid input for " + toolName + ": " + String.join("; ", violations));
        this.toolName = toolName;
        this.violations = List.copyOf(violations);
    }

    public String getToolName() {
        return toolName;
    }

    public List<String> getViolations() {
        return violations;
    }
}
