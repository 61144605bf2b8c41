package com.crustdata.mcp.model.response;

import com.crustdata.mcp.model.Displayable;
import com.crustdata.mcp.model.request.RequestDescriptor;

/**
 * Result of a tool call in dry-run mode: the request that would have been sent, and its rendering.
 */
public record DryRunResult(
    RequestDescriptor request,
    String rendering
) implements Displayable {

    @Override
    public String toDisplayText() {
        return rendering;
    }
}
