package com.crustdata.mcp.model;

import com.crustdata.mcp.utils.Json;

/**
 * Output for tools that return structured data via record objects.
 * The data object is serialized to JSON via Jackson.
 */
public record JsonOutput(Object data) implements ToolOutput {

    @Override
    public String toStructuredJson() {
        return Json.serialize(data);
    }

    @Override
    public String toDisplayText() {
        if (data instanceof Displayable d) {
            return d.toDisplayText();
        }
        return toStructuredJson();
    }
}
