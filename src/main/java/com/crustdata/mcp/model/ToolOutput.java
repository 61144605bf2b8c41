package com.crustdata.mcp.model;

/**
 * Sealed interface for typed MCP tool outputs.
 * Each subtype defines its own structured JSON shape and display text format.
 */
public sealed interface ToolOutput permits JsonOutput, StatusOutput {

    /** Return the structured JSON representation of this output. */
    String toStructuredJson();

    /** Return the human-readable display text. */
    String toDisplayText();
}
