package com.crustdata.mcp.client;

import com.crustdata.mcp.model.ToolOutput;
import com.crustdata.mcp.model.request.RequestDescriptor;

/**
 * Executes a built request against the Crustdata API and turns the outcome into tool output.
 */
@FunctionalInterface
public interface CrustdataTransport {

    ToolOutput execute(RequestDescriptor request);
}
