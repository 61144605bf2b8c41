package com.crustdata.mcp.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crustdata.mcp.model.JsonOutput;
import com.crustdata.mcp.model.ToolOutput;
import com.crustdata.mcp.model.request.RequestDescriptor;
import com.crustdata.mcp.model.response.DryRunResult;

/**
 * Transport that never touches the network: it renders the request and returns the rendering.
 */
public class DryRunTransport implements CrustdataTransport {
    private static final Logger LOG = LoggerFactory.getLogger(DryRunTransport.class);

    private final DryRunFormatter formatter;

    public DryRunTransport(DryRunFormatter formatter) {
        this.formatter = formatter;
    }

    @Override
    public ToolOutput execute(RequestDescriptor request) {
        LOG.debug("Dry run {} {}", request.method(), request.path());
        return new JsonOutput(new DryRunResult(request, formatter.format(request)));
    }
}
