package com.crustdata.mcp.model.input;

import java.util.List;

import com.crustdata.mcp.api.Param;

/**
 * Input for {@code crustdata_web_fetch}.
 */
public record WebFetchInput(
    @Param(value = "List of URLs to fetch (must include http:// or https://)", minItems = 1, maxItems = 10)
    List<String> urls
) {}
