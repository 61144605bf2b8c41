package com.crustdata.mcp.model.input;

import java.util.List;

import com.crustdata.mcp.api.Param;

/**
 * Input for {@code crustdata_enrich_person}.
 */
public record EnrichPersonInput(
    @Param(value = "List of LinkedIn profile URLs to enrich", minItems = 1, maxItems = 25)
    List<String> linkedinUrls
) {}
