package com.crustdata.mcp.model.input;

import java.util.List;
import java.util.Optional;

import com.crustdata.mcp.api.Param;

/**
 * Input for {@code crustdata_web_search}. Optional components are empty when the caller
 * did not supply them and are then left out of the request body.
 */
public record WebSearchInput(
    @Param(value = "Search query text", minLength = 1, maxLength = 1000)
    String query,

    @Param(value = "ISO 3166-1 alpha-2 country code (e.g. 'US', 'GB', 'DE', 'FR', 'JP', 'IN', 'AU', 'BR')",
        pattern = "^[A-Za-z]{2}$")
    Optional<String> geolocation,

    @Param(value = "Search sources: 'news', 'web', 'scholar-articles', 'scholar-articles-enriched', 'scholar-author'",
        allowedValues = {"news", "web", "scholar-articles", "scholar-articles-enriched", "scholar-author"})
    Optional<List<String>> sources,

    @Param("Restrict results to a specific domain (e.g. 'github.com')")
    Optional<String> site,

    @Param("Unix timestamp for start date filter")
    Optional<Long> startDate,

    @Param("Unix timestamp for end date filter")
    Optional<Long> endDate,

    @Param(value = "If true, fetches full HTML content for each result URL", defaultValue = "false")
    boolean fetchContent
) {}
