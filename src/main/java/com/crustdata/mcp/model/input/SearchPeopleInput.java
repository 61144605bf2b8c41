package com.crustdata.mcp.model.input;

import java.util.List;

import com.crustdata.mcp.api.Param;

/**
 * Input for {@code crustdata_search_people}. Filters are combined with AND logic by the API.
 */
public record SearchPeopleInput(
    @Param(value = "List of search filters (combined with AND logic)", minItems = 1)
    List<PersonSearchFilter> filters,

    @Param(value = "Page number for pagination (25 results per page)", defaultValue = "1", minimum = 1)
    int page
) {}
