package com.crustdata.mcp.services;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.crustdata.mcp.api.McpTool;
import com.crustdata.mcp.client.CrustdataTransport;
import com.crustdata.mcp.model.ToolOutput;
import com.crustdata.mcp.model.input.EnrichPersonInput;
import com.crustdata.mcp.model.input.GetSocialPostsInput;
import com.crustdata.mcp.model.input.PersonSearchFilter;
import com.crustdata.mcp.model.input.SearchPeopleInput;
import com.crustdata.mcp.model.request.RequestDescriptor;
import com.crustdata.mcp.model.response.DryRunResult;

/**
 * Service class for the people endpoints: profile enrichment, social posts and people search
 */
public class PeopleService {
    static final String ENRICH_PATH = "/screener/person/enrich";
    static final String SOCIAL_POSTS_PATH = "/screener/social_posts";
    static final String SEARCH_PATH = "/screener/person/search";

    private final CrustdataTransport transport;

    /**
     * Creates a new PeopleService
     *
     * @param transport the transport that executes built requests
     */
    public PeopleService(CrustdataTransport transport) {
        this.transport = transport;
    }

    @McpTool(name = "crustdata_enrich_person", title = "Enrich Person", responseType = DryRunResult.class,
        description = "Enrich LinkedIn profiles with detailed professional data.\n\n"
            + "Retrieves employment history, education, skills, connections and more for one or more\n"
            + "LinkedIn profiles. Profiles that are not found yet are enriched by Crustdata within\n"
            + "30-60 minutes; query again after that time.\n\n"
            + "Example URLs: 'https://www.linkedin.com/in/satyanadella/', 'https://www.linkedin.com/in/jeffweiner08/'")
    public ToolOutput enrichPerson(EnrichPersonInput params) {
        return transport.execute(buildEnrichPersonRequest(params));
    }

    @McpTool(name = "crustdata_get_social_posts", title = "Get Social Posts", responseType = DryRunResult.class,
        description = "Get recent social media posts and engagement metrics for a person.\n\n"
            + "Returns posts with content, reactions, comments, shares, and the people who interacted\n"
            + "with them. The endpoint fetches data in real time; expect 30-60 seconds of latency.")
    public ToolOutput getSocialPosts(GetSocialPostsInput params) {
        return transport.execute(buildSocialPostsRequest(params));
    }

    @McpTool(name = "crustdata_search_people", title = "Search People", responseType = DryRunResult.class,
        description = "Search for professional profiles using structured filters.\n\n"
            + "Find people by company, title, seniority, industry, location, skills, etc.\n"
            + "Filters are combined with AND logic. Returns 25 results per page.\n\n"
            + "Filter types: CURRENT_COMPANY, CURRENT_TITLE, PAST_TITLE, PAST_COMPANY, SENIORITY_LEVEL,\n"
            + "INDUSTRY, REGION, COMPANY_HEADCOUNT, YEARS_AT_CURRENT_COMPANY, YEARS_OF_EXPERIENCE,\n"
            + "FUNCTION, KEYWORD, COMPANY_TYPE.\n"
            + "Boolean filters (no meaningful value): POSTED_ON_SOCIAL_MEDIA, RECENTLY_CHANGED_JOBS, IN_THE_NEWS.")
    public ToolOutput searchPeople(SearchPeopleInput params) {
        return transport.execute(buildSearchPeopleRequest(params));
    }

    /**
     * GET /screener/person/enrich with all profile URLs comma-joined into one query parameter.
     */
    public static RequestDescriptor buildEnrichPersonRequest(EnrichPersonInput params) {
        return RequestDescriptor.get(ENRICH_PATH,
            Map.of("linkedin_profile_url", String.join(",", params.linkedinUrls())));
    }

    public static RequestDescriptor buildSocialPostsRequest(GetSocialPostsInput params) {
        final Map<String, String> query = new LinkedHashMap<>();
        query.put("person_linkedin_url", params.personLinkedinUrl());
        query.put("page", String.valueOf(params.page()));
        return RequestDescriptor.get(SOCIAL_POSTS_PATH, query);
    }

    /**
     * POST /screener/person/search; filters keep caller order and lose null-valued keys.
     */
    public static RequestDescriptor buildSearchPeopleRequest(SearchPeopleInput params) {
        final List<Map<String, Object>> filters = params.filters().stream()
            .map(PersonSearchFilter::toMap)
            .toList();

        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("filters", filters);
        body.put("page", params.page());
        return RequestDescriptor.post(SEARCH_PATH, null, Collections.unmodifiableMap(body));
    }
}
