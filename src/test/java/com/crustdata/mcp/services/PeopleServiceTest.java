package com.crustdata.mcp.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.crustdata.mcp.api.ApiHandlerRegistry;
import com.crustdata.mcp.api.ValidationException;
import com.crustdata.mcp.client.CrustdataTransport;
import com.crustdata.mcp.model.StatusOutput;
import com.crustdata.mcp.model.input.EnrichPersonInput;
import com.crustdata.mcp.model.input.GetSocialPostsInput;
import com.crustdata.mcp.model.input.PersonSearchFilter;
import com.crustdata.mcp.model.input.SearchPeopleInput;
import com.crustdata.mcp.model.request.HttpMethod;
import com.crustdata.mcp.model.request.RequestDescriptor;
import com.crustdata.mcp.telemetry.TelemetryLogger;

@ExtendWith(MockitoExtension.class)
class PeopleServiceTest {

    private static final String PROFILE_A = "https://www.linkedin.com/in/satyanadella/";
    private static final String PROFILE_B = "https://www.linkedin.com/in/jeffweiner08/";

    @Mock
    private CrustdataTransport mockTransport;

    private ApiHandlerRegistry registry;

    @BeforeEach
    void setUp() {
        lenient().when(mockTransport.execute(any())).thenReturn(StatusOutput.ok("sent"));
        registry = new ApiHandlerRegistry(null, TelemetryLogger.disabled(), new PeopleService(mockTransport));
    }

    private RequestDescriptor call(String toolName, Map<String, Object> arguments) {
        registry.callTool(toolName, arguments);
        ArgumentCaptor<RequestDescriptor> captor = ArgumentCaptor.forClass(RequestDescriptor.class);
        verify(mockTransport).execute(captor.capture());
        return captor.getValue();
    }

    private ValidationException reject(String toolName, Map<String, Object> arguments) {
        ValidationException e = assertThrows(ValidationException.class, () -> registry.callTool(toolName, arguments));
        verify(mockTransport, never()).execute(any());
        return e;
    }

    private static Map<String, Object> filter(String filterType, String type, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("filter_type", filterType);
        map.put("type", type);
        map.put("value", value);
        return map;
    }

    // =========================================================================
    // crustdata_enrich_person
    // =========================================================================

    @Test
    void testEnrichPerson_SingleUrl() {
        RequestDescriptor request = call("crustdata_enrich_person", Map.of("linkedin_urls", List.of(PROFILE_A)));

        assertEquals(HttpMethod.GET, request.method());
        assertEquals("/screener/person/enrich", request.path());
        assertEquals(Map.of("linkedin_profile_url", PROFILE_A), request.query());
        assertNull(request.body());
    }

    @Test
    @DisplayName("enrich joins URLs with commas in caller order")
    void testEnrichPerson_CommaJoinsInOrder() {
        RequestDescriptor request = call("crustdata_enrich_person",
            Map.of("linkedin_urls", List.of(PROFILE_B, PROFILE_A)));

        assertEquals(PROFILE_B + "," + PROFILE_A, request.query().get("linkedin_profile_url"));
    }

    @Test
    void testEnrichPerson_TrimsUrls() {
        RequestDescriptor request = call("crustdata_enrich_person",
            Map.of("linkedin_urls", List.of("  " + PROFILE_A + "\t")));

        assertEquals(PROFILE_A, request.query().get("linkedin_profile_url"));
    }

    @Test
    void testEnrichPerson_AcceptsTwentyFiveUrls() {
        List<String> urls = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            urls.add("https://www.linkedin.com/in/person" + i + "/");
        }

        RequestDescriptor request = call("crustdata_enrich_person", Map.of("linkedin_urls", urls));

        assertEquals(String.join(",", urls), request.query().get("linkedin_profile_url"));
    }

    @Test
    void testEnrichPerson_RejectsTwentySixUrls() {
        List<String> urls = new ArrayList<>();
        for (int i = 0; i < 26; i++) {
            urls.add("https://www.linkedin.com/in/person" + i + "/");
        }

        ValidationException e = reject("crustdata_enrich_person", Map.of("linkedin_urls", urls));
        assertEquals(List.of("linkedin_urls: must contain at most 25 item(s)"), e.getViolations());
    }

    @Test
    void testEnrichPerson_RejectsEmptyList() {
        ValidationException e = reject("crustdata_enrich_person", Map.of("linkedin_urls", List.of()));
        assertEquals(List.of("linkedin_urls: must contain at least 1 item(s)"), e.getViolations());
    }

    @Test
    void testEnrichPerson_RejectsMissingField() {
        ValidationException e = reject("crustdata_enrich_person", Map.of());
        assertEquals(List.of("linkedin_urls: field required"), e.getViolations());
    }

    @Test
    void testEnrichPerson_RejectsStringInsteadOfList() {
        ValidationException e = reject("crustdata_enrich_person", Map.of("linkedin_urls", PROFILE_A));
        assertEquals(List.of("linkedin_urls: expected array"), e.getViolations());
    }

    @Test
    void testEnrichPerson_RejectsNonStringItem() {
        ValidationException e = reject("crustdata_enrich_person", Map.of("linkedin_urls", List.of(PROFILE_A, 42)));
        assertEquals(List.of("linkedin_urls[1]: expected string"), e.getViolations());
    }

    // =========================================================================
    // crustdata_get_social_posts
    // =========================================================================

    @Test
    void testGetSocialPosts_DefaultPage() {
        RequestDescriptor request = call("crustdata_get_social_posts",
            Map.of("person_linkedin_url", PROFILE_A));

        assertEquals(HttpMethod.GET, request.method());
        assertEquals("/screener/social_posts", request.path());
        assertEquals(List.of("person_linkedin_url", "page"), new ArrayList<>(request.query().keySet()));
        assertEquals(PROFILE_A, request.query().get("person_linkedin_url"));
        assertEquals("1", request.query().get("page"));
        assertFalse(request.hasBody());
    }

    @Test
    void testGetSocialPosts_ExplicitPage() {
        RequestDescriptor request = call("crustdata_get_social_posts",
            Map.of("person_linkedin_url", PROFILE_A, "page", 3));

        assertEquals("3", request.query().get("page"));
    }

    @Test
    void testGetSocialPosts_RejectsPageZero() {
        ValidationException e = reject("crustdata_get_social_posts",
            Map.of("person_linkedin_url", PROFILE_A, "page", 0));
        assertEquals(List.of("page: must be greater than or equal to 1"), e.getViolations());
    }

    @Test
    @DisplayName("page given as a string is not coerced")
    void testGetSocialPosts_RejectsStringPage() {
        ValidationException e = reject("crustdata_get_social_posts",
            Map.of("person_linkedin_url", PROFILE_A, "page", "2"));
        assertEquals(List.of("page: expected integer"), e.getViolations());
    }

    @Test
    void testGetSocialPosts_RejectsMissingUrl() {
        ValidationException e = reject("crustdata_get_social_posts", Map.of("page", 2));
        assertEquals(List.of("person_linkedin_url: field required"), e.getViolations());
    }

    // =========================================================================
    // crustdata_search_people
    // =========================================================================

    @Test
    @SuppressWarnings("unchecked")
    void testSearchPeople_SingleFilter() {
        Map<String, Object> f = filter("CURRENT_COMPANY", "in", List.of("Google"));

        RequestDescriptor request = call("crustdata_search_people", Map.of("filters", List.of(f)));

        assertEquals(HttpMethod.POST, request.method());
        assertEquals("/screener/person/search", request.path());
        assertTrue(request.query().isEmpty());

        Map<String, Object> body = (Map<String, Object>) request.body();
        assertEquals(List.of("filters", "page"), new ArrayList<>(body.keySet()));
        assertEquals(List.of(f), body.get("filters"));
        assertEquals(1, body.get("page"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testSearchPeople_PreservesFilterOrderAndPage() {
        Map<String, Object> first = filter("CURRENT_TITLE", "in", List.of("CTO"));
        Map<String, Object> second = filter("REGION", "not in", List.of("France"));

        RequestDescriptor request = call("crustdata_search_people",
            Map.of("filters", List.of(first, second), "page", 4));

        Map<String, Object> body = (Map<String, Object>) request.body();
        assertEquals(List.of(first, second), body.get("filters"));
        assertEquals(4, body.get("page"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testSearchPeople_PassesExtraFilterKeysThrough() {
        Map<String, Object> f = filter("COMPANY_HEADCOUNT", "in", List.of("11-50"));
        f.put("sub_filter", "exact");

        RequestDescriptor request = call("crustdata_search_people", Map.of("filters", List.of(f)));

        List<Map<String, Object>> filters = (List<Map<String, Object>>) ((Map<String, Object>) request.body())
            .get("filters");
        assertEquals(List.of("filter_type", "type", "value", "sub_filter"), new ArrayList<>(filters.get(0).keySet()));
        assertEquals("exact", filters.get(0).get("sub_filter"));
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("the built request does not change when the caller later edits its filter values")
    void testSearchPeople_DescriptorIndependentOfCallerLists() {
        List<Object> companies = new ArrayList<>(List.of("Google"));
        Map<String, Object> f = filter("CURRENT_COMPANY", "in", companies);

        RequestDescriptor request = call("crustdata_search_people", Map.of("filters", List.of(f)));
        companies.add("Meta");
        f.put("sub_filter", "late");

        List<Map<String, Object>> filters = (List<Map<String, Object>>) ((Map<String, Object>) request.body())
            .get("filters");
        assertEquals(Map.of("filter_type", "CURRENT_COMPANY", "type", "in", "value", List.of("Google")),
            filters.get(0));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testSearchPeople_NullValueDropped() {
        Map<String, Object> f = filter("RECENTLY_CHANGED_JOBS", "in", null);

        RequestDescriptor request = call("crustdata_search_people", Map.of("filters", List.of(f)));

        List<Map<String, Object>> filters = (List<Map<String, Object>>) ((Map<String, Object>) request.body())
            .get("filters");
        assertEquals(Map.of("filter_type", "RECENTLY_CHANGED_JOBS", "type", "in"), filters.get(0));
    }

    @Test
    void testSearchPeople_RejectsEmptyFilters() {
        ValidationException e = reject("crustdata_search_people", Map.of("filters", List.of()));
        assertEquals(List.of("filters: must contain at least 1 item(s)"), e.getViolations());
    }

    @Test
    void testSearchPeople_ReportsFilterViolationsByIndex() {
        Map<String, Object> missingValue = new HashMap<>();
        missingValue.put("filter_type", "INDUSTRY");
        missingValue.put("type", "in");

        ValidationException e = reject("crustdata_search_people",
            Map.of("filters", List.of(filter("INDUSTRY", "in", List.of("Software")), missingValue, "oops")));

        assertEquals(List.of("filters[1].value: field required", "filters[2]: expected object"), e.getViolations());
    }

    // =========================================================================
    // Request builders
    // =========================================================================

    @Test
    void testBuilders_AreDeterministic() {
        SearchPeopleInput input = new SearchPeopleInput(
            List.of(new PersonSearchFilter("CURRENT_COMPANY", "in", List.of("Google"))), 2);

        assertEquals(PeopleService.buildSearchPeopleRequest(input), PeopleService.buildSearchPeopleRequest(input));
        assertEquals(
            PeopleService.buildEnrichPersonRequest(new EnrichPersonInput(List.of(PROFILE_A))),
            PeopleService.buildEnrichPersonRequest(new EnrichPersonInput(List.of(PROFILE_A))));
    }

    @Test
    void testBuildSocialPostsRequest_PageAsString() {
        RequestDescriptor request = PeopleService.buildSocialPostsRequest(new GetSocialPostsInput(PROFILE_B, 12));

        assertEquals(Map.of("person_linkedin_url", PROFILE_B, "page", "12"), request.query());
    }
}
