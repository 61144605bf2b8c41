package com.crustdata.mcp.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.reflect.Method;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.crustdata.mcp.model.StatusOutput;
import com.crustdata.mcp.model.ToolOutput;
import com.crustdata.mcp.model.input.GetSocialPostsInput;
import com.crustdata.mcp.model.input.WebSearchInput;
import com.crustdata.mcp.services.PeopleService;
import com.crustdata.mcp.services.WebService;

class ToolDefTest {

    // =========================================================================
    // Test helper tools
    // =========================================================================

    record LookupInput(
        @Param(value = "Name to look up", minLength = 2) String name,
        @Param(value = "How many results", defaultValue = "5", minimum = 1) int limit,
        @Param("Optional tag") Optional<String> tag
    ) {}

    record UnannotatedInput(String name) {}

    @SuppressWarnings("unused")
    static class TestTools {
        @McpTool(description = "Look something up")
        private ToolOutput lookupThing(LookupInput input) {
            return StatusOutput.ok(input.name() + ":" + input.limit() + ":" + input.tag().orElse("-"));
        }

        @McpTool(name = "custom_name", title = "Custom", description = "Tool with custom name",
            readOnly = false, idempotent = false)
        private ToolOutput renamed(LookupInput input) {
            return StatusOutput.ok("custom");
        }

        @McpTool(description = "Takes a plain string")
        private ToolOutput plainString(String value) {
            return StatusOutput.ok(value);
        }

        @McpTool(description = "Returns a string")
        private String wrongReturn(LookupInput input) {
            return "nope";
        }

        @McpTool(description = "Input lacks @Param")
        private ToolOutput unannotated(UnannotatedInput input) {
            return StatusOutput.ok("x");
        }

        @McpTool(description = "Always fails")
        private ToolOutput failing(LookupInput input) {
            throw new IllegalStateException("boom");
        }
    }

    private static ToolDef toolFor(Object target, String methodName, Class<?> inputType) throws Exception {
        Method method = target.getClass().getDeclaredMethod(methodName, inputType);
        return ToolDef.fromMethod(target, method, method.getAnnotation(McpTool.class));
    }

    // =========================================================================
    // fromMethod
    // =========================================================================

    @Test
    void testFromMethod_DerivesSnakeCaseName() throws Exception {
        ToolDef def = toolFor(new TestTools(), "lookupThing", LookupInput.class);

        assertEquals("lookup_thing", def.getName());
        assertEquals(LookupInput.class, def.getInputType());
        assertEquals(3, def.getParams().size());
    }

    @Test
    void testFromMethod_CustomNameAndHints() throws Exception {
        ToolDef def = toolFor(new TestTools(), "renamed", LookupInput.class);

        assertEquals("custom_name", def.getName());
        assertEquals("Custom", def.getTitle());
        assertFalse(def.isReadOnly());
        assertFalse(def.isIdempotent());
        assertFalse(def.isDestructive());
        assertTrue(def.isOpenWorld());
    }

    @Test
    void testFromMethod_ParamDefinitions() throws Exception {
        ToolDef def = toolFor(new TestTools(), "lookupThing", LookupInput.class);

        ToolParamDef name = def.getParams().get(0);
        assertEquals("name", name.name());
        assertEquals(ParamType.STRING, name.type());
        assertTrue(name.required());

        ToolParamDef limit = def.getParams().get(1);
        assertEquals(ParamType.INTEGER, limit.type());
        assertFalse(limit.required());
        assertEquals(5, limit.defaultValue());

        ToolParamDef tag = def.getParams().get(2);
        assertFalse(tag.required());
        assertTrue(tag.optionalWrapper());
    }

    @Test
    void testFromMethod_WebSearchInputUsesWireNames() throws Exception {
        ToolDef def = toolFor(new WebService(null), "webSearch", WebSearchInput.class);

        List<String> names = def.getParams().stream().map(ToolParamDef::name).toList();
        assertEquals(List.of("query", "geolocation", "sources", "site", "start_date", "end_date", "fetch_content"),
            names);
        assertEquals(ParamType.STRING_LIST, def.getParams().get(2).type());
        assertEquals(ParamType.LONG, def.getParams().get(4).type());
        assertEquals(false, def.getParams().get(6).defaultValue());
    }

    @Test
    void testFromMethod_RejectsNonRecordInput() throws Exception {
        Method method = TestTools.class.getDeclaredMethod("plainString", String.class);
        assertThrows(IllegalArgumentException.class,
            () -> ToolDef.fromMethod(new TestTools(), method, method.getAnnotation(McpTool.class)));
    }

    @Test
    void testFromMethod_RejectsNonToolOutputReturn() throws Exception {
        Method method = TestTools.class.getDeclaredMethod("wrongReturn", LookupInput.class);
        assertThrows(IllegalArgumentException.class,
            () -> ToolDef.fromMethod(new TestTools(), method, method.getAnnotation(McpTool.class)));
    }

    @Test
    void testFromMethod_RejectsComponentWithoutParam() throws Exception {
        Method method = TestTools.class.getDeclaredMethod("unannotated", UnannotatedInput.class);
        assertThrows(IllegalArgumentException.class,
            () -> ToolDef.fromMethod(new TestTools(), method, method.getAnnotation(McpTool.class)));
    }

    // =========================================================================
    // validate / call
    // =========================================================================

    @Test
    @DisplayName("validate applies defaults and wraps optional values")
    void testValidate_DefaultsAndOptionals() throws Exception {
        ToolDef def = toolFor(new TestTools(), "lookupThing", LookupInput.class);

        LookupInput input = (LookupInput) def.validate(Map.of("name", "  alice  "));

        assertEquals("alice", input.name());
        assertEquals(5, input.limit());
        assertEquals(Optional.empty(), input.tag());
    }

    @Test
    @DisplayName("validate reports every violation at once")
    void testValidate_AggregatesViolations() throws Exception {
        ToolDef def = toolFor(new TestTools(), "lookupThing", LookupInput.class);

        ValidationException e = assertThrows(ValidationException.class,
            () -> def.validate(Map.of("limit", 0, "tag", 7)));

        assertEquals("lookup_thing", e.getToolName());
        assertEquals(List.of(
            "name: field required",
            "limit: must be greater than or equal to 1",
            "tag: expected string"), e.getViolations());
        assertTrue(e.getMessage().startsWith("Invalid input for lookup_thing: name: field required"));
    }

    @Test
    void testValidate_NullArgumentsTreatedAsEmpty() throws Exception {
        ToolDef def = toolFor(new TestTools(), "lookupThing", LookupInput.class);

        ValidationException e = assertThrows(ValidationException.class, () -> def.validate(null));
        assertEquals(List.of("name: field required"), e.getViolations());
    }

    @Test
    void testValidate_ExplicitNullForDefaultedFieldRejected() throws Exception {
        ToolDef def = toolFor(new PeopleService(null), "getSocialPosts", GetSocialPostsInput.class);

        HashMap<String, Object> args = new HashMap<>();
        args.put("person_linkedin_url", "https://www.linkedin.com/in/someone/");
        args.put("page", null);

        ValidationException e = assertThrows(ValidationException.class, () -> def.validate(args));
        assertEquals(List.of("page: must not be null"), e.getViolations());
    }

    @Test
    void testValidate_UnknownKeysIgnored() throws Exception {
        ToolDef def = toolFor(new TestTools(), "lookupThing", LookupInput.class);

        LookupInput input = (LookupInput) def.validate(Map.of("name", "bob", "unexpected", true));
        assertEquals("bob", input.name());
    }

    @Test
    void testCall_InvokesHandler() throws Exception {
        ToolDef def = toolFor(new TestTools(), "lookupThing", LookupInput.class);

        ToolOutput output = def.call(Map.of("name", "carol", "limit", 2, "tag", "x"));

        assertInstanceOf(StatusOutput.class, output);
        assertEquals("carol:2:x", output.toDisplayText());
    }

    @Test
    void testCall_PropagatesHandlerRuntimeException() throws Exception {
        ToolDef def = toolFor(new TestTools(), "failing", LookupInput.class);

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> def.call(Map.of("name", "dave")));
        assertEquals("boom", e.getMessage());
    }

    // =========================================================================
    // JSON Schema generation
    // =========================================================================

    @Test
    void testToInputSchemaJson_Constraints() throws Exception {
        ToolDef def = toolFor(new TestTools(), "lookupThing", LookupInput.class);

        String schema = def.toInputSchemaJson();
        assertTrue(schema.startsWith("{\"type\":\"object\",\"properties\":{"));
        assertTrue(schema.contains("\"minLength\":2"));
        assertTrue(schema.contains("\"minimum\":1"));
        assertTrue(schema.contains("\"default\":5"));
        assertTrue(schema.contains("\"required\":[\"name\"]"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testToInputSchemaMap_WebSearchEnums() throws Exception {
        ToolDef def = toolFor(new WebService(null), "webSearch", WebSearchInput.class);

        Map<String, Object> properties = (Map<String, Object>) def.toInputSchemaMap().get("properties");
        Map<String, Object> query = (Map<String, Object>) properties.get("query");
        assertEquals(1000, query.get("maxLength"));

        Map<String, Object> sources = (Map<String, Object>) properties.get("sources");
        assertEquals("array", sources.get("type"));
        Map<String, Object> items = (Map<String, Object>) sources.get("items");
        assertEquals(List.of("news", "web", "scholar-articles", "scholar-articles-enriched", "scholar-author"),
            items.get("enum"));

        Map<String, Object> geolocation = (Map<String, Object>) properties.get("geolocation");
        assertEquals("^[A-Za-z]{2}$", geolocation.get("pattern"));
        assertFalse(geolocation.containsKey("enum"));

        assertEquals(List.of("query"), def.toInputSchemaMap().get("required"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testToToolMap_Structure() throws Exception {
        ToolDef def = toolFor(new PeopleService(null), "getSocialPosts", GetSocialPostsInput.class);

        Map<String, Object> tool = def.toToolMap();
        assertEquals("crustdata_get_social_posts", tool.get("name"));
        assertEquals("Get Social Posts", tool.get("title"));
        assertNotNull(tool.get("inputSchema"));
        assertNotNull(tool.get("outputSchema"));

        Map<String, Object> hints = (Map<String, Object>) tool.get("annotations");
        assertEquals(true, hints.get("readOnlyHint"));
        assertEquals(false, hints.get("destructiveHint"));
        assertEquals(true, hints.get("idempotentHint"));
        assertEquals(true, hints.get("openWorldHint"));
    }

    @Test
    void testToToolJson_NoOutputSchemaWithoutResponseType() throws Exception {
        ToolDef def = toolFor(new TestTools(), "lookupThing", LookupInput.class);

        String json = def.toToolJson();
        assertTrue(json.contains("\"name\":\"lookup_thing\""));
        assertFalse(json.contains("\"outputSchema\""));
        assertFalse(json.contains("\"title\""));
    }

    @Test
    void testDescriptionIncludesAutoParameters() throws Exception {
        ToolDef def = toolFor(new TestTools(), "lookupThing", LookupInput.class);

        String desc = def.getDescription();
        assertTrue(desc.startsWith("Look something up"));
        assertTrue(desc.contains("Parameters:"));
        assertTrue(desc.contains("name: Name to look up"));
        assertTrue(desc.contains("limit: How many results (default: 5)"));
    }
}
