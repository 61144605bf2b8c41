package com.crustdata.mcp.api;

import java.util.Map;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.victools.jsonschema.generator.Option;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfig;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import com.github.victools.jsonschema.module.jackson.JacksonModule;
import com.github.victools.jsonschema.module.jackson.JacksonOption;
import com.crustdata.mcp.utils.Json;

/**
 * Generates JSON Schema from Java record types using victools/jsonschema-generator.
 * Used to derive the outputSchema of each tool in /mcp/tools.
 */
public final class SchemaGenerator {
    private static final com.github.victools.jsonschema.generator.SchemaGenerator GENERATOR;

    static {
        final JacksonModule jacksonModule = new JacksonModule(JacksonOption.RESPECT_JSONPROPERTY_REQUIRED);
        final SchemaGeneratorConfigBuilder configBuilder =
            new SchemaGeneratorConfigBuilder(SchemaVersion.DRAFT_2020_12, OptionPreset.PLAIN_JSON)
                .with(jacksonModule)
                .with(Option.FORBIDDEN_ADDITIONAL_PROPERTIES_BY_DEFAULT);
        // Apply snake_case naming to schema properties to match Jackson serialization
        configBuilder.forFields()
            .withPropertyNameOverrideResolver(field ->
                Json.toSnakeCase(field.getDeclaredName()));
        final SchemaGeneratorConfig config = configBuilder.build();
        GENERATOR = new com.github.victools.jsonschema.generator.SchemaGenerator(config);
    }

    private SchemaGenerator() {}

    /**
     * Generate a JSON Schema for a response record type.
     *
     * @param responseType the record type (or Void.class for no schema)
     * @return the schema as a map ready for Jackson serialization, or null if responseType is Void
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> generateSchema(final Class<?> responseType) {
        if (responseType == Void.class || responseType == void.class) {
            return null;
        }
        final ObjectNode schema = GENERATOR.generateSchema(responseType);
        return Json.convertValue(schema, Map.class);
    }
}
