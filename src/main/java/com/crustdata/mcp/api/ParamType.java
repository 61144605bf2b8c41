package com.crustdata.mcp.api;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.crustdata.mcp.model.input.PersonSearchFilter;

/**
 * Maps Java parameter types to JSON Schema types and validates raw JSON values against them.
 * Values are never coerced: a string is not accepted where an integer is declared.
 */
public enum ParamType {
    STRING("string"),
    INTEGER("integer"),
    LONG("integer"),
    BOOLEAN("boolean"),
    STRING_LIST("array"),
    FILTER_LIST("array");

    private final String jsonSchemaType;

    ParamType(String jsonSchemaType) {
        this.jsonSchemaType = jsonSchemaType;
    }

    /**
     * Infer ParamType from a Java reflection Type. Optional wrappers must be unwrapped by the caller.
     */
    public static ParamType inferFrom(Type javaType) {
        if (javaType == String.class) return STRING;
        if (javaType == int.class || javaType == Integer.class) return INTEGER;
        if (javaType == long.class || javaType == Long.class) return LONG;
        if (javaType == boolean.class || javaType == Boolean.class) return BOOLEAN;

        if (javaType instanceof ParameterizedType pt && pt.getRawType() == List.class) {
            Type item = pt.getActualTypeArguments()[0];
            if (item == String.class) return STRING_LIST;
            if (item == PersonSearchFilter.class) return FILTER_LIST;
        }

        throw new IllegalArgumentException("Unsupported tool parameter type: " + javaType.getTypeName());
    }

    /**
     * Parse a default value declared in {@link Param#defaultValue()}.
     */
    public Object parseDefault(String raw) {
        if (raw == null || raw.equals(Param.REQUIRED) || raw.isEmpty()) return null;
        return switch (this) {
            case STRING -> raw;
            case INTEGER -> Integer.parseInt(raw);
            case LONG -> Long.parseLong(raw);
            case BOOLEAN -> Boolean.parseBoolean(raw);
            case STRING_LIST, FILTER_LIST ->
                throw new IllegalArgumentException("List parameters cannot declare a default");
        };
    }

    /**
     * Validate a non-null raw value for the given parameter, returning the normalized value.
     */
    Object validate(ToolParamDef param, Object raw, List<String> violations) {
        final String name = param.name();
        final ParamConstraints c = param.constraints();
        switch (this) {
            case STRING: {
                if (!(raw instanceof String s)) {
                    violations.add(name + ": expected string");
                    return null;
                }
                return checkString(name, s, c, violations);
            }
            case INTEGER:
            case LONG: {
                final Long n = integralValue(raw);
                if (n == null) {
                    violations.add(name + ": expected integer");
                    return null;
                }
                if (this == INTEGER && (n < Integer.MIN_VALUE || n > Integer.MAX_VALUE)) {
                    violations.add(name + ": integer out of range");
                    return null;
                }
                if (c.hasMinimum() && n < c.minimum()) {
                    violations.add(name + ": must be greater than or equal to " + c.minimum());
                    return null;
                }
                return this == INTEGER ? (Object) n.intValue() : (Object) n;
            }
            case BOOLEAN: {
                if (!(raw instanceof Boolean)) {
                    violations.add(name + ": expected boolean");
                    return null;
                }
                return raw;
            }
            case STRING_LIST: {
                final List<?> items = checkList(name, raw, c, violations);
                if (items == null) return null;
                final List<String> result = new ArrayList<>(items.size());
                for (int i = 0; i < items.size(); i++) {
                    final String itemName = name + "[" + i + "]";
                    if (!(items.get(i) instanceof String s)) {
                        violations.add(itemName + ": expected string");
                        continue;
                    }
                    result.add(checkString(itemName, s, c, violations));
                }
                return List.copyOf(result);
            }
            case FILTER_LIST: {
                final List<?> items = checkList(name, raw, c, violations);
                if (items == null) return null;
                final List<PersonSearchFilter> result = new ArrayList<>(items.size());
                for (int i = 0; i < items.size(); i++) {
                    final PersonSearchFilter filter =
                        PersonSearchFilter.fromMap(items.get(i), name + "[" + i + "]", violations);
                    if (filter != null) result.add(filter);
                }
                return List.copyOf(result);
            }
            default:
                throw new IllegalStateException("Unhandled parameter type " + this);
        }
    }

    /**
     * Build the JSON Schema fragment for a parameter of this type.
     */
    public Map<String, Object> toJsonSchemaMap(ToolParamDef param) {
        final ParamConstraints c = param.constraints();
        final Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", jsonSchemaType);
        if (param.description() != null && !param.description().isEmpty()) {
            schema.put("description", param.description());
        }

        switch (this) {
            case STRING:
                putStringConstraints(schema, c);
                break;
            case INTEGER:
            case LONG:
                if (c.hasMinimum()) schema.put("minimum", c.minimum());
                break;
            case STRING_LIST: {
                final Map<String, Object> items = new LinkedHashMap<>();
                items.put("type", "string");
                putStringConstraints(items, c);
                schema.put("items", items);
                putListConstraints(schema, c);
                break;
            }
            case FILTER_LIST:
                schema.put("items", PersonSearchFilter.itemSchema());
                putListConstraints(schema, c);
                break;
            default:
                break;
        }

        if (param.defaultValue() != null) {
            schema.put("default", param.defaultValue());
        }
        return schema;
    }

    private static String checkString(String name, String raw, ParamConstraints c, List<String> violations) {
        final String value = c.trim() ? raw.strip() : raw;
        if (c.minLength() >= 0 && value.length() < c.minLength()) {
            violations.add(name + ": must be at least " + c.minLength() + " character(s) long");
        } else if (c.maxLength() >= 0 && value.length() > c.maxLength()) {
            violations.add(name + ": must be at most " + c.maxLength() + " character(s) long");
        } else if (!c.allowedValues().isEmpty() && !c.allowedValues().contains(value)) {
            violations.add(name + ": unsupported value '" + value + "'");
        } else if (c.hasPattern() && !value.matches(c.pattern())) {
            violations.add(name + ": must match pattern '" + c.pattern() + "'");
        }
        return value;
    }

    private static List<?> checkList(String name, Object raw, ParamConstraints c, List<String> violations) {
        if (!(raw instanceof List<?> items)) {
            violations.add(name + ": expected array");
            return null;
        }
        if (c.minItems() >= 0 && items.size() < c.minItems()) {
            violations.add(name + ": must contain at least " + c.minItems() + " item(s)");
            return null;
        }
        if (c.maxItems() >= 0 && items.size() > c.maxItems()) {
            violations.add(name + ": must contain at most " + c.maxItems() + " item(s)");
            return null;
        }
        return items;
    }

    private static Long integralValue(Object raw) {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof BigInteger big && big.bitLength() < 64) {
            return big.longValue();
        }
        return null;
    }

    private static void putStringConstraints(Map<String, Object> schema, ParamConstraints c) {
        if (c.minLength() >= 0) schema.put("minLength", c.minLength());
        if (c.maxLength() >= 0) schema.put("maxLength", c.maxLength());
        if (!c.allowedValues().isEmpty()) schema.put("enum", c.allowedValues());
        if (c.hasPattern()) schema.put("pattern", c.pattern());
    }

    private static void putListConstraints(Map<String, Object> schema, ParamConstraints c) {
        if (c.minItems() >= 0) schema.put("minItems", c.minItems());
        if (c.maxItems() >= 0) schema.put("maxItems", c.maxItems());
    }
}
