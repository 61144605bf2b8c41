package com.crustdata.mcp.model.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One people-search filter. The documented keys are typed; any further keys the caller supplies
 * are kept in {@link #getExtras()} in their original order and passed through to the API.
 */
public final class PersonSearchFilter {
    public static final String FILTER_TYPE = "filter_type";
    public static final String TYPE = "type";
    public static final String VALUE = "value";

    private final String filterType;
    private final String type;
    private final Object value;
    private final Map<String, Object> extras;

    public PersonSearchFilter(final String filterType, final String type, final Object value,
                              final Map<String, Object> extras) {
        this.filterType = Objects.requireNonNull(filterType, FILTER_TYPE);
        this.type = Objects.requireNonNull(type, TYPE);
        this.value = copyJson(value);
        if (extras == null) {
            this.extras = Map.of();
        } else {
            final Map<String, Object> copy = new LinkedHashMap<>();
            extras.forEach((k, v) -> copy.put(k, copyJson(v)));
            this.extras = Collections.unmodifiableMap(copy);
        }
    }

    public PersonSearchFilter(final String filterType, final String type, final Object value) {
        this(filterType, type, value, null);
    }

    /**
     * Validate a JSON-decoded filter object.
     *
     * @param raw        the decoded value, expected to be a JSON object
     * @param path       field path used in violation messages, e.g. {@code filters[0]}
     * @param violations sink for violation messages
     * @return the filter, or null if any violation was recorded
     */
    public static PersonSearchFilter fromMap(final Object raw, final String path, final List<String> violations) {
        if (!(raw instanceof Map<?, ?> map)) {
            violations.add(path + ": expected object");
            return null;
        }

        final int before = violations.size();
        final String filterType = requireString(map, FILTER_TYPE, path, violations);
        final String type = requireString(map, TYPE, path, violations);
        if (!map.containsKey(VALUE)) {
            violations.add(path + "." + VALUE + ": field required");
        }
        if (violations.size() > before) {
            return null;
        }

        final Map<String, Object> extras = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : map.entrySet()) {
            final String key = String.valueOf(entry.getKey());
            if (!key.equals(FILTER_TYPE) && !key.equals(TYPE) && !key.equals(VALUE)) {
                extras.put(key, entry.getValue());
            }
        }
        return new PersonSearchFilter(filterType, type, map.get(VALUE), extras);
    }

    /**
     * Unmodifiable deep copy of a decoded JSON value. Lists and objects may hold nulls.
     */
    static Object copyJson(final Object value) {
        if (value instanceof Map<?, ?> map) {
            final Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), copyJson(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            final List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyJson(item)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static String requireString(final Map<?, ?> map, final String key, final String path,
                                        final List<String> violations) {
        final Object raw = map.get(key);
        if (raw == null) {
            violations.add(path + "." + key + ": field required");
            return null;
        }
        if (!(raw instanceof String s)) {
            violations.add(path + "." + key + ": expected string");
            return null;
        }
        return s;
    }

    /**
     * Wire representation: documented keys first, then extras, with null-valued entries dropped.
     */
    public Map<String, Object> toMap() {
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put(FILTER_TYPE, filterType);
        map.put(TYPE, type);
        if (value != null) {
            map.put(VALUE, value);
        }
        extras.forEach((k, v) -> {
            if (v != null) map.put(k, v);
        });
        return Collections.unmodifiableMap(map);
    }

    /**
     * JSON Schema for a single filter object. Additional properties are allowed.
     */
    public static Map<String, Object> itemSchema() {
        final Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(FILTER_TYPE, Map.of("type", "string",
            "description", "Filter type (e.g. 'CURRENT_COMPANY', 'CURRENT_TITLE', 'SENIORITY_LEVEL', 'INDUSTRY')"));
        properties.put(TYPE, Map.of("type", "string",
            "description", "Operation type: 'in' or 'not in'"));
        properties.put(VALUE, Map.of("description", "Filter value(s) as a list"));

        final Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", List.of(FILTER_TYPE, TYPE, VALUE));
        schema.put("additionalProperties", true);
        return schema;
    }

    public String getFilterType() {
        return filterType;
    }

    public String getType() {
        return type;
    }

    public Object getValue() {
        return value;
    }

    public Map<String, Object> getExtras() {
        return extras;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof PersonSearchFilter other)) return false;
        return filterType.equals(other.filterType)
            && type.equals(other.type)
            && Objects.equals(value, other.value)
            && extras.equals(other.extras);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filterType, type, value, extras);
    }

    @Override
    public String toString() {
        return "PersonSearchFilter" + toMap();
    }
}
