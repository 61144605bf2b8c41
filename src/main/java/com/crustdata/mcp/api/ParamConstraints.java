package com.crustdata.mcp.api;

import java.util.List;

/**
 * Field-level constraints read from a {@link Param} annotation.
 */
public record ParamConstraints(
    boolean trim,
    int minLength,
    int maxLength,
    int minItems,
    int maxItems,
    long minimum,
    List<String> allowedValues,
    String pattern
) {
    public static final ParamConstraints NONE =
        new ParamConstraints(true, -1, -1, -1, -1, Long.MIN_VALUE, List.of(), "");

    public ParamConstraints {
        allowedValues = List.copyOf(allowedValues);
        pattern = pattern == null ? "" : pattern;
    }

    public static ParamConstraints from(final Param param) {
        return new ParamConstraints(param.trim(), param.minLength(), param.maxLength(),
            param.minItems(), param.maxItems(), param.minimum(), List.of(param.allowedValues()), param.pattern());
    }

    public boolean hasMinimum() {
        return minimum != Long.MIN_VALUE;
    }

    public boolean hasPattern() {
        return !pattern.isEmpty();
    }
}
