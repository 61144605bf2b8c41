package com.crustdata.mcp.api;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Runtime definition of a single tool parameter, built from a @Param-annotated record component.
 */
public record ToolParamDef(
    String name,                    // snake_case wire name
    ParamType type,                 // inferred from the component type
    boolean required,               // true if neither Optional nor defaulted
    boolean optionalWrapper,        // component is declared as Optional<T>
    Object defaultValue,            // parsed default, or null
    String description,             // from @Param.value()
    ParamConstraints constraints
) {

    /**
     * Validate and normalize the raw JSON value for this parameter.
     * Violations are appended to {@code violations}; the return value is then meaningless.
     *
     * @param present whether the key was supplied at all
     * @param raw     the JSON-decoded value (may be null)
     */
    public Object bind(final boolean present, final Object raw, final List<String> violations) {
        if (raw == null) {
            if (optionalWrapper) {
                return Optional.empty();
            }
            if (present) {
                violations.add(name + ": must not be null");
                return null;
            }
            if (required) {
                violations.add(name + ": field required");
                return null;
            }
            return defaultValue;
        }

        // Blank strings and empty lists carry no intent for optional fields
        if (optionalWrapper && raw instanceof String s && s.isBlank()) return Optional.empty();
        if (optionalWrapper && raw instanceof Collection<?> c && c.isEmpty()) return Optional.empty();

        final int before = violations.size();
        final Object value = type.validate(this, raw, violations);
        if (violations.size() > before) {
            return null;
        }
        return optionalWrapper ? Optional.of(value) : value;
    }
}
