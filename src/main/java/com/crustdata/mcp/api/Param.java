package com.crustdata.mcp.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotates a component of a tool input record with its description, optional default and
 * validation constraints. Unset numeric constraints use negative sentinels.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.RECORD_COMPONENT, ElementType.PARAMETER})
public @interface Param {
    /** Sentinel value indicating the parameter is required (no default). */
    String REQUIRED = "\0__REQUIRED__";

    /** Parameter description shown to MCP clients. */
    String value();

    /** Default value as a string, or {@link #REQUIRED} if the parameter is required. */
    String defaultValue() default "\0__REQUIRED__";

    /** Strip leading and trailing whitespace from string values (and string list items). */
    boolean trim() default true;

    int minLength() default -1;

    int maxLength() default -1;

    int minItems() default -1;

    int maxItems() default -1;

    long minimum() default Long.MIN_VALUE;

    /** Enumerated values accepted for strings or string list items. Empty means unrestricted. */
    String[] allowedValues() default {};

    /** Regular expression a string value must fully match. Empty means unrestricted. */
    String pattern() default "";
}
