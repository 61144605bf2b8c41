package com.crustdata.mcp.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as an MCP tool. The method takes a single input record whose components carry
 * {@link Param} annotations, and returns a {@link com.crustdata.mcp.model.ToolOutput}.
 * Reflection discovers annotated methods at startup and registers one HTTP endpoint per tool.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface McpTool {
    /** Override tool name (empty = derive from method name via Json.toSnakeCase). */
    String name() default "";

    /** Human-readable title shown by MCP clients. */
    String title() default "";

    /** Tool description text. A Parameters: section is auto-appended from @Param annotations. */
    String description();

    boolean readOnly() default true;

    boolean destructive() default false;

    boolean idempotent() default true;

    boolean openWorld() default true;

    /** Response record type used to derive outputSchema. Void.class means no typed schema. */
    Class<?> responseType() default Void.class;
}
