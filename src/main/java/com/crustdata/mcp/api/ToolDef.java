package com.crustdata.mcp.api;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.crustdata.mcp.model.ToolOutput;
import com.crustdata.mcp.utils.Json;

/**
 * Runtime tool definition built from an @McpTool-annotated method via reflection.
 * Owns the tool's input schema: it validates raw JSON arguments, binds them to the input
 * record and invokes the handler method.
 */
public class ToolDef {
    private final String name;              // snake_case tool name
    private final String title;
    private final String description;       // full description including auto-generated Parameters section
    private final McpTool annotation;
    private final List<ToolParamDef> params;
    private final Constructor<?> inputConstructor;
    private final Object target;
    private final Method method;

    private ToolDef(final String name, final String title, final String rawDescription, final McpTool annotation,
                    final List<ToolParamDef> params, final Constructor<?> inputConstructor,
                    final Object target, final Method method) {
        this.name = name;
        this.title = title;
        this.annotation = annotation;
        this.params = List.copyOf(params);
        this.inputConstructor = inputConstructor;
        this.target = target;
        this.method = method;
        this.description = buildFullDescription(rawDescription, params);
    }

    /**
     * Build a ToolDef from an annotated method using reflection.
     *
     * @param target the object the method is invoked on
     * @throws IllegalArgumentException if the method does not take exactly one record parameter
     *                                  or does not return a ToolOutput
     */
    public static ToolDef fromMethod(final Object target, final Method method, final McpTool annotation) {
        final String toolName = annotation.name().isEmpty()
            ? Json.toSnakeCase(method.getName())
            : annotation.name();

        if (method.getParameterCount() != 1 || !method.getParameterTypes()[0].isRecord()) {
            throw new IllegalArgumentException("Tool " + toolName + " must take a single input record");
        }
        if (!ToolOutput.class.isAssignableFrom(method.getReturnType())) {
            throw new IllegalArgumentException("Tool " + toolName + " must return a ToolOutput");
        }

        final Class<?> inputType = method.getParameterTypes()[0];
        final RecordComponent[] components = inputType.getRecordComponents();
        final Class<?>[] componentTypes = new Class<?>[components.length];
        final List<ToolParamDef> paramDefs = new ArrayList<>();
        for (int i = 0; i < components.length; i++) {
            componentTypes[i] = components[i].getType();
            paramDefs.add(paramFromComponent(toolName, components[i]));
        }

        final Constructor<?> constructor;
        try {
            constructor = inputType.getDeclaredConstructor(componentTypes);
            constructor.setAccessible(true);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("No canonical constructor on " + inputType.getName(), e);
        }
        method.setAccessible(true);

        return new ToolDef(toolName, annotation.title(), annotation.description(), annotation,
            paramDefs, constructor, target, method);
    }

    private static ToolParamDef paramFromComponent(final String toolName, final RecordComponent component) {
        final Param paramAnn = component.getAnnotation(Param.class);
        if (paramAnn == null) {
            throw new IllegalArgumentException(
                "Component " + component.getName() + " of tool " + toolName + " lacks @Param");
        }

        Type javaType = component.getGenericType();
        boolean optionalWrapper = false;
        if (javaType instanceof ParameterizedType pt && pt.getRawType() == Optional.class) {
            optionalWrapper = true;
            javaType = pt.getActualTypeArguments()[0];
        }

        final ParamType paramType = ParamType.inferFrom(javaType);
        final Object defaultValue = paramType.parseDefault(paramAnn.defaultValue());
        final boolean required = !optionalWrapper && defaultValue == null;

        return new ToolParamDef(Json.toSnakeCase(component.getName()), paramType, required, optionalWrapper,
            defaultValue, paramAnn.value(), ParamConstraints.from(paramAnn));
    }

    /**
     * Validate raw JSON-decoded arguments and bind them to this tool's input record.
     * Unknown keys are ignored.
     *
     * @throws ValidationException listing every violated constraint
     */
    public Object validate(final Map<String, Object> arguments) {
        final Map<String, Object> source = arguments != null ? arguments : Map.of();
        final List<String> violations = new ArrayList<>();
        final Object[] values = new Object[params.size()];
        for (int i = 0; i < params.size(); i++) {
            final ToolParamDef p = params.get(i);
            values[i] = p.bind(source.containsKey(p.name()), source.get(p.name()), violations);
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(name, violations);
        }

        try {
            return inputConstructor.newInstance(values);
        } catch (InstantiationException | IllegalAccessException e) {
            throw new IllegalStateException("Cannot construct input for tool " + name, e);
        } catch (InvocationTargetException e) {
            throw rethrow(e);
        }
    }

    /**
     * Validate the arguments and invoke the tool handler.
     */
    public ToolOutput call(final Map<String, Object> arguments) {
        final Object input = validate(arguments);
        try {
            return (ToolOutput) method.invoke(target, input);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot invoke tool " + name, e);
        } catch (InvocationTargetException e) {
            throw rethrow(e);
        }
    }

    private RuntimeException rethrow(final InvocationTargetException e) {
        final Throwable cause = e.getCause();
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return new IllegalStateException("Tool " + name + " failed", cause);
    }

    /**
     * Build the tool entry for the /mcp/tools listing.
     */
    public Map<String, Object> toToolMap() {
        final Map<String, Object> tool = new LinkedHashMap<>();
        tool.put("name", name);
        if (!title.isEmpty()) {
            tool.put("title", title);
        }
        tool.put("description", description);
        tool.put("inputSchema", toInputSchemaMap());

        final Map<String, Object> outputSchema = SchemaGenerator.generateSchema(annotation.responseType());
        if (outputSchema != null) {
            tool.put("outputSchema", outputSchema);
        }

        final Map<String, Object> hints = new LinkedHashMap<>();
        if (!title.isEmpty()) {
            hints.put("title", title);
        }
        hints.put("readOnlyHint", annotation.readOnly());
        hints.put("destructiveHint", annotation.destructive());
        hints.put("idempotentHint", annotation.idempotent());
        hints.put("openWorldHint", annotation.openWorld());
        tool.put("annotations", hints);
        return tool;
    }

    /**
     * Generate JSON for the /mcp/tools listing (one tool entry).
     */
    public String toToolJson() {
        return Json.serialize(toToolMap());
    }

    /**
     * Build the input schema as a Map for Jackson serialization.
     */
    public Map<String, Object> toInputSchemaMap() {
        final Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");

        if (!params.isEmpty()) {
            final Map<String, Object> properties = new LinkedHashMap<>();
            for (final ToolParamDef p : params) {
                properties.put(p.name(), p.type().toJsonSchemaMap(p));
            }
            schema.put("properties", properties);

            final List<String> required = params.stream()
                .filter(ToolParamDef::required)
                .map(ToolParamDef::name)
                .toList();
            if (!required.isEmpty()) {
                schema.put("required", required);
            }
        }

        return schema;
    }

    /**
     * Generate JSON Schema for this tool's input parameters.
     */
    public String toInputSchemaJson() {
        return Json.serialize(toInputSchemaMap());
    }

    public String getName() { return name; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public List<ToolParamDef> getParams() { return params; }
    public Class<?> getInputType() { return inputConstructor.getDeclaringClass(); }
    public boolean isReadOnly() { return annotation.readOnly(); }
    public boolean isDestructive() { return annotation.destructive(); }
    public boolean isIdempotent() { return annotation.idempotent(); }
    public boolean isOpenWorld() { return annotation.openWorld(); }

    private static String buildFullDescription(final String rawDescription, final List<ToolParamDef> params) {
        if (params.isEmpty()) return rawDescription;

        final StringBuilder sb = new StringBuilder(rawDescription);
        sb.append("\n\n    Parameters:\n");
        for (final ToolParamDef p : params) {
            sb.append("        ").append(p.name()).append(": ").append(p.description());
            if (!p.required() && p.defaultValue() != null) {
                sb.append(" (default: ").append(p.defaultValue()).append(")");
            }
            sb.append("\n");
        }
        return sb.toString().stripTrailing();
    }
}
