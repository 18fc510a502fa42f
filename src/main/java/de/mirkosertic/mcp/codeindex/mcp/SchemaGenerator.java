package de.mirkosertic.mcp.codeindex.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives the JSON schema of a tool's input from its request record.
 * <p>
 * Components annotated with {@link Nullable} are optional, all others are required. Enums are
 * listed by their lower-case names, which the request records parse case-insensitively.
 */
public final class SchemaGenerator {

    private SchemaGenerator() {
    }

    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> recordClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();
        for (final RecordComponent component : recordClass.getRecordComponents()) {
            properties.put(component.getName(), componentSchema(component));
            if (!component.isAnnotationPresent(Nullable.class)) {
                required.add(component.getName());
            }
        }
        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    /**
     * Schema for tools without parameters.
     */
    public static McpSchema.JsonSchema emptySchema() {
        return new McpSchema.JsonSchema("object", Map.of(), List.of(), null, null, null);
    }

    private static Map<String, Object> componentSchema(final RecordComponent component) {
        final Map<String, Object> schema = new LinkedHashMap<>();
        final Description description = component.getAnnotation(Description.class);
        if (description != null) {
            schema.put("description", description.value());
        }
        schema.putAll(typeSchema(component.getGenericType()));
        return schema;
    }

    static Map<String, Object> typeSchema(final Type type) {
        final Map<String, Object> schema = new LinkedHashMap<>();
        if (type instanceof ParameterizedType parameterized && parameterized.getRawType() instanceof Class<?> raw) {
            final Type[] arguments = parameterized.getActualTypeArguments();
            if (Collection.class.isAssignableFrom(raw)) {
                schema.put("type", "array");
                schema.put("items", typeSchema(arguments[0]));
            } else if (Map.class.isAssignableFrom(raw)) {
                schema.put("type", "object");
                schema.put("additionalProperties", typeSchema(arguments[1]));
            } else {
                schema.put("type", "object");
            }
            return schema;
        }
        if (!(type instanceof Class<?> clazz)) {
            schema.put("type", "string");
            return schema;
        }

        if (clazz == String.class) {
            schema.put("type", "string");
        } else if (clazz == Integer.class || clazz == int.class || clazz == Long.class || clazz == long.class) {
            schema.put("type", "integer");
        } else if (clazz == Double.class || clazz == double.class || clazz == Float.class || clazz == float.class) {
            schema.put("type", "number");
        } else if (clazz == Boolean.class || clazz == boolean.class) {
            schema.put("type", "boolean");
        } else if (clazz.isEnum()) {
            final List<String> values = new ArrayList<>();
            for (final Object constant : clazz.getEnumConstants()) {
                values.add(((Enum<?>) constant).name().toLowerCase(Locale.ROOT));
            }
            schema.put("type", "string");
            schema.put("enum", values);
        } else if (clazz.isRecord()) {
            final Map<String, Object> nested = new LinkedHashMap<>();
            for (final RecordComponent component : clazz.getRecordComponents()) {
                nested.put(component.getName(), componentSchema(component));
            }
            schema.put("type", "object");
            schema.put("properties", nested);
        } else {
            schema.put("type", "object");
        }
        return schema;
    }
}
