package de.mirkosertic.mcp.codeindex.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.spec.McpSchema;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.List;

/**
 * Turns response records into MCP tool results.
 * <p>
 * A response whose {@code success} component is false is flagged as an error result.
 */
public final class ToolResultHelper {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ToolResultHelper() {
    }

    public static McpSchema.CallToolResult createResult(final Object response) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(response))))
                .isError(!isSuccess(response))
                .build();
    }

    public static McpSchema.CallToolResult createErrorResult(final String errorMessage) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(errorJson(errorMessage))))
                .isError(true)
                .build();
    }

    public static String toJson(final Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (final JsonProcessingException e) {
            return errorJson("JSON serialization error: " + e.getOriginalMessage());
        }
    }

    private static String errorJson(final String message) {
        final ObjectNode node = OBJECT_MAPPER.createObjectNode();
        node.put("success", false);
        node.put("error", message != null ? message : "");
        return node.toString();
    }

    static boolean isSuccess(final Object response) {
        if (!(response instanceof Record record)) {
            return true;
        }
        for (final RecordComponent component : record.getClass().getRecordComponents()) {
            if ("success".equals(component.getName())) {
                try {
                    return !Boolean.FALSE.equals(component.getAccessor().invoke(record));
                } catch (final IllegalAccessException | InvocationTargetException e) {
                    return true;
                }
            }
        }
        return true;
    }
}
