package com.quantpulsar.spantrace.chat;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

import static com.quantpulsar.spantrace.chat.SchemaViolation.nullToAbsent;
import static com.quantpulsar.spantrace.chat.SchemaViolation.require;

/**
 * Chat message schema, tagged by {@code role}.
 *
 * <p>Content is either a string or a list of content parts ({@code text}, {@code image_url}).
 *
 * @author Quantpulsar 2025-2026
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "role", visible = true)
@JsonSubTypes({
        @JsonSubTypes.Type(value = ChatMessage.SystemMessage.class, name = "system"),
        @JsonSubTypes.Type(value = ChatMessage.UserMessage.class, name = "user"),
        @JsonSubTypes.Type(value = ChatMessage.AssistantMessage.class, name = "assistant"),
        @JsonSubTypes.Type(value = ChatMessage.ToolMessage.class, name = "tool")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface ChatMessage {

    String role();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SystemMessage(String role, JsonNode content, String name) implements ChatMessage {
        public SystemMessage {
            content = checkContent(content, true);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record UserMessage(String role, JsonNode content, String name) implements ChatMessage {
        public UserMessage {
            content = checkContent(content, true);
        }
    }

    /** Assistant turn; carries content, tool calls or a refusal. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record AssistantMessage(String role,
                            JsonNode content,
                            String name,
                            @JsonProperty("tool_calls") List<ToolCall> toolCalls,
                            String refusal) implements ChatMessage {
        public AssistantMessage {
            content = checkContent(content, false);
            if (content == null && (toolCalls == null || toolCalls.isEmpty()) && refusal == null) {
                throw new SchemaViolation("content", "assistant message needs content, tool_calls or refusal");
            }
        }
    }

    /** Result of a tool call, answering {@code tool_call_id}. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ToolMessage(String role,
                       JsonNode content,
                       @JsonProperty("tool_call_id") String toolCallId,
                       String name) implements ChatMessage {
        public ToolMessage {
            content = checkContent(content, true);
            require(toolCallId, "tool_call_id");
        }
    }

    /** A tool invocation requested by the assistant. An absent {@code type} means {@code function}. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ToolCall(String id, String type, FunctionCall function) {
        public ToolCall {
            require(id, "id");
            if (type != null && !"function".equals(type)) {
                throw new SchemaViolation("type", "unsupported tool call type '" + type + "'");
            }
            require(function, "function");
        }
    }

    /** Function name and its JSON-encoded arguments. */
    record FunctionCall(String name, String arguments) {
        public FunctionCall {
            require(name, "name");
            if (arguments == null) {
                throw new SchemaViolation("arguments", "field required");
            }
        }
    }

    private static JsonNode checkContent(JsonNode content, boolean required) {
        content = nullToAbsent(content);
        if (content == null) {
            if (required) {
                throw new SchemaViolation("content", "field required");
            }
            return null;
        }
        if (content.isTextual()) {
            return content;
        }
        if (!content.isArray()) {
            throw new SchemaViolation("content", "must be a string or a list of content parts");
        }
        for (int i = 0; i < content.size(); i++) {
            checkContentPart(content.get(i), "content[" + i + "]");
        }
        return content;
    }

    private static void checkContentPart(JsonNode part, String path) {
        if (!part.isObject()) {
            throw new SchemaViolation(path, "content part must be an object");
        }
        String type = part.path("type").asText(null);
        if (type == null) {
            throw new SchemaViolation(path + ".type", "field required");
        }
        switch (type) {
            case "text" -> {
                if (!part.path("text").isTextual()) {
                    throw new SchemaViolation(path + ".text", "field required");
                }
            }
            case "image_url" -> {
                if (!part.path("image_url").path("url").isTextual()) {
                    throw new SchemaViolation(path + ".image_url.url", "field required");
                }
            }
            default -> throw new SchemaViolation(path + ".type", "unsupported content part type '" + type + "'");
        }
    }
}
