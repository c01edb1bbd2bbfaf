package com.quantpulsar.spantrace.chat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantpulsar.spantrace.span.InMemoryTraceSpan;
import com.quantpulsar.spantrace.span.SpanAttributeKeys;
import com.quantpulsar.spantrace.span.SpanIds;
import com.quantpulsar.spantrace.span.TraceSpan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for ChatAttributeWriter backed by the Jackson validator.
 */
class ChatAttributeWriterTest {

    private static final List<Map<String, Object>> TOOL_CALL_CONVERSATION = List.of(
            Map.of("role", "system", "content", "please use the provided tool to answer the user's questions"),
            Map.of("role", "user", "content", "what is 1 + 1?"),
            Map.of("role", "assistant", "tool_calls", List.of(Map.of(
                    "id", "123",
                    "function", Map.of("arguments", "{\"a\": 1,\"b\": 2}", "name", "add"),
                    "type", "function"))));

    private static final List<Map<String, Object>> ADD_TOOL = List.of(Map.of(
            "type", "function",
            "function", Map.of(
                    "name", "add",
                    "description", "Add two numbers",
                    "parameters", Map.of(
                            "type", "object",
                            "properties", Map.of(
                                    "a", Map.of("type", "number"),
                                    "b", Map.of("type", "number")),
                            "required", List.of("a", "b")))));

    private static final List<Map<String, Object>> CONFIDENT_BOT = List.of(
            Map.of("role", "system", "content", "you are a confident bot"),
            Map.of("role", "user", "content", "what is 1 + 1?"));

    private static final List<Map<String, Object>> ANSWER = List.of(
            Map.of("role", "assistant", "content", "it is definitely 5"));

    private ChatAttributeWriter writer;
    private TraceSpan span;

    @BeforeEach
    void setUp() {
        writer = new ChatAttributeWriter(new JacksonChatSchemaValidator(new ObjectMapper()));
        span = new InMemoryTraceSpan(SpanIds.encodeSpanId(0), "tr-123", "dummy_call");
    }

    @Test
    @DisplayName("Valid messages and tools are stored in their normalized form")
    void setMessagesAndTools_shouldStoreValidatedValues() {
        writer.setChatMessages(span, TOOL_CALL_CONVERSATION);
        writer.setChatTools(span, ADD_TOOL);

        assertThat(span.getAttribute(SpanAttributeKeys.CHAT_MESSAGES)).isEqualTo(TOOL_CALL_CONVERSATION);
        assertThat(span.getAttribute(SpanAttributeKeys.CHAT_TOOLS)).isEqualTo(ADD_TOOL);
    }

    @Test
    void setMessages_appendShouldConcatenate() {
        writer.setChatMessages(span, CONFIDENT_BOT);
        writer.setChatMessages(span, ANSWER, true);

        List<Map<String, Object>> expected = new ArrayList<>(CONFIDENT_BOT);
        expected.addAll(ANSWER);
        assertThat(span.getAttribute(SpanAttributeKeys.CHAT_MESSAGES)).isEqualTo(expected);
    }

    @Test
    void setMessages_withoutAppendShouldReplace() {
        writer.setChatMessages(span, CONFIDENT_BOT);
        writer.setChatMessages(span, ANSWER, false);

        assertThat(span.getAttribute(SpanAttributeKeys.CHAT_MESSAGES)).isEqualTo(ANSWER);
    }

    // Appending onto nothing behaves like a plain set
    @Test
    void setMessages_appendOnEmptySpan() {
        writer.setChatMessages(span, ANSWER, true);

        assertThat(span.getAttribute(SpanAttributeKeys.CHAT_MESSAGES)).isEqualTo(ANSWER);
    }

    @Test
    void setMessages_appendShouldReplaceNonListValue() {
        span.setAttribute(SpanAttributeKeys.CHAT_MESSAGES, "garbage");

        writer.setChatMessages(span, ANSWER, true);

        assertThat(span.getAttribute(SpanAttributeKeys.CHAT_MESSAGES)).isEqualTo(ANSWER);
    }

    @Test
    @DisplayName("A message without a role is rejected and the span keeps its value")
    void setMessages_missingRoleShouldFail() {
        writer.setChatMessages(span, CONFIDENT_BOT);

        assertThatThrownBy(() -> writer.setChatMessages(span, List.of(Map.of("invalid_field", "user", "content", "hello"))))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("validation error for ChatMessage")
                .satisfies(e -> {
                    SchemaValidationException error = (SchemaValidationException) e;
                    assertThat(error.getSchema()).isEqualTo("ChatMessage");
                    assertThat(error.getIndex()).isZero();
                    assertThat(error.getField()).isEqualTo("role");
                });
        assertThat(span.getAttribute(SpanAttributeKeys.CHAT_MESSAGES)).isEqualTo(CONFIDENT_BOT);
    }

    @Test
    @DisplayName("One invalid element rejects the whole batch")
    void setMessages_shouldBeAllOrNothing() {
        List<Map<String, Object>> batch = List.of(
                Map.of("role", "user", "content", "hi"),
                Map.of("role", "wizard", "content", "abracadabra"));

        assertThatThrownBy(() -> writer.setChatMessages(span, batch, true))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("unsupported value 'wizard'")
                .extracting(e -> ((SchemaValidationException) e).getIndex())
                .isEqualTo(1);
        assertThat(span.getAttribute(SpanAttributeKeys.CHAT_MESSAGES)).isNull();
    }

    @Test
    @DisplayName("An unsupported tool type is rejected and the span is untouched")
    void setTools_unsupportedTypeShouldFail() {
        List<Map<String, Object>> tools = List.of(Map.of(
                "type", "unsupported_function",
                "unsupported_function", Map.of("name", "test")));

        assertThatThrownBy(() -> writer.setChatTools(span, tools))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("validation error for ChatTool")
                .extracting(e -> ((SchemaValidationException) e).getField())
                .isEqualTo("type");
        assertThat(span.getAttribute(SpanAttributeKeys.CHAT_TOOLS)).isNull();
    }

    @Test
    @DisplayName("A rejected tool write keeps the tools already on the span")
    void setTools_failedWriteShouldKeepPreviousTools() {
        writer.setChatTools(span, ADD_TOOL);
        List<Map<String, Object>> tools = List.of(Map.of(
                "type", "unsupported_function",
                "unsupported_function", Map.of("name", "test")));

        assertThatThrownBy(() -> writer.setChatTools(span, tools))
                .isInstanceOf(SchemaValidationException.class);
        assertThat(span.getAttribute(SpanAttributeKeys.CHAT_TOOLS)).isEqualTo(ADD_TOOL);
    }

    @Test
    void setTools_shouldReplaceExisting() {
        writer.setChatTools(span, ADD_TOOL);
        writer.setChatTools(span, List.of());

        assertThat(span.getAttribute(SpanAttributeKeys.CHAT_TOOLS)).isEqualTo(List.of());
    }
}
