package me.golemcore.agent.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jLlmAdapterTest {

    private static final String TEST_MODEL = "gpt-test";
    private static final String WEATHER = "get_weather";

    private ChatModel chatModel;
    private Langchain4jLlmAdapter adapter;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        adapter = new Langchain4jLlmAdapter("openai", chatModel, TEST_MODEL, new ObjectMapper(), Runnable::run);
    }

    private static LlmRequest userRequest(String content) {
        return LlmRequest.builder().messages(List.of(Message.user(content))).build();
    }

    // ==================== Chat ====================

    @Test
    void shouldReturnResponseOnSuccessfulChat() throws Exception {
        ChatResponse chatResponse = ChatResponse.builder()
                .aiMessage(AiMessage.from("Hello back!"))
                .tokenUsage(new TokenUsage(10, 5, 15))
                .finishReason(FinishReason.STOP)
                .build();
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(chatResponse);

        LlmResponse response = adapter.chat(userRequest("Hi")).get();

        assertEquals("Hello back!", response.getContent());
        assertEquals("STOP", response.getFinishReason());
        assertEquals(TEST_MODEL, response.getModel());
        assertNotNull(response.getUsage());
        assertEquals(10, response.getUsage().getInputTokens());
        assertEquals(5, response.getUsage().getOutputTokens());
        assertEquals(15, response.getUsage().getTotalTokens());
        assertNotNull(response.getUsage().getLatency());
        assertFalse(response.hasToolCalls());
    }

    @Test
    void shouldFailWhenModelNotConfigured() {
        Langchain4jLlmAdapter unconfigured = new Langchain4jLlmAdapter("openai", null, TEST_MODEL,
                new ObjectMapper());

        assertFalse(unconfigured.isAvailable());
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> unconfigured.chat(userRequest("Hi")).get());
        assertTrue(ex.getCause().getMessage().contains("not available"));
    }

    @Test
    void shouldPropagateProviderFailureUnchanged() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new IllegalStateException("Connection refused"));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> adapter.chat(userRequest("Hi")).get());

        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertEquals("Connection refused", ex.getCause().getMessage());
    }

    @Test
    void shouldPassSamplingSettingsAndTools() throws Exception {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("ok"))
                .finishReason(FinishReason.STOP)
                .build());
        ToolDefinition weather = ToolDefinition.builder()
                .name(WEATHER)
                .description("Get weather")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "location", Map.of("type", "string", "description", "City"),
                                "days", Map.of("type", "integer"),
                                "unit", Map.of("type", "string", "enum", List.of("C", "F")),
                                "tags", Map.of("type", "array")),
                        "required", List.of("location")))
                .build();
        LlmRequest request = LlmRequest.builder()
                .messages(List.of(Message.user("Weather?")))
                .tools(List.of(weather))
                .temperature(0.2)
                .maxTokens(256)
                .build();

        adapter.chat(request).get();

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        ChatRequest sent = captor.getValue();
        assertEquals(0.2, sent.temperature());
        assertEquals(256, sent.maxOutputTokens());
        ToolSpecification toolSpecification = sent.toolSpecifications().get(0);
        assertEquals(WEATHER, toolSpecification.name());
        JsonObjectSchema parameters = toolSpecification.parameters();
        assertEquals(List.of("location"), parameters.required());
        assertInstanceOf(JsonIntegerSchema.class, parameters.properties().get("days"));
        assertInstanceOf(JsonEnumSchema.class, parameters.properties().get("unit"));
        assertInstanceOf(JsonArraySchema.class, parameters.properties().get("tags"));
    }

    // ==================== Conversion ====================

    @Test
    void shouldConvertEveryRole() {
        Message.ToolCall parsed = Message.ToolCall.builder().id("call_1").name(WEATHER)
                .arguments(Map.of("location", "London")).build();
        Message.ToolCall raw = Message.ToolCall.builder().id("call_2").name(WEATHER)
                .rawArguments("{\"location\": ").build();
        LlmRequest request = LlmRequest.builder()
                .messages(List.of(
                        Message.system("Be brief"),
                        Message.user("Weather?"),
                        Message.builder().role(Message.ROLE_ASSISTANT).toolCalls(List.of(parsed, raw)).build(),
                        Message.builder().role(Message.ROLE_TOOL).toolCallId("call_1").toolName(WEATHER)
                                .content("Sunny").build(),
                        Message.builder().role("narrator").content("aside").build()))
                .build();

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(5, messages.size());
        assertEquals("Be brief", ((SystemMessage) messages.get(0)).text());
        assertEquals("Weather?", ((UserMessage) messages.get(1)).singleText());
        AiMessage assistant = (AiMessage) messages.get(2);
        assertEquals("{\"location\":\"London\"}", assistant.toolExecutionRequests().get(0).arguments());
        assertEquals("{\"location\": ", assistant.toolExecutionRequests().get(1).arguments());
        ToolExecutionResultMessage result = (ToolExecutionResultMessage) messages.get(3);
        assertEquals("call_1", result.id());
        assertEquals(WEATHER, result.toolName());
        assertEquals("Sunny", result.text());
        assertEquals("aside", ((UserMessage) messages.get(4)).singleText());
    }

    @Test
    void shouldParseToolCallArguments() {
        ChatResponse chatResponse = ChatResponse.builder()
                .aiMessage(AiMessage.from(List.of(
                        ToolExecutionRequest.builder().id("call_1").name(WEATHER)
                                .arguments("{\"location\":\"London\"}").build(),
                        ToolExecutionRequest.builder().id("call_2").name(WEATHER).arguments("").build(),
                        ToolExecutionRequest.builder().id("call_3").name(WEATHER).arguments("{not json").build())))
                .finishReason(FinishReason.TOOL_EXECUTION)
                .build();

        LlmResponse response = adapter.convertResponse(chatResponse, Duration.ofMillis(5));

        assertEquals("TOOL_EXECUTION", response.getFinishReason());
        assertEquals(3, response.getToolCalls().size());
        assertEquals("London", response.getToolCalls().get(0).getArguments().get("location"));
        assertTrue(response.getToolCalls().get(1).getArguments().isEmpty());
        Message.ToolCall broken = response.getToolCalls().get(2);
        assertNull(broken.getArguments());
        assertEquals("{not json", broken.getRawArguments());
        assertTrue(broken.hasUnparsableArguments());
        assertNull(response.getUsage());
    }

    @Test
    void shouldSkipToolsWhenNoneDeclared() {
        assertTrue(adapter.convertTools(userRequest("Hi")).isEmpty());
    }
}
