package me.golemcore.agent.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.type.TypeReference;
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
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.port.outbound.LlmPort;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Model provider backed by a langchain4j {@link ChatModel}.
 *
 * <p>
 * Translates engine messages and function definitions to langchain4j types and
 * back. Provider failures are propagated unchanged through the returned future
 * so the retry engine can classify them; the adapter itself never retries.
 */
@Slf4j
public class Langchain4jLlmAdapter implements LlmPort {

    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final String providerId;
    private final ChatModel chatModel;
    private final String modelName;
    private final ObjectMapper objectMapper;
    private final Executor executor;

    public Langchain4jLlmAdapter(String providerId, ChatModel chatModel, String modelName, ObjectMapper objectMapper) {
        this(providerId, chatModel, modelName, objectMapper, ForkJoinPool.commonPool());
    }

    public Langchain4jLlmAdapter(String providerId, ChatModel chatModel, String modelName, ObjectMapper objectMapper,
            Executor executor) {
        this.providerId = providerId;
        this.chatModel = chatModel;
        this.modelName = modelName;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    @Override
    public String getProviderId() {
        return providerId;
    }

    @Override
    public boolean isAvailable() {
        return chatModel != null;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        if (chatModel == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Langchain4j adapter not available"));
        }
        return CompletableFuture.supplyAsync(() -> {
            List<ChatMessage> messages = convertMessages(request);
            List<ToolSpecification> tools = convertTools(request);

            ChatRequest.Builder builder = ChatRequest.builder().messages(messages);
            if (!tools.isEmpty()) {
                log.trace("Calling LLM with {} tools", tools.size());
                builder.toolSpecifications(tools);
            }
            if (request.getTemperature() != null) {
                builder.temperature(request.getTemperature());
            }
            if (request.getMaxTokens() != null) {
                builder.maxOutputTokens(request.getMaxTokens());
            }

            long started = System.nanoTime();
            ChatResponse response = chatModel.chat(builder.build());
            return convertResponse(response, Duration.ofNanos(System.nanoTime() - started));
        }, executor);
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        for (Message msg : request.getMessages()) {
            switch (msg.getRole()) {
            case Message.ROLE_USER -> messages.add(UserMessage.from(nullToEmpty(msg.getContent())));
            case Message.ROLE_ASSISTANT -> messages.add(convertAssistant(msg));
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    nullToEmpty(msg.getContent())));
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(msg.getContent()));
            default -> {
                log.warn("Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(nullToEmpty(msg.getContent())));
            }
            }
        }
        return messages;
    }

    private ChatMessage convertAssistant(Message msg) {
        if (!msg.hasToolCalls()) {
            return AiMessage.from(nullToEmpty(msg.getContent()));
        }
        List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                .map(tc -> ToolExecutionRequest.builder()
                        .id(tc.getId())
                        .name(tc.getName())
                        .arguments(tc.getArguments() != null || tc.getRawArguments() == null
                                ? convertArgsToJson(tc.getArguments())
                                : tc.getRawArguments())
                        .build())
                .toList();
        if (msg.getContent() != null && !msg.getContent().isBlank()) {
            return AiMessage.from(msg.getContent(), toolRequests);
        }
        return AiMessage.from(toolRequests);
    }

    List<ToolSpecification> convertTools(LlmRequest request) {
        if (request.getTools() == null || request.getTools().isEmpty()) {
            return Collections.emptyList();
        }
        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema == null) {
            return builder.build();
        }
        Map<String, Object> properties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
        if (properties != null) {
            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            for (Map.Entry<String, Object> entry : properties.entrySet()) {
                schemaBuilder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
            }
            List<String> required = tool.requiredParameters();
            if (!required.isEmpty()) {
                schemaBuilder.required(required);
            }
            builder.parameters(schemaBuilder.build());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        boolean described = description != null && !description.isBlank();
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }

        switch (type != null ? type : "string") {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (described) {
                builder.description(description);
            }
            Object items = paramSchema.get("items");
            builder.items(items instanceof Map<?, ?> itemSchema
                    ? toJsonSchemaElement((Map<String, Object>) itemSchema)
                    : JsonStringSchema.builder().build());
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
            if (described) {
                builder.description(description);
            }
            Object nested = paramSchema.get(SCHEMA_KEY_PROPERTIES);
            if (nested instanceof Map<?, ?> nestedProps) {
                for (Map.Entry<?, ?> entry : nestedProps.entrySet()) {
                    builder.addProperty(String.valueOf(entry.getKey()),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            return builder.build();
        }
        default -> {
            // strings and unknown types
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    LlmResponse convertResponse(ChatResponse response, Duration latency) {
        AiMessage aiMessage = response.aiMessage();

        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(this::convertToolCall)
                    .toList();
            log.trace("Parsed {} tool calls from response", toolCalls.size());
        }

        LlmUsage usage = null;
        TokenUsage tokenUsage = response.tokenUsage();
        if (tokenUsage != null) {
            usage = LlmUsage.builder()
                    .inputTokens(orZero(tokenUsage.inputTokenCount()))
                    .outputTokens(orZero(tokenUsage.outputTokenCount()))
                    .totalTokens(orZero(tokenUsage.totalTokenCount()))
                    .latency(latency)
                    .model(modelName)
                    .build();
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .usage(usage)
                .model(modelName)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private Message.ToolCall convertToolCall(ToolExecutionRequest request) {
        Message.ToolCall.ToolCallBuilder builder = Message.ToolCall.builder()
                .id(request.id())
                .name(request.name());
        String json = request.arguments();
        if (json == null || json.isBlank()) {
            return builder.arguments(Collections.emptyMap()).build();
        }
        try {
            return builder.arguments(objectMapper.readValue(json, MAP_TYPE_REF)).build();
        } catch (Exception e) {
            log.warn("Failed to parse tool arguments for {}: {}", request.name(), e.getMessage());
            return builder.rawArguments(json).build();
        }
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (Exception e) {
            log.warn("Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
