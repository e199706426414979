package me.golemcore.agent.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single message in an agent conversation. Supports the four roles (user,
 * assistant, system, tool), assistant tool-call requests, tool results bound to
 * a call id, provider usage and an open metadata bag.
 *
 * <p>
 * Messages are immutable once created. Filtered copies (for example the
 * persisted subset of a turn) are produced with {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_TOOL = "tool";

    String id;
    String role;
    String content;
    String reasoning;

    List<ToolCall> toolCalls;
    String toolCallId; // For tool result messages
    String toolName; // Tool name for tool result messages

    LlmUsage usage;

    @Builder.Default
    Map<String, Object> metadata = Map.of();

    Instant timestamp;

    @JsonIgnore
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    @JsonIgnore
    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    @JsonIgnore
    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    @JsonIgnore
    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    /**
     * Checks if this message contains tool calls from the LLM.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Checks if this message is a summary produced by history reduction.
     */
    @JsonIgnore
    public boolean isSummary() {
        return metadata != null && Boolean.TRUE.equals(metadata.get(MessageMetadata.SUMMARY));
    }

    /**
     * Checks if this message is an ephemeral container expansion result.
     */
    @JsonIgnore
    public boolean isContainerResult() {
        return metadata != null && Boolean.TRUE.equals(metadata.get(MessageMetadata.CONTAINER_RESULT));
    }

    /**
     * Returns a copy with one extra metadata entry.
     */
    public Message withMetadata(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (metadata != null) {
            copy.putAll(metadata);
        }
        copy.put(key, value);
        return toBuilder().metadata(copy).build();
    }

    public static Message user(String content) {
        return Message.builder().role(ROLE_USER).content(content).timestamp(Instant.now()).build();
    }

    public static Message system(String content) {
        return Message.builder().role(ROLE_SYSTEM).content(content).timestamp(Instant.now()).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(ROLE_ASSISTANT).content(content).timestamp(Instant.now()).build();
    }

    /**
     * Tool call requested by the LLM.
     */
    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class ToolCall {
        String id;
        String name;
        Map<String, Object> arguments;
        /**
         * Raw argument text as produced by the provider. Set when the arguments could
         * not be parsed into {@link #arguments}.
         */
        String rawArguments;

        @JsonIgnore
        public boolean hasUnparsableArguments() {
            return arguments == null && rawArguments != null && !rawArguments.isBlank();
        }
    }
}
