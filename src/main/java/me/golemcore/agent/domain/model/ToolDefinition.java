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

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Describes a function the LLM can call: name, description and JSON Schema of
 * its parameters, plus the flags the scheduler needs.
 *
 * <p>
 * A container groups related functions. Its members carry
 * {@link #parentContainer} and stay hidden until the model calls the container
 * with no arguments.
 */
@Data
@Builder(toBuilder = true)
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema; // JSON Schema

    private boolean requiresPermission;
    private boolean container;
    private String parentContainer;

    public static ToolDefinition simple(String name, String description) {
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(Map.of("type", "object", "properties", Map.of()))
                .build();
    }

    public static ToolDefinition container(String name, String description) {
        return simple(name, description).toBuilder().container(true).build();
    }

    /**
     * Names of required parameters declared by the schema.
     */
    public List<String> requiredParameters() {
        if (inputSchema == null) {
            return List.of();
        }
        Object required = inputSchema.get("required");
        if (required instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
