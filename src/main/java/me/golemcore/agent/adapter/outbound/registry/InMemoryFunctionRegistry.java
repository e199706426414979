package me.golemcore.agent.adapter.outbound.registry;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolInvocation;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tools.FunctionInvoker;
import me.golemcore.agent.port.outbound.FunctionRegistryPort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Function registry held in memory. Registration happens once through
 * {@link Builder}; the resulting registry is immutable and safe to share
 * between runs.
 */
@Slf4j
public class InMemoryFunctionRegistry implements FunctionRegistryPort {

    private final Map<String, ToolDefinition> definitions;
    private final Map<String, FunctionInvoker> invokers;

    private InMemoryFunctionRegistry(Map<String, ToolDefinition> definitions, Map<String, FunctionInvoker> invokers) {
        this.definitions = definitions;
        this.invokers = invokers;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<ToolDefinition> listAvailable(Set<String> expandedContainers) {
        Set<String> expanded = expandedContainers != null ? expandedContainers : Set.of();
        List<ToolDefinition> available = new ArrayList<>();
        for (ToolDefinition definition : definitions.values()) {
            String parent = definition.getParentContainer();
            if (parent == null || expanded.contains(parent)) {
                available.add(definition);
            }
        }
        return available;
    }

    @Override
    public Optional<ToolDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    @Override
    public List<ToolDefinition> membersOf(String containerName) {
        return definitions.values().stream()
                .filter(definition -> containerName.equals(definition.getParentContainer()))
                .toList();
    }

    @Override
    public CompletableFuture<ToolResult> invoke(ToolInvocation invocation) {
        FunctionInvoker invoker = invokers.get(invocation.name());
        if (invoker == null) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure("No implementation registered for function: " + invocation.name()));
        }
        try {
            CompletableFuture<ToolResult> future = invoker.invoke(invocation);
            if (future == null) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Function " + invocation.name() + " returned no result"));
            }
            return future;
        } catch (RuntimeException e) {
            log.debug("[Tools] Function {} threw synchronously: {}", invocation.name(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    public static final class Builder {

        private final Map<String, ToolDefinition> definitions = new LinkedHashMap<>();
        private final Map<String, FunctionInvoker> invokers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(ToolDefinition definition, FunctionInvoker invoker) {
            if (definition.isContainer()) {
                throw new IllegalArgumentException(
                        "Container " + definition.getName() + " must be registered with registerContainer");
            }
            if (definition.getParentContainer() != null && !definitions.containsKey(definition.getParentContainer())) {
                throw new IllegalArgumentException("Unknown container " + definition.getParentContainer()
                        + " for function " + definition.getName());
            }
            put(definition);
            invokers.put(definition.getName(), invoker);
            return this;
        }

        public Builder registerContainer(ToolDefinition definition) {
            put(definition.isContainer() ? definition : definition.toBuilder().container(true).build());
            return this;
        }

        /**
         * Registers a function as a member of an already registered container.
         */
        public Builder registerMember(String containerName, ToolDefinition definition, FunctionInvoker invoker) {
            return register(definition.toBuilder().parentContainer(containerName).build(), invoker);
        }

        private void put(ToolDefinition definition) {
            String name = definition.getName();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Function name must not be blank");
            }
            if (definitions.containsKey(name)) {
                throw new IllegalArgumentException("Function already registered: " + name);
            }
            definitions.put(name, definition);
        }

        public InMemoryFunctionRegistry build() {
            log.debug("[Tools] Registry built with {} definitions", definitions.size());
            return new InMemoryFunctionRegistry(
                    Collections.unmodifiableMap(new LinkedHashMap<>(definitions)),
                    Map.copyOf(invokers));
        }
    }
}
