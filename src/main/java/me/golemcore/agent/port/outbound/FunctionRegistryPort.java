package me.golemcore.agent.port.outbound;

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

import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolInvocation;
import me.golemcore.agent.domain.model.ToolResult;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Port for function discovery and invocation.
 */
public interface FunctionRegistryPort {

    /**
     * Lists the definitions the model may call right now: top-level functions,
     * containers, and members of the given expanded containers.
     */
    List<ToolDefinition> listAvailable(Set<String> expandedContainers);

    /**
     * Looks a definition up by name regardless of container expansion.
     */
    Optional<ToolDefinition> find(String name);

    /**
     * Members of a container, in registration order.
     */
    List<ToolDefinition> membersOf(String containerName);

    /**
     * Invokes a function. Failures are reported through the returned future, never
     * thrown.
     */
    CompletableFuture<ToolResult> invoke(ToolInvocation invocation);
}
