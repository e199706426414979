package me.golemcore.agent.domain.loop;

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
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.RunCancellation;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.tools.PermissionMemory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mutable state of one agent run. Created when the run starts and dropped when
 * it ends; never shared between runs.
 *
 * <p>
 * {@link #messages} is what the model sees (including ephemeral container
 * results and injected context). {@link #turnHistory} is what the caller gets
 * back and may persist.
 */
@Data
@Builder
public class TurnContext {

    private String runId;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private List<Message> turnHistory = new ArrayList<>();

    private int iteration;
    private int maxIterations;

    @Builder.Default
    private List<ToolDefinition> availableTools = new ArrayList<>();

    /**
     * Containers expanded during this run. Written from tool workers.
     */
    @Builder.Default
    private Set<String> expandedContainers = ConcurrentHashMap.newKeySet();

    private int consecutiveToolErrors;

    @Builder.Default
    private IdenticalCallBreaker identicalCallBreaker = new IdenticalCallBreaker(0);

    @Builder.Default
    private RunCancellation cancellation = RunCancellation.none();

    @Builder.Default
    private PermissionMemory permissionMemory = new PermissionMemory();

    public void addMessage(Message message) {
        messages.add(message);
    }

    public void addTurnMessage(Message message) {
        turnHistory.add(message);
    }
}
