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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolInvocation;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tools.FunctionInvoker;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Exposes an agent loop as a callable function so agents can delegate to
 * agents. The nested run executes on the calling thread: it picks up the
 * ambient coordinator (its events bubble, its human requests reach the
 * outermost transport) and a child of the caller's cancellation.
 */
@Slf4j
public class SubAgentFunction implements FunctionInvoker {

    public static final String TASK_PARAMETER = "task";

    private final AgentLoop loop;
    private final String instructions;
    private final int maxIterations;

    public SubAgentFunction(AgentLoop loop, String instructions, int maxIterations) {
        this.loop = loop;
        this.instructions = instructions;
        this.maxIterations = maxIterations;
    }

    public static ToolDefinition definition(String name, String description) {
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(TASK_PARAMETER, Map.of(
                                "type", "string",
                                "description", "What the agent should do")),
                        "required", List.of(TASK_PARAMETER)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> invoke(ToolInvocation invocation) {
        String task = invocation.stringArgument(TASK_PARAMETER);
        if (task == null || task.isBlank()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "Parameter 'task' is required"));
        }

        List<Message> history = new ArrayList<>();
        if (instructions != null && !instructions.isBlank()) {
            history.add(Message.system(instructions));
        }

        try {
            AgentRunResult result = loop.run(history, List.of(Message.user(task)), maxIterations,
                    invocation.cancellation().child());
            if (result.status() != AgentRunStatus.COMPLETED) {
                return CompletableFuture.completedFuture(ToolResult.failure(
                        "Sub-agent stopped (" + result.status() + ") before finishing the task"));
            }
            String text = result.finalText();
            return CompletableFuture.completedFuture(ToolResult.success(text != null ? text : ""));
        } catch (AgentRunException e) {
            log.warn("[Loop] Sub-agent '{}' failed: {}", invocation.name(), e.getMessage());
            return CompletableFuture.completedFuture(
                    ToolResult.failure("Sub-agent failed (" + e.getReason() + "): " + e.getMessage()));
        }
    }
}
