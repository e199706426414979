package me.golemcore.agent.domain.event;

import me.golemcore.agent.domain.model.ToolFailureKind;

public record ToolCallCompletedEvent(String runId, String callId, String toolName, boolean success,
        ToolFailureKind failureKind, long durationMs) implements AgentEvent {
}
