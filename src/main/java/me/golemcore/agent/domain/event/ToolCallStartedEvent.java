package me.golemcore.agent.domain.event;

public record ToolCallStartedEvent(String runId, String callId, String toolName) implements AgentEvent {
}
