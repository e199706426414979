package me.golemcore.agent.domain.event;

public record ErrorEvent(String runId, String reason, String message) implements AgentEvent {
}
