package me.golemcore.agent.domain.event;

public record TurnCompletedEvent(String runId, String status, int iterations) implements AgentEvent {
}
