package me.golemcore.agent.domain.event;

public record TurnStartedEvent(String runId, int messageCount, int maxIterations) implements AgentEvent {
}
