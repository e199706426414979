package me.golemcore.agent.domain.event;

public record IterationCompletedEvent(String runId, int iteration, int toolCallCount) implements AgentEvent {
}
