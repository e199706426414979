package me.golemcore.agent.domain.event;

public record IterationStartedEvent(String runId, int iteration) implements AgentEvent {
}
