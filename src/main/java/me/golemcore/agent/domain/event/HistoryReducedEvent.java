package me.golemcore.agent.domain.event;

public record HistoryReducedEvent(String runId, String strategy, int removedCount, int remainingCount)
        implements AgentEvent {
}
