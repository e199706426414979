package me.golemcore.agent.domain.event;

public record CircuitBreakerTriggeredEvent(String runId, String toolName, int consecutiveCalls)
        implements AgentEvent {
}
