package me.golemcore.agent.domain.event;

import me.golemcore.agent.domain.retry.ErrorCategory;

public record ModelRetryEvent(String runId, int attempt, ErrorCategory category, long delayMs, String error)
        implements AgentEvent {
}
