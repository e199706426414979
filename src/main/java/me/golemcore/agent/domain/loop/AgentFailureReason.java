package me.golemcore.agent.domain.loop;

public enum AgentFailureReason {
    MODEL_FAILURE, TOOL_ERROR_LIMIT, UNKNOWN_FUNCTION, CANCELLED
}
