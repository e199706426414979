package me.golemcore.agent.domain.loop;

public enum AgentRunStatus {
    /**
     * The model answered without requesting tools.
     */
    COMPLETED,
    /**
     * The iteration budget ran out while the model still wanted tools.
     */
    ITERATION_LIMIT,
    /**
     * The same call was about to repeat too many times in a row.
     */
    CIRCUIT_BREAKER
}
