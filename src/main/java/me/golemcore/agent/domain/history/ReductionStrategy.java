package me.golemcore.agent.domain.history;

public enum ReductionStrategy {
    /**
     * Drop the oldest messages after the last summary.
     */
    TRUNCATE,
    /**
     * Replace the oldest messages after the last summary with one summary message.
     */
    SUMMARIZE
}
