package me.golemcore.agent.domain.retry;

public enum RetryState {
    PENDING, RETRYING, SUCCEEDED, EXHAUSTED, NON_RETRYABLE
}
