package me.golemcore.agent.domain.retry;

import java.time.Duration;

/**
 * Snapshot of a retried operation, reported to {@link RetryListener}s.
 *
 * @param attempt
 *            number of failed attempts so far
 * @param delay
 *            wait before the next attempt; {@code null} in terminal states
 */
public record RetryAttempt(String operation, int attempt, RetryState state, ErrorCategory category,
        Duration delay, Duration elapsed, String errorMessage) {
}
