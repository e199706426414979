package me.golemcore.agent.domain.retry;

import java.time.Duration;
import java.util.Optional;

/**
 * Custom retry decision. When configured it overrides classification entirely.
 */
@FunctionalInterface
public interface RetryStrategy {

    /**
     * @param attempt
     *            1-based number of the attempt that just failed
     * @return delay before the next attempt, or empty to stop
     */
    Optional<Duration> delayFor(Throwable error, int attempt);
}
