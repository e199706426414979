package me.golemcore.agent.domain.retry;

/**
 * Maps a failure to an {@link ErrorCategory}. Implementations never throw.
 */
@FunctionalInterface
public interface ErrorClassifier {

    ErrorDetails classify(Throwable error);
}
