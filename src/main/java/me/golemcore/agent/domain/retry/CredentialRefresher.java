package me.golemcore.agent.domain.retry;

/**
 * Refreshes provider credentials after an authentication failure.
 */
@FunctionalInterface
public interface CredentialRefresher {

    /**
     * @return {@code true} when new credentials are in place and the call is worth
     *         repeating
     */
    boolean refresh();
}
