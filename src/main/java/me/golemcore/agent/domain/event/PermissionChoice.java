package me.golemcore.agent.domain.event;

/**
 * How long a permission answer applies.
 */
public enum PermissionChoice {
    /**
     * Only this call.
     */
    ASK,
    ALWAYS_ALLOW,
    ALWAYS_DENY
}
