package me.golemcore.agent.domain.event;

public enum CoordinationKind {
    PERMISSION, CLARIFICATION, CONTINUATION
}
