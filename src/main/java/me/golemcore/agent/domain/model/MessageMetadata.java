package me.golemcore.agent.domain.model;

/**
 * Well-known keys of {@link Message#getMetadata()}.
 */
public final class MessageMetadata {

    public static final String SUMMARY = "summary";
    public static final String SUMMARIZED_COUNT = "summarizedCount";
    public static final String CONTAINER_RESULT = "containerResult";
    public static final String INPUT_TOKENS = "inputTokens";
    public static final String OUTPUT_TOKENS = "outputTokens";
    public static final String FAILURE_KIND = "failureKind";
    public static final String INJECTED_CONTEXT = "injectedContext";
    public static final String PREAMBLE = "preamble";

    private MessageMetadata() {
    }
}
