package io.conductor.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of a send operation. A {@code degraded} response was synthesized locally after every
 * provider attempt failed; it is still a valid response and carries a user-facing message.
 */
public record LlmResponse(
    String providerName,
    String modelName,
    ChatMessage message,
    List<ToolCall> toolCalls,
    Usage usage,
    String conversationId,
    boolean degraded
) {
    public static final String SYSTEM_PROVIDER = "System";

    public LlmResponse {
        providerName = providerName == null ? "" : providerName;
        modelName = modelName == null ? "" : modelName;
        Objects.requireNonNull(message, "message must not be null");
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        usage = usage == null ? Usage.empty() : usage;
    }

    public static LlmResponse of(String providerName, String modelName, String content) {
        return new LlmResponse(providerName, modelName, ChatMessage.assistant(content), List.of(), Usage.empty(), null, false);
    }

    public static LlmResponse withToolCalls(String providerName, String modelName, String content, List<ToolCall> toolCalls) {
        return new LlmResponse(
            providerName,
            modelName,
            ChatMessage.assistantWithToolCalls(content, toolCalls),
            toolCalls,
            Usage.empty(),
            null,
            false
        );
    }

    public static LlmResponse degraded(String content) {
        return new LlmResponse(SYSTEM_PROVIDER, SYSTEM_PROVIDER, ChatMessage.assistant(content), List.of(), Usage.empty(), null, true);
    }

    public String content() {
        return message.content();
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public LlmResponse withContent(String content) {
        return new LlmResponse(providerName, modelName, message.withContent(content), toolCalls, usage, conversationId, degraded);
    }

    public LlmResponse withUsage(Usage newUsage) {
        return new LlmResponse(providerName, modelName, message, toolCalls, newUsage, conversationId, degraded);
    }

    public LlmResponse withConversationId(String id) {
        return new LlmResponse(providerName, modelName, message, toolCalls, usage, id, degraded);
    }
}
