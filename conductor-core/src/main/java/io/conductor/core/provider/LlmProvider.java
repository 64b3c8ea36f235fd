package io.conductor.core.provider;

import io.conductor.core.concurrent.CancellationSignal;
import io.conductor.core.model.ChatMessage;
import io.conductor.core.model.LlmResponse;
import io.conductor.core.model.ModelInfo;
import io.conductor.core.tool.ToolDefinition;
import java.io.IOException;
import java.util.List;
import java.util.function.Consumer;

/**
 * A swappable language-model backend. Implementations own their wire protocol, credentials and
 * model catalog. Every send method throws on failure; the caller decides about failover.
 *
 * <p>When {@code systemPrompt} is non-blank it replaces any system message contained in
 * {@code messages}.
 */
public interface LlmProvider {

    String name();

    void initialize() throws IOException;

    ModelInfo currentModel();

    List<ModelInfo> availableModels();

    boolean hasValidApiKey();

    default boolean supportsStreaming() {
        return false;
    }

    default boolean supportsToolCalls() {
        ModelInfo model = currentModel();
        return model != null && model.supportsToolCalls();
    }

    default boolean supportsVision() {
        ModelInfo model = currentModel();
        return model != null && model.supportsVision();
    }

    LlmResponse send(List<ChatMessage> messages, String systemPrompt, CancellationSignal cancellation) throws IOException;

    /**
     * Streams the response through {@code onChunk}. Providers without native streaming deliver
     * the whole answer as a single chunk.
     */
    default LlmResponse sendStreaming(
        List<ChatMessage> messages,
        String systemPrompt,
        Consumer<String> onChunk,
        CancellationSignal cancellation
    ) throws IOException {
        LlmResponse response = send(messages, systemPrompt, cancellation);
        onChunk.accept(response.content());
        return response;
    }

    LlmResponse sendWithTools(
        List<ChatMessage> messages,
        List<ToolDefinition> tools,
        String systemPrompt,
        CancellationSignal cancellation
    ) throws IOException;

    default LlmResponse sendWithToolsStreaming(
        List<ChatMessage> messages,
        List<ToolDefinition> tools,
        String systemPrompt,
        Consumer<String> onChunk,
        CancellationSignal cancellation
    ) throws IOException {
        LlmResponse response = sendWithTools(messages, tools, systemPrompt, cancellation);
        onChunk.accept(response.content());
        return response;
    }

    LlmResponse sendWithImage(String message, byte[] image, String systemPrompt, CancellationSignal cancellation)
        throws IOException;

    /**
     * Re-queries the vendor catalog and replaces {@link #availableModels()} with the result.
     */
    List<ModelInfo> fetchAvailableModels() throws IOException;

    boolean setModel(String modelId);
}
