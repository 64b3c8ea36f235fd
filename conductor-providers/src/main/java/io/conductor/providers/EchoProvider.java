package io.conductor.providers;

import io.conductor.core.concurrent.CancellationSignal;
import io.conductor.core.model.ChatMessage;
import io.conductor.core.model.LlmResponse;
import io.conductor.core.model.MessageRole;
import io.conductor.core.model.ModelInfo;
import io.conductor.core.provider.LlmProvider;
import io.conductor.core.tool.ToolDefinition;
import java.util.List;
import java.util.Objects;

/**
 * Offline provider that answers with the last user message. Always credentialed, so it works as
 * a last-resort member of the failover chain and as a smoke test for the CLI.
 */
public final class EchoProvider implements LlmProvider {
    private final String name;
    private final ModelInfo model;

    public EchoProvider(String name) {
        this(name, new ModelInfo("echo", "Echo", 8192, false, false));
    }

    public EchoProvider(String name, ModelInfo model) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void initialize() {
    }

    @Override
    public ModelInfo currentModel() {
        return model;
    }

    @Override
    public List<ModelInfo> availableModels() {
        return List.of(model);
    }

    @Override
    public boolean hasValidApiKey() {
        return true;
    }

    @Override
    public LlmResponse send(List<ChatMessage> messages, String systemPrompt, CancellationSignal cancellation) {
        cancellation.throwIfCancelled();
        String lastUserMessage = messages.stream()
            .filter(message -> message.role() == MessageRole.USER)
            .reduce((first, second) -> second)
            .map(ChatMessage::content)
            .orElse("");
        return LlmResponse.of(name, model.id(), "[" + name + "] " + lastUserMessage);
    }

    @Override
    public LlmResponse sendWithTools(
        List<ChatMessage> messages,
        List<ToolDefinition> tools,
        String systemPrompt,
        CancellationSignal cancellation
    ) {
        return send(messages, systemPrompt, cancellation);
    }

    @Override
    public LlmResponse sendWithImage(String message, byte[] image, String systemPrompt, CancellationSignal cancellation) {
        cancellation.throwIfCancelled();
        int size = image == null ? 0 : image.length;
        return LlmResponse.of(name, model.id(), "[" + name + "] " + message + " (image, " + size + " bytes)");
    }

    @Override
    public List<ModelInfo> fetchAvailableModels() {
        return availableModels();
    }

    @Override
    public boolean setModel(String modelId) {
        return model.id().equals(modelId);
    }
}
