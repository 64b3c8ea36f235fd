package io.conductor.providers;

import io.conductor.core.concurrent.CancellationSignal;
import io.conductor.core.model.ChatMessage;
import io.conductor.core.model.LlmResponse;
import io.conductor.core.model.ModelInfo;
import io.conductor.core.provider.LlmProvider;
import io.conductor.core.provider.ProviderException;
import io.conductor.core.tool.ToolDefinition;
import java.util.List;
import java.util.Objects;

/**
 * Provider placeholder used when a provider is not configured.
 * Reports no credentials so selection skips it, and fails every call with a deterministic error.
 */
public final class DisabledProvider implements LlmProvider {
    private final String name;
    private final String reason;
    private final ModelInfo model;

    public DisabledProvider(String name, String reason) {
        this(name, reason, ModelInfo.of("none", 0));
    }

    public DisabledProvider(String name, String reason, ModelInfo model) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.reason = reason == null || reason.isBlank() ? "provider is disabled" : reason;
        this.model = model == null ? ModelInfo.of("none", 0) : model;
    }

    @Override
    public String name() {
        return name;
    }

    public String reason() {
        return reason;
    }

    @Override
    public void initialize() throws ProviderException {
        throw notConfigured();
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
        return false;
    }

    @Override
    public LlmResponse send(List<ChatMessage> messages, String systemPrompt, CancellationSignal cancellation)
        throws ProviderException {
        throw notConfigured();
    }

    @Override
    public LlmResponse sendWithTools(
        List<ChatMessage> messages,
        List<ToolDefinition> tools,
        String systemPrompt,
        CancellationSignal cancellation
    ) throws ProviderException {
        throw notConfigured();
    }

    @Override
    public LlmResponse sendWithImage(String message, byte[] image, String systemPrompt, CancellationSignal cancellation)
        throws ProviderException {
        throw notConfigured();
    }

    @Override
    public List<ModelInfo> fetchAvailableModels() throws ProviderException {
        throw notConfigured();
    }

    @Override
    public boolean setModel(String modelId) {
        return false;
    }

    private ProviderException notConfigured() {
        return new ProviderException(name, "provider " + name + " is not configured (" + reason + ")");
    }
}
