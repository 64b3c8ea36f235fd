package io.conductor.providers;

import io.conductor.core.config.model.ProviderConfig;
import io.conductor.core.model.ModelInfo;
import io.conductor.core.provider.LlmProvider;
import io.conductor.core.provider.ProviderRegistry;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns provider configuration entries into adapters. Entries without an API key, or with an
 * unknown type, become {@link DisabledProvider}s so they stay visible in status output.
 */
public final class ProviderFactory {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderFactory.class);

    static final String OPENAI_BASE = "https://api.openai.com/v1";
    static final String OPENROUTER_BASE = "https://openrouter.ai/api/v1";

    private ProviderFactory() {
    }

    public static ProviderRegistry registryFor(List<ProviderConfig> configs) {
        ProviderRegistry registry = new ProviderRegistry();
        for (ProviderConfig config : configs) {
            if (config.name() == null || config.name().isBlank()) {
                LOG.warn("Skipping provider entry without a name (type {})", config.type());
                continue;
            }
            if (registry.find(config.name()).isPresent()) {
                LOG.warn("Skipping duplicate provider entry {}", config.name());
                continue;
            }
            registry.register(create(config));
        }
        return registry;
    }

    public static LlmProvider create(ProviderConfig config) {
        String type = config.type().trim().toLowerCase(Locale.ROOT);
        ModelInfo model = modelOf(config);
        switch (type) {
            case "echo":
                return new EchoProvider(config.name(), model);
            case "openai":
                return openAiCompat(config, model, OPENAI_BASE);
            case "openrouter":
                return openAiCompat(config, model, OPENROUTER_BASE);
            default:
                LOG.warn("Provider {} has unknown type {}", config.name(), config.type());
                return new DisabledProvider(config.name(), "unknown provider type " + config.type(), model);
        }
    }

    private static LlmProvider openAiCompat(ProviderConfig config, ModelInfo model, String defaultBase) {
        if (!config.configured()) {
            return new DisabledProvider(config.name(), "missing API key", model);
        }
        String base = config.apiBase() == null || config.apiBase().isBlank() ? defaultBase : config.apiBase();
        return new OpenAiCompatProvider(config.name(), config.apiKey(), base, model, config.extraHeaders());
    }

    private static ModelInfo modelOf(ProviderConfig config) {
        String id = config.model() == null || config.model().isBlank() ? config.name() : config.model();
        return new ModelInfo(id, id, config.contextLength(), config.supportsTools(), config.supportsVision());
    }
}
