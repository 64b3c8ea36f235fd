package io.conductor.core.provider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configured providers in registration order, looked up by case-insensitive name.
 * Registration happens during wiring; afterwards the set of providers is fixed and only
 * the initialization state changes.
 */
public final class ProviderRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, LlmProvider> providers = new LinkedHashMap<>();
    private final Set<String> initialized = ConcurrentHashMap.newKeySet();

    public synchronized void register(LlmProvider provider) {
        String key = normalize(provider.name());
        if (providers.containsKey(key)) {
            throw new IllegalArgumentException("Provider already registered: " + provider.name());
        }
        providers.put(key, provider);
    }

    public synchronized Optional<LlmProvider> find(String name) {
        return Optional.ofNullable(providers.get(normalize(name)));
    }

    public synchronized List<LlmProvider> all() {
        return List.copyOf(providers.values());
    }

    public synchronized boolean isEmpty() {
        return providers.isEmpty();
    }

    /**
     * Asks every provider to initialize. A provider that fails stays registered and is only
     * skipped by the first active-selection rule.
     */
    public void initializeAll() {
        for (LlmProvider provider : all()) {
            try {
                provider.initialize();
                initialized.add(normalize(provider.name()));
                LOG.info("Initialized provider {}", provider.name());
            } catch (Exception e) {
                LOG.warn("Failed to initialize provider {}", provider.name(), e);
            }
        }
    }

    public boolean isInitialized(LlmProvider provider) {
        return initialized.contains(normalize(provider.name()));
    }

    static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
