package io.conductor.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ConductorConfig(
    OrchestratorConfig orchestrator,
    ModelRefreshConfig refresh,
    StorageConfig storage,
    List<ProviderConfig> providers
) {

    public ConductorConfig {
        orchestrator = orchestrator == null ? OrchestratorConfig.defaults() : orchestrator;
        refresh = refresh == null ? ModelRefreshConfig.defaults() : refresh;
        storage = storage == null ? StorageConfig.defaults() : storage;
        providers = providers == null ? List.of() : List.copyOf(providers);
    }

    public static ConductorConfig defaults() {
        return new ConductorConfig(
            OrchestratorConfig.defaults(),
            ModelRefreshConfig.defaults(),
            StorageConfig.defaults(),
            List.of(ProviderConfig.openAi(), ProviderConfig.echo())
        );
    }
}
