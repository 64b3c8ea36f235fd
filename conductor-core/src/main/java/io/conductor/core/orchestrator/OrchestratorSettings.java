package io.conductor.core.orchestrator;

import io.conductor.core.config.model.ConductorConfig;
import java.time.Duration;

public record OrchestratorSettings(
    int responseReserveTokens,
    int defaultContextLength,
    Duration backoff,
    String preferredProvider,
    boolean refreshEnabled,
    Duration refreshInitialDelay,
    Duration refreshInterval
) {

    public OrchestratorSettings {
        if (responseReserveTokens < 0) {
            throw new IllegalArgumentException("responseReserveTokens must be >= 0");
        }
        if (defaultContextLength <= 0) {
            throw new IllegalArgumentException("defaultContextLength must be > 0");
        }
        backoff = backoff == null ? Duration.ofMinutes(5) : backoff;
        preferredProvider = preferredProvider == null ? "" : preferredProvider;
        refreshInitialDelay = refreshInitialDelay == null ? ModelRefreshScheduler.DEFAULT_INITIAL_DELAY : refreshInitialDelay;
        refreshInterval = refreshInterval == null ? ModelRefreshScheduler.DEFAULT_INTERVAL : refreshInterval;
    }

    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(
            1000,
            8192,
            Duration.ofMinutes(5),
            "",
            true,
            ModelRefreshScheduler.DEFAULT_INITIAL_DELAY,
            ModelRefreshScheduler.DEFAULT_INTERVAL
        );
    }

    public static OrchestratorSettings from(ConductorConfig config) {
        return new OrchestratorSettings(
            config.orchestrator().responseReserveTokens(),
            config.orchestrator().defaultContextLength(),
            Duration.ofSeconds(config.orchestrator().backoffSeconds()),
            config.orchestrator().preferredProvider(),
            config.refresh().enabled(),
            Duration.ofSeconds(config.refresh().initialDelaySeconds()),
            Duration.ofHours(config.refresh().intervalHours())
        );
    }

    public OrchestratorSettings withRefreshEnabled(boolean enabled) {
        return new OrchestratorSettings(
            responseReserveTokens,
            defaultContextLength,
            backoff,
            preferredProvider,
            enabled,
            refreshInitialDelay,
            refreshInterval
        );
    }
}
