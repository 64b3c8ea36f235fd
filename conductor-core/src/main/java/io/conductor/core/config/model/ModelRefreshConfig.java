package io.conductor.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelRefreshConfig(
    boolean enabled,
    @JsonAlias({"initial_delay_seconds"}) long initialDelaySeconds,
    @JsonAlias({"interval_hours"}) long intervalHours
) {

    public static ModelRefreshConfig defaults() {
        return new ModelRefreshConfig(true, 120, 24);
    }
}
