package io.conductor.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OrchestratorConfig(
    @JsonAlias({"system_prompt"}) String systemPrompt,
    @JsonAlias({"response_reserve_tokens"}) int responseReserveTokens,
    @JsonAlias({"default_context_length"}) int defaultContextLength,
    @JsonAlias({"backoff_seconds"}) long backoffSeconds,
    @JsonAlias({"preferred_provider"}) String preferredProvider
) {
    public static final String DEFAULT_SYSTEM_PROMPT = "You are a helpful assistant.";

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig(DEFAULT_SYSTEM_PROMPT, 1000, 8192, 300, "");
    }
}
