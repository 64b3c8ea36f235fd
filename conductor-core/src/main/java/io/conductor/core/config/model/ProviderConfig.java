package io.conductor.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    String name,
    String type,
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    String model,
    @JsonAlias({"context_length"}) int contextLength,
    @JsonAlias({"supports_vision"}) boolean supportsVision,
    @JsonAlias({"supports_tools"}) boolean supportsTools,
    @JsonAlias({"extra_headers"}) Map<String, String> extraHeaders
) {

    public ProviderConfig {
        type = type == null || type.isBlank() ? "openai" : type;
        extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
    }

    public static ProviderConfig openAi() {
        return new ProviderConfig("openai", "openai", "", "https://api.openai.com/v1", "gpt-4o-mini", 128000, true, true, Map.of());
    }

    public static ProviderConfig echo() {
        return new ProviderConfig("echo", "echo", "", null, "echo", 8192, false, false, Map.of());
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
