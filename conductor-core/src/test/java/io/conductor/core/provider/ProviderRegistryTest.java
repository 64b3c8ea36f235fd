package io.conductor.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ProviderRegistryTest {

    @Test
    void shouldFindProvidersIgnoringCaseAndSeparators() {
        ProviderRegistry registry = new ProviderRegistry();
        StubLlmProvider provider = new StubLlmProvider("open-router");
        registry.register(provider);

        assertThat(registry.find("OPEN_ROUTER")).contains(provider);
        assertThat(registry.find("Open-Router")).contains(provider);
        assertThat(registry.find("openai")).isEmpty();
    }

    @Test
    void shouldKeepRegistrationOrder() {
        ProviderRegistry registry = new ProviderRegistry();
        StubLlmProvider zeta = new StubLlmProvider("zeta");
        StubLlmProvider alpha = new StubLlmProvider("alpha");
        registry.register(zeta);
        registry.register(alpha);

        assertThat(registry.all()).containsExactly(zeta, alpha);
    }

    @Test
    void shouldRejectDuplicateNames() {
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new StubLlmProvider("openai"));

        assertThatThrownBy(() -> registry.register(new StubLlmProvider("OpenAI")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldKeepProviderThatFailsToInitialize() {
        ProviderRegistry registry = new ProviderRegistry();
        StubLlmProvider broken = new StubLlmProvider("broken").failingInitialize();
        StubLlmProvider healthy = new StubLlmProvider("healthy");
        registry.register(broken);
        registry.register(healthy);

        registry.initializeAll();

        assertThat(registry.all()).containsExactly(broken, healthy);
        assertThat(registry.isInitialized(broken)).isFalse();
        assertThat(registry.isInitialized(healthy)).isTrue();
    }
}
