package io.conductor.core.provider;

public enum ProviderStatus {
    UNKNOWN,
    INITIALIZED,
    ACTIVE,
    FAILED
}
