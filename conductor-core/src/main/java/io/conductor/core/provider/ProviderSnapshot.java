package io.conductor.core.provider;

import java.time.Duration;

/**
 * Read-only view of one provider for status reporting. {@code sinceLastFailure} is null when the
 * provider has no failure record.
 */
public record ProviderSnapshot(
    String name,
    ProviderStatus status,
    boolean credentialed,
    String modelId,
    boolean supportsStreaming,
    boolean supportsToolCalls,
    boolean supportsVision,
    Duration sinceLastFailure
) {
}
