package io.conductor.core.model;

import java.util.Objects;

/**
 * Catalog entry for a model served by a provider. Replaced wholesale on catalog refresh.
 */
public record ModelInfo(
    String id,
    String displayName,
    int maxContextLength,
    boolean supportsToolCalls,
    boolean supportsVision
) {

    public ModelInfo {
        Objects.requireNonNull(id, "id must not be null");
        displayName = displayName == null || displayName.isBlank() ? id : displayName;
        maxContextLength = Math.max(0, maxContextLength);
    }

    public static ModelInfo of(String id, int maxContextLength) {
        return new ModelInfo(id, id, maxContextLength, false, false);
    }

    /**
     * True when this model can do everything {@code other} can: tool calls, vision and at least the same context.
     */
    public boolean covers(ModelInfo other) {
        return (supportsToolCalls || !other.supportsToolCalls())
            && (supportsVision || !other.supportsVision())
            && maxContextLength >= other.maxContextLength();
    }
}
