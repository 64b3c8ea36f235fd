package io.conductor.core.model;

import java.util.Objects;

/**
 * A structured tool invocation signalled natively by a provider.
 * {@code arguments} is the serialized payload exactly as the provider produced it.
 */
public record ToolCall(String id, String name, String arguments) {

    public ToolCall {
        Objects.requireNonNull(name, "name must not be null");
        id = id == null ? "" : id;
        arguments = arguments == null ? "" : arguments;
    }
}
