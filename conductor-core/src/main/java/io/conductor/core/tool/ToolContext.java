package io.conductor.core.tool;

import io.conductor.core.concurrent.CancellationSignal;
import java.util.Map;

public record ToolContext(CancellationSignal cancellation, Map<String, Object> services) {

    public ToolContext {
        cancellation = cancellation == null ? CancellationSignal.none() : cancellation;
        services = services == null ? Map.of() : Map.copyOf(services);
    }

    public ToolContext(CancellationSignal cancellation) {
        this(cancellation, Map.of());
    }

    public <T> T service(String key, Class<T> type) {
        Object service = services.get(key);
        if (service == null) {
            return null;
        }
        if (!type.isInstance(service)) {
            throw new IllegalArgumentException("Service '" + key + "' is not of type " + type.getSimpleName());
        }
        return type.cast(service);
    }
}
