package io.conductor.core.tool;

import io.conductor.core.concurrent.CancellationSignal;
import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-process {@link ToolExecutor} backed by registered {@link Tool}s.
 */
public final class ToolRegistry implements ToolExecutor {
    private final Map<String, Tool> tools = new ConcurrentSkipListMap<>();
    private final Map<String, Object> services;

    public ToolRegistry() {
        this(Map.of());
    }

    public ToolRegistry(Map<String, Object> services) {
        this.services = services == null ? Map.of() : Map.copyOf(services);
    }

    public void register(Tool tool) {
        tools.put(tool.name(), tool);
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<Tool> all() {
        return tools.values();
    }

    public List<ToolDefinition> definitions() {
        return tools.values().stream()
            .map(tool -> new ToolDefinition(tool.name(), tool.description(), tool.schema()))
            .toList();
    }

    @Override
    public ToolResult execute(String toolName, Map<String, Object> arguments, CancellationSignal cancellation)
        throws IOException {
        Optional<Tool> tool = find(toolName);
        if (tool.isEmpty()) {
            return ToolResult.failure("Tool '" + toolName + "' not found");
        }
        String output = tool.get().execute(arguments == null ? Map.of() : arguments, new ToolContext(cancellation, services));
        return ToolResult.success(output);
    }
}
