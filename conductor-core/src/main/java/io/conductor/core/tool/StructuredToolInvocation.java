package io.conductor.core.tool;

import io.conductor.core.model.ToolCall;
import java.util.Objects;

public record StructuredToolInvocation(ToolCall call) implements ToolInvocation {

    public StructuredToolInvocation {
        Objects.requireNonNull(call, "call must not be null");
    }

    @Override
    public String toolName() {
        return call.name();
    }

    @Override
    public String rawArguments() {
        return call.arguments();
    }

    @Override
    public String applyResult(String content, String result, int shift) {
        return (content == null ? "" : content) + "\n\nTool: " + call.name() + "\nResult: " + result;
    }
}
