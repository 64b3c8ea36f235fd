package io.conductor.core.tool;

import io.conductor.core.concurrent.CancellationSignal;
import java.io.IOException;
import java.util.Map;

/**
 * Backend that runs tools by name. Failures may be reported either as a failed
 * {@link ToolResult} or by throwing.
 */
public interface ToolExecutor {

    ToolResult execute(String toolName, Map<String, Object> arguments, CancellationSignal cancellation) throws IOException;
}
