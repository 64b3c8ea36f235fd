package io.conductor.core.tool;

/**
 * A tool request detected in a model response, either signalled natively by the provider or
 * written inline in the response text. The processor executes every invocation the same way and
 * lets the invocation decide how its result is written back.
 */
public interface ToolInvocation {

    String toolName();

    String rawArguments();

    /**
     * Returns {@code content} with {@code result} written in for this invocation. {@code shift} is
     * how far results already written for earlier invocations moved this one's position.
     */
    String applyResult(String content, String result, int shift);
}
