package io.conductor.core.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.conductor.core.concurrent.CancellationSignal;
import io.conductor.core.model.LlmResponse;
import io.conductor.core.model.ToolCall;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes tool requests found in a model response and writes the results back into the
 * response text. A failing tool turns into an {@code Error: ...} result; it never stops the
 * remaining invocations and never escapes this class. Only cancellation propagates.
 */
public final class ToolCallProcessor {
    private static final Logger LOG = LoggerFactory.getLogger(ToolCallProcessor.class);
    private static final Pattern INLINE_TOOL_BLOCK = Pattern.compile("```tool\\s+(\\w+)\\s+([\\s\\S]*?)```");

    private final ToolExecutor executor;
    private final ObjectMapper mapper;
    private final ToolArgumentParser argumentParser;

    public ToolCallProcessor(ToolExecutor executor) {
        this(executor, new ObjectMapper());
    }

    public ToolCallProcessor(ToolExecutor executor, ObjectMapper mapper) {
        this.executor = executor;
        this.mapper = mapper;
        this.argumentParser = new ToolArgumentParser(mapper);
    }

    /**
     * Structured tool calls take precedence; the response text is scanned for inline blocks only
     * when the provider signalled none.
     */
    public LlmResponse process(LlmResponse response, CancellationSignal cancellation) {
        List<ToolInvocation> invocations = detect(response);
        if (invocations.isEmpty()) {
            return response;
        }
        return response.withContent(run(response.content(), invocations, cancellation));
    }

    public String processText(String text, CancellationSignal cancellation) {
        List<ToolInvocation> invocations = detectInline(text);
        if (invocations.isEmpty()) {
            return text;
        }
        return run(text, invocations, cancellation);
    }

    public List<ToolInvocation> detect(LlmResponse response) {
        if (response.hasToolCalls()) {
            List<ToolInvocation> structured = new ArrayList<>();
            for (ToolCall call : response.toolCalls()) {
                structured.add(new StructuredToolInvocation(call));
            }
            return structured;
        }
        return detectInline(response.content());
    }

    public List<ToolInvocation> detectInline(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<ToolInvocation> inline = new ArrayList<>();
        Matcher matcher = INLINE_TOOL_BLOCK.matcher(text);
        while (matcher.find()) {
            inline.add(new InlineToolInvocation(
                matcher.group(1).trim(),
                matcher.group(2).trim(),
                matcher.group(),
                matcher.start()
            ));
        }
        return inline;
    }

    private String run(String content, List<ToolInvocation> invocations, CancellationSignal cancellation) {
        String processed = content == null ? "" : content;
        int shift = 0;
        for (ToolInvocation invocation : invocations) {
            cancellation.throwIfCancelled();
            String next = invocation.applyResult(processed, execute(invocation, cancellation), shift);
            shift += next.length() - processed.length();
            processed = next;
        }
        return processed;
    }

    private String execute(ToolInvocation invocation, CancellationSignal cancellation) {
        String toolName = invocation.toolName();
        try {
            Map<String, Object> arguments = argumentParser.parse(invocation.rawArguments());
            LOG.debug("Executing tool {} with {} argument(s)", toolName, arguments.size());
            ToolResult result = executor.execute(toolName, arguments, cancellation);
            if (result == null) {
                return "Error: tool returned no result";
            }
            if (!result.success()) {
                LOG.warn("Tool {} reported failure: {}", toolName, result.errorMessage());
                return "Error: " + result.errorMessage();
            }
            return render(result.data());
        } catch (CancellationException e) {
            throw e;
        } catch (Exception e) {
            LOG.warn("Tool {} failed", toolName, e);
            return "Error: " + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private String render(Object data) throws JsonProcessingException {
        if (data == null) {
            return "";
        }
        if (data instanceof CharSequence text) {
            return text.toString();
        }
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(data);
    }
}
