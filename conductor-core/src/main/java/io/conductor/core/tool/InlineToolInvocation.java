package io.conductor.core.tool;

import java.util.Objects;

/**
 * A fenced {@code ```tool <name>} block found in response text. {@code matchedText} is the whole
 * block as it appeared and {@code start} its offset in the scanned text.
 */
public record InlineToolInvocation(
    String toolName,
    String rawArguments,
    String matchedText,
    int start
) implements ToolInvocation {

    public InlineToolInvocation {
        Objects.requireNonNull(toolName, "toolName must not be null");
        Objects.requireNonNull(matchedText, "matchedText must not be null");
        rawArguments = rawArguments == null ? "" : rawArguments;
        if (start < 0) {
            throw new IllegalArgumentException("start must be >= 0");
        }
    }

    @Override
    public String applyResult(String content, String result, int shift) {
        int index = start + shift;
        if (index < 0 || !content.startsWith(matchedText, index)) {
            return content;
        }
        String replacement = "```tool " + toolName + "\n" + rawArguments + "\n```\n\n**Tool Result:**\n```json\n"
            + result + "\n```";
        return content.substring(0, index) + replacement + content.substring(index + matchedText.length());
    }
}
