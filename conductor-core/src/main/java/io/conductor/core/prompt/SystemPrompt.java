package io.conductor.core.prompt;

public record SystemPrompt(String name, String content) {

    public SystemPrompt {
        content = content == null ? "" : content;
    }
}
