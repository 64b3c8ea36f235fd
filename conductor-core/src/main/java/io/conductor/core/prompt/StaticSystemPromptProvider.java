package io.conductor.core.prompt;

public final class StaticSystemPromptProvider implements SystemPromptProvider {
    private final SystemPrompt prompt;

    public StaticSystemPromptProvider(String content) {
        this.prompt = new SystemPrompt("default", content);
    }

    @Override
    public SystemPrompt defaultPrompt() {
        return prompt;
    }
}
