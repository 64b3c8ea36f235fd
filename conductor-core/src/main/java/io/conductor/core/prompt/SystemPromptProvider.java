package io.conductor.core.prompt;

import java.io.IOException;

/**
 * Source of the prompt that seeds every new conversation.
 */
public interface SystemPromptProvider {

    SystemPrompt defaultPrompt() throws IOException;
}
