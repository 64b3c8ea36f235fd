package io.conductor.core.orchestrator;

public class ConversationNotFoundException extends OrchestrationException {
    private final String conversationId;

    public ConversationNotFoundException(String conversationId) {
        super("Conversation not found: " + conversationId);
        this.conversationId = conversationId;
    }

    public String conversationId() {
        return conversationId;
    }
}
