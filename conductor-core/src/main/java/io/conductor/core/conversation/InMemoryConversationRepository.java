package io.conductor.core.conversation;

import io.conductor.core.model.Conversation;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryConversationRepository implements ConversationRepository {
    private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();

    @Override
    public Optional<Conversation> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(conversations.get(id)).map(Conversation::copy);
    }

    @Override
    public String add(Conversation conversation) {
        if (conversations.putIfAbsent(conversation.id(), conversation.copy()) != null) {
            throw new IllegalArgumentException("Conversation already exists: " + conversation.id());
        }
        return conversation.id();
    }

    @Override
    public void update(Conversation conversation) {
        conversations.put(conversation.id(), conversation.copy());
    }

    @Override
    public boolean delete(String id) {
        return id != null && conversations.remove(id) != null;
    }

    @Override
    public List<Conversation> list() {
        return conversations.values().stream()
            .map(Conversation::copy)
            .sorted(Comparator.comparing(Conversation::createdAt))
            .toList();
    }
}
