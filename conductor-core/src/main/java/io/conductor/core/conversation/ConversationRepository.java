package io.conductor.core.conversation;

import io.conductor.core.model.Conversation;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Storage for conversations. Implementations hand out copies: a conversation returned by
 * {@link #get(String)} is a private working copy and changes reach storage only through
 * {@link #update(Conversation)}. Writes are last-writer-wins.
 */
public interface ConversationRepository {

    Optional<Conversation> get(String id) throws IOException;

    String add(Conversation conversation) throws IOException;

    void update(Conversation conversation) throws IOException;

    boolean delete(String id) throws IOException;

    List<Conversation> list() throws IOException;

    default List<Conversation> findByClassId(String classId) throws IOException {
        return list().stream()
            .filter(conversation -> classId != null && classId.equals(conversation.classId()))
            .toList();
    }
}
