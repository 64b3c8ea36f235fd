package io.conductor.core.context;

import io.conductor.core.model.ChatMessage;
import io.conductor.core.model.MessageRole;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shrinks a history to a token budget, keeping the most recent messages. Messages are kept or
 * dropped whole; the kept non-system messages are always a contiguous suffix of the input.
 */
public final class ConversationTrimmer {
    private static final Logger LOG = LoggerFactory.getLogger(ConversationTrimmer.class);

    public List<ChatMessage> trim(List<ChatMessage> messages, int maxTokens) {
        return trim(messages, maxTokens, true);
    }

    /**
     * Returns {@code messages} itself when it already fits. Otherwise keeps the first system
     * message (when {@code preserveSystem}) followed by as many of the newest remaining messages
     * as fit. The system message is kept even when it alone exceeds the budget.
     */
    public List<ChatMessage> trim(List<ChatMessage> messages, int maxTokens, boolean preserveSystem) {
        int total = TokenEstimator.estimate(messages);
        if (total <= maxTokens) {
            return messages;
        }

        ChatMessage system = null;
        if (preserveSystem) {
            system = messages.stream()
                .filter(message -> message.role() == MessageRole.SYSTEM)
                .findFirst()
                .orElse(null);
        }

        LinkedList<ChatMessage> kept = new LinkedList<>();
        int used = TokenEstimator.estimate(system == null ? List.of() : List.of(system));
        for (int i = messages.size() - 1; i >= 0; i--) {
            ChatMessage message = messages.get(i);
            if (preserveSystem && message.role() == MessageRole.SYSTEM) {
                continue;
            }
            int tokens = TokenEstimator.estimate(message);
            if (used + tokens > maxTokens) {
                break;
            }
            kept.addFirst(message);
            used += tokens;
        }

        List<ChatMessage> result = new ArrayList<>(kept.size() + 1);
        if (system != null) {
            result.add(system);
        }
        result.addAll(kept);
        LOG.debug("Trimmed history from {} to {} messages ({} -> {} tokens, budget {})",
            messages.size(), result.size(), total, used, maxTokens);
        return result;
    }
}
