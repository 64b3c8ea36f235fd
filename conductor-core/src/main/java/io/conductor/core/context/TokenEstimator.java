package io.conductor.core.context;

import io.conductor.core.model.ChatMessage;
import io.conductor.core.model.MessageRole;
import io.conductor.core.model.ToolCall;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Approximate token accounting. Text containing CJK script counts one token per character,
 * anything else a quarter token per character, plus a fixed overhead per message.
 */
public final class TokenEstimator {
    private static final double DEFAULT_TOKENS_PER_CHAR = 0.25;
    private static final double CJK_TOKENS_PER_CHAR = 1.0;
    private static final Pattern CJK = Pattern.compile(
        "[\\p{IsHan}\\p{IsHiragana}\\p{IsKatakana}\\p{IsHangul}\\p{InCJK_Symbols_and_Punctuation}]"
    );

    static final int MESSAGE_OVERHEAD = 4;
    static final int TOOL_OVERHEAD = 10;
    static final int CONVERSATION_OVERHEAD = 3;

    private TokenEstimator() {
    }

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        double ratio = CJK.matcher(text).find() ? CJK_TOKENS_PER_CHAR : DEFAULT_TOKENS_PER_CHAR;
        return (int) Math.ceil(text.length() * ratio);
    }

    public static int estimate(ChatMessage message) {
        int tokens = estimate(message.content()) + overhead(message.role());
        for (ToolCall call : message.toolCalls()) {
            tokens += estimate(call);
        }
        return tokens;
    }

    public static int estimate(ToolCall call) {
        return estimate(call.name()) + estimate(call.arguments()) + TOOL_OVERHEAD;
    }

    public static int estimate(List<ChatMessage> messages) {
        int total = CONVERSATION_OVERHEAD;
        for (ChatMessage message : messages) {
            total += estimate(message);
        }
        return total;
    }

    private static int overhead(MessageRole role) {
        return role == MessageRole.TOOL ? TOOL_OVERHEAD : MESSAGE_OVERHEAD;
    }
}
