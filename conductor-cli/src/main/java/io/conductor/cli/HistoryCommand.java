package io.conductor.cli;

import io.conductor.core.model.ChatMessage;
import io.conductor.core.model.Conversation;
import io.conductor.core.orchestrator.LlmOrchestrator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(name = "history", description = "Show a conversation, or list stored conversations")
public final class HistoryCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    ConductorCliCommand root;

    @Parameters(index = "0", arity = "0..1", description = "Conversation id")
    String conversationId;

    @Option(names = {"--list"}, description = "List stored conversations")
    boolean list;

    @Option(names = {"--class-id"}, description = "Only list conversations of this class")
    String classId;

    public HistoryCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        if (!list && conversationId == null) {
            System.err.println("Specify a conversation id or --list");
            return 2;
        }
        try (LlmOrchestrator orchestrator = context.open(root)) {
            if (list) {
                List<Conversation> conversations = orchestrator.listConversations();
                for (Conversation conversation : conversations) {
                    if (classId != null && !classId.equals(conversation.classId())) {
                        continue;
                    }
                    System.out.println(conversation.id()
                        + "  " + conversation.date()
                        + "  class=" + (conversation.classId() == null ? "-" : conversation.classId())
                        + "  messages=" + conversation.messages().size()
                        + "  updated=" + conversation.updatedAt());
                }
                return 0;
            }

            Optional<Conversation> found = orchestrator.getConversationHistory(conversationId);
            if (found.isEmpty()) {
                System.err.println("Conversation not found: " + conversationId);
                return 1;
            }
            for (ChatMessage message : found.get().messages()) {
                String label = message.toolName() == null
                    ? message.role().wireName()
                    : message.role().wireName() + ":" + message.toolName();
                System.out.println("[" + label + "] " + message.content());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("History command failed: " + e.getMessage());
            return 1;
        }
    }
}
