package io.conductor.cli;

import io.conductor.core.orchestrator.LlmOrchestrator;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(name = "delete", description = "Delete a stored conversation")
public final class DeleteCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    ConductorCliCommand root;

    @Parameters(index = "0", arity = "1", description = "Conversation id")
    String conversationId;

    public DeleteCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (LlmOrchestrator orchestrator = context.open(root)) {
            if (!orchestrator.deleteConversation(conversationId)) {
                System.err.println("Conversation not found: " + conversationId);
                return 1;
            }
            System.out.println("Deleted conversation " + conversationId);
            return 0;
        } catch (Exception e) {
            System.err.println("Delete command failed: " + e.getMessage());
            return 1;
        }
    }
}
