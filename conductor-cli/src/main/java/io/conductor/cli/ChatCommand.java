package io.conductor.cli;

import io.conductor.core.concurrent.CancellationSignal;
import io.conductor.core.model.ChatMessage;
import io.conductor.core.model.LlmResponse;
import io.conductor.core.orchestrator.LlmOrchestrator;
import io.conductor.core.orchestrator.OrchestrationException;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(name = "chat", description = "Send a message and print the reply")
public final class ChatCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    ConductorCliCommand root;

    @Parameters(arity = "1..*", description = "Message to send")
    List<String> words;

    @Option(names = {"-c", "--conversation"}, description = "Continue an existing conversation")
    String conversationId;

    @Option(names = {"--class-id"}, description = "Class to associate with a new conversation")
    String classId;

    @Option(names = {"--stream"}, description = "Print the reply as it arrives")
    boolean stream;

    @Option(names = {"--tools"}, description = "Offer the registered tools to the model")
    boolean tools;

    @Option(names = {"--image"}, description = "Attach an image file")
    Path image;

    @Option(names = {"-p", "--provider"}, description = "Provider override")
    String provider;

    @Option(names = {"-s", "--system"}, description = "System prompt override")
    String systemPrompt;

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        PrintStream out = System.out;
        String message = String.join(" ", words);
        CancellationSignal cancellation = new CancellationSignal();
        try (LlmOrchestrator orchestrator = context.open(root)) {
            if (provider != null && !orchestrator.setActiveProvider(provider)) {
                System.err.println("Provider not available: " + provider + " (unknown or missing API key)");
                return 2;
            }
            String conversation = conversationId;
            if (conversation == null && classId != null) {
                conversation = orchestrator.createConversation(classId);
            }

            LlmResponse response = send(orchestrator, message, conversation, cancellation, out);
            if (stream && image == null) {
                out.println();
            } else {
                out.println(response.content());
            }
            String via = response.degraded() ? "unavailable" : response.providerName() + "/" + response.modelName();
            out.println("-- conversation " + response.conversationId() + " (" + via + ")");
            return 0;
        } catch (CancellationException e) {
            System.err.println("Chat cancelled");
            return 130;
        } catch (OrchestrationException e) {
            System.err.println("Chat failed: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }

    private LlmResponse send(
        LlmOrchestrator orchestrator,
        String message,
        String conversation,
        CancellationSignal cancellation,
        PrintStream out
    ) throws OrchestrationException, IOException {
        if (image != null) {
            byte[] bytes = Files.readAllBytes(image);
            return orchestrator.sendMessageWithImage(message, bytes, conversation, systemPrompt, cancellation);
        }
        if (tools && stream) {
            return orchestrator.sendMessageWithToolsStreaming(message, conversation, systemPrompt, out::print, cancellation);
        }
        if (tools) {
            return orchestrator.sendMessageWithTools(message, conversation, systemPrompt, cancellation);
        }
        if (stream) {
            return orchestrator.sendMessagesStreaming(
                List.of(ChatMessage.user(message)),
                conversation,
                systemPrompt,
                out::print,
                cancellation
            );
        }
        return orchestrator.sendMessage(message, conversation, systemPrompt, cancellation);
    }
}
