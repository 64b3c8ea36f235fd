package io.conductor.cli;

import io.conductor.core.model.ModelInfo;
import io.conductor.core.orchestrator.LlmOrchestrator;
import io.conductor.core.provider.LlmProvider;
import io.conductor.core.provider.ProviderSnapshot;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(name = "models", description = "List models, or refresh catalogs with 'models refresh'")
public final class ModelsCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    ConductorCliCommand root;

    @Parameters(index = "0", arity = "0..1", description = "Action: list (default) or refresh")
    String action;

    @Option(names = {"-p", "--provider"}, description = "Limit to one provider")
    String provider;

    public ModelsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        boolean refresh = "refresh".equalsIgnoreCase(action);
        if (action != null && !refresh && !"list".equalsIgnoreCase(action)) {
            System.err.println("Unknown action: " + action);
            return 2;
        }
        try (LlmOrchestrator orchestrator = context.open(root)) {
            if (refresh) {
                boolean ok = provider == null ? orchestrator.refreshModels() : orchestrator.refreshModelsForProvider(provider);
                if (!ok) {
                    System.err.println(provider == null ? "Model refresh already running" : "Could not refresh " + provider);
                    return 1;
                }
                System.out.println("Model catalogs refreshed");
            }
            for (ProviderSnapshot snapshot : orchestrator.providers()) {
                if (provider != null && !snapshot.name().equalsIgnoreCase(provider)) {
                    continue;
                }
                Optional<LlmProvider> found = orchestrator.getProvider(snapshot.name());
                if (found.isEmpty()) {
                    continue;
                }
                System.out.println(snapshot.name() + " (current: " + snapshot.modelId() + ")");
                for (ModelInfo model : found.get().availableModels()) {
                    System.out.println("  " + model.id() + "  context=" + model.maxContextLength()
                        + (model.supportsToolCalls() ? "  tools" : "")
                        + (model.supportsVision() ? "  vision" : ""));
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Models command failed: " + e.getMessage());
            return 1;
        }
    }
}
