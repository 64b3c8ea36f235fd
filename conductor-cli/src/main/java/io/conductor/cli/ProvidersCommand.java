package io.conductor.cli;

import io.conductor.core.orchestrator.LlmOrchestrator;
import io.conductor.core.provider.LlmProvider;
import io.conductor.core.provider.ProviderSnapshot;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(name = "providers", description = "Show provider status")
public final class ProvidersCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    ConductorCliCommand root;

    public ProvidersCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (LlmOrchestrator orchestrator = context.open(root)) {
            Optional<String> active = orchestrator.activeProvider().map(LlmProvider::name);
            System.out.println("Config path: " + context.configPath(root));
            System.out.println("Active provider: " + active.orElse("none"));
            System.out.printf("%-2s %-16s %-12s %-10s %-32s %s%n", "", "NAME", "STATUS", "KEY", "MODEL", "CAPABILITIES");
            for (ProviderSnapshot snapshot : orchestrator.providers()) {
                String marker = active.filter(snapshot.name()::equals).isPresent() ? "*" : "";
                System.out.printf(
                    "%-2s %-16s %-12s %-10s %-32s %s%n",
                    marker,
                    snapshot.name(),
                    snapshot.status(),
                    snapshot.credentialed() ? "yes" : "missing",
                    snapshot.modelId(),
                    capabilities(snapshot)
                );
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Providers command failed: " + e.getMessage());
            return 1;
        }
    }

    private String capabilities(ProviderSnapshot snapshot) {
        StringBuilder builder = new StringBuilder();
        if (snapshot.supportsStreaming()) {
            builder.append("stream ");
        }
        if (snapshot.supportsToolCalls()) {
            builder.append("tools ");
        }
        if (snapshot.supportsVision()) {
            builder.append("vision ");
        }
        if (snapshot.sinceLastFailure() != null) {
            builder.append("failed ").append(snapshot.sinceLastFailure().toSeconds()).append("s ago");
        }
        return builder.toString().trim();
    }
}
