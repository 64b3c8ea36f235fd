package io.conductor.cli;

import io.conductor.core.config.ConfigService;
import io.conductor.core.config.model.ConductorConfig;
import io.conductor.core.orchestrator.LlmOrchestrator;
import java.io.IOException;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    OrchestratorFactory orchestrators
) {

    /**
     * Config path honoring the root command's {@code --config} option when present.
     */
    Path configPath(ConductorCliCommand root) {
        return root == null || root.configPath == null ? configPath : root.configPath;
    }

    LlmOrchestrator open(ConductorCliCommand root) throws IOException {
        ConductorConfig config = configService.load(configPath(root));
        return orchestrators.open(config);
    }
}
