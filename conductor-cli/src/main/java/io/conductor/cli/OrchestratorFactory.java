package io.conductor.cli;

import io.conductor.core.config.model.ConductorConfig;
import io.conductor.core.orchestrator.LlmOrchestrator;
import java.io.IOException;

/**
 * Builds a started orchestrator for one command invocation. The command closes it when done.
 */
@FunctionalInterface
public interface OrchestratorFactory {
    LlmOrchestrator open(ConductorConfig config) throws IOException;
}
