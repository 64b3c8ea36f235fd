package io.conductor.app;

import io.conductor.cli.CliContext;
import io.conductor.cli.ConductorCliCommand;
import io.conductor.core.config.ConfigPaths;
import io.conductor.core.config.ConfigService;
import io.conductor.core.config.model.ConductorConfig;
import io.conductor.core.config.model.StorageConfig;
import io.conductor.core.conversation.ConversationRepository;
import io.conductor.core.conversation.FileConversationRepository;
import io.conductor.core.conversation.InMemoryConversationRepository;
import io.conductor.core.conversation.SqliteConversationRepository;
import io.conductor.core.orchestrator.LlmOrchestrator;
import io.conductor.core.orchestrator.OrchestratorSettings;
import io.conductor.core.prompt.StaticSystemPromptProvider;
import io.conductor.core.provider.ProviderRegistry;
import io.conductor.core.tool.ToolRegistry;
import io.conductor.providers.ProviderFactory;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ConductorApplication {
    private static final Logger LOG = LoggerFactory.getLogger(ConductorApplication.class);

    private ConductorApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        CliContext context = new CliContext(configService, configPath, ConductorApplication::openOrchestrator);

        int exitCode = ConductorCliCommand.commandLine(context).execute(args);
        System.exit(exitCode);
    }

    /**
     * Wires providers, storage and tools from {@code config} and starts the orchestrator.
     */
    static LlmOrchestrator openOrchestrator(ConductorConfig config) throws IOException {
        Clock clock = Clock.systemUTC();
        ProviderRegistry registry = ProviderFactory.registryFor(config.providers());
        ConversationRepository repository = buildConversationRepository(config.storage());

        ToolRegistry tools = new ToolRegistry(Map.of("clock", clock));
        tools.register(new ClockTool());

        LlmOrchestrator orchestrator = new LlmOrchestrator(
            registry,
            repository,
            new StaticSystemPromptProvider(config.orchestrator().systemPrompt()),
            tools,
            OrchestratorSettings.from(config),
            clock
        );
        orchestrator.start();
        LOG.debug("Orchestrator started with {} providers", registry.all().size());
        return orchestrator;
    }

    static ConversationRepository buildConversationRepository(StorageConfig storage) throws IOException {
        String backend = System.getenv().getOrDefault("CONDUCTOR_CONVERSATION_STORE", storage.backend())
            .trim()
            .toLowerCase(Locale.ROOT);
        String rawPath = System.getenv().getOrDefault("CONDUCTOR_CONVERSATION_PATH", storage.path());
        switch (backend) {
            case "memory":
                return new InMemoryConversationRepository();
            case "file":
                return new FileConversationRepository(
                    ConfigPaths.resolve(rawPath, Path.of(System.getProperty("user.home"), ".conductor", "conversations"))
                );
            case "sqlite":
                Path sqlitePath = ConfigPaths.resolve(rawPath, Path.of(System.getProperty("user.home"), ".conductor", "conversations.db"));
                try {
                    return new SqliteConversationRepository(sqlitePath);
                } catch (IOException e) {
                    throw new IOException("Failed to initialize SQLite conversation store at " + sqlitePath, e);
                }
            default:
                throw new IllegalArgumentException("Unknown storage backend: " + backend);
        }
    }
}
