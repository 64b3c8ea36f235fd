package io.conductor.cli;

import java.nio.file.Path;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "conductor", mixinStandardHelpOptions = true, description = "Conductor LLM orchestration shell")
public final class ConductorCliCommand implements Runnable {

    @Option(names = {"--config"}, description = "Config file (default: ~/.conductor/config.json)")
    Path configPath;

    /**
     * Full command tree bound to {@code context}.
     */
    public static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new ConductorCliCommand());
        commandLine.addSubcommand("chat", new ChatCommand(context));
        commandLine.addSubcommand("history", new HistoryCommand(context));
        commandLine.addSubcommand("delete", new DeleteCommand(context));
        commandLine.addSubcommand("providers", new ProvidersCommand(context));
        commandLine.addSubcommand("models", new ModelsCommand(context));
        commandLine.addSubcommand("init", new InitCommand(context));
        return commandLine;
    }

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
