package io.mycelic.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(name = "mycelic", mixinStandardHelpOptions = true, version = "mycelic 0.1.0",
    description = "Persistent memory for AI agents")
public final class MycelicCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }

    public static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new MycelicCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("remember", new RememberCommand(context));
        commandLine.addSubcommand("get", new GetCommand(context));
        commandLine.addSubcommand("update", new UpdateCommand(context));
        commandLine.addSubcommand("forget", new ForgetCommand(context));
        commandLine.addSubcommand("list", new ListCommand(context));
        commandLine.addSubcommand("search", new SearchCommand(context));
        commandLine.addSubcommand("relate", new RelateCommand(context));
        commandLine.addSubcommand("related", new RelatedCommand(context));
        commandLine.addSubcommand("map-graph", new MapGraphCommand(context));
        commandLine.addSubcommand("discover", new DiscoverCommand(context));
        commandLine.addSubcommand("categories", CategoriesCommand.commandLine(context));
        commandLine.addSubcommand("domains", DomainsCommand.commandLine(context));
        commandLine.addSubcommand("sessions", SessionsCommand.commandLine(context));
        commandLine.addSubcommand("stats", new StatsCommand(context));
        commandLine.addSubcommand("reindex", new ReindexCommand(context));
        commandLine.addSubcommand("serve", new ServeCommand(context));
        return commandLine;
    }
}
