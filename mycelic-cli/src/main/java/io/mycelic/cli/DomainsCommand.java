package io.mycelic.cli;

import io.mycelic.core.MemoryEngine;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "domains", description = "List knowledge domains, or manage them with a subcommand")
public final class DomainsCommand extends EngineCommand {

    public DomainsCommand(CliContext context) {
        super(context);
    }

    static CommandLine commandLine(CliContext context) {
        return new CommandLine(new DomainsCommand(context))
            .addSubcommand("create", new Create(context))
            .addSubcommand("stats", new Stats(context));
    }

    @Override
    protected String label() {
        return "Domains";
    }

    @Override
    protected Object run(MemoryEngine engine) {
        return engine.domains().list();
    }

    @Command(name = "create", description = "Create a domain")
    static final class Create extends EngineCommand {
        @Parameters(index = "0")
        String name;

        @Option(names = "--description")
        String description;

        Create(CliContext context) {
            super(context);
        }

        @Override
        protected String label() {
            return "Create domain";
        }

        @Override
        protected Object run(MemoryEngine engine) {
            return engine.domains().create(name, description);
        }
    }

    @Command(name = "stats", description = "Memory count and importance for one domain")
    static final class Stats extends EngineCommand {
        @Parameters(index = "0")
        String name;

        Stats(CliContext context) {
            super(context);
        }

        @Override
        protected String label() {
            return "Domain stats";
        }

        @Override
        protected Object run(MemoryEngine engine) {
            return engine.domains().stats(name);
        }
    }
}
