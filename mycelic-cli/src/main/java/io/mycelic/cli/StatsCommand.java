package io.mycelic.cli;

import io.mycelic.core.MemoryEngine;
import picocli.CommandLine.Command;

@Command(name = "stats", description = "Totals across memories, relationships, sessions, domains and categories")
public final class StatsCommand extends EngineCommand {

    public StatsCommand(CliContext context) {
        super(context);
    }

    @Override
    protected String label() {
        return "Stats";
    }

    @Override
    protected Object run(MemoryEngine engine) {
        return engine.stats().summary();
    }
}
