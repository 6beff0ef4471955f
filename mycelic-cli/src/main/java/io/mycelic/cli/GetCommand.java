package io.mycelic.cli;

import io.mycelic.core.MemoryEngine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "get", description = "Show one memory by id or slug")
public final class GetCommand extends EngineCommand {

    @Parameters(index = "0", description = "Memory id, or slug with --slug")
    String key;

    @Option(names = "--slug", description = "Treat the argument as a slug")
    boolean bySlug;

    public GetCommand(CliContext context) {
        super(context);
    }

    @Override
    protected String label() {
        return "Get";
    }

    @Override
    protected Object run(MemoryEngine engine) {
        return bySlug ? engine.memories().getBySlug(key) : engine.memories().get(key);
    }
}
