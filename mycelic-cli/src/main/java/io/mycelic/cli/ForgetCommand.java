package io.mycelic.cli;

import io.mycelic.core.MemoryEngine;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "forget", description = "Delete a memory with its tags, links and embedding")
public final class ForgetCommand extends EngineCommand {

    @Parameters(index = "0", description = "Memory id")
    String id;

    public ForgetCommand(CliContext context) {
        super(context);
    }

    @Override
    protected String label() {
        return "Forget";
    }

    @Override
    protected Object run(MemoryEngine engine) {
        engine.memories().delete(id);
        return Map.of("deleted", id);
    }
}
