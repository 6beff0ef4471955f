package io.mycelic.cli;

import io.mycelic.core.MemoryEngine;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "reindex", description = "Embed memories that have no embedding yet")
public final class ReindexCommand extends EngineCommand {

    @Option(names = {"-n", "--limit"}, defaultValue = "100")
    int limit;

    public ReindexCommand(CliContext context) {
        super(context);
    }

    @Override
    protected String label() {
        return "Reindex";
    }

    @Override
    protected Object run(MemoryEngine engine) {
        return Map.of("embedded", engine.memories().reindexMissingEmbeddings(limit));
    }
}
