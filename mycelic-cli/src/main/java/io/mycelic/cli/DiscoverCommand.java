package io.mycelic.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mycelic.core.MemoryEngine;
import io.mycelic.core.api.RequestReader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "discover", description = "Link similar memories using their embeddings")
public final class DiscoverCommand extends EngineCommand {

    @Option(names = {"-n", "--limit"})
    Integer limit;

    @Option(names = "--min-strength", description = "Minimum similarity (default 0.7)")
    Double minStrength;

    @Option(names = "--timeout")
    Integer timeoutSeconds;

    public DiscoverCommand(CliContext context) {
        super(context);
    }

    @Override
    protected String label() {
        return "Discover";
    }

    @Override
    protected Object run(MemoryEngine engine) {
        ObjectNode params = args();
        put(params, "timeout_seconds", timeoutSeconds);
        return engine.relationships().discover(limit, minStrength, RequestReader.timeout(params));
    }
}
