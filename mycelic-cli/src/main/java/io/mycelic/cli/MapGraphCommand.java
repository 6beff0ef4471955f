package io.mycelic.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mycelic.core.MemoryEngine;
import io.mycelic.core.api.RequestReader;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "map-graph", description = "Walk relationships outward from a memory")
public final class MapGraphCommand extends EngineCommand {

    @Parameters(index = "0", description = "Root memory id")
    String rootId;

    @Option(names = "--depth", description = "Maximum hops, up to 5 (default 2)")
    Integer depth;

    @Option(names = "--types", split = ",")
    List<String> types;

    @Option(names = "--min-strength")
    Double minStrength;

    @Option(names = "--timeout", description = "Seconds before the walk stops with a partial graph")
    Integer timeoutSeconds;

    public MapGraphCommand(CliContext context) {
        super(context);
    }

    @Override
    protected String label() {
        return "Map graph";
    }

    @Override
    protected Object run(MemoryEngine engine) {
        ObjectNode params = args();
        put(params, "depth", depth);
        put(params, "types", types);
        put(params, "min_strength", minStrength);
        put(params, "timeout_seconds", timeoutSeconds);
        return engine.relationships().mapGraph(RequestReader.graphQuery(rootId, params));
    }
}
