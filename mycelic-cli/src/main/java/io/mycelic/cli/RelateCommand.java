package io.mycelic.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mycelic.core.MemoryEngine;
import io.mycelic.core.api.RequestReader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "relate", description = "Link two memories")
public final class RelateCommand extends EngineCommand {

    @Parameters(index = "0", description = "Source memory id")
    String sourceId;

    @Parameters(index = "1", description = "Target memory id")
    String targetId;

    @Option(names = "--type", required = true,
        description = "references, contradicts, expands, similar, sequential, causes or enables")
    String type;

    @Option(names = "--strength", description = "0.0 to 1.0 (default 0.5)")
    Double strength;

    @Option(names = "--context")
    String relationContext;

    public RelateCommand(CliContext context) {
        super(context);
    }

    @Override
    protected String label() {
        return "Relate";
    }

    @Override
    protected Object run(MemoryEngine engine) {
        ObjectNode body = args();
        put(body, "source_id", sourceId);
        put(body, "target_id", targetId);
        put(body, "relationship_type", type);
        put(body, "strength", strength);
        put(body, "context", relationContext);
        return engine.relationships().create(RequestReader.relationshipDraft(body));
    }
}
