package io.mycelic.cli;

import io.mycelic.core.MemoryEngine;
import io.mycelic.core.graph.RelationshipType;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "related", description = "Memories directly linked to a memory, strongest first")
public final class RelatedCommand extends EngineCommand {

    @Parameters(index = "0", description = "Memory id")
    String id;

    @Option(names = "--min-strength")
    Double minStrength;

    @Option(names = "--type")
    String type;

    @Option(names = {"-n", "--limit"})
    Integer limit;

    public RelatedCommand(CliContext context) {
        super(context);
    }

    @Override
    protected String label() {
        return "Related";
    }

    @Override
    protected Object run(MemoryEngine engine) {
        RelationshipType relationshipType = type == null ? null : RelationshipType.parse(type);
        return engine.relationships().findRelated(id, minStrength, relationshipType, limit);
    }
}
