package io.mycelic.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mycelic.core.MemoryEngine;
import io.mycelic.core.api.RequestReader;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "update", description = "Change fields of a memory; omitted options stay as they are")
public final class UpdateCommand extends EngineCommand {

    @Parameters(index = "0", description = "Memory id")
    String id;

    @Option(names = {"-c", "--content"})
    String content;

    @Option(names = {"-i", "--importance"})
    Integer importance;

    @Option(names = {"-t", "--tags"}, split = ",", description = "Replaces all tags")
    List<String> tags;

    @Option(names = "--source")
    String source;

    @Option(names = {"-d", "--domain"})
    String domain;

    public UpdateCommand(CliContext context) {
        super(context);
    }

    @Override
    protected String label() {
        return "Update";
    }

    @Override
    protected Object run(MemoryEngine engine) {
        ObjectNode body = args();
        put(body, "content", content);
        put(body, "importance", importance);
        put(body, "tags", tags);
        put(body, "source", source);
        put(body, "domain", domain);
        return engine.memories().update(id, RequestReader.memoryUpdate(body));
    }
}
