package io.mycelic.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mycelic.core.MemoryEngine;
import io.mycelic.core.api.RequestReader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "list", description = "List memories, newest first")
public final class ListCommand extends EngineCommand {

    @Option(names = {"-d", "--domain"})
    String domain;

    @Option(names = {"-s", "--session"})
    String sessionId;

    @Option(names = "--min-importance")
    Integer minImportance;

    @Option(names = "--max-importance")
    Integer maxImportance;

    @Option(names = {"-n", "--limit"})
    Integer limit;

    @Option(names = "--offset")
    Integer offset;

    public ListCommand(CliContext context) {
        super(context);
    }

    @Override
    protected String label() {
        return "List";
    }

    @Override
    protected Object run(MemoryEngine engine) {
        ObjectNode params = args();
        put(params, "domain", domain);
        put(params, "session_id", sessionId);
        put(params, "min_importance", minImportance);
        put(params, "max_importance", maxImportance);
        put(params, "limit", limit);
        put(params, "offset", offset);
        return engine.memories().list(RequestReader.memoryQuery(params));
    }
}
