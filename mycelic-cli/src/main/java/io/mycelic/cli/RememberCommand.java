package io.mycelic.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mycelic.core.MemoryEngine;
import io.mycelic.core.api.RequestReader;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "remember", description = "Store a new memory")
public final class RememberCommand extends EngineCommand {

    @Parameters(index = "0", description = "Memory content")
    String content;

    @Option(names = {"-i", "--importance"}, description = "Importance from 1 to 10 (default 5)")
    Integer importance;

    @Option(names = {"-t", "--tags"}, split = ",", description = "Comma separated tags")
    List<String> tags;

    @Option(names = {"-d", "--domain"})
    String domain;

    @Option(names = "--source")
    String source;

    @Option(names = {"-s", "--session"}, description = "Session id (default from config)")
    String sessionId;

    @Option(names = "--agent-type")
    String agentType;

    @Option(names = "--agent-context")
    String agentContext;

    @Option(names = "--scope", description = "session, shared or global")
    String accessScope;

    @Option(names = "--slug")
    String slug;

    public RememberCommand(CliContext context) {
        super(context);
    }

    @Override
    protected String label() {
        return "Remember";
    }

    @Override
    protected Object run(MemoryEngine engine) {
        ObjectNode body = args();
        put(body, "content", content);
        put(body, "importance", importance);
        put(body, "tags", tags);
        put(body, "domain", domain);
        put(body, "source", source);
        put(body, "session_id", sessionId);
        put(body, "agent_type", agentType == null ? engine.config().session().defaultAgentType() : agentType);
        put(body, "agent_context", agentContext);
        put(body, "access_scope", accessScope);
        put(body, "slug", slug);
        return engine.memories().create(RequestReader.memoryDraft(body, engine.config().session().defaultSessionId()));
    }
}
