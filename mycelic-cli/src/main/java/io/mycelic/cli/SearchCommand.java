package io.mycelic.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mycelic.core.MemoryEngine;
import io.mycelic.core.api.RequestReader;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "search", description = "Search memories by keyword, meaning, tags or date")
public final class SearchCommand extends EngineCommand {

    @Parameters(index = "0", arity = "0..1", description = "Query text (not needed for tag or date searches)")
    String query;

    @Option(names = {"-m", "--mode"}, description = "keyword, semantic, hybrid, tag or date_range (default keyword)")
    String mode;

    @Option(names = {"-t", "--tags"}, split = ",")
    List<String> tags;

    @Option(names = "--tag-operator", description = "AND or OR")
    String tagOperator;

    @Option(names = "--start", description = "ISO-8601 date or instant")
    String start;

    @Option(names = "--end", description = "ISO-8601 date or instant; a plain date includes the whole day")
    String end;

    @Option(names = {"-d", "--domain"})
    String domain;

    @Option(names = {"-s", "--session"})
    String sessionId;

    @Option(names = "--session-mode", description = "all, session_only or session_and_shared")
    String sessionMode;

    @Option(names = "--scope")
    String accessScope;

    @Option(names = {"-n", "--limit"})
    Integer limit;

    @Option(names = "--min-relevance")
    Double minRelevance;

    public SearchCommand(CliContext context) {
        super(context);
    }

    @Override
    protected String label() {
        return "Search";
    }

    @Override
    protected Object run(MemoryEngine engine) {
        ObjectNode body = args();
        put(body, "query", query);
        put(body, "mode", mode);
        put(body, "tags", tags);
        put(body, "tag_operator", tagOperator);
        put(body, "start", start);
        put(body, "end", end);
        put(body, "domain", domain);
        put(body, "session_id", sessionId);
        put(body, "session_filter_mode", sessionMode);
        put(body, "access_scope", accessScope);
        put(body, "limit", limit);
        put(body, "min_relevance", minRelevance);
        return engine.search().search(RequestReader.searchRequest(body));
    }
}
