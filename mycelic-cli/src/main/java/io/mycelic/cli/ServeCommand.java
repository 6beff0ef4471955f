package io.mycelic.cli;

import io.mycelic.core.config.model.MycelicConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "serve", description = "Run the REST API and the MCP server until interrupted")
public final class ServeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--rest", negatable = true, description = "Start the REST API (default from config)")
    Boolean rest;

    @Option(names = "--mcp", negatable = true, description = "Start the MCP server (default from config)")
    Boolean mcp;

    public ServeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MycelicConfig config = context.loadConfig();
            boolean startRest = rest == null ? config.restApi().enabled() : rest;
            boolean startMcp = mcp == null ? config.mcp().enabled() : mcp;
            if (!startRest && !startMcp) {
                System.err.println("Serve failed: both the REST API and the MCP server are disabled");
                return ExitCodes.INVALID_INPUT;
            }
            return context.serveRunner().run(config, startRest, startMcp);
        } catch (Exception e) {
            System.err.println("Serve failed: " + e.getMessage());
            return 1;
        }
    }
}
