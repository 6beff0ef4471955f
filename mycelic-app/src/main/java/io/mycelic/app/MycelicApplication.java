package io.mycelic.app;

import io.mycelic.cli.CliContext;
import io.mycelic.cli.MycelicCliCommand;
import io.mycelic.core.MemoryEngine;
import io.mycelic.core.api.RestApiServer;
import io.mycelic.core.config.ConfigPaths;
import io.mycelic.core.config.ConfigService;
import io.mycelic.core.config.model.MycelicConfig;
import io.mycelic.core.config.model.RestApiConfig;
import io.mycelic.mcp.server.McpHttpServer;
import io.mycelic.mcp.server.McpServerApplication;
import io.mycelic.mcp.server.config.McpServerConfig;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class MycelicApplication {
    private static final Logger LOG = LoggerFactory.getLogger(MycelicApplication.class);

    private MycelicApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = configPath();

        CliContext context = new CliContext(
            configService,
            configPath,
            MemoryEngine::open,
            MycelicApplication::serve
        );

        CommandLine commandLine = MycelicCliCommand.commandLine(context);
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static Path configPath() {
        String override = System.getenv("MYCELIC_CONFIG");
        if (override != null && !override.isBlank()) {
            return ConfigPaths.resolve(override.trim());
        }
        return ConfigPaths.defaultConfigPath();
    }

    private static int serve(MycelicConfig config, boolean rest, boolean mcp) throws Exception {
        CountDownLatch shutdown = new CountDownLatch(1);
        RestApiServer restServer = null;
        McpHttpServer mcpServer = null;
        try (MemoryEngine engine = MemoryEngine.open(config)) {
            if (rest) {
                RestApiConfig restConfig = config.restApi();
                restServer = new RestApiServer(engine, restConfig.host(), restConfig.port(), restConfig.corsEnabled());
                restServer.start();
                System.out.println("REST API started on http://" + restConfig.host() + ":" + restServer.port() + "/api/v1");
            }
            if (mcp) {
                McpServerConfig mcpConfig = McpServerConfig.fromEnv(config.mcp());
                mcpServer = McpServerApplication.start(engine, mcpConfig);
                System.out.println("MCP server started on http://" + mcpConfig.host() + ":" + mcpServer.port() + "/mcp");
            }
            System.out.println("Database: " + engine.databasePath());
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            shutdown.await();
        } finally {
            if (mcpServer != null) {
                mcpServer.close();
            }
            if (restServer != null) {
                restServer.close();
            }
            LOG.info("Servers stopped");
        }
        return 0;
    }
}
