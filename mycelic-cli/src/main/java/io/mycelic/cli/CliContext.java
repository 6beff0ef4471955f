package io.mycelic.cli;

import io.mycelic.core.MemoryEngine;
import io.mycelic.core.config.ConfigService;
import io.mycelic.core.config.model.MycelicConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Function;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Function<MycelicConfig, MemoryEngine> engineFactory,
    ServeRunner serveRunner
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, MemoryEngine::open, (config, rest, mcp) -> {
            throw new UnsupportedOperationException("serve runner is not configured");
        });
    }

    public MycelicConfig loadConfig() throws IOException {
        return configService.load(configPath);
    }

    public MemoryEngine openEngine() throws IOException {
        return engineFactory.apply(loadConfig());
    }
}
