package io.mycelic.cli;

import io.mycelic.core.config.model.MycelicConfig;

@FunctionalInterface
public interface ServeRunner {
    int run(MycelicConfig config, boolean rest, boolean mcp) throws Exception;
}
