package io.mycelic.mcp.server.config;

import io.mycelic.core.config.model.McpConfig;

/**
 * Listener settings for the MCP server: the {@code mcp} section of the config file, overridden by
 * {@code MYCELIC_MCP_HOST} and {@code MYCELIC_MCP_PORT}.
 */
public record McpServerConfig(
    String host,
    int port
) {
    public static McpServerConfig fromEnv(McpConfig file) {
        McpConfig base = file == null ? McpConfig.defaults() : file;
        return new McpServerConfig(
            env("MYCELIC_MCP_HOST", base.host()),
            intEnv("MYCELIC_MCP_PORT", base.port())
        );
    }

    private static String env(String key, String fallback) {
        String value = System.getenv(key);
        return value == null || value.isBlank() ? fallback : value;
    }

    private static int intEnv(String key, int fallback) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
