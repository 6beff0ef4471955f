package io.mycelic.mcp.server.model;

import io.mycelic.core.error.ErrorKind;
import java.util.Locale;

/**
 * Outcome of one tool call. {@code errorKind} is set only when {@code ok} is false.
 */
public record ToolCallResponse(
    boolean ok,
    String message,
    Object data,
    String errorKind
) {
    public static ToolCallResponse ok(String message, Object data) {
        return new ToolCallResponse(true, message, data, null);
    }

    public static ToolCallResponse error(String errorKind, String message) {
        return new ToolCallResponse(false, message, null, errorKind);
    }

    public static ToolCallResponse error(ErrorKind kind, String message) {
        return error(kind.name().toLowerCase(Locale.ROOT), message);
    }
}
