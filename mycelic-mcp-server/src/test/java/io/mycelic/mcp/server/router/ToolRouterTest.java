package io.mycelic.mcp.server.router;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mycelic.core.config.model.RateLimitConfig;
import io.mycelic.core.config.model.RateLimitConfig.LimitConfig;
import io.mycelic.core.error.NotFoundException;
import io.mycelic.core.ratelimit.ToolRateLimiter;
import io.mycelic.mcp.server.ToolRouter;
import io.mycelic.mcp.server.model.ToolCallResponse;
import io.mycelic.mcp.server.model.ToolDefinition;
import io.mycelic.mcp.server.provider.ToolProvider;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolRouterTest {
    private final ObjectMapper mapper = new ObjectMapper();

    private ToolProvider demo() {
        return new ToolProvider() {
            @Override
            public String name() {
                return "demo";
            }

            @Override
            public List<ToolDefinition> tools() {
                return List.of(
                    new ToolDefinition("demo_echo", "Echo", Map.of(), "demo", false),
                    new ToolDefinition("demo_missing", "Always missing", Map.of(), "demo", false)
                );
            }

            @Override
            public ToolCallResponse execute(String toolName, JsonNode arguments) {
                if (toolName.equals("demo_missing")) {
                    throw new NotFoundException("Memory not found: m-1");
                }
                return ToolCallResponse.ok("ok", Map.of("tool", toolName, "x", arguments.path("x").asInt()));
            }
        };
    }

    @Test
    void routesToolCallsToCorrectProvider() {
        ToolRouter router = new ToolRouter(List.of(demo()));

        ToolCallResponse response = router.callTool("demo_echo", mapper.createObjectNode().put("x", 1));

        assertThat(response.ok()).isTrue();
        assertThat(response.data()).isEqualTo(Map.of("tool", "demo_echo", "x", 1));
        assertThat(router.listTools()).extracting(ToolDefinition::name).containsExactly("demo_echo", "demo_missing");
    }

    @Test
    void turnsEngineErrorsIntoErrorResults() {
        ToolRouter router = new ToolRouter(List.of(demo()));

        ToolCallResponse response = router.callTool("demo_missing", null);

        assertThat(response.ok()).isFalse();
        assertThat(response.errorKind()).isEqualTo("not_found");
        assertThat(response.message()).contains("m-1");
    }

    @Test
    void returnsErrorForUnknownToolOrBadArguments() {
        ToolRouter router = new ToolRouter(List.of(demo()));

        ToolCallResponse unknown = router.callTool("missing_tool", null);
        assertThat(unknown.ok()).isFalse();
        assertThat(unknown.message()).contains("Unknown tool");

        ToolCallResponse notObject = router.callTool("demo_echo", mapper.createArrayNode());
        assertThat(notObject.ok()).isFalse();
        assertThat(notObject.errorKind()).isEqualTo("validation");
    }

    @Test
    void rejectsCallsOverToolBudgetWithoutTouchingOtherTools() {
        RateLimitConfig limits = new RateLimitConfig(true, new LimitConfig(1000, 1000),
            Map.of("demo_echo", new LimitConfig(0.01, 1)));
        ToolRouter router = new ToolRouter(List.of(demo()), new ToolRateLimiter(limits));

        assertThat(router.callTool("demo_echo", null).ok()).isTrue();
        ToolCallResponse limited = router.callTool("demo_echo", null);

        assertThat(limited.ok()).isFalse();
        assertThat(limited.errorKind()).isEqualTo("rate_limited");
        assertThat(limited.message()).contains("demo_echo");
        assertThat(router.callTool("demo_missing", null).errorKind()).isEqualTo("not_found");
    }
}
