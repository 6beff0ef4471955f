package io.mycelic.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A global request budget plus optional budgets per tool ({@code search}, {@code store_memory},
 * {@code relationships}, ...). A call must fit in both.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RateLimitConfig(
    boolean enabled,
    LimitConfig global,
    Map<String, LimitConfig> tools
) {

    public RateLimitConfig {
        tools = tools == null ? Map.of() : Map.copyOf(tools);
    }

    public static RateLimitConfig defaults() {
        Map<String, LimitConfig> tools = new LinkedHashMap<>();
        tools.put("search", new LimitConfig(20, 40));
        tools.put("store_memory", new LimitConfig(30, 60));
        tools.put("relationships", new LimitConfig(20, 40));
        return new RateLimitConfig(true, new LimitConfig(100, 200), tools);
    }

    public static RateLimitConfig disabled() {
        return new RateLimitConfig(false, new LimitConfig(100, 200), Map.of());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LimitConfig(
        @JsonAlias({"requests_per_second"}) double requestsPerSecond,
        @JsonAlias({"burst_size"}) int burstSize
    ) {
    }
}
