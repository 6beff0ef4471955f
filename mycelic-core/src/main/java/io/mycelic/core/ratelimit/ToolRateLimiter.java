package io.mycelic.core.ratelimit;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.mycelic.core.config.model.RateLimitConfig;
import io.mycelic.core.config.model.RateLimitConfig.LimitConfig;
import io.mycelic.core.error.RateLimitedException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Global plus per-tool request budgets shared by the REST and MCP front ends.
 *
 * <p>Each budget admits {@code burst_size} calls per refresh period of
 * {@code burst_size / requests_per_second} seconds. A call never waits: it either gets a permit
 * or fails with {@link RateLimitedException}. The tool budget is checked before the global one,
 * so a call rejected by its tool does not spend a global permit.
 */
public final class ToolRateLimiter {
    private static final Logger LOG = LoggerFactory.getLogger(ToolRateLimiter.class);

    public static final String GLOBAL = "global";
    public static final String DEFAULT_TOOL = "default";

    private final boolean enabled;
    private final RateLimiter global;
    private final Map<String, RateLimiter> tools = new HashMap<>();

    public ToolRateLimiter(RateLimitConfig config) {
        RateLimitConfig effective = config == null ? RateLimitConfig.defaults() : config;
        LimitConfig globalLimit = effective.global() == null ? RateLimitConfig.defaults().global() : effective.global();
        this.enabled = effective.enabled();

        RateLimiterRegistry registry = RateLimiterRegistry.ofDefaults();
        this.global = registry.rateLimiter(GLOBAL, limiterConfig(GLOBAL, globalLimit));
        for (Map.Entry<String, LimitConfig> entry : effective.tools().entrySet()) {
            String tool = entry.getKey();
            tools.put(tool, registry.rateLimiter("tool." + tool, limiterConfig(tool, entry.getValue())));
        }
        if (enabled) {
            LOG.debug("Rate limits: global {}/s burst {}, tools {}", globalLimit.requestsPerSecond(),
                globalLimit.burstSize(), effective.tools().keySet());
        }
    }

    public static ToolRateLimiter unlimited() {
        return new ToolRateLimiter(RateLimitConfig.disabled());
    }

    public boolean enabled() {
        return enabled;
    }

    /**
     * Takes one permit for {@code tool} and one from the global budget.
     *
     * @throws RateLimitedException when either budget is exhausted
     */
    public void acquire(String tool) {
        if (!enabled) {
            return;
        }
        String name = tool == null || tool.isBlank() ? DEFAULT_TOOL : tool;
        RateLimiter toolLimiter = tools.get(name);
        if (toolLimiter != null && !toolLimiter.acquirePermission()) {
            throw rejected(name, toolLimiter);
        }
        if (!global.acquirePermission()) {
            throw rejected(GLOBAL, global);
        }
    }

    private static RateLimitedException rejected(String name, RateLimiter limiter) {
        Duration period = limiter.getRateLimiterConfig().getLimitRefreshPeriod();
        long seconds = Math.max(1L, (period.toMillis() + 999L) / 1000L);
        LOG.debug("Rejected call over the {} rate limit", name);
        return new RateLimitedException(name, Duration.ofSeconds(seconds));
    }

    static RateLimiterConfig limiterConfig(String name, LimitConfig limit) {
        if (limit == null || limit.requestsPerSecond() <= 0 || limit.burstSize() <= 0) {
            throw new IllegalArgumentException("Rate limit '" + name
                + "' needs a positive requests_per_second and burst_size");
        }
        long periodNanos = Math.max(1L, Math.round(limit.burstSize() / limit.requestsPerSecond() * 1_000_000_000d));
        return RateLimiterConfig.custom()
            .limitForPeriod(limit.burstSize())
            .limitRefreshPeriod(Duration.ofNanos(periodNanos))
            .timeoutDuration(Duration.ZERO)
            .build();
    }
}
