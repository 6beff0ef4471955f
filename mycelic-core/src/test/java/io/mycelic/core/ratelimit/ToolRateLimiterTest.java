package io.mycelic.core.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mycelic.core.config.model.RateLimitConfig;
import io.mycelic.core.config.model.RateLimitConfig.LimitConfig;
import io.mycelic.core.error.ErrorKind;
import io.mycelic.core.error.RateLimitedException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolRateLimiterTest {

    @Test
    void shouldRejectToolOnceItsBurstIsSpent() {
        ToolRateLimiter limiter = new ToolRateLimiter(new RateLimitConfig(true, new LimitConfig(1000, 1000),
            Map.of("search", new LimitConfig(0.01, 2))));

        limiter.acquire("search");
        limiter.acquire("search");

        assertThatThrownBy(() -> limiter.acquire("search"))
            .isInstanceOfSatisfying(RateLimitedException.class, e -> {
                assertThat(e.kind()).isEqualTo(ErrorKind.RATE_LIMITED);
                assertThat(e.limit()).isEqualTo("search");
                assertThat(e.retryAfter().toSeconds()).isEqualTo(200);
            });
        assertThatCode(() -> limiter.acquire("store_memory")).doesNotThrowAnyException();
    }

    @Test
    void shouldApplyGlobalBudgetAcrossTools() {
        ToolRateLimiter limiter = new ToolRateLimiter(new RateLimitConfig(true, new LimitConfig(0.01, 3), Map.of()));

        limiter.acquire("search");
        limiter.acquire("store_memory");
        limiter.acquire(null);

        assertThatThrownBy(() -> limiter.acquire("relationships"))
            .isInstanceOfSatisfying(RateLimitedException.class, e -> assertThat(e.limit()).isEqualTo("global"));
    }

    @Test
    void shouldNotSpendGlobalPermitWhenToolRejects() {
        ToolRateLimiter limiter = new ToolRateLimiter(new RateLimitConfig(true, new LimitConfig(0.01, 2),
            Map.of("search", new LimitConfig(0.01, 1))));

        limiter.acquire("search");
        assertThatThrownBy(() -> limiter.acquire("search")).isInstanceOf(RateLimitedException.class);

        assertThatCode(() -> limiter.acquire("stats")).doesNotThrowAnyException();
    }

    @Test
    void shouldAdmitEverythingWhenDisabled() {
        ToolRateLimiter limiter = ToolRateLimiter.unlimited();

        for (int i = 0; i < 1000; i++) {
            limiter.acquire("search");
        }
        assertThat(limiter.enabled()).isFalse();
    }

    @Test
    void shouldRejectNonPositiveLimits() {
        assertThatThrownBy(() -> new ToolRateLimiter(new RateLimitConfig(true, new LimitConfig(0, 10), Map.of())))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
