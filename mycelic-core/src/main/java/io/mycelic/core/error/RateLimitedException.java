package io.mycelic.core.error;

import java.time.Duration;

public class RateLimitedException extends MemoryEngineException {
    private final String limit;
    private final Duration retryAfter;

    public RateLimitedException(String limit, Duration retryAfter) {
        super(ErrorKind.RATE_LIMITED, "Rate limit exceeded for " + limit + ". Retry after "
            + retryAfter.toSeconds() + " seconds.");
        this.limit = limit;
        this.retryAfter = retryAfter;
    }

    /**
     * @return {@code global} or the name of the tool whose limit was hit
     */
    public String limit() {
        return limit;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}
