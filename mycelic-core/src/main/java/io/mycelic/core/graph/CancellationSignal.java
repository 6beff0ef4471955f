package io.mycelic.core.graph;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.BooleanSupplier;

/**
 * Polled by long-running graph work between steps.
 */
@FunctionalInterface
public interface CancellationSignal {

    boolean isCancelled();

    static CancellationSignal none() {
        return () -> false;
    }

    static CancellationSignal deadline(Duration timeout) {
        return deadline(timeout, Clock.systemUTC());
    }

    static CancellationSignal deadline(Duration timeout, Clock clock) {
        Instant expiry = clock.instant().plus(timeout);
        return () -> !clock.instant().isBefore(expiry);
    }

    static CancellationSignal of(BooleanSupplier flag) {
        return flag::getAsBoolean;
    }
}
