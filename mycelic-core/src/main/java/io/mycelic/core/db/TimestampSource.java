package io.mycelic.core.db;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hands out strictly increasing instants at microsecond precision, even when the wall clock
 * stalls or steps backwards.
 */
public final class TimestampSource {
    private final Clock clock;
    private final AtomicReference<Instant> last = new AtomicReference<>(Instant.EPOCH);

    public TimestampSource() {
        this(Clock.systemUTC());
    }

    public TimestampSource(Clock clock) {
        this.clock = clock;
    }

    public Instant next() {
        while (true) {
            Instant previous = last.get();
            Instant candidate = clock.instant().truncatedTo(ChronoUnit.MICROS);
            if (!candidate.isAfter(previous)) {
                candidate = previous.plus(1, ChronoUnit.MICROS);
            }
            if (last.compareAndSet(previous, candidate)) {
                return candidate;
            }
        }
    }
}
