package io.atprose.types;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Produces strictly increasing {@link Tid}s. The clock id is fixed per instance; if the clock
 * stalls or moves backwards the timestamp is advanced by one microsecond past the last value
 * issued.
 *
 * <p>
 * Thread-safe.
 */
public final class TidGenerator {

    private final Clock clock;
    private final int clockId;
    private long lastMicros = Long.MIN_VALUE;

    /** Uses the system UTC clock and a random clock id. */
    public TidGenerator() {
        this(Clock.systemUTC(), new SecureRandom().nextInt(1024));
    }

    /**
     * @param clock   time source
     * @param clockId clock identifier, 0 to 1023
     */
    public TidGenerator(Clock clock, int clockId) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (clockId < 0 || clockId > 1023) {
            throw new IllegalArgumentException("clockId must be between 0 and 1023, got: " + clockId);
        }
        this.clockId = clockId;
    }

    /** Returns the next identifier, always greater than every previously returned one. */
    public synchronized Tid next() {
        Instant now = clock.instant();
        long micros = Math.addExact(Math.multiplyExact(now.getEpochSecond(), 1_000_000L), now.getNano() / 1_000L);
        if (micros <= lastMicros) {
            micros = lastMicros + 1;
        }
        lastMicros = micros;
        return Tid.of(micros, clockId);
    }

    /** The clock id stamped into every generated TID. */
    public int clockId() {
        return clockId;
    }
}
