package io.storylink.core;

import java.time.Clock;
import java.util.Objects;
import java.util.Random;

/**
 * Produces totally ordered change keys for one link's change log.
 * <p>
 * Layout: {@code <16 hex digits epoch millis>-<16 hex digits random>}.
 * Lexicographic order of keys equals (time, nonce) order, so keys written on
 * different devices interleave approximately by wall-clock time and the
 * random suffix breaks ties.
 * <p>
 * This is a heuristic total order, not a causal one: clock skew between
 * devices can order a causally later change before an earlier one.
 * <p>
 * Keys from a single generator are strictly increasing: when the clock has not
 * moved past the previous key's time, the time component is bumped by one.
 * <p>
 * Not thread safe; each link owns its own instance and only uses it from
 * inside its operation queue.
 */
public final class KeyGenerator {
    private final Clock clock;
    private final Random random;
    private long lastMillis = Long.MIN_VALUE;

    /** Generator over the system UTC clock with an unseeded random source. */
    public KeyGenerator() {
        this(Clock.systemUTC(), new Random());
    }

    /** Deterministic generator for tests: fixed clock and seeded random. */
    public KeyGenerator(Clock clock, Random random) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
    }

    /** Create the next key. */
    public String create() {
        long now = clock.millis();
        long millis = (lastMillis != Long.MIN_VALUE && now <= lastMillis) ? lastMillis + 1 : now;
        lastMillis = millis;
        return format(millis, random.nextLong());
    }

    /** Build a key from explicit parts. Exposed so tests and tools can fabricate ordered keys. */
    public static String format(long millis, long nonce) {
        return String.format("%016x-%016x", millis, nonce);
    }

    /** Millisecond component of a key produced by this class. */
    public static long millisOf(String key) {
        Objects.requireNonNull(key, "key");
        int dash = key.indexOf('-');
        if (dash != 16) {
            throw new IllegalArgumentException("not a change key: " + key);
        }
        return Long.parseUnsignedLong(key.substring(0, dash), 16);
    }
}
