package com.questrail.uprotocol.uuid;

import com.questrail.uprotocol.time.SystemWallClock;
import com.questrail.uprotocol.time.WallClock;

import java.util.Objects;

/**
 * UuidBuilder
 * =============================================================================
 * Issues time-ordered {@link Uuid} identifiers (version 8, RFC 4122 variant).
 *
 * <h2>Two modes</h2>
 * <ul>
 *   <li>{@link #getBuilder()} returns the production builder. It reads the
 *       system wall clock and a {@link java.security.SecureRandom}, and all
 *       production builders share one process-wide counter state, so every
 *       caller observes a single consistent sequence. Its sources and state
 *       cannot be replaced: {@link #withTimeSource}, {@link #withRandomSource}
 *       and {@link #withIndependentState} throw {@link IllegalStateException}.</li>
 *   <li>{@link #getTestBuilder()} returns a builder with private state whose
 *       sources may be injected, for deterministic and parallel tests.</li>
 * </ul>
 *
 * <h2>Issuance</h2>
 * <p>
 * For each {@link #build()}: read the time in milliseconds and 64 random bits.
 * If the time equals the last recorded timestamp the counter is incremented,
 * saturating at {@link Uuid#MAX_COUNTER}; otherwise the counter restarts at 0.
 * The timestamp and counter go into the high word together with the version,
 * the variant and 62 random bits into the low word.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * The production builder is safe for concurrent use. A test builder is meant
 * for one thread; sharing one across threads keeps the counter consistent but
 * interleaves the sequence, and its source setters are not synchronized.
 * </p>
 */
public final class UuidBuilder implements UuidGenerator
{
    private static final UuidBuilder PRODUCTION = new UuidBuilder(
            false, SystemWallClock.INSTANCE, new SecureRandomSource(), UuidGeneratorState.SHARED);

    private final boolean testing;
    private final UuidGeneratorState state;

    private WallClock timeSource;
    private RandomSource randomSource;

    private UuidBuilder(boolean testing, WallClock timeSource, RandomSource randomSource, UuidGeneratorState state) {
        this.testing = testing;
        this.timeSource = timeSource;
        this.randomSource = randomSource;
        this.state = state;
    }

    /**
     * Returns the shared production builder.
     */
    public static UuidBuilder getBuilder() {
        return PRODUCTION;
    }

    /**
     * Returns a new test builder with private state, the system clock and a
     * secure random source until replaced.
     */
    public static UuidBuilder getTestBuilder() {
        return new UuidBuilder(true, SystemWallClock.INSTANCE, new SecureRandomSource(), new UuidGeneratorState());
    }

    public boolean isTestBuilder() {
        return testing;
    }

    /**
     * Replaces the time source of this test builder.
     *
     * @return this builder
     * @throws IllegalStateException on the production builder
     */
    public UuidBuilder withTimeSource(WallClock timeSource) {
        requireTesting("withTimeSource");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
        return this;
    }

    /**
     * Replaces the random source of this test builder.
     *
     * @return this builder
     * @throws IllegalStateException on the production builder
     */
    public UuidBuilder withRandomSource(RandomSource randomSource) {
        requireTesting("withRandomSource");
        this.randomSource = Objects.requireNonNull(randomSource, "randomSource");
        return this;
    }

    /**
     * Returns a new test builder with the same sources and its own fresh
     * counter state, isolated from this builder and from every other one.
     *
     * @throws IllegalStateException on the production builder
     */
    public UuidBuilder withIndependentState() {
        requireTesting("withIndependentState");
        return new UuidBuilder(true, timeSource, randomSource, new UuidGeneratorState());
    }

    @Override
    public Uuid build() {
        UuidGeneratorState.Stamp stamp = state.advance(timeSource);
        long random = randomSource.nextLong();

        long msb = (stamp.timestamp() << Uuid.TIMESTAMP_SHIFT)
                | ((long) Uuid.VERSION_8 << Uuid.VERSION_SHIFT)
                | stamp.counter();
        long lsb = ((long) Uuid.VARIANT_RFC4122 << Uuid.VARIANT_SHIFT)
                | (random & Uuid.RANDOM_MASK);

        return new Uuid(msb, lsb);
    }

    private void requireTesting(String operation) {
        if (!testing) {
            throw new IllegalStateException(
                    operation + " is only permitted on test builders; the production builder is shared");
        }
    }
}
