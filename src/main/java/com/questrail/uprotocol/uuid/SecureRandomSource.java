package com.questrail.uprotocol.uuid;

import java.security.SecureRandom;
import java.util.Objects;

/**
 * {@link RandomSource} backed by a {@link SecureRandom}.
 *
 * <p>Thread-safe: {@code SecureRandom} instances may be shared between threads.</p>
 */
public final class SecureRandomSource implements RandomSource
{
    private final SecureRandom random;

    public SecureRandomSource() {
        this(new SecureRandom());
    }

    public SecureRandomSource(SecureRandom random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public long nextLong() {
        return random.nextLong();
    }
}
