package com.questrail.uprotocol.uuid;

import com.questrail.uprotocol.time.WallClock;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Last issued (timestamp, counter) pair of one generator.
 *
 * <p>
 * The process-wide instance is shared by every production builder; test
 * builders own a private instance. The clock is read and the pair updated
 * under the state's lock, so issuances are totally ordered by lock acquisition
 * and a slow caller can never rewind the state to an older timestamp.
 * </p>
 */
final class UuidGeneratorState
{
    static final UuidGeneratorState SHARED = new UuidGeneratorState();

    private final ReentrantLock lock = new ReentrantLock();

    private long lastTimestamp = -1L;
    private int counter;

    /**
     * Reads {@code clock}, records an issuance at that time and returns the
     * timestamp and counter to embed in the identifier.
     */
    Stamp advance(WallClock clock) {
        lock.lock();
        try {
            long now = clock.nowMillis() & Uuid.TIMESTAMP_MASK;
            if (now == lastTimestamp) {
                // Saturate: never carry into the version or timestamp bits.
                if (counter < Uuid.MAX_COUNTER) {
                    counter++;
                }
            } else {
                lastTimestamp = now;
                counter = 0;
            }
            return new Stamp(now, counter);
        } finally {
            lock.unlock();
        }
    }

    record Stamp(long timestamp, int counter) {}
}
