package com.questrail.uprotocol.uuid;

import java.util.UUID;

/**
 * Uuid
 * =============================================================================
 * 128-bit message identifier, stored as two 64-bit words.
 *
 * <h2>Bit layout</h2>
 * <pre>
 *   msb:  | 48-bit unix time (ms) | 4-bit version | 12-bit counter |
 *   lsb:  | 2-bit variant | 62 random bits                         |
 * </pre>
 *
 * <p>
 * Identifiers issued by one {@link UuidGenerator} sort by (timestamp, counter)
 * in issuance order, so comparing the {@code msb} words as unsigned numbers
 * yields issuance order for a single generator.
 * </p>
 */
public record Uuid(long msb, long lsb) implements Comparable<Uuid>
{
    /** Width of the counter field; the timestamp starts above the version nibble. */
    public static final int COUNTER_BITS = 12;
    public static final int VERSION_SHIFT = 12;
    public static final int TIMESTAMP_SHIFT = 16;
    public static final int VARIANT_SHIFT = 62;

    public static final long COUNTER_MASK = 0xFFFL;
    public static final long VERSION_MASK = 0xFL;
    public static final long VARIANT_MASK = 0x3L;
    public static final long TIMESTAMP_MASK = 0xFFFF_FFFF_FFFFL;
    public static final long RANDOM_MASK = 0x3FFF_FFFF_FFFF_FFFFL;

    public static final int MAX_COUNTER = (int) COUNTER_MASK;
    public static final int VERSION_8 = 8;
    /** RFC 4122 variant, binary {@code 10}. */
    public static final int VARIANT_RFC4122 = 0b10;

    public long timestamp() {
        return msb >>> TIMESTAMP_SHIFT;
    }

    public int version() {
        return (int) ((msb >>> VERSION_SHIFT) & VERSION_MASK);
    }

    public int counter() {
        return (int) (msb & COUNTER_MASK);
    }

    public int variant() {
        return (int) ((lsb >>> VARIANT_SHIFT) & VARIANT_MASK);
    }

    public long random() {
        return lsb & RANDOM_MASK;
    }

    public UUID toJavaUuid() {
        return new UUID(msb, lsb);
    }

    public static Uuid fromJavaUuid(UUID uuid) {
        return new Uuid(uuid.getMostSignificantBits(), uuid.getLeastSignificantBits());
    }

    /**
     * Parses the canonical {@code 8-4-4-4-12} hex form.
     *
     * @throws IllegalArgumentException if the text is not a UUID
     */
    public static Uuid fromString(String text) {
        return fromJavaUuid(UUID.fromString(text));
    }

    @Override
    public int compareTo(Uuid other) {
        int byMsb = Long.compareUnsigned(msb, other.msb);
        return byMsb != 0 ? byMsb : Long.compareUnsigned(lsb, other.lsb);
    }

    @Override
    public String toString() {
        return toJavaUuid().toString();
    }
}
