package com.questrail.uprotocol.api;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable message body.
 *
 * <p>
 * The bytes are copied on the way in and on the way out, so a payload can be
 * shared freely between threads and listeners. The transport layer treats the
 * content as opaque; only {@link #format()} hints at how to interpret it.
 * </p>
 */
public final class UPayload
{
    public static final UPayload EMPTY = new UPayload(new byte[0], UPayloadFormat.UNSPECIFIED);

    private final byte[] data;
    private final UPayloadFormat format;

    private UPayload(byte[] data, UPayloadFormat format) {
        this.data = data;
        this.format = format;
    }

    public static UPayload of(byte[] data, UPayloadFormat format) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(format, "format");
        return new UPayload(data.clone(), format);
    }

    public static UPayload ofText(String text) {
        Objects.requireNonNull(text, "text");
        return new UPayload(text.getBytes(StandardCharsets.UTF_8), UPayloadFormat.TEXT);
    }

    public UPayloadFormat format() {
        return format;
    }

    public int size() {
        return data.length;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    public byte[] toByteArray() {
        return data.clone();
    }

    /**
     * Read-only view over the payload bytes without copying.
     */
    public ByteBuffer asReadOnlyBuffer() {
        return ByteBuffer.wrap(data).asReadOnlyBuffer();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UPayload that)) return false;
        return format == that.format && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(data) + format.hashCode();
    }

    @Override
    public String toString() {
        return "UPayload[" + format + ", " + data.length + " bytes]";
    }
}
