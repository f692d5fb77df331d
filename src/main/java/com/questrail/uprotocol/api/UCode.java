package com.questrail.uprotocol.api;

/**
 * UCode
 * -----------------------------------------------------------------------------
 * Fixed enumeration of result codes carried by a {@link UStatus}.
 *
 * <p>The numeric values are stable and may be used by concrete transports that
 * need to put a status on a medium. {@link #OK} is the only success code.</p>
 */
public enum UCode
{
    OK(0),
    CANCELLED(1),
    UNKNOWN(2),
    INVALID_ARGUMENT(3),
    DEADLINE_EXCEEDED(4),
    NOT_FOUND(5),
    ALREADY_EXISTS(6),
    PERMISSION_DENIED(7),
    RESOURCE_EXHAUSTED(8),
    FAILED_PRECONDITION(9),
    ABORTED(10),
    OUT_OF_RANGE(11),
    UNIMPLEMENTED(12),
    INTERNAL(13),
    UNAVAILABLE(14),
    DATA_LOSS(15),
    UNAUTHENTICATED(16);

    private final int value;

    UCode(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /**
     * Resolves a numeric code.
     *
     * @throws IllegalArgumentException if no code has the given value
     */
    public static UCode fromValue(int value) {
        for (UCode code : values()) {
            if (code.value == value) {
                return code;
            }
        }
        throw new IllegalArgumentException("Unknown UCode value: " + value);
    }
}
