package com.questrail.uprotocol.api;

import java.util.Objects;

/**
 * Status value returned by every fallible transport operation.
 *
 * <p>A status is a value, not a fault: callers inspect {@link #isOk()} and treat
 * any other code as an actionable failure. The message is free text intended
 * for humans and may be empty.</p>
 */
public record UStatus(UCode code, String message)
{
    private static final UStatus OK = new UStatus(UCode.OK, "");

    public UStatus {
        Objects.requireNonNull(code, "code");
        message = message == null ? "" : message;
    }

    public static UStatus ok() {
        return OK;
    }

    public static UStatus of(UCode code, String message) {
        return new UStatus(code, message);
    }

    public boolean isOk() {
        return code == UCode.OK;
    }

    @Override
    public String toString() {
        return message.isEmpty() ? code.name() : code.name() + ": " + message;
    }
}
