package com.questrail.uprotocol.observability;

import java.time.Instant;

/**
 * Record representing an unexpected failure inside a transport hook or listener.
 */
public record TransportErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
