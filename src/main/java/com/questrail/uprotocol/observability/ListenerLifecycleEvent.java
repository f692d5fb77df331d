package com.questrail.uprotocol.observability;

import com.questrail.uprotocol.api.UStatus;
import com.questrail.uprotocol.api.UUri;

import java.time.Instant;
import java.util.Optional;

/**
 * Record describing a listener registration changing state.
 */
public record ListenerLifecycleEvent(
    Instant timestamp,
    Phase phase,
    UUri sinkFilter,
    Optional<UUri> sourceFilter,
    UStatus status
) {
    public enum Phase {
        /** The register hook accepted the listener and a handle was issued. */
        REGISTERED,
        /** The register hook refused the listener; no handle exists. */
        REJECTED,
        /** The handle was released and the cleanup hook ran. */
        CLEANED_UP
    }
}
