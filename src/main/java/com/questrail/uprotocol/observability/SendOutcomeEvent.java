package com.questrail.uprotocol.observability;

import com.questrail.uprotocol.api.UMessageType;
import com.questrail.uprotocol.api.UStatus;
import com.questrail.uprotocol.uuid.Uuid;

import java.time.Instant;

/**
 * Record describing the status returned for one send attempt.
 */
public record SendOutcomeEvent(
    Instant timestamp,
    Uuid messageId,
    UMessageType messageType,
    UStatus status
) {
}
