package com.questrail.uprotocol.api;

import com.questrail.uprotocol.uuid.Uuid;

import java.util.Objects;
import java.util.Optional;

/**
 * Envelope attributes of a {@link UMessage}.
 *
 * <p>
 * {@code sink} is empty for {@link UMessageType#PUBLISH} and present for every
 * other type.
 * </p>
 */
public record UAttributes(
    Uuid id,
    UMessageType type,
    UUri source,
    Optional<UUri> sink
) {
    public UAttributes {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sink, "sink");
        if (type == UMessageType.PUBLISH && sink.isPresent()) {
            throw new IllegalArgumentException("PUBLISH messages carry no sink");
        }
        if (type != UMessageType.PUBLISH && sink.isEmpty()) {
            throw new IllegalArgumentException(type + " messages require a sink");
        }
    }
}
