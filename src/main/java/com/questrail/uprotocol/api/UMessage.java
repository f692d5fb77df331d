package com.questrail.uprotocol.api;

import java.util.Objects;

/**
 * A message as handed to {@code UTransport.send} and delivered to listeners.
 *
 * <p>The layout of a message on any medium is the business of the concrete
 * transport; this type is the in-memory form only.</p>
 */
public record UMessage(UAttributes attributes, UPayload payload)
{
    public UMessage {
        Objects.requireNonNull(attributes, "attributes");
        Objects.requireNonNull(payload, "payload");
    }
}
