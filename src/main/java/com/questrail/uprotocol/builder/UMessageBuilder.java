package com.questrail.uprotocol.builder;

import com.questrail.uprotocol.api.UAttributes;
import com.questrail.uprotocol.api.UMessage;
import com.questrail.uprotocol.api.UMessageType;
import com.questrail.uprotocol.api.UPayload;
import com.questrail.uprotocol.api.UUri;
import com.questrail.uprotocol.uuid.UuidBuilder;
import com.questrail.uprotocol.uuid.UuidGenerator;

import java.util.Objects;
import java.util.Optional;

/**
 * UMessageBuilder
 * =============================================================================
 * Assembles {@link UMessage} envelopes and stamps each one with a fresh
 * identifier.
 *
 * <p>
 * Identifiers come from the shared production {@link UuidBuilder} unless
 * another {@link UuidGenerator} is supplied. A builder may be reused: every
 * {@link #build()} issues a new identifier.
 * </p>
 */
public final class UMessageBuilder
{
    private final UMessageType type;
    private final UUri source;
    private final Optional<UUri> sink;

    private UPayload payload = UPayload.EMPTY;
    private UuidGenerator idGenerator = UuidBuilder.getBuilder();

    private UMessageBuilder(UMessageType type, UUri source, Optional<UUri> sink) {
        this.type = type;
        this.source = Objects.requireNonNull(source, "source");
        this.sink = sink;
    }

    public static UMessageBuilder publish(UUri topic) {
        return new UMessageBuilder(UMessageType.PUBLISH, topic, Optional.empty());
    }

    public static UMessageBuilder notification(UUri source, UUri sink) {
        return new UMessageBuilder(UMessageType.NOTIFICATION, source,
                Optional.of(Objects.requireNonNull(sink, "sink")));
    }

    public static UMessageBuilder request(UUri source, UUri method) {
        return new UMessageBuilder(UMessageType.REQUEST, source,
                Optional.of(Objects.requireNonNull(method, "method")));
    }

    public static UMessageBuilder response(UUri method, UUri sink) {
        return new UMessageBuilder(UMessageType.RESPONSE, method,
                Optional.of(Objects.requireNonNull(sink, "sink")));
    }

    public UMessageBuilder withPayload(UPayload payload) {
        this.payload = Objects.requireNonNull(payload, "payload");
        return this;
    }

    public UMessageBuilder withIdGenerator(UuidGenerator idGenerator) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        return this;
    }

    public UMessage build() {
        UAttributes attributes = new UAttributes(idGenerator.build(), type, source, sink);
        return new UMessage(attributes, payload);
    }
}
