package com.questrail.uprotocol.api;

/**
 * Serialization format of the bytes held by a {@link UPayload}.
 */
public enum UPayloadFormat
{
    /** Format was not set. */
    UNSPECIFIED,
    /** An Any protobuf message wrapping the packed payload. */
    PROTOBUF_WRAPPED_IN_ANY,
    PROTOBUF,
    JSON,
    /** Basic SOME/IP serialization. */
    SOMEIP,
    /** SOME/IP TLV. */
    SOMEIP_TLV,
    RAW,
    TEXT
}
