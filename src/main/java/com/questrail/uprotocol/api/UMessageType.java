package com.questrail.uprotocol.api;

/**
 * Kind of a {@link UMessage}.
 */
public enum UMessageType
{
    /** Topic publication; carries no sink. */
    PUBLISH,
    /** Directed event from a source to a single sink. */
    NOTIFICATION,
    /** RPC request. */
    REQUEST,
    /** RPC response. */
    RESPONSE
}
