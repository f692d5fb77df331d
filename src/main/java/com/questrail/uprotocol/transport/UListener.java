package com.questrail.uprotocol.transport;

import com.questrail.uprotocol.api.UMessage;

/**
 * Callback receiving inbound messages that match a registration's filters.
 */
@FunctionalInterface
public interface UListener
{
    void onReceive(UMessage message);
}
