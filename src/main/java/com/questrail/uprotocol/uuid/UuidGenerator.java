package com.questrail.uprotocol.uuid;

/**
 * Capability to issue message identifiers.
 *
 * <p>Components that stamp messages depend on this interface rather than on
 * {@link UuidBuilder}, so they can neither reconfigure the shared production
 * generator nor tell it apart from a deterministic test generator.</p>
 */
@FunctionalInterface
public interface UuidGenerator
{
    /**
     * Issues the next identifier.
     */
    Uuid build();
}
