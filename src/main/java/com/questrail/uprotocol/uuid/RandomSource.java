package com.questrail.uprotocol.uuid;

/**
 * Source of 64 random bits per issued identifier.
 */
@FunctionalInterface
public interface RandomSource
{
    long nextLong();
}
