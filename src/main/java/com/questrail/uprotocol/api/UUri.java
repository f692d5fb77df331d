package com.questrail.uprotocol.api;

import java.util.Objects;

/**
 * Structured address of a uEntity resource.
 *
 * <h2>Fields</h2>
 * <ul>
 *   <li>{@code authorityName}: the device or domain hosting the entity</li>
 *   <li>{@code ueId}: 32-bit entity id; the upper 16 bits carry the instance,
 *       the lower 16 bits the entity type</li>
 *   <li>{@code ueVersionMajor}: 8-bit major version</li>
 *   <li>{@code resourceId}: 16-bit resource (topic, method or notification)</li>
 * </ul>
 *
 * <h2>Wildcards</h2>
 * <p>
 * When used as a filter, {@link #WILDCARD_AUTHORITY}, {@code 0xFFFF} in either
 * half of {@code ueId}, {@link #WILDCARD_VERSION} and {@link #WILDCARD_RESOURCE}
 * match any value. {@link #ANY} combines all of them.
 * </p>
 *
 * <p>
 * This type only enforces field ranges. Whether a URI is a valid topic, method
 * or notification target is decided elsewhere.
 * </p>
 */
public final class UUri
{
    public static final String WILDCARD_AUTHORITY = "*";
    public static final int WILDCARD_ENTITY_ID = 0xFFFF;
    public static final int WILDCARD_ENTITY_INSTANCE = 0xFFFF;
    public static final int WILDCARD_VERSION = 0xFF;
    public static final int WILDCARD_RESOURCE = 0xFFFF;

    public static final UUri ANY = new UUri(WILDCARD_AUTHORITY, 0xFFFF_FFFF, WILDCARD_VERSION, WILDCARD_RESOURCE);

    private final String authorityName;
    private final int ueId;
    private final int ueVersionMajor;
    private final int resourceId;

    private UUri(String authorityName, int ueId, int ueVersionMajor, int resourceId) {
        this.authorityName = authorityName;
        this.ueId = ueId;
        this.ueVersionMajor = ueVersionMajor;
        this.resourceId = resourceId;
    }

    /**
     * Creates a URI.
     *
     * @param authorityName authority; may be empty for a local URI
     * @param ueId          32-bit entity id (treated as unsigned)
     * @param ueVersionMajor major version, 0-255
     * @param resourceId    resource id, 0-65535
     * @throws IllegalArgumentException if a field is out of range
     */
    public static UUri of(String authorityName, int ueId, int ueVersionMajor, int resourceId) {
        Objects.requireNonNull(authorityName, "authorityName");
        if (ueVersionMajor < 0 || ueVersionMajor > 0xFF) {
            throw new IllegalArgumentException("ueVersionMajor must be in range 0-255 (was " + ueVersionMajor + ")");
        }
        if (resourceId < 0 || resourceId > 0xFFFF) {
            throw new IllegalArgumentException("resourceId must be in range 0-65535 (was " + resourceId + ")");
        }
        return new UUri(authorityName, ueId, ueVersionMajor, resourceId);
    }

    public String authorityName() {
        return authorityName;
    }

    public int ueId() {
        return ueId;
    }

    /** Lower 16 bits of {@link #ueId()}. */
    public int entityType() {
        return ueId & 0xFFFF;
    }

    /** Upper 16 bits of {@link #ueId()}. */
    public int entityInstance() {
        return (ueId >>> 16) & 0xFFFF;
    }

    public int ueVersionMajor() {
        return ueVersionMajor;
    }

    public int resourceId() {
        return resourceId;
    }

    /**
     * Returns a copy of this URI addressing another resource of the same entity.
     */
    public UUri withResourceId(int resourceId) {
        return of(authorityName, ueId, ueVersionMajor, resourceId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UUri that)) return false;
        return ueId == that.ueId
                && ueVersionMajor == that.ueVersionMajor
                && resourceId == that.resourceId
                && authorityName.equals(that.authorityName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(authorityName, ueId, ueVersionMajor, resourceId);
    }

    @Override
    public String toString() {
        return String.format("//%s/%X/%X/%X", authorityName, Integer.toUnsignedLong(ueId), ueVersionMajor, resourceId);
    }
}
