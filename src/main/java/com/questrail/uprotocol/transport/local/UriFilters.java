package com.questrail.uprotocol.transport.local;

import com.questrail.uprotocol.api.UUri;

import java.util.Objects;

/**
 * Wildcard matching of {@link UUri} filters.
 *
 * <p>Each field of the filter either equals the candidate's field or holds that
 * field's wildcard value. The entity id is matched per 16-bit half.</p>
 */
public final class UriFilters
{
    private UriFilters() {}

    public static boolean matches(UUri filter, UUri candidate) {
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(candidate, "candidate");

        return (UUri.WILDCARD_AUTHORITY.equals(filter.authorityName())
                        || filter.authorityName().equals(candidate.authorityName()))
                && (filter.entityType() == UUri.WILDCARD_ENTITY_ID
                        || filter.entityType() == candidate.entityType())
                && (filter.entityInstance() == UUri.WILDCARD_ENTITY_INSTANCE
                        || filter.entityInstance() == candidate.entityInstance())
                && (filter.ueVersionMajor() == UUri.WILDCARD_VERSION
                        || filter.ueVersionMajor() == candidate.ueVersionMajor())
                && (filter.resourceId() == UUri.WILDCARD_RESOURCE
                        || filter.resourceId() == candidate.resourceId());
    }
}
