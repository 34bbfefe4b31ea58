package com.vmturbo.placement.candidates;

import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

/**
 * A resource provider nominated as able to supply one resource class, along with the root of
 * its provider tree. The same provider may be nominated once per resource class.
 */
@Immutable
public class RpCandidate {

    private final String uuid;

    private final String rootUuid;

    private final String resourceClass;

    /**
     * Create a new candidate.
     *
     * @param uuid The UUID of the resource provider.
     * @param rootUuid The UUID of the root provider of its tree.
     * @param resourceClass The name of the resource class it can supply.
     */
    public RpCandidate(@Nonnull final String uuid,
                       @Nonnull final String rootUuid,
                       @Nonnull final String resourceClass) {
        this.uuid = Objects.requireNonNull(uuid);
        this.rootUuid = Objects.requireNonNull(rootUuid);
        this.resourceClass = Objects.requireNonNull(resourceClass);
    }

    @Nonnull
    public String getUuid() {
        return uuid;
    }

    @Nonnull
    public String getRootUuid() {
        return rootUuid;
    }

    @Nonnull
    public String getResourceClass() {
        return resourceClass;
    }

    /**
     * Get the provider and root of this candidate, without the resource class.
     *
     * @return The {@link ProviderRef}.
     */
    @Nonnull
    public ProviderRef toProviderRef() {
        return new ProviderRef(uuid, rootUuid);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RpCandidate)) {
            return false;
        }
        final RpCandidate other = (RpCandidate)o;
        return uuid.equals(other.uuid)
                && rootUuid.equals(other.rootUuid)
                && resourceClass.equals(other.resourceClass);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uuid, rootUuid, resourceClass);
    }

    @Override
    public String toString() {
        return "(" + uuid + ", " + rootUuid + ", " + resourceClass + ")";
    }
}
