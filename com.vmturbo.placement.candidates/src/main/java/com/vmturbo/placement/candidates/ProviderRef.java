package com.vmturbo.placement.candidates;

import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

/**
 * A resource provider together with the root of the provider tree it belongs to.
 */
@Immutable
public class ProviderRef {

    private final String uuid;

    private final String rootUuid;

    /**
     * Create a new reference.
     *
     * @param uuid The UUID of the resource provider.
     * @param rootUuid The UUID of the root of its tree. Equal to {@code uuid} for a root.
     */
    public ProviderRef(@Nonnull final String uuid, @Nonnull final String rootUuid) {
        this.uuid = Objects.requireNonNull(uuid);
        this.rootUuid = Objects.requireNonNull(rootUuid);
    }

    @Nonnull
    public String getUuid() {
        return uuid;
    }

    @Nonnull
    public String getRootUuid() {
        return rootUuid;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProviderRef)) {
            return false;
        }
        final ProviderRef other = (ProviderRef)o;
        return uuid.equals(other.uuid) && rootUuid.equals(other.rootUuid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uuid, rootUuid);
    }

    @Override
    public String toString() {
        return uuid + " (root " + rootUuid + ")";
    }
}
