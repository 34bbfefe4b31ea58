package com.vmturbo.placement.ownership;

import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

/**
 * A user. Owned by at most one project, and owns consumers.
 */
@Immutable
public class User {

    private final String uuid;

    /**
     * Create a new user.
     *
     * @param uuid The UUID of the user.
     */
    public User(@Nonnull final String uuid) {
        this.uuid = Objects.requireNonNull(uuid);
    }

    @Nonnull
    public String getUuid() {
        return uuid;
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof User && uuid.equals(((User)o).uuid);
    }

    @Override
    public int hashCode() {
        return uuid.hashCode();
    }

    @Override
    public String toString() {
        return "User " + uuid;
    }
}
