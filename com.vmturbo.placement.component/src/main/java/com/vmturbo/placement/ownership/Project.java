package com.vmturbo.placement.ownership;

import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

/**
 * A project. The top of the ownership chain: a project owns users, which own consumers.
 */
@Immutable
public class Project {

    private final String uuid;

    /**
     * Create a new project.
     *
     * @param uuid The UUID of the project.
     */
    public Project(@Nonnull final String uuid) {
        this.uuid = Objects.requireNonNull(uuid);
    }

    @Nonnull
    public String getUuid() {
        return uuid;
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof Project && uuid.equals(((Project)o).uuid);
    }

    @Override
    public int hashCode() {
        return uuid.hashCode();
    }

    @Override
    public String toString() {
        return "Project " + uuid;
    }
}
