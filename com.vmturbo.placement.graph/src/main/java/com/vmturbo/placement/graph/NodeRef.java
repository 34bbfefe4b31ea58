package com.vmturbo.placement.graph;

import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

/**
 * The identity of a node: its label and its UUID. UUIDs are unique within a label only, so a
 * project and a user may share one.
 */
@Immutable
public final class NodeRef {

    private final NodeLabel label;

    private final String uuid;

    private NodeRef(@Nonnull final NodeLabel label, @Nonnull final String uuid) {
        this.label = Objects.requireNonNull(label);
        this.uuid = Objects.requireNonNull(uuid);
    }

    /**
     * Refer to a node.
     *
     * @param label The node label.
     * @param uuid The node UUID.
     * @return The reference.
     */
    @Nonnull
    public static NodeRef of(@Nonnull final NodeLabel label, @Nonnull final String uuid) {
        return new NodeRef(label, uuid);
    }

    @Nonnull
    public NodeLabel getLabel() {
        return label;
    }

    @Nonnull
    public String getUuid() {
        return uuid;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NodeRef)) {
            return false;
        }
        final NodeRef other = (NodeRef)o;
        return label == other.label && uuid.equals(other.uuid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, uuid);
    }

    @Override
    public String toString() {
        return label + ":" + uuid;
    }
}
