package com.vmturbo.placement.graph;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

import com.google.common.collect.ImmutableMap;

/**
 * A node in the placement graph. Nodes are identified by UUID, and UUIDs are unique across
 * all labels.
 */
@Immutable
public class GraphNode {

    private final NodeLabel label;

    private final String uuid;

    private final ImmutableMap<String, Object> properties;

    /**
     * Create a new node.
     *
     * @param label The label of the node.
     * @param uuid The UUID of the node.
     * @param properties The properties of the node. Null values are not permitted.
     */
    public GraphNode(@Nonnull final NodeLabel label,
                     @Nonnull final String uuid,
                     @Nonnull final Map<String, Object> properties) {
        this.label = Objects.requireNonNull(label);
        this.uuid = Objects.requireNonNull(uuid);
        this.properties = ImmutableMap.copyOf(properties);
    }

    @Nonnull
    public NodeLabel getLabel() {
        return label;
    }

    @Nonnull
    public String getUuid() {
        return uuid;
    }

    @Nonnull
    public NodeRef getRef() {
        return NodeRef.of(label, uuid);
    }

    @Nonnull
    public ImmutableMap<String, Object> getProperties() {
        return properties;
    }

    /**
     * Get a property of the node.
     *
     * @param key The property name.
     * @param type The expected type of the property value.
     * @param <T> The expected type of the property value.
     * @return The value, or empty if the node doesn't have the property.
     * @throws GraphStoreException If the property exists but has a different type.
     */
    @Nonnull
    public <T> Optional<T> getProperty(@Nonnull final String key, @Nonnull final Class<T> type) {
        final Object value = properties.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!type.isInstance(value)) {
            throw new GraphStoreException("Property " + key + " of " + label + " " + uuid
                    + " is a " + value.getClass().getSimpleName() + ", not a "
                    + type.getSimpleName());
        }
        return Optional.of(type.cast(value));
    }

    /**
     * Return a copy of this node with some properties replaced or added.
     *
     * @param updates The properties to set.
     * @return The new node.
     */
    @Nonnull
    public GraphNode withProperties(@Nonnull final Map<String, Object> updates) {
        final Map<String, Object> merged = new HashMap<>(properties);
        merged.putAll(updates);
        return new GraphNode(label, uuid, merged);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GraphNode)) {
            return false;
        }
        final GraphNode other = (GraphNode)o;
        return label == other.label
                && uuid.equals(other.uuid)
                && properties.equals(other.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, uuid, properties);
    }

    @Override
    public String toString() {
        return label + "(" + uuid + ")" + properties;
    }
}
