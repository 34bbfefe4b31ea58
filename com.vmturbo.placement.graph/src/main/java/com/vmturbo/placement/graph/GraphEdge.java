package com.vmturbo.placement.graph;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

import com.google.common.collect.ImmutableMap;

/**
 * A directed relationship between two nodes in the placement graph. There is at most one edge
 * of a given type between the same source and target.
 */
@Immutable
public class GraphEdge {

    private final EdgeType type;

    private final NodeRef source;

    private final NodeRef target;

    private final ImmutableMap<String, Object> properties;

    /**
     * Create a new edge.
     *
     * @param type The relationship type.
     * @param source The node the edge starts at.
     * @param target The node the edge ends at.
     * @param properties Edge properties.
     */
    public GraphEdge(@Nonnull final EdgeType type,
                     @Nonnull final NodeRef source,
                     @Nonnull final NodeRef target,
                     @Nonnull final Map<String, Object> properties) {
        this.type = Objects.requireNonNull(type);
        this.source = Objects.requireNonNull(source);
        this.target = Objects.requireNonNull(target);
        this.properties = ImmutableMap.copyOf(properties);
    }

    @Nonnull
    public EdgeType getType() {
        return type;
    }

    @Nonnull
    public NodeRef getSource() {
        return source;
    }

    @Nonnull
    public NodeRef getTarget() {
        return target;
    }

    @Nonnull
    public String getSourceUuid() {
        return source.getUuid();
    }

    @Nonnull
    public String getTargetUuid() {
        return target.getUuid();
    }

    @Nonnull
    public ImmutableMap<String, Object> getProperties() {
        return properties;
    }

    /**
     * Get a property of the edge.
     *
     * @param key The property name.
     * @param type The expected type of the property value.
     * @param <T> The expected type of the property value.
     * @return The value, or empty if the edge doesn't have the property.
     */
    @Nonnull
    public <T> Optional<T> getProperty(@Nonnull final String key, @Nonnull final Class<T> type) {
        final Object value = properties.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GraphEdge)) {
            return false;
        }
        final GraphEdge other = (GraphEdge)o;
        return type == other.type
                && source.equals(other.source)
                && target.equals(other.target)
                && properties.equals(other.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, source, target, properties);
    }

    @Override
    public String toString() {
        return "(" + source + ")-[:" + type + properties + "]->(" + target + ")";
    }
}
