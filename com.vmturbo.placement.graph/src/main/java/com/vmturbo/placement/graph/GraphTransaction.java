package com.vmturbo.placement.graph;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import javax.annotation.Nonnull;

/**
 * The operations available inside a {@link GraphStore} transaction.
 *
 * <p>All parameters are bound values; there is no query language, and so no way to inject
 * anything through a UUID or a property value.</p>
 *
 * <p>Write operations called on a read-only transaction throw {@link GraphStoreException}.</p>
 */
public interface GraphTransaction {

    /**
     * Create a node if it doesn't exist. Merging a node identical to an existing one is a no-op.
     *
     * @param label The node label.
     * @param uuid The node UUID.
     * @param properties The node properties.
     * @return The node in the store.
     * @throws GraphStoreException If a node with the same label and UUID already exists with
     *         different properties.
     */
    @Nonnull
    GraphNode mergeNode(@Nonnull NodeLabel label,
                        @Nonnull String uuid,
                        @Nonnull Map<String, Object> properties);

    /**
     * Look up a node.
     *
     * @param label The node label.
     * @param uuid The node UUID.
     * @return The node, or empty if there is no node with that label and UUID.
     */
    @Nonnull
    Optional<GraphNode> getNode(@Nonnull NodeLabel label, @Nonnull String uuid);

    /**
     * Get all nodes with a label.
     *
     * @param label The node label.
     * @return The nodes, in creation order.
     */
    @Nonnull
    List<GraphNode> getNodes(@Nonnull NodeLabel label);

    /**
     * Set properties on a node, keeping the ones not mentioned.
     *
     * @param label The node label.
     * @param uuid The node UUID.
     * @param updates The properties to set.
     * @return The updated node, or empty if there is no such node.
     */
    @Nonnull
    Optional<GraphNode> setNodeProperties(@Nonnull NodeLabel label,
                                          @Nonnull String uuid,
                                          @Nonnull Map<String, Object> updates);

    /**
     * Set properties on a node if, and only if, one of its properties currently has an
     * expected value. The comparison and the update happen as one step.
     *
     * @param label The node label.
     * @param uuid The node UUID.
     * @param key The property to compare.
     * @param expected The value the property must have.
     * @param updates The properties to set when the comparison succeeds.
     * @return True if the node was updated. False if the node doesn't exist or the property
     *         didn't have the expected value, in which case nothing was changed.
     */
    boolean compareAndSetProperties(@Nonnull NodeLabel label,
                                    @Nonnull String uuid,
                                    @Nonnull String key,
                                    @Nonnull Object expected,
                                    @Nonnull Map<String, Object> updates);

    /**
     * Delete a node that has no relationships.
     *
     * @param label The node label.
     * @param uuid The node UUID.
     * @return True if a node was deleted.
     * @throws GraphStoreException If the node still has relationships.
     */
    boolean deleteNode(@Nonnull NodeLabel label, @Nonnull String uuid);

    /**
     * Delete a node along with every relationship it takes part in.
     *
     * @param label The node label.
     * @param uuid The node UUID.
     * @return True if a node was deleted.
     */
    boolean detachDeleteNode(@Nonnull NodeLabel label, @Nonnull String uuid);

    /**
     * Create an edge, or replace the properties of the existing edge of the same type between
     * the same nodes.
     *
     * @param type The relationship type.
     * @param source The source node.
     * @param target The target node.
     * @param properties The edge properties.
     * @return The edge in the store.
     * @throws GraphStoreException If either node doesn't exist, or the edge type doesn't
     *         connect nodes with those labels.
     */
    @Nonnull
    GraphEdge mergeEdge(@Nonnull EdgeType type,
                        @Nonnull NodeRef source,
                        @Nonnull NodeRef target,
                        @Nonnull Map<String, Object> properties);

    /**
     * Delete an edge.
     *
     * @param type The relationship type.
     * @param source The source node.
     * @param target The target node.
     * @return True if an edge was deleted.
     */
    boolean deleteEdge(@Nonnull EdgeType type, @Nonnull NodeRef source, @Nonnull NodeRef target);

    /**
     * Get the edges of a type that start at a node.
     *
     * @param type The relationship type.
     * @param source The source node.
     * @return The edges, in creation order.
     */
    @Nonnull
    List<GraphEdge> getOutgoing(@Nonnull EdgeType type, @Nonnull NodeRef source);

    /**
     * Get the edges of a type that end at a node.
     *
     * @param type The relationship type.
     * @param target The target node.
     * @return The edges, in creation order.
     */
    @Nonnull
    List<GraphEdge> getIncoming(@Nonnull EdgeType type, @Nonnull NodeRef target);

    /**
     * Count every relationship, of any type and in either direction, a node takes part in.
     *
     * @param node The node.
     * @return The number of relationships.
     */
    int relationshipCount(@Nonnull NodeRef node);

    /**
     * Count the relationships of one type, in either direction, a node takes part in.
     *
     * @param node The node.
     * @param type The relationship type.
     * @return The number of relationships.
     */
    int relationshipCount(@Nonnull NodeRef node, @Nonnull EdgeType type);
}
