package com.vmturbo.placement.graph;

import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableSetMultimap;

/**
 * The kinds of relationship kept in the placement graph.
 */
public enum EdgeType {
    /**
     * Ownership. Project -> User and User -> Consumer.
     */
    OWNS(ImmutableSetMultimap.of(
            NodeLabel.PROJECT, NodeLabel.USER,
            NodeLabel.USER, NodeLabel.CONSUMER)),

    /**
     * Allocation. Consumer -> Inventory, with the amount used as an edge property.
     */
    USES(ImmutableSetMultimap.of(NodeLabel.CONSUMER, NodeLabel.INVENTORY)),

    /**
     * Resource Provider -> Inventory.
     */
    PROVIDES(ImmutableSetMultimap.of(NodeLabel.RESOURCE_PROVIDER, NodeLabel.INVENTORY)),

    /**
     * Parent Resource Provider -> child Resource Provider.
     */
    PARENT_OF(ImmutableSetMultimap.of(NodeLabel.RESOURCE_PROVIDER, NodeLabel.RESOURCE_PROVIDER));

    private final ImmutableSetMultimap<NodeLabel, NodeLabel> endpoints;

    EdgeType(@Nonnull final ImmutableSetMultimap<NodeLabel, NodeLabel> endpoints) {
        this.endpoints = endpoints;
    }

    /**
     * Whether an edge of this type may run from a node with one label to a node with another.
     *
     * @param source The source label.
     * @param target The target label.
     * @return True if the edge is allowed.
     */
    public boolean connects(@Nonnull final NodeLabel source, @Nonnull final NodeLabel target) {
        return endpoints.containsEntry(source, target);
    }
}
