package com.vmturbo.placement.graph;

/**
 * The kinds of node kept in the placement graph.
 */
public enum NodeLabel {
    /**
     * A project. Owns users.
     */
    PROJECT,

    /**
     * A user. Owned by a project, owns consumers.
     */
    USER,

    /**
     * A consumer of inventory, e.g. a VM instance. Owned by a user.
     */
    CONSUMER,

    /**
     * A resource provider, e.g. a compute host or a storage pool.
     */
    RESOURCE_PROVIDER,

    /**
     * The inventory of a single resource class on a single resource provider.
     */
    INVENTORY
}
