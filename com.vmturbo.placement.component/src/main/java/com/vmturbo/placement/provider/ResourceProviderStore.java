package com.vmturbo.placement.provider;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import javax.annotation.Nonnull;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmturbo.placement.candidates.ProviderRef;
import com.vmturbo.placement.common.ConcurrentUpdateDetectedException;
import com.vmturbo.placement.common.InvalidInventoryException;
import com.vmturbo.placement.common.ItemNotFoundException.ResourceProviderNotFoundException;
import com.vmturbo.placement.common.StoreOperations;
import com.vmturbo.placement.graph.EdgeType;
import com.vmturbo.placement.graph.GraphEdge;
import com.vmturbo.placement.graph.GraphNode;
import com.vmturbo.placement.graph.GraphStore;
import com.vmturbo.placement.graph.GraphStoreException;
import com.vmturbo.placement.graph.GraphTransaction;
import com.vmturbo.placement.graph.NodeLabel;
import com.vmturbo.placement.graph.NodeRef;

/**
 * Persists {@link ResourceProvider}s and their {@link Inventory} in the {@link GraphStore}.
 *
 * <p>A provider is a RESOURCE_PROVIDER node. Each of its inventories is an INVENTORY node the
 * provider PROVIDES, and allocations are USES edges from consumers to the inventory nodes.
 * Child providers hang off their parent through PARENT_OF edges.</p>
 *
 * <p>Inventory changes are guarded by the provider generation in the same way allocation
 * changes are guarded by the consumer generation.</p>
 */
public class ResourceProviderStore {

    static final String NAME = "name";
    static final String PARENT_UUID = "parent_uuid";
    static final String ROOT_UUID = "root_uuid";
    static final String GENERATION = "generation";

    /**
     * The property on an inventory node holding the UUID of its provider.
     */
    public static final String PROVIDER_UUID = "provider_uuid";

    /**
     * The property on an inventory node holding its resource class.
     */
    public static final String RESOURCE_CLASS = "resource_class";

    static final String TOTAL = "total";
    static final String RESERVED = "reserved";
    static final String MIN_UNIT = "min_unit";
    static final String MAX_UNIT = "max_unit";
    static final String STEP_SIZE = "step_size";
    static final String ALLOCATION_RATIO = "allocation_ratio";

    /**
     * The property on a USES edge holding the amount allocated.
     */
    public static final String USED = "used";

    private static final Logger logger = LogManager.getLogger();

    private static final String STORE_LABEL = "resource_provider";

    private final GraphStore graphStore;

    /**
     * Create a new store.
     *
     * @param graphStore The graph the providers live in.
     */
    public ResourceProviderStore(@Nonnull final GraphStore graphStore) {
        this.graphStore = Objects.requireNonNull(graphStore);
    }

    /**
     * The UUID of the inventory node for a resource class of a provider. Resource classes
     * never contain the separator, so no two (provider, class) pairs share a UUID.
     *
     * @param providerUuid The provider UUID.
     * @param resourceClass The resource class.
     * @return The inventory node UUID.
     * @throws IllegalArgumentException If the resource class is malformed.
     */
    @Nonnull
    public static String inventoryUuid(@Nonnull final String providerUuid,
                                       @Nonnull final String resourceClass) {
        return providerUuid + "/" + Inventory.checkResourceClass(resourceClass);
    }

    /**
     * Refer to the inventory node for a resource class of a provider.
     *
     * @param providerUuid The provider UUID.
     * @param resourceClass The resource class.
     * @return The reference.
     * @throws IllegalArgumentException If the resource class is malformed.
     */
    @Nonnull
    public static NodeRef inventoryRef(@Nonnull final String providerUuid,
                                       @Nonnull final String resourceClass) {
        return NodeRef.of(NodeLabel.INVENTORY, inventoryUuid(providerUuid, resourceClass));
    }

    /**
     * Refer to a provider node.
     *
     * @param uuid The provider UUID.
     * @return The reference.
     */
    @Nonnull
    public static NodeRef providerRef(@Nonnull final String uuid) {
        return NodeRef.of(NodeLabel.RESOURCE_PROVIDER, uuid);
    }

    /**
     * Create a provider at generation 0. A provider with a parent belongs to its parent's
     * tree; a provider without one is the root of its own tree. On return the provider
     * carries its root and generation.
     *
     * @param provider The provider.
     * @throws ResourceProviderNotFoundException If the parent doesn't exist.
     */
    public void create(@Nonnull final ResourceProvider provider)
            throws ResourceProviderNotFoundException {
        try {
            graphStore.transaction(tx -> create(tx, provider));
        } catch (GraphStoreException e) {
            StoreOperations.rethrowIfCause(e, ResourceProviderNotFoundException.class);
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "create").increment();
            throw e;
        }
    }

    /**
     * Create a provider inside an open transaction. See {@link #create(ResourceProvider)}.
     *
     * @param tx The transaction.
     * @param provider The provider.
     * @throws ResourceProviderNotFoundException If the parent doesn't exist.
     */
    public void create(@Nonnull final GraphTransaction tx,
                       @Nonnull final ResourceProvider provider)
            throws ResourceProviderNotFoundException {
        final ImmutableMap.Builder<String, Object> properties = ImmutableMap.builder();
        properties.put(NAME, provider.getName());
        final String rootUuid;
        if (provider.getParentUuid() != null) {
            rootUuid = getRootUuid(tx, provider.getParentUuid());
            properties.put(PARENT_UUID, provider.getParentUuid());
        } else {
            rootUuid = provider.getUuid();
        }
        properties.put(ROOT_UUID, rootUuid);
        properties.put(GENERATION, 0L);
        tx.mergeNode(NodeLabel.RESOURCE_PROVIDER, provider.getUuid(), properties.build());
        if (provider.getParentUuid() != null) {
            tx.mergeEdge(EdgeType.PARENT_OF, providerRef(provider.getParentUuid()),
                    providerRef(provider.getUuid()), ImmutableMap.of());
        }
        provider.setRootUuid(rootUuid);
        provider.setGeneration(0L);
        logger.debug("Created {} in tree {}", provider, rootUuid);
    }

    /**
     * Look up a provider.
     *
     * @param uuid The UUID of the provider.
     * @return The provider.
     * @throws ResourceProviderNotFoundException If there is no such provider.
     */
    @Nonnull
    public ResourceProvider getByUuid(@Nonnull final String uuid)
            throws ResourceProviderNotFoundException {
        try {
            return graphStore.readResult(tx -> getByUuid(tx, uuid));
        } catch (GraphStoreException e) {
            StoreOperations.rethrowIfCause(e, ResourceProviderNotFoundException.class);
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "get").increment();
            throw e;
        }
    }

    /**
     * Look up a provider inside an open transaction.
     *
     * @param tx The transaction.
     * @param uuid The UUID of the provider.
     * @return The provider.
     * @throws ResourceProviderNotFoundException If there is no such provider.
     */
    @Nonnull
    public ResourceProvider getByUuid(@Nonnull final GraphTransaction tx,
                                      @Nonnull final String uuid)
            throws ResourceProviderNotFoundException {
        final GraphNode node = providerNode(tx, uuid);
        return new ResourceProvider(uuid,
                node.getProperty(NAME, String.class).orElse(uuid),
                node.getProperty(PARENT_UUID, String.class).orElse(null),
                node.getProperty(ROOT_UUID, String.class).orElse(uuid),
                node.getProperty(GENERATION, Long.class).orElse(0L));
    }

    /**
     * Get the root of the tree a provider belongs to.
     *
     * @param uuid The UUID of the provider.
     * @return The UUID of the root provider.
     * @throws ResourceProviderNotFoundException If there is no such provider.
     */
    @Nonnull
    public String getRootUuid(@Nonnull final String uuid)
            throws ResourceProviderNotFoundException {
        try {
            return graphStore.readResult(tx -> getRootUuid(tx, uuid));
        } catch (GraphStoreException e) {
            StoreOperations.rethrowIfCause(e, ResourceProviderNotFoundException.class);
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "get_root").increment();
            throw e;
        }
    }

    /**
     * Get the root of the tree a provider belongs to, inside an open transaction.
     *
     * @param tx The transaction.
     * @param uuid The UUID of the provider.
     * @return The UUID of the root provider.
     * @throws ResourceProviderNotFoundException If there is no such provider.
     */
    @Nonnull
    public String getRootUuid(@Nonnull final GraphTransaction tx, @Nonnull final String uuid)
            throws ResourceProviderNotFoundException {
        return providerNode(tx, uuid).getProperty(ROOT_UUID, String.class).orElse(uuid);
    }

    /**
     * Replace all of a provider's inventory. Resource classes missing from the new inventory
     * are removed, which is only allowed when nothing is allocated from them.
     *
     * @param provider The provider, at the generation it was read at. Carries the new
     *        generation on return.
     * @param inventories The new inventory, at most one per resource class.
     * @throws ResourceProviderNotFoundException If the provider doesn't exist.
     * @throws InvalidInventoryException If a resource class in use would be removed.
     * @throws ConcurrentUpdateDetectedException If the provider changed since it was read.
     */
    public void setInventory(@Nonnull final ResourceProvider provider,
                             @Nonnull final Collection<Inventory> inventories)
            throws ResourceProviderNotFoundException, InvalidInventoryException,
            ConcurrentUpdateDetectedException {
        final long generation;
        try {
            generation = graphStore.transactionResult(tx -> {
                final Map<String, Inventory> byClass = inventories.stream()
                        .collect(Collectors.toMap(Inventory::getResourceClass,
                                Function.identity(), (a, b) -> {
                                    throw new IllegalArgumentException(
                                            "Duplicate inventory for " + a.getResourceClass());
                                }));
                providerNode(tx, provider.getUuid());
                for (Inventory existing : getInventories(tx, provider.getUuid())) {
                    if (!byClass.containsKey(existing.getResourceClass())) {
                        removeInventory(tx, provider.getUuid(), existing.getResourceClass());
                    }
                }
                for (Inventory inventory : byClass.values()) {
                    writeInventory(tx, provider.getUuid(), inventory);
                }
                return incrementGeneration(tx, provider);
            });
        } catch (GraphStoreException e) {
            StoreOperations.rethrowIfCause(e, ResourceProviderNotFoundException.class);
            StoreOperations.rethrowIfCause(e, InvalidInventoryException.class);
            StoreOperations.rethrowIfCause(e, ConcurrentUpdateDetectedException.class);
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "set_inventory").increment();
            throw e;
        }
        provider.setGeneration(generation);
    }

    /**
     * Add inventory of a resource class the provider doesn't have yet.
     *
     * @param provider The provider, at the generation it was read at. Carries the new
     *        generation on return.
     * @param inventory The new inventory.
     * @throws ResourceProviderNotFoundException If the provider doesn't exist.
     * @throws InvalidInventoryException If the provider already has that resource class.
     * @throws ConcurrentUpdateDetectedException If the provider changed since it was read.
     */
    public void addInventory(@Nonnull final ResourceProvider provider,
                             @Nonnull final Inventory inventory)
            throws ResourceProviderNotFoundException, InvalidInventoryException,
            ConcurrentUpdateDetectedException {
        final long generation;
        try {
            generation = graphStore.transactionResult(tx -> {
                providerNode(tx, provider.getUuid());
                if (getInventory(tx, provider.getUuid(), inventory.getResourceClass())
                        .isPresent()) {
                    throw new InvalidInventoryException("Resource provider "
                            + provider.getUuid() + " already has inventory of "
                            + inventory.getResourceClass() + ".");
                }
                writeInventory(tx, provider.getUuid(), inventory);
                return incrementGeneration(tx, provider);
            });
        } catch (GraphStoreException e) {
            StoreOperations.rethrowIfCause(e, ResourceProviderNotFoundException.class);
            StoreOperations.rethrowIfCause(e, InvalidInventoryException.class);
            StoreOperations.rethrowIfCause(e, ConcurrentUpdateDetectedException.class);
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "add_inventory").increment();
            throw e;
        }
        provider.setGeneration(generation);
    }

    /**
     * Remove a provider's inventory of one resource class.
     *
     * @param provider The provider, at the generation it was read at. Carries the new
     *        generation on return.
     * @param resourceClass The resource class.
     * @throws ResourceProviderNotFoundException If the provider doesn't exist.
     * @throws InvalidInventoryException If the provider has no such inventory, or it is in use.
     * @throws ConcurrentUpdateDetectedException If the provider changed since it was read.
     */
    public void deleteInventory(@Nonnull final ResourceProvider provider,
                                @Nonnull final String resourceClass)
            throws ResourceProviderNotFoundException, InvalidInventoryException,
            ConcurrentUpdateDetectedException {
        final long generation;
        try {
            generation = graphStore.transactionResult(tx -> {
                providerNode(tx, provider.getUuid());
                if (!getInventory(tx, provider.getUuid(), resourceClass).isPresent()) {
                    throw new InvalidInventoryException("Resource provider "
                            + provider.getUuid() + " has no inventory of " + resourceClass
                            + ".");
                }
                removeInventory(tx, provider.getUuid(), resourceClass);
                return incrementGeneration(tx, provider);
            });
        } catch (GraphStoreException e) {
            StoreOperations.rethrowIfCause(e, ResourceProviderNotFoundException.class);
            StoreOperations.rethrowIfCause(e, InvalidInventoryException.class);
            StoreOperations.rethrowIfCause(e, ConcurrentUpdateDetectedException.class);
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "delete_inventory").increment();
            throw e;
        }
        provider.setGeneration(generation);
    }

    /**
     * Get a provider's inventory.
     *
     * @param providerUuid The provider UUID.
     * @return The inventory, one entry per resource class.
     * @throws ResourceProviderNotFoundException If the provider doesn't exist.
     */
    @Nonnull
    public List<Inventory> getInventories(@Nonnull final String providerUuid)
            throws ResourceProviderNotFoundException {
        try {
            return graphStore.readResult(tx -> {
                providerNode(tx, providerUuid);
                return getInventories(tx, providerUuid);
            });
        } catch (GraphStoreException e) {
            StoreOperations.rethrowIfCause(e, ResourceProviderNotFoundException.class);
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "get_inventories").increment();
            throw e;
        }
    }

    /**
     * Get a provider's inventory inside an open transaction.
     *
     * @param tx The transaction.
     * @param providerUuid The provider UUID.
     * @return The inventory, empty if the provider has none or doesn't exist.
     */
    @Nonnull
    public List<Inventory> getInventories(@Nonnull final GraphTransaction tx,
                                          @Nonnull final String providerUuid) {
        return tx.getOutgoing(EdgeType.PROVIDES, providerRef(providerUuid)).stream()
                .map(edge -> tx.getNode(NodeLabel.INVENTORY, edge.getTargetUuid()))
                .filter(Optional::isPresent)
                .map(node -> toInventory(node.get()))
                .collect(Collectors.toList());
    }

    /**
     * Get a provider's inventory of one resource class inside an open transaction.
     *
     * @param tx The transaction.
     * @param providerUuid The provider UUID.
     * @param resourceClass The resource class.
     * @return The inventory, or empty if the provider has none of that class.
     */
    @Nonnull
    public Optional<Inventory> getInventory(@Nonnull final GraphTransaction tx,
                                            @Nonnull final String providerUuid,
                                            @Nonnull final String resourceClass) {
        if (!Inventory.isValidResourceClass(resourceClass)) {
            return Optional.empty();
        }
        return tx.getNode(NodeLabel.INVENTORY, inventoryUuid(providerUuid, resourceClass))
                .map(ResourceProviderStore::toInventory);
    }

    /**
     * Get the total amount allocated from a provider's inventory of one resource class.
     *
     * @param tx The transaction.
     * @param providerUuid The provider UUID.
     * @param resourceClass The resource class.
     * @return The amount in use, 0 if there is no such inventory.
     */
    public long getUsage(@Nonnull final GraphTransaction tx,
                         @Nonnull final String providerUuid,
                         @Nonnull final String resourceClass) {
        if (!Inventory.isValidResourceClass(resourceClass)) {
            return 0L;
        }
        return tx.getIncoming(EdgeType.USES, inventoryRef(providerUuid, resourceClass))
                .stream()
                .mapToLong(edge -> edge.getProperty(USED, Long.class).orElse(0L))
                .sum();
    }

    /**
     * Find the providers that could satisfy a request for an amount of a resource class: the
     * amount meets the inventory's unit constraints, and fits in the capacity not yet used.
     *
     * @param resourceClass The resource class.
     * @param amount The amount requested.
     * @return Each matching provider with the root of its tree.
     */
    @Nonnull
    public Set<ProviderRef> getProvidersWithCapacity(@Nonnull final String resourceClass,
                                                     final long amount) {
        try {
            return graphStore.readResult(tx ->
                    getProvidersWithCapacity(tx, resourceClass, amount));
        } catch (GraphStoreException e) {
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "providers_with_capacity")
                    .increment();
            throw e;
        }
    }

    /**
     * Find the providers that could satisfy a request, inside an open transaction. See
     * {@link #getProvidersWithCapacity(String, long)}.
     *
     * @param tx The transaction.
     * @param resourceClass The resource class.
     * @param amount The amount requested.
     * @return Each matching provider with the root of its tree.
     */
    @Nonnull
    public Set<ProviderRef> getProvidersWithCapacity(@Nonnull final GraphTransaction tx,
                                                     @Nonnull final String resourceClass,
                                                     final long amount) {
        final ImmutableSet.Builder<ProviderRef> providers = ImmutableSet.builder();
        for (GraphNode node : tx.getNodes(NodeLabel.INVENTORY)) {
            final Inventory inventory = toInventory(node);
            if (!inventory.getResourceClass().equals(resourceClass)
                    || !inventory.acceptsAmount(amount)) {
                continue;
            }
            final String providerUuid = node.getProperty(PROVIDER_UUID, String.class)
                    .orElseThrow(() -> new GraphStoreException(
                            "Inventory " + node.getUuid() + " has no provider."));
            final long used = getUsage(tx, providerUuid, resourceClass);
            if (used + amount <= inventory.getCapacity()) {
                tx.getNode(NodeLabel.RESOURCE_PROVIDER, providerUuid).ifPresent(provider ->
                        providers.add(new ProviderRef(providerUuid,
                                provider.getProperty(ROOT_UUID, String.class)
                                        .orElse(providerUuid))));
            }
        }
        return providers.build();
    }

    /**
     * Move a provider to its next generation, whatever generation it is at. Used when
     * allocations against the provider change.
     *
     * @param tx The transaction.
     * @param providerUuid The provider UUID.
     * @return The new generation.
     * @throws ResourceProviderNotFoundException If the provider doesn't exist.
     */
    public long bumpGeneration(@Nonnull final GraphTransaction tx,
                               @Nonnull final String providerUuid)
            throws ResourceProviderNotFoundException {
        final long next = providerNode(tx, providerUuid).getProperty(GENERATION, Long.class)
                .orElse(0L) + 1;
        tx.setNodeProperties(NodeLabel.RESOURCE_PROVIDER, providerUuid,
                ImmutableMap.of(GENERATION, next));
        return next;
    }

    private long incrementGeneration(@Nonnull final GraphTransaction tx,
                                     @Nonnull final ResourceProvider provider)
            throws ConcurrentUpdateDetectedException {
        final Long expected = provider.getGeneration();
        Preconditions.checkArgument(expected != null,
                "Resource provider %s has no generation. Create or read it first.",
                provider.getUuid());
        final long next = expected + 1;
        if (!tx.compareAndSetProperties(NodeLabel.RESOURCE_PROVIDER, provider.getUuid(),
                GENERATION, expected, ImmutableMap.of(GENERATION, next))) {
            logger.warn("Resource provider {} was updated concurrently: expected generation {}",
                    provider.getUuid(), expected);
            throw new ConcurrentUpdateDetectedException("Resource provider "
                    + provider.getUuid() + " was updated by another writer. Expected generation "
                    + expected + ".");
        }
        return next;
    }

    private void writeInventory(@Nonnull final GraphTransaction tx,
                                @Nonnull final String providerUuid,
                                @Nonnull final Inventory inventory) {
        final String uuid = inventoryUuid(providerUuid, inventory.getResourceClass());
        final Map<String, Object> properties = ImmutableMap.<String, Object>builder()
                .put(PROVIDER_UUID, providerUuid)
                .put(RESOURCE_CLASS, inventory.getResourceClass())
                .put(TOTAL, inventory.getTotal())
                .put(RESERVED, inventory.getReserved())
                .put(MIN_UNIT, inventory.getMinUnit())
                .put(MAX_UNIT, inventory.getMaxUnit())
                .put(STEP_SIZE, inventory.getStepSize())
                .put(ALLOCATION_RATIO, inventory.getAllocationRatio())
                .build();
        if (tx.getNode(NodeLabel.INVENTORY, uuid).isPresent()) {
            tx.setNodeProperties(NodeLabel.INVENTORY, uuid, properties);
            final long used = getUsage(tx, providerUuid, inventory.getResourceClass());
            if (used > inventory.getCapacity()) {
                logger.warn("Resource provider {} now has {} of {} in use, above its capacity {}",
                        providerUuid, used, inventory.getResourceClass(),
                        inventory.getCapacity());
            }
        } else {
            tx.mergeNode(NodeLabel.INVENTORY, uuid, properties);
            tx.mergeEdge(EdgeType.PROVIDES, providerRef(providerUuid),
                    NodeRef.of(NodeLabel.INVENTORY, uuid), ImmutableMap.of());
        }
        logger.debug("Resource provider {} has {}", providerUuid, inventory);
    }

    private void removeInventory(@Nonnull final GraphTransaction tx,
                                 @Nonnull final String providerUuid,
                                 @Nonnull final String resourceClass)
            throws InvalidInventoryException {
        final String uuid = inventoryUuid(providerUuid, resourceClass);
        final List<GraphEdge> allocations = tx.getIncoming(EdgeType.USES,
                NodeRef.of(NodeLabel.INVENTORY, uuid));
        if (!allocations.isEmpty()) {
            throw new InvalidInventoryException("Inventory of " + resourceClass
                    + " on resource provider " + providerUuid + " is in use by "
                    + allocations.size() + " consumers.");
        }
        tx.detachDeleteNode(NodeLabel.INVENTORY, uuid);
        logger.debug("Removed {} inventory from resource provider {}", resourceClass,
                providerUuid);
    }

    @Nonnull
    private static GraphNode providerNode(@Nonnull final GraphTransaction tx,
                                          @Nonnull final String uuid)
            throws ResourceProviderNotFoundException {
        return tx.getNode(NodeLabel.RESOURCE_PROVIDER, uuid)
                .orElseThrow(() -> new ResourceProviderNotFoundException(uuid));
    }

    @Nonnull
    private static Inventory toInventory(@Nonnull final GraphNode node) {
        final String resourceClass = node.getProperty(RESOURCE_CLASS, String.class)
                .orElseThrow(() -> new GraphStoreException(
                        "Inventory " + node.getUuid() + " has no resource class."));
        final long total = node.getProperty(TOTAL, Long.class).orElse(0L);
        final Inventory.Builder builder = Inventory.newBuilder(resourceClass, total);
        node.getProperty(RESERVED, Long.class).ifPresent(builder::setReserved);
        node.getProperty(MIN_UNIT, Long.class).ifPresent(builder::setMinUnit);
        node.getProperty(MAX_UNIT, Long.class).ifPresent(builder::setMaxUnit);
        node.getProperty(STEP_SIZE, Long.class).ifPresent(builder::setStepSize);
        node.getProperty(ALLOCATION_RATIO, Double.class).ifPresent(builder::setAllocationRatio);
        return builder.build();
    }
}
