package com.vmturbo.placement.allocation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableMap;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.lang3.tuple.Triple;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmturbo.placement.common.ConcurrentUpdateDetectedException;
import com.vmturbo.placement.common.InvalidAllocationException;
import com.vmturbo.placement.common.ItemNotFoundException;
import com.vmturbo.placement.common.ItemNotFoundException.ConsumerNotFoundException;
import com.vmturbo.placement.common.ItemNotFoundException.ResourceProviderNotFoundException;
import com.vmturbo.placement.common.StoreOperations;
import com.vmturbo.placement.consumer.Consumer;
import com.vmturbo.placement.consumer.ConsumerStore;
import com.vmturbo.placement.graph.EdgeType;
import com.vmturbo.placement.graph.GraphEdge;
import com.vmturbo.placement.graph.GraphNode;
import com.vmturbo.placement.graph.GraphStore;
import com.vmturbo.placement.graph.GraphStoreException;
import com.vmturbo.placement.graph.GraphTransaction;
import com.vmturbo.placement.graph.NodeLabel;
import com.vmturbo.placement.graph.NodeRef;
import com.vmturbo.placement.ownership.Project;
import com.vmturbo.placement.ownership.User;
import com.vmturbo.placement.ownership.UserStore;
import com.vmturbo.placement.provider.Inventory;
import com.vmturbo.placement.provider.ResourceProviderStore;

/**
 * Records the {@link Allocation}s consumers hold against provider inventory.
 *
 * <p>An allocation is a USES edge from the consumer to the inventory node, carrying the amount
 * used. All the allocations of a consumer are replaced together, and every replacement moves
 * the consumer to its next generation, so two writers working from the same view of a
 * consumer cannot both succeed.</p>
 */
public class AllocationStore {

    private static final Logger logger = LogManager.getLogger();

    private static final String STORE_LABEL = "allocation";

    private final GraphStore graphStore;

    private final ConsumerStore consumerStore;

    private final UserStore userStore;

    private final ResourceProviderStore resourceProviderStore;

    /**
     * Create a new store.
     *
     * @param graphStore The graph the allocations live in.
     * @param consumerStore The store for the consumers holding allocations.
     * @param userStore The store for the users owning new consumers.
     * @param resourceProviderStore The store for the providers allocations come from.
     */
    public AllocationStore(@Nonnull final GraphStore graphStore,
                           @Nonnull final ConsumerStore consumerStore,
                           @Nonnull final UserStore userStore,
                           @Nonnull final ResourceProviderStore resourceProviderStore) {
        this.graphStore = Objects.requireNonNull(graphStore);
        this.consumerStore = Objects.requireNonNull(consumerStore);
        this.userStore = Objects.requireNonNull(userStore);
        this.resourceProviderStore = Objects.requireNonNull(resourceProviderStore);
    }

    /**
     * Replace all the allocations of every consumer named in the given allocations, in one
     * transaction.
     *
     * <p>Consumers that don't exist yet are created. A new consumer is owned by its user and
     * project if both are given. A user given without a project keeps the project it already
     * has, or joins the "incomplete" project. A consumer with no user is owned by the
     * "incomplete" user. Allocations of the
     * same resource class from the same provider for the same consumer are added together,
     * and a total of 0 means the consumer holds nothing of it. Each affected consumer and
     * provider moves to its next generation. Consumers left holding nothing are deleted.</p>
     *
     * <p>On success the consumers carry their new generation, and new consumers their creation
     * times. On failure nothing is changed, the consumer objects included.</p>
     *
     * @param allocations The new allocations.
     * @throws InvalidAllocationException If an allocation breaks the unit constraints of the
     *         inventory, doesn't fit in the free capacity, or names a resource class the
     *         provider has no inventory of.
     * @throws ConcurrentUpdateDetectedException If a consumer changed since it was read.
     * @throws ItemNotFoundException If a provider, or the owner of a new consumer, doesn't
     *         exist.
     */
    public void replaceAll(@Nonnull final Collection<Allocation> allocations)
            throws InvalidAllocationException, ConcurrentUpdateDetectedException,
            ItemNotFoundException {
        final Map<Consumer, Consumer> stored;
        try {
            stored = graphStore.transactionResult(tx -> replaceAll(tx, allocations));
        } catch (GraphStoreException e) {
            StoreOperations.rethrowIfCause(e, InvalidAllocationException.class);
            StoreOperations.rethrowIfCause(e, ConcurrentUpdateDetectedException.class);
            StoreOperations.rethrowIfCause(e, ItemNotFoundException.class);
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "replace_all").increment();
            throw e;
        }
        stored.forEach(Consumer::copyStoredState);
    }

    /**
     * Replace allocations inside an open transaction. The consumer objects are not changed.
     *
     * @return Each consumer named in the allocations, mapped to its state once the transaction
     *         commits.
     */
    @Nonnull
    private Map<Consumer, Consumer> replaceAll(@Nonnull final GraphTransaction tx,
                                           @Nonnull final Collection<Allocation> allocations)
            throws InvalidAllocationException, ConcurrentUpdateDetectedException,
            ItemNotFoundException {
        final Map<String, Consumer> consumers = new LinkedHashMap<>();
        final Map<Triple<String, String, String>, Long> totals = new LinkedHashMap<>();
        for (Allocation allocation : allocations) {
            if (allocation.getUsed() < 0) {
                throw new InvalidAllocationException("Negative allocation: " + allocation);
            }
            final Consumer consumer = allocation.getConsumer();
            consumers.putIfAbsent(consumer.getUuid(), consumer);
            totals.merge(Triple.of(consumer.getUuid(), allocation.getProviderUuid(),
                    allocation.getResourceClass()), allocation.getUsed(), Long::sum);
        }

        final Map<Consumer, Consumer> stored = new LinkedHashMap<>();
        for (Consumer consumer : consumers.values()) {
            stored.put(consumer, consumerStore.exists(tx, consumer.getUuid())
                    ? copyOf(consumer) : createConsumer(tx, consumer));
        }

        final Set<String> touchedProviders = new LinkedHashSet<>();
        for (String consumerUuid : consumers.keySet()) {
            final NodeRef consumerRef = ConsumerStore.consumerRef(consumerUuid);
            for (GraphEdge uses : tx.getOutgoing(EdgeType.USES, consumerRef)) {
                tx.deleteEdge(EdgeType.USES, consumerRef, uses.getTarget());
                tx.getNode(NodeLabel.INVENTORY, uses.getTargetUuid())
                        .flatMap(inventory -> inventory.getProperty(
                                ResourceProviderStore.PROVIDER_UUID, String.class))
                        .ifPresent(touchedProviders::add);
            }
        }

        for (Map.Entry<Triple<String, String, String>, Long> total : totals.entrySet()) {
            final String consumerUuid = total.getKey().getLeft();
            final String providerUuid = total.getKey().getMiddle();
            final String resourceClass = total.getKey().getRight();
            final long used = total.getValue();
            resourceProviderStore.getByUuid(tx, providerUuid);
            touchedProviders.add(providerUuid);
            if (used == 0) {
                continue;
            }
            final Inventory inventory = resourceProviderStore
                    .getInventory(tx, providerUuid, resourceClass)
                    .orElseThrow(() -> new InvalidAllocationException("Resource provider "
                            + providerUuid + " has no inventory of " + resourceClass + "."));
            if (!inventory.acceptsAmount(used)) {
                throw new InvalidAllocationException("Cannot allocate " + used + " "
                        + resourceClass + " from " + providerUuid + ": amounts must be between "
                        + inventory.getMinUnit() + " and " + inventory.getMaxUnit()
                        + " in steps of " + inventory.getStepSize() + ".");
            }
            final long inUse = resourceProviderStore.getUsage(tx, providerUuid, resourceClass);
            if (inUse + used > inventory.getCapacity()) {
                throw new InvalidAllocationException("Cannot allocate " + used + " "
                        + resourceClass + " from " + providerUuid + ": " + inUse + " of "
                        + inventory.getCapacity() + " already in use.");
            }
            tx.mergeEdge(EdgeType.USES, ConsumerStore.consumerRef(consumerUuid),
                    ResourceProviderStore.inventoryRef(providerUuid, resourceClass),
                    ImmutableMap.of(ResourceProviderStore.USED, used));
        }

        for (String providerUuid : touchedProviders) {
            resourceProviderStore.bumpGeneration(tx, providerUuid);
        }

        for (Consumer current : stored.values()) {
            current.setGeneration(consumerStore.incrementGeneration(tx, current));
        }
        final Set<String> emptied =
                consumerStore.deleteConsumersIfNoAllocations(tx, consumers.keySet());
        logger.debug("Replaced allocations of {} consumers on {} providers; deleted {}",
                consumers.size(), touchedProviders.size(), emptied);
        return stored;
    }

    @Nonnull
    private Consumer createConsumer(@Nonnull final GraphTransaction tx,
                                    @Nonnull final Consumer consumer)
            throws ItemNotFoundException {
        final Consumer created = consumerStore.create(tx, consumer);
        final User user = consumer.getUser();
        final Project project = consumer.getProject();
        if (user != null) {
            final String projectUuid;
            if (project != null) {
                projectUuid = project.getUuid();
            } else {
                userStore.getByUuid(tx, user.getUuid());
                projectUuid = userStore.getProjectUuid(tx, user.getUuid()).orElseGet(() -> {
                    userStore.ensureIncompleteUser(tx);
                    return userStore.getIncompleteProject().getUuid();
                });
                logger.debug("Consumer {} has {} but no project given; using project {}",
                        consumer.getUuid(), user, projectUuid);
            }
            consumerStore.relateProjectAndUser(tx, projectUuid, user.getUuid(),
                    consumer.getUuid());
        } else {
            final String incompleteUser = userStore.ensureIncompleteUser(tx);
            tx.mergeEdge(EdgeType.OWNS, UserStore.userRef(incompleteUser),
                    ConsumerStore.consumerRef(consumer.getUuid()), ImmutableMap.of());
            if (project != null) {
                logger.warn("Consumer {} names {} but no user; it is owned by the incomplete "
                        + "user {} instead", consumer.getUuid(), project, incompleteUser);
            } else {
                logger.debug("Consumer {} has no owner given; owned by the incomplete user",
                        consumer.getUuid());
            }
        }
        return created;
    }

    @Nonnull
    private static Consumer copyOf(@Nonnull final Consumer consumer) {
        return new Consumer(consumer.getUuid(), consumer.getProject(), consumer.getUser(),
                consumer.getGeneration(), consumer.getCreatedAt(), consumer.getUpdatedAt());
    }

    /**
     * Get the allocations a consumer holds.
     *
     * @param consumerUuid The consumer UUID.
     * @return The allocations.
     * @throws ConsumerNotFoundException If the consumer doesn't exist.
     */
    @Nonnull
    public List<Allocation> getAllocationsForConsumer(@Nonnull final String consumerUuid)
            throws ConsumerNotFoundException {
        try {
            return graphStore.readResult(tx -> {
                final Consumer consumer = consumerStore.getByUuid(tx, consumerUuid);
                final List<Allocation> result = new ArrayList<>();
                for (GraphEdge uses : tx.getOutgoing(EdgeType.USES,
                        ConsumerStore.consumerRef(consumerUuid))) {
                    final Pair<String, String> target = inventoryTarget(tx, uses);
                    result.add(new Allocation(target.getLeft(), target.getRight(), consumer,
                            uses.getProperty(ResourceProviderStore.USED, Long.class)
                                    .orElse(0L)));
                }
                return result;
            });
        } catch (GraphStoreException e) {
            StoreOperations.rethrowIfCause(e, ConsumerNotFoundException.class);
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "get_for_consumer").increment();
            throw e;
        }
    }

    /**
     * Get the allocations made against a provider's inventory.
     *
     * @param providerUuid The provider UUID.
     * @return The allocations.
     * @throws ResourceProviderNotFoundException If the provider doesn't exist.
     */
    @Nonnull
    public List<Allocation> getAllocationsForProvider(@Nonnull final String providerUuid)
            throws ResourceProviderNotFoundException {
        try {
            return graphStore.readResult(tx -> {
                resourceProviderStore.getByUuid(tx, providerUuid);
                final List<Allocation> result = new ArrayList<>();
                for (GraphEdge provides : tx.getOutgoing(EdgeType.PROVIDES,
                        ResourceProviderStore.providerRef(providerUuid))) {
                    for (GraphEdge uses : tx.getIncoming(EdgeType.USES, provides.getTarget())) {
                        final Pair<String, String> target = inventoryTarget(tx, uses);
                        result.add(new Allocation(providerUuid, target.getRight(),
                                consumerStore.getByUuid(tx, uses.getSourceUuid()),
                                uses.getProperty(ResourceProviderStore.USED, Long.class)
                                        .orElse(0L)));
                    }
                }
                return result;
            });
        } catch (GraphStoreException e) {
            StoreOperations.rethrowIfCause(e, ResourceProviderNotFoundException.class);
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "get_for_provider").increment();
            throw e;
        }
    }

    /**
     * Get the amount of a resource class in use on a provider.
     *
     * @param providerUuid The provider UUID.
     * @param resourceClass The resource class.
     * @return The amount allocated, 0 if none.
     * @throws ResourceProviderNotFoundException If the provider doesn't exist.
     */
    public long getUsage(@Nonnull final String providerUuid,
                         @Nonnull final String resourceClass)
            throws ResourceProviderNotFoundException {
        try {
            return graphStore.readResult(tx -> {
                resourceProviderStore.getByUuid(tx, providerUuid);
                return resourceProviderStore.getUsage(tx, providerUuid, resourceClass);
            });
        } catch (GraphStoreException e) {
            StoreOperations.rethrowIfCause(e, ResourceProviderNotFoundException.class);
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "get_usage").increment();
            throw e;
        }
    }

    @Nonnull
    private static Pair<String, String> inventoryTarget(@Nonnull final GraphTransaction tx,
                                                        @Nonnull final GraphEdge uses) {
        final GraphNode inventory = tx.getNode(NodeLabel.INVENTORY, uses.getTargetUuid())
                .orElseThrow(() -> new GraphStoreException("Allocation " + uses
                        + " points at missing inventory."));
        return Pair.of(
                inventory.getProperty(ResourceProviderStore.PROVIDER_UUID, String.class)
                        .orElseThrow(() -> new GraphStoreException(
                                "Inventory " + inventory.getUuid() + " has no provider.")),
                inventory.getProperty(ResourceProviderStore.RESOURCE_CLASS,
                        String.class)
                        .orElseThrow(() -> new GraphStoreException(
                                "Inventory " + inventory.getUuid() + " has no resource class.")));
    }
}
