package com.vmturbo.placement.consumer;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import javax.annotation.Nonnull;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmturbo.placement.common.ConcurrentUpdateDetectedException;
import com.vmturbo.placement.common.ItemNotFoundException;
import com.vmturbo.placement.common.ItemNotFoundException.ConsumerNotFoundException;
import com.vmturbo.placement.common.ItemNotFoundException.ProjectNotFoundException;
import com.vmturbo.placement.common.PlacementMetricCounter;
import com.vmturbo.placement.common.StoreOperations;
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

/**
 * The {@link ConsumerStore} is used for the lifecycle of {@link Consumer}s and for the
 * ownership chain project -> user -> consumer.
 *
 * <p>Each public method runs in its own graph transaction. The variants taking a
 * {@link GraphTransaction} let callers compose several operations into one transaction.</p>
 *
 * <p>The store does no locking of its own. Concurrent changes to a consumer's allocations are
 * caught by {@link #incrementGeneration(Consumer)}, and ownership edges are merged so that
 * concurrent callers relating the same consumer end up with the same edges.</p>
 */
public class ConsumerStore {

    static final String GENERATION = "generation";

    static final String CREATED_AT = "created_at";

    static final String UPDATED_AT = "updated_at";

    private static final String STORE_LABEL = "consumer";

    private static final PlacementMetricCounter GENERATION_CONFLICT_COUNT =
            PlacementMetricCounter.builder()
                    .withName("placement_consumer_generation_conflicts_total")
                    .withHelp("Number of consumer updates rejected because the consumer "
                            + "generation moved on.")
                    .build()
                    .register();

    private static final Logger logger = LogManager.getLogger();

    private final GraphStore graphStore;

    private final UserStore userStore;

    private final Clock clock;

    /**
     * Create a new store.
     *
     * @param graphStore The graph the consumers live in.
     * @param userStore The store for the users owning the consumers.
     * @param clock The clock for creation and update times.
     */
    public ConsumerStore(@Nonnull final GraphStore graphStore,
                         @Nonnull final UserStore userStore,
                         @Nonnull final Clock clock) {
        this.graphStore = Objects.requireNonNull(graphStore);
        this.userStore = Objects.requireNonNull(userStore);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Look up a consumer, along with its owning user and project.
     *
     * @param uuid The UUID of the consumer.
     * @return The consumer.
     * @throws ConsumerNotFoundException If there is no such consumer.
     */
    @Nonnull
    public Consumer getByUuid(@Nonnull final String uuid) throws ConsumerNotFoundException {
        try {
            return graphStore.readResult(tx -> getByUuid(tx, uuid));
        } catch (GraphStoreException e) {
            StoreOperations.rethrowIfCause(e, ConsumerNotFoundException.class);
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "get").increment();
            throw e;
        }
    }

    /**
     * Look up a consumer inside an open transaction.
     *
     * @param tx The transaction.
     * @param uuid The UUID of the consumer.
     * @return The consumer.
     * @throws ConsumerNotFoundException If there is no such consumer.
     */
    @Nonnull
    public Consumer getByUuid(@Nonnull final GraphTransaction tx, @Nonnull final String uuid)
            throws ConsumerNotFoundException {
        final GraphNode node = tx.getNode(NodeLabel.CONSUMER, uuid)
                .orElseThrow(() -> new ConsumerNotFoundException(uuid));
        final Optional<String> userUuid = owner(tx, consumerRef(uuid));
        final Optional<String> projectUuid = userUuid.flatMap(
                user -> userStore.getProjectUuid(tx, user));
        return new Consumer(uuid,
                projectUuid.map(Project::new).orElse(null),
                userUuid.map(User::new).orElse(null),
                node.getProperty(GENERATION, Long.class).orElse(0L),
                node.getProperty(CREATED_AT, Long.class).map(Instant::ofEpochMilli).orElse(null),
                node.getProperty(UPDATED_AT, Long.class).map(Instant::ofEpochMilli).orElse(null));
    }

    /**
     * Check whether a consumer exists.
     *
     * @param tx The transaction.
     * @param uuid The UUID of the consumer.
     * @return True if the consumer exists.
     */
    public boolean exists(@Nonnull final GraphTransaction tx, @Nonnull final String uuid) {
        return tx.getNode(NodeLabel.CONSUMER, uuid).isPresent();
    }

    /**
     * Create a consumer. The generation defaults to 0, and the creation and update times to
     * now. Once the transaction commits the consumer carries the values that were stored.
     *
     * <p>Creating a consumer that already exists with the same generation does nothing except
     * load the stored times into the consumer. UUIDs must be unique: a consumer that already
     * exists with another generation is an error.</p>
     *
     * @param consumer The consumer.
     */
    public void create(@Nonnull final Consumer consumer) {
        final Consumer stored;
        try {
            stored = graphStore.transactionResult(tx -> create(tx, consumer));
        } catch (GraphStoreException e) {
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "create").increment();
            throw e;
        }
        consumer.copyStoredState(stored);
    }

    /**
     * Create a consumer inside an open transaction. See {@link #create(Consumer)}. The consumer
     * object is not changed, since the transaction may still roll back.
     *
     * @param tx The transaction.
     * @param consumer The consumer.
     * @return The consumer as stored, with its generation and times.
     */
    @Nonnull
    public Consumer create(@Nonnull final GraphTransaction tx, @Nonnull final Consumer consumer) {
        final long generation = consumer.getGeneration() == null ? 0L : consumer.getGeneration();
        final Optional<GraphNode> existing = tx.getNode(NodeLabel.CONSUMER, consumer.getUuid());
        final long createdAt;
        final long updatedAt;
        if (existing.isPresent()) {
            final long storedGeneration = existing.get().getProperty(GENERATION, Long.class)
                    .orElse(0L);
            if (storedGeneration != generation) {
                throw new GraphStoreException("Consumer " + consumer.getUuid()
                        + " already exists with generation " + storedGeneration);
            }
            createdAt = existing.get().getProperty(CREATED_AT, Long.class).orElse(0L);
            updatedAt = existing.get().getProperty(UPDATED_AT, Long.class).orElse(0L);
        } else {
            final long now = clock.millis();
            createdAt = consumer.getCreatedAt() == null ? now
                    : consumer.getCreatedAt().toEpochMilli();
            updatedAt = consumer.getUpdatedAt() == null ? now
                    : consumer.getUpdatedAt().toEpochMilli();
            tx.mergeNode(NodeLabel.CONSUMER, consumer.getUuid(), ImmutableMap.of(
                    GENERATION, generation,
                    CREATED_AT, createdAt,
                    UPDATED_AT, updatedAt));
            logger.debug("Created consumer {} at generation {}", consumer.getUuid(), generation);
        }
        return new Consumer(consumer.getUuid(), consumer.getProject(), consumer.getUser(),
                generation, Instant.ofEpochMilli(createdAt), Instant.ofEpochMilli(updatedAt));
    }

    /**
     * Change the user owning a consumer, without changing its generation. Since the chain is
     * project -> user -> consumer, only the user -> consumer edge changes. A consumer with no
     * user loses its owner.
     *
     * @param consumer The consumer, carrying the new user and the generation it was read at.
     * @throws ItemNotFoundException If the consumer or the new user doesn't exist.
     * @throws ConcurrentUpdateDetectedException If the stored consumer is at another generation.
     */
    public void update(@Nonnull final Consumer consumer)
            throws ItemNotFoundException, ConcurrentUpdateDetectedException {
        try {
            graphStore.transaction(tx -> update(tx, consumer));
        } catch (GraphStoreException e) {
            StoreOperations.rethrowIfCause(e, ItemNotFoundException.class);
            StoreOperations.rethrowIfCause(e, ConcurrentUpdateDetectedException.class);
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "update").increment();
            throw e;
        }
    }

    /**
     * Change the user owning a consumer inside an open transaction. See
     * {@link #update(Consumer)}.
     *
     * @param tx The transaction.
     * @param consumer The consumer.
     * @throws ItemNotFoundException If the consumer or the new user doesn't exist.
     * @throws ConcurrentUpdateDetectedException If the stored consumer is at another generation.
     */
    public void update(@Nonnull final GraphTransaction tx, @Nonnull final Consumer consumer)
            throws ItemNotFoundException, ConcurrentUpdateDetectedException {
        final GraphNode node = tx.getNode(NodeLabel.CONSUMER, consumer.getUuid())
                .orElseThrow(() -> new ConsumerNotFoundException(consumer.getUuid()));
        final Long storedGeneration = node.getProperty(GENERATION, Long.class).orElse(null);
        if (!Objects.equals(storedGeneration, consumer.getGeneration())) {
            throw conflict(consumer, storedGeneration);
        }
        final User user = consumer.getUser();
        if (user != null) {
            userStore.getByUuid(tx, user.getUuid());
        }
        final NodeRef consumerRef = consumerRef(consumer.getUuid());
        for (GraphEdge owns : tx.getIncoming(EdgeType.OWNS, consumerRef)) {
            tx.deleteEdge(EdgeType.OWNS, owns.getSource(), consumerRef);
        }
        if (user != null) {
            tx.mergeEdge(EdgeType.OWNS, UserStore.userRef(user.getUuid()), consumerRef,
                    ImmutableMap.of());
            logger.debug("Consumer {} is now owned by {}", consumer.getUuid(), user);
        } else {
            logger.debug("Consumer {} no longer has an owner", consumer.getUuid());
        }
    }

    /**
     * Move a consumer to its next generation, if and only if the stored generation is still the
     * one the consumer was read at. On success the consumer carries the new generation.
     *
     * @param consumer The consumer.
     * @throws ConcurrentUpdateDetectedException If another writer changed the consumer since it
     *         was read. The caller must re-read the consumer and retry the whole operation.
     */
    public void incrementGeneration(@Nonnull final Consumer consumer)
            throws ConcurrentUpdateDetectedException {
        final long newGeneration;
        try {
            newGeneration = graphStore.transactionResult(tx -> incrementGeneration(tx, consumer));
        } catch (GraphStoreException e) {
            StoreOperations.rethrowIfCause(e, ConcurrentUpdateDetectedException.class);
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "increment_generation")
                    .increment();
            throw e;
        }
        consumer.setGeneration(newGeneration);
    }

    /**
     * Move a consumer to its next generation inside an open transaction. The consumer object
     * is not changed, since the transaction may still roll back. Callers set the returned
     * generation on it once the transaction commits.
     *
     * @param tx The transaction.
     * @param consumer The consumer.
     * @return The new generation.
     * @throws ConcurrentUpdateDetectedException If another writer changed the consumer since it
     *         was read.
     */
    public long incrementGeneration(@Nonnull final GraphTransaction tx,
                                    @Nonnull final Consumer consumer)
            throws ConcurrentUpdateDetectedException {
        final Long expected = consumer.getGeneration();
        Preconditions.checkArgument(expected != null,
                "Consumer %s has no generation. Create or read it first.", consumer.getUuid());
        final long next = expected + 1;
        if (!tx.compareAndSetProperties(NodeLabel.CONSUMER, consumer.getUuid(), GENERATION,
                expected, ImmutableMap.of(GENERATION, next))) {
            throw conflict(consumer, tx.getNode(NodeLabel.CONSUMER, consumer.getUuid())
                    .flatMap(node -> node.getProperty(GENERATION, Long.class))
                    .orElse(null));
        }
        return next;
    }

    @Nonnull
    private ConcurrentUpdateDetectedException conflict(@Nonnull final Consumer consumer,
                                                       final Long storedGeneration) {
        GENERATION_CONFLICT_COUNT.increment();
        logger.warn("Consumer {} was updated concurrently: expected generation {}, found {}",
                consumer.getUuid(), consumer.getGeneration(), storedGeneration);
        return new ConcurrentUpdateDetectedException("Consumer " + consumer.getUuid()
                + " was updated by another writer. Expected generation "
                + consumer.getGeneration() + " but found " + storedGeneration + ".");
    }

    /**
     * Delete a consumer along with any relationships it still has, allocations included.
     * Deleting a consumer that doesn't exist does nothing.
     *
     * @param consumer The consumer.
     */
    public void delete(@Nonnull final Consumer consumer) {
        try {
            graphStore.transaction(tx -> delete(tx, consumer));
        } catch (GraphStoreException e) {
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "delete").increment();
            throw e;
        }
    }

    /**
     * Delete a consumer inside an open transaction. See {@link #delete(Consumer)}.
     *
     * @param tx The transaction.
     * @param consumer The consumer.
     */
    public void delete(@Nonnull final GraphTransaction tx, @Nonnull final Consumer consumer) {
        final int relationships = tx.relationshipCount(consumerRef(consumer.getUuid()));
        if (tx.detachDeleteNode(NodeLabel.CONSUMER, consumer.getUuid())) {
            logger.debug("Deleted consumer {} and {} relationships", consumer.getUuid(),
                    relationships);
        }
    }

    /**
     * Make sure the ownership chain project -> user -> consumer is in place. Any other project
     * owning the user, and any other user owning the consumer, loses that ownership. Calling
     * this again with the same arguments changes nothing.
     *
     * @param projectUuid The UUID of the project.
     * @param userUuid The UUID of the user.
     * @param consumerUuid The UUID of the consumer.
     * @throws ItemNotFoundException If any of the three doesn't exist.
     */
    public void relateProjectAndUser(@Nonnull final String projectUuid,
                                     @Nonnull final String userUuid,
                                     @Nonnull final String consumerUuid)
            throws ItemNotFoundException {
        try {
            graphStore.transaction(tx -> relateProjectAndUser(tx, projectUuid, userUuid,
                    consumerUuid));
        } catch (GraphStoreException e) {
            StoreOperations.rethrowIfCause(e, ItemNotFoundException.class);
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "relate").increment();
            throw e;
        }
    }

    /**
     * Make sure the ownership chain is in place inside an open transaction. See
     * {@link #relateProjectAndUser(String, String, String)}.
     *
     * @param tx The transaction.
     * @param projectUuid The UUID of the project.
     * @param userUuid The UUID of the user.
     * @param consumerUuid The UUID of the consumer.
     * @throws ItemNotFoundException If any of the three doesn't exist.
     */
    public void relateProjectAndUser(@Nonnull final GraphTransaction tx,
                                     @Nonnull final String projectUuid,
                                     @Nonnull final String userUuid,
                                     @Nonnull final String consumerUuid)
            throws ItemNotFoundException {
        final NodeRef projectRef = NodeRef.of(NodeLabel.PROJECT, projectUuid);
        final NodeRef userRef = UserStore.userRef(userUuid);
        final NodeRef consumerRef = consumerRef(consumerUuid);
        final List<String> userOwners = owners(tx, userRef);
        final List<String> consumerOwners = owners(tx, consumerRef);
        if (userOwners.equals(Collections.singletonList(projectUuid))
                && consumerOwners.equals(Collections.singletonList(userUuid))) {
            return;
        }
        if (!tx.getNode(NodeLabel.PROJECT, projectUuid).isPresent()) {
            throw new ProjectNotFoundException(projectUuid);
        }
        userStore.getByUuid(tx, userUuid);
        if (!exists(tx, consumerUuid)) {
            throw new ConsumerNotFoundException(consumerUuid);
        }

        for (String owner : userOwners) {
            if (!owner.equals(projectUuid)) {
                tx.deleteEdge(EdgeType.OWNS, NodeRef.of(NodeLabel.PROJECT, owner), userRef);
                logger.debug("User {} is no longer owned by project {}", userUuid, owner);
            }
        }
        for (String owner : consumerOwners) {
            if (!owner.equals(userUuid)) {
                tx.deleteEdge(EdgeType.OWNS, UserStore.userRef(owner), consumerRef);
                logger.debug("Consumer {} is no longer owned by user {}", consumerUuid, owner);
            }
        }
        tx.mergeEdge(EdgeType.OWNS, projectRef, userRef, ImmutableMap.of());
        tx.mergeEdge(EdgeType.OWNS, userRef, consumerRef, ImmutableMap.of());
        logger.debug("Related project {} -> user {} -> consumer {}", projectUuid, userUuid,
                consumerUuid);
    }

    /**
     * Complete the ownership chain of every consumer that lacks part of it. A consumer with no
     * owning user is given to the "incomplete" user, which belongs to the "incomplete" project.
     * A consumer whose user belongs to no project keeps its user, and the user is given to the
     * "incomplete" project. Consumers with a full chain are left alone, so running this again
     * changes nothing.
     *
     * @param batchSize The most consumers to complete in this call.
     * @return How many incomplete consumers were found and completed.
     */
    @Nonnull
    public MigrationResult createIncompleteConsumers(final int batchSize) {
        Preconditions.checkArgument(batchSize > 0, "Batch size must be positive: %s", batchSize);
        final MigrationResult result;
        try {
            result = graphStore.transactionResult(tx -> {
                final NodeRef incompleteUser =
                        UserStore.userRef(userStore.ensureIncompleteUser(tx));
                final NodeRef incompleteProject = NodeRef.of(NodeLabel.PROJECT,
                        userStore.getIncompleteProject().getUuid());
                int found = 0;
                for (GraphNode consumer : tx.getNodes(NodeLabel.CONSUMER)) {
                    if (found == batchSize) {
                        break;
                    }
                    final Optional<String> user = owner(tx, consumer.getRef());
                    if (!user.isPresent()) {
                        tx.mergeEdge(EdgeType.OWNS, incompleteUser, consumer.getRef(),
                                ImmutableMap.of());
                        found++;
                    } else if (!userStore.getProjectUuid(tx, user.get()).isPresent()) {
                        tx.mergeEdge(EdgeType.OWNS, incompleteProject,
                                UserStore.userRef(user.get()), ImmutableMap.of());
                        logger.debug("User {} of consumer {} had no project", user.get(),
                                consumer.getUuid());
                        found++;
                    }
                }
                return new MigrationResult(found, found);
            });
        } catch (GraphStoreException e) {
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "create_incomplete")
                    .increment();
            throw e;
        }
        if (result.getDone() > 0) {
            logger.info("Completed the ownership of {} consumers with the incomplete user {}",
                    result.getDone(), userStore.getIncompleteUser().getUuid());
        }
        return result;
    }

    /**
     * Delete each of the given consumers that has no allocations. Consumers with allocations,
     * and consumers that don't exist, are left alone. The check and the delete happen in one
     * transaction, so an allocation made concurrently is never orphaned.
     *
     * @param consumerUuids The UUIDs of the consumers to check.
     * @return The UUIDs of the consumers that were deleted.
     */
    @Nonnull
    public Set<String> deleteConsumersIfNoAllocations(
            @Nonnull final Collection<String> consumerUuids) {
        try {
            return graphStore.transactionResult(tx ->
                    deleteConsumersIfNoAllocations(tx, consumerUuids));
        } catch (GraphStoreException e) {
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "delete_if_unused").increment();
            throw e;
        }
    }

    /**
     * Delete each of the given consumers that has no allocations, inside an open transaction.
     *
     * @param tx The transaction.
     * @param consumerUuids The UUIDs of the consumers to check.
     * @return The UUIDs of the consumers that were deleted.
     */
    @Nonnull
    public Set<String> deleteConsumersIfNoAllocations(
            @Nonnull final GraphTransaction tx,
            @Nonnull final Collection<String> consumerUuids) {
        final Set<String> deleted = new LinkedHashSet<>();
        for (String uuid : consumerUuids) {
            if (exists(tx, uuid) && tx.relationshipCount(consumerRef(uuid), EdgeType.USES) == 0) {
                tx.detachDeleteNode(NodeLabel.CONSUMER, uuid);
                deleted.add(uuid);
            }
        }
        if (!deleted.isEmpty()) {
            logger.info("Deleted {} consumers with no allocations: {}", deleted.size(), deleted);
        }
        return deleted;
    }

    /**
     * Refer to a consumer node.
     *
     * @param uuid The UUID of the consumer.
     * @return The reference.
     */
    @Nonnull
    public static NodeRef consumerRef(@Nonnull final String uuid) {
        return NodeRef.of(NodeLabel.CONSUMER, uuid);
    }

    @Nonnull
    private static List<String> owners(@Nonnull final GraphTransaction tx,
                                       @Nonnull final NodeRef owned) {
        return tx.getIncoming(EdgeType.OWNS, owned).stream()
                .map(GraphEdge::getSourceUuid)
                .collect(Collectors.toList());
    }

    @Nonnull
    private static Optional<String> owner(@Nonnull final GraphTransaction tx,
                                          @Nonnull final NodeRef owned) {
        return owners(tx, owned).stream().findFirst();
    }
}
