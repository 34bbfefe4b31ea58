package com.vmturbo.placement.consumer;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import com.vmturbo.placement.PlacementTestFixtures;
import com.vmturbo.placement.common.ConcurrentUpdateDetectedException;
import com.vmturbo.placement.common.ItemNotFoundException.ConsumerNotFoundException;
import com.vmturbo.placement.common.ItemNotFoundException.ProjectNotFoundException;
import com.vmturbo.placement.common.ItemNotFoundException.UserNotFoundException;
import com.vmturbo.placement.graph.EdgeType;
import com.vmturbo.placement.graph.GraphEdge;
import com.vmturbo.placement.graph.NodeLabel;
import com.vmturbo.placement.graph.NodeRef;
import com.vmturbo.placement.ownership.Project;
import com.vmturbo.placement.ownership.User;
import com.vmturbo.placement.ownership.UserStore;
import com.vmturbo.placement.provider.ResourceProvider;

/**
 * Unit tests for {@link ConsumerStore}.
 */
public class ConsumerStoreTest {

    private static final String CONSUMER = "consumer";

    /**
     * Expected exceptions to test against.
     */
    @Rule
    public ExpectedException thrown = ExpectedException.none();

    private PlacementTestFixtures fixtures;

    private ConsumerStore consumerStore;

    private ExecutorService executor;

    /**
     * Common setup.
     */
    @Before
    public void setup() {
        fixtures = new PlacementTestFixtures();
        consumerStore = fixtures.consumerStore;
        executor = Executors.newFixedThreadPool(4);
    }

    /**
     * Cleanup.
     */
    @After
    public void teardown() {
        executor.shutdownNow();
    }

    /**
     * A new consumer starts at generation 0, stamped with the store clock.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testCreateDefaults() throws Exception {
        final Consumer consumer = new Consumer(CONSUMER, null, null);
        consumerStore.create(consumer);

        assertEquals(Long.valueOf(0L), consumer.getGeneration());
        assertEquals(PlacementTestFixtures.NOW, consumer.getCreatedAt());
        assertEquals(PlacementTestFixtures.NOW, consumer.getUpdatedAt());

        final Consumer stored = consumerStore.getByUuid(CONSUMER);
        assertEquals(Long.valueOf(0L), stored.getGeneration());
        assertEquals(PlacementTestFixtures.NOW, stored.getCreatedAt());
        assertNull(stored.getUser());
        assertNull(stored.getProject());
    }

    /**
     * Times given on the consumer are kept.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testCreateKeepsGivenTimes() throws Exception {
        final Instant created = Instant.parse("2025-06-01T12:00:00Z");
        consumerStore.create(new Consumer(CONSUMER, null, null, 3L, created, created));

        final Consumer stored = consumerStore.getByUuid(CONSUMER);
        assertEquals(Long.valueOf(3L), stored.getGeneration());
        assertEquals(created, stored.getCreatedAt());
    }

    /**
     * Creating the same consumer twice leaves one consumer.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testCreateTwice() throws Exception {
        consumerStore.create(new Consumer(CONSUMER, null, null));
        consumerStore.create(new Consumer(CONSUMER, null, null));
        assertEquals(1, fixtures.graphStore.readResult(tx ->
                tx.getNodes(NodeLabel.CONSUMER).size()).intValue());
    }

    /**
     * Creating inside a transaction hands back the stored values and leaves the consumer
     * alone, so a rollback can't leave it looking stored.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testCreateInTransactionDoesNotChangeConsumer() throws Exception {
        final Consumer consumer = new Consumer(CONSUMER, null, null);
        try {
            fixtures.graphStore.transaction(tx -> {
                final Consumer stored = consumerStore.create(tx, consumer);
                assertEquals(Long.valueOf(0L), stored.getGeneration());
                assertEquals(PlacementTestFixtures.NOW, stored.getCreatedAt());
                throw new IllegalStateException("abort");
            });
            fail("Expected the transaction to fail");
        } catch (IllegalStateException e) {
            assertEquals("abort", e.getMessage());
        }

        assertNull(consumer.getGeneration());
        assertNull(consumer.getCreatedAt());
        assertNull(consumer.getUpdatedAt());
        assertFalse(fixtures.graphStore.readResult(tx -> consumerStore.exists(tx, CONSUMER)));
    }

    /**
     * Looking up a missing consumer fails.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testGetByUuidNotFound() throws Exception {
        thrown.expect(ConsumerNotFoundException.class);
        consumerStore.getByUuid("missing");
    }

    /**
     * The project and user of a consumer come from the ownership chain.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testGetByUuidResolvesOwners() throws Exception {
        fixtures.ensureConsumer(CONSUMER);

        final Consumer stored = consumerStore.getByUuid(CONSUMER);
        assertEquals(fixtures.user, stored.getUser());
        assertEquals(fixtures.project, stored.getProject());
    }

    /**
     * Incrementing moves the generation on by one, in the store and on the consumer.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testIncrementGeneration() throws Exception {
        final Consumer consumer = fixtures.ensureConsumer(CONSUMER);
        consumerStore.incrementGeneration(consumer);

        assertEquals(Long.valueOf(1L), consumer.getGeneration());
        assertEquals(Long.valueOf(1L), consumerStore.getByUuid(CONSUMER).getGeneration());
    }

    /**
     * A consumer read before another writer's increment can't be incremented, and the stored
     * generation is left alone.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testIncrementGenerationStale() throws Exception {
        fixtures.ensureConsumer(CONSUMER);
        final Consumer first = consumerStore.getByUuid(CONSUMER);
        final Consumer second = consumerStore.getByUuid(CONSUMER);
        consumerStore.incrementGeneration(first);

        try {
            consumerStore.incrementGeneration(second);
            fail("Stale consumer was incremented");
        } catch (ConcurrentUpdateDetectedException e) {
            assertEquals(Long.valueOf(0L), second.getGeneration());
        }
        assertEquals(Long.valueOf(1L), consumerStore.getByUuid(CONSUMER).getGeneration());
    }

    /**
     * Of several writers incrementing from the same generation at the same time, exactly one
     * succeeds.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testConcurrentIncrementOneWins() throws Exception {
        fixtures.ensureConsumer(CONSUMER);
        final int writers = 4;
        final CountDownLatch start = new CountDownLatch(1);
        final List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < writers; i++) {
            final Consumer copy = consumerStore.getByUuid(CONSUMER);
            final Callable<Boolean> increment = () -> {
                start.await();
                try {
                    consumerStore.incrementGeneration(copy);
                    return true;
                } catch (ConcurrentUpdateDetectedException e) {
                    return false;
                }
            };
            results.add(executor.submit(increment));
        }
        start.countDown();

        int winners = 0;
        for (Future<Boolean> result : results) {
            if (result.get()) {
                winners++;
            }
        }
        assertEquals(1, winners);
        assertEquals(Long.valueOf(1L), consumerStore.getByUuid(CONSUMER).getGeneration());
    }

    /**
     * Updating a consumer with a new user swaps its owner.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testUpdateSwapsUser() throws Exception {
        final Consumer consumer = fixtures.ensureConsumer(CONSUMER);
        final User other = new User("other-user");
        fixtures.userStore.create(other);

        consumer.setUser(other);
        consumerStore.update(consumer);

        assertEquals(other, consumerStore.getByUuid(CONSUMER).getUser());
        assertThat(consumerOwners(CONSUMER), contains("other-user"));
        assertEquals(Long.valueOf(0L), consumerStore.getByUuid(CONSUMER).getGeneration());
    }

    /**
     * Updating a consumer with no user drops its owner.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testUpdateDropsUser() throws Exception {
        final Consumer consumer = fixtures.ensureConsumer(CONSUMER);
        consumer.setUser(null);
        consumerStore.update(consumer);

        assertThat(consumerOwners(CONSUMER), is(empty()));
    }

    /**
     * An update from a stale read is refused.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testUpdateStale() throws Exception {
        final Consumer consumer = fixtures.ensureConsumer(CONSUMER);
        final Consumer stale = consumerStore.getByUuid(CONSUMER);
        consumerStore.incrementGeneration(consumer);

        stale.setUser(null);
        thrown.expect(ConcurrentUpdateDetectedException.class);
        consumerStore.update(stale);
    }

    /**
     * An update naming a user that doesn't exist is refused and changes nothing.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testUpdateUnknownUser() throws Exception {
        final Consumer consumer = fixtures.ensureConsumer(CONSUMER);
        consumer.setUser(new User("nobody"));
        try {
            consumerStore.update(consumer);
            fail("Update to an unknown user succeeded");
        } catch (UserNotFoundException e) {
            assertThat(consumerOwners(CONSUMER), contains(fixtures.user.getUuid()));
        }
    }

    /**
     * Relating the same chain twice leaves one edge at each link.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testRelateTwice() throws Exception {
        consumerStore.create(new Consumer(CONSUMER, null, null));
        final String project = fixtures.project.getUuid();
        final String user = fixtures.user.getUuid();
        consumerStore.relateProjectAndUser(project, user, CONSUMER);
        consumerStore.relateProjectAndUser(project, user, CONSUMER);

        assertThat(consumerOwners(CONSUMER), contains(user));
        assertThat(userOwners(user), contains(project));
    }

    /**
     * Relating to a different user and project replaces the old owners.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testRelateReplacesOwners() throws Exception {
        fixtures.ensureConsumer(CONSUMER);
        fixtures.projectStore.create(new Project("other-project"));
        fixtures.userStore.create(new User("other-user"));

        consumerStore.relateProjectAndUser("other-project", "other-user", CONSUMER);

        assertThat(consumerOwners(CONSUMER), contains("other-user"));
        assertThat(userOwners("other-user"), contains("other-project"));
        final Consumer stored = consumerStore.getByUuid(CONSUMER);
        assertEquals(new Project("other-project"), stored.getProject());
    }

    /**
     * Relating to a missing project fails without changing anything.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testRelateMissingProject() throws Exception {
        fixtures.ensureConsumer(CONSUMER);
        try {
            consumerStore.relateProjectAndUser("nowhere", fixtures.user.getUuid(), CONSUMER);
            fail("Related to a missing project");
        } catch (ProjectNotFoundException e) {
            assertThat(userOwners(fixtures.user.getUuid()), contains(fixtures.project.getUuid()));
        }
    }

    /**
     * Ownerless consumers are attached to the incomplete user in batches, and a consumer is
     * only attached once.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testCreateIncompleteConsumers() throws Exception {
        for (String uuid : Arrays.asList("a", "b", "c")) {
            consumerStore.create(new Consumer(uuid, null, null));
        }
        fixtures.ensureConsumer("owned");

        final MigrationResult first = consumerStore.createIncompleteConsumers(2);
        assertEquals(2, first.getFound());
        assertEquals(2, first.getDone());
        final MigrationResult second = consumerStore.createIncompleteConsumers(2);
        assertEquals(1, second.getDone());
        final MigrationResult third = consumerStore.createIncompleteConsumers(2);
        assertEquals(0, third.getFound());

        for (String uuid : Arrays.asList("a", "b", "c")) {
            assertThat(consumerOwners(uuid), contains(PlacementTestFixtures.INCOMPLETE_USER));
            assertEquals(new Project(PlacementTestFixtures.INCOMPLETE_PROJECT),
                    consumerStore.getByUuid(uuid).getProject());
        }
        assertThat(consumerOwners("owned"), contains(fixtures.user.getUuid()));
    }

    /**
     * A consumer whose user belongs to no project is incomplete too. Its user joins the
     * incomplete project and keeps the consumer.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testCreateIncompleteConsumersCompletesUserWithoutProject() throws Exception {
        fixtures.userStore.create(new User("drifter"));
        final Consumer consumer = new Consumer(CONSUMER, null, null);
        consumerStore.create(consumer);
        consumer.setUser(new User("drifter"));
        consumerStore.update(consumer);
        assertNull(consumerStore.getByUuid(CONSUMER).getProject());

        assertEquals(1, consumerStore.createIncompleteConsumers(10).getDone());
        assertEquals(0, consumerStore.createIncompleteConsumers(10).getFound());

        final Consumer stored = consumerStore.getByUuid(CONSUMER);
        assertEquals(new User("drifter"), stored.getUser());
        assertEquals(new Project(PlacementTestFixtures.INCOMPLETE_PROJECT), stored.getProject());
    }

    /**
     * The incomplete project and user may share a UUID.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testCreateIncompleteConsumersWithSharedUuid() throws Exception {
        final String zero = "00000000-0000-0000-0000-000000000000";
        final ConsumerStore sharedStore = new PlacementTestFixtures(zero, zero).consumerStore;
        sharedStore.create(new Consumer(CONSUMER, null, null));

        assertEquals(1, sharedStore.createIncompleteConsumers(10).getDone());

        final Consumer stored = sharedStore.getByUuid(CONSUMER);
        assertEquals(new User(zero), stored.getUser());
        assertEquals(new Project(zero), stored.getProject());
    }

    /**
     * Only consumers without allocations are deleted.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testDeleteConsumersIfNoAllocations() throws Exception {
        final ResourceProvider provider = fixtures.createProvider("host", null);
        fixtures.addInventory(provider, "VCPU", 8);
        final Consumer busy = fixtures.ensureConsumer("busy");
        fixtures.allocate(provider, "VCPU", 2, busy);
        fixtures.ensureConsumer("idle");

        final Set<String> deleted = consumerStore.deleteConsumersIfNoAllocations(
                Arrays.asList("busy", "idle", "missing"));

        assertThat(deleted, contains("idle"));
        assertEquals(Long.valueOf(1L), consumerStore.getByUuid("busy").getGeneration());
        thrown.expect(ConsumerNotFoundException.class);
        consumerStore.getByUuid("idle");
    }

    /**
     * Deleting a consumer removes its allocations along with it.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testDeleteRemovesAllocations() throws Exception {
        final ResourceProvider provider = fixtures.createProvider("host", null);
        fixtures.addInventory(provider, "VCPU", 8);
        final Consumer consumer = fixtures.ensureConsumer(CONSUMER);
        fixtures.allocate(provider, "VCPU", 2, consumer);

        consumerStore.delete(consumer);

        assertEquals(0, fixtures.allocationStore.getUsage("host", "VCPU"));
        assertFalse(fixtures.graphStore.readResult(tx -> consumerStore.exists(tx, CONSUMER)));
        assertTrue(fixtures.graphStore.edges().stream()
                .noneMatch(edge -> edge.getSourceUuid().equals(CONSUMER)
                        || edge.getTargetUuid().equals(CONSUMER)));
    }

    private List<String> consumerOwners(final String uuid) {
        return owners(ConsumerStore.consumerRef(uuid));
    }

    private List<String> userOwners(final String uuid) {
        return owners(UserStore.userRef(uuid));
    }

    private List<String> owners(final NodeRef owned) {
        return fixtures.graphStore.readResult(tx -> tx.getIncoming(EdgeType.OWNS, owned)).stream()
                .map(GraphEdge::getSourceUuid)
                .collect(Collectors.toList());
    }
}
