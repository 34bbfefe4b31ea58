package com.vmturbo.placement.resolver;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.Assert.assertTrue;

import java.util.Collections;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import com.vmturbo.placement.PlacementTestFixtures;
import com.vmturbo.placement.candidates.RpCandidate;
import com.vmturbo.placement.candidates.RpCandidateList;
import com.vmturbo.placement.common.ItemNotFoundException.ResourceProviderNotFoundException;
import com.vmturbo.placement.provider.ResourceProvider;

/**
 * Unit tests for {@link AllocationCandidateResolver}.
 *
 * <p>Two compute trees: cn1 has CPU and memory itself, cn2 has CPU and its NUMA child has the
 * memory. A separate storage provider has only disk.</p>
 */
public class AllocationCandidateResolverTest {

    /**
     * Expected exceptions to test against.
     */
    @Rule
    public ExpectedException thrown = ExpectedException.none();

    private PlacementTestFixtures fixtures;

    private AllocationCandidateResolver resolver;

    /**
     * Common setup.
     *
     * @throws Exception on exception.
     */
    @Before
    public void setup() throws Exception {
        fixtures = new PlacementTestFixtures();
        resolver = fixtures.resolver;

        final ResourceProvider cn1 = fixtures.createProvider("cn1", null);
        fixtures.addInventory(cn1, "VCPU", 8);
        fixtures.addInventory(cn1, "MEMORY_MB", 1024);

        final ResourceProvider cn2 = fixtures.createProvider("cn2", null);
        fixtures.addInventory(cn2, "VCPU", 8);
        final ResourceProvider numa = fixtures.createProvider("cn2-numa", cn2);
        fixtures.addInventory(numa, "MEMORY_MB", 4096);

        final ResourceProvider storage = fixtures.createProvider("ss", null);
        fixtures.addInventory(storage, "DISK_GB", 100);
    }

    /**
     * Every tree that can supply every class is a candidate, with each provider that
     * contributes.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testBothTrees() throws Exception {
        final RpCandidateList result = resolver.resolve(request().build());

        assertThat(result.getRpsInfo(), containsInAnyOrder(
                new RpCandidate("cn1", "cn1", "VCPU"),
                new RpCandidate("cn1", "cn1", "MEMORY_MB"),
                new RpCandidate("cn2", "cn2", "VCPU"),
                new RpCandidate("cn2-numa", "cn2", "MEMORY_MB")));
        assertThat(result.getTrees(), containsInAnyOrder("cn1", "cn2"));
    }

    /**
     * A tree that can't supply one of the classes drops out entirely.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testCapacityNarrowsTrees() throws Exception {
        final RpCandidateList result = resolver.resolve(AllocationCandidateRequest.newBuilder()
                .addResource("VCPU", 2)
                .addResource("MEMORY_MB", 2048)
                .build());

        assertThat(result.getTrees(), containsInAnyOrder("cn2"));
        assertThat(result.getRps(), containsInAnyOrder("cn2", "cn2-numa"));
    }

    /**
     * No tree has all three classes.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testNoCommonTree() throws Exception {
        assertTrue(resolver.resolve(request().addResource("DISK_GB", 10).build()).isEmpty());
    }

    /**
     * A class nobody has empties the result, whatever came before it.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testUnknownClass() throws Exception {
        assertTrue(resolver.resolve(request().addResource("GPU", 1).build()).isEmpty());
    }

    /**
     * Asking for nothing finds nothing.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testEmptyRequest() throws Exception {
        assertTrue(resolver.resolve(AllocationCandidateRequest.newBuilder().build()).isEmpty());
    }

    /**
     * Limiting to the tree of any provider in it keeps only that tree.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testInTree() throws Exception {
        final RpCandidateList result = resolver.resolve(request().setInTree("cn2-numa").build());
        assertThat(result.getTrees(), containsInAnyOrder("cn2"));
    }

    /**
     * Limiting to the tree of an unknown provider fails.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testInTreeUnknown() throws Exception {
        thrown.expect(ResourceProviderNotFoundException.class);
        resolver.resolve(request().setInTree("ghost").build());
    }

    /**
     * Required providers keep candidates that are the provider or in its tree.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testRequiredProviders() throws Exception {
        final RpCandidateList result = resolver.resolve(request()
                .addRequiredProviders(Collections.singleton("cn1"))
                .build());
        assertThat(result.getRps(), containsInAnyOrder("cn1"));
    }

    /**
     * Excluding a provider removes it, and the tree below it when it is a root.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testExcludedProviders() throws Exception {
        final RpCandidateList numaExcluded = resolver.resolve(request()
                .addExcludedProviders(Collections.singleton("cn2-numa"))
                .build());
        assertThat(numaExcluded.getRps(), containsInAnyOrder("cn1", "cn2"));

        final RpCandidateList rootExcluded = resolver.resolve(request()
                .addExcludedProviders(Collections.singleton("cn2"))
                .build());
        assertThat(rootExcluded.getTrees(), containsInAnyOrder("cn1"));
    }

    /**
     * Capacity already allocated is taken into account.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testUsedCapacity() throws Exception {
        fixtures.allocate(fixtures.providerStore.getByUuid("cn1"), "VCPU", 7,
                fixtures.ensureConsumer("vm"));

        assertThat(resolver.resolve(request().build()).getTrees(), containsInAnyOrder("cn2"));
    }

    private static AllocationCandidateRequest.Builder request() {
        return AllocationCandidateRequest.newBuilder()
                .addResource("VCPU", 2)
                .addResource("MEMORY_MB", 512);
    }
}
