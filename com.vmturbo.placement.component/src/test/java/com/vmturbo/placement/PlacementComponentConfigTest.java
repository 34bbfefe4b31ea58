package com.vmturbo.placement;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import java.util.Collections;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.annotation.DirtiesContext.ClassMode;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit4.SpringJUnit4ClassRunner;

import com.vmturbo.placement.allocation.Allocation;
import com.vmturbo.placement.allocation.AllocationStore;
import com.vmturbo.placement.consumer.Consumer;
import com.vmturbo.placement.consumer.ConsumerStore;
import com.vmturbo.placement.graph.EdgeType;
import com.vmturbo.placement.graph.GraphStore;
import com.vmturbo.placement.ownership.UserStore;
import com.vmturbo.placement.provider.Inventory;
import com.vmturbo.placement.provider.ResourceProvider;
import com.vmturbo.placement.provider.ResourceProviderStore;
import com.vmturbo.placement.resolver.AllocationCandidateRequest;
import com.vmturbo.placement.resolver.AllocationCandidateResolver;

/**
 * Checks the Spring wiring of {@link PlacementComponentConfig}, and that the wired stores work
 * together on one graph.
 */
@RunWith(SpringJUnit4ClassRunner.class)
@ContextConfiguration(classes = {PlacementComponentConfig.class})
@DirtiesContext(classMode = ClassMode.AFTER_EACH_TEST_METHOD)
@TestPropertySource(properties = {"incompleteConsumerProjectId=orphans-project",
        "incompleteConsumerUserId=orphans-user"})
public class PlacementComponentConfigTest {

    @Autowired
    private GraphStore graphStore;

    @Autowired
    private UserStore userStore;

    @Autowired
    private ConsumerStore consumerStore;

    @Autowired
    private ResourceProviderStore resourceProviderStore;

    @Autowired
    private AllocationStore allocationStore;

    @Autowired
    private AllocationCandidateResolver resolver;

    @Autowired
    private PlacementComponentConfig config;

    /**
     * The incomplete owner comes from the properties.
     */
    @Test
    public void testIncompleteOwnerProperties() {
        assertEquals("orphans-project", userStore.getIncompleteProject().getUuid());
        assertEquals("orphans-user", userStore.getIncompleteUser().getUuid());
        assertSame(userStore, config.userStore());
    }

    /**
     * A provider, an allocation from it and a candidate search, all through the wired beans.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testWiredStores() throws Exception {
        final ResourceProvider host = new ResourceProvider("host", "host", null);
        resourceProviderStore.create(host);
        resourceProviderStore.addInventory(host, Inventory.newBuilder("VCPU", 4).build());

        allocationStore.replaceAll(Collections.singletonList(
                new Allocation("host", "VCPU", new Consumer("vm", null, null), 1)));

        assertEquals("orphans-user", consumerStore.getByUuid("vm").getUser().getUuid());
        assertThat(resolver.resolve(AllocationCandidateRequest.newBuilder()
                .addResource("VCPU", 3)
                .build()).getRps(), containsInAnyOrder("host"));
        assertEquals(Integer.valueOf(1), graphStore.readResult(tx ->
                tx.getOutgoing(EdgeType.USES, ConsumerStore.consumerRef("vm")).size()));
    }
}
