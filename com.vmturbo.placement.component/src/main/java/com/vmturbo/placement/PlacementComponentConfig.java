package com.vmturbo.placement;

import java.time.Clock;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import com.vmturbo.placement.allocation.AllocationStore;
import com.vmturbo.placement.consumer.ConsumerStore;
import com.vmturbo.placement.graph.GraphStoreConfig;
import com.vmturbo.placement.ownership.ProjectStore;
import com.vmturbo.placement.ownership.UserStore;
import com.vmturbo.placement.provider.ResourceProviderStore;
import com.vmturbo.placement.resolver.AllocationCandidateResolver;

/**
 * Wires the placement stores and the candidate resolver on top of the graph store.
 */
@Configuration
@Import({GraphStoreConfig.class})
public class PlacementComponentConfig {

    @Autowired
    private GraphStoreConfig graphStoreConfig;

    /**
     * The project owning the user that owns consumers created without an owner.
     */
    @Value("${incompleteConsumerProjectId:00000000-0000-0000-0000-000000000000}")
    private String incompleteConsumerProjectId;

    /**
     * The user owning consumers created without an owner.
     */
    @Value("${incompleteConsumerUserId:00000000-0000-0000-0000-000000000000}")
    private String incompleteConsumerUserId;

    @Bean
    public Clock placementClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProjectStore projectStore() {
        return new ProjectStore(graphStoreConfig.graphStore());
    }

    @Bean
    public UserStore userStore() {
        return new UserStore(graphStoreConfig.graphStore(), incompleteConsumerProjectId,
                incompleteConsumerUserId);
    }

    @Bean
    public ConsumerStore consumerStore() {
        return new ConsumerStore(graphStoreConfig.graphStore(), userStore(), placementClock());
    }

    @Bean
    public ResourceProviderStore resourceProviderStore() {
        return new ResourceProviderStore(graphStoreConfig.graphStore());
    }

    @Bean
    public AllocationStore allocationStore() {
        return new AllocationStore(graphStoreConfig.graphStore(), consumerStore(), userStore(),
                resourceProviderStore());
    }

    @Bean
    public AllocationCandidateResolver allocationCandidateResolver() {
        return new AllocationCandidateResolver(graphStoreConfig.graphStore(),
                resourceProviderStore());
    }
}
