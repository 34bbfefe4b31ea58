package com.vmturbo.placement.graph;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the {@link GraphStore} used by the placement component.
 */
@Configuration
public class GraphStoreConfig {

    @Bean
    public GraphStore graphStore() {
        return new InMemoryGraphStore();
    }
}
