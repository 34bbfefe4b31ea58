package com.vmturbo.placement.resolver;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import javax.annotation.Nonnull;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmturbo.placement.candidates.ProviderRef;
import com.vmturbo.placement.candidates.RpCandidateList;
import com.vmturbo.placement.common.ItemNotFoundException.ResourceProviderNotFoundException;
import com.vmturbo.placement.common.StoreOperations;
import com.vmturbo.placement.graph.GraphStore;
import com.vmturbo.placement.graph.GraphStoreException;
import com.vmturbo.placement.graph.GraphTransaction;
import com.vmturbo.placement.provider.ResourceProviderStore;

/**
 * Finds the providers that could together satisfy an {@link AllocationCandidateRequest}.
 *
 * <p>Each resource class is looked up separately, and the per-class candidates are then
 * joined so that only trees able to supply every class survive. The request's provider
 * constraints are applied last. Everything is read from one consistent view of the store.</p>
 */
public class AllocationCandidateResolver {

    private static final Logger logger = LogManager.getLogger();

    private final GraphStore graphStore;

    private final ResourceProviderStore resourceProviderStore;

    /**
     * Create a new resolver.
     *
     * @param graphStore The graph to read.
     * @param resourceProviderStore The store for providers and their inventory.
     */
    public AllocationCandidateResolver(@Nonnull final GraphStore graphStore,
                                       @Nonnull final ResourceProviderStore resourceProviderStore) {
        this.graphStore = Objects.requireNonNull(graphStore);
        this.resourceProviderStore = Objects.requireNonNull(resourceProviderStore);
    }

    /**
     * Resolve a request into candidates.
     *
     * @param request The request.
     * @return The candidates. Empty if the request asks for nothing, or if no single tree can
     *         supply every resource class within the constraints.
     * @throws ResourceProviderNotFoundException If the request is limited to the tree of a
     *         provider that doesn't exist.
     */
    @Nonnull
    public RpCandidateList resolve(@Nonnull final AllocationCandidateRequest request)
            throws ResourceProviderNotFoundException {
        try {
            return graphStore.readResult(tx -> resolve(tx, request));
        } catch (GraphStoreException e) {
            StoreOperations.rethrowIfCause(e, ResourceProviderNotFoundException.class);
            StoreOperations.STORE_ERROR_COUNT.labels("resolver", "resolve").increment();
            throw e;
        }
    }

    @Nonnull
    private RpCandidateList resolve(@Nonnull final GraphTransaction tx,
                                    @Nonnull final AllocationCandidateRequest request)
            throws ResourceProviderNotFoundException {
        final RpCandidateList result = new RpCandidateList();
        for (Map.Entry<String, Long> resource : request.getResources().entrySet()) {
            final Set<ProviderRef> providers = resourceProviderStore.getProvidersWithCapacity(
                    tx, resource.getKey(), resource.getValue());
            if (providers.isEmpty()) {
                logger.debug("No provider has {} {} free", resource.getValue(),
                        resource.getKey());
                return new RpCandidateList();
            }
            final RpCandidateList forClass = new RpCandidateList();
            forClass.addRps(providers, resource.getKey());
            result.mergeCommonTrees(forClass);
            // An empty result would adopt the next class's candidates wholesale.
            if (result.isEmpty()) {
                logger.debug("No tree can supply everything in {}", request);
                return result;
            }
        }

        if (request.getInTree().isPresent()) {
            result.filterByTree(Collections.singleton(
                    resourceProviderStore.getRootUuid(tx, request.getInTree().get())));
        }
        if (!request.getRequiredProviders().isEmpty()) {
            result.filterByRpOrTree(request.getRequiredProviders());
        }
        if (!request.getExcludedProviders().isEmpty()) {
            result.filterByRpNorTree(request.getExcludedProviders());
        }
        logger.debug("Resolved {} into {}", request, result);
        return result;
    }
}
