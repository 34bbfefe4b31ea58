package com.vmturbo.placement.common;

import javax.annotation.Nonnull;

import com.vmturbo.placement.graph.GraphStoreException;

/**
 * Helpers shared by the placement stores for the errors that come out of graph transactions.
 */
public class StoreOperations {

    /**
     * Errors encountered by the placement stores, by store and operation.
     */
    public static final PlacementMetricCounter STORE_ERROR_COUNT =
            PlacementMetricCounter.builder()
                    .withName("placement_store_error_count")
                    .withHelp("Number of errors encountered in operating the placement stores.")
                    .withLabelNames("store", "operation")
                    .build()
                    .register();

    private StoreOperations() {}

    /**
     * Rethrow the checked exception carried by a {@link GraphStoreException}, if it is of the
     * given type.
     *
     * @param e The exception thrown by the graph store.
     * @param type The checked exception type to look for.
     * @param <X> The checked exception type to look for.
     * @throws X If the graph store exception was caused by one.
     */
    public static <X extends Exception> void rethrowIfCause(@Nonnull final GraphStoreException e,
                                                            @Nonnull final Class<X> type)
            throws X {
        final X cause = e.getCause(type);
        if (cause != null) {
            throw cause;
        }
    }
}
