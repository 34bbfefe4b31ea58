package com.vmturbo.placement.graph;

import javax.annotation.Nonnull;

/**
 * Work to run inside a {@link GraphStore} transaction, producing a result.
 *
 * @param <T> The result type.
 */
@FunctionalInterface
public interface GraphTransactionalCallable<T> {

    /**
     * Run the work.
     *
     * @param transaction The transaction to issue graph operations through.
     * @return The result.
     * @throws Exception Any exception. Aborts the transaction.
     */
    T run(@Nonnull GraphTransaction transaction) throws Exception;
}
