package com.vmturbo.placement.graph;

import javax.annotation.Nonnull;

/**
 * Work to run inside a {@link GraphStore} transaction, with no result.
 */
@FunctionalInterface
public interface GraphTransactionalRunnable {

    /**
     * Run the work.
     *
     * @param transaction The transaction to issue graph operations through.
     * @throws Exception Any exception. Aborts the transaction.
     */
    void run(@Nonnull GraphTransaction transaction) throws Exception;
}
