package com.vmturbo.placement.graph;

import javax.annotation.Nonnull;

/**
 * A backend-agnostic property graph holding the placement data.
 *
 * <p>Reads run in read-only transactions and may run alongside each other and alongside
 * writers. Writes run in writer transactions that are atomic: if the work throws, none of its
 * changes are kept. The store offers no other locking. Callers that need to detect concurrent
 * updates do so with {@link GraphTransaction#compareAndSetProperties}.</p>
 *
 * <p>Checked exceptions thrown by the work are wrapped in a {@link GraphStoreException}. Use
 * {@link GraphStoreException#getCause(Class)} to get them back. Unchecked exceptions propagate
 * as they are.</p>
 */
public interface GraphStore {

    /**
     * Run work in a read-only transaction.
     *
     * @param callable The work.
     * @param <T> The result type.
     * @return The result of the work.
     */
    <T> T readResult(@Nonnull GraphTransactionalCallable<T> callable);

    /**
     * Run work in a writer transaction.
     *
     * @param callable The work.
     * @param <T> The result type.
     * @return The result of the work.
     */
    <T> T transactionResult(@Nonnull GraphTransactionalCallable<T> callable);

    /**
     * Run work with no result in a writer transaction.
     *
     * @param runnable The work.
     */
    void transaction(@Nonnull GraphTransactionalRunnable runnable);
}
