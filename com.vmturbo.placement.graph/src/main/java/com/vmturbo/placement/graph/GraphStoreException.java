package com.vmturbo.placement.graph;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown by the {@link GraphStore} when an operation violates a store constraint, and used to
 * carry checked exceptions out of a transaction.
 */
public class GraphStoreException extends RuntimeException {
    private static final long serialVersionUID = 6470314802553163401L;

    /**
     * Constructor.
     *
     * @param message the detail message.
     */
    public GraphStoreException(@Nonnull final String message) {
        super(message);
    }

    /**
     * Constructor.
     *
     * @param message the detail message.
     * @param cause   the cause.
     */
    public GraphStoreException(@Nonnull final String message, @Nonnull final Throwable cause) {
        super(message, cause);
    }

    /**
     * Find the first cause in the chain that is an instance of a given type.
     *
     * @param type The exception type to look for.
     * @param <T> The exception type to look for.
     * @return The cause, or null if there is none of that type.
     */
    @Nullable
    public <T extends Throwable> T getCause(@Nonnull final Class<? extends T> type) {
        Throwable next = getCause();
        while (next != null) {
            if (type.isInstance(next)) {
                return type.cast(next);
            }
            if (next.getCause() == next) {
                break;
            }
            next = next.getCause();
        }
        return null;
    }
}
