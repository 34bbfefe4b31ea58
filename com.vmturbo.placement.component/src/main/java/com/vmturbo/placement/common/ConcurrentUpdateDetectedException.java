package com.vmturbo.placement.common;

import javax.annotation.Nonnull;

/**
 * Thrown when a generation-guarded update finds that another writer got there first. The
 * caller has to re-read the current state and redo the whole operation.
 */
public class ConcurrentUpdateDetectedException extends Exception {
    private static final long serialVersionUID = -1786032913442563395L;

    /**
     * Constructor.
     *
     * @param message the detail message.
     */
    public ConcurrentUpdateDetectedException(@Nonnull final String message) {
        super(message);
    }
}
