package com.vmturbo.placement.common;

import javax.annotation.Nonnull;

/**
 * Thrown when a requested allocation can't be satisfied by the provider's inventory, either
 * because there isn't enough free capacity or because the amount breaks the inventory's unit
 * constraints.
 */
public class InvalidAllocationException extends Exception {
    private static final long serialVersionUID = 4113296581932415705L;

    /**
     * Constructor.
     *
     * @param message the detail message.
     */
    public InvalidAllocationException(@Nonnull final String message) {
        super(message);
    }
}
