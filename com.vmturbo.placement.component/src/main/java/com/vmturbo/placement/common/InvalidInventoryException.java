package com.vmturbo.placement.common;

import javax.annotation.Nonnull;

/**
 * Thrown when an inventory change is not allowed: adding a resource class the provider already
 * has, or removing inventory that still has allocations against it.
 */
public class InvalidInventoryException extends Exception {
    private static final long serialVersionUID = -6092390530613740233L;

    /**
     * Constructor.
     *
     * @param message the detail message.
     */
    public InvalidInventoryException(@Nonnull final String message) {
        super(message);
    }
}
