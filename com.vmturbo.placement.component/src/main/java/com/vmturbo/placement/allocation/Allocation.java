package com.vmturbo.placement.allocation;

import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

import com.vmturbo.placement.consumer.Consumer;

/**
 * An amount of one resource class that a consumer holds from a resource provider.
 */
@Immutable
public class Allocation {

    private final String providerUuid;

    private final String resourceClass;

    private final Consumer consumer;

    private final long used;

    /**
     * Create a new allocation.
     *
     * @param providerUuid The UUID of the provider the resource comes from.
     * @param resourceClass The resource class.
     * @param consumer The consumer holding the resource.
     * @param used The amount held.
     */
    public Allocation(@Nonnull final String providerUuid,
                      @Nonnull final String resourceClass,
                      @Nonnull final Consumer consumer,
                      final long used) {
        this.providerUuid = Objects.requireNonNull(providerUuid);
        this.resourceClass = Objects.requireNonNull(resourceClass);
        this.consumer = Objects.requireNonNull(consumer);
        this.used = used;
    }

    @Nonnull
    public String getProviderUuid() {
        return providerUuid;
    }

    @Nonnull
    public String getResourceClass() {
        return resourceClass;
    }

    @Nonnull
    public Consumer getConsumer() {
        return consumer;
    }

    public long getUsed() {
        return used;
    }

    @Override
    public String toString() {
        return used + " " + resourceClass + " from " + providerUuid + " for consumer "
                + consumer.getUuid();
    }
}
