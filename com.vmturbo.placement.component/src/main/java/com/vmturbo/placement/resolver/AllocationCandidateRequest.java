package com.vmturbo.placement.resolver;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.apache.commons.lang3.StringUtils;

/**
 * What a caller needs placed: amounts of resource classes, all from one provider tree, and
 * optional constraints on which providers may supply them.
 */
@Immutable
public class AllocationCandidateRequest {

    private final ImmutableMap<String, Long> resources;

    private final String inTree;

    private final ImmutableSet<String> requiredProviders;

    private final ImmutableSet<String> excludedProviders;

    private AllocationCandidateRequest(@Nonnull final Builder builder) {
        this.resources = ImmutableMap.copyOf(builder.resources);
        this.inTree = builder.inTree;
        this.requiredProviders = ImmutableSet.copyOf(builder.requiredProviders);
        this.excludedProviders = ImmutableSet.copyOf(builder.excludedProviders);
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * The amount wanted of each resource class, in the order they were added.
     *
     * @return Resource class to amount.
     */
    @Nonnull
    public ImmutableMap<String, Long> getResources() {
        return resources;
    }

    /**
     * A provider whose tree the candidates must come from.
     *
     * @return The provider UUID, if the request is limited to one tree.
     */
    @Nonnull
    public Optional<String> getInTree() {
        return Optional.ofNullable(inTree);
    }

    @Nonnull
    public ImmutableSet<String> getRequiredProviders() {
        return requiredProviders;
    }

    @Nonnull
    public ImmutableSet<String> getExcludedProviders() {
        return excludedProviders;
    }

    @Override
    public String toString() {
        return "AllocationCandidateRequest(resources=" + resources + ", inTree=" + inTree
                + ", required=" + requiredProviders + ", excluded=" + excludedProviders + ")";
    }

    /**
     * Builder for {@link AllocationCandidateRequest}.
     */
    public static class Builder {
        private final Map<String, Long> resources = new LinkedHashMap<>();
        private String inTree = null;
        private final Set<String> requiredProviders = new LinkedHashSet<>();
        private final Set<String> excludedProviders = new LinkedHashSet<>();

        private Builder() {}

        /**
         * Ask for an amount of a resource class. Asking for the same class again replaces the
         * earlier amount.
         *
         * @param resourceClass The resource class.
         * @param amount The amount, at least 1.
         * @return The builder.
         */
        @Nonnull
        public Builder addResource(@Nonnull final String resourceClass, final long amount) {
            Preconditions.checkArgument(StringUtils.isNotBlank(resourceClass),
                    "Resource class must not be blank");
            Preconditions.checkArgument(amount > 0, "Amount of %s must be positive: %s",
                    resourceClass, amount);
            resources.put(resourceClass, amount);
            return this;
        }

        @Nonnull
        public Builder setInTree(@Nullable final String providerUuid) {
            this.inTree = StringUtils.trimToNull(providerUuid);
            return this;
        }

        /**
         * Only accept candidates that are one of these providers, or in the tree of one.
         *
         * @param providerUuids The provider UUIDs.
         * @return The builder.
         */
        @Nonnull
        public Builder addRequiredProviders(@Nonnull final Set<String> providerUuids) {
            requiredProviders.addAll(providerUuids);
            return this;
        }

        /**
         * Reject candidates that are one of these providers, or in the tree of one.
         *
         * @param providerUuids The provider UUIDs.
         * @return The builder.
         */
        @Nonnull
        public Builder addExcludedProviders(@Nonnull final Set<String> providerUuids) {
            excludedProviders.addAll(providerUuids);
            return this;
        }

        @Nonnull
        public AllocationCandidateRequest build() {
            return new AllocationCandidateRequest(this);
        }
    }
}
