package com.vmturbo.placement.provider;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import org.apache.commons.lang3.Validate;

/**
 * A source of resources, e.g. a compute host or a storage pool. Providers form trees through
 * their parents. The root of a tree is the provider with no parent.
 *
 * <p>The root and generation are filled in by the {@link ResourceProviderStore}.</p>
 */
public class ResourceProvider {

    private final String uuid;

    private final String name;

    private final String parentUuid;

    private String rootUuid;

    private Long generation;

    /**
     * Create a provider that hasn't been stored yet.
     *
     * @param uuid The UUID of the provider.
     * @param name The name of the provider.
     * @param parentUuid The UUID of the parent provider, or null for a root provider.
     */
    public ResourceProvider(@Nonnull final String uuid,
                            @Nonnull final String name,
                            @Nullable final String parentUuid) {
        this(uuid, name, parentUuid, null, null);
    }

    ResourceProvider(@Nonnull final String uuid,
                     @Nonnull final String name,
                     @Nullable final String parentUuid,
                     @Nullable final String rootUuid,
                     @Nullable final Long generation) {
        this.uuid = Validate.notBlank(uuid, "Resource provider UUID must not be blank");
        this.name = Validate.notBlank(name, "Resource provider name must not be blank");
        this.parentUuid = parentUuid;
        this.rootUuid = rootUuid;
        this.generation = generation;
    }

    @Nonnull
    public String getUuid() {
        return uuid;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nullable
    public String getParentUuid() {
        return parentUuid;
    }

    @Nullable
    public String getRootUuid() {
        return rootUuid;
    }

    void setRootUuid(@Nonnull final String rootUuid) {
        this.rootUuid = rootUuid;
    }

    @Nullable
    public Long getGeneration() {
        return generation;
    }

    void setGeneration(@Nonnull final Long generation) {
        this.generation = generation;
    }

    @Override
    public String toString() {
        return "Resource provider " + name + " (" + uuid + ", generation " + generation + ")";
    }
}
