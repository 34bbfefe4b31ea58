package com.vmturbo.placement.consumer;

import java.time.Instant;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import com.vmturbo.placement.ownership.Project;
import com.vmturbo.placement.ownership.User;

/**
 * An entity holding allocations against resource providers, e.g. an instance.
 *
 * <p>The generation is the token for optimistic concurrency on the consumer's allocations.
 * It is null until the consumer has been created in, or read from, the store, and the
 * {@link ConsumerStore} moves it forward as it changes the stored consumer.</p>
 */
public class Consumer {

    private final String uuid;

    private Project project;

    private User user;

    private Long generation;

    private Instant createdAt;

    private Instant updatedAt;

    /**
     * Create a consumer that hasn't been stored yet.
     *
     * @param uuid The UUID of the consumer.
     * @param project The project owning the consumer's user, if known.
     * @param user The user owning the consumer, if known.
     */
    public Consumer(@Nonnull final String uuid,
                    @Nullable final Project project,
                    @Nullable final User user) {
        this(uuid, project, user, null, null, null);
    }

    /**
     * Create a consumer with all of its fields.
     *
     * @param uuid The UUID of the consumer.
     * @param project The owning project.
     * @param user The owning user.
     * @param generation The generation.
     * @param createdAt When the consumer was created.
     * @param updatedAt When the consumer was last updated.
     */
    public Consumer(@Nonnull final String uuid,
                    @Nullable final Project project,
                    @Nullable final User user,
                    @Nullable final Long generation,
                    @Nullable final Instant createdAt,
                    @Nullable final Instant updatedAt) {
        this.uuid = uuid;
        this.project = project;
        this.user = user;
        this.generation = generation;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    @Nonnull
    public String getUuid() {
        return uuid;
    }

    @Nullable
    public Project getProject() {
        return project;
    }

    public void setProject(@Nullable final Project project) {
        this.project = project;
    }

    @Nullable
    public User getUser() {
        return user;
    }

    public void setUser(@Nullable final User user) {
        this.user = user;
    }

    @Nullable
    public Long getGeneration() {
        return generation;
    }

    public void setGeneration(@Nullable final Long generation) {
        this.generation = generation;
    }

    @Nullable
    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(@Nullable final Instant createdAt) {
        this.createdAt = createdAt;
    }

    @Nullable
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(@Nullable final Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    /**
     * Take the generation and times from another view of this consumer, such as the one a
     * store returns once its transaction has committed.
     *
     * @param stored The stored view of the same consumer.
     */
    public void copyStoredState(@Nonnull final Consumer stored) {
        Preconditions.checkArgument(uuid.equals(stored.getUuid()),
                "Cannot copy the state of %s into %s", stored.getUuid(), uuid);
        this.generation = stored.getGeneration();
        this.createdAt = stored.getCreatedAt();
        this.updatedAt = stored.getUpdatedAt();
    }

    @Override
    public String toString() {
        return "Consumer " + uuid + " (generation " + generation + ", " + user + ", "
                + project + ")";
    }
}
