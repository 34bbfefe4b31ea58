package com.vmturbo.placement.ownership;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;

import javax.annotation.Nonnull;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmturbo.placement.common.ItemNotFoundException.UserNotFoundException;
import com.vmturbo.placement.common.StoreOperations;
import com.vmturbo.placement.graph.EdgeType;
import com.vmturbo.placement.graph.GraphEdge;
import com.vmturbo.placement.graph.GraphStore;
import com.vmturbo.placement.graph.GraphStoreException;
import com.vmturbo.placement.graph.GraphTransaction;
import com.vmturbo.placement.graph.NodeLabel;
import com.vmturbo.placement.graph.NodeRef;

/**
 * Persists {@link User}s in the {@link GraphStore}, and looks after the "incomplete" user that
 * owns consumers nobody else has claimed.
 */
public class UserStore {

    private static final Logger logger = LogManager.getLogger();

    private static final String STORE_LABEL = "user";

    private final GraphStore graphStore;

    private final Project incompleteProject;

    private final User incompleteUser;

    /**
     * Create a new store.
     *
     * @param graphStore The graph the users live in.
     * @param incompleteProjectUuid The UUID of the project that owns the incomplete user.
     * @param incompleteUserUuid The UUID of the user that owns consumers with no other owner.
     */
    public UserStore(@Nonnull final GraphStore graphStore,
                     @Nonnull final String incompleteProjectUuid,
                     @Nonnull final String incompleteUserUuid) {
        this.graphStore = Objects.requireNonNull(graphStore);
        this.incompleteProject = new Project(incompleteProjectUuid);
        this.incompleteUser = new User(incompleteUserUuid);
    }

    /**
     * Create a user. Creating a user that already exists does nothing.
     *
     * @param user The user.
     */
    public void create(@Nonnull final User user) {
        try {
            graphStore.transaction(tx -> create(tx, user));
        } catch (GraphStoreException e) {
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "create").increment();
            throw e;
        }
    }

    /**
     * Create a user inside an open transaction.
     *
     * @param tx The transaction.
     * @param user The user.
     */
    public void create(@Nonnull final GraphTransaction tx, @Nonnull final User user) {
        tx.mergeNode(NodeLabel.USER, user.getUuid(), Collections.emptyMap());
        logger.debug("Created {}", user);
    }

    /**
     * Look up a user.
     *
     * @param uuid The UUID of the user.
     * @return The user.
     * @throws UserNotFoundException If there is no such user.
     */
    @Nonnull
    public User getByUuid(@Nonnull final String uuid) throws UserNotFoundException {
        try {
            return graphStore.readResult(tx -> getByUuid(tx, uuid));
        } catch (GraphStoreException e) {
            StoreOperations.rethrowIfCause(e, UserNotFoundException.class);
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "get").increment();
            throw e;
        }
    }

    /**
     * Look up a user inside an open transaction.
     *
     * @param tx The transaction.
     * @param uuid The UUID of the user.
     * @return The user.
     * @throws UserNotFoundException If there is no such user.
     */
    @Nonnull
    public User getByUuid(@Nonnull final GraphTransaction tx, @Nonnull final String uuid)
            throws UserNotFoundException {
        return tx.getNode(NodeLabel.USER, uuid)
                .map(node -> new User(node.getUuid()))
                .orElseThrow(() -> new UserNotFoundException(uuid));
    }

    /**
     * Find the project owning a user, inside an open transaction.
     *
     * @param tx The transaction.
     * @param userUuid The UUID of the user.
     * @return The UUID of the owning project, or empty if the user has none.
     */
    @Nonnull
    public Optional<String> getProjectUuid(@Nonnull final GraphTransaction tx,
                                           @Nonnull final String userUuid) {
        return tx.getIncoming(EdgeType.OWNS, userRef(userUuid)).stream()
                .map(GraphEdge::getSourceUuid)
                .findFirst();
    }

    @Nonnull
    public Project getIncompleteProject() {
        return incompleteProject;
    }

    @Nonnull
    public User getIncompleteUser() {
        return incompleteUser;
    }

    /**
     * Make sure the incomplete user and project exist, and that the project owns the user.
     * Safe to call any number of times.
     *
     * @return The UUID of the incomplete user.
     */
    @Nonnull
    public String ensureIncompleteUser() {
        try {
            return graphStore.transactionResult(tx -> ensureIncompleteUser(tx));
        } catch (GraphStoreException e) {
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "ensure_incomplete").increment();
            throw e;
        }
    }

    /**
     * Make sure the incomplete user and project exist inside an open transaction.
     *
     * @param tx The transaction.
     * @return The UUID of the incomplete user.
     */
    @Nonnull
    public String ensureIncompleteUser(@Nonnull final GraphTransaction tx) {
        tx.mergeNode(NodeLabel.PROJECT, incompleteProject.getUuid(), Collections.emptyMap());
        tx.mergeNode(NodeLabel.USER, incompleteUser.getUuid(), Collections.emptyMap());
        tx.mergeEdge(EdgeType.OWNS, NodeRef.of(NodeLabel.PROJECT, incompleteProject.getUuid()),
                userRef(incompleteUser.getUuid()), Collections.emptyMap());
        return incompleteUser.getUuid();
    }

    /**
     * Refer to a user node.
     *
     * @param uuid The UUID of the user.
     * @return The reference.
     */
    @Nonnull
    public static NodeRef userRef(@Nonnull final String uuid) {
        return NodeRef.of(NodeLabel.USER, uuid);
    }
}
