package com.vmturbo.placement.ownership;

import java.util.Collections;
import java.util.Objects;

import javax.annotation.Nonnull;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmturbo.placement.common.ItemNotFoundException.ProjectNotFoundException;
import com.vmturbo.placement.common.StoreOperations;
import com.vmturbo.placement.graph.GraphStore;
import com.vmturbo.placement.graph.GraphStoreException;
import com.vmturbo.placement.graph.GraphTransaction;
import com.vmturbo.placement.graph.NodeLabel;

/**
 * Persists {@link Project}s in the {@link GraphStore}.
 */
public class ProjectStore {

    private static final Logger logger = LogManager.getLogger();

    private static final String STORE_LABEL = "project";

    private final GraphStore graphStore;

    /**
     * Create a new store.
     *
     * @param graphStore The graph the projects live in.
     */
    public ProjectStore(@Nonnull final GraphStore graphStore) {
        this.graphStore = Objects.requireNonNull(graphStore);
    }

    /**
     * Create a project. Creating a project that already exists does nothing.
     *
     * @param project The project.
     */
    public void create(@Nonnull final Project project) {
        try {
            graphStore.transaction(tx -> create(tx, project));
        } catch (GraphStoreException e) {
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "create").increment();
            throw e;
        }
    }

    /**
     * Create a project inside an open transaction.
     *
     * @param tx The transaction.
     * @param project The project.
     */
    public void create(@Nonnull final GraphTransaction tx, @Nonnull final Project project) {
        tx.mergeNode(NodeLabel.PROJECT, project.getUuid(), Collections.emptyMap());
        logger.debug("Created {}", project);
    }

    /**
     * Look up a project.
     *
     * @param uuid The UUID of the project.
     * @return The project.
     * @throws ProjectNotFoundException If there is no such project.
     */
    @Nonnull
    public Project getByUuid(@Nonnull final String uuid) throws ProjectNotFoundException {
        try {
            return graphStore.readResult(tx -> getByUuid(tx, uuid));
        } catch (GraphStoreException e) {
            StoreOperations.rethrowIfCause(e, ProjectNotFoundException.class);
            StoreOperations.STORE_ERROR_COUNT.labels(STORE_LABEL, "get").increment();
            throw e;
        }
    }

    /**
     * Look up a project inside an open transaction.
     *
     * @param tx The transaction.
     * @param uuid The UUID of the project.
     * @return The project.
     * @throws ProjectNotFoundException If there is no such project.
     */
    @Nonnull
    public Project getByUuid(@Nonnull final GraphTransaction tx, @Nonnull final String uuid)
            throws ProjectNotFoundException {
        return tx.getNode(NodeLabel.PROJECT, uuid)
                .map(node -> new Project(node.getUuid()))
                .orElseThrow(() -> new ProjectNotFoundException(uuid));
    }
}
