package com.vmturbo.placement.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Map-backed implementation of {@link GraphStore}.
 *
 * <p>Writers work on a private copy of the graph, which replaces the shared graph only when the
 * work completes. Readers work on whatever graph was last committed, so they never see a
 * half-finished write. Writers are serialized.</p>
 */
@ThreadSafe
public class InMemoryGraphStore implements GraphStore {

    private static final Logger logger = LogManager.getLogger();

    private final ReentrantLock writeLock = new ReentrantLock();

    private final ThreadLocal<Boolean> inTransaction = ThreadLocal.withInitial(() -> false);

    private volatile GraphState committed = new GraphState();

    @Override
    public <T> T readResult(@Nonnull final GraphTransactionalCallable<T> callable) {
        return runGuarded(() -> callable.run(new InMemoryTransaction(committed, true)));
    }

    @Override
    public <T> T transactionResult(@Nonnull final GraphTransactionalCallable<T> callable) {
        return runGuarded(() -> {
            writeLock.lock();
            try {
                final GraphState working = committed.copy();
                final T result = callable.run(new InMemoryTransaction(working, false));
                committed = working;
                return result;
            } catch (Exception | Error e) {
                logger.debug("Rolled back graph transaction: {}", e.toString());
                throw e;
            } finally {
                writeLock.unlock();
            }
        });
    }

    @Override
    public void transaction(@Nonnull final GraphTransactionalRunnable runnable) {
        transactionResult(tx -> {
            runnable.run(tx);
            return null;
        });
    }

    /**
     * Delete everything in the store.
     */
    public void clear() {
        writeLock.lock();
        try {
            committed = new GraphState();
        } finally {
            writeLock.unlock();
        }
    }

    private <T> T runGuarded(@Nonnull final Callable<T> work) {
        if (inTransaction.get()) {
            throw new GraphStoreException("Nested graph transactions are not supported. "
                    + "Pass the open transaction down instead.");
        }
        inTransaction.set(true);
        try {
            return work.call();
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Exception e) {
            throw new GraphStoreException(e.getMessage() == null
                    ? e.getClass().getSimpleName() : e.getMessage(), e);
        } finally {
            inTransaction.remove();
        }
    }

    /**
     * Identity of an edge: there is at most one edge per (type, source, target).
     */
    private static final class EdgeKey {
        private final EdgeType type;
        private final NodeRef source;
        private final NodeRef target;

        private EdgeKey(final EdgeType type, final NodeRef source, final NodeRef target) {
            this.type = type;
            this.source = source;
            this.target = target;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof EdgeKey)) {
                return false;
            }
            final EdgeKey other = (EdgeKey)o;
            return type == other.type && source.equals(other.source)
                    && target.equals(other.target);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, source, target);
        }
    }

    /**
     * The graph itself. Nodes by (label, UUID), edges by key, and an index from node to the keys
     * of every edge touching that node.
     */
    private static final class GraphState {
        private final Map<NodeRef, GraphNode> nodes;
        private final Map<EdgeKey, GraphEdge> edges;
        private final SetMultimap<NodeRef, EdgeKey> edgesByNode;

        private GraphState() {
            this(new LinkedHashMap<>(), new LinkedHashMap<>(), LinkedHashMultimap.create());
        }

        private GraphState(final Map<NodeRef, GraphNode> nodes,
                           final Map<EdgeKey, GraphEdge> edges,
                           final SetMultimap<NodeRef, EdgeKey> edgesByNode) {
            this.nodes = nodes;
            this.edges = edges;
            this.edgesByNode = edgesByNode;
        }

        private GraphState copy() {
            return new GraphState(new LinkedHashMap<>(nodes), new LinkedHashMap<>(edges),
                    LinkedHashMultimap.create(edgesByNode));
        }
    }

    /**
     * A transaction against one {@link GraphState}.
     */
    private static final class InMemoryTransaction implements GraphTransaction {

        private final GraphState state;

        private final boolean readOnly;

        private InMemoryTransaction(@Nonnull final GraphState state, final boolean readOnly) {
            this.state = state;
            this.readOnly = readOnly;
        }

        private void checkWritable(@Nonnull final String operation) {
            if (readOnly) {
                throw new GraphStoreException(operation + " is not allowed in a read-only "
                        + "transaction.");
            }
        }

        @Nonnull
        @Override
        public GraphNode mergeNode(@Nonnull final NodeLabel label,
                                   @Nonnull final String uuid,
                                   @Nonnull final Map<String, Object> properties) {
            checkWritable("mergeNode");
            final NodeRef ref = NodeRef.of(label, uuid);
            final GraphNode node = new GraphNode(label, uuid, properties);
            final GraphNode existing = state.nodes.get(ref);
            if (existing == null) {
                state.nodes.put(ref, node);
                return node;
            } else if (existing.equals(node)) {
                return existing;
            } else {
                throw new GraphStoreException("Node " + ref + " already exists as " + existing
                        + "; cannot merge " + node);
            }
        }

        @Nonnull
        @Override
        public Optional<GraphNode> getNode(@Nonnull final NodeLabel label,
                                           @Nonnull final String uuid) {
            return Optional.ofNullable(state.nodes.get(NodeRef.of(label, uuid)));
        }

        @Nonnull
        @Override
        public List<GraphNode> getNodes(@Nonnull final NodeLabel label) {
            return state.nodes.values().stream()
                    .filter(node -> node.getLabel() == label)
                    .collect(Collectors.toList());
        }

        @Nonnull
        @Override
        public Optional<GraphNode> setNodeProperties(@Nonnull final NodeLabel label,
                                                     @Nonnull final String uuid,
                                                     @Nonnull final Map<String, Object> updates) {
            checkWritable("setNodeProperties");
            final Optional<GraphNode> updated = getNode(label, uuid)
                    .map(node -> node.withProperties(updates));
            updated.ifPresent(node -> state.nodes.put(NodeRef.of(label, uuid), node));
            return updated;
        }

        @Override
        public boolean compareAndSetProperties(@Nonnull final NodeLabel label,
                                               @Nonnull final String uuid,
                                               @Nonnull final String key,
                                               @Nonnull final Object expected,
                                               @Nonnull final Map<String, Object> updates) {
            checkWritable("compareAndSetProperties");
            final Optional<GraphNode> node = getNode(label, uuid);
            if (!node.isPresent() || !expected.equals(node.get().getProperties().get(key))) {
                return false;
            }
            state.nodes.put(NodeRef.of(label, uuid), node.get().withProperties(updates));
            return true;
        }

        @Override
        public boolean deleteNode(@Nonnull final NodeLabel label, @Nonnull final String uuid) {
            checkWritable("deleteNode");
            final NodeRef ref = NodeRef.of(label, uuid);
            if (!state.nodes.containsKey(ref)) {
                return false;
            }
            final int relationships = relationshipCount(ref);
            if (relationships > 0) {
                throw new GraphStoreException("Cannot delete " + ref
                        + " because it still has " + relationships + " relationships.");
            }
            state.nodes.remove(ref);
            return true;
        }

        @Override
        public boolean detachDeleteNode(@Nonnull final NodeLabel label,
                                        @Nonnull final String uuid) {
            checkWritable("detachDeleteNode");
            final NodeRef ref = NodeRef.of(label, uuid);
            if (!state.nodes.containsKey(ref)) {
                return false;
            }
            for (EdgeKey key : new ArrayList<>(state.edgesByNode.get(ref))) {
                removeEdge(key);
            }
            state.nodes.remove(ref);
            return true;
        }

        @Nonnull
        @Override
        public GraphEdge mergeEdge(@Nonnull final EdgeType type,
                                   @Nonnull final NodeRef source,
                                   @Nonnull final NodeRef target,
                                   @Nonnull final Map<String, Object> properties) {
            checkWritable("mergeEdge");
            if (!type.connects(source.getLabel(), target.getLabel())) {
                throw new GraphStoreException(type + " edges cannot run from "
                        + source.getLabel() + " to " + target.getLabel() + ".");
            }
            if (!state.nodes.containsKey(source) || !state.nodes.containsKey(target)) {
                throw new GraphStoreException("Cannot create " + type + " edge from "
                        + source + " to " + target + ": both nodes must exist.");
            }
            final EdgeKey key = new EdgeKey(type, source, target);
            final GraphEdge edge = new GraphEdge(type, source, target, properties);
            state.edges.put(key, edge);
            state.edgesByNode.put(source, key);
            state.edgesByNode.put(target, key);
            return edge;
        }

        @Override
        public boolean deleteEdge(@Nonnull final EdgeType type,
                                  @Nonnull final NodeRef source,
                                  @Nonnull final NodeRef target) {
            checkWritable("deleteEdge");
            return removeEdge(new EdgeKey(type, source, target));
        }

        private boolean removeEdge(@Nonnull final EdgeKey key) {
            if (state.edges.remove(key) == null) {
                return false;
            }
            state.edgesByNode.remove(key.source, key);
            state.edgesByNode.remove(key.target, key);
            return true;
        }

        @Nonnull
        @Override
        public List<GraphEdge> getOutgoing(@Nonnull final EdgeType type,
                                           @Nonnull final NodeRef source) {
            return state.edgesByNode.get(source).stream()
                    .filter(key -> key.type == type && key.source.equals(source))
                    .map(state.edges::get)
                    .collect(Collectors.toList());
        }

        @Nonnull
        @Override
        public List<GraphEdge> getIncoming(@Nonnull final EdgeType type,
                                           @Nonnull final NodeRef target) {
            return state.edgesByNode.get(target).stream()
                    .filter(key -> key.type == type && key.target.equals(target))
                    .map(state.edges::get)
                    .collect(Collectors.toList());
        }

        @Override
        public int relationshipCount(@Nonnull final NodeRef node) {
            return state.edgesByNode.get(node).size();
        }

        @Override
        public int relationshipCount(@Nonnull final NodeRef node, @Nonnull final EdgeType type) {
            return (int)state.edgesByNode.get(node).stream()
                    .filter(key -> key.type == type)
                    .count();
        }
    }

    @Override
    public String toString() {
        final GraphState snapshot = committed;
        return "InMemoryGraphStore[" + snapshot.nodes.size() + " nodes, "
                + snapshot.edges.size() + " edges]";
    }

    /**
     * Used by tests to look at the raw committed graph.
     *
     * @return The number of nodes in the committed graph.
     */
    public int nodeCount() {
        return committed.nodes.size();
    }

    /**
     * Used by tests to look at the raw committed graph.
     *
     * @return The edges in the committed graph.
     */
    @Nonnull
    public List<GraphEdge> edges() {
        return Collections.unmodifiableList(new ArrayList<>(committed.edges.values()));
    }
}
