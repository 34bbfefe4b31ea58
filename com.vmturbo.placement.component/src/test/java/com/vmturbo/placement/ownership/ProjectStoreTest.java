package com.vmturbo.placement.ownership;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import com.vmturbo.placement.common.ItemNotFoundException.ProjectNotFoundException;
import com.vmturbo.placement.common.StoreOperations;
import com.vmturbo.placement.graph.GraphStore;
import com.vmturbo.placement.graph.GraphStoreException;
import com.vmturbo.placement.graph.GraphTransactionalCallable;
import com.vmturbo.placement.graph.InMemoryGraphStore;

/**
 * Unit tests for {@link ProjectStore}.
 */
public class ProjectStoreTest {

    /**
     * Expected exceptions to test against.
     */
    @Rule
    public ExpectedException thrown = ExpectedException.none();

    private InMemoryGraphStore graphStore;

    private ProjectStore projectStore;

    /**
     * Common setup.
     */
    @Before
    public void setup() {
        graphStore = new InMemoryGraphStore();
        projectStore = new ProjectStore(graphStore);
    }

    /**
     * A created project can be looked up, and creating it again changes nothing.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testCreateAndGet() throws Exception {
        projectStore.create(new Project("p1"));
        projectStore.create(new Project("p1"));

        assertEquals(new Project("p1"), projectStore.getByUuid("p1"));
        assertEquals(1, graphStore.nodeCount());
    }

    /**
     * Looking up a missing project fails.
     *
     * @throws Exception on exception.
     */
    @Test
    public void testGetMissing() throws Exception {
        thrown.expect(ProjectNotFoundException.class);
        thrown.expectMessage("p1");
        projectStore.getByUuid("p1");
    }

    /**
     * Store failures propagate as they are, and are counted.
     *
     * @throws Exception on exception.
     */
    @Test
    @SuppressWarnings("unchecked")
    public void testStoreFailureIsCounted() throws Exception {
        final GraphStore failing = mock(GraphStore.class);
        final GraphStoreException failure = new GraphStoreException("Store is down.");
        when(failing.readResult(any(GraphTransactionalCallable.class))).thenThrow(failure);
        final double before = errorCount();

        try {
            new ProjectStore(failing).getByUuid("p1");
            fail("Store failure was swallowed");
        } catch (GraphStoreException e) {
            assertSame(failure, e);
        }
        assertEquals(before + 1, errorCount(), 0.0);
    }

    private static double errorCount() {
        return StoreOperations.STORE_ERROR_COUNT.labels("project", "get").getData();
    }
}
