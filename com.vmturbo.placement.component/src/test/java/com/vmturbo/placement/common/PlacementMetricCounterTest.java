package com.vmturbo.placement.common;

import static org.junit.Assert.assertEquals;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

/**
 * Unit tests for {@link PlacementMetricCounter}.
 */
public class PlacementMetricCounterTest {

    /**
     * Expected exceptions to test against.
     */
    @Rule
    public ExpectedException thrown = ExpectedException.none();

    /**
     * Labelled values are counted apart.
     */
    @Test
    public void testLabels() {
        final PlacementMetricCounter counter = PlacementMetricCounter.builder()
                .withName("placement_test_labelled_count")
                .withHelp("Labelled test counter.")
                .withLabelNames("store", "operation")
                .build()
                .register();
        counter.labels("consumer", "get").increment();
        counter.labels("consumer", "get").increment();
        counter.labels("consumer", "create").increment();

        assertEquals(2.0, counter.labels("consumer", "get").getData(), 0.0);
        assertEquals(1.0, counter.labels("consumer", "create").getData(), 0.0);
        assertEquals(0.0, counter.labels("user", "get").getData(), 0.0);
    }

    /**
     * A counter without labels counts on its own.
     */
    @Test
    public void testNoLabels() {
        final PlacementMetricCounter counter = PlacementMetricCounter.builder()
                .withName("placement_test_plain_count")
                .withHelp("Plain test counter.")
                .build()
                .register();
        counter.increment();
        assertEquals(1.0, counter.getData(), 0.0);
    }

    /**
     * Registering a second counter under a taken name leaves it usable.
     */
    @Test
    public void testRegisterTwice() {
        final PlacementMetricCounter.Builder builder = PlacementMetricCounter.builder()
                .withName("placement_test_duplicate_count")
                .withHelp("Duplicate test counter.");
        builder.build().register();
        final PlacementMetricCounter second = builder.build().register();
        second.increment();
        assertEquals(1.0, second.getData(), 0.0);
    }

    /**
     * The number of label values must match the label names.
     */
    @Test
    public void testWrongLabelCount() {
        final PlacementMetricCounter counter = PlacementMetricCounter.builder()
                .withName("placement_test_checked_count")
                .withHelp("Checked test counter.")
                .withLabelNames("store")
                .build();
        thrown.expect(IllegalArgumentException.class);
        thrown.expectMessage("placement_test_checked_count");
        counter.labels("consumer", "get");
    }

    /**
     * A counter needs a name.
     */
    @Test
    public void testMissingName() {
        thrown.expect(IllegalStateException.class);
        PlacementMetricCounter.builder().withHelp("Nameless.").build();
    }
}
