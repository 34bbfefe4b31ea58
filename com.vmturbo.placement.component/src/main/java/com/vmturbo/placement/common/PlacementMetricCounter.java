package com.vmturbo.placement.common;

import java.util.Arrays;
import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;

import com.google.common.base.Preconditions;

import io.prometheus.client.Counter;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A counter metric of the placement component, backed by a Prometheus {@link Counter}.
 *
 * <pre>
 * private static final PlacementMetricCounter ERRORS = PlacementMetricCounter.builder()
 *         .withName("placement_errors")
 *         .withHelp("Errors, by operation.")
 *         .withLabelNames("operation")
 *         .build()
 *         .register();
 * </pre>
 */
@ThreadSafe
public class PlacementMetricCounter {

    private static final Logger logger = LogManager.getLogger();

    private final String name;

    private final String[] labelNames;

    // does the actual counting
    private final Counter counter;

    private PlacementMetricCounter(@Nonnull final String name,
                                   @Nonnull final String help,
                                   @Nonnull final String[] labelNames) {
        this.name = name;
        this.labelNames = labelNames;
        this.counter = Counter.build()
                .name(name)
                .help(help)
                .labelNames(labelNames)
                .create();
    }

    /**
     * Register the counter with the default Prometheus registry. A counter whose name is
     * already registered is kept unregistered, which happens when tests load a class twice.
     *
     * @return This counter.
     */
    @Nonnull
    public PlacementMetricCounter register() {
        try {
            counter.register();
        } catch (IllegalArgumentException e) {
            logger.warn("Metric {} already registered with prometheus. Will not re-register.",
                    name);
        }
        return this;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    /**
     * Increment the counter when it has no labels.
     */
    public void increment() {
        labels().increment();
    }

    /**
     * Get the value of the counter when it has no labels.
     *
     * @return The value.
     */
    public double getData() {
        return labels().getData();
    }

    /**
     * Get the part of the counter with the given label values.
     *
     * @param labels One value for each label name, in the same order.
     * @return The labelled data.
     */
    @Nonnull
    public CounterData labels(@Nonnull final String... labels) {
        Preconditions.checkArgument(labels.length == labelNames.length,
                "Metric %s expects labels %s but got %s", name, Arrays.toString(labelNames),
                Arrays.toString(labels));
        return new CounterData(counter.labels(labels));
    }

    /**
     * Start building a counter.
     *
     * @return The builder.
     */
    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a {@link PlacementMetricCounter}.
     */
    public static class Builder {
        private String name;
        private String help;
        private String[] labelNames = new String[0];

        private Builder() {}

        /**
         * Set the metric name.
         *
         * @param name The name.
         * @return The builder, for chaining.
         */
        @Nonnull
        public Builder withName(@Nonnull final String name) {
            this.name = Objects.requireNonNull(name);
            return this;
        }

        /**
         * Set the metric help text.
         *
         * @param help The help text.
         * @return The builder, for chaining.
         */
        @Nonnull
        public Builder withHelp(@Nonnull final String help) {
            this.help = Objects.requireNonNull(help);
            return this;
        }

        /**
         * Set the label names.
         *
         * @param labelNames The label names.
         * @return The builder, for chaining.
         */
        @Nonnull
        public Builder withLabelNames(@Nonnull final String... labelNames) {
            this.labelNames = labelNames.clone();
            return this;
        }

        /**
         * Build the counter. It still has to be registered.
         *
         * @return The counter.
         */
        @Nonnull
        public PlacementMetricCounter build() {
            Preconditions.checkState(StringUtils.isNotBlank(name), "A metric needs a name.");
            Preconditions.checkState(StringUtils.isNotBlank(help), "Metric %s needs help text.",
                    name);
            return new PlacementMetricCounter(name, help, labelNames);
        }
    }

    /**
     * The value of a counter for one set of label values.
     */
    public static class CounterData {

        private final Counter.Child child;

        private CounterData(@Nonnull final Counter.Child child) {
            this.child = child;
        }

        /**
         * Increment the value by 1.
         */
        public void increment() {
            child.inc();
        }

        /**
         * Get the value.
         *
         * @return The value.
         */
        public double getData() {
            return child.get();
        }
    }
}
