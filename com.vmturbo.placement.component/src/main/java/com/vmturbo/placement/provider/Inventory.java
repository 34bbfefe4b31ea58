package com.vmturbo.placement.provider;

import java.util.Objects;
import java.util.regex.Pattern;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.Preconditions;

import org.apache.commons.lang3.Validate;

/**
 * The amount of one resource class a provider offers, and the constraints on how it may be
 * allocated.
 */
@Immutable
public class Inventory {

    /**
     * Resource class names are upper case letters, digits and underscores, e.g. "VCPU" or
     * "CUSTOM_FPGA".
     */
    public static final String RESOURCE_CLASS_REGEX = "[A-Z0-9_]+";

    private static final Pattern RESOURCE_CLASS_PATTERN = Pattern.compile(RESOURCE_CLASS_REGEX);

    private final String resourceClass;

    private final long total;

    private final long reserved;

    private final long minUnit;

    private final long maxUnit;

    private final long stepSize;

    private final double allocationRatio;

    private Inventory(@Nonnull final Builder builder) {
        this.resourceClass = builder.resourceClass;
        this.total = builder.total;
        this.reserved = builder.reserved;
        this.minUnit = builder.minUnit;
        this.maxUnit = builder.maxUnit == null ? builder.total : builder.maxUnit;
        this.stepSize = builder.stepSize;
        this.allocationRatio = builder.allocationRatio;
    }

    /**
     * Start building an inventory.
     *
     * @param resourceClass The resource class, e.g. "VCPU".
     * @param total The total amount of the resource.
     * @return The builder.
     */
    @Nonnull
    public static Builder newBuilder(@Nonnull final String resourceClass, final long total) {
        return new Builder(resourceClass, total);
    }

    /**
     * Check whether a string is a well-formed resource class name.
     *
     * @param resourceClass The name.
     * @return True if the name matches {@link #RESOURCE_CLASS_REGEX}.
     */
    public static boolean isValidResourceClass(@Nullable final String resourceClass) {
        return resourceClass != null && RESOURCE_CLASS_PATTERN.matcher(resourceClass).matches();
    }

    /**
     * Reject a malformed resource class name.
     *
     * @param resourceClass The name.
     * @return The name.
     * @throws IllegalArgumentException If the name doesn't match {@link #RESOURCE_CLASS_REGEX}.
     */
    @Nonnull
    public static String checkResourceClass(@Nullable final String resourceClass) {
        Validate.isTrue(isValidResourceClass(resourceClass),
                "Resource class must match %s: %s", RESOURCE_CLASS_REGEX, resourceClass);
        return resourceClass;
    }

    @Nonnull
    public String getResourceClass() {
        return resourceClass;
    }

    public long getTotal() {
        return total;
    }

    public long getReserved() {
        return reserved;
    }

    public long getMinUnit() {
        return minUnit;
    }

    public long getMaxUnit() {
        return maxUnit;
    }

    public long getStepSize() {
        return stepSize;
    }

    public double getAllocationRatio() {
        return allocationRatio;
    }

    /**
     * The amount that may be allocated in total: what isn't reserved, scaled by the
     * allocation ratio.
     *
     * @return The capacity.
     */
    public long getCapacity() {
        return (long)((total - reserved) * allocationRatio);
    }

    /**
     * Check a single allocation amount against the unit constraints. Free capacity is not
     * considered.
     *
     * @param amount The amount.
     * @return True if the amount is within [minUnit, maxUnit] and a multiple of the step size.
     */
    public boolean acceptsAmount(final long amount) {
        return amount >= minUnit && amount <= maxUnit && amount % stepSize == 0;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Inventory)) {
            return false;
        }
        final Inventory other = (Inventory)o;
        return total == other.total && reserved == other.reserved && minUnit == other.minUnit
                && maxUnit == other.maxUnit && stepSize == other.stepSize
                && Double.compare(allocationRatio, other.allocationRatio) == 0
                && resourceClass.equals(other.resourceClass);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resourceClass, total, reserved, minUnit, maxUnit, stepSize,
                allocationRatio);
    }

    @Override
    public String toString() {
        return resourceClass + " inventory (total " + total + ", reserved " + reserved
                + ", units " + minUnit + ".." + maxUnit + " step " + stepSize
                + ", ratio " + allocationRatio + ")";
    }

    /**
     * Builder for {@link Inventory}. Unless set, nothing is reserved, units run from 1 to the
     * total in steps of 1, and the allocation ratio is 1.
     */
    public static class Builder {
        private final String resourceClass;
        private final long total;
        private long reserved = 0;
        private long minUnit = 1;
        private Long maxUnit = null;
        private long stepSize = 1;
        private double allocationRatio = 1.0;

        private Builder(@Nonnull final String resourceClass, final long total) {
            this.resourceClass = checkResourceClass(resourceClass);
            this.total = total;
        }

        @Nonnull
        public Builder setReserved(final long reserved) {
            this.reserved = reserved;
            return this;
        }

        @Nonnull
        public Builder setMinUnit(final long minUnit) {
            this.minUnit = minUnit;
            return this;
        }

        @Nonnull
        public Builder setMaxUnit(final long maxUnit) {
            this.maxUnit = maxUnit;
            return this;
        }

        @Nonnull
        public Builder setStepSize(final long stepSize) {
            this.stepSize = stepSize;
            return this;
        }

        @Nonnull
        public Builder setAllocationRatio(final double allocationRatio) {
            this.allocationRatio = allocationRatio;
            return this;
        }

        /**
         * Build the inventory.
         *
         * @return The inventory.
         * @throws IllegalArgumentException If the values are inconsistent.
         */
        @Nonnull
        public Inventory build() {
            Preconditions.checkArgument(total >= 0, "Total must not be negative: %s", total);
            Preconditions.checkArgument(reserved >= 0 && reserved <= total,
                    "Reserved must be between 0 and the total %s: %s", total, reserved);
            Preconditions.checkArgument(minUnit >= 1, "Min unit must be at least 1: %s",
                    minUnit);
            Preconditions.checkArgument(maxUnit == null || maxUnit >= minUnit,
                    "Max unit %s is below min unit %s", maxUnit, minUnit);
            Preconditions.checkArgument(stepSize >= 1, "Step size must be at least 1: %s",
                    stepSize);
            Preconditions.checkArgument(allocationRatio > 0,
                    "Allocation ratio must be positive: %s", allocationRatio);
            return new Inventory(this);
        }
    }
}
