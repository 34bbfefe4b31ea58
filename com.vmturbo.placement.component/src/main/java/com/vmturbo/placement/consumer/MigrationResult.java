package com.vmturbo.placement.consumer;

import javax.annotation.concurrent.Immutable;

/**
 * The outcome of one batch of a data migration: how many records needed migrating, and how
 * many were migrated.
 */
@Immutable
public class MigrationResult {

    private final int found;

    private final int done;

    /**
     * Create a new result.
     *
     * @param found The number of records found needing migration.
     * @param done The number of records migrated.
     */
    public MigrationResult(final int found, final int done) {
        this.found = found;
        this.done = done;
    }

    public int getFound() {
        return found;
    }

    public int getDone() {
        return done;
    }

    @Override
    public String toString() {
        return "MigrationResult(found=" + found + ", done=" + done + ")";
    }
}
