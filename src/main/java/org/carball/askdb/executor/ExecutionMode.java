package org.carball.askdb.executor;

/**
 * How the store is asked for the filtered rows.
 */
public enum ExecutionMode {
    /** Fetch matching rows; aggregation happens client-side. */
    ROWS,
    /** Server-side count only, no row payload. */
    COUNT
}
