package org.carball.askdb.executor;

/**
 * Entry point into the store. Implementations expose the store's chained-filter API and
 * never accept raw SQL.
 */
public interface DataAccessClient {

    FilterQuery from(String table);
}
