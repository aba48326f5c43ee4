package org.carball.askdb.executor;

import org.carball.askdb.model.filter.FilterOperation;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Chainable filter builder of a data-access client. Filter calls only accumulate state;
 * nothing is sent until {@link #rows()} or {@link #count()}.
 */
public interface FilterQuery {

    FilterQuery gte(String field, Instant value);

    FilterQuery lt(String field, Instant value);

    FilterQuery like(String field, String pattern);

    FilterQuery notLike(String field, String pattern);

    FilterQuery ilike(String field, String value);

    FilterQuery eq(String field, Object value);

    FilterQuery isNull(String field);

    /**
     * Rows matching at least one of the given simple operations.
     */
    FilterQuery or(List<FilterOperation> operands);

    List<Map<String, Object>> rows() throws QueryExecutionException;

    long count() throws QueryExecutionException;
}
