package org.carball.askdb.executor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.carball.askdb.model.filter.FilterOperation;
import org.carball.askdb.model.filter.FilterPipeline;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Replays a pipeline as chained filter calls on the data-access client, one call per
 * operation in pipeline order. Read-only; failures are not retried.
 */
@Slf4j
@RequiredArgsConstructor
public class QueryExecutor {

    private final DataAccessClient client;

    public ExecutionResult execute(FilterPipeline pipeline, ExecutionMode mode) throws QueryExecutionException {
        List<FilterOperation> operations = pipeline.consume();
        String table = pipeline.getTargetTable();
        log.debug("Executing {} filter(s) against {} in {} mode", operations.size(), table, mode);

        long start = System.currentTimeMillis();
        try {
            FilterQuery query = client.from(table);
            for (FilterOperation operation : operations) {
                query = apply(query, operation);
            }

            ExecutionResult result;
            if (mode == ExecutionMode.COUNT) {
                result = ExecutionResult.ofCount(table, query.count());
            } else {
                List<Map<String, Object>> rows = query.rows();
                result = ExecutionResult.ofRows(table, rows);
            }

            log.debug("Query on {} returned {} row(s) in {} ms", table, result.getCount(),
                    System.currentTimeMillis() - start);
            return result;

        } catch (QueryExecutionException e) {
            log.error("Query on {} failed: {}", table, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Data access client failed on {}: {}", table, e.getMessage());
            throw new QueryExecutionException("Query on " + table + " failed: " + e.getMessage(), e);
        }
    }

    static FilterQuery apply(FilterQuery query, FilterOperation operation) {
        String field = operation.getField();
        Object value = operation.getValue();

        switch (operation.getOperator()) {
            case GTE:
                return query.gte(field, (Instant) value);
            case LT:
                return query.lt(field, (Instant) value);
            case LIKE:
                return query.like(field, (String) value);
            case NOT_LIKE:
                return query.notLike(field, (String) value);
            case ILIKE:
                return query.ilike(field, (String) value);
            case EQ:
                return query.eq(field, value);
            case IS_NULL:
                return query.isNull(field);
            case OR:
                return query.or(operation.getOperands());
            default:
                throw new IllegalArgumentException("Unsupported operator: " + operation.getOperator());
        }
    }
}
