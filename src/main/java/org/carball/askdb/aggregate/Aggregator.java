package org.carball.askdb.aggregate;

import lombok.extern.slf4j.Slf4j;
import org.carball.askdb.executor.ExecutionMode;
import org.carball.askdb.executor.ExecutionResult;
import org.carball.askdb.model.aggregate.AggregateFunction;
import org.carball.askdb.model.aggregate.AggregateRequest;
import org.carball.askdb.model.aggregate.AggregateResult;
import org.carball.askdb.model.aggregate.Metric;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reduces an execution result to counts and exact decimal sums, optionally per group.
 * Quantities are summed as {@link BigDecimal} so that whole-vs-parts comparisons are exact.
 */
@Slf4j
public class Aggregator {

    public AggregateResult aggregate(ExecutionResult result, AggregateRequest request) {
        if (result.getMode() == ExecutionMode.COUNT) {
            return fromCount(result, request);
        }

        if (!request.isGrouped()) {
            Map<String, BigDecimal> values = reduce(result.getRows(), request.getMetrics());
            log.debug("Aggregated {} row(s) of {}: {}", result.getRows().size(), result.getTargetTable(), values);
            return AggregateResult.ungrouped(values);
        }

        Map<String, List<Map<String, Object>>> buckets = new TreeMap<>();
        for (Map<String, Object> row : result.getRows()) {
            Object key = row.get(request.getGroupBy());
            String groupKey = key == null ? AggregateResult.NULL_GROUP : key.toString();
            buckets.computeIfAbsent(groupKey, k -> new ArrayList<>()).add(row);
        }

        Map<String, Map<String, BigDecimal>> groups = new LinkedHashMap<>();
        buckets.forEach((key, rows) -> groups.put(key, reduce(rows, request.getMetrics())));
        log.debug("Aggregated {} row(s) of {} into {} group(s) by {}",
                result.getRows().size(), result.getTargetTable(), groups.size(), request.getGroupBy());
        return new AggregateResult(request.getGroupBy(), groups);
    }

    private AggregateResult fromCount(ExecutionResult result, AggregateRequest request) {
        if (request.isGrouped() || request.getMetrics().stream().anyMatch(m -> m.getFunction() != AggregateFunction.COUNT)) {
            throw new IllegalArgumentException("A count-only result cannot answer " + request.getMetrics()
                    + (request.isGrouped() ? " grouped by " + request.getGroupBy() : ""));
        }
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        values.put(Metric.count().getLabel(), BigDecimal.valueOf(result.getCount()));
        return AggregateResult.ungrouped(values);
    }

    private Map<String, BigDecimal> reduce(List<Map<String, Object>> rows, List<Metric> metrics) {
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        for (Metric metric : metrics) {
            if (metric.getFunction() == AggregateFunction.COUNT) {
                values.put(metric.getLabel(), BigDecimal.valueOf(rows.size()));
            } else {
                values.put(metric.getLabel(), sum(rows, metric.getField()));
            }
        }
        return values;
    }

    private BigDecimal sum(List<Map<String, Object>> rows, String field) {
        BigDecimal total = BigDecimal.ZERO;
        for (Map<String, Object> row : rows) {
            Object value = row.get(field);
            if (value != null) {
                total = total.add(toDecimal(value, field));
            }
        }
        return total;
    }

    static BigDecimal toDecimal(Object value, String field) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Non-numeric value '" + value + "' in field " + field, e);
        }
    }
}
