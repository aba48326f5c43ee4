package org.carball.askdb.model.aggregate;

import lombok.Value;
import org.carball.askdb.executor.ExecutionMode;

import java.util.List;

@Value
public class AggregateRequest {
    List<Metric> metrics;
    String groupBy;

    public AggregateRequest(List<Metric> metrics, String groupBy) {
        if (metrics == null || metrics.isEmpty()) {
            throw new IllegalArgumentException("An aggregate request needs at least one metric");
        }
        this.metrics = List.copyOf(metrics);
        this.groupBy = groupBy == null || groupBy.isBlank() ? null : groupBy;
    }

    public static AggregateRequest count() {
        return new AggregateRequest(List.of(Metric.count()), null);
    }

    public static AggregateRequest sum(String field) {
        return new AggregateRequest(List.of(Metric.sum(field)), null);
    }

    public static AggregateRequest sumGroupedBy(String field, String groupBy) {
        return new AggregateRequest(List.of(Metric.sum(field)), groupBy);
    }

    public boolean isGrouped() {
        return groupBy != null;
    }

    /**
     * Ungrouped counts run as a server-side head count; anything else needs the rows.
     */
    public ExecutionMode preferredMode() {
        boolean countOnly = metrics.stream().allMatch(m -> m.getFunction() == AggregateFunction.COUNT);
        return countOnly && !isGrouped() ? ExecutionMode.COUNT : ExecutionMode.ROWS;
    }
}
