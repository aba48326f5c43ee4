package org.carball.askdb.model.aggregate;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Group key to metric label to value. Ungrouped results hold the single key {@link #ALL}.
 */
@Value
public class AggregateResult {

    public static final String ALL = "ALL";
    public static final String NULL_GROUP = "null";

    String groupBy;
    Map<String, Map<String, BigDecimal>> groups;

    public AggregateResult(String groupBy, Map<String, Map<String, BigDecimal>> groups) {
        this.groupBy = groupBy;
        Map<String, Map<String, BigDecimal>> copy = new LinkedHashMap<>();
        groups.forEach((key, values) -> copy.put(key, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
        this.groups = Collections.unmodifiableMap(copy);
    }

    public static AggregateResult ungrouped(Map<String, BigDecimal> values) {
        return new AggregateResult(null, Map.of(ALL, values));
    }

    public boolean isGrouped() {
        return groupBy != null;
    }

    public BigDecimal getValue(String groupKey, String metricLabel) {
        Map<String, BigDecimal> values = groups.get(groupKey);
        return values == null ? null : values.get(metricLabel);
    }

    /**
     * Metric value summed over every group; for ungrouped results this is the value itself.
     */
    public BigDecimal getTotal(String metricLabel) {
        BigDecimal total = BigDecimal.ZERO;
        for (Map<String, BigDecimal> values : groups.values()) {
            BigDecimal value = values.get(metricLabel);
            if (value != null) {
                total = total.add(value);
            }
        }
        return total;
    }
}
