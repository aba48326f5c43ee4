package org.carball.askdb.model.aggregate;

import lombok.Value;

@Value
public class Metric {
    AggregateFunction function;
    String field;

    public static Metric count() {
        return new Metric(AggregateFunction.COUNT, null);
    }

    public static Metric sum(String field) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("SUM needs a field");
        }
        return new Metric(AggregateFunction.SUM, field);
    }

    /**
     * Key under which the metric's value is stored in an {@link AggregateResult}.
     */
    public String getLabel() {
        return function == AggregateFunction.COUNT ? "count" : "sum(" + field + ")";
    }

    @Override
    public String toString() {
        return getLabel();
    }
}
