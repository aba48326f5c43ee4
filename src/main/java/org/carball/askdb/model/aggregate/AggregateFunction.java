package org.carball.askdb.model.aggregate;

public enum AggregateFunction {
    COUNT,
    SUM
}
