package org.carball.askdb.model.filter;

public enum Operator {
    GTE,
    LT,
    LIKE,
    NOT_LIKE,
    ILIKE,
    EQ,
    IS_NULL,
    OR;

    public boolean isCompound() {
        return this == OR;
    }
}
