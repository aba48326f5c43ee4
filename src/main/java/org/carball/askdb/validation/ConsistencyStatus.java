package org.carball.askdb.validation;

public enum ConsistencyStatus {
    CONSISTENT,
    VIOLATED
}
