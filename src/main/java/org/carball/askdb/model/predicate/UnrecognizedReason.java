package org.carball.askdb.model.predicate;

public enum UnrecognizedReason {
    UNSUPPORTED_SHAPE,
    SCHEMA_MISMATCH,
    OFFSET_OUT_OF_RANGE
}
