package org.carball.askdb.validation;

public enum ConsistencyRelation {
    /** whole = part1 + part2 + ... for disjoint parts */
    SUM_OF_PARTS,
    /** whole >= part */
    AT_LEAST
}
