package org.carball.askdb.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

/**
 * Advisory result of a consistency check. A violation flags the answer, it never replaces it.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConsistencyOutcome {
    ConsistencyStatus status;
    ConsistencyRelation relation;
    String metricLabel;
    String detail;

    public static ConsistencyOutcome consistent(ConsistencyRelation relation, String metricLabel) {
        return new ConsistencyOutcome(ConsistencyStatus.CONSISTENT, relation, metricLabel, null);
    }

    public static ConsistencyOutcome violated(ConsistencyRelation relation, String metricLabel, String detail) {
        return new ConsistencyOutcome(ConsistencyStatus.VIOLATED, relation, metricLabel, detail);
    }

    @JsonIgnore
    public boolean isConsistent() {
        return status == ConsistencyStatus.CONSISTENT;
    }
}
