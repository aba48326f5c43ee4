package org.carball.askdb.validation;

import lombok.Value;
import org.carball.askdb.model.aggregate.AggregateResult;

import java.util.List;

/**
 * Sibling results of one question turn plus the relation that should hold between them.
 */
@Value
public class ConsistencyCheck {
    AggregateResult whole;
    List<AggregateResult> parts;
    ConsistencyRelation relation;
    String metricLabel;

    public ConsistencyCheck(AggregateResult whole, List<AggregateResult> parts,
                            ConsistencyRelation relation, String metricLabel) {
        if (whole == null || parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("A consistency check needs a whole and at least one part");
        }
        if (relation == ConsistencyRelation.AT_LEAST && parts.size() != 1) {
            throw new IllegalArgumentException("AT_LEAST compares the whole with exactly one part, got " + parts.size());
        }
        this.whole = whole;
        this.parts = List.copyOf(parts);
        this.relation = relation;
        this.metricLabel = metricLabel;
    }
}
