package org.carball.askdb.model.predicate;

import lombok.Value;

@Value
public class ExactEquals implements ClassifiedPredicate {
    String rawText;
    String field;
    String value;

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitExactEquals(this);
    }
}
