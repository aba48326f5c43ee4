package org.carball.askdb.model.predicate;

import lombok.Value;

@Value
public class PatternInclude implements ClassifiedPredicate {
    String rawText;
    String field;
    String pattern;

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitPatternInclude(this);
    }
}
