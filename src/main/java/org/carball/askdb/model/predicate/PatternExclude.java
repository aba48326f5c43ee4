package org.carball.askdb.model.predicate;

import lombok.Value;

/**
 * {@code (col IS NULL OR col NOT LIKE 'pattern')}: rows lacking the pattern, NULLs included.
 * One predicate, never two.
 */
@Value
public class PatternExclude implements ClassifiedPredicate {
    String rawText;
    String field;
    String pattern;

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitPatternExclude(this);
    }
}
