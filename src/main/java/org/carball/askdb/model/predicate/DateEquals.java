package org.carball.askdb.model.predicate;

import lombok.Value;

/**
 * {@code DATE(col) = CURRENT_DATE [- INTERVAL 'N days']}.
 */
@Value
public class DateEquals implements ClassifiedPredicate {
    String rawText;
    String dateField;
    int relativeOffsetDays;

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitDateEquals(this);
    }
}
