package org.carball.askdb.model.predicate;

import lombok.Value;

/**
 * Whole local days from {@code today - startOffsetDays} through {@code today - endOffsetDays}, both inclusive.
 */
@Value
public class DateRange implements ClassifiedPredicate {
    String rawText;
    String dateField;
    int startOffsetDays;
    int endOffsetDays;

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitDateRange(this);
    }
}
