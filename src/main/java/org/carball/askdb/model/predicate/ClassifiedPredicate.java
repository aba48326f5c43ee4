package org.carball.askdb.model.predicate;

/**
 * Result of classifying one atomic condition. The set of kinds is closed: every
 * consumer goes through {@link Visitor}, so a new kind fails compilation until each
 * consumer handles it.
 */
public interface ClassifiedPredicate {

    String getRawText();

    <R> R accept(Visitor<R> visitor);

    default boolean isRecognized() {
        return !(this instanceof Unrecognized);
    }

    interface Visitor<R> {
        R visitDateEquals(DateEquals predicate);

        R visitDateRange(DateRange predicate);

        R visitPatternExclude(PatternExclude predicate);

        R visitPatternInclude(PatternInclude predicate);

        R visitCaseInsensitiveEquals(CaseInsensitiveEquals predicate);

        R visitExactEquals(ExactEquals predicate);

        R visitUnrecognized(Unrecognized predicate);
    }
}
