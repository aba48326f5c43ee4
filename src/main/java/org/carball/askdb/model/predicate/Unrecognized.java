package org.carball.askdb.model.predicate;

import lombok.Value;

/**
 * Terminal state for conditions the engine will not translate. Never an error.
 */
@Value
public class Unrecognized implements ClassifiedPredicate {
    String rawText;
    UnrecognizedReason reason;

    public static Unrecognized unsupported(String rawText) {
        return new Unrecognized(rawText, UnrecognizedReason.UNSUPPORTED_SHAPE);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUnrecognized(this);
    }
}
