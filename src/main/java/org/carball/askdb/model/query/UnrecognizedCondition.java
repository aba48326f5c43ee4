package org.carball.askdb.model.query;

import lombok.Value;
import org.carball.askdb.model.predicate.UnrecognizedReason;

@Value
public class UnrecognizedCondition {
    String text;
    UnrecognizedReason reason;
}
