package org.carball.askdb.model.query;

import lombok.Value;

/**
 * One atomic condition cut out of a WHERE clause by a top-level AND split.
 */
@Value
public class RawCondition {
    String text;
    int position;

    @Override
    public String toString() {
        return text;
    }
}
