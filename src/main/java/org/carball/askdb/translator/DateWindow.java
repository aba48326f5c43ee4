package org.carball.askdb.translator;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open interval {@code [start, endExclusive)} in UTC.
 */
@Value
public class DateWindow {
    Instant start;
    Instant endExclusive;

    public Duration length() {
        return Duration.between(start, endExclusive);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(endExclusive);
    }
}
