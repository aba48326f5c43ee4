package org.carball.askdb.translator;

import lombok.Getter;

/**
 * Thrown when a relative day offset lies outside the configured bound. Offsets are never clamped.
 */
@Getter
public class DateWindowRangeException extends IllegalArgumentException {

    private final int offsetDays;
    private final int maxOffsetDays;

    public DateWindowRangeException(int offsetDays, int maxOffsetDays) {
        super("Day offset " + offsetDays + " is outside the allowed range 0.." + maxOffsetDays);
        this.offsetDays = offsetDays;
        this.maxOffsetDays = maxOffsetDays;
    }
}
