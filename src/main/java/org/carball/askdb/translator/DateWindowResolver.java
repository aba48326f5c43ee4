package org.carball.askdb.translator;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Turns relative day offsets into absolute UTC windows. Business days start at local midnight
 * in the warehouse time zone while the store keeps UTC timestamps, so all day arithmetic
 * happens on local dates and only the boundaries are converted.
 */
@Slf4j
public class DateWindowResolver {

    private final Clock clock;
    private final int maxOffsetDays;

    public DateWindowResolver(Clock clock, int maxOffsetDays) {
        if (maxOffsetDays < 0) {
            throw new IllegalArgumentException("maxOffsetDays must not be negative: " + maxOffsetDays);
        }
        this.clock = clock;
        this.maxOffsetDays = maxOffsetDays;
    }

    /**
     * Reads the clock. Callers translating a whole clause call this once and pass the date on,
     * so every predicate of one request sees the same "today".
     */
    public LocalDate today(ZoneId zone) {
        return LocalDate.now(clock.withZone(zone));
    }

    public DateWindow resolve(int offsetDays, ZoneId zone) {
        return resolve(today(zone), offsetDays, zone);
    }

    /**
     * Local day {@code today - offsetDays}, from its midnight to the next one.
     */
    public DateWindow resolve(LocalDate today, int offsetDays, ZoneId zone) {
        checkOffset(offsetDays);
        LocalDate day = today.minusDays(offsetDays);
        return new DateWindow(
                day.atStartOfDay(zone).toInstant(),
                day.plusDays(1).atStartOfDay(zone).toInstant());
    }

    /**
     * Whole local days from {@code today - startOffsetDays} through {@code today - endOffsetDays}.
     */
    public DateWindow resolveRange(LocalDate today, int startOffsetDays, int endOffsetDays, ZoneId zone) {
        checkOffset(startOffsetDays);
        checkOffset(endOffsetDays);
        if (startOffsetDays < endOffsetDays) {
            throw new IllegalArgumentException("Range start offset " + startOffsetDays
                    + " lies after end offset " + endOffsetDays);
        }
        DateWindow first = resolve(today, startOffsetDays, zone);
        DateWindow last = resolve(today, endOffsetDays, zone);
        return new DateWindow(first.getStart(), last.getEndExclusive());
    }

    public int getMaxOffsetDays() {
        return maxOffsetDays;
    }

    private void checkOffset(int offsetDays) {
        if (offsetDays < 0 || offsetDays > maxOffsetDays) {
            log.debug("Rejecting day offset {} (max {})", offsetDays, maxOffsetDays);
            throw new DateWindowRangeException(offsetDays, maxOffsetDays);
        }
    }
}
