package io.github.filtersql.core.date;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Inclusive instant range. Ranges produced by {@link RelativeDateResolver} start at
 * {@code 00:00:00} and end at {@code 23:59:59.999999} of calendar days in the reference time zone.
 *
 * @param start first instant of the range
 * @param end   last instant of the range
 */
public record DateRange(Instant start, Instant end) {

    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public Duration duration() {
        return Duration.between(start, end);
    }
}
