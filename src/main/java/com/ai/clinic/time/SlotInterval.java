package com.ai.clinic.time;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Half-open interval [start, end) anchored in the clinic offset.
 */
public record SlotInterval(OffsetDateTime start, OffsetDateTime end) {

    public SlotInterval {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Slot start and end are required");
        }
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Slot end must be after start");
        }
    }

    public static SlotInterval of(OffsetDateTime start, Duration duration) {
        return new SlotInterval(start, start.plus(duration));
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public SlotInterval shift(Duration offset) {
        return new SlotInterval(start.plus(offset), end.plus(offset));
    }

    public boolean overlaps(OffsetDateTime otherStart, OffsetDateTime otherEnd) {
        return otherStart.isBefore(end) && otherEnd.isAfter(start);
    }
}
