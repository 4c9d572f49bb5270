package com.ai.clinic.dto;

import com.ai.clinic.time.SlotInterval;
import com.ai.clinic.time.TemporalNormalizer;

import java.time.format.DateTimeFormatter;

/**
 * A candidate slot as shown to the caller.
 */
public record SlotView(String date, String time, String start, String end) {

    public static SlotView from(SlotInterval slot) {
        return new SlotView(
                TemporalNormalizer.formatDate(slot.start().toLocalDate()),
                TemporalNormalizer.formatTime(slot.start().toLocalTime()),
                slot.start().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                slot.end().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
    }

    public String label() {
        return date + " at " + time;
    }
}
