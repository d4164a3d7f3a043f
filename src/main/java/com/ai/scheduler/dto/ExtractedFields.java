package com.ai.scheduler.dto;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Booking fields returned by an external language-model parser.
 */
public record ExtractedFields(String title, LocalDate date, LocalTime time, Integer durationMinutes) {

    public boolean isComplete() {
        return title != null && !title.isBlank() && date != null && time != null
                && durationMinutes != null && durationMinutes > 0;
    }
}
