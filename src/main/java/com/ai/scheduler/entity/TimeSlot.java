package com.ai.scheduler.entity;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Half-open interval {@code [start, end)}.
 */
public record TimeSlot(LocalDateTime start, LocalDateTime end) {

    public TimeSlot {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Slot start and end are required");
        }
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Slot end " + end + " must be after start " + start);
        }
    }

    public static TimeSlot of(LocalDate date, LocalTime time, int durationMinutes) {
        LocalDateTime start = LocalDateTime.of(date, time);
        return new TimeSlot(start, start.plusMinutes(durationMinutes));
    }

    public static TimeSlot of(LocalDateTime start, int durationMinutes) {
        return new TimeSlot(start, start.plusMinutes(durationMinutes));
    }

    public boolean overlaps(TimeSlot other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public int durationMinutes() {
        return (int) Duration.between(start, end).toMinutes();
    }

    public LocalDate date() {
        return start.toLocalDate();
    }
}
