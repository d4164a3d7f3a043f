package com.ai.scheduler.entity;

import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

@Getter
@ToString
public class Appointment {

    private final Long id;
    private final String title;
    private final LocalDateTime start;
    private final LocalDateTime end;

    public Appointment(Long id, String title, LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null || !end.isAfter(start)) {
            throw new IllegalArgumentException("Appointment must end after it starts: " + start + " - " + end);
        }
        this.id = id;
        this.title = title;
        this.start = start;
        this.end = end;
    }

    public TimeSlot getSlot() {
        return new TimeSlot(start, end);
    }

    public int getDurationMinutes() {
        return getSlot().durationMinutes();
    }
}
