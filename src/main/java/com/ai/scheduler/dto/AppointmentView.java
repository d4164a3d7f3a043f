package com.ai.scheduler.dto;

import com.ai.scheduler.entity.Appointment;

import java.time.LocalDateTime;

public record AppointmentView(Long id, String title, LocalDateTime start, LocalDateTime end) {

    public static AppointmentView from(Appointment appointment) {
        return new AppointmentView(appointment.getId(), appointment.getTitle(),
                appointment.getStart(), appointment.getEnd());
    }
}
