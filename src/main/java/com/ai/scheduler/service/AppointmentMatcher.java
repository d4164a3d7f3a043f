package com.ai.scheduler.service;

import com.ai.scheduler.entity.Appointment;
import com.ai.scheduler.repository.CalendarStore;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Locates the appointment a cancel or reschedule request refers to. A reference matches a title
 * when either contains the other, ignoring case; a null reference matches every title.
 */
@Service
public class AppointmentMatcher {

    public List<Appointment> match(CalendarStore store, String reference, LocalDate date, LocalTime time) {
        return store.listAll().stream()
                .filter(a -> titleMatches(a.getTitle(), reference))
                .filter(a -> date == null || a.getStart().toLocalDate().equals(date))
                .filter(a -> time == null || a.getStart().toLocalTime().equals(time))
                .collect(Collectors.toList());
    }

    static boolean titleMatches(String title, String reference) {
        if (StringUtils.isBlank(reference)) {
            return true;
        }
        if (title == null) {
            return false;
        }
        String t = title.toLowerCase().trim();
        String r = reference.toLowerCase().trim();
        return t.contains(r) || r.contains(t);
    }
}
