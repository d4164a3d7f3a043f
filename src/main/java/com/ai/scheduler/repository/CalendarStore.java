package com.ai.scheduler.repository;

import com.ai.scheduler.config.BusinessRules;
import com.ai.scheduler.entity.Appointment;
import com.ai.scheduler.entity.BusinessHoursCheck;
import com.ai.scheduler.entity.RuleViolation;
import com.ai.scheduler.entity.TimeSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory appointment book for a single session. Appointments are kept ordered by start.
 * {@link #add} does not validate; callers check hours and conflicts first.
 */
public class CalendarStore {

    private static final Logger log = LoggerFactory.getLogger(CalendarStore.class);

    private static final Comparator<Appointment> BY_START =
            Comparator.comparing(Appointment::getStart).thenComparing(Appointment::getId);

    private final BusinessRules rules;
    private final List<Appointment> appointments = new ArrayList<>();
    private final AtomicLong idSequence = new AtomicLong();

    public CalendarStore(BusinessRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public BusinessRules getRules() {
        return rules;
    }

    public BusinessHoursCheck checkBusinessHours(TimeSlot slot) {
        LocalDate date = slot.date();
        if (!rules.isWorkingDay(date)) {
            return BusinessHoursCheck.invalid(RuleViolation.WEEKEND);
        }
        if (rules.isHoliday(date)) {
            return BusinessHoursCheck.invalid(RuleViolation.HOLIDAY);
        }
        if (!slot.end().toLocalDate().equals(date)) {
            return BusinessHoursCheck.invalid(RuleViolation.OUTSIDE_HOURS);
        }
        LocalTime start = slot.start().toLocalTime();
        LocalTime end = slot.end().toLocalTime();
        if (start.isBefore(rules.getOpen()) || end.isAfter(rules.getClose())) {
            return BusinessHoursCheck.invalid(RuleViolation.OUTSIDE_HOURS);
        }
        if (start.isAfter(rules.getLastStart())) {
            return BusinessHoursCheck.invalid(RuleViolation.STARTS_AFTER_LAST_SLOT);
        }
        if (start.isBefore(rules.getLunchEnd()) && end.isAfter(rules.getLunchStart())) {
            return BusinessHoursCheck.invalid(RuleViolation.CROSSES_LUNCH);
        }
        return BusinessHoursCheck.ok();
    }

    public List<Appointment> findConflicts(TimeSlot slot) {
        return findConflicts(slot, null);
    }

    /**
     * Appointments overlapping {@code slot}, skipping {@code ignoreId} (the appointment being moved).
     */
    public List<Appointment> findConflicts(TimeSlot slot, Long ignoreId) {
        return appointments.stream()
                .filter(a -> ignoreId == null || !ignoreId.equals(a.getId()))
                .filter(a -> a.getSlot().overlaps(slot))
                .collect(Collectors.toList());
    }

    public Appointment add(String title, TimeSlot slot) {
        Appointment appointment = new Appointment(idSequence.incrementAndGet(), title, slot.start(), slot.end());
        appointments.add(appointment);
        appointments.sort(BY_START);
        log.debug("Added appointment: id={} title='{}' {} - {}", appointment.getId(), title, slot.start(), slot.end());
        return appointment;
    }

    public boolean remove(Long id) {
        boolean removed = appointments.removeIf(a -> a.getId().equals(id));
        if (removed) {
            log.debug("Removed appointment id={}", id);
        }
        return removed;
    }

    public Optional<Appointment> findById(Long id) {
        return appointments.stream().filter(a -> a.getId().equals(id)).findFirst();
    }

    public List<TimeSlot> getAvailableSlots(LocalDate date, int durationMinutes) {
        return getAvailableSlots(date, durationMinutes, null);
    }

    public List<TimeSlot> getAvailableSlots(LocalDate date, int durationMinutes, Long ignoreId) {
        List<TimeSlot> slots = new ArrayList<>();
        if (durationMinutes <= 0) {
            return slots;
        }
        LocalDateTime last = LocalDateTime.of(date, rules.getLastStart());
        for (LocalDateTime t = LocalDateTime.of(date, rules.getOpen());
             !t.isAfter(last);
             t = t.plusMinutes(rules.getGranularityMinutes())) {
            TimeSlot candidate = TimeSlot.of(t, durationMinutes);
            if (checkBusinessHours(candidate).valid() && findConflicts(candidate, ignoreId).isEmpty()) {
                slots.add(candidate);
            }
        }
        return slots;
    }

    public List<Appointment> listAll() {
        return List.copyOf(appointments);
    }

    public List<Appointment> listOn(LocalDate date) {
        return appointments.stream()
                .filter(a -> a.getStart().toLocalDate().equals(date))
                .collect(Collectors.toList());
    }

    public int size() {
        return appointments.size();
    }
}
