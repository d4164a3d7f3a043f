package com.ai.scheduler.config;

import lombok.Builder;
import lombok.Getter;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.MonthDay;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable opening-hours policy. Construction fails fast when the hours are inconsistent.
 */
@Getter
public final class BusinessRules {

    private final Set<DayOfWeek> workingDays;
    private final LocalTime open;
    private final LocalTime close;
    private final LocalTime lastStart;
    private final LocalTime lunchStart;
    private final LocalTime lunchEnd;
    private final Set<MonthDay> recurringHolidays;
    private final Set<LocalDate> holidays;
    private final int granularityMinutes;
    private final int defaultDurationMinutes;

    @Builder
    private BusinessRules(Set<DayOfWeek> workingDays, LocalTime open, LocalTime close, LocalTime lastStart,
                          LocalTime lunchStart, LocalTime lunchEnd, Set<MonthDay> recurringHolidays,
                          Set<LocalDate> holidays, int granularityMinutes, int defaultDurationMinutes) {
        if (workingDays == null || workingDays.isEmpty()) {
            throw new IllegalArgumentException("At least one working day is required");
        }
        if (open == null || close == null || lastStart == null || lunchStart == null || lunchEnd == null) {
            throw new IllegalArgumentException("open, close, last-start and lunch times are required");
        }
        if (!(open.isBefore(lunchStart) && lunchStart.isBefore(lunchEnd) && lunchEnd.isBefore(close))) {
            throw new IllegalArgumentException("Expected open < lunch start < lunch end < close but got "
                    + open + ", " + lunchStart + ", " + lunchEnd + ", " + close);
        }
        if (lastStart.isAfter(close) || lastStart.isBefore(open)) {
            throw new IllegalArgumentException("Last start " + lastStart + " must lie between " + open + " and " + close);
        }
        if (granularityMinutes <= 0) {
            throw new IllegalArgumentException("Slot granularity must be positive: " + granularityMinutes);
        }
        if (defaultDurationMinutes <= 0) {
            throw new IllegalArgumentException("Default duration must be positive: " + defaultDurationMinutes);
        }
        this.workingDays = Collections.unmodifiableSet(EnumSet.copyOf(workingDays));
        this.open = open;
        this.close = close;
        this.lastStart = lastStart;
        this.lunchStart = lunchStart;
        this.lunchEnd = lunchEnd;
        this.recurringHolidays = recurringHolidays == null ? Set.of() : Set.copyOf(recurringHolidays);
        this.holidays = holidays == null ? Set.of() : Set.copyOf(holidays);
        this.granularityMinutes = granularityMinutes;
        this.defaultDurationMinutes = defaultDurationMinutes;
    }

    public boolean isWorkingDay(LocalDate date) {
        return workingDays.contains(date.getDayOfWeek());
    }

    public boolean isHoliday(LocalDate date) {
        return holidays.contains(date) || recurringHolidays.contains(MonthDay.from(date));
    }

    /** Mon–Fri, 08:00–17:00, last start 16:30, lunch 13:00–14:00, 30 minute slots. */
    public static BusinessRules defaults() {
        return builder()
                .workingDays(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY))
                .open(LocalTime.of(8, 0))
                .close(LocalTime.of(17, 0))
                .lastStart(LocalTime.of(16, 30))
                .lunchStart(LocalTime.of(13, 0))
                .lunchEnd(LocalTime.of(14, 0))
                .recurringHolidays(Set.of(
                        MonthDay.of(1, 1), MonthDay.of(5, 27), MonthDay.of(7, 4), MonthDay.of(9, 2),
                        MonthDay.of(11, 27), MonthDay.of(11, 28), MonthDay.of(12, 25)))
                .granularityMinutes(30)
                .defaultDurationMinutes(30)
                .build();
    }
}
