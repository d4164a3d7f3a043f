package com.ai.scheduler.config;

import lombok.Getter;
import lombok.Setter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Opening hours and holidays bound from {@code scheduler.business.*}.
 * Times are plain "HH:mm" strings, recurring holidays "MM-dd", one-off holidays ISO dates.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "scheduler.business")
public class BusinessRulesProperties {

    private static final DateTimeFormatter MONTH_DAY = DateTimeFormatter.ofPattern("MM-dd");

    private List<DayOfWeek> workingDays = new ArrayList<>(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY));
    private String open = "08:00";
    private String close = "17:00";
    private String lastStart = "16:30";
    private String lunchStart = "13:00";
    private String lunchEnd = "14:00";
    private int granularityMinutes = 30;
    private int defaultDurationMinutes = 30;
    private List<String> recurringHolidays = new ArrayList<>();
    private List<String> holidays = new ArrayList<>();

    public BusinessRules toBusinessRules() {
        Set<MonthDay> recurring = new HashSet<>();
        for (String value : recurringHolidays) {
            if (StringUtils.isNotBlank(value)) {
                recurring.add(MonthDay.parse(value.trim(), MONTH_DAY));
            }
        }
        Set<LocalDate> fixed = new HashSet<>();
        for (String value : holidays) {
            if (StringUtils.isNotBlank(value)) {
                fixed.add(LocalDate.parse(value.trim()));
            }
        }
        return BusinessRules.builder()
                .workingDays(workingDays.isEmpty() ? EnumSet.noneOf(DayOfWeek.class) : EnumSet.copyOf(workingDays))
                .open(LocalTime.parse(open))
                .close(LocalTime.parse(close))
                .lastStart(LocalTime.parse(lastStart))
                .lunchStart(LocalTime.parse(lunchStart))
                .lunchEnd(LocalTime.parse(lunchEnd))
                .granularityMinutes(granularityMinutes)
                .defaultDurationMinutes(defaultDurationMinutes)
                .recurringHolidays(recurring)
                .holidays(fixed)
                .build();
    }
}
