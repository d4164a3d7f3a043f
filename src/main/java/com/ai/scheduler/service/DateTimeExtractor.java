package com.ai.scheduler.service;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls dates, clock times and durations out of free text. Input is expected lower-cased.
 * <p>
 * Date precedence: relative words and weekday names, then month names, then numeric M/D[/Y].
 * A number is only a time when it carries am/pm or a colon.
 */
@Component
public class DateTimeExtractor {

    static final int MAX_DURATION_MINUTES = 24 * 60;

    private static final Pattern DAY_AFTER_TOMORROW = Pattern.compile("\\bday after tomorrow\\b");
    private static final Pattern TOMORROW = Pattern.compile("\\b(tomorrow|tmrw|tmr)\\b");
    private static final Pattern TODAY = Pattern.compile("\\b(today|tonight|this afternoon|this morning)\\b");
    private static final Pattern WEEKDAY = Pattern.compile(
            "\\b(monday|tuesday|tues|wednesday|weds|thursday|thurs|friday|saturday|sunday)\\b");

    private static final String MONTHS =
            "(january|february|march|april|may|june|july|august|september|october|november|december"
                    + "|jan|feb|mar|apr|jun|jul|aug|sept|sep|oct|nov|dec)";
    private static final Pattern MONTH_DAY = Pattern.compile(
            "\\b" + MONTHS + "\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?\\b(?:,?\\s+(\\d{4})\\b)?");
    private static final Pattern DAY_OF_MONTH = Pattern.compile(
            "\\b(?:the\\s+)?(\\d{1,2})(?:st|nd|rd|th)?\\s+(?:of\\s+)?" + MONTHS + "\\b(?:,?\\s+(\\d{4})\\b)?");

    private static final Pattern NUMERIC_FULL = Pattern.compile("\\b(\\d{1,2})/(\\d{1,2})/(\\d{4}|\\d{2})\\b");
    private static final Pattern NUMERIC_SHORT = Pattern.compile("\\b(\\d{1,2})/(\\d{1,2})\\b");

    private static final Pattern TIME_AM_PM = Pattern.compile(
            "\\b(\\d{1,2})(?::([0-5]\\d))?\\s*([ap])\\.?\\s?m\\b\\.?");
    private static final Pattern TIME_COLON = Pattern.compile("\\b(\\d{1,2}):([0-5]\\d)\\b");
    private static final Pattern NOON = Pattern.compile("\\bnoon\\b|\\bmidday\\b");
    private static final Pattern MIDNIGHT = Pattern.compile("\\bmidnight\\b");

    private static final Pattern HOURS = Pattern.compile("\\b(\\d+(?:\\.\\d+)?)\\s*(?:hours?|hrs?|h)\\b");
    private static final Pattern MINUTES = Pattern.compile("\\b(\\d+)\\s*(?:minutes?|mins?)\\b");
    private static final Pattern HOUR_AND_A_HALF = Pattern.compile("\\b(?:an?|one)\\s+hour\\s+and\\s+a\\s+half\\b");
    private static final Pattern HALF_HOUR = Pattern.compile("\\b(?:half an hour|half hour)\\b");
    private static final Pattern ONE_HOUR = Pattern.compile("\\b(?:an|one)\\s+hour\\b");

    private static final Map<String, Integer> MONTH_NUMBERS = Map.ofEntries(
            Map.entry("january", 1), Map.entry("jan", 1),
            Map.entry("february", 2), Map.entry("feb", 2),
            Map.entry("march", 3), Map.entry("mar", 3),
            Map.entry("april", 4), Map.entry("apr", 4),
            Map.entry("may", 5),
            Map.entry("june", 6), Map.entry("jun", 6),
            Map.entry("july", 7), Map.entry("jul", 7),
            Map.entry("august", 8), Map.entry("aug", 8),
            Map.entry("september", 9), Map.entry("sept", 9), Map.entry("sep", 9),
            Map.entry("october", 10), Map.entry("oct", 10),
            Map.entry("november", 11), Map.entry("nov", 11),
            Map.entry("december", 12), Map.entry("dec", 12));

    private static final Map<String, DayOfWeek> WEEKDAYS = Map.ofEntries(
            Map.entry("monday", DayOfWeek.MONDAY),
            Map.entry("tuesday", DayOfWeek.TUESDAY), Map.entry("tues", DayOfWeek.TUESDAY),
            Map.entry("wednesday", DayOfWeek.WEDNESDAY), Map.entry("weds", DayOfWeek.WEDNESDAY),
            Map.entry("thursday", DayOfWeek.THURSDAY), Map.entry("thurs", DayOfWeek.THURSDAY),
            Map.entry("friday", DayOfWeek.FRIDAY),
            Map.entry("saturday", DayOfWeek.SATURDAY),
            Map.entry("sunday", DayOfWeek.SUNDAY));

    public Optional<LocalDate> extractDate(String text, LocalDate today) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        if (DAY_AFTER_TOMORROW.matcher(text).find()) {
            return Optional.of(today.plusDays(2));
        }
        if (TOMORROW.matcher(text).find()) {
            return Optional.of(today.plusDays(1));
        }
        if (TODAY.matcher(text).find()) {
            return Optional.of(today);
        }
        Matcher weekday = WEEKDAY.matcher(text);
        if (weekday.find()) {
            // a bare weekday always means the next one, never today
            return Optional.of(today.with(TemporalAdjusters.next(WEEKDAYS.get(weekday.group(1)))));
        }

        Matcher monthDay = MONTH_DAY.matcher(text);
        if (monthDay.find()) {
            return calendarDate(MONTH_NUMBERS.get(monthDay.group(1)), Integer.parseInt(monthDay.group(2)),
                    monthDay.group(3), today);
        }
        Matcher dayOfMonth = DAY_OF_MONTH.matcher(text);
        if (dayOfMonth.find()) {
            return calendarDate(MONTH_NUMBERS.get(dayOfMonth.group(2)), Integer.parseInt(dayOfMonth.group(1)),
                    dayOfMonth.group(3), today);
        }

        Matcher full = NUMERIC_FULL.matcher(text);
        if (full.find()) {
            String year = full.group(3).length() == 2 ? "20" + full.group(3) : full.group(3);
            return numericDate(Integer.parseInt(full.group(1)), Integer.parseInt(full.group(2)), year, today);
        }
        Matcher shortDate = NUMERIC_SHORT.matcher(text);
        if (shortDate.find()) {
            return numericDate(Integer.parseInt(shortDate.group(1)), Integer.parseInt(shortDate.group(2)), null, today);
        }
        return Optional.empty();
    }

    public Optional<LocalTime> extractTime(String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        Matcher amPm = TIME_AM_PM.matcher(text);
        while (amPm.find()) {
            int hour = Integer.parseInt(amPm.group(1));
            int minute = amPm.group(2) == null ? 0 : Integer.parseInt(amPm.group(2));
            if (hour < 1 || hour > 12) {
                continue;
            }
            boolean pm = "p".equals(amPm.group(3));
            if (hour == 12) {
                hour = pm ? 12 : 0;
            } else if (pm) {
                hour += 12;
            }
            return Optional.of(LocalTime.of(hour, minute));
        }
        Matcher colon = TIME_COLON.matcher(text);
        while (colon.find()) {
            int hour = Integer.parseInt(colon.group(1));
            if (hour <= 23) {
                return Optional.of(LocalTime.of(hour, Integer.parseInt(colon.group(2))));
            }
        }
        if (NOON.matcher(text).find()) {
            return Optional.of(LocalTime.NOON);
        }
        if (MIDNIGHT.matcher(text).find()) {
            return Optional.of(LocalTime.MIDNIGHT);
        }
        return Optional.empty();
    }

    /**
     * Removes every time expression, used to judge whether a reply is just a time.
     */
    public String stripTimes(String text) {
        String out = TIME_AM_PM.matcher(text).replaceAll(" ");
        out = TIME_COLON.matcher(out).replaceAll(" ");
        out = NOON.matcher(out).replaceAll(" ");
        out = MIDNIGHT.matcher(out).replaceAll(" ");
        return StringUtils.normalizeSpace(out);
    }

    /**
     * Total minutes named in the text ("1 hour 30 minutes" is 90), or null when none or longer than a day.
     */
    public Integer extractDuration(String text) {
        long total = totalMinutes(text);
        return total > 0 && total <= MAX_DURATION_MINUTES ? (int) total : null;
    }

    public boolean exceedsMaxDuration(String text) {
        return totalMinutes(text) > MAX_DURATION_MINUTES;
    }

    private static long totalMinutes(String text) {
        if (StringUtils.isBlank(text)) {
            return 0;
        }
        long total = 0;
        boolean found = false;
        Matcher hours = HOURS.matcher(text);
        while (hours.find()) {
            total += Math.round(Double.parseDouble(hours.group(1)) * 60);
            found = true;
        }
        Matcher minutes = MINUTES.matcher(text);
        while (minutes.find()) {
            total += Long.parseLong(minutes.group(1));
            found = true;
        }
        if (!found) {
            if (HOUR_AND_A_HALF.matcher(text).find()) {
                total = 90;
            } else if (HALF_HOUR.matcher(text).find()) {
                total = 30;
            } else if (ONE_HOUR.matcher(text).find()) {
                total = 60;
            }
        }
        return total;
    }

    private static Optional<LocalDate> calendarDate(int month, int day, String year, LocalDate today) {
        if (year != null) {
            return validDate(Integer.parseInt(year), month, day);
        }
        Optional<LocalDate> date = validDate(today.getYear(), month, day);
        if (date.isPresent() && date.get().isBefore(today)) {
            return validDate(today.getYear() + 1, month, day);
        }
        return date;
    }

    private static Optional<LocalDate> numericDate(int first, int second, String year, LocalDate today) {
        int month = first;
        int day = second;
        if (first > 12 && second <= 12) {
            month = second;
            day = first;
        }
        return calendarDate(month, day, year, today);
    }

    private static Optional<LocalDate> validDate(int year, int month, int day) {
        if (month < 1 || month > 12 || day < 1) {
            return Optional.empty();
        }
        if (day > YearMonth.of(year, month).lengthOfMonth()) {
            return Optional.empty();
        }
        return Optional.of(LocalDate.of(year, month, day));
    }
}
