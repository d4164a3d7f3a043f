package com.ai.scheduler.service;

import com.ai.scheduler.component.ResponsePhrases;
import com.ai.scheduler.config.BusinessRules;
import com.ai.scheduler.dto.TurnOutcome;
import com.ai.scheduler.entity.Appointment;
import com.ai.scheduler.entity.RuleViolation;
import com.ai.scheduler.entity.TimeSlot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseFormatterTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 3);

    private final ResponseFormatter formatter = new ResponseFormatter(new ResponsePhrases(BusinessRules.defaults()));

    private static Appointment appointment(long id, String title, int hour) {
        LocalDateTime start = LocalDateTime.of(DAY, LocalTime.of(hour, 0));
        return new Appointment(id, title, start, start.plusMinutes(60));
    }

    @Test
    void bookedNamesTitleAndTime() {
        String text = formatter.format(TurnOutcome.booked(appointment(1, "dentist", 10)));

        assertThat(text).contains("\"dentist\"").contains("Tuesday 03 March at 10:00").contains("11:00");
    }

    @Test
    void conflictOfferNamesTheOverlapAndTheOffer() {
        TimeSlot requested = TimeSlot.of(DAY, LocalTime.of(10, 30), 30);
        TimeSlot offer = TimeSlot.of(DAY, LocalTime.of(11, 0), 30);

        String text = formatter.format(TurnOutcome.conflictOffer("call", requested, List.of(appointment(1, "standup", 10)), offer));

        assertThat(text).contains("standup").contains("at 11:00 to 11:30").endsWith("?");
    }

    @Test
    void invalidHoursNamesTheRuleAndTheOpeningHours() {
        TimeSlot early = TimeSlot.of(DAY, LocalTime.of(7, 0), 30);

        assertThat(formatter.format(TurnOutcome.invalidHours(early, RuleViolation.OUTSIDE_HOURS)))
                .contains("outside our opening hours")
                .contains("Monday to Friday, 08:00 to 17:00 (last start 16:30)");
        assertThat(formatter.format(TurnOutcome.invalidHours(early, RuleViolation.CROSSES_LUNCH)))
                .contains("lunch between 13:00 and 14:00");
        assertThat(formatter.format(TurnOutcome.invalidHours(early, RuleViolation.WEEKEND)))
                .contains("only schedule on Monday to Friday");
        assertThat(formatter.format(TurnOutcome.invalidHours(early, RuleViolation.STARTS_AFTER_LAST_SLOT)))
                .contains("latest appointment start is 16:30");
    }

    @Test
    void slotListShowsStartTimes() {
        List<TimeSlot> slots = List.of(TimeSlot.of(DAY, LocalTime.of(8, 0), 30), TimeSlot.of(DAY, LocalTime.of(8, 30), 30));

        assertThat(formatter.format(TurnOutcome.slotList(DAY, slots)))
                .contains("Tuesday 03 March").contains("08:00, 08:30");
    }

    @Test
    void noSlotsExplainsClosedDays() {
        assertThat(formatter.format(TurnOutcome.noSlots(LocalDate.of(2026, 7, 4), RuleViolation.HOLIDAY)))
                .contains("no available slots on Saturday 04 July").contains("holidays");
        assertThat(formatter.format(TurnOutcome.noSlots(DAY, null))).contains("Try another day");
    }

    @Test
    void listAndEmptyList() {
        String text = formatter.format(TurnOutcome.list(List.of(appointment(1, "a", 9), appointment(2, "b", 10)), null));

        assertThat(text).startsWith("You have 2 appointments:").contains("- a, Tuesday 03 March at 09:00 to 10:00");
        assertThat(formatter.format(TurnOutcome.list(List.of(), null))).contains("don't have any appointments");
        assertThat(formatter.format(TurnOutcome.list(List.of(), DAY))).contains("nothing booked on Tuesday 03 March");
    }

    @Test
    void rescheduledMentionsOldAndNewTimes() {
        String text = formatter.format(TurnOutcome.rescheduled(appointment(1, "review", 9), appointment(2, "review", 15)));

        assertThat(text).contains("from Tuesday 03 March at 09:00").contains("to Tuesday 03 March at 15:00");
    }

    @Test
    void clarifyAsksForDateAndTimeWhenThatIsWhatIsMissing() {
        assertThat(formatter.format(TurnOutcome.clarify(true))).contains("Which day and time");
        assertThat(formatter.format(TurnOutcome.clarify(false))).contains("didn't quite get that");
    }

    @Test
    void needNewTimeUsesTheTitle() {
        assertThat(formatter.format(TurnOutcome.of(TurnOutcome.Type.NEED_NEW_TIME, Map.of(TurnOutcome.TITLE, "gym"))))
                .contains("\"gym\"");
    }

    @ParameterizedTest
    @EnumSource(value = TurnOutcome.Type.class, names = {"GREETING", "SMALLTALK", "OUT_OF_SCOPE", "DECLINED",
            "SLOT_TAKEN", "NOT_FOUND", "NOTHING_PENDING"})
    void payloadFreeOutcomesAlwaysHaveText(TurnOutcome.Type type) {
        assertThat(formatter.format(TurnOutcome.of(type))).isNotBlank();
    }
}
