package com.ai.scheduler.service;

import com.ai.scheduler.component.ResponsePhrases;
import com.ai.scheduler.dto.TurnOutcome;
import com.ai.scheduler.entity.Appointment;
import com.ai.scheduler.entity.RuleViolation;
import com.ai.scheduler.entity.TimeSlot;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Converts a structured {@link TurnOutcome} into the assistant's reply.
 * No flow logic, only type + payload to sentence.
 */
@Service
public class ResponseFormatter {

    static final DateTimeFormatter WHEN = DateTimeFormatter.ofPattern("EEEE dd MMMM 'at' HH:mm", Locale.ENGLISH);
    static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("EEEE dd MMMM", Locale.ENGLISH);
    static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm", Locale.ENGLISH);

    private final ResponsePhrases phrases;

    public ResponseFormatter(ResponsePhrases phrases) {
        this.phrases = phrases;
    }

    public String format(TurnOutcome outcome) {
        if (outcome == null)
            return "";
        switch (outcome.getType()) {
            case GREETING:
                return phrases.greeting();
            case SMALLTALK:
                return phrases.smalltalk();
            case OUT_OF_SCOPE:
                return phrases.outOfScope();
            case CLARIFY:
                return outcome.getFlag(TurnOutcome.MISSING_DATE_TIME) ? phrases.askDateAndTime() : phrases.clarify();
            case LIST:
                return formatList(outcome);
            case BOOKED: {
                Appointment a = outcome.getAppointment();
                return phrases.booked(a.getTitle(), when(a.getStart()), time(a.getEnd()));
            }
            case CONFIRMED: {
                Appointment a = outcome.getAppointment();
                return phrases.confirmed(a.getTitle(), when(a.getStart()), time(a.getEnd()));
            }
            case CONFLICT_OFFER: {
                TimeSlot offer = outcome.getSlot();
                return phrases.conflictOffer(titles(outcome.getAppointments()), when(offer.start()), time(offer.end()));
            }
            case NO_ALTERNATIVE:
                return phrases.noAlternative(titles(outcome.getAppointments()), day(outcome.getDate()));
            case DECLINED:
                return phrases.declined();
            case SLOT_LIST:
                return phrases.slotList(day(outcome.getDate()), slotTimes(outcome.getSlots()));
            case SLOT_REPROMPT:
                return phrases.slotReprompt(day(outcome.getDate()), slotTimes(outcome.getSlots()));
            case SLOT_TAKEN:
                return phrases.slotTaken();
            case NO_SLOTS:
                if (outcome.getViolation() != null)
                    return phrases.noSlotsClosed(day(outcome.getDate()), reason(outcome.getViolation()));
                return phrases.noSlotsFullyBooked(day(outcome.getDate()));
            case INVALID_HOURS:
                return reason(outcome.getViolation()) + " " + phrases.hoursSummary();
            case AMBIGUOUS_MATCH:
                return phrases.ambiguous(outcome.getString(TurnOutcome.REFERENCE), listing(outcome.getAppointments()));
            case NOT_FOUND:
                return phrases.notFound();
            case CANCELLED: {
                Appointment a = outcome.getAppointment();
                return phrases.cancelled(a.getTitle(), when(a.getStart()));
            }
            case RESCHEDULED: {
                Appointment previous = (Appointment) outcome.getPayload().get(TurnOutcome.PREVIOUS);
                Appointment a = outcome.getAppointment();
                return phrases.rescheduled(a.getTitle(), when(previous.getStart()), when(a.getStart()), time(a.getEnd()));
            }
            case NEED_NEW_TIME:
                return phrases.needNewTime(outcome.getString(TurnOutcome.TITLE));
            case NOTHING_PENDING:
                return phrases.nothingPending();
            default:
                return phrases.clarify();
        }
    }

    String reason(RuleViolation violation) {
        if (violation == null)
            return phrases.outsideHours();
        switch (violation) {
            case WEEKEND:
                return phrases.weekend();
            case HOLIDAY:
                return phrases.holiday();
            case STARTS_AFTER_LAST_SLOT:
                return phrases.startsAfterLastSlot();
            case CROSSES_LUNCH:
                return phrases.crossesLunch();
            case OUTSIDE_HOURS:
            default:
                return phrases.outsideHours();
        }
    }

    private String formatList(TurnOutcome outcome) {
        List<Appointment> appointments = outcome.getAppointments();
        LocalDate date = outcome.getDate();
        if (appointments.isEmpty()) {
            return date != null ? phrases.noAppointmentsOn(day(date)) : phrases.noAppointments();
        }
        return listing(appointments);
    }

    private String listing(List<Appointment> appointments) {
        if (appointments.isEmpty())
            return phrases.noAppointments();
        StringBuilder sb = new StringBuilder(phrases.listHeader(appointments.size()));
        for (Appointment a : appointments) {
            sb.append('\n').append(phrases.listLine(a.getTitle(), when(a.getStart()), time(a.getEnd())));
        }
        return sb.toString();
    }

    private static String titles(List<Appointment> appointments) {
        return appointments.stream()
                .map(a -> "\"" + a.getTitle() + "\" (" + time(a.getStart()) + "-" + time(a.getEnd()) + ")")
                .collect(Collectors.joining(", "));
    }

    private static String slotTimes(List<TimeSlot> slots) {
        return slots.stream().map(s -> time(s.start())).collect(Collectors.joining(", "));
    }

    private static String when(LocalDateTime dateTime) {
        return dateTime.format(WHEN);
    }

    private static String day(LocalDate date) {
        return date == null ? "that day" : date.format(DAY);
    }

    private static String time(LocalDateTime dateTime) {
        return dateTime.format(TIME);
    }
}
