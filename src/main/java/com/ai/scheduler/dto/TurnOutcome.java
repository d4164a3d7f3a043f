package com.ai.scheduler.dto;

import com.ai.scheduler.entity.Appointment;
import com.ai.scheduler.entity.RuleViolation;
import com.ai.scheduler.entity.TimeSlot;

import java.time.LocalDate;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured result of one turn. No conversational text, only type and payload;
 * {@code ResponseFormatter} turns it into a reply.
 */
public final class TurnOutcome {

    public enum Type {
        GREETING,
        SMALLTALK,
        OUT_OF_SCOPE,
        CLARIFY,
        LIST,
        BOOKED,
        CONFLICT_OFFER,
        NO_ALTERNATIVE,
        CONFIRMED,
        DECLINED,
        SLOT_LIST,
        NO_SLOTS,
        SLOT_REPROMPT,
        SLOT_TAKEN,
        INVALID_HOURS,
        AMBIGUOUS_MATCH,
        NOT_FOUND,
        CANCELLED,
        RESCHEDULED,
        NEED_NEW_TIME,
        NOTHING_PENDING
    }

    public static final String TITLE = "title";
    public static final String SLOT = "slot";
    public static final String SLOTS = "slots";
    public static final String DATE = "date";
    public static final String APPOINTMENT = "appointment";
    public static final String APPOINTMENTS = "appointments";
    public static final String VIOLATION = "violation";
    public static final String REFERENCE = "reference";
    public static final String PREVIOUS = "previous";
    public static final String MISSING_DATE_TIME = "missingDateTime";

    private final Type type;
    private final Map<String, Object> payload;

    private TurnOutcome(Type type, Map<String, Object> payload) {
        this.type = type;
        this.payload = payload == null ? Collections.emptyMap() : new HashMap<>(payload);
    }

    public Type getType() {
        return type;
    }

    public Map<String, Object> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    public String getString(String key) {
        Object v = payload.get(key);
        return v == null ? null : v.toString();
    }

    public TimeSlot getSlot() {
        return (TimeSlot) payload.get(SLOT);
    }

    @SuppressWarnings("unchecked")
    public List<TimeSlot> getSlots() {
        Object v = payload.get(SLOTS);
        return v == null ? List.of() : (List<TimeSlot>) v;
    }

    public Appointment getAppointment() {
        return (Appointment) payload.get(APPOINTMENT);
    }

    @SuppressWarnings("unchecked")
    public List<Appointment> getAppointments() {
        Object v = payload.get(APPOINTMENTS);
        return v == null ? List.of() : (List<Appointment>) v;
    }

    public LocalDate getDate() {
        return (LocalDate) payload.get(DATE);
    }

    public RuleViolation getViolation() {
        return (RuleViolation) payload.get(VIOLATION);
    }

    public boolean getFlag(String key) {
        return Boolean.TRUE.equals(payload.get(key));
    }

    public static TurnOutcome of(Type type) {
        return new TurnOutcome(type, null);
    }

    public static TurnOutcome of(Type type, Map<String, Object> payload) {
        return new TurnOutcome(type, payload);
    }

    public static TurnOutcome booked(Appointment appointment) {
        return new TurnOutcome(Type.BOOKED, Map.of(APPOINTMENT, appointment));
    }

    public static TurnOutcome confirmed(Appointment appointment) {
        return new TurnOutcome(Type.CONFIRMED, Map.of(APPOINTMENT, appointment));
    }

    public static TurnOutcome rescheduled(Appointment previous, Appointment appointment) {
        return new TurnOutcome(Type.RESCHEDULED, Map.of(PREVIOUS, previous, APPOINTMENT, appointment));
    }

    public static TurnOutcome cancelled(Appointment appointment) {
        return new TurnOutcome(Type.CANCELLED, Map.of(APPOINTMENT, appointment));
    }

    public static TurnOutcome conflictOffer(String title, TimeSlot requested, List<Appointment> conflicts, TimeSlot offer) {
        Map<String, Object> p = new HashMap<>();
        p.put(TITLE, title);
        p.put(DATE, requested.date());
        p.put(APPOINTMENTS, List.copyOf(conflicts));
        p.put(SLOT, offer);
        return new TurnOutcome(Type.CONFLICT_OFFER, p);
    }

    public static TurnOutcome noAlternative(TimeSlot requested, List<Appointment> conflicts) {
        return new TurnOutcome(Type.NO_ALTERNATIVE, Map.of(SLOT, requested, DATE, requested.date(),
                APPOINTMENTS, List.copyOf(conflicts)));
    }

    public static TurnOutcome invalidHours(TimeSlot requested, RuleViolation violation) {
        return new TurnOutcome(Type.INVALID_HOURS, Map.of(SLOT, requested, VIOLATION, violation));
    }

    public static TurnOutcome slotList(LocalDate date, List<TimeSlot> slots) {
        return new TurnOutcome(Type.SLOT_LIST, Map.of(DATE, date, SLOTS, List.copyOf(slots)));
    }

    public static TurnOutcome slotReprompt(LocalDate date, List<TimeSlot> slots) {
        return new TurnOutcome(Type.SLOT_REPROMPT, Map.of(DATE, date, SLOTS, List.copyOf(slots)));
    }

    /** {@code violation} is null when the day is open but fully booked. */
    public static TurnOutcome noSlots(LocalDate date, RuleViolation violation) {
        Map<String, Object> p = new HashMap<>();
        p.put(DATE, date);
        if (violation != null) {
            p.put(VIOLATION, violation);
        }
        return new TurnOutcome(Type.NO_SLOTS, p);
    }

    public static TurnOutcome list(List<Appointment> appointments, LocalDate date) {
        Map<String, Object> p = new HashMap<>();
        p.put(APPOINTMENTS, List.copyOf(appointments));
        if (date != null) {
            p.put(DATE, date);
        }
        return new TurnOutcome(Type.LIST, p);
    }

    public static TurnOutcome ambiguous(String reference, List<Appointment> appointments) {
        Map<String, Object> p = new HashMap<>();
        p.put(APPOINTMENTS, List.copyOf(appointments));
        if (reference != null) {
            p.put(REFERENCE, reference);
        }
        return new TurnOutcome(Type.AMBIGUOUS_MATCH, p);
    }

    public static TurnOutcome clarify(boolean missingDateTime) {
        return new TurnOutcome(Type.CLARIFY, Map.of(MISSING_DATE_TIME, missingDateTime));
    }

    @Override
    public String toString() {
        return "TurnOutcome{" + type + ", " + payload.keySet() + "}";
    }
}
