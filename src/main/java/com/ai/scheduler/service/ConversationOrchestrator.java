package com.ai.scheduler.service;

import com.ai.scheduler.component.SessionRegistry;
import com.ai.scheduler.config.BusinessRules;
import com.ai.scheduler.conversation.ConversationState;
import com.ai.scheduler.conversation.ParsedRequest;
import com.ai.scheduler.conversation.SchedulingSession;
import com.ai.scheduler.dto.TranscriptEntry;
import com.ai.scheduler.dto.TurnOutcome;
import com.ai.scheduler.dto.TurnResult;
import com.ai.scheduler.entity.Appointment;
import com.ai.scheduler.entity.BusinessHoursCheck;
import com.ai.scheduler.entity.RuleViolation;
import com.ai.scheduler.entity.TimeSlot;
import com.ai.scheduler.repository.CalendarStore;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single entry for a conversation turn: parses the utterance, applies it to the session's calendar
 * and pending state, and renders the reply. Booking decisions are always made here, never by the
 * external parser.
 */
@Service
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    private final SessionRegistry sessions;
    private final UtteranceParser parser;
    private final ConflictResolver conflictResolver;
    private final AppointmentMatcher matcher;
    private final ResponseFormatter formatter;
    private final BusinessRules rules;
    private final Clock clock;

    public ConversationOrchestrator(SessionRegistry sessions,
                                    UtteranceParser parser,
                                    ConflictResolver conflictResolver,
                                    AppointmentMatcher matcher,
                                    ResponseFormatter formatter,
                                    BusinessRules rules,
                                    Clock clock) {
        this.sessions = sessions;
        this.parser = parser;
        this.conflictResolver = conflictResolver;
        this.matcher = matcher;
        this.formatter = formatter;
        this.rules = rules;
        this.clock = clock;
    }

    public TurnResult handleTurn(String sessionId, String text) {
        return handleTurn(sessions.getOrCreate(sessionId), text);
    }

    /**
     * Processes one utterance. Turns of the same session are serialised on the session.
     */
    public TurnResult handleTurn(SchedulingSession session, String text) {
        synchronized (session) {
            ConversationState before = session.getState();
            ParsedRequest request = parser.parse(text, LocalDateTime.now(clock), before.hasPending());

            Step step;
            try {
                step = dispatch(session, before, request);
            } catch (RuntimeException e) {
                log.error("[{}] turn failed for '{}'", session.getId(), text, e);
                step = new Step(TurnOutcome.clarify(false), before);
            }

            session.setState(step.state());
            String reply = formatter.format(step.outcome());
            List<TranscriptEntry> entries = List.of(
                    TranscriptEntry.user(StringUtils.defaultString(text)),
                    TranscriptEntry.assistant(reply, step.outcome().getType()));
            session.append(entries);
            logFlow(session.getId(), request, step);
            return new TurnResult(session.getId(), entries, step.state(), step.outcome());
        }
    }

    private Step dispatch(SchedulingSession session, ConversationState state, ParsedRequest request) {
        CalendarStore store = session.getCalendar();
        switch (request.getIntent()) {
            case GREETING:
                return new Step(TurnOutcome.of(TurnOutcome.Type.GREETING), state);
            case SMALLTALK:
                return new Step(TurnOutcome.of(TurnOutcome.Type.SMALLTALK), state);
            case OUT_OF_SCOPE:
                return new Step(TurnOutcome.of(TurnOutcome.Type.OUT_OF_SCOPE), state);
            case UNKNOWN:
                return new Step(TurnOutcome.clarify(request.getTitle() != null), state);
            case LIST: {
                List<Appointment> appointments = request.getDate() != null
                        ? store.listOn(request.getDate())
                        : store.listAll();
                return new Step(TurnOutcome.list(appointments, request.getDate()), state);
            }
            case CREATE:
                return create(session, title(request), request.getDate(), request.getTime(),
                        duration(request.getDurationMinutes(), rules.getDefaultDurationMinutes()), null);
            case DATE_ONLY_CREATE:
                return offerSlots(store, request.getDate(),
                        duration(request.getDurationMinutes(), rules.getDefaultDurationMinutes()),
                        title(request), null);
            case CONFIRM_YES:
                return confirmYes(session, state);
            case CONFIRM_NO:
                if (state.isIdle()) {
                    return new Step(TurnOutcome.of(TurnOutcome.Type.NOTHING_PENDING), state);
                }
                return new Step(TurnOutcome.of(TurnOutcome.Type.DECLINED), ConversationState.idle());
            case SLOT_CHOICE:
                return slotChoice(session, state, request);
            case RESCHEDULE:
                return reschedule(session, request);
            case CANCEL:
                return cancel(session, request);
            default:
                return new Step(TurnOutcome.clarify(false), state);
        }
    }

    private Step create(SchedulingSession session, String title, LocalDate date, LocalTime time,
                        int duration, Long replacesId) {
        CalendarStore store = session.getCalendar();
        TimeSlot slot = TimeSlot.of(date, time, duration);
        BusinessHoursCheck check = store.checkBusinessHours(slot);
        if (!check.valid()) {
            return new Step(TurnOutcome.invalidHours(slot, check.violation()), ConversationState.idle());
        }
        List<Appointment> conflicts = store.findConflicts(slot, replacesId);
        if (conflicts.isEmpty()) {
            return new Step(commit(session, title, slot, replacesId, TurnOutcome.Type.BOOKED), ConversationState.idle());
        }
        Optional<TimeSlot> offer = conflictResolver.suggestNextFreeSlot(store, slot, replacesId);
        if (offer.isPresent()) {
            return new Step(TurnOutcome.conflictOffer(title, slot, conflicts, offer.get()),
                    ConversationState.awaitingConfirmation(title, offer.get(), replacesId));
        }
        return new Step(TurnOutcome.noAlternative(slot, conflicts), ConversationState.idle());
    }

    private Step offerSlots(CalendarStore store, LocalDate date, int duration, String title, Long replacesId) {
        List<TimeSlot> slots = store.getAvailableSlots(date, duration, replacesId);
        if (slots.isEmpty()) {
            return new Step(TurnOutcome.noSlots(date, closedReason(date)), ConversationState.idle());
        }
        return new Step(TurnOutcome.slotList(date, slots),
                ConversationState.awaitingSlotChoice(date, duration, title, slots, replacesId));
    }

    private Step confirmYes(SchedulingSession session, ConversationState state) {
        switch (state.getPhase()) {
            case AWAITING_CONFIRMATION: {
                TimeSlot slot = state.getProposedSlot();
                if (!isStillFree(session.getCalendar(), slot, state.getReplacesAppointmentId())) {
                    return new Step(TurnOutcome.of(TurnOutcome.Type.SLOT_TAKEN), ConversationState.idle());
                }
                TurnOutcome outcome = commit(session, state.getTitle(), slot, state.getReplacesAppointmentId(),
                        TurnOutcome.Type.CONFIRMED);
                return new Step(outcome, ConversationState.idle());
            }
            case AWAITING_SLOT_CHOICE:
                return new Step(TurnOutcome.slotReprompt(state.getDate(), state.getOfferedSlots()), state);
            default:
                return new Step(TurnOutcome.of(TurnOutcome.Type.NOTHING_PENDING), state);
        }
    }

    private Step slotChoice(SchedulingSession session, ConversationState state, ParsedRequest request) {
        switch (state.getPhase()) {
            case AWAITING_SLOT_CHOICE: {
                Optional<TimeSlot> chosen = state.getOfferedSlots().stream()
                        .filter(s -> s.start().toLocalTime().equals(request.getTime()))
                        .findFirst();
                if (chosen.isEmpty()) {
                    return new Step(TurnOutcome.slotReprompt(state.getDate(), state.getOfferedSlots()), state);
                }
                if (!isStillFree(session.getCalendar(), chosen.get(), state.getReplacesAppointmentId())) {
                    return new Step(TurnOutcome.of(TurnOutcome.Type.SLOT_TAKEN), ConversationState.idle());
                }
                TurnOutcome outcome = commit(session, state.getTitle(), chosen.get(),
                        state.getReplacesAppointmentId(), TurnOutcome.Type.BOOKED);
                return new Step(outcome, ConversationState.idle());
            }
            case AWAITING_CONFIRMATION:
                // a different time instead of yes/no: try it on the same day
                return create(session, state.getTitle(), state.getDate(), request.getTime(),
                        duration(request.getDurationMinutes(), state.getDurationMinutes()),
                        state.getReplacesAppointmentId());
            default:
                return new Step(TurnOutcome.clarify(false), state);
        }
    }

    private Step reschedule(SchedulingSession session, ParsedRequest request) {
        CalendarStore store = session.getCalendar();
        if (store.size() == 0) {
            return new Step(TurnOutcome.of(TurnOutcome.Type.NOT_FOUND), ConversationState.idle());
        }
        List<Appointment> matches = matcher.match(store, request.getReference(), request.getReferenceDate(), null);
        if (matches.size() != 1) {
            return new Step(ambiguous(store, request.getReference(), matches), ConversationState.idle());
        }
        Appointment target = matches.get(0);
        int duration = duration(request.getDurationMinutes(), target.getDurationMinutes());
        if (request.getTime() == null) {
            if (request.getDate() != null) {
                return offerSlots(store, request.getDate(), duration, target.getTitle(), target.getId());
            }
            return new Step(TurnOutcome.of(TurnOutcome.Type.NEED_NEW_TIME,
                    Map.of(TurnOutcome.TITLE, target.getTitle())), ConversationState.idle());
        }
        LocalDate date = request.getDate() != null ? request.getDate() : target.getStart().toLocalDate();
        return create(session, target.getTitle(), date, request.getTime(), duration, target.getId());
    }

    private Step cancel(SchedulingSession session, ParsedRequest request) {
        CalendarStore store = session.getCalendar();
        if (store.size() == 0) {
            return new Step(TurnOutcome.of(TurnOutcome.Type.NOT_FOUND), ConversationState.idle());
        }
        if (request.getReference() == null && request.getReferenceDate() == null && request.getTime() == null) {
            // "cancel it" names nothing; removal needs a title, day or time
            return new Step(TurnOutcome.ambiguous(null, store.listAll()), ConversationState.idle());
        }
        List<Appointment> matches = matcher.match(store, request.getReference(), request.getReferenceDate(),
                request.getTime());
        if (matches.size() != 1) {
            return new Step(ambiguous(store, request.getReference(), matches), ConversationState.idle());
        }
        Appointment target = matches.get(0);
        store.remove(target.getId());
        log.info("[{}] cancelled appointment id={} '{}'", session.getId(), target.getId(), target.getTitle());
        return new Step(TurnOutcome.cancelled(target), ConversationState.idle());
    }

    /**
     * Adds the appointment and, for a reschedule, removes the one it replaces. Callers have already
     * checked hours and conflicts, so the old appointment is only removed once the new one is certain.
     */
    private TurnOutcome commit(SchedulingSession session, String title, TimeSlot slot, Long replacesId,
                               TurnOutcome.Type bookedType) {
        CalendarStore store = session.getCalendar();
        Optional<Appointment> previous = replacesId == null ? Optional.empty() : store.findById(replacesId);
        previous.ifPresent(p -> store.remove(p.getId()));
        Appointment appointment = store.add(title, slot);
        if (previous.isPresent()) {
            log.info("[{}] rescheduled '{}' from {} to {}", session.getId(), title,
                    previous.get().getStart(), slot.start());
            return TurnOutcome.rescheduled(previous.get(), appointment);
        }
        log.info("[{}] booked '{}' at {}", session.getId(), title, slot.start());
        return bookedType == TurnOutcome.Type.CONFIRMED
                ? TurnOutcome.confirmed(appointment)
                : TurnOutcome.booked(appointment);
    }

    private boolean isStillFree(CalendarStore store, TimeSlot slot, Long ignoreId) {
        return store.checkBusinessHours(slot).valid() && store.findConflicts(slot, ignoreId).isEmpty();
    }

    private static TurnOutcome ambiguous(CalendarStore store, String reference, List<Appointment> matches) {
        return TurnOutcome.ambiguous(reference, matches.size() > 1 ? matches : store.listAll());
    }

    private RuleViolation closedReason(LocalDate date) {
        if (!rules.isWorkingDay(date)) {
            return RuleViolation.WEEKEND;
        }
        if (rules.isHoliday(date)) {
            return RuleViolation.HOLIDAY;
        }
        return null;
    }

    private static String title(ParsedRequest request) {
        return StringUtils.isBlank(request.getTitle()) ? "appointment" : request.getTitle();
    }

    private static int duration(Integer requested, int fallback) {
        return requested != null && requested > 0 ? requested : fallback;
    }

    private void logFlow(String sessionId, ParsedRequest request, Step step) {
        log.debug("[{}] intent={} source={} outcome={} state={}", sessionId, request.getIntent(),
                request.getSource(), step.outcome().getType(), step.state().getPhase());
    }

    private record Step(TurnOutcome outcome, ConversationState state) {
    }
}
