package com.ai.scheduler.conversation;

import com.ai.scheduler.entity.TimeSlot;

import java.time.LocalDate;
import java.util.List;

/**
 * The single pending decision of a session. Immutable; transitions build a new instance.
 */
public final class ConversationState {

    public enum Phase {
        IDLE,
        AWAITING_CONFIRMATION,
        AWAITING_SLOT_CHOICE
    }

    private static final ConversationState IDLE = new ConversationState(Phase.IDLE, null, null, null, 0, List.of(), null);

    private final Phase phase;
    private final String title;
    private final TimeSlot proposedSlot;
    private final LocalDate date;
    private final int durationMinutes;
    private final List<TimeSlot> offeredSlots;
    private final Long replacesAppointmentId;

    private ConversationState(Phase phase, String title, TimeSlot proposedSlot, LocalDate date,
                              int durationMinutes, List<TimeSlot> offeredSlots, Long replacesAppointmentId) {
        this.phase = phase;
        this.title = title;
        this.proposedSlot = proposedSlot;
        this.date = date;
        this.durationMinutes = durationMinutes;
        this.offeredSlots = List.copyOf(offeredSlots);
        this.replacesAppointmentId = replacesAppointmentId;
    }

    public static ConversationState idle() {
        return IDLE;
    }

    /**
     * An alternative slot was offered; the next yes/no decides it.
     * {@code replacesAppointmentId} is set when the offer came out of a reschedule.
     */
    public static ConversationState awaitingConfirmation(String title, TimeSlot proposedSlot, Long replacesAppointmentId) {
        return new ConversationState(Phase.AWAITING_CONFIRMATION, title, proposedSlot, proposedSlot.date(),
                proposedSlot.durationMinutes(), List.of(), replacesAppointmentId);
    }

    public static ConversationState awaitingSlotChoice(LocalDate date, int durationMinutes, String title,
                                                       List<TimeSlot> offeredSlots, Long replacesAppointmentId) {
        return new ConversationState(Phase.AWAITING_SLOT_CHOICE, title, null, date, durationMinutes,
                offeredSlots, replacesAppointmentId);
    }

    public Phase getPhase() {
        return phase;
    }

    public boolean isIdle() {
        return phase == Phase.IDLE;
    }

    public boolean hasPending() {
        return phase != Phase.IDLE;
    }

    public String getTitle() {
        return title;
    }

    public TimeSlot getProposedSlot() {
        return proposedSlot;
    }

    public LocalDate getDate() {
        return date;
    }

    public int getDurationMinutes() {
        return durationMinutes;
    }

    public List<TimeSlot> getOfferedSlots() {
        return offeredSlots;
    }

    public Long getReplacesAppointmentId() {
        return replacesAppointmentId;
    }

    @Override
    public String toString() {
        return "ConversationState{" + phase + (title != null ? ", title=" + title : "") + "}";
    }
}
