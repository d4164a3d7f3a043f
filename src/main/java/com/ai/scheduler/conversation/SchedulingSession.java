package com.ai.scheduler.conversation;

import com.ai.scheduler.dto.TranscriptEntry;
import com.ai.scheduler.repository.CalendarStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One conversation: its own calendar, pending state and transcript.
 * Callers lock on the session while a turn is processed.
 */
public class SchedulingSession {

    private final String id;
    private final CalendarStore calendar;
    private final List<TranscriptEntry> transcript = new ArrayList<>();
    private ConversationState state = ConversationState.idle();

    public SchedulingSession(String id, CalendarStore calendar) {
        this.id = id;
        this.calendar = calendar;
    }

    public String getId() {
        return id;
    }

    public CalendarStore getCalendar() {
        return calendar;
    }

    public ConversationState getState() {
        return state;
    }

    public void setState(ConversationState state) {
        this.state = state == null ? ConversationState.idle() : state;
    }

    public void append(List<TranscriptEntry> entries) {
        transcript.addAll(entries);
    }

    public List<TranscriptEntry> getTranscript() {
        return Collections.unmodifiableList(transcript);
    }
}
