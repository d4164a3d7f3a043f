package com.ai.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * JSON body returned for a conversation turn.
 */
@Getter
@Builder
@AllArgsConstructor
public class TurnResponse {

    private final String sessionId;
    private final List<String> replies;
    private final List<TranscriptEntry> transcript;
    /** Name of the pending phase, e.g. AWAITING_CONFIRMATION. */
    private final String pending;
    private final List<AppointmentView> appointments;
}
