package com.ai.scheduler.conversation;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * What one utterance asks for. Every field except {@code intent} may be null.
 */
@Value
@Builder
public class ParsedRequest {

    public enum Source { RULES, EXTERNAL }

    Intent intent;
    LocalDate date;
    LocalTime time;
    Integer durationMinutes;
    String title;
    /** Phrase naming an existing appointment, for cancel and reschedule. */
    String reference;
    /** Date that narrows {@link #reference}; for reschedule this is the old date, not the target. */
    LocalDate referenceDate;
    @Builder.Default
    Source source = Source.RULES;

    public static ParsedRequest of(Intent intent) {
        return ParsedRequest.builder().intent(intent).build();
    }
}
