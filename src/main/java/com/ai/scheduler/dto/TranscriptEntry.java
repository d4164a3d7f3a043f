package com.ai.scheduler.dto;

/**
 * One line of a conversation. {@code outcome} is null for user lines.
 */
public record TranscriptEntry(String sender, String content, TurnOutcome.Type outcome) {

    public static final String USER = "User";
    public static final String ASSISTANT = "Assistant";

    public static TranscriptEntry user(String content) {
        return new TranscriptEntry(USER, content, null);
    }

    public static TranscriptEntry assistant(String content, TurnOutcome.Type outcome) {
        return new TranscriptEntry(ASSISTANT, content, outcome);
    }
}
