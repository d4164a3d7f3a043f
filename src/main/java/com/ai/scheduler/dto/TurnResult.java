package com.ai.scheduler.dto;

import com.ai.scheduler.conversation.ConversationState;

import java.util.List;
import java.util.stream.Collectors;

/**
 * What one call to {@code handleTurn} produced: the new transcript lines and the state after the turn.
 */
public record TurnResult(String sessionId, List<TranscriptEntry> transcript, ConversationState state,
                         TurnOutcome outcome) {

    public List<String> replies() {
        return transcript.stream()
                .filter(e -> TranscriptEntry.ASSISTANT.equals(e.sender()))
                .map(TranscriptEntry::content)
                .collect(Collectors.toList());
    }
}
