package com.ai.scheduler.service;

import com.ai.scheduler.dto.ExtractedFields;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Optional structured extraction backed by a language model. Implementations never throw;
 * an empty result means "use the rule-based parser".
 */
public interface ExternalParser {

    Optional<ExtractedFields> extract(String text, LocalDateTime referenceNow);

    static ExternalParser disabled() {
        return (text, referenceNow) -> Optional.empty();
    }
}
