package com.ai.scheduler.service;

import com.ai.scheduler.conversation.YesNoResult;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Recognises a bare yes or no. Only short replies count; "no, book friday at 2pm instead"
 * is a new request, not an answer.
 */
@Service
public class YesNoClassifier {

    private static final int MAX_BARE_LENGTH = 25;

    private static final Set<String> AFFIRMATIVE_EXACT = Set.of(
            "yes", "y", "yeah", "yep", "yup", "ya", "ok", "okay", "sure", "confirm", "confirmed",
            "correct", "right", "absolutely", "definitely", "of course", "go ahead", "do it",
            "book it", "sounds good", "that works", "works for me", "perfect", "please do",
            "yes please", "yes book it", "ok book it", "sure thing", "alright", "fine"
    );

    private static final Set<String> NEGATIVE_EXACT = Set.of(
            "no", "n", "nope", "nah", "no thanks", "no thank you", "not really", "never mind",
            "nevermind", "cancel it", "cancel", "don't", "dont", "don't book it", "not now",
            "no way", "forget it", "skip it", "no please"
    );

    private static final Pattern FILLER = Pattern.compile("\\b(please|thanks|thank you)\\b$");

    public YesNoResult classify(String userInput) {
        if (StringUtils.isBlank(userInput)) {
            return YesNoResult.UNKNOWN;
        }
        String normalized = normalize(userInput);
        if (normalized.isEmpty() || normalized.length() > MAX_BARE_LENGTH) {
            return YesNoResult.UNKNOWN;
        }
        YesNoResult exact = exact(normalized);
        if (exact != YesNoResult.UNKNOWN) {
            return exact;
        }
        String withoutFiller = FILLER.matcher(normalized).replaceAll("").trim();
        return withoutFiller.equals(normalized) ? YesNoResult.UNKNOWN : exact(withoutFiller);
    }

    private static YesNoResult exact(String normalized) {
        if (AFFIRMATIVE_EXACT.contains(normalized)) {
            return YesNoResult.YES;
        }
        if (NEGATIVE_EXACT.contains(normalized)) {
            return YesNoResult.NO;
        }
        return YesNoResult.UNKNOWN;
    }

    private static String normalize(String text) {
        return StringUtils.normalizeSpace(text.toLowerCase().replaceAll("[.!?,]", " ").replace('’', '\''));
    }
}
