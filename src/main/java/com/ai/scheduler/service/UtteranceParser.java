package com.ai.scheduler.service;

import com.ai.scheduler.conversation.Intent;
import com.ai.scheduler.conversation.ParsedRequest;
import com.ai.scheduler.conversation.YesNoResult;
import com.ai.scheduler.dto.ExtractedFields;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one utterance into a {@link ParsedRequest}. Never throws: anything it cannot make sense of
 * comes back as {@link Intent#UNKNOWN} or {@link Intent#OUT_OF_SCOPE}.
 */
@Service
public class UtteranceParser {

    private static final Logger log = LoggerFactory.getLogger(UtteranceParser.class);

    private static final String DEFAULT_TITLE = "appointment";

    private static final Pattern CANCEL_VERB = Pattern.compile("\\b(cancel|remove|delete|call off)\\b");
    private static final Pattern RESCHEDULE_VERB = Pattern.compile(
            "\\b(reschedule|re-schedule|rebook|re-book|postpone|push back|move|change|shift|push)\\b");
    private static final Pattern TO = Pattern.compile("\\bto\\b");
    private static final Pattern FOR_PHRASE = Pattern.compile("\\bfor\\s+(?:a\\s+|an\\s+|my\\s+|the\\s+)?([a-z][a-z ]*)");

    private static final Set<String> LEADING_SKIP = Set.of(
            "me", "us", "a", "an", "the", "my", "our", "new", "in", "up", "another", "this", "that", "some");

    private static final Set<String> LEADING_DATE_WORDS = Set.of(
            "today", "tomorrow", "tonight", "next", "monday", "tuesday", "wednesday", "thursday", "friday",
            "saturday", "sunday");

    private static final Set<String> STOP_WORDS = Set.of(
            "for", "on", "at", "to", "with", "from", "by", "in", "around", "about", "between", "please",
            "tomorrow", "today", "tonight", "next", "this", "day", "after", "and", "that", "which", "if", "so",
            "noon", "midnight", "morning", "afternoon", "evening", "instead", "then", "i", "we", "is", "it's",
            "monday", "tuesday", "tues", "wednesday", "weds", "thursday", "thurs", "friday", "saturday", "sunday",
            "january", "february", "march", "april", "may", "june", "july", "august", "september",
            "october", "november", "december", "jan", "feb", "mar", "apr", "jun", "jul", "aug", "sep",
            "sept", "oct", "nov", "dec", "am", "pm", "lasting", "until", "till");

    /** Words that may surround a time when picking a slot ("how about 2pm", "let's do 10am please"). */
    private static final Set<String> SLOT_CHOICE_FILLER = Set.of(
            "at", "around", "how", "about", "what", "let's", "lets", "do", "please", "ok", "okay", "then",
            "instead", "maybe", "make", "it", "try", "go", "with", "the", "one", "that", "works", "i'll",
            "take", "can", "we", "say", "fine", "sure", "is", "for", "a", "an", "half", "and", "minutes",
            "minute", "mins", "min", "hour", "hours", "hr", "hrs", "o'clock", "oclock", "thanks");

    private static final Set<String> GENERIC_TITLES = Set.of(
            "slot", "time", "something", "one", "it", "spot", "session", "appointment", "appointments");

    private static final Set<String> GENERIC_REFERENCES = Set.of(
            "appointment", "appointments", "booking", "bookings", "event", "it", "one", "reservation", "that");

    private static final Map<String, String> KNOWN_TITLES = Map.of(
            "dentist", "dentist appointment",
            "doctor", "doctor visit",
            "haircut", "haircut",
            "interview", "interview",
            "consultation", "consultation",
            "checkup", "checkup",
            "meeting", "meeting",
            "call", "call");

    private static final List<String> KNOWN_TITLE_ORDER = List.of(
            "dentist", "doctor", "haircut", "interview", "consultation", "checkup", "meeting", "call");

    private final IntentClassifier intentClassifier;
    private final YesNoClassifier yesNoClassifier;
    private final DateTimeExtractor extractor;
    private final ExternalParser externalParser;

    public UtteranceParser(IntentClassifier intentClassifier, YesNoClassifier yesNoClassifier,
                           DateTimeExtractor extractor, ExternalParser externalParser) {
        this.intentClassifier = intentClassifier;
        this.yesNoClassifier = yesNoClassifier;
        this.extractor = extractor;
        this.externalParser = externalParser;
    }

    /**
     * @param pending whether the session is waiting for a confirmation or a slot choice
     */
    public ParsedRequest parse(String text, LocalDateTime referenceNow, boolean pending) {
        if (StringUtils.isBlank(text)) {
            return ParsedRequest.of(Intent.UNKNOWN);
        }
        try {
            return doParse(text, referenceNow, pending);
        } catch (RuntimeException e) {
            log.warn("Could not parse utterance '{}'", text, e);
            return ParsedRequest.of(Intent.UNKNOWN);
        }
    }

    private ParsedRequest doParse(String text, LocalDateTime referenceNow, boolean pending) {
        String normalized = StringUtils.normalizeSpace(text.toLowerCase().replace('’', '\''));
        LocalDate today = referenceNow.toLocalDate();

        // without a pending decision a bare "cancel" is a cancellation request, not a "no"
        YesNoResult yesNo = !pending && intentClassifier.isCancel(normalized)
                ? YesNoResult.UNKNOWN
                : yesNoClassifier.classify(normalized);
        if (yesNo == YesNoResult.YES) {
            return ParsedRequest.of(Intent.CONFIRM_YES);
        }
        if (yesNo == YesNoResult.NO) {
            return ParsedRequest.of(Intent.CONFIRM_NO);
        }

        if (extractor.exceedsMaxDuration(normalized)) {
            log.debug("Duration in '{}' is longer than a day, asking again", normalized);
            return ParsedRequest.of(Intent.UNKNOWN);
        }

        Optional<LocalDate> date = extractor.extractDate(normalized, today);
        Optional<LocalTime> time = extractor.extractTime(normalized);
        Integer duration = extractor.extractDuration(normalized);

        if (pending && time.isPresent() && date.isEmpty() && isBareTime(normalized)) {
            return ParsedRequest.builder()
                    .intent(Intent.SLOT_CHOICE)
                    .time(time.get())
                    .durationMinutes(duration)
                    .build();
        }

        Intent triage = intentClassifier.classify(normalized, date.isPresent() || time.isPresent());
        switch (triage) {
            case RESCHEDULE:
                return parseReschedule(normalized, today);
            case CANCEL:
                return parseCancel(normalized, date.orElse(null), time.orElse(null));
            case LIST:
                return ParsedRequest.builder().intent(Intent.LIST).date(date.orElse(null)).build();
            case CREATE:
                return parseCreate(text, normalized, referenceNow, date.orElse(null), time.orElse(null), duration);
            default:
                return ParsedRequest.of(triage);
        }
    }

    private ParsedRequest parseCreate(String original, String normalized, LocalDateTime referenceNow,
                                      LocalDate date, LocalTime time, Integer duration) {
        Optional<ExtractedFields> external = extractExternally(original, referenceNow);
        if (external.isPresent() && external.get().isComplete()) {
            ExtractedFields fields = external.get();
            log.debug("Using external extraction: {}", fields);
            return ParsedRequest.builder()
                    .intent(Intent.CREATE)
                    .title(fields.title())
                    .date(fields.date())
                    .time(fields.time())
                    .durationMinutes(fields.durationMinutes())
                    .source(ParsedRequest.Source.EXTERNAL)
                    .build();
        }

        String title = extractTitle(normalized);
        if (time != null) {
            return ParsedRequest.builder()
                    .intent(Intent.CREATE)
                    .date(date != null ? date : referenceNow.toLocalDate())
                    .time(time)
                    .durationMinutes(duration)
                    .title(title)
                    .build();
        }
        if (date != null) {
            return ParsedRequest.builder()
                    .intent(Intent.DATE_ONLY_CREATE)
                    .date(date)
                    .durationMinutes(duration)
                    .title(title)
                    .build();
        }
        return ParsedRequest.builder().intent(Intent.UNKNOWN).title(title).durationMinutes(duration).build();
    }

    private Optional<ExtractedFields> extractExternally(String text, LocalDateTime referenceNow) {
        try {
            return externalParser.extract(text, referenceNow);
        } catch (RuntimeException e) {
            log.warn("External parser failed, using rules", e);
            return Optional.empty();
        }
    }

    private ParsedRequest parseCancel(String normalized, LocalDate date, LocalTime time) {
        Matcher verb = CANCEL_VERB.matcher(normalized);
        String reference = verb.find() ? reference(normalized.substring(verb.end())) : null;
        return ParsedRequest.builder()
                .intent(Intent.CANCEL)
                .reference(reference)
                .referenceDate(date)
                .time(time)
                .build();
    }

    /**
     * The first "to" after the verb splits the utterance: before it names the appointment,
     * after it names the new date and time.
     */
    private ParsedRequest parseReschedule(String normalized, LocalDate today) {
        Matcher verb = RESCHEDULE_VERB.matcher(normalized);
        int verbEnd = verb.find() ? verb.end() : 0;
        String afterVerb = normalized.substring(verbEnd);
        Matcher to = TO.matcher(afterVerb);
        String referencePart;
        String targetPart;
        LocalDate referenceDate = null;
        if (to.find()) {
            referencePart = afterVerb.substring(0, to.start());
            targetPart = afterVerb.substring(to.end());
            referenceDate = extractor.extractDate(referencePart, today).orElse(null);
        } else {
            referencePart = afterVerb;
            targetPart = afterVerb;
        }
        return ParsedRequest.builder()
                .intent(Intent.RESCHEDULE)
                .reference(reference(referencePart))
                .referenceDate(referenceDate)
                .date(extractor.extractDate(targetPart, today).orElse(null))
                .time(extractor.extractTime(targetPart).orElse(null))
                .durationMinutes(extractor.extractDuration(targetPart))
                .build();
    }

    /**
     * A time with nothing but filler around it. Any other word ("book", a title noun) makes it a new request.
     */
    private boolean isBareTime(String normalized) {
        if (IntentClassifier.BOOKING_VERB.matcher(normalized).find()) {
            return false;
        }
        String rest = extractor.stripTimes(normalized).replaceAll("[.!?,]", " ").trim();
        if (rest.isEmpty()) {
            return true;
        }
        for (String word : rest.split("\\s+")) {
            if (!SLOT_CHOICE_FILLER.contains(word) && !word.chars().allMatch(Character::isDigit)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Words after a booking verb up to the first preposition or date word:
     * "book a dentist appointment for tomorrow" gives "dentist appointment".
     */
    String extractTitle(String normalized) {
        Matcher verb = IntentClassifier.BOOKING_VERB.matcher(normalized);
        String title = null;
        if (verb.find()) {
            title = phraseAfter(normalized.substring(verb.end()));
        }
        if (title == null || GENERIC_TITLES.contains(title)) {
            Matcher forPhrase = FOR_PHRASE.matcher(normalized);
            while (forPhrase.find()) {
                String candidate = phraseAfter(forPhrase.group(1));
                if (candidate != null && !GENERIC_TITLES.contains(candidate)) {
                    return candidate;
                }
            }
        }
        if (title != null && !GENERIC_TITLES.contains(title)) {
            return title;
        }
        for (String noun : KNOWN_TITLE_ORDER) {
            if (Pattern.compile("\\b" + noun + "\\b").matcher(normalized).find()) {
                return KNOWN_TITLES.get(noun);
            }
        }
        return DEFAULT_TITLE;
    }

    private static String reference(String segment) {
        String phrase = phraseAfter(segment);
        if (phrase == null || GENERIC_REFERENCES.contains(phrase)) {
            return null;
        }
        return phrase;
    }

    private static String phraseAfter(String segment) {
        String[] tokens = segment.replaceAll("[.!?,;:]", " ").trim().split("\\s+");
        List<String> words = new ArrayList<>();
        boolean leading = true;
        for (String raw : tokens) {
            if (raw.isEmpty()) {
                continue;
            }
            String token = raw.endsWith("'s") ? raw.substring(0, raw.length() - 2) : raw;
            if (leading && (LEADING_SKIP.contains(token) || LEADING_DATE_WORDS.contains(token))) {
                continue;
            }
            leading = false;
            if (STOP_WORDS.contains(token) || token.chars().anyMatch(Character::isDigit)) {
                break;
            }
            words.add(token);
        }
        return words.isEmpty() ? null : String.join(" ", words);
    }
}
