package com.ai.scheduler.service;

import com.ai.scheduler.conversation.Intent;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword triage of a lower-cased utterance. Returns {@link Intent#CREATE} for anything
 * booking-shaped; {@link UtteranceParser} refines that using the extracted date and time.
 * Reschedule takes precedence over cancel, and both over list, unless a booking verb comes first.
 */
@Service
public class IntentClassifier {

    private static final Set<String> GREETINGS = Set.of(
            "hi", "hello", "hey", "hi there", "hello there", "hey there", "good morning",
            "good afternoon", "good evening", "greetings", "howdy", "yo", "morning", "hiya"
    );

    private static final Pattern GREETING_WORD = Pattern.compile("\\b(hi|hello|hey)\\b");

    private static final Pattern SMALLTALK = Pattern.compile(
            "\\b(how are you|how're you|how are things|how's it going|how is it going|how do you do"
                    + "|what's up|whats up|thank you|thanks|thx|cheers|who are you|what can you do"
                    + "|nice to meet you|goodbye|bye)\\b");

    private static final Pattern RESCHEDULE_STRONG = Pattern.compile(
            "\\b(reschedule|re-schedule|rebook|re-book|postpone|push back)\\b");

    private static final Pattern RESCHEDULE_WEAK = Pattern.compile("\\b(move|change|shift|push)\\b");

    private static final Pattern RESCHEDULE_ANY = Pattern.compile(
            RESCHEDULE_STRONG.pattern() + "|" + RESCHEDULE_WEAK.pattern());

    private static final Pattern RESCHEDULE_TARGET = Pattern.compile(
            "\\b(to|at)\\b|\\b(appointments?|meetings?|booking|call|visit)\\b");

    private static final Pattern CANCEL = Pattern.compile("\\b(cancel|remove|delete|call off)\\b");

    private static final Pattern LIST = Pattern.compile(
            "\\b(list|show|view|see|display|check|tell me)\\b.*\\b(appointments?|schedule|calendar|meetings|bookings?|booked)\\b"
                    + "|\\bwhat(?:'s| is| do i have| have i got)\\b.*\\b(booked|scheduled|on my (?:calendar|schedule))\\b"
                    + "|\\bwhat do i have\\b|\\bdo i have any\\b"
                    + "|^(?:my )?(appointments|meetings|schedule|calendar|bookings)$");

    private static final Pattern OUT_OF_SCOPE_TOPIC = Pattern.compile(
            "\\b(weather|joke|jokes|news|sports?|football|recipe|movies?|music|songs?|games?|stocks?"
                    + "|capital of|president|translate|poem)\\b");

    static final Pattern BOOKING_VERB = Pattern.compile(
            "\\b(book|schedule|set up|setup|reserve|add|arrange|plan|organi[sz]e|put)\\b");

    private static final Pattern BOOKING_NOUN = Pattern.compile(
            "\\b(appointments?|meetings?|slots?|availability|available|free|openings?|calendar|visit|consultation)\\b");

    /**
     * @param text            lower-cased, trimmed utterance
     * @param hasDateOrTime   whether a date or time token was found
     */
    public Intent classify(String text, boolean hasDateOrTime) {
        if (StringUtils.isBlank(text)) {
            return Intent.UNKNOWN;
        }
        String bare = StringUtils.normalizeSpace(text.replaceAll("[.!?,]", " "));
        if (GREETINGS.contains(bare)
                || (text.length() <= 25 && (text.endsWith("!") || text.endsWith("?"))
                && GREETING_WORD.matcher(text).find() && !isBookingShaped(text, hasDateOrTime))) {
            return Intent.GREETING;
        }
        boolean bookingShaped = isBookingShaped(text, hasDateOrTime);
        if (SMALLTALK.matcher(text).find() && !bookingShaped) {
            return Intent.SMALLTALK;
        }
        if (isReschedule(text)) {
            return Intent.RESCHEDULE;
        }
        if (isCancel(text)) {
            return Intent.CANCEL;
        }
        if (LIST.matcher(bare).find()) {
            return Intent.LIST;
        }
        if (OUT_OF_SCOPE_TOPIC.matcher(text).find() && !BOOKING_VERB.matcher(text).find()) {
            return Intent.OUT_OF_SCOPE;
        }
        if (bookingShaped) {
            return Intent.CREATE;
        }
        return Intent.OUT_OF_SCOPE;
    }

    public boolean isReschedule(String text) {
        boolean matched = RESCHEDULE_STRONG.matcher(text).find()
                || (RESCHEDULE_WEAK.matcher(text).find() && RESCHEDULE_TARGET.matcher(text).find());
        return matched && !bookingVerbFirst(text, RESCHEDULE_ANY);
    }

    public boolean isCancel(String text) {
        return CANCEL.matcher(text).find() && !bookingVerbFirst(text, CANCEL);
    }

    public boolean isList(String text) {
        return LIST.matcher(StringUtils.normalizeSpace(text.replaceAll("[.!?,]", " "))).find();
    }

    /**
     * "book a call to change my password": the booking verb leads, so the later verb is part of the title.
     */
    private static boolean bookingVerbFirst(String text, Pattern other) {
        Matcher booking = BOOKING_VERB.matcher(text);
        Matcher competing = other.matcher(text);
        return booking.find() && competing.find() && booking.start() < competing.start();
    }

    private static boolean isBookingShaped(String text, boolean hasDateOrTime) {
        return hasDateOrTime || BOOKING_VERB.matcher(text).find() || BOOKING_NOUN.matcher(text).find();
    }
}
